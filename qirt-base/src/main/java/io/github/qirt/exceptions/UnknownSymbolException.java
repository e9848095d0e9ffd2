/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.qirt.exceptions;

/**
 * Thrown when a label references a character that is not registered for any basis.
 */
public class UnknownSymbolException extends QirtException {
    private final char symbol;

    public UnknownSymbolException(char symbol) {
        super(String.format("Symbol '%s' is not registered for any basis", symbol));
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }
}
