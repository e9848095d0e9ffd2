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
 * Thrown when a ket notation table or notation file is malformed: a missing or unknown key,
 * a value that is not exactly one character, or the same symbol registered twice.
 */
public class InvalidNotationException extends QirtException {
    public InvalidNotationException(String message) {
        super(message);
    }

    public InvalidNotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
