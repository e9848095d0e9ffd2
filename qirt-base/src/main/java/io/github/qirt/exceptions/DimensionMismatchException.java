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
 * Thrown when a label, basis assignment, bitstring or matrix does not match the qubit count
 * (or vector length) it is combined with.
 */
public class DimensionMismatchException extends QirtException {
    public DimensionMismatchException(String message) {
        super(message);
    }

    public DimensionMismatchException(String what, int expected, int actual) {
        super(String.format("%s has length %d, expected %d", what, actual, expected));
    }
}
