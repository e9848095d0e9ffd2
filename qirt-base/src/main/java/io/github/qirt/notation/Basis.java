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

package io.github.qirt.notation;

/**
 * The three single-qubit measurement bases. They are mutually unbiased: a Z eigenstate has
 * probability 1/2 for either outcome in X or Y, and so on.
 */
public enum Basis {
    /** Computational basis, eigenstates |0> and |1>. */
    Z('z'),
    /** Hadamard basis, eigenstates |+> and |->. */
    X('x'),
    /** Circular basis, eigenstates |+i> and |-i>. */
    Y('y');

    private final char letter;

    Basis(char letter) {
        this.letter = letter;
    }

    /**
     * @return the lower-case letter used for this basis in basis assignment strings
     */
    public char letter() {
        return letter;
    }

    /**
     * Parses a basis letter, case-insensitively.
     *
     * @param c one of z, x, y
     * @return the basis
     * @throws IllegalArgumentException for any other character
     */
    public static Basis fromLetter(char c) {
        switch (Character.toLowerCase(c)) {
            case 'z':
                return Z;
            case 'x':
                return X;
            case 'y':
                return Y;
            default:
                throw new IllegalArgumentException("Invalid basis '" + c + "', expected one of z, x, y");
        }
    }

    /**
     * @param bit 0 or 1
     * @return the notation key for this basis and bit, e.g. {@code x1}
     */
    public String key(int bit) {
        return String.valueOf(letter) + bit;
    }
}
