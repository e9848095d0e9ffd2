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

package io.github.qirt.state;

import io.github.qirt.exceptions.DimensionMismatchException;
import io.github.qirt.notation.Basis;

import java.util.Arrays;

/**
 * A basis assignment in which some qubits are left open ({@code *} or {@code -}) for
 * {@link BasisOptimizer} to choose. A pattern shorter than the register is padded with open
 * entries.
 */
public final class BasisPattern {
    // null marks an open entry
    private final Basis[] entries;

    private BasisPattern(Basis[] entries) {
        this.entries = entries;
    }

    /**
     * Parses a pattern such as {@code "z*x"}.
     *
     * @param text one character per qubit: z, x, y (any case), or * / - for an open entry
     * @return the pattern
     * @throws IllegalArgumentException for any other character
     */
    public static BasisPattern parse(String text) {
        var entries = new Basis[text.length()];
        for (int i = 0; i < entries.length; i++) {
            char c = text.charAt(i);
            entries[i] = (c == '*' || c == '-') ? null : Basis.fromLetter(c);
        }
        return new BasisPattern(entries);
    }

    /**
     * @param qubitCount the number of qubits
     * @return a pattern with every entry open
     */
    public static BasisPattern open(int qubitCount) {
        return new BasisPattern(new Basis[qubitCount]);
    }

    public int size() {
        return entries.length;
    }

    /**
     * @param qubitCount the register size
     * @return this pattern with open entries appended up to qubitCount
     * @throws DimensionMismatchException if the pattern is longer than qubitCount
     */
    public BasisPattern padTo(int qubitCount) {
        if (entries.length > qubitCount) {
            throw new DimensionMismatchException("Basis pattern", qubitCount, entries.length);
        }
        return new BasisPattern(Arrays.copyOf(entries, qubitCount));
    }

    /**
     * @return indices of the open entries, ascending
     */
    public int[] openQubits() {
        int count = 0;
        for (Basis e : entries) {
            if (e == null) count++;
        }
        var result = new int[count];
        int n = 0;
        for (int i = 0; i < entries.length; i++) {
            if (entries[i] == null) {
                result[n++] = i;
            }
        }
        return result;
    }

    /**
     * Fills the open entries.
     *
     * @param choices one basis per open entry, in ascending qubit order
     * @return the completed assignment
     */
    public BasisAssignment fill(Basis[] choices) {
        int open = openQubits().length;
        if (open != choices.length) {
            throw new IllegalArgumentException("expected " + open + " choices, got " + choices.length);
        }
        var result = new Basis[entries.length];
        int n = 0;
        for (int i = 0; i < entries.length; i++) {
            result[i] = entries[i] != null ? entries[i] : choices[n++];
        }
        return BasisAssignment.of(result);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(entries, ((BasisPattern) o).entries);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(entries);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(entries.length);
        for (Basis e : entries) {
            sb.append(e == null ? '*' : e.letter());
        }
        return sb.toString();
    }
}
