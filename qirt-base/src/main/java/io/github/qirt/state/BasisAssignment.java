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

import io.github.qirt.notation.Basis;

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable per-qubit choice of basis; entry {@code k} applies to qubit {@code k}.
 * <p>
 * The string form lists one letter per qubit, qubit 0 first, e.g. {@code "zxy"}.
 */
public final class BasisAssignment {
    private final Basis[] bases;

    private BasisAssignment(Basis[] bases) {
        this.bases = bases;
    }

    public static BasisAssignment of(Basis... bases) {
        for (Basis b : bases) {
            Objects.requireNonNull(b, "basis");
        }
        return new BasisAssignment(bases.clone());
    }

    /**
     * Parses a basis string such as {@code "zxy"}, case-insensitively.
     *
     * @param text one letter per qubit
     * @return the assignment
     * @throws IllegalArgumentException if a character is not z, x or y
     */
    public static BasisAssignment parse(String text) {
        var bases = new Basis[text.length()];
        for (int i = 0; i < bases.length; i++) {
            bases[i] = Basis.fromLetter(text.charAt(i));
        }
        return new BasisAssignment(bases);
    }

    /**
     * @param basis the basis for every qubit
     * @param qubitCount the number of qubits
     * @return an assignment using the same basis everywhere
     */
    public static BasisAssignment uniform(Basis basis, int qubitCount) {
        var bases = new Basis[qubitCount];
        Arrays.fill(bases, Objects.requireNonNull(basis));
        return new BasisAssignment(bases);
    }

    /**
     * @param qubitCount the number of qubits
     * @return the all-Z assignment
     */
    public static BasisAssignment computational(int qubitCount) {
        return uniform(Basis.Z, qubitCount);
    }

    public int size() {
        return bases.length;
    }

    public Basis get(int qubit) {
        return bases[qubit];
    }

    /**
     * @param qubits qubit indices, in the order wanted
     * @return the assignment restricted to the given qubits, re-indexed from 0
     */
    public BasisAssignment select(int[] qubits) {
        var result = new Basis[qubits.length];
        for (int i = 0; i < qubits.length; i++) {
            result[i] = bases[qubits[i]];
        }
        return new BasisAssignment(result);
    }

    public boolean isComputational() {
        for (Basis b : bases) {
            if (b != Basis.Z) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bases, ((BasisAssignment) o).bases);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bases);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(bases.length);
        for (Basis b : bases) {
            sb.append(b.letter());
        }
        return sb.toString();
    }
}
