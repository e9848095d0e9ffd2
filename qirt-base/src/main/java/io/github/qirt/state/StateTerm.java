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

import io.github.qirt.vector.ComplexFormat;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * One non-vanishing term of a state expressed in some basis assignment: the coefficient of
 * the basis vector named by {@code symbols}. This is what a renderer consumes; it must not
 * recompute probabilities itself.
 */
public final class StateTerm implements Comparable<StateTerm> {
    /** The amplitude index of the basis vector */
    public final int index;
    /** The ket symbols naming the basis vector, qubit 0 first */
    public final String symbols;
    /** The coefficient of the basis vector */
    public final Complex coefficient;
    /** The squared magnitude of the coefficient */
    public final double probability;

    public StateTerm(int index, String symbols, Complex coefficient, double probability) {
        this.index = index;
        this.symbols = symbols;
        this.coefficient = coefficient;
        this.probability = probability;
    }

    /**
     * Most probable first. Probabilities are compared on a grid of {@link QuantumState#EPSILON}
     * so that rounding noise ties, and ties go to the lower amplitude index.
     */
    @Override
    public int compareTo(StateTerm o) {
        int probabilityCompare = Long.compare(rank(o.probability), rank(probability));
        return probabilityCompare != 0 ? probabilityCompare : Integer.compare(index, o.index);
    }

    // buckets of width EPSILON
    private static long rank(double probability) {
        return Math.round(probability / QuantumState.EPSILON);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        StateTerm that = (StateTerm) o;
        return index == that.index && symbols.equals(that.symbols) && coefficient.equals(that.coefficient);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, symbols, coefficient);
    }

    @Override
    public String toString() {
        return ComplexFormat.format(coefficient) + "|" + symbols + ">";
    }
}
