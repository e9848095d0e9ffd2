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
import io.github.qirt.exceptions.ZeroStateException;
import io.github.qirt.notation.BasisTable;
import io.github.qirt.util.MathUtil;
import io.github.qirt.util.QubitLimits;
import io.github.qirt.vector.ComplexMatrix;
import io.github.qirt.vector.ComplexVector;
import io.github.qirt.vector.ComplexVectorUtil;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable, normalized pure state of n qubits.
 * <p>
 * Amplitude {@code i} belongs to the computational basis vector in which qubit {@code k} has
 * bit {@code (i >> k) & 1}. The amplitudes are copied on construction and on access, so an
 * instance can be shared freely between threads. Every transformation returns a new state.
 * <p>
 * Equality ignores global phase: two states are equal when {@code |<a|b>|^2} is within
 * {@link #EPSILON} of 1.
 */
public final class QuantumState {
    /** Tolerance for normalization, zero-probability and equality checks. */
    public static final double EPSILON = 1e-9;

    private final ComplexVector amplitudes;
    private final int qubitCount;

    private QuantumState(ComplexVector amplitudes, int qubitCount) {
        this.amplitudes = amplitudes;
        this.qubitCount = qubitCount;
    }

    /**
     * Creates a state from a raw vector, which is copied and normalized.
     *
     * @param raw the amplitudes, length 2^n
     * @return the normalized state
     * @throws io.github.qirt.exceptions.InvalidDimensionException if the length is not a power of 2
     * @throws ZeroStateException if the vector has zero norm
     * @throws io.github.qirt.exceptions.CapacityExceededException if n is above the qubit ceiling
     */
    public static QuantumState of(ComplexVector raw) {
        int n = MathUtil.qubitCountFor(raw.length());
        QubitLimits.checkQubitCount(n);
        double norm = ComplexVectorUtil.norm(raw);
        if (norm <= EPSILON || Double.isNaN(norm)) {
            throw new ZeroStateException("Cannot normalize a vector with norm " + norm);
        }
        var copy = raw.copy();
        ComplexVectorUtil.scale(copy, 1 / norm);
        return new QuantumState(copy, n);
    }

    public static QuantumState of(Complex... amplitudes) {
        return of(ComplexVector.of(amplitudes));
    }

    /**
     * @param qubitCount n
     * @param index the amplitude index
     * @return the computational basis state |index>
     */
    public static QuantumState basisState(int qubitCount, int index) {
        QubitLimits.checkQubitCount(qubitCount);
        if (index < 0 || index >= 1 << qubitCount) {
            throw new IllegalArgumentException("index " + index + " out of range for " + qubitCount + " qubits");
        }
        return new QuantumState(ComplexVector.unit(1 << qubitCount, index), qubitCount);
    }

    /**
     * Builds a state from labels with coefficient 1, using the process-wide notation.
     *
     * @param labels e.g. {@code "00", "11"}
     * @return the normalized sum
     */
    public static QuantumState fromLabel(String... labels) {
        return of(new LabelParser().parse(labels));
    }

    /**
     * Builds a state from labels, using the process-wide notation.
     */
    public static QuantumState fromLabels(Label... labels) {
        return of(new LabelParser().parse(labels));
    }

    public static QuantumState fromLabels(LabelParser parser, List<Label> labels) {
        return of(parser.parse(labels));
    }

    /**
     * @return a copy of the amplitudes
     */
    public ComplexVector amplitudes() {
        return amplitudes.copy();
    }

    public Complex amplitude(int index) {
        return amplitudes.get(index);
    }

    public int qubitCount() {
        return qubitCount;
    }

    /**
     * @return 2^n
     */
    public int dimension() {
        return amplitudes.length();
    }

    public double probabilityOf(int index) {
        return amplitudes.absSquared(index);
    }

    /**
     * Probability of observing the given computational bitstring when measuring every qubit in Z.
     *
     * @param bitstring one 0/1 character per qubit, qubit 0 first
     * @return |amplitude|^2
     * @throws DimensionMismatchException if the bitstring does not have n characters
     */
    public double probabilityOf(String bitstring) {
        if (bitstring.length() != qubitCount) {
            throw new DimensionMismatchException("Bitstring '" + bitstring + "'", qubitCount, bitstring.length());
        }
        int index = 0;
        for (int k = 0; k < qubitCount; k++) {
            char c = bitstring.charAt(k);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("Bitstring must contain only 0 and 1: " + bitstring);
            }
            index |= (c - '0') << k;
        }
        return probabilityOf(index);
    }

    /**
     * @return the probability of every computational basis vector
     */
    public double[] probabilities() {
        var result = new double[dimension()];
        for (int i = 0; i < result.length; i++) {
            result[i] = amplitudes.absSquared(i);
        }
        return result;
    }

    /**
     * @param basis one basis per qubit
     * @return the probability of every basis vector of the given assignment
     */
    public double[] probabilities(BasisAssignment basis) {
        if (basis.isComputational()) {
            return probabilities();
        }
        var coefficients = BasisTransform.toBasis(amplitudes, basis);
        var result = new double[dimension()];
        for (int i = 0; i < result.length; i++) {
            result[i] = coefficients.absSquared(i);
        }
        return result;
    }

    /**
     * @param basis one basis per qubit
     * @return the coefficients of this state over the eigenvectors of the given assignment
     */
    public ComplexVector inBasis(BasisAssignment basis) {
        if (basis.isComputational()) {
            return amplitudes();
        }
        return BasisTransform.toBasis(amplitudes, basis);
    }

    /**
     * @return the Shannon entropy (base 2) of the computational-basis outcome distribution
     */
    public double entropy() {
        return MathUtil.entropy(probabilities());
    }

    /**
     * @param basis one basis per qubit
     * @return the Shannon entropy (base 2) of the outcome distribution in the given basis
     */
    public double entropy(BasisAssignment basis) {
        return MathUtil.entropy(probabilities(basis));
    }

    /**
     * Applies a unitary, such as one produced by a circuit simulator, to this state.
     *
     * @param unitary a 2^n x 2^n matrix
     * @return the evolved state, renormalized
     * @throws DimensionMismatchException if the matrix does not match the state dimension
     */
    public QuantumState evolve(ComplexMatrix unitary) {
        if (unitary.rows() != dimension() || unitary.columns() != dimension()) {
            throw new DimensionMismatchException(String.format("Operator of shape %dx%d does not apply to a state of dimension %d",
                                                               unitary.rows(), unitary.columns(), dimension()));
        }
        return of(unitary.multiply(amplitudes));
    }

    /**
     * @return the amplitudes as a 2^n x 1 column matrix
     */
    public ComplexMatrix toColumnMatrix() {
        return ComplexMatrix.columnOf(amplitudes);
    }

    /**
     * @return |<this|other>|^2
     * @throws DimensionMismatchException if the qubit counts differ
     */
    public double fidelity(QuantumState other) {
        if (other.qubitCount != qubitCount) {
            throw new DimensionMismatchException("Other state", qubitCount, other.qubitCount);
        }
        var overlap = ComplexVectorUtil.innerProduct(amplitudes, other.amplitudes);
        return MathUtil.square(overlap.abs());
    }

    /**
     * @return true if the states differ at most by a global phase, within tolerance
     */
    public boolean isClose(QuantumState other, double tolerance) {
        return other.qubitCount == qubitCount && Math.abs(1 - fidelity(other)) <= tolerance;
    }

    /**
     * Terms of this state in the computational basis; see {@link #terms(BasisAssignment, BasisTable)}.
     */
    public List<StateTerm> terms() {
        return terms(BasisAssignment.computational(qubitCount));
    }

    public List<StateTerm> terms(BasisAssignment basis) {
        return terms(basis, BasisTable.getInstance());
    }

    /**
     * Expresses this state in the given basis as a list of labeled terms, most probable first,
     * ties by ascending amplitude index. Terms with probability at most {@link #EPSILON} are
     * omitted.
     *
     * @param basis one basis per qubit
     * @param table the notation used for the symbols
     * @return the terms
     */
    public List<StateTerm> terms(BasisAssignment basis, BasisTable table) {
        var coefficients = BasisTransform.toBasis(amplitudes, basis);
        var terms = new ArrayList<StateTerm>();
        var symbols = new char[qubitCount];
        for (int i = 0; i < coefficients.length(); i++) {
            double p = coefficients.absSquared(i);
            if (p <= EPSILON) {
                continue;
            }
            for (int k = 0; k < qubitCount; k++) {
                symbols[k] = table.symbolFor(basis.get(k), (i >> k) & 1);
            }
            terms.add(new StateTerm(i, new String(symbols), coefficients.get(i), p));
        }
        Collections.sort(terms);
        return terms;
    }

    /**
     * @return this state as a plain-text sum of kets in the given basis
     */
    public String toString(BasisAssignment basis) {
        return toString(basis, BasisTable.getInstance());
    }

    public String toString(BasisAssignment basis, BasisTable table) {
        return terms(basis, table).stream().map(StateTerm::toString).collect(Collectors.joining(" + "));
    }

    @Override
    public String toString() {
        return toString(BasisAssignment.computational(qubitCount));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuantumState)) return false;
        return isClose((QuantumState) o, EPSILON);
    }

    /**
     * Equality is tolerant and phase-insensitive, so only the qubit count contributes.
     */
    @Override
    public int hashCode() {
        return Integer.hashCode(qubitCount);
    }
}
