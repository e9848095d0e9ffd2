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
import io.github.qirt.exceptions.InvalidQubitIndexException;
import io.github.qirt.notation.BasisTable;
import io.github.qirt.vector.ComplexVector;
import io.github.qirt.vector.ComplexVectorUtil;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Projective measurement of a subset of qubits, each in its own basis.
 * <p>
 * The state is first rotated into the target basis assignment. The measured qubits use their
 * entry as measurement basis; the unmeasured qubits use theirs as display basis for the
 * post-measurement state. The rotated amplitudes are then grouped by the bits of the measured
 * qubits: a group's squared norm is the outcome probability, and the group itself, renormalized,
 * holds the coefficients of the post-measurement state over the remaining qubits.
 */
public class MeasurementEngine {
    private static final Logger logger = LoggerFactory.getLogger(MeasurementEngine.class);

    private final BasisTable table;
    private final LabelParser parser;

    /**
     * Creates an engine over the process-wide notation as installed right now.
     */
    public MeasurementEngine() {
        this(BasisTable.getInstance());
    }

    public MeasurementEngine(BasisTable table) {
        this.table = Objects.requireNonNull(table);
        this.parser = new LabelParser(table);
    }

    /**
     * Measures the listed qubits.
     *
     * @param state the state to measure
     * @param measuredQubits distinct indices in [0, n); the first is the most significant outcome bit
     * @param targetBasis one basis per qubit of the whole register
     * @return all 2^m outcomes
     * @throws InvalidQubitIndexException if an index is out of range or repeated
     * @throws DimensionMismatchException if targetBasis does not have n entries
     */
    public MeasurementOutcomeSet measure(QuantumState state, int[] measuredQubits, BasisAssignment targetBasis) {
        int n = state.qubitCount();
        if (targetBasis.size() != n) {
            throw new DimensionMismatchException("Target basis " + targetBasis, n, targetBasis.size());
        }
        var measured = measuredQubits.clone();
        var remaining = remainingQubits(measured, n);
        int m = measured.length;

        var rotated = state.inBasis(targetBasis);
        int groupLength = 1 << remaining.length;
        var groups = new ComplexVector[1 << m];
        var probabilities = new double[1 << m];
        for (int j = 0; j < groups.length; j++) {
            groups[j] = ComplexVector.create(groupLength);
        }
        for (int i = 0; i < rotated.length(); i++) {
            int outcome = 0;
            for (int p = 0; p < m; p++) {
                outcome |= ((i >> measured[p]) & 1) << (m - 1 - p);
            }
            int position = 0;
            for (int q = 0; q < remaining.length; q++) {
                position |= ((i >> remaining[q]) & 1) << q;
            }
            groups[outcome].set(position, rotated.getReal(i), rotated.getImaginary(i));
            probabilities[outcome] += rotated.absSquared(i);
        }

        var measurementBasis = targetBasis.select(measured);
        var remainingBasis = targetBasis.select(remaining);
        var outcomes = new MeasurementOutcome[1 << m];
        for (int j = 0; j < outcomes.length; j++) {
            var bits = new char[m];
            var symbols = new char[m];
            for (int p = 0; p < m; p++) {
                int bit = (j >> (m - 1 - p)) & 1;
                bits[p] = (char) ('0' + bit);
                symbols[p] = table.symbolFor(measurementBasis.get(p), bit);
            }
            String symbolString = new String(symbols);

            QuantumState post = null;
            QuantumState collapsed = null;
            if (probabilities[j] > QuantumState.EPSILON) {
                var coefficients = groups[j];
                ComplexVectorUtil.scale(coefficients, 1 / Math.sqrt(probabilities[j]));
                post = QuantumState.of(BasisTransform.fromBasis(coefficients, remainingBasis));
                collapsed = QuantumState.of(parser.productState(symbolString));
            }
            outcomes[j] = new MeasurementOutcome(j, new String(bits), symbolString, probabilities[j], remainingBasis, post, collapsed);
        }
        logger.debug("Measured qubits {} of {}-qubit state in basis {}", Arrays.toString(measured), n, targetBasis);
        return new MeasurementOutcomeSet(measured, targetBasis, outcomes);
    }

    public MeasurementOutcomeSet measure(QuantumState state, List<Integer> measuredQubits, BasisAssignment targetBasis) {
        return measure(state, measuredQubits.stream().mapToInt(Integer::intValue).toArray(), targetBasis);
    }

    /**
     * String form: {@code measure(state, "02", "zxz")} measures qubits 0 and 2.
     *
     * @param measuredQubits one decimal digit per measured qubit
     * @param targetBasis one basis letter per qubit
     */
    public MeasurementOutcomeSet measure(QuantumState state, String measuredQubits, String targetBasis) {
        var qubits = new int[measuredQubits.length()];
        for (int i = 0; i < qubits.length; i++) {
            char c = measuredQubits.charAt(i);
            if (!Character.isDigit(c)) {
                throw new IllegalArgumentException("Qubit list must be decimal digits: " + measuredQubits);
            }
            qubits[i] = c - '0';
        }
        return measure(state, qubits, BasisAssignment.parse(targetBasis));
    }

    /**
     * Measures after letting {@link BasisOptimizer} fill the open entries of the pattern with
     * the bases of minimum entropy.
     */
    public MeasurementOutcomeSet measure(QuantumState state, int[] measuredQubits, BasisPattern pattern, BasisOptimizer.Algorithm algorithm) {
        return measure(state, measuredQubits, BasisOptimizer.resolve(state, pattern, algorithm));
    }

    /**
     * Draws {@code shots} independent outcomes with a fresh generator.
     *
     * @see #sample(QuantumState, int[], BasisAssignment, int, RandomGenerator)
     */
    public Map<String, Integer> sample(QuantumState state, int[] measuredQubits, BasisAssignment targetBasis, int shots) {
        return sample(state, measuredQubits, targetBasis, shots, new Well19937c());
    }

    /**
     * Draws {@code shots} independent outcomes from the distribution computed by
     * {@link #measure(QuantumState, int[], BasisAssignment)}.
     *
     * @param shots the number of draws, positive
     * @param random the source of randomness; pass a seeded generator for reproducible counts
     * @return observed counts keyed by outcome bits, ascending outcome index, observed outcomes only
     */
    public Map<String, Integer> sample(QuantumState state, int[] measuredQubits, BasisAssignment targetBasis, int shots, RandomGenerator random) {
        if (shots <= 0) {
            throw new IllegalArgumentException("shots must be positive: " + shots);
        }
        return sample(measure(state, measuredQubits, targetBasis), shots, random);
    }

    /**
     * Draws {@code shots} outcomes from an already computed outcome set.
     */
    public Map<String, Integer> sample(MeasurementOutcomeSet outcomes, int shots, RandomGenerator random) {
        if (shots <= 0) {
            throw new IllegalArgumentException("shots must be positive: " + shots);
        }
        var indices = new int[outcomes.size()];
        for (int j = 0; j < indices.length; j++) {
            indices[j] = j;
        }
        var distribution = new EnumeratedIntegerDistribution(random, indices, outcomes.probabilities());
        var counts = new int[outcomes.size()];
        for (int draw : distribution.sample(shots)) {
            counts[draw]++;
        }

        Map<String, Integer> result = new LinkedHashMap<>();
        for (int j = 0; j < counts.length; j++) {
            if (counts[j] > 0) {
                result.put(outcomes.get(j).bits, counts[j]);
            }
        }
        return result;
    }

    private static int[] remainingQubits(int[] measured, int n) {
        var seen = new boolean[n];
        for (int q : measured) {
            if (q < 0 || q >= n) {
                throw new InvalidQubitIndexException(q, "must be in [0, " + n + ")");
            }
            if (seen[q]) {
                throw new InvalidQubitIndexException(q, "listed more than once");
            }
            seen[q] = true;
        }
        var remaining = new int[n - measured.length];
        int r = 0;
        for (int q = 0; q < n; q++) {
            if (!seen[q]) {
                remaining[r++] = q;
            }
        }
        return remaining;
    }
}
