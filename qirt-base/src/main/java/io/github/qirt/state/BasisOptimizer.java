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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Chooses bases for the open entries of a {@link BasisPattern} so that the state's outcome
 * distribution has minimum Shannon entropy, i.e. the state is written with as few terms as
 * possible.
 */
public final class BasisOptimizer {
    private static final Logger logger = LoggerFactory.getLogger(BasisOptimizer.class);

    /** Above this many open qubits a global search is reported as slow (3^k candidates). */
    static final int GLOBAL_SEARCH_WARN_QUBITS = 8;

    private static final Basis[] SEARCH_ORDER = {Basis.Z, Basis.X, Basis.Y};
    private static final Basis[] GREEDY_ORDER = {Basis.Y, Basis.X, Basis.Z};

    public enum Algorithm {
        /** Try every combination of Z, X and Y over the open qubits. */
        GLOBAL,
        /** Pick the best uniform basis, then improve one qubit at a time. */
        LOCAL
    }

    private BasisOptimizer() {
    }

    /**
     * @param state the state to describe
     * @param pattern fixed and open entries; padded with open entries up to the qubit count
     * @param algorithm the search strategy
     * @return a complete assignment keeping every fixed entry of the pattern
     * @throws io.github.qirt.exceptions.DimensionMismatchException if the pattern is longer than the register
     */
    public static BasisAssignment resolve(QuantumState state, BasisPattern pattern, Algorithm algorithm) {
        var padded = pattern.padTo(state.qubitCount());
        int[] open = padded.openQubits();
        if (open.length == 0) {
            return padded.fill(new Basis[0]);
        }
        BasisAssignment result;
        switch (algorithm) {
            case GLOBAL:
                result = global(state, padded, open.length);
                break;
            case LOCAL:
                result = local(state, padded, open.length);
                break;
            default:
                throw new AssertionError(algorithm);
        }
        logger.debug("Resolved basis pattern {} to {} ({})", padded, result, algorithm);
        return result;
    }

    private static BasisAssignment global(QuantumState state, BasisPattern pattern, int openCount) {
        if (openCount > GLOBAL_SEARCH_WARN_QUBITS) {
            logger.warn("Global minimum-entropy search over {} qubits tries {} bases and may take a long time",
                        openCount, (long) Math.pow(3, openCount));
        }
        var choice = new Basis[openCount];
        BasisAssignment best = null;
        double bestEntropy = Double.POSITIVE_INFINITY;
        // odometer over {Z, X, Y}^k, last open qubit varying fastest
        var digits = new int[openCount];
        while (true) {
            for (int i = 0; i < openCount; i++) {
                choice[i] = SEARCH_ORDER[digits[i]];
            }
            var candidate = pattern.fill(choice);
            double entropy = state.entropy(candidate);
            if (entropy < bestEntropy) {
                bestEntropy = entropy;
                best = candidate;
            }
            int i = openCount - 1;
            while (i >= 0 && ++digits[i] == SEARCH_ORDER.length) {
                digits[i--] = 0;
            }
            if (i < 0) {
                return best;
            }
        }
    }

    private static BasisAssignment local(QuantumState state, BasisPattern pattern, int openCount) {
        var best = new Basis[openCount];
        double bestEntropy = Double.POSITIVE_INFINITY;
        var uniform = new Basis[openCount];
        for (Basis basis : SEARCH_ORDER) {
            Arrays.fill(uniform, basis);
            double entropy = state.entropy(pattern.fill(uniform));
            if (entropy < bestEntropy) {
                bestEntropy = entropy;
                System.arraycopy(uniform, 0, best, 0, openCount);
            }
        }

        var trial = new Basis[openCount];
        for (int i = 0; i < openCount; i++) {
            System.arraycopy(best, 0, trial, 0, openCount);
            for (Basis basis : GREEDY_ORDER) {
                trial[i] = basis;
                double entropy = state.entropy(pattern.fill(trial));
                if (entropy < bestEntropy) {
                    bestEntropy = entropy;
                    best[i] = basis;
                }
            }
        }
        return pattern.fill(best);
    }
}
