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

/**
 * One possible result of a measurement: the observed bits, their probability and the state
 * the rest of the register collapses to.
 */
public final class MeasurementOutcome {
    /** Position in the outcome set; the first measured qubit is the most significant bit */
    public final int index;
    /** Observed bit of each measured qubit, in the order the qubits were listed */
    public final String bits;
    /** Ket symbols of the observed eigenvectors in the measurement bases */
    public final String symbols;
    /** Probability of this outcome */
    public final double probability;
    /** Display basis of the unmeasured qubits, re-indexed from 0 in ascending qubit order */
    public final BasisAssignment remainingBasis;

    private final QuantumState postMeasurementState;
    private final QuantumState measuredState;

    MeasurementOutcome(int index, String bits, String symbols, double probability, BasisAssignment remainingBasis,
                       QuantumState postMeasurementState, QuantumState measuredState) {
        this.index = index;
        this.bits = bits;
        this.symbols = symbols;
        this.probability = probability;
        this.remainingBasis = remainingBasis;
        this.postMeasurementState = postMeasurementState;
        this.measuredState = measuredState;
    }

    /**
     * @return false if this outcome has (numerically) zero probability
     */
    public boolean isPossible() {
        return postMeasurementState != null;
    }

    /**
     * Returns the normalized state of the unmeasured qubits after observing this outcome, as
     * computational amplitudes. Render it in {@link #remainingBasis} to see it the way it was
     * measured.
     *
     * @return the post-measurement state, or null if the outcome cannot occur
     */
    public QuantumState getPostMeasurementState() {
        return postMeasurementState;
    }

    /**
     * @return the product state the measured qubits collapse to, qubit {@code p} of it being
     * the p-th measured qubit
     */
    public QuantumState getMeasuredState() {
        return measuredState;
    }

    @Override
    public String toString() {
        return String.format("MeasurementOutcome(%s |%s>, p=%.6f)", bits, symbols, probability);
    }
}
