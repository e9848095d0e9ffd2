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

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * All 2^m outcomes of measuring m qubits, indexed so that the first listed qubit is the most
 * significant bit of the outcome index.
 */
public final class MeasurementOutcomeSet implements Iterable<MeasurementOutcome> {
    private final int[] measuredQubits;
    private final BasisAssignment targetBasis;
    private final MeasurementOutcome[] outcomes;

    MeasurementOutcomeSet(int[] measuredQubits, BasisAssignment targetBasis, MeasurementOutcome[] outcomes) {
        this.measuredQubits = measuredQubits;
        this.targetBasis = targetBasis;
        this.outcomes = outcomes;
    }

    public int size() {
        return outcomes.length;
    }

    public MeasurementOutcome get(int index) {
        return outcomes[index];
    }

    /**
     * @param bits one 0/1 character per measured qubit, in measurement order
     * @return the matching outcome
     */
    public MeasurementOutcome get(String bits) {
        if (bits.length() != measuredQubits.length) {
            throw new IllegalArgumentException("expected " + measuredQubits.length + " bits, got '" + bits + "'");
        }
        return outcomes[Integer.parseInt(bits.isEmpty() ? "0" : bits, 2)];
    }

    /**
     * @return the measured qubit indices, in measurement order
     */
    public int[] getMeasuredQubits() {
        return measuredQubits.clone();
    }

    /**
     * @return the full basis assignment the state was rotated into
     */
    public BasisAssignment getTargetBasis() {
        return targetBasis;
    }

    /**
     * @return the measurement basis of each measured qubit, in measurement order
     */
    public BasisAssignment getMeasurementBasis() {
        return targetBasis.select(measuredQubits);
    }

    public double[] probabilities() {
        return Arrays.stream(outcomes).mapToDouble(o -> o.probability).toArray();
    }

    /**
     * @return outcomes that can occur, in index order
     */
    public List<MeasurementOutcome> possibleOutcomes() {
        return Arrays.stream(outcomes).filter(MeasurementOutcome::isPossible).collect(Collectors.toList());
    }

    public List<MeasurementOutcome> asList() {
        return List.of(outcomes);
    }

    @Override
    public Iterator<MeasurementOutcome> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return "MeasurementOutcomeSet(qubits=" + Arrays.toString(measuredQubits) + ", basis=" + targetBasis
               + ", outcomes=" + Arrays.toString(outcomes) + ")";
    }
}
