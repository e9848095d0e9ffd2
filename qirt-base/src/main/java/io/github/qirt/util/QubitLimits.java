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

package io.github.qirt.util;

import io.github.qirt.exceptions.CapacityExceededException;

/**
 * Qubit-count ceilings guarding the exponential memory growth of state vectors and matrices.
 * <p>
 * A state over n qubits holds 2^n complex amplitudes, and an explicit transform matrix holds
 * 4^n. Both ceilings are read once from system properties so that an operator can raise them
 * for large machines.
 */
public final class QubitLimits {
    /**
     * Maximum qubit count of a state vector, configurable via the qirt.max_qubits system property
     */
    private static final int maxQubits = Integer.getInteger("qirt.max_qubits", 24);

    /**
     * Maximum qubit count of an explicitly built 2^n x 2^n matrix, configurable via qirt.max_matrix_qubits
     */
    private static final int maxMatrixQubits = Integer.getInteger("qirt.max_matrix_qubits", 10);

    private QubitLimits() {
    }

    public static int getMaxQubits() {
        return maxQubits;
    }

    public static int getMaxMatrixQubits() {
        return maxMatrixQubits;
    }

    /**
     * @param qubitCount the qubit count of a vector about to be allocated
     * @throws CapacityExceededException if qubitCount is above {@link #getMaxQubits()}
     */
    public static void checkQubitCount(int qubitCount) {
        check(qubitCount, maxQubits, "State vector");
    }

    /**
     * @param qubitCount the qubit count of a square matrix about to be allocated
     * @throws CapacityExceededException if qubitCount is above {@link #getMaxMatrixQubits()}
     */
    public static void checkMatrixQubitCount(int qubitCount) {
        check(qubitCount, maxMatrixQubits, "Transform matrix");
    }

    static void check(int qubitCount, int limit, String what) {
        if (qubitCount > limit) {
            throw new CapacityExceededException(qubitCount, limit, what);
        }
    }
}
