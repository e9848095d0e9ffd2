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

package io.github.qirt.exceptions;

/**
 * Thrown before allocating a vector or matrix whose qubit count exceeds the configured ceiling.
 *
 * @see io.github.qirt.util.QubitLimits
 */
public class CapacityExceededException extends QirtException {
    private final int qubitCount;
    private final int limit;

    public CapacityExceededException(int qubitCount, int limit, String what) {
        super(String.format("%s over %d qubits exceeds the configured ceiling of %d qubits", what, qubitCount, limit));
        this.qubitCount = qubitCount;
        this.limit = limit;
    }

    public int getQubitCount() {
        return qubitCount;
    }

    public int getLimit() {
        return limit;
    }
}
