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

/**
 * Small numeric helpers and the qubit-count ceilings.
 *
 * <ul>
 *   <li>{@link io.github.qirt.util.MathUtil} - squaring, power-of-two checks, Shannon entropy</li>
 *   <li>{@link io.github.qirt.util.QubitLimits} - the {@code qirt.max_qubits} and
 *       {@code qirt.max_matrix_qubits} ceilings</li>
 * </ul>
 */
package io.github.qirt.util;
