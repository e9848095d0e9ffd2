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
 * Quantum states, basis transforms and measurement.
 * <p>
 * <b>Key Components:</b>
 * <ul>
 *   <li>{@link io.github.qirt.state.LabelParser} - turns labels such as {@code "0+"} or
 *       {@code (-1, "1-")} into a normalized amplitude vector.</li>
 *   <li>{@link io.github.qirt.state.QuantumState} - immutable normalized state with
 *       phase-insensitive equality, entropy and the term list renderers consume.</li>
 *   <li>{@link io.github.qirt.state.BasisTransform} - per-qubit rotations between the
 *       computational basis and any {@link io.github.qirt.state.BasisAssignment}.</li>
 *   <li>{@link io.github.qirt.state.MeasurementEngine} - outcome probabilities,
 *       post-measurement states and sampling.</li>
 *   <li>{@link io.github.qirt.state.BasisOptimizer} - minimum-entropy choice of basis for the
 *       open entries of a {@link io.github.qirt.state.BasisPattern}.</li>
 * </ul>
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * QuantumState bell = QuantumState.fromLabel("00", "11");
 * MeasurementOutcomeSet outcomes = new MeasurementEngine().measure(bell, new int[] {0}, BasisAssignment.parse("zz"));
 * outcomes.get("1").getPostMeasurementState();   // |1>
 * bell.toString(BasisAssignment.parse("xx"));      // 0.7071|++> + 0.7071|-->
 * }</pre>
 */
package io.github.qirt.state;
