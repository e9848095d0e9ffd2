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
 * Unchecked exception types raised by QIRT.
 * <p>
 * Every operation either succeeds completely or throws one of these before producing any
 * result. Since states are immutable, a failed call never affects existing instances.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.qirt.exceptions.InvalidNotationException} - bad notation table or file</li>
 *   <li>{@link io.github.qirt.exceptions.UnknownSymbolException} - label character not registered</li>
 *   <li>{@link io.github.qirt.exceptions.DimensionMismatchException} - label, basis or matrix length
 *       differs from the qubit count</li>
 *   <li>{@link io.github.qirt.exceptions.InvalidDimensionException} - vector length not a power of 2</li>
 *   <li>{@link io.github.qirt.exceptions.ZeroStateException} - normalizing a zero vector</li>
 *   <li>{@link io.github.qirt.exceptions.InvalidQubitIndexException} - index out of range or duplicated</li>
 *   <li>{@link io.github.qirt.exceptions.CapacityExceededException} - qubit count beyond the ceiling</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     QuantumState state = QuantumState.fromLabel("0+", "1-");
 * } catch (UnknownSymbolException e) {
 *     logger.warn("label uses unregistered symbol {}", e.getSymbol());
 * }
 * }</pre>
 */
package io.github.qirt.exceptions;
