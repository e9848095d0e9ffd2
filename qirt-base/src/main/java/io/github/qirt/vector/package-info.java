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
 * Dense complex vectors and matrices used to hold and transform quantum states.
 * <p>
 * <b>Key Components:</b>
 * <ul>
 *   <li>{@link io.github.qirt.vector.ComplexVector} - a mutable vector backed by an interleaved
 *       {@code double[]}, exposing elements as commons-math {@code Complex}.</li>
 *   <li>{@link io.github.qirt.vector.ComplexVectorUtil} - inner product, norm, scaling and
 *       Kronecker product.</li>
 *   <li>{@link io.github.qirt.vector.ComplexMatrix} - row-major matrix with adjoint, products and
 *       Kronecker product; used for explicit basis transforms and unitary evolution.</li>
 *   <li>{@link io.github.qirt.vector.ComplexFormat} - plain-text formatting and parsing of
 *       complex literals.</li>
 * </ul>
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * ComplexVector v = ComplexVector.ofReal(1, 1);
 * ComplexVectorUtil.scale(v, 1 / ComplexVectorUtil.norm(v));
 * Complex overlap = ComplexVectorUtil.innerProduct(v, ComplexVector.unit(2, 0));
 * }</pre>
 */
package io.github.qirt.vector;
