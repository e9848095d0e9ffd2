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
 * Ket notation: which display symbol denotes which basis eigenvector.
 * <p>
 * {@link io.github.qirt.notation.BasisTable} is the immutable symbol table, with a process-wide
 * instance that {@link io.github.qirt.notation.NotationConfig} can replace from a YAML file.
 * Library code that needs a table takes one explicitly; the process-wide instance only backs
 * the convenience factories.
 */
package io.github.qirt.notation;
