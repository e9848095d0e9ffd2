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

package io.github.qirt.notation;

import java.util.Objects;

/**
 * A (basis, bit) pair: which eigenvector of which basis a ket symbol denotes.
 */
public final class BasisBit {
    /** The basis the symbol belongs to */
    public final Basis basis;
    /** The eigenvector index within the basis, 0 or 1 */
    public final int bit;

    public BasisBit(Basis basis, int bit) {
        if (bit != 0 && bit != 1) {
            throw new IllegalArgumentException("bit must be 0 or 1: " + bit);
        }
        this.basis = Objects.requireNonNull(basis);
        this.bit = bit;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        BasisBit that = (BasisBit) o;
        return bit == that.bit && basis == that.basis;
    }

    @Override
    public int hashCode() {
        return Objects.hash(basis, bit);
    }

    @Override
    public String toString() {
        return basis.key(bit);
    }
}
