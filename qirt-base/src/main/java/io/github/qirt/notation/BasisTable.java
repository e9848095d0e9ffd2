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

import io.github.qirt.exceptions.InvalidNotationException;
import io.github.qirt.exceptions.UnknownSymbolException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Immutable mapping between the six ket symbols and the (basis, bit) pairs they denote.
 * <p>
 * Symbols must be pairwise distinct, otherwise a label character could not be resolved to a
 * single basis; this is rejected when the table is built. The process-wide table is replaced
 * atomically by {@link #install(BasisTable)}; states already built are unaffected, since they
 * only hold amplitudes.
 */
public final class BasisTable {
    private static final BasisTable DEFAULTS = of('0', '1', '+', '-', 'i', 'j');
    private static final AtomicReference<BasisTable> instance = new AtomicReference<>(DEFAULTS);

    // indexed by basis.ordinal() * 2 + bit
    private final char[] symbols;
    private final Map<Character, BasisBit> inverse;

    private BasisTable(char[] symbols) {
        this.symbols = symbols;
        Map<Character, BasisBit> map = new HashMap<>();
        for (Basis basis : Basis.values()) {
            for (int bit = 0; bit < 2; bit++) {
                char symbol = symbols[basis.ordinal() * 2 + bit];
                BasisBit previous = map.put(symbol, new BasisBit(basis, bit));
                if (previous != null) {
                    throw new InvalidNotationException(String.format("Symbol '%s' is registered for both %s and %s",
                                                                     symbol, previous, basis.key(bit)));
                }
            }
        }
        this.inverse = Map.copyOf(map);
    }

    /**
     * Builds a table from the six symbols.
     *
     * @throws InvalidNotationException if any two symbols are equal
     */
    public static BasisTable of(char z0, char z1, char x0, char x1, char y0, char y1) {
        return new BasisTable(new char[] {z0, z1, x0, x1, y0, y1});
    }

    /**
     * @return the documented default notation {@code 0, 1, +, -, i, j}
     */
    public static BasisTable defaults() {
        return DEFAULTS;
    }

    /**
     * @return the process-wide table
     */
    public static BasisTable getInstance() {
        return instance.get();
    }

    /**
     * Replaces the process-wide table for subsequent operations.
     *
     * @param table the new table
     * @return the table that was installed before
     */
    public static BasisTable install(BasisTable table) {
        return instance.getAndSet(Objects.requireNonNull(table));
    }

    /**
     * @param basis the basis
     * @param bit 0 or 1
     * @return the display symbol for the basis eigenvector
     */
    public char symbolFor(Basis basis, int bit) {
        if (bit != 0 && bit != 1) {
            throw new IllegalArgumentException("bit must be 0 or 1: " + bit);
        }
        return symbols[basis.ordinal() * 2 + bit];
    }

    /**
     * @param symbol a ket symbol
     * @return the basis and bit it denotes
     * @throws UnknownSymbolException if the symbol is not registered
     */
    public BasisBit basisAndBitFor(char symbol) {
        BasisBit result = inverse.get(symbol);
        if (result == null) {
            throw new UnknownSymbolException(symbol);
        }
        return result;
    }

    public boolean isRegistered(char symbol) {
        return inverse.containsKey(symbol);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(symbols, ((BasisTable) o).symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BasisTable(");
        for (Basis basis : Basis.values()) {
            for (int bit = 0; bit < 2; bit++) {
                if (sb.length() > "BasisTable(".length()) {
                    sb.append(", ");
                }
                sb.append(basis.key(bit)).append('=').append(symbolFor(basis, bit));
            }
        }
        return sb.append(')').toString();
    }
}
