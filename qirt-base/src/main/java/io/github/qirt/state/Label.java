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

import io.github.qirt.vector.ComplexFormat;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * One term of a symbolic state: a complex coefficient times the product state named by a
 * string of ket symbols, character {@code k} describing qubit {@code k}.
 */
public final class Label {
    /** The coefficient of the term */
    public final Complex coefficient;
    /** The ket symbols, one per qubit */
    public final String symbols;

    public Label(Complex coefficient, String symbols) {
        this.coefficient = Objects.requireNonNull(coefficient, "coefficient");
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        if (coefficient.isNaN() || coefficient.isInfinite()) {
            throw new IllegalArgumentException("coefficient must be finite: " + coefficient);
        }
    }

    /**
     * @return a label with coefficient 1
     */
    public static Label of(String symbols) {
        return new Label(Complex.ONE, symbols);
    }

    public static Label of(double coefficient, String symbols) {
        return new Label(new Complex(coefficient), symbols);
    }

    public static Label of(Complex coefficient, String symbols) {
        return new Label(coefficient, symbols);
    }

    /**
     * Parses the command-line form {@code [coefficient:]symbols}, e.g. {@code 01},
     * {@code -1:10} or {@code 0.5+0.5i:+-}. The first colon separates the coefficient.
     *
     * @param text the label text
     * @return the label
     * @throws NumberFormatException if the coefficient is malformed
     */
    public static Label parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return of(text);
        }
        return new Label(ComplexFormat.parse(text.substring(0, colon)), text.substring(colon + 1));
    }

    public int length() {
        return symbols.length();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Label label = (Label) o;
        return coefficient.equals(label.coefficient) && symbols.equals(label.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficient, symbols);
    }

    @Override
    public String toString() {
        return ComplexFormat.format(coefficient) + "|" + symbols + ">";
    }
}
