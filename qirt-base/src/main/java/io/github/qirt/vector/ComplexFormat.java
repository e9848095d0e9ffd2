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

package io.github.qirt.vector;

import org.apache.commons.math3.complex.Complex;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Compact plain-text formatting of complex numbers, e.g. {@code 0.7071} or
 * {@code (0.5 + 0.5i)}, rounded to 4 decimals, plus parsing of the space-free literals
 * accepted on the command line.
 * <p>
 * Formatting delegates to commons-math's {@link org.apache.commons.math3.complex.ComplexFormat}.
 * Its parser needs spaces around the sign and a real part, so {@link #parse} is separate.
 */
public final class ComplexFormat {
    private static final double SCALE = 1e4;

    private ComplexFormat() {
    }

    public static String format(Complex c) {
        return format(c.getReal(), c.getImaginary());
    }

    public static String format(double re, double im) {
        // DecimalFormat is not thread-safe
        var realFormat = new DecimalFormat("0.####", DecimalFormatSymbols.getInstance(Locale.ROOT));
        double roundedRe = round(re);
        double roundedIm = round(im);
        if (roundedIm == 0) {
            return realFormat.format(roundedRe);
        }
        var complexFormat = new org.apache.commons.math3.complex.ComplexFormat(realFormat);
        return "(" + complexFormat.format(new Complex(roundedRe, roundedIm)) + ")";
    }

    // also maps -0.0 and tiny negatives to 0.0
    private static double round(double x) {
        return Math.round(x * SCALE) / SCALE;
    }

    /**
     * Parses a complex literal such as {@code 2}, {@code -1.5}, {@code 0.5i}, {@code -i} or
     * {@code 0.5+0.5i}. Whitespace is not allowed.
     *
     * @param text the literal
     * @return the parsed value
     * @throws NumberFormatException if the text is not a complex literal
     */
    public static Complex parse(String text) {
        if (text.isEmpty()) {
            throw new NumberFormatException("empty complex literal");
        }
        if (!text.endsWith("i")) {
            return new Complex(Double.parseDouble(text), 0);
        }
        String body = text.substring(0, text.length() - 1);
        // split at the last sign that is not the leading one and not part of an exponent
        int split = -1;
        for (int i = body.length() - 1; i > 0; i--) {
            char c = body.charAt(i);
            char prev = body.charAt(i - 1);
            if ((c == '+' || c == '-') && prev != 'e' && prev != 'E') {
                split = i;
                break;
            }
        }
        if (split < 0) {
            return new Complex(0, imaginaryPart(body));
        }
        return new Complex(Double.parseDouble(body.substring(0, split)), imaginaryPart(body.substring(split)));
    }

    private static double imaginaryPart(String s) {
        switch (s) {
            case "":
            case "+":
                return 1;
            case "-":
                return -1;
            default:
                return Double.parseDouble(s);
        }
    }
}
