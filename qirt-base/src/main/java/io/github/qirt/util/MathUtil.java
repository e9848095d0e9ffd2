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

package io.github.qirt.util;

import io.github.qirt.exceptions.InvalidDimensionException;

/**
 * Utility methods for mathematical operations.
 */
public class MathUtil {
    /** 1/sqrt(2), the normalization factor of the X and Y eigenvectors. */
    public static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);

    /** Private constructor to prevent instantiation. */
    private MathUtil() {
    }

    /**
     * Squares the given double value.
     * While this may look silly at first, it really does make code more readable.
     *
     * @param a the value to square
     * @return the square of a
     */
    public static double square(double a) {
        return a * a;
    }

    /**
     * @param n a non-negative length
     * @return true if n is 1, 2, 4, 8, ...
     */
    public static boolean isPowerOfTwo(int n) {
        return n > 0 && (n & (n - 1)) == 0;
    }

    /**
     * Returns the number of qubits whose amplitude vector has the given length.
     *
     * @param length the amplitude vector length
     * @return log2(length)
     * @throws InvalidDimensionException if length is not a power of two
     */
    public static int qubitCountFor(int length) {
        if (!isPowerOfTwo(length)) {
            throw new InvalidDimensionException(length);
        }
        return Integer.numberOfTrailingZeros(length);
    }

    /**
     * Base-2 Shannon entropy of a probability distribution. Zero entries contribute nothing.
     *
     * @param probabilities the distribution, expected to sum to 1
     * @return -sum(p * log2(p))
     */
    public static double entropy(double[] probabilities) {
        double h = 0;
        for (double p : probabilities) {
            if (p > 0) {
                h -= p * Math.log(p);
            }
        }
        // -0.0 reads badly in output
        return h == 0 ? 0 : h / Math.log(2);
    }
}
