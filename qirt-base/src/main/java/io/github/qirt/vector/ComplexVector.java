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

import java.util.Arrays;

/**
 * A dense vector of complex numbers backed by a single interleaved {@code double[]}
 * (real part at {@code 2i}, imaginary part at {@code 2i + 1}).
 * <p>
 * Elements are exposed as commons-math {@link Complex} values; the hot loops in
 * {@link ComplexVectorUtil} and {@link ComplexMatrix} read the primitive parts directly.
 * Instances are mutable; owners that must stay immutable copy on the way in and out.
 */
public final class ComplexVector {
    private final double[] data;

    private ComplexVector(double[] data) {
        this.data = data;
    }

    /**
     * Creates a zero vector.
     * @param length the number of complex elements
     * @return a new zero vector
     */
    public static ComplexVector create(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        return new ComplexVector(new double[2 * length]);
    }

    /**
     * Creates a vector holding the given values.
     * @param values the elements
     * @return a new vector
     */
    public static ComplexVector of(Complex... values) {
        var v = create(values.length);
        for (int i = 0; i < values.length; i++) {
            v.set(i, values[i]);
        }
        return v;
    }

    /**
     * Creates a vector with the given real parts and zero imaginary parts.
     * @param values the real elements
     * @return a new vector
     */
    public static ComplexVector ofReal(double... values) {
        var v = create(values.length);
        for (int i = 0; i < values.length; i++) {
            v.set(i, values[i], 0);
        }
        return v;
    }

    /**
     * Creates the standard basis vector e_index.
     * @param length the vector length
     * @param index the position of the single 1
     * @return a new unit vector
     */
    public static ComplexVector unit(int length, int index) {
        var v = create(length);
        v.set(index, 1, 0);
        return v;
    }

    public int length() {
        return data.length / 2;
    }

    public Complex get(int i) {
        return new Complex(data[2 * i], data[2 * i + 1]);
    }

    public double getReal(int i) {
        return data[2 * i];
    }

    public double getImaginary(int i) {
        return data[2 * i + 1];
    }

    public void set(int i, Complex value) {
        set(i, value.getReal(), value.getImaginary());
    }

    public void set(int i, double re, double im) {
        data[2 * i] = re;
        data[2 * i + 1] = im;
    }

    /**
     * Adds re + i*im to the element at i.
     */
    public void addTo(int i, double re, double im) {
        data[2 * i] += re;
        data[2 * i + 1] += im;
    }

    /**
     * Squared magnitude of the element at i.
     * @param i the index
     * @return |v_i|^2
     */
    public double absSquared(int i) {
        double re = data[2 * i];
        double im = data[2 * i + 1];
        return re * re + im * im;
    }

    public ComplexVector copy() {
        return new ComplexVector(Arrays.copyOf(data, data.length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComplexVector)) return false;
        return Arrays.equals(data, ((ComplexVector) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < length(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(ComplexFormat.format(getReal(i), getImaginary(i)));
        }
        return sb.append(']').toString();
    }
}
