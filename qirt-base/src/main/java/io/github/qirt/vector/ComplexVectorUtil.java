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

/** Utilities for computations with complex vectors */
public final class ComplexVectorUtil {

  private ComplexVectorUtil() {}

  /**
   * Returns the Hermitian inner product {@code <a, b> = sum(conj(a_i) * b_i)}.
   *
   * @param a the first vector (conjugated)
   * @param b the second vector
   * @return the inner product of the two vectors
   * @throws IllegalArgumentException if the vectors' dimensions differ.
   */
  public static Complex innerProduct(ComplexVector a, ComplexVector b) {
    checkSameLength(a, b);
    double re = 0;
    double im = 0;
    for (int i = 0; i < a.length(); i++) {
      double ar = a.getReal(i), ai = a.getImaginary(i);
      double br = b.getReal(i), bi = b.getImaginary(i);
      re += ar * br + ai * bi;
      im += ar * bi - ai * br;
    }
    return new Complex(re, im);
  }

  /**
   * Returns the sum of squared magnitudes of the vector's elements.
   *
   * @param v the vector
   * @return the squared Euclidean norm
   */
  public static double normSquared(ComplexVector v) {
    double sum = 0;
    for (int i = 0; i < v.length(); i++) {
      sum += v.absSquared(i);
    }
    return sum;
  }

  /**
   * @param v the vector
   * @return the Euclidean norm
   */
  public static double norm(ComplexVector v) {
    return Math.sqrt(normSquared(v));
  }

  /**
   * Multiplies every element of the vector by a real factor, in place.
   *
   * @param v the vector
   * @param multiplier the factor
   */
  public static void scale(ComplexVector v, double multiplier) {
    for (int i = 0; i < v.length(); i++) {
      v.set(i, v.getReal(i) * multiplier, v.getImaginary(i) * multiplier);
    }
  }

  /**
   * Multiplies every element of the vector by a complex factor, in place.
   *
   * @param v the vector
   * @param multiplier the factor
   */
  public static void scale(ComplexVector v, Complex multiplier) {
    double mr = multiplier.getReal();
    double mi = multiplier.getImaginary();
    for (int i = 0; i < v.length(); i++) {
      double r = v.getReal(i), im = v.getImaginary(i);
      v.set(i, r * mr - im * mi, r * mi + im * mr);
    }
  }

  /**
   * Adds v2 into v1, in place.
   *
   * @param v1 the vector to add to
   * @param v2 the vector to add
   * @throws IllegalArgumentException if the vectors' dimensions differ.
   */
  public static void addInPlace(ComplexVector v1, ComplexVector v2) {
    checkSameLength(v1, v2);
    for (int i = 0; i < v1.length(); i++) {
      v1.addTo(i, v2.getReal(i), v2.getImaginary(i));
    }
  }

  /**
   * Kronecker (tensor) product {@code a ⊗ b}: element {@code i * b.length() + j} is
   * {@code a_i * b_j}, so b varies fastest and ends up in the low-order index bits.
   *
   * @param a the outer factor
   * @param b the inner factor
   * @return a new vector of length a.length() * b.length()
   */
  public static ComplexVector kron(ComplexVector a, ComplexVector b) {
    int bl = b.length();
    var result = ComplexVector.create(a.length() * bl);
    for (int i = 0; i < a.length(); i++) {
      double ar = a.getReal(i), ai = a.getImaginary(i);
      for (int j = 0; j < bl; j++) {
        double br = b.getReal(j), bi = b.getImaginary(j);
        result.set(i * bl + j, ar * br - ai * bi, ar * bi + ai * br);
      }
    }
    return result;
  }

  /**
   * Returns true if every element of a is within tolerance of the matching element of b.
   *
   * @param a the first vector
   * @param b the second vector
   * @param tolerance the maximum allowed element-wise distance
   * @return true if the vectors are element-wise close
   */
  public static boolean allClose(ComplexVector a, ComplexVector b, double tolerance) {
    if (a.length() != b.length()) {
      return false;
    }
    for (int i = 0; i < a.length(); i++) {
      double dr = a.getReal(i) - b.getReal(i);
      double di = a.getImaginary(i) - b.getImaginary(i);
      if (dr * dr + di * di > tolerance * tolerance) {
        return false;
      }
    }
    return true;
  }

  private static void checkSameLength(ComplexVector a, ComplexVector b) {
    if (a.length() != b.length()) {
      throw new IllegalArgumentException("vector dimensions differ: " + a.length() + "!=" + b.length());
    }
  }
}
