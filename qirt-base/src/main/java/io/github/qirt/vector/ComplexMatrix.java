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

/**
 * Complex matrix object where each row is a ComplexVector; this makes multiplication of a
 * matrix by a vector a series of row dot products.
 */
public class ComplexMatrix {
    /**
     * The matrix data stored as rows.
     */
    ComplexVector[] data;
    private final int columns;

    /**
     * Constructs an m-by-n matrix with all elements initialized to zero.
     * @param m the number of rows
     * @param n the number of columns
     */
    public ComplexMatrix(int m, int n) {
        this(m, n, true);
    }

    /**
     * Constructs an m-by-n matrix with optional zero initialization.
     * @param m the number of rows
     * @param n the number of columns
     * @param allocateZeroed if true, all elements are initialized to zero; if false, rows are unallocated
     */
    public ComplexMatrix(int m, int n, boolean allocateZeroed) {
        data = new ComplexVector[m];
        columns = n;
        if (allocateZeroed) {
            for (int i = 0; i < m; i++) {
                data[i] = ComplexVector.create(n);
            }
        }
    }

    /**
     * Creates the n-by-n identity matrix.
     * @param n the dimension
     * @return a new identity matrix
     */
    public static ComplexMatrix identity(int n) {
        var result = new ComplexMatrix(n, n);
        for (int i = 0; i < n; i++) {
            result.data[i].set(i, 1, 0);
        }
        return result;
    }

    public int rows() {
        return data.length;
    }

    public int columns() {
        return columns;
    }

    /**
     * Returns the element at row i and column j.
     * @param i the row index
     * @param j the column index
     * @return the matrix element at position (i, j)
     */
    public Complex get(int i, int j) {
        return data[i].get(j);
    }

    /**
     * Sets the element at row i and column j to the specified value.
     * @param i the row index
     * @param j the column index
     * @param value the value to set
     */
    public void set(int i, int j, Complex value) {
        data[i].set(j, value);
    }

    /**
     * Checks if this matrix has the same dimensions as another matrix.
     * @param other the matrix to compare dimensions with
     * @return true if both matrices have the same number of rows and columns, false otherwise
     */
    public boolean isIsomorphicWith(ComplexMatrix other) {
        return rows() == other.rows() && columns() == other.columns();
    }

    /**
     * Returns the conjugate transpose (adjoint) of this matrix.
     * @return a new n-by-m matrix
     */
    public ComplexMatrix conjugateTranspose() {
        var result = new ComplexMatrix(columns, rows());
        for (int i = 0; i < rows(); i++) {
            var row = data[i];
            for (int j = 0; j < columns; j++) {
                result.data[j].set(i, row.getReal(j), -row.getImaginary(j));
            }
        }
        return result;
    }

    /**
     * Multiplies this matrix by a column vector, returning the resulting vector.
     * @param v the vector to multiply with this matrix
     * @return the resulting vector from the matrix-vector multiplication
     * @throws IllegalArgumentException if the vector dimension doesn't match the matrix column count
     */
    public ComplexVector multiply(ComplexVector v) {
        if (v.length() != columns) {
            throw new IllegalArgumentException("matrix has " + columns + " columns but vector has length " + v.length());
        }

        var result = ComplexVector.create(rows());
        for (int i = 0; i < rows(); i++) {
            var row = data[i];
            double re = 0;
            double im = 0;
            for (int j = 0; j < columns; j++) {
                double ar = row.getReal(j), ai = row.getImaginary(j);
                double br = v.getReal(j), bi = v.getImaginary(j);
                re += ar * br - ai * bi;
                im += ar * bi + ai * br;
            }
            result.set(i, re, im);
        }
        return result;
    }

    /**
     * Matrix product {@code this * other}.
     * @param other the right-hand factor
     * @return a new matrix
     * @throws IllegalArgumentException if the inner dimensions differ
     */
    public ComplexMatrix multiply(ComplexMatrix other) {
        if (columns != other.rows()) {
            throw new IllegalArgumentException("inner dimensions differ: " + columns + "!=" + other.rows());
        }
        // multiply each column of other, then scatter the result back into rows
        var result = new ComplexMatrix(rows(), other.columns());
        for (int j = 0; j < other.columns(); j++) {
            var product = multiply(other.column(j));
            for (int i = 0; i < rows(); i++) {
                result.data[i].set(j, product.getReal(i), product.getImaginary(i));
            }
        }
        return result;
    }

    /**
     * Kronecker product {@code this ⊗ other}; other's indices vary fastest.
     * @param other the inner factor
     * @return a new (m*p)-by-(n*q) matrix
     */
    public ComplexMatrix kronecker(ComplexMatrix other) {
        int p = other.rows();
        int q = other.columns();
        var result = new ComplexMatrix(rows() * p, columns * q, false);
        for (int i = 0; i < rows(); i++) {
            for (int k = 0; k < p; k++) {
                var row = ComplexVector.create(columns * q);
                for (int j = 0; j < columns; j++) {
                    double ar = data[i].getReal(j), ai = data[i].getImaginary(j);
                    if (ar == 0 && ai == 0) {
                        continue;
                    }
                    for (int l = 0; l < q; l++) {
                        double br = other.data[k].getReal(l), bi = other.data[k].getImaginary(l);
                        row.set(j * q + l, ar * br - ai * bi, ar * bi + ai * br);
                    }
                }
                result.data[i * p + k] = row;
            }
        }
        return result;
    }

    /**
     * Multiplies all elements in the matrix by a scalar value, modifying the matrix in place.
     * @param multiplier the scalar value to multiply each matrix element by
     */
    public void scale(Complex multiplier) {
        for (var row : data) {
            ComplexVectorUtil.scale(row, multiplier);
        }
    }

    /**
     * Returns true if {@code this * this^dagger} is the identity within tolerance.
     * @param tolerance the element-wise tolerance
     * @return whether this matrix is unitary
     */
    public boolean isUnitary(double tolerance) {
        if (rows() != columns) {
            return false;
        }
        var product = multiply(conjugateTranspose());
        var identity = identity(rows());
        for (int i = 0; i < rows(); i++) {
            if (!ComplexVectorUtil.allClose(product.data[i], identity.data[i], tolerance)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true if every element is within tolerance of the matching element of other.
     * @param other the matrix to compare with
     * @param tolerance the element-wise tolerance
     * @return whether the matrices are element-wise close
     */
    public boolean isClose(ComplexMatrix other, double tolerance) {
        if (!isIsomorphicWith(other)) {
            return false;
        }
        for (int i = 0; i < rows(); i++) {
            if (!ComplexVectorUtil.allClose(data[i], other.data[i], tolerance)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (ComplexVector row : data) {
            sb.append(row.toString());
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof ComplexMatrix)) {
            return false;
        }

        var other = (ComplexMatrix) obj;
        if (!isIsomorphicWith(other)) {
            return false;
        }
        for (int i = 0; i < data.length; i++) {
            if (!data[i].equals(other.data[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 31 * rows() + columns;
        for (var row : data) {
            result = 31 * result + row.hashCode();
        }
        return result;
    }

    /**
     * Creates a matrix from a 2D array of complex values. Each row of the array becomes a row in the matrix.
     * @param values the 2D array containing the matrix elements (values[row][column])
     * @return a new ComplexMatrix initialized with the provided values
     */
    public static ComplexMatrix from(Complex[][] values) {
        var result = new ComplexMatrix(values.length, values.length == 0 ? 0 : values[0].length, false);
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != result.columns) {
                throw new IllegalArgumentException("ragged matrix: row " + i + " has " + values[i].length + " columns");
            }
            result.data[i] = ComplexVector.of(values[i]);
        }
        return result;
    }

    /**
     * Returns the column {@code j} as a new vector.
     * @param j the column index
     * @return a copy of the column
     */
    public ComplexVector column(int j) {
        var result = ComplexVector.create(rows());
        for (int i = 0; i < rows(); i++) {
            result.set(i, data[i].getReal(j), data[i].getImaginary(j));
        }
        return result;
    }

    /**
     * Builds a single-column matrix from a vector.
     * @param v the vector
     * @return a new v.length()-by-1 matrix
     */
    public static ComplexMatrix columnOf(ComplexVector v) {
        var result = new ComplexMatrix(v.length(), 1);
        for (int i = 0; i < v.length(); i++) {
            result.data[i].set(0, v.getReal(i), v.getImaginary(i));
        }
        return result;
    }
}
