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

import io.github.qirt.exceptions.DimensionMismatchException;
import io.github.qirt.notation.Basis;
import io.github.qirt.util.MathUtil;
import io.github.qirt.util.QubitLimits;
import io.github.qirt.vector.ComplexMatrix;
import io.github.qirt.vector.ComplexVector;
import org.apache.commons.math3.complex.Complex;

import static io.github.qirt.util.MathUtil.INV_SQRT2;

/**
 * Per-qubit basis rotations.
 * <p>
 * For each basis the construction matrix U has the basis eigenvectors as its columns:
 * <pre>
 *   U_Z = I      U_X = 1/sqrt(2) [[1, 1], [1, -1]]      U_Y = 1/sqrt(2) [[1, 1], [i, -i]]
 * </pre>
 * {@link #fromBasis} multiplies by U (coefficients in the given basis to computational
 * amplitudes) and {@link #toBasis} by U^dagger (computational amplitudes to coefficients in the
 * given basis). U_Y is not Hermitian, so toBasis uses its conjugate transpose
 * 1/sqrt(2) [[1, -i], [1, i]], never U_Y itself.
 * <p>
 * The full transform is the Kronecker product with qubit 0 innermost, matching the index
 * convention {@code bit of qubit k in amplitude i = (i >> k) & 1}. The vector operations apply
 * it one qubit at a time and never build the 2^n x 2^n matrix.
 */
public final class BasisTransform {
    // row-major 2x2 complex matrices as {re00, im00, re01, im01, re10, im10, re11, im11}
    private static final double[] IDENTITY = {1, 0, 0, 0, 0, 0, 1, 0};
    private static final double[] HADAMARD = {INV_SQRT2, 0, INV_SQRT2, 0, INV_SQRT2, 0, -INV_SQRT2, 0};
    private static final double[] Y_FORWARD = {INV_SQRT2, 0, INV_SQRT2, 0, 0, INV_SQRT2, 0, -INV_SQRT2};
    private static final double[] Y_ADJOINT = {INV_SQRT2, 0, 0, -INV_SQRT2, INV_SQRT2, 0, 0, INV_SQRT2};

    private BasisTransform() {
    }

    /**
     * @param basis the basis
     * @return the 2x2 construction matrix U whose columns are the basis eigenvectors
     */
    public static ComplexMatrix singleQubitMatrix(Basis basis) {
        return toMatrix(forward(basis));
    }

    /**
     * Builds the explicit 2^n x 2^n construction matrix {@code U_{n-1} ⊗ ... ⊗ U_0}.
     *
     * @param assignment the per-qubit bases
     * @return the full unitary
     * @throws io.github.qirt.exceptions.CapacityExceededException if n is above the matrix ceiling
     */
    public static ComplexMatrix fullTransform(BasisAssignment assignment) {
        QubitLimits.checkMatrixQubitCount(assignment.size());
        var result = ComplexMatrix.identity(1);
        for (int k = 0; k < assignment.size(); k++) {
            result = singleQubitMatrix(assignment.get(k)).kronecker(result);
        }
        return result;
    }

    /**
     * Re-expresses computational amplitudes as coefficients over the eigenvectors of the given
     * bases, i.e. multiplies by the adjoint of {@link #fullTransform}.
     *
     * @param amplitudes the computational amplitudes, length 2^n
     * @param assignment one basis per qubit
     * @return a new vector of basis coefficients
     * @throws DimensionMismatchException if the assignment does not have n entries
     */
    public static ComplexVector toBasis(ComplexVector amplitudes, BasisAssignment assignment) {
        checkDimensions(amplitudes, assignment);
        var result = amplitudes.copy();
        for (int k = 0; k < assignment.size(); k++) {
            Basis basis = assignment.get(k);
            if (basis != Basis.Z) {
                applySingleQubit(result, k, adjoint(basis));
            }
        }
        return result;
    }

    /**
     * Rebuilds computational amplitudes from coefficients over the eigenvectors of the given
     * bases, i.e. multiplies by {@link #fullTransform}. Inverse of {@link #toBasis}.
     *
     * @param coefficients the basis coefficients, length 2^n
     * @param assignment one basis per qubit
     * @return a new vector of computational amplitudes
     * @throws DimensionMismatchException if the assignment does not have n entries
     */
    public static ComplexVector fromBasis(ComplexVector coefficients, BasisAssignment assignment) {
        checkDimensions(coefficients, assignment);
        var result = coefficients.copy();
        for (int k = 0; k < assignment.size(); k++) {
            Basis basis = assignment.get(k);
            if (basis != Basis.Z) {
                applySingleQubit(result, k, forward(basis));
            }
        }
        return result;
    }

    /**
     * Converts coefficients expressed in one basis assignment into another.
     *
     * @param coefficients coefficients over the eigenvectors of {@code current}
     * @param current the basis the coefficients are expressed in
     * @param target the basis to express them in
     * @return a new vector of coefficients over the eigenvectors of {@code target}
     */
    public static ComplexVector convert(ComplexVector coefficients, BasisAssignment current, BasisAssignment target) {
        return toBasis(fromBasis(coefficients, current), target);
    }

    /**
     * Applies a 2x2 matrix to qubit k of the vector, in place.
     */
    static void applySingleQubit(ComplexVector v, int k, double[] m) {
        int stride = 1 << k;
        for (int i = 0; i < v.length(); i++) {
            if ((i & stride) != 0) {
                continue;
            }
            int j = i | stride;
            double ar = v.getReal(i), ai = v.getImaginary(i);
            double br = v.getReal(j), bi = v.getImaginary(j);
            v.set(i, m[0] * ar - m[1] * ai + m[2] * br - m[3] * bi,
                     m[0] * ai + m[1] * ar + m[2] * bi + m[3] * br);
            v.set(j, m[4] * ar - m[5] * ai + m[6] * br - m[7] * bi,
                     m[4] * ai + m[5] * ar + m[6] * bi + m[7] * br);
        }
    }

    private static void checkDimensions(ComplexVector v, BasisAssignment assignment) {
        int n = MathUtil.qubitCountFor(v.length());
        if (assignment.size() != n) {
            throw new DimensionMismatchException("Basis assignment " + assignment, n, assignment.size());
        }
    }

    private static double[] forward(Basis basis) {
        switch (basis) {
            case Z:
                return IDENTITY;
            case X:
                return HADAMARD;
            case Y:
                return Y_FORWARD;
            default:
                throw new AssertionError(basis);
        }
    }

    private static double[] adjoint(Basis basis) {
        // Z and X are Hermitian
        return basis == Basis.Y ? Y_ADJOINT : forward(basis);
    }

    private static ComplexMatrix toMatrix(double[] m) {
        return ComplexMatrix.from(new Complex[][] {
                {new Complex(m[0], m[1]), new Complex(m[2], m[3])},
                {new Complex(m[4], m[5]), new Complex(m[6], m[7])}
        });
    }
}
