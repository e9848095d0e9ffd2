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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.qirt.exceptions.CapacityExceededException;
import io.github.qirt.exceptions.DimensionMismatchException;
import io.github.qirt.notation.Basis;
import io.github.qirt.util.QubitLimits;
import io.github.qirt.vector.ComplexMatrix;
import io.github.qirt.vector.ComplexVector;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import static io.github.qirt.StateFixtures.NOTATION;
import static io.github.qirt.StateFixtures.assertComplexEquals;
import static io.github.qirt.StateFixtures.assertVectorEquals;
import static io.github.qirt.StateFixtures.randomBasis;
import static io.github.qirt.StateFixtures.randomVector;
import static io.github.qirt.util.MathUtil.INV_SQRT2;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestBasisTransform extends RandomizedTest {
    private static final double DELTA = 1e-9;
    private final LabelParser parser = new LabelParser(NOTATION);

    @Test
    public void testSingleQubitMatricesAreUnitary() {
        for (Basis basis : Basis.values()) {
            assertTrue(basis.toString(), BasisTransform.singleQubitMatrix(basis).isUnitary(DELTA));
        }
        var y = BasisTransform.singleQubitMatrix(Basis.Y);
        assertFalse(y.isClose(y.conjugateTranspose(), DELTA));
    }

    @Test
    public void testYAdjointIsHadamardAfterSdg() {
        var h = BasisTransform.singleQubitMatrix(Basis.X);
        var sdg = ComplexMatrix.from(new Complex[][] {{Complex.ONE, Complex.ZERO}, {Complex.ZERO, new Complex(0, -1)}});
        var adjoint = BasisTransform.singleQubitMatrix(Basis.Y).conjugateTranspose();
        assertTrue(h.multiply(sdg).isClose(adjoint, DELTA));
    }

    @Test
    public void testEigenstatesMapToUnitVectors() {
        for (Basis basis : Basis.values()) {
            var assignment = BasisAssignment.of(basis);
            for (int bit = 0; bit < 2; bit++) {
                var eigenvector = LabelParser.eigenvector(basis, bit);
                assertVectorEquals(ComplexVector.unit(2, bit), BasisTransform.toBasis(eigenvector, assignment), DELTA);
                assertVectorEquals(eigenvector, BasisTransform.fromBasis(ComplexVector.unit(2, bit), assignment), DELTA);
            }
        }
    }

    @Test
    public void testComputationalStateInY() {
        var coefficients = BasisTransform.toBasis(ComplexVector.ofReal(1, 0), BasisAssignment.parse("y"));
        assertEquals(0.5, coefficients.absSquared(0), DELTA);
        assertEquals(0.5, coefficients.absSquared(1), DELTA);
    }

    @Test
    public void testProductStatesInTheirOwnBasis() {
        var v = parser.parse("+0j");
        var coefficients = BasisTransform.toBasis(v, BasisAssignment.parse("xzy"));
        // "+0j" is x bit 0, z bit 0, y bit 1: index 0b100
        assertVectorEquals(ComplexVector.unit(8, 4), coefficients, DELTA);
    }

    @Test
    public void testRoundTrip() {
        for (int i = 0; i < 20; i++) {
            int n = randomIntBetween(0, 6);
            var v = randomVector(getRandom(), 1 << n);
            var basis = randomBasis(getRandom(), n);
            assertVectorEquals(v, BasisTransform.toBasis(BasisTransform.fromBasis(v, basis), basis), DELTA);
            assertVectorEquals(v, BasisTransform.fromBasis(BasisTransform.toBasis(v, basis), basis), DELTA);
        }
    }

    @Test
    public void testPerQubitApplicationMatchesFullMatrix() {
        for (int i = 0; i < 20; i++) {
            int n = randomIntBetween(1, 5);
            var v = randomVector(getRandom(), 1 << n);
            var basis = randomBasis(getRandom(), n);
            var full = BasisTransform.fullTransform(basis);
            assertTrue(full.isUnitary(DELTA));
            assertVectorEquals(full.multiply(v), BasisTransform.fromBasis(v, basis), DELTA);
            assertVectorEquals(full.conjugateTranspose().multiply(v), BasisTransform.toBasis(v, basis), DELTA);
        }
    }

    @Test
    public void testFullTransformPutsQubitZeroInnermost() {
        // qubit 0 in Z and qubit 1 in X gives H ⊗ I
        var full = BasisTransform.fullTransform(BasisAssignment.parse("zx"));
        assertComplexEquals(new Complex(INV_SQRT2, 0), full.get(0, 2), DELTA);
        assertComplexEquals(new Complex(-INV_SQRT2, 0), full.get(2, 2), DELTA);
        assertComplexEquals(Complex.ZERO, full.get(0, 1), DELTA);
    }

    @Test
    public void testConvert() {
        // |+> in X is (1, 0); in Z it is (1, 1)/sqrt(2)
        var inZ = BasisTransform.convert(ComplexVector.ofReal(1, 0), BasisAssignment.parse("x"), BasisAssignment.parse("z"));
        assertVectorEquals(ComplexVector.ofReal(INV_SQRT2, INV_SQRT2), inZ, DELTA);

        for (int i = 0; i < 10; i++) {
            int n = randomIntBetween(1, 5);
            var v = randomVector(getRandom(), 1 << n);
            var a = randomBasis(getRandom(), n);
            var b = randomBasis(getRandom(), n);
            var direct = BasisTransform.convert(v, a, b);
            var viaZ = BasisTransform.toBasis(BasisTransform.fromBasis(v, a), b);
            assertVectorEquals(viaZ, direct, DELTA);
            assertVectorEquals(v, BasisTransform.convert(direct, b, a), DELTA);
        }
    }

    @Test
    public void testConversionIsIdempotent() {
        for (int i = 0; i < 10; i++) {
            int n = randomIntBetween(1, 5);
            var v = randomVector(getRandom(), 1 << n);
            var z = BasisAssignment.computational(n);
            var b = randomBasis(getRandom(), n);

            var once = BasisTransform.convert(v, z, b);
            // already in b, so converting to b again changes nothing
            assertVectorEquals(once, BasisTransform.convert(once, b, b), DELTA);

            var there = BasisTransform.convert(BasisTransform.convert(v, z, b), b, z);
            var twice = BasisTransform.convert(BasisTransform.convert(there, z, b), b, z);
            assertVectorEquals(there, twice, DELTA);
        }
    }

    @Test
    public void testInputNotModified() {
        var v = ComplexVector.ofReal(1, 2, 3, 4);
        var copy = v.copy();
        BasisTransform.toBasis(v, BasisAssignment.parse("xy"));
        BasisTransform.fromBasis(v, BasisAssignment.parse("yx"));
        assertEquals(copy, v);
    }

    @Test
    public void testDimensionMismatch() {
        assertThrows(DimensionMismatchException.class, () -> BasisTransform.toBasis(ComplexVector.create(4), BasisAssignment.parse("z")));
        assertThrows(DimensionMismatchException.class, () -> BasisTransform.fromBasis(ComplexVector.create(2), BasisAssignment.parse("xx")));
    }

    @Test
    public void testMatrixCeiling() {
        int tooMany = QubitLimits.getMaxMatrixQubits() + 1;
        assertThrows(CapacityExceededException.class, () -> BasisTransform.fullTransform(BasisAssignment.uniform(Basis.X, tooMany)));
    }
}
