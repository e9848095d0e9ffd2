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
import org.junit.Test;

import static io.github.qirt.StateFixtures.assertComplexEquals;
import static io.github.qirt.StateFixtures.assertVectorEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestComplexMatrix {
    private static final double DELTA = 1e-12;

    private static Complex c(double re, double im) {
        return new Complex(re, im);
    }

    @Test
    public void testIdentity() {
        var id = ComplexMatrix.identity(3);
        assertEquals(3, id.rows());
        assertEquals(3, id.columns());
        assertTrue(id.isUnitary(DELTA));
        var v = ComplexVector.of(c(1, 2), c(3, 4), c(5, 6));
        assertVectorEquals(v, id.multiply(v), DELTA);
    }

    @Test
    public void testConjugateTranspose() {
        var m = ComplexMatrix.from(new Complex[][] {
                {c(1, 1), c(2, 0), c(0, 3)},
                {c(4, 0), c(0, -5), c(6, 6)}
        });
        var adjoint = m.conjugateTranspose();
        assertEquals(3, adjoint.rows());
        assertEquals(2, adjoint.columns());
        assertComplexEquals(c(1, -1), adjoint.get(0, 0), DELTA);
        assertComplexEquals(c(0, -3), adjoint.get(2, 0), DELTA);
        assertComplexEquals(c(0, 5), adjoint.get(1, 1), DELTA);
        assertEquals(m, adjoint.conjugateTranspose());
    }

    @Test
    public void testMultiplyMatrix() {
        var a = ComplexMatrix.from(new Complex[][] {{c(1, 0), c(2, 0)}, {c(0, 1), c(0, 0)}});
        var b = ComplexMatrix.from(new Complex[][] {{c(0, 0), c(1, 0)}, {c(1, 0), c(0, 1)}});
        var product = a.multiply(b);
        assertComplexEquals(c(2, 0), product.get(0, 0), DELTA);
        assertComplexEquals(c(1, 2), product.get(0, 1), DELTA);
        assertComplexEquals(Complex.ZERO, product.get(1, 0), DELTA);
        assertComplexEquals(c(0, 1), product.get(1, 1), DELTA);
        assertThrows(IllegalArgumentException.class, () -> a.multiply(new ComplexMatrix(3, 1)));
    }

    @Test
    public void testMultiplyVectorDimensionCheck() {
        assertThrows(IllegalArgumentException.class, () -> ComplexMatrix.identity(2).multiply(ComplexVector.create(3)));
    }

    @Test
    public void testKroneckerOrdering() {
        // [[1,2],[3,4]] ⊗ I: the inner factor's indices vary fastest
        var a = ComplexMatrix.from(new Complex[][] {{c(1, 0), c(2, 0)}, {c(3, 0), c(4, 0)}});
        var k = a.kronecker(ComplexMatrix.identity(2));
        assertEquals(4, k.rows());
        assertEquals(4, k.columns());
        assertComplexEquals(c(2, 0), k.get(0, 2), DELTA);
        assertComplexEquals(Complex.ZERO, k.get(0, 3), DELTA);
        assertComplexEquals(c(3, 0), k.get(3, 1), DELTA);
        assertComplexEquals(c(4, 0), k.get(3, 3), DELTA);
    }

    @Test
    public void testUnitary() {
        double s = Math.sqrt(0.5);
        var h = ComplexMatrix.from(new Complex[][] {{c(s, 0), c(s, 0)}, {c(s, 0), c(-s, 0)}});
        assertTrue(h.isUnitary(1e-12));
        assertTrue(h.kronecker(h).isUnitary(1e-12));
        var notUnitary = ComplexMatrix.from(new Complex[][] {{c(1, 0), c(1, 0)}, {c(0, 0), c(1, 0)}});
        assertFalse(notUnitary.isUnitary(1e-12));
        assertFalse(new ComplexMatrix(2, 3).isUnitary(1e-12));
    }

    @Test
    public void testScale() {
        var m = ComplexMatrix.identity(2);
        m.scale(c(0, 2));
        assertComplexEquals(c(0, 2), m.get(1, 1), DELTA);
        assertComplexEquals(Complex.ZERO, m.get(0, 1), DELTA);
    }

    @Test
    public void testColumnRoundTrip() {
        var v = ComplexVector.of(c(1, -1), c(0, 2));
        var column = ComplexMatrix.columnOf(v);
        assertEquals(2, column.rows());
        assertEquals(1, column.columns());
        assertEquals(v, column.column(0));
    }

    @Test
    public void testRaggedInputRejected() {
        assertThrows(IllegalArgumentException.class, () -> ComplexMatrix.from(new Complex[][] {{c(1, 0)}, {c(1, 0), c(2, 0)}}));
    }
}
