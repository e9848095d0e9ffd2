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
import io.github.qirt.exceptions.DimensionMismatchException;
import io.github.qirt.exceptions.InvalidDimensionException;
import io.github.qirt.exceptions.ZeroStateException;
import io.github.qirt.notation.BasisTable;
import io.github.qirt.vector.ComplexMatrix;
import io.github.qirt.vector.ComplexVector;
import io.github.qirt.vector.ComplexVectorUtil;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.qirt.StateFixtures.NOTATION;
import static io.github.qirt.StateFixtures.assertComplexEquals;
import static io.github.qirt.StateFixtures.assertNormalized;
import static io.github.qirt.StateFixtures.assertVectorEquals;
import static io.github.qirt.StateFixtures.randomBasis;
import static io.github.qirt.StateFixtures.randomState;
import static io.github.qirt.StateFixtures.randomVector;
import static io.github.qirt.StateFixtures.state;
import static io.github.qirt.util.MathUtil.INV_SQRT2;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;

public class TestQuantumState extends RandomizedTest {
    private static final double DELTA = 1e-9;

    @Test
    public void testNormalizesOnConstruction() {
        var state = QuantumState.of(ComplexVector.ofReal(3, 4));
        assertEquals(1, state.qubitCount());
        assertEquals(2, state.dimension());
        assertComplexEquals(new Complex(0.6, 0), state.amplitude(0), DELTA);
        assertComplexEquals(new Complex(0.8, 0), state.amplitude(1), DELTA);

        for (int i = 0; i < 10; i++) {
            assertNormalized(QuantumState.of(randomVector(getRandom(), 1 << randomIntBetween(0, 6))));
        }
    }

    @Test
    public void testRejectsBadInput() {
        assertThrows(InvalidDimensionException.class, () -> QuantumState.of(ComplexVector.create(3)));
        assertThrows(InvalidDimensionException.class, () -> QuantumState.of(ComplexVector.create(0)));
        assertThrows(ZeroStateException.class, () -> QuantumState.of(ComplexVector.create(4)));
        assertThrows(ZeroStateException.class, () -> QuantumState.of(ComplexVector.ofReal(Double.NaN, 1)));
        assertThrows(IllegalArgumentException.class, () -> QuantumState.basisState(2, 4));
    }

    @Test
    public void testAmplitudesAreCopied() {
        var raw = ComplexVector.ofReal(1, 0);
        var state = QuantumState.of(raw);
        raw.set(0, 0, 0);
        state.amplitudes().set(0, 0, 0);
        assertEquals(1.0, state.probabilityOf(0), DELTA);
    }

    @Test
    public void testEqualityIgnoresGlobalPhase() {
        var a = QuantumState.of(ComplexVector.ofReal(0.6, 0.8));
        var b = QuantumState.of(new Complex(0, 0.6), new Complex(0, 0.8));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(state("0"), state("+"));
        assertNotEquals(state("0"), state("00"));
    }

    @Test
    public void testFidelity() {
        assertEquals(0.5, state("0").fidelity(state("i")), DELTA);
        assertEquals(0.0, state("+").fidelity(state("-")), DELTA);
        assertThrows(DimensionMismatchException.class, () -> state("0").fidelity(state("00")));
    }

    @Test
    public void testProbabilityOfBitstring() {
        var state = state("01");
        assertEquals(1.0, state.probabilityOf("01"), DELTA);
        assertEquals(0.0, state.probabilityOf("10"), DELTA);
        assertEquals(state.probabilityOf(2), state.probabilityOf("01"), 0);
        assertThrows(DimensionMismatchException.class, () -> state.probabilityOf("0"));
        assertThrows(IllegalArgumentException.class, () -> state.probabilityOf("0a"));
    }

    @Test
    public void testProbabilitiesSumToOneInEveryBasis() {
        for (int i = 0; i < 20; i++) {
            int n = randomIntBetween(1, 6);
            var state = randomState(getRandom(), n);
            double total = Arrays.stream(state.probabilities(randomBasis(getRandom(), n))).sum();
            assertEquals(1.0, total, DELTA);
            assertArrayEquals(state.probabilities(), state.probabilities(BasisAssignment.computational(n)), 0);
            assertVectorEquals(state.amplitudes(), state.inBasis(BasisAssignment.computational(n)), 0);
        }
    }

    @Test
    public void testEntropy() {
        var plus = state("++");
        assertEquals(2.0, plus.entropy(), DELTA);
        assertEquals(0.0, plus.entropy(BasisAssignment.parse("xx")), DELTA);
        assertEquals(1.0, plus.entropy(BasisAssignment.parse("xz")), DELTA);
        assertEquals(1.0, state("00", "11").entropy(), DELTA);
    }

    @Test
    public void testEvolve() {
        var pauliX = ComplexMatrix.from(new Complex[][] {{Complex.ZERO, Complex.ONE}, {Complex.ONE, Complex.ZERO}});
        assertEquals(state("1"), state("0").evolve(pauliX));
        assertEquals(state("-"), state("-").evolve(pauliX));
        assertThrows(DimensionMismatchException.class, () -> state("00").evolve(pauliX));
    }

    @Test
    public void testColumnMatrix() {
        var state = state("00", "11");
        var column = state.toColumnMatrix();
        assertEquals(4, column.rows());
        assertEquals(1, column.columns());
        assertVectorEquals(state.amplitudes(), column.column(0), DELTA);
    }

    @Test
    public void testSuperpositionRendersAsSingleTermInX() {
        var state = state("0", "1");
        var terms = state.terms(BasisAssignment.parse("x"), NOTATION);
        assertEquals(1, terms.size());
        assertEquals("+", terms.get(0).symbols);
        assertEquals(1.0, terms.get(0).coefficient.abs(), DELTA);
        assertEquals("1|+>", state.toString(BasisAssignment.parse("x"), NOTATION));
        assertEquals("0.7071|0> + 0.7071|1>", state.toString(BasisAssignment.computational(1), NOTATION));
    }

    @Test
    public void testBellStateInX() {
        var terms = state("00", "11").terms(BasisAssignment.parse("xx"), NOTATION);
        assertEquals(2, terms.size());
        assertEquals("++", terms.get(0).symbols);
        assertEquals("--", terms.get(1).symbols);
        for (StateTerm term : terms) {
            assertComplexEquals(new Complex(INV_SQRT2, 0), term.coefficient, DELTA);
            assertEquals(0.5, term.probability, DELTA);
        }
    }

    @Test
    public void testTermsOrderedByProbabilityThenIndex() {
        var terms = QuantumState.of(ComplexVector.ofReal(1, 2)).terms(BasisAssignment.computational(1), NOTATION);
        assertEquals("1", terms.get(0).symbols);
        assertEquals("0", terms.get(1).symbols);
        assertEquals(0.8, terms.get(0).probability, DELTA);

        // equal probabilities keep ascending index order
        var uniform = state("++").terms(BasisAssignment.computational(2), NOTATION);
        assertEquals(4, uniform.size());
        for (int i = 0; i < uniform.size(); i++) {
            assertEquals(i, uniform.get(i).index);
        }
        assertEquals("10", uniform.get(1).symbols);

        // probabilities that differ only by rounding still tie
        var parser = new LabelParser(NOTATION);
        for (int degrees = 0; degrees < 360; degrees++) {
            double t = Math.toRadians(degrees);
            var phased = QuantumState.fromLabels(parser, List.of(Label.of("0"), Label.of(new Complex(Math.cos(t), Math.sin(t)), "1")));
            var phasedTerms = phased.terms(BasisAssignment.computational(1), NOTATION);
            assertEquals("phase " + degrees, 2, phasedTerms.size());
            assertEquals("phase " + degrees, 0, phasedTerms.get(0).index);
            assertEquals("phase " + degrees, 1, phasedTerms.get(1).index);
        }
    }

    @Test
    public void testFromLabelUsesInstalledNotation() {
        var previous = BasisTable.install(BasisTable.of('a', 'b', 'p', 'm', 'r', 'l'));
        try {
            assertEquals(state("1", "-"), QuantumState.fromLabel("b", "m"));
            assertEquals(state("0"), QuantumState.fromLabels(Label.of("a")));
            assertEquals("1|m>", state("-").toString(BasisAssignment.parse("x")));
        } finally {
            BasisTable.install(previous);
        }
    }

    @Test
    public void testTermsSkipNegligibleCoefficients() {
        var state = QuantumState.of(ComplexVector.ofReal(1, 1e-6));
        assertEquals(1, state.terms().size());
    }

    @Test
    public void testTermsInCustomNotation() {
        var table = BasisTable.of('a', 'b', 'p', 'm', 'r', 'l');
        var terms = state("1-").terms(BasisAssignment.parse("zx"), table);
        assertEquals(1, terms.size());
        assertEquals("bm", terms.get(0).symbols);
    }

    @Test
    public void testInBasisMatchesTerms() {
        for (int i = 0; i < 10; i++) {
            int n = randomIntBetween(1, 4);
            var state = randomState(getRandom(), n);
            var basis = randomBasis(getRandom(), n);
            var coefficients = state.inBasis(basis);
            assertEquals(1.0, ComplexVectorUtil.normSquared(coefficients), DELTA);
            for (StateTerm term : state.terms(basis)) {
                assertComplexEquals(coefficients.get(term.index), term.coefficient, DELTA);
            }
            // rebuilding from the coefficients gives back the same state
            assertEquals(state, QuantumState.of(BasisTransform.fromBasis(coefficients, basis)));
        }
    }

    @Test
    public void testZeroQubitState() {
        var state = QuantumState.of(ComplexVector.ofReal(2));
        assertEquals(0, state.qubitCount());
        assertEquals("1|>", state.toString(BasisAssignment.computational(0), NOTATION));
        assertEquals(0.0, state.entropy(), 0);
    }
}
