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
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.qirt.exceptions.DimensionMismatchException;
import io.github.qirt.notation.Basis;
import org.junit.Test;

import static io.github.qirt.StateFixtures.randomBasis;
import static io.github.qirt.StateFixtures.randomState;
import static io.github.qirt.StateFixtures.state;
import static io.github.qirt.state.BasisOptimizer.Algorithm.GLOBAL;
import static io.github.qirt.state.BasisOptimizer.Algorithm.LOCAL;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestBasisOptimizer extends RandomizedTest {
    private static final double DELTA = 1e-9;

    @Test
    public void testProductStatesResolveToTheirOwnBases() {
        for (BasisOptimizer.Algorithm algorithm : BasisOptimizer.Algorithm.values()) {
            assertEquals(BasisAssignment.parse("xx"), BasisOptimizer.resolve(state("++"), BasisPattern.open(2), algorithm));
            assertEquals(BasisAssignment.parse("yy"), BasisOptimizer.resolve(state("ij"), BasisPattern.open(2), algorithm));
            assertEquals(BasisAssignment.parse("zxy"), BasisOptimizer.resolve(state("0+i"), BasisPattern.open(3), algorithm));
        }
    }

    @Test
    public void testFixedEntriesAreKept() {
        var state = state("++");
        assertEquals(BasisAssignment.parse("zx"), BasisOptimizer.resolve(state, BasisPattern.parse("z*"), GLOBAL));
        assertEquals(BasisAssignment.parse("zx"), BasisOptimizer.resolve(state, BasisPattern.parse("z-"), LOCAL));
        // a short pattern is padded with open entries
        assertEquals(BasisAssignment.parse("yx"), BasisOptimizer.resolve(state, BasisPattern.parse("y"), GLOBAL));
    }

    @Test
    public void testFullyFixedPatternIsReturnedAsIs() {
        var state = state("++");
        assertEquals(BasisAssignment.parse("zy"), BasisOptimizer.resolve(state, BasisPattern.parse("zy"), GLOBAL));
        assertEquals(BasisAssignment.parse("zy"), BasisOptimizer.resolve(state, BasisPattern.parse("ZY"), LOCAL));
    }

    @Test
    public void testPatternLongerThanRegister() {
        assertThrows(DimensionMismatchException.class,
                     () -> BasisOptimizer.resolve(state("0"), BasisPattern.parse("z*"), GLOBAL));
    }

    @Test
    public void testEntangledStateKeepsOneBitOfEntropy() {
        var bell = state("00", "11");
        var best = BasisOptimizer.resolve(bell, BasisPattern.open(2), GLOBAL);
        assertEquals(1.0, bell.entropy(best), DELTA);
    }

    @Test
    public void testGlobalIsNeverWorseThanLocal() {
        for (int i = 0; i < 10; i++) {
            int n = randomIntBetween(1, 4);
            var state = randomState(getRandom(), n);
            var global = BasisOptimizer.resolve(state, BasisPattern.open(n), GLOBAL);
            var local = BasisOptimizer.resolve(state, BasisPattern.open(n), LOCAL);
            assertTrue(state.entropy(global) <= state.entropy(local) + DELTA);
            // and no worse than any basis picked at random
            assertTrue(state.entropy(global) <= state.entropy(randomBasis(getRandom(), n)) + DELTA);
        }
    }

    @Test
    public void testPattern() {
        var pattern = BasisPattern.parse("z*x-");
        assertEquals(4, pattern.size());
        assertEquals("z*x*", pattern.toString());
        assertArrayEquals(new int[] {1, 3}, pattern.openQubits());
        assertEquals(BasisAssignment.parse("zyxz"), pattern.fill(new Basis[] {Basis.Y, Basis.Z}));
        assertThrows(IllegalArgumentException.class, () -> pattern.fill(new Basis[] {Basis.Y}));
        assertThrows(IllegalArgumentException.class, () -> BasisPattern.parse("z?"));
        assertEquals(BasisPattern.parse("**"), BasisPattern.open(2));
        assertEquals(BasisPattern.parse("z***"), BasisPattern.parse("z").padTo(4));
    }

    @Test
    public void testAssignment() {
        var assignment = BasisAssignment.parse("ZxY");
        assertEquals("zxy", assignment.toString());
        assertEquals(BasisAssignment.parse("yz"), assignment.select(new int[] {2, 0}));
        assertTrue(BasisAssignment.computational(3).isComputational());
        assertFalse(assignment.isComputational());
        assertEquals(BasisAssignment.uniform(Basis.X, 2), BasisAssignment.of(Basis.X, Basis.X));
    }
}
