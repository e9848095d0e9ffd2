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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestMathUtil {
    @Test
    public void testPowerOfTwo() {
        assertTrue(MathUtil.isPowerOfTwo(1));
        assertTrue(MathUtil.isPowerOfTwo(1024));
        assertFalse(MathUtil.isPowerOfTwo(0));
        assertFalse(MathUtil.isPowerOfTwo(6));
        assertFalse(MathUtil.isPowerOfTwo(-4));
    }

    @Test
    public void testQubitCountFor() {
        assertEquals(0, MathUtil.qubitCountFor(1));
        assertEquals(3, MathUtil.qubitCountFor(8));
        var e = assertThrows(InvalidDimensionException.class, () -> MathUtil.qubitCountFor(12));
        assertTrue(e.getMessage(), e.getMessage().contains("12"));
    }

    @Test
    public void testEntropy() {
        assertEquals(0.0, MathUtil.entropy(new double[] {1, 0, 0, 0}), 0);
        assertEquals(1.0, MathUtil.entropy(new double[] {0.5, 0.5}), 1e-12);
        assertEquals(2.0, MathUtil.entropy(new double[] {0.25, 0.25, 0.25, 0.25}), 1e-12);
        assertEquals(1.5, MathUtil.entropy(new double[] {0.5, 0.25, 0.25}), 1e-12);
    }
}
