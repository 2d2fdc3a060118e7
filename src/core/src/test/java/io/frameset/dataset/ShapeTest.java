/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.frameset.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ShapeTest {

    @Test
    void testNavigationAndSignal() {
        Shape shape = Shape.of(new int[] {2, 5}, new int[] {4, 6});

        assertEquals(4, shape.getDims());
        assertEquals(2, shape.getNavDims());
        assertEquals(2, shape.getSigDims());
        assertEquals(240, shape.size());
        assertEquals(new Shape(new int[] {2, 5}, 0), shape.nav());
        assertEquals(new Shape(new int[] {4, 6}, 2), shape.sig());
        assertEquals(Shape.of(new int[] {10}, new int[] {4, 6}), shape.flattenNav());
        assertEquals("(2, 5, 4, 6)", shape.toString());
    }

    @Test
    void testEquality() {
        assertEquals(new Shape(new int[] {3, 3}, 2), new Shape(new int[] {3, 3}, 2));
        assertNotEquals(new Shape(new int[] {3, 3}, 2), new Shape(new int[] {3, 3}, 1));
        assertEquals(new Shape(new int[] {3, 3}, 2).hashCode(), new Shape(new int[] {3, 3}, 2).hashCode());
    }

    @Test
    void testArraysAreCopied() {
        int[] dims = {2, 2};
        Shape shape = new Shape(dims, 2);
        dims[0] = 7;
        shape.toArray()[1] = 9;
        assertThat(shape.toArray()).containsExactly(2, 2);
    }

    @Test
    void testZeroExtent() {
        Shape shape = Shape.of(new int[] {0}, new int[] {4, 4});
        assertEquals(0, shape.size());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Shape(new int[] {2, -1}, 1));
        assertThrows(IllegalArgumentException.class, () -> new Shape(new int[] {2, 2}, 3));
        assertThrows(IllegalArgumentException.class, () -> new Shape(new int[] {2, 2}, -1));
    }

    @Test
    void testSlice() {
        Shape sig = new Shape(new int[] {4, 4}, 2);
        Slice slice = new Slice(10, 5, sig);

        assertEquals(15, slice.end());
        assertEquals(16, slice.sigSize());
        assertEquals(Shape.of(new int[] {5}, new int[] {4, 4}), slice.shape());
        assertEquals(new Slice(12, 2, sig), slice.subSlice(12, 2));
        assertThrows(IllegalArgumentException.class, () -> slice.subSlice(9, 2));
        assertThrows(IllegalArgumentException.class, () -> slice.subSlice(14, 2));
        assertThrows(IllegalArgumentException.class, () -> new Slice(0, 1, Shape.of(new int[] {1}, new int[] {4})));
    }
}
