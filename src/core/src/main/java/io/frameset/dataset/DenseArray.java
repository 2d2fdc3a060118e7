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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;

/**
 * Dense, row-major float array of arbitrary rank.
 */
public final class DenseArray {

    private final float[] data;
    private final int[] shape;

    public DenseArray(float[] data, int[] shape) {
        this.data = requireNonNull(data, "data");
        this.shape = requireNonNull(shape, "shape").clone();
        long size = 1;
        for (int d : shape) {
            size *= d;
        }
        if (size != data.length) {
            throw new IllegalArgumentException(
                    "shape %s needs %d elements, got %d".formatted(Arrays.toString(shape), size, data.length));
        }
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    public float get(int index) {
        return data[index];
    }

    /**
     * Removes all dimensions of extent one. The data is shared with this array.
     *
     * @return an array of minimal rank holding the same elements
     */
    public DenseArray squeeze() {
        int[] squeezed = Arrays.stream(shape).filter(d -> d != 1).toArray();
        if (squeezed.length == shape.length) {
            return this;
        }
        return new DenseArray(data, squeezed);
    }

    /**
     * @return whether this array has exactly the given shape
     */
    public boolean hasShape(int[] expected) {
        return Arrays.equals(shape, expected);
    }

    @Override
    public String toString() {
        return "DenseArray" + Arrays.toString(shape);
    }
}
