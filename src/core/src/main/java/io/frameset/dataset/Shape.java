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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Immutable n-dimensional shape made of navigation dimensions followed by
 * {@link #getSigDims() sigDims} signal dimensions.
 * <p>
 * For a raster scan of 2 rows by 5 columns over 4x4 pixel frames the shape is
 * {@code (2, 5, 4, 4)} with two signal dimensions.
 */
public final class Shape {

    private final int[] dims;
    private final int sigDims;

    public Shape(int[] dims, int sigDims) {
        if (sigDims < 0 || sigDims > dims.length) {
            throw new IllegalArgumentException(
                    "sigDims must be within [0, %d]: %d".formatted(dims.length, sigDims));
        }
        for (int d : dims) {
            if (d < 0) {
                throw new IllegalArgumentException("negative dimension in " + Arrays.toString(dims));
            }
        }
        this.dims = dims.clone();
        this.sigDims = sigDims;
    }

    /**
     * Creates a shape by concatenating navigation and signal dimensions.
     *
     * @param nav navigation dimensions
     * @param sig signal dimensions
     * @return the combined shape
     */
    public static Shape of(int[] nav, int[] sig) {
        int[] all = Arrays.copyOf(nav, nav.length + sig.length);
        System.arraycopy(sig, 0, all, nav.length, sig.length);
        return new Shape(all, sig.length);
    }

    public int getDims() {
        return dims.length;
    }

    public int getSigDims() {
        return sigDims;
    }

    public int getNavDims() {
        return dims.length - sigDims;
    }

    public int get(int axis) {
        return dims[axis];
    }

    public int[] toArray() {
        return dims.clone();
    }

    /**
     * @return the navigation part of this shape, with no signal dimensions
     */
    public Shape nav() {
        return new Shape(Arrays.copyOfRange(dims, 0, getNavDims()), 0);
    }

    /**
     * @return the signal part of this shape, all of whose dimensions are signal dimensions
     */
    public Shape sig() {
        return new Shape(Arrays.copyOfRange(dims, getNavDims(), dims.length), sigDims);
    }

    /**
     * @return the number of elements described by this shape
     */
    public long size() {
        long size = 1;
        for (int d : dims) {
            size = Math.multiplyExact(size, d);
        }
        return size;
    }

    /**
     * Collapses all navigation dimensions into a single one.
     *
     * @return a shape with exactly one navigation dimension
     */
    public Shape flattenNav() {
        int[] sig = sig().toArray();
        return Shape.of(new int[] {Math.toIntExact(nav().size())}, sig);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Shape other && sigDims == other.sigDims && Arrays.equals(dims, other.dims);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dims) + sigDims;
    }

    @Override
    public String toString() {
        return Arrays.stream(dims).mapToObj(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
