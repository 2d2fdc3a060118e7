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

/**
 * A run of consecutive frames in flattened navigation coordinates, covering
 * the whole signal shape.
 *
 * @param start global index of the first frame
 * @param frames number of frames, may be zero
 * @param sigShape signal shape of each frame
 */
public record Slice(long start, long frames, Shape sigShape) {

    public Slice {
        requireNonNull(sigShape, "sigShape");
        if (start < 0 || frames < 0) {
            throw new IllegalArgumentException("invalid slice start=%d frames=%d".formatted(start, frames));
        }
        if (sigShape.getNavDims() != 0) {
            throw new IllegalArgumentException("sigShape must only have signal dimensions: " + sigShape);
        }
    }

    /**
     * @return the exclusive global end index
     */
    public long end() {
        return start + frames;
    }

    /**
     * @return {@code (frames,) + sigShape}
     */
    public Shape shape() {
        return Shape.of(new int[] {Math.toIntExact(frames)}, sigShape.toArray());
    }

    /**
     * @return the number of elements of one frame
     */
    public int sigSize() {
        return Math.toIntExact(sigShape.size());
    }

    /**
     * Returns the slice of {@code count} frames starting at global index {@code from}.
     *
     * @throws IllegalArgumentException if the requested frames are not inside this slice
     */
    public Slice subSlice(long from, long count) {
        if (from < start || count < 0 || from + count > end()) {
            throw new IllegalArgumentException(
                    "[%d, %d) is not inside %s".formatted(from, from + count, this));
        }
        return new Slice(from, count, sigShape);
    }

    @Override
    public String toString() {
        return "Slice[%d:%d, sig=%s]".formatted(start, end(), sigShape);
    }
}
