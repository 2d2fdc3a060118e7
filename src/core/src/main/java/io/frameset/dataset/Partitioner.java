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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a frame range into contiguous, disjoint partitions.
 */
public final class Partitioner {

    /** Amount of file data one partition should hold at most before more partitions than workers are used. */
    public static final long BYTES_PER_PARTITION = 512L * 1024 * 1024;

    private Partitioner() {
        // utility class
    }

    /**
     * Number of partitions a dataset of {@code totalBytes} should be split into
     * when {@code workers} workers are available: one per worker, more when
     * the data exceeds {@link #BYTES_PER_PARTITION} per worker.
     *
     * @return a partition count of at least one
     */
    public static int defaultPartitionCount(long totalBytes, int workers) {
        long count = Math.max(workers, totalBytes / BYTES_PER_PARTITION);
        return (int) Math.max(1, Math.min(count, Integer.MAX_VALUE));
    }

    /**
     * Splits {@code [0, totalFrames)} into {@code partitionCount} contiguous
     * chunks of {@code totalFrames / partitionCount} frames, the last chunk
     * taking the remainder. With fewer frames than partitions the leading
     * chunks are empty.
     *
     * @param totalFrames number of frames to distribute
     * @param partitionCount number of chunks, at least one
     * @param sigShape signal shape attached to every slice
     * @return {@code partitionCount} slices in ascending order
     */
    public static List<Slice> plan(long totalFrames, int partitionCount, Shape sigShape) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be at least 1: " + partitionCount);
        }
        if (totalFrames < 0) {
            throw new IllegalArgumentException("totalFrames must not be negative: " + totalFrames);
        }
        final long perPartition = totalFrames / partitionCount;
        List<Slice> slices = new ArrayList<>(partitionCount);
        for (int i = 0; i < partitionCount; i++) {
            long start = i * perPartition;
            long stop = i == partitionCount - 1 ? totalFrames : start + perPartition;
            slices.add(new Slice(start, stop - start, sigShape));
        }
        return slices;
    }
}
