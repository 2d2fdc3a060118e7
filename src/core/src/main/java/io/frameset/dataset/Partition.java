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
 * A contiguous range of frames and the files holding them; the unit of
 * parallel work.
 * <p>
 * Partitions are immutable and hold no open resources, file handles are only
 * opened by the {@link TileReader} returned from {@link #tiles(long)}.
 */
public final class Partition {

    /** Default upper bound on the bytes read for one tile. */
    public static final long DEFAULT_TILE_BYTES = 8L * 1024 * 1024;

    private final DatasetMeta meta;
    private final FileSet fileSet;
    private final Slice slice;

    public Partition(DatasetMeta meta, FileSet fileSet, Slice slice) {
        this.meta = requireNonNull(meta, "meta");
        this.fileSet = requireNonNull(fileSet, "fileSet");
        this.slice = requireNonNull(slice, "slice");
        if (fileSet.frameCount() != slice.frames()
                || (!fileSet.isEmpty() && fileSet.startIdx() != slice.start())) {
            throw new IllegalArgumentException("file set [%d, %d) does not match %s"
                    .formatted(fileSet.startIdx(), fileSet.endIdx(), slice));
        }
    }

    public DatasetMeta getMeta() {
        return meta;
    }

    public FileSet getFileSet() {
        return fileSet;
    }

    public Slice getSlice() {
        return slice;
    }

    public long getStartFrame() {
        return slice.start();
    }

    public long getNumFrames() {
        return slice.frames();
    }

    /**
     * Opens a forward-only stream of the tiles of this partition.
     *
     * @param tileByteBudget upper bound of bytes read per tile; a tile always holds at least one frame
     * @return a new reader, to be closed by the caller
     */
    public TileReader tiles(long tileByteBudget) {
        return new TileReader(fileSet, slice, tileByteBudget);
    }

    /**
     * Opens a tile stream with the {@link #DEFAULT_TILE_BYTES default} budget.
     */
    public TileReader tiles() {
        return tiles(DEFAULT_TILE_BYTES);
    }

    @Override
    public String toString() {
        return "Partition[%s, %d files]".formatted(slice, fileSet.files().size());
    }
}
