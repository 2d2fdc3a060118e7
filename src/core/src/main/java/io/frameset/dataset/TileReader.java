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

import io.frameset.io.ByteRange;
import io.frameset.reader.FileRangeReader;
import io.frameset.reader.RangeReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;

/**
 * Streams the frames of a {@link FileSet} as {@link Tile tiles} of at most a
 * given number of bytes.
 * <p>
 * Files are visited in ascending frame order and each is read with a single
 * positioned read per tile, skipping the file header, frame headers and frame
 * footers. Tiles never span two files; inside a file every tile holds the same
 * number of frames except the last one.
 * <p>
 * The stream is finite, forward-only and cannot be restarted. The read buffer
 * is reused, so a tile must be consumed before {@link #next()} is called again.
 * <p>
 * <strong>Thread Safety:</strong> instances are confined to the task that
 * opened them.
 */
@Slf4j
public final class TileReader implements Closeable {

    private final FileSet fileSet;
    private final Slice partitionSlice;
    private final long tileByteBudget;

    private int fileIndex;
    private long nextFrame;
    private RangeReader reader;
    private ByteBuffer buffer;
    private boolean closed;

    TileReader(FileSet fileSet, Slice partitionSlice, long tileByteBudget) {
        this.fileSet = requireNonNull(fileSet, "fileSet");
        this.partitionSlice = requireNonNull(partitionSlice, "partitionSlice");
        if (tileByteBudget <= 0) {
            throw new IllegalArgumentException("tileByteBudget must be positive: " + tileByteBudget);
        }
        this.tileByteBudget = tileByteBudget;
        this.fileIndex = 0;
        this.nextFrame = fileSet.isEmpty() ? partitionSlice.start() : fileSet.files().get(0).startIdx();
    }

    /**
     * Number of frames per tile for a file, at least one.
     */
    static int framesPerTile(FileDescriptor file, long tileByteBudget) {
        long stride = file.frameStride();
        if (stride > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("frame records of %d bytes are too large".formatted(stride));
        }
        long frames = Math.max(1, tileByteBudget / stride);
        return (int) Math.min(frames, Integer.MAX_VALUE / stride);
    }

    public boolean hasNext() {
        return !closed && fileIndex < fileSet.files().size();
    }

    /**
     * Reads the next tile.
     *
     * @return a tile valid until the next call to this method
     * @throws TruncatedFileException if the file ends before the tile's last frame
     * @throws IOException if the file cannot be read
     * @throws NoSuchElementException if the stream is exhausted or closed
     */
    public Tile next() throws IOException {
        if (!hasNext()) {
            throw new NoSuchElementException("no more tiles in " + partitionSlice);
        }
        final FileDescriptor file = fileSet.files().get(fileIndex);
        if (reader == null) {
            reader = FileRangeReader.of(file.path());
            log.debug("Opened {} for frames [{}, {})", reader.getSourceIdentifier(), file.startIdx(), file.endIdx());
        }

        final int frames = (int) Math.min(framesPerTile(file, tileByteBudget), file.endIdx() - nextFrame);
        final int stride = (int) file.frameStride();
        // the footer of the tile's last frame is not needed
        final int length = (frames - 1) * stride + file.frameHeader() + (int) file.frameSizeBytes();
        final ByteRange range = ByteRange.of(file.recordOffset(nextFrame), length);

        ByteBuffer target = buffer(length);
        int read = reader.readRange(range, target);
        if (read < length) {
            long badFrame = nextFrame + read / stride;
            throw new TruncatedFileException(reader.getSourceIdentifier(), badFrame, length, read);
        }
        target.flip();

        Tile tile = new Tile(
                partitionSlice.subSlice(nextFrame, frames),
                target.asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN),
                file.nativeType(),
                stride,
                file.frameHeader());
        log.trace("Read {} from {} at {}", tile, file.path(), range);

        nextFrame += frames;
        if (nextFrame >= file.endIdx()) {
            nextFile();
        }
        return tile;
    }

    private ByteBuffer buffer(int length) {
        if (buffer == null || buffer.capacity() < length) {
            buffer = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        }
        buffer.clear();
        return buffer;
    }

    private void nextFile() throws IOException {
        closeReader();
        fileIndex++;
        if (fileIndex < fileSet.files().size()) {
            nextFrame = fileSet.files().get(fileIndex).startIdx();
        }
    }

    private void closeReader() throws IOException {
        if (reader != null) {
            RangeReader current = reader;
            reader = null;
            current.close();
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        buffer = null;
        closeReader();
    }
}
