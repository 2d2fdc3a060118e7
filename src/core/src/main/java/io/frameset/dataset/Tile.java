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

import java.nio.ByteBuffer;

/**
 * A group of consecutive frames, {@code (frames,) + sigShape}, viewed in
 * place inside a read buffer.
 * <p>
 * The tile does not own its buffer: it is only valid until the next call to
 * {@link TileReader#next()}.
 */
public final class Tile {

    private final Slice slice;
    private final ByteBuffer buffer;
    private final DataType dataType;
    private final int frameStride;
    private final int payloadOffset;

    Tile(Slice slice, ByteBuffer buffer, DataType dataType, int frameStride, int payloadOffset) {
        this.slice = requireNonNull(slice);
        this.buffer = requireNonNull(buffer);
        this.dataType = requireNonNull(dataType);
        this.frameStride = frameStride;
        this.payloadOffset = payloadOffset;
    }

    /**
     * @return the global frames this tile holds
     */
    public Slice getSlice() {
        return slice;
    }

    public DataType getDataType() {
        return dataType;
    }

    public int getFrameCount() {
        return (int) slice.frames();
    }

    public Shape getShape() {
        return slice.shape();
    }

    /**
     * @param frame frame index within this tile
     * @param pixel flattened pixel index within the frame
     * @return the pixel value widened to float
     */
    public float getFloat(int frame, int pixel) {
        return dataType.getFloat(buffer, elementOffset(frame, pixel));
    }

    /**
     * Decodes one frame into {@code target}, which must hold at least one frame.
     *
     * @param frame frame index within this tile
     * @param target destination of {@code sigSize} values
     */
    public void readFrame(int frame, float[] target) {
        final int sigSize = slice.sigSize();
        if (target.length < sigSize) {
            throw new IllegalArgumentException("target too small: " + target.length + " < " + sigSize);
        }
        final int base = elementOffset(frame, 0);
        final int itemSize = dataType.itemSize();
        switch (dataType) {
            case UINT8 -> {
                for (int p = 0; p < sigSize; p++) {
                    target[p] = buffer.get(base + p) & 0xFF;
                }
            }
            case UINT16 -> {
                for (int p = 0; p < sigSize; p++) {
                    target[p] = buffer.getShort(base + p * itemSize) & 0xFFFF;
                }
            }
            default -> {
                for (int p = 0; p < sigSize; p++) {
                    target[p] = dataType.getFloat(buffer, base + p * itemSize);
                }
            }
        }
    }

    private int elementOffset(int frame, int pixel) {
        if (frame < 0 || frame >= slice.frames()) {
            throw new IndexOutOfBoundsException("frame " + frame + " outside tile of " + slice.frames());
        }
        return frame * frameStride + payloadOffset + pixel * dataType.itemSize();
    }

    @Override
    public String toString() {
        return "Tile[%s, %s]".formatted(slice, dataType);
    }
}
