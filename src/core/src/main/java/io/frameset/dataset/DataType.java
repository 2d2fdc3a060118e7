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

import java.nio.ByteBuffer;

/**
 * On-disk element types of frame payloads. All supported types are unsigned
 * little-endian integers.
 */
public enum DataType {
    UINT8(1),
    UINT16(2),
    UINT32(4),
    UINT64(8);

    private final int itemSize;

    DataType(int itemSize) {
        this.itemSize = itemSize;
    }

    /**
     * @return the size of one element in bytes
     */
    public int itemSize() {
        return itemSize;
    }

    /**
     * @return the size of one element in bits
     */
    public int bits() {
        return itemSize * 8;
    }

    /**
     * Maps a header bit depth onto an element type.
     *
     * @param bitDepth the declared bits per pixel
     * @return the unsigned integer type of that width
     * @throws UnsupportedFormatException if {@code bitDepth} is not one of 8, 16, 32 or 64
     */
    public static DataType forBitDepth(long bitDepth) throws UnsupportedFormatException {
        for (DataType type : values()) {
            if (type.bits() == bitDepth) {
                return type;
            }
        }
        throw new UnsupportedFormatException("unsupported bit depth: " + bitDepth);
    }

    /**
     * Reads one element at an absolute byte offset and widens it to a float.
     *
     * @param buffer a little-endian buffer
     * @param byteOffset absolute offset of the element
     * @return the unsigned value of the element
     */
    public float getFloat(ByteBuffer buffer, int byteOffset) {
        return switch (this) {
            case UINT8 -> buffer.get(byteOffset) & 0xFF;
            case UINT16 -> buffer.getShort(byteOffset) & 0xFFFF;
            case UINT32 -> buffer.getInt(byteOffset) & 0xFFFFFFFFL;
            case UINT64 -> unsignedToFloat(buffer.getLong(byteOffset));
        };
    }

    private static float unsignedToFloat(long value) {
        if (value >= 0) {
            return value;
        }
        // halve, convert, double back; the dropped low bit is below float precision
        return ((float) (value >>> 1)) * 2f;
    }
}
