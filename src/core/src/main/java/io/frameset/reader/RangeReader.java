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
package io.frameset.reader;

import io.frameset.io.ByteRange;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * Interface for reading ranges of bytes from a source.
 * <p>
 * Header decoding, correction file loading and tile streaming all go through
 * this abstraction, so none of them depend on how the bytes are actually
 * fetched.
 * <p>
 * All implementations of this interface MUST be thread-safe.
 */
public interface RangeReader extends Closeable {

    /**
     * Reads bytes from the source at the specified offset into a newly allocated buffer.
     *
     * @param offset The offset to read from
     * @param length The number of bytes to read
     * @return A ByteBuffer with its position set at the actual number of bytes read, needs flip() to be consumed
     * @throws IOException              If an I/O error occurs
     * @throws IllegalArgumentException If offset or length is negative
     */
    default ByteBuffer readRange(long offset, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        int bytesRead = readRange(offset, length, buffer);
        assert bytesRead == buffer.position();
        return buffer;
    }

    /**
     * Reads bytes from the source at the specified offset into the provided target
     * buffer.
     * <p>
     * Following standard NIO conventions, after this method returns the target
     * buffer's position is advanced by the number of bytes read, and the caller
     * must call {@code flip()} on the buffer to prepare it for reading.
     *
     * @param offset The offset to read from
     * @param length The number of bytes to read
     * @param target The ByteBuffer to read into, starting at its current position
     * @return The number of bytes actually read, less than {@code length} only at end of file
     * @throws IOException                      If an I/O error occurs
     * @throws IllegalArgumentException         If offset or length is negative, target is null
     *                                          or has insufficient remaining capacity
     * @throws java.nio.ReadOnlyBufferException If the target buffer is read-only
     */
    int readRange(long offset, int length, ByteBuffer target) throws IOException;

    /**
     * Reads a byte range from the source into the provided target buffer.
     *
     * @param range The byte range to read.
     * @param target The ByteBuffer to read into.
     * @return The number of bytes read.
     * @throws IOException If an I/O error occurs.
     */
    default int readRange(ByteRange range, ByteBuffer target) throws IOException {
        return readRange(range.offset(), range.length(), target);
    }

    /**
     * Gets the total size of the source in bytes.
     *
     * @return The size in bytes, or empty if unknown
     * @throws IOException If an I/O error occurs
     */
    OptionalLong size() throws IOException;

    /**
     * Gets a unique identifier for the source being read, used in log and
     * error messages.
     *
     * @return A unique identifier for this source
     */
    String getSourceIdentifier();

    /**
     * Closes this range reader and releases any underlying resource. This operation
     * is idempotent.
     */
    @Override
    void close() throws IOException;
}
