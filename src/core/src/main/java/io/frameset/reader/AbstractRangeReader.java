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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.OptionalLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class providing common implementation for {@link RangeReader}.
 * <p>
 * {@link #readRange(long, int, ByteBuffer)} handles argument validation and
 * end-of-file truncation, and delegates the actual read to
 * {@link #readRangeNoFlip(long, int, ByteBuffer)}.
 */
@Slf4j
public abstract class AbstractRangeReader implements RangeReader {

    protected AbstractRangeReader() {
        // Default constructor for subclasses
    }

    /**
     * {@inheritDoc}
     * <p>
     * Zero-length reads and reads starting at or beyond the end of the source
     * return 0 without touching the target buffer. Reads extending past the end
     * of the source are truncated to the available bytes, callers that need the
     * full range must compare the returned count with the requested length.
     */
    @Override
    public final int readRange(long offset, int length, ByteBuffer target) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative");
        }
        if (target == null) {
            throw new IllegalArgumentException("Target buffer cannot be null");
        }
        if (target.isReadOnly()) {
            throw new java.nio.ReadOnlyBufferException();
        }
        if (length == 0) {
            return 0;
        }

        final int remainingBefore = target.remaining();
        if (remainingBefore < length) {
            throw new IllegalArgumentException(
                    "Target buffer has insufficient remaining capacity: " + remainingBefore + " < " + length);
        }

        int actualLength = length;
        final OptionalLong fileSize = size();
        if (fileSize.isPresent()) {
            long size = fileSize.getAsLong();
            if (offset >= size) {
                log.trace("Read at offset {} is beyond the end of {} ({} bytes)", offset, getSourceIdentifier(), size);
                return 0;
            }
            if (offset + length > size) {
                actualLength = (int) (size - offset);
            }
        }
        return readRangeNoFlip(offset, actualLength, target);
    }

    /**
     * Reads bytes from the source into the target buffer without preparing the buffer for consumption.
     * <p>
     * When called from {@link #readRange(long, int, ByteBuffer)} the following holds:
     * {@literal offset >= 0}, {@literal actualLength > 0}, {@code target} is writable and
     * {@literal target.remaining() >= actualLength}. Implementations must advance the
     * target position by the number of bytes written and leave its limit unchanged.
     *
     * @param offset       The byte offset to read from
     * @param actualLength The number of bytes to read
     * @param target       The ByteBuffer to write into
     * @return The number of bytes actually read and written to the target buffer
     * @throws IOException If an I/O error occurs during reading from the underlying source
     */
    protected abstract int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException;
}
