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
package io.frameset.correction;

import io.frameset.dataset.DenseArray;
import io.frameset.dataset.FormatException;
import io.frameset.dataset.UnsupportedFormatException;
import io.frameset.reader.FileRangeReader;
import io.frameset.reader.RangeReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads the image data of an MRC file (the MRC2014 layout) as a dense
 * {@code (nz, ny, nx)} float array.
 * <p>
 * Supported modes: 0 (signed 8 bit), 1 (signed 16 bit), 2 (32 bit float) and
 * 6 (unsigned 16 bit). Byte order follows the machine stamp at offset 212.
 */
@Slf4j
public final class MrcReader {

    /** Size of the fixed MRC header. */
    public static final int HEADER_SIZE = 1024;

    static final int NSYMBT_OFFSET = 92;
    static final int MACHINE_STAMP_OFFSET = 212;

    private MrcReader() {
        // utility class
    }

    /**
     * Reads an MRC file.
     *
     * @param path the file to read
     * @return the image stack with shape {@code (nz, ny, nx)}
     * @throws FormatException if the header is short or inconsistent, or the data is truncated
     * @throws UnsupportedFormatException if the data mode is not supported
     * @throws IOException if the file cannot be read
     */
    public static DenseArray read(Path path) throws IOException {
        try (RangeReader reader = FileRangeReader.of(path)) {
            ByteBuffer header = reader.readRange(0, HEADER_SIZE).flip();
            if (header.remaining() < HEADER_SIZE) {
                throw new FormatException("%s: MRC header needs %d bytes, file has %d"
                        .formatted(path, HEADER_SIZE, header.remaining()));
            }
            ByteOrder order = header.get(MACHINE_STAMP_OFFSET) == 0x11 ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
            header.order(order);

            final int nx = header.getInt(0);
            final int ny = header.getInt(4);
            final int nz = header.getInt(8);
            final int mode = header.getInt(12);
            final int nsymbt = header.getInt(NSYMBT_OFFSET);
            if (nx <= 0 || ny <= 0 || nz <= 0 || nsymbt < 0) {
                throw new FormatException("%s: invalid MRC header nx=%d ny=%d nz=%d nsymbt=%d"
                        .formatted(path, nx, ny, nz, nsymbt));
            }

            final int itemSize = itemSize(mode);
            final long count = (long) nx * ny * nz;
            final long byteCount = count * itemSize;
            if (byteCount > Integer.MAX_VALUE) {
                throw new UnsupportedFormatException(
                        "%s: MRC data of %d bytes is too large".formatted(path, byteCount));
            }
            ByteBuffer data = reader.readRange((long) HEADER_SIZE + nsymbt, (int) byteCount).flip();
            if (data.remaining() < byteCount) {
                throw new FormatException("%s: MRC data truncated, expected %d bytes, got %d"
                        .formatted(path, byteCount, data.remaining()));
            }
            data.order(order);

            float[] values = new float[(int) count];
            for (int i = 0; i < values.length; i++) {
                values[i] = switch (mode) {
                    case 0 -> data.get(i);
                    case 1 -> data.getShort(i * 2);
                    case 2 -> data.getFloat(i * 4);
                    case 6 -> data.getShort(i * 2) & 0xFFFF;
                    default -> throw new IllegalStateException("mode " + mode);
                };
            }
            log.debug("Read MRC {} mode={} shape=({}, {}, {})", path, mode, nz, ny, nx);
            return new DenseArray(values, new int[] {nz, ny, nx});
        }
    }

    private static int itemSize(int mode) throws UnsupportedFormatException {
        return switch (mode) {
            case 0 -> 1;
            case 1, 6 -> 2;
            case 2 -> 4;
            default -> throw new UnsupportedFormatException("unsupported MRC mode: " + mode);
        };
    }
}
