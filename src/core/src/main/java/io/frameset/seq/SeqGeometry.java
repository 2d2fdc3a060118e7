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
package io.frameset.seq;

import static java.util.Objects.requireNonNull;

import io.frameset.dataset.DataType;
import io.frameset.dataset.FormatException;
import io.frameset.dataset.Shape;
import io.frameset.dataset.UnsupportedFormatException;

/**
 * Frame layout of a SEQ file, derived from its header and actual size.
 *
 * @param imageOffset bytes from the start of the file to the first frame
 * @param dataType element type of the frame payload
 * @param sigShape {@code (height, width)}
 * @param frameSizeBytes payload bytes of one frame
 * @param footerSize bytes following each frame payload
 * @param trueImageSize bytes of one frame record, payload and footer
 * @param frameCount number of complete frame records in the file
 * @param timestampMicro whether frame timestamps carry a microsecond part
 */
public record SeqGeometry(
        long imageOffset,
        DataType dataType,
        Shape sigShape,
        long frameSizeBytes,
        int footerSize,
        long trueImageSize,
        long frameCount,
        boolean timestampMicro) {

    /** Image offset of files written by StreamPix 6 and later (header version 5 and up). */
    public static final long IMAGE_OFFSET_V5 = 8192;

    /** Image offset of older files. */
    public static final long IMAGE_OFFSET_LEGACY = 1024;

    public SeqGeometry {
        requireNonNull(dataType, "dataType");
        requireNonNull(sigShape, "sigShape");
    }

    /**
     * @return the offset of the first frame for the header's format version
     */
    public static long imageOffset(SeqHeader header) {
        return header.version() >= 5 ? IMAGE_OFFSET_V5 : IMAGE_OFFSET_LEGACY;
    }

    /**
     * Number of complete frame records in a file of {@code fileSize} bytes.
     *
     * @throws FormatException if the header declares an empty frame record
     */
    public static long frameCount(SeqHeader header, long fileSize) throws FormatException {
        final long trueImageSize = header.trueImageSize();
        if (trueImageSize <= 0) {
            throw new FormatException("invalid true_image_size: " + trueImageSize);
        }
        return Math.max(0, fileSize - imageOffset(header)) / trueImageSize;
    }

    /**
     * Derives the frame layout of a file.
     *
     * @param header the decoded header
     * @param fileSize actual size of the file; the header frame count is not trusted
     * @throws UnsupportedFormatException if the bit depth has no matching element type
     * @throws FormatException if the frame payload is larger than the declared record size
     */
    public static SeqGeometry derive(SeqHeader header, long fileSize)
            throws FormatException, UnsupportedFormatException {
        final DataType dataType = DataType.forBitDepth(header.bitDepth());
        final long width = header.width();
        final long height = header.height();
        if (width > Integer.MAX_VALUE || height > Integer.MAX_VALUE) {
            throw new FormatException("frame size %d x %d out of range".formatted(width, height));
        }
        final long frameSizeBytes = width * height * dataType.itemSize();
        final long footerSize = header.trueImageSize() - frameSizeBytes;
        if (footerSize < 0) {
            throw new FormatException("true_image_size %d is smaller than the %d bytes of a %d x %d %s frame"
                    .formatted(header.trueImageSize(), frameSizeBytes, width, height, dataType));
        }
        if (footerSize > Integer.MAX_VALUE) {
            throw new FormatException("frame footer of %d bytes out of range".formatted(footerSize));
        }
        return new SeqGeometry(
                imageOffset(header),
                dataType,
                new Shape(new int[] {(int) height, (int) width}, 2),
                frameSizeBytes,
                (int) footerSize,
                header.trueImageSize(),
                frameCount(header, fileSize),
                header.version() >= 5);
    }
}
