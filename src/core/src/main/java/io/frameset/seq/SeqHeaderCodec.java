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

import io.frameset.dataset.DatasetException;
import io.frameset.dataset.FormatException;
import io.frameset.dataset.UnsupportedFormatException;
import io.frameset.reader.FileRangeReader;
import io.frameset.reader.RangeReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the fixed-layout header at the start of a Norpix SEQ file.
 * <p>
 * The header is described by {@link #FIELDS}, an ordered table of
 * {@code (name, width, decoder)} entries read back to back from offset 0.
 * All numbers are little-endian.
 */
public final class SeqHeaderCodec {

    /** Magic number of SEQ files. */
    public static final long MAGIC = 0xFEED;

    /** {@code image_format} value of monochrome images. */
    public static final long MONOCHROME = 100;

    /**
     * Decodes one field of {@code width} bytes at an absolute offset.
     */
    @FunctionalInterface
    public interface FieldDecoder {
        Object decode(ByteBuffer buffer, int offset, int width) throws FormatException;
    }

    /**
     * A header field.
     *
     * @param name field name
     * @param width size in bytes
     * @param decoder value decoder
     */
    public record Field(String name, int width, FieldDecoder decoder) {}

    static final FieldDecoder DWORD = (buffer, offset, width) -> Integer.toUnsignedLong(buffer.getInt(offset));
    static final FieldDecoder LONG = (buffer, offset, width) -> buffer.getInt(offset);
    static final FieldDecoder DOUBLE = (buffer, offset, width) -> buffer.getDouble(offset);
    static final FieldDecoder USHORT = (buffer, offset, width) -> Short.toUnsignedInt(buffer.getShort(offset));
    static final FieldDecoder TEXT = SeqHeaderCodec::decodeText;

    /** Header fields in file order. */
    public static final List<Field> FIELDS = List.of(
            new Field("magic", 4, DWORD),
            new Field("name", 24, TEXT),
            new Field("version", 4, LONG),
            new Field("header_size", 4, LONG),
            new Field("description", 512, TEXT),
            new Field("width", 4, DWORD),
            new Field("height", 4, DWORD),
            new Field("bit_depth", 4, DWORD),
            new Field("bit_depth_real", 4, DWORD),
            new Field("image_size_bytes", 4, DWORD),
            new Field("image_format", 4, DWORD),
            new Field("allocated_frames", 4, DWORD),
            new Field("origin", 4, DWORD),
            new Field("true_image_size", 4, DWORD),
            new Field("suggested_frame_rate", 8, DOUBLE),
            new Field("description_format", 4, LONG),
            new Field("reference_frame", 4, DWORD),
            new Field("fixed_size", 4, DWORD),
            new Field("flags", 4, DWORD),
            new Field("bayer_pattern", 4, LONG),
            new Field("time_offset_us", 4, LONG),
            new Field("extended_header_size", 4, LONG),
            new Field("compression_format", 4, DWORD),
            new Field("reference_time_s", 4, LONG),
            new Field("reference_time_ms", 2, USHORT),
            new Field("reference_time_us", 2, USHORT));

    /** Number of bytes read from the start of a file to decode its header. */
    public static final int HEADER_SIZE = FIELDS.stream().mapToInt(Field::width).sum();

    private SeqHeaderCodec() {
        // utility class
    }

    /**
     * Decodes a header from the remaining bytes of {@code bytes}; the buffer
     * position is not changed.
     *
     * @throws FormatException if fewer than {@link #HEADER_SIZE} bytes remain or a text field is malformed
     */
    public static SeqHeader decode(ByteBuffer bytes) throws FormatException {
        requireNonNull(bytes, "bytes");
        if (bytes.remaining() < HEADER_SIZE) {
            throw new FormatException(
                    "SEQ header needs %d bytes, only %d available".formatted(HEADER_SIZE, bytes.remaining()));
        }
        ByteBuffer buffer = bytes.slice().order(ByteOrder.LITTLE_ENDIAN);
        Map<String, Object> values = new LinkedHashMap<>();
        int offset = 0;
        for (Field field : FIELDS) {
            values.put(field.name(), field.decoder().decode(buffer, offset, field.width()));
            offset += field.width();
        }
        return new SeqHeader(values);
    }

    public static SeqHeader decode(byte[] bytes) throws FormatException {
        return decode(ByteBuffer.wrap(bytes));
    }

    /**
     * Reads and decodes the header of a file.
     */
    public static SeqHeader read(Path path) throws IOException {
        try (RangeReader reader = FileRangeReader.of(path)) {
            return read(reader);
        }
    }

    public static SeqHeader read(RangeReader reader) throws IOException {
        ByteBuffer bytes = reader.readRange(0, HEADER_SIZE).flip();
        try {
            return decode(bytes);
        } catch (FormatException e) {
            throw new FormatException(reader.getSourceIdentifier() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks that the header describes an uncompressed monochrome SEQ file.
     *
     * @throws FormatException if the magic number is wrong
     * @throws UnsupportedFormatException if the images are compressed or not monochrome
     */
    public static void validate(SeqHeader header) throws DatasetException {
        if (header.magic() != MAGIC) {
            throw new FormatException("The format of this .seq file is unrecognized (magic 0x%04X)"
                    .formatted(header.magic()));
        }
        if (header.compressionFormat() != 0) {
            throw new UnsupportedFormatException("Only uncompressed images are supported in .seq files, "
                    + "compressed images use compression_format " + header.compressionFormat());
        }
        if (header.imageFormat() != MONOCHROME) {
            throw new UnsupportedFormatException(
                    "Non-monochrome images are not supported (image_format " + header.imageFormat() + ")");
        }
    }

    /**
     * UTF-16LE text ending at the first aligned {@code 0x0000} code unit, or at
     * the end of the field. A leading byte order mark is dropped.
     */
    static String decodeText(ByteBuffer buffer, int offset, int width) throws FormatException {
        int end = width;
        for (int i = 0; i + 1 < width; i += 2) {
            if (buffer.get(offset + i) == 0 && buffer.get(offset + i + 1) == 0) {
                end = i;
                break;
            }
        }
        int start = 0;
        if (end >= 2 && (buffer.get(offset) & 0xFF) == 0xFF && (buffer.get(offset + 1) & 0xFF) == 0xFE) {
            start = 2;
        }
        ByteBuffer text = buffer.slice(offset + start, end - start);
        CharsetDecoder decoder = StandardCharsets.UTF_16LE
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(text);
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new FormatException("undecodable UTF-16 text at header offset " + offset, e);
        }
    }
}
