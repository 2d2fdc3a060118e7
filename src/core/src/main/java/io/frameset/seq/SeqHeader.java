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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded header of a SEQ file: field names mapped to values in file order.
 * <p>
 * Unsigned 32 bit fields are held as {@link Long}, signed 32 bit and unsigned
 * 16 bit fields as {@link Integer}, text fields as {@link String}.
 */
public final class SeqHeader {

    private final Map<String, Object> fields;

    SeqHeader(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(fields)));
    }

    /**
     * @return all decoded fields in file order
     */
    public Map<String, Object> asMap() {
        return fields;
    }

    /**
     * @throws IllegalArgumentException if there is no such field
     */
    public Object get(String name) {
        Object value = fields.get(name);
        if (value == null) {
            throw new IllegalArgumentException("no header field " + name);
        }
        return value;
    }

    public long getLong(String name) {
        return ((Number) get(name)).longValue();
    }

    public long magic() {
        return getLong("magic");
    }

    public String name() {
        return (String) get("name");
    }

    public int version() {
        return (int) getLong("version");
    }

    public String description() {
        return (String) get("description");
    }

    public long width() {
        return getLong("width");
    }

    public long height() {
        return getLong("height");
    }

    public long bitDepth() {
        return getLong("bit_depth");
    }

    public long imageFormat() {
        return getLong("image_format");
    }

    public long trueImageSize() {
        return getLong("true_image_size");
    }

    public double suggestedFrameRate() {
        return ((Number) get("suggested_frame_rate")).doubleValue();
    }

    public long compressionFormat() {
        return getLong("compression_format");
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SeqHeader other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "SeqHeader" + fields;
    }
}
