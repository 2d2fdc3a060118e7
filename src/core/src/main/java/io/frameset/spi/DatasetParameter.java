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
package io.frameset.spi;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Optional;

/**
 * Describes a configuration parameter of a {@link DatasetProvider}: its key,
 * human-readable title and description, value type, default value and sample
 * values for user interfaces.
 *
 * @param <T> The type of the parameter's value.
 * @param key The unique key identifying the parameter.
 * @param title A human-readable title of the parameter.
 * @param description A human-readable description of the parameter.
 * @param group A logical grouping for the parameter (e.g., "dataset", "partitioning").
 * @param type The {@link Class} representing the type of the parameter's value.
 * @param required Whether a dataset cannot be opened without a value for this parameter.
 * @param defaultValue An {@link Optional} containing the default value of the parameter, if any.
 * @param sampleValues A list of sample or suggested values for the parameter.
 */
public record DatasetParameter<T>(
        String key,
        String title,
        String description,
        String group,
        Class<T> type,
        boolean required,
        Optional<T> defaultValue,
        List<T> sampleValues) {

    /** Parameter group of the parameters locating and shaping a dataset. */
    public static final String GROUP_DATASET = "dataset";
    /** Parameter group of the parameters controlling how work is split. */
    public static final String GROUP_PARTITIONING = "partitioning";

    public DatasetParameter {
        requireNonNull(key, "Parameter key cannot be null");
        requireNonNull(title, "Parameter title cannot be null");
        requireNonNull(description, "Parameter description cannot be null");
        requireNonNull(group, "Parameter group cannot be null");
        requireNonNull(type, "Parameter type cannot be null");
        requireNonNull(defaultValue, "Parameter default value optional cannot be null");
        sampleValues = List.copyOf(requireNonNull(sampleValues, "Parameter sample values list cannot be null"));
    }

    /**
     * Creates a new {@link Builder} for constructing a {@link DatasetParameter}.
     *
     * @return A new {@link Builder} instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder class for {@link DatasetParameter}.
     */
    public static class Builder {
        String key;
        String title;
        String description = "";
        String group = GROUP_DATASET;
        boolean required;

        @SuppressWarnings("rawtypes")
        Class type;

        Optional<Object> defaultValue = Optional.empty();
        List<Object> sampleValues = List.of();

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(Class<?> type) {
            this.type = type;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = Optional.ofNullable(defaultValue);
            return this;
        }

        /**
         * Sets a list of sample or suggested values for the parameter.
         *
         * @param values An array of sample values.
         * @return This builder instance.
         */
        public Builder options(Object... values) {
            this.sampleValues = values == null || values.length == 0 ? List.of() : List.of(values);
            return this;
        }

        /**
         * Builds a new {@link DatasetParameter} instance.
         *
         * @param <T> The type of the parameter value.
         * @return A new {@link DatasetParameter}.
         * @throws NullPointerException if key, title or type is {@code null}.
         */
        @SuppressWarnings({"unchecked", "rawtypes"})
        public <T> DatasetParameter<T> build() {
            return new DatasetParameter(
                    key, title, description, group, type, required, defaultValue, sampleValues);
        }
    }
}
