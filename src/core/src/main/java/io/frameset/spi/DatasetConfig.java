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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Configuration for opening a {@link io.frameset.dataset.Dataset}: the path of
 * the main file, an optional explicit provider id, and provider-specific
 * parameter values.
 */
public class DatasetConfig {

    /** The key used in {@link Properties} to specify the dataset path. */
    public static final String PATH_KEY = "io.frameset.path";

    /** The key used in {@link Properties} to force a {@link DatasetProvider} by id. */
    public static final String PROVIDER_ID_KEY = "io.frameset.provider";

    private Path path;

    private String providerId;

    private final Map<String, Object> parameterValues = new LinkedHashMap<>();

    public DatasetConfig() {
        // Default constructor
    }

    public Path path() {
        return path;
    }

    /**
     * Sets the path of the dataset's main file.
     *
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public DatasetConfig path(Path path) {
        this.path = requireNonNull(path, "path can't be null");
        return this;
    }

    public DatasetConfig path(String path) {
        return path(Paths.get(requireNonNull(path, "path can't be null")));
    }

    public Optional<String> providerId() {
        return Optional.ofNullable(providerId);
    }

    public DatasetConfig providerId(String providerId) {
        this.providerId = providerId;
        return this;
    }

    /**
     * Sets a parameter value by its key. Values are not validated until they
     * are {@link #getParameter(String, Class) read} with a type.
     */
    public DatasetConfig setParameter(String key, Object value) {
        if (PROVIDER_ID_KEY.equals(key)) {
            this.providerId = value == null ? null : String.valueOf(value);
            return this;
        }
        if (PATH_KEY.equals(key)) {
            return value == null ? this : path(value instanceof Path p ? p : Paths.get(String.valueOf(value)));
        }
        this.parameterValues.put(requireNonNull(key, "key"), value);
        return this;
    }

    public <T> DatasetConfig setParameter(DatasetParameter<T> param, T value) {
        return setParameter(param.key(), value);
    }

    /**
     * @return the value of {@code param}, or its default value when not set
     */
    public <T> Optional<T> getParameter(DatasetParameter<T> param) {
        Optional<T> value = getParameter(param.key(), param.type());
        return value.isPresent() ? value : param.defaultValue();
    }

    /**
     * Checks that every {@link DatasetParameter#required() required} parameter
     * has a value, either set or as a default.
     *
     * @throws IllegalArgumentException naming the first missing parameter
     */
    public DatasetConfig checkRequired(List<DatasetParameter<?>> parameters) {
        for (DatasetParameter<?> param : parameters) {
            if (param.required() && getParameter(param).isEmpty()) {
                throw new IllegalArgumentException("%s is required to open %s".formatted(param.key(), path));
            }
        }
        return this;
    }

    public Optional<Object> getParameter(String key) {
        return getParameter(key, Object.class);
    }

    /**
     * Retrieves a parameter value converted to {@code type}.
     *
     * @throws IllegalArgumentException if the value cannot be converted to {@code type}
     */
    public <T> Optional<T> getParameter(String key, Class<T> type) {
        Object value = parameterValues.get(requireNonNull(key, "key"));
        requireNonNull(type, "type");
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(convert(value, type));
    }

    /**
     * Converts a parameter value. Supports {@code String}, {@code Boolean},
     * {@code Integer}, {@code Long} and {@code int[]}; integer arrays are read
     * from comma separated lists such as {@code "2,5"} or {@code "(2, 5)"}.
     */
    static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) return type.cast(value);

        Object converted;
        if (type.equals(String.class)) {
            converted = format(value);
        } else if (type.equals(Boolean.class)) {
            converted = Boolean.valueOf(String.valueOf(value));
        } else if (type.equals(Integer.class)) {
            converted = Integer.parseInt(String.valueOf(value).trim());
        } else if (type.equals(Long.class)) {
            converted = Long.parseLong(String.valueOf(value).trim());
        } else if (type.equals(int[].class)) {
            converted = parseInts(value);
        } else {
            throw new IllegalArgumentException("Unsupported conversion %s to %s"
                    .formatted(value.getClass().getCanonicalName(), type.getCanonicalName()));
        }
        return type.cast(converted);
    }

    private static int[] parseInts(Object value) {
        if (value instanceof Number n) {
            return new int[] {n.intValue()};
        }
        String text = String.valueOf(value).trim();
        if (text.startsWith("(") || text.startsWith("[")) {
            char close = text.charAt(0) == '(' ? ')' : ']';
            if (text.length() < 2 || text.charAt(text.length() - 1) != close) {
                throw new IllegalArgumentException("unbalanced brackets in list of integers: " + value);
            }
            text = text.substring(1, text.length() - 1);
        }
        try {
            return Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .mapToInt(Integer::parseInt)
                    .toArray();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a list of integers: " + value, e);
        }
    }

    private static String format(Object value) {
        if (value instanceof int[] ints) {
            return Arrays.stream(ints).mapToObj(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    /**
     * @return the path, provider id and all parameter values as strings
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        if (path != null) {
            properties.setProperty(PATH_KEY, path.toString());
        }
        if (providerId != null) {
            properties.setProperty(PROVIDER_ID_KEY, providerId);
        }
        parameterValues.forEach((name, v) -> {
            if (v != null) {
                properties.setProperty(name, format(v));
            }
        });
        return properties;
    }

    /**
     * Creates a config from {@link Properties}, which must contain {@link #PATH_KEY}.
     *
     * @throws NullPointerException if the path is missing
     */
    public static DatasetConfig fromProperties(Properties properties) {
        requireNonNull(properties);
        Object pathValue = requireNonNull(properties.get(PATH_KEY), "Properties must include " + PATH_KEY);

        DatasetConfig config = new DatasetConfig();
        properties.forEach((k, v) -> config.setParameter(String.valueOf(k), v));
        return config.path(pathValue instanceof Path p ? p : Paths.get(pathValue.toString()));
    }

    /**
     * Creates a config holding the default values of {@code parameters}.
     */
    public static DatasetConfig withDefaults(List<DatasetParameter<?>> parameters) {
        DatasetConfig config = new DatasetConfig();
        parameters.stream()
                .filter(p -> p.defaultValue().isPresent())
                .forEach(p -> config.setParameter(p.key(), p.defaultValue().orElseThrow()));
        return config;
    }

    /**
     * Checks whether {@code config} can be handled by the provider {@code providerId}
     * reading files with one of {@code extensions}. A forced provider id must match;
     * otherwise the file extension decides, case-insensitively.
     */
    public static boolean matches(DatasetConfig config, String providerId, String... extensions) {
        requireNonNull(config, "config parameter is null");
        requireNonNull(providerId, "providerId parameter is null");
        if (config.providerId().isPresent()) {
            return config.providerId().orElseThrow().equalsIgnoreCase(providerId);
        }
        Path path = requireNonNull(config.path(), "config path is null");
        return extensionOf(path).map(ext -> Arrays.asList(extensions).contains(ext)).orElse(false);
    }

    /**
     * @return the lower case extension of the file name, without the dot
     */
    public static Optional<String> extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? Optional.empty() : Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "DatasetConfig[path=%s, provider=%s, parameters=%s]".formatted(path, providerId, toProperties());
    }
}
