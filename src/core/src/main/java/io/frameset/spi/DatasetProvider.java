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

import io.frameset.dataset.Dataset;
import io.frameset.executor.JobExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Service Provider Interface (SPI) for opening {@link Dataset} instances of a
 * particular file format. Implementations are discovered at runtime using
 * {@link ServiceLoader}.
 */
public interface DatasetProvider {

    /**
     * Returns the unique identifier for this provider.
     *
     * @return The unique ID.
     */
    String getId();

    /**
     * Returns a human-readable description of this provider.
     *
     * @return The description.
     */
    String getDescription();

    /**
     * Checks if this provider is available in the current environment.
     *
     * @return {@code true} if available, {@code false} otherwise.
     */
    boolean isAvailable();

    /**
     * Returns a list of configuration parameters supported by this provider.
     *
     * @return A list of {@link DatasetParameter}s.
     */
    List<DatasetParameter<?>> getParameters();

    /**
     * Returns the default configuration for this provider, populated with default values.
     *
     * @return The default {@link DatasetConfig}.
     */
    default DatasetConfig getDefaultConfig() {
        return DatasetConfig.withDefaults(getParameters());
    }

    /**
     * @return the lower case file extensions, without the dot, this provider reads
     */
    Set<String> getSupportedExtensions();

    /**
     * Performs a fast, static check to see if this provider can likely handle the given config.
     * This check is based on the forced provider id and the file extension only, without I/O.
     *
     * @param config The configuration to check.
     * @return {@code true} if this provider can likely handle the config, {@code false} otherwise.
     */
    default boolean canProcess(DatasetConfig config) {
        return DatasetConfig.matches(config, getId(), getSupportedExtensions().toArray(String[]::new));
    }

    /**
     * Inspects the file at {@code path} and guesses the parameters needed to open it.
     * Never throws: any failure to read or recognize the file yields an empty result.
     *
     * @param path the file to probe
     * @return a configuration able to open the file, or empty if the format is not recognized
     */
    Optional<DatasetConfig> detect(Path path);

    /**
     * Gets the order value of this provider. Lower values have higher priority.
     * The default priority is 0.
     *
     * @return The order value.
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Opens and initializes a {@link Dataset}.
     *
     * @param config The configuration, including the path of the main file.
     * @param executor The executor used to run the initialization and later jobs.
     * @return A fully initialized {@link Dataset}.
     * @throws IOException If the file cannot be read or does not match the configuration.
     */
    Dataset create(DatasetConfig config, JobExecutor executor) throws IOException;

    /**
     * Checks if a feature is enabled via a system property or environment variable.
     * The property is checked first, then the environment variable.
     * If neither is set, it defaults to {@code true}.
     *
     * @param key The key for the system property/environment variable.
     * @return {@code true} if enabled, {@code false} otherwise.
     */
    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null ? true : Boolean.parseBoolean(enabled);
    }

    /**
     * Finds all {@link DatasetProvider} implementations using the {@link ServiceLoader}.
     *
     * @return A stream of providers.
     */
    static Stream<DatasetProvider> findProviders() {
        ServiceLoader<DatasetProvider> loader = ServiceLoader.load(DatasetProvider.class);
        return loader.stream().map(Provider::get);
    }

    /**
     * Returns all registered {@link DatasetProvider}s that are {@link DatasetProvider#isAvailable() available}.
     *
     * @return A list of available providers.
     */
    static List<DatasetProvider> getAvailableProviders() {
        return findProviders().filter(DatasetProvider::isAvailable).toList();
    }

    /**
     * Finds a specific {@link DatasetProvider} by its ID.
     *
     * @param providerId The ID of the provider to find.
     * @return An {@link Optional} containing the provider if found, otherwise empty.
     */
    static Optional<DatasetProvider> findProvider(String providerId) {
        return findProviders()
                .filter(p -> p.getId().equalsIgnoreCase(providerId))
                .findFirst();
    }
}
