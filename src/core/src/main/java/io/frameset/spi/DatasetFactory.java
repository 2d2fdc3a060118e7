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

import io.frameset.dataset.Dataset;
import io.frameset.executor.JobExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A factory for opening {@link Dataset} instances.
 * This factory uses the Java Service Provider Interface (SPI) to discover
 * available {@link DatasetProvider} implementations at runtime.
 */
public final class DatasetFactory {
    private static final Logger logger = LoggerFactory.getLogger(DatasetFactory.class);

    private DatasetFactory() {
        // Private constructor to prevent instantiation of this utility class.
    }

    /**
     * Probes {@code path} with every available provider, those claiming the
     * file extension first, and returns the first configuration found.
     *
     * @param path the file to probe
     * @return a configuration naming the provider that recognized the file, or empty
     */
    public static Optional<DatasetConfig> detect(Path path) {
        return detect(path, DatasetProvider.getAvailableProviders());
    }

    static Optional<DatasetConfig> detect(Path path, List<DatasetProvider> providers) {
        requireNonNull(path, "path");
        final DatasetConfig byPath = new DatasetConfig().path(path);
        Comparator<DatasetProvider> extensionFirst =
                Comparator.comparing(p -> p.canProcess(byPath) ? 0 : 1);
        return providers.stream()
                .sorted(extensionFirst.thenComparingInt(DatasetProvider::getOrder))
                .flatMap(p -> probe(p, path))
                .findFirst();
    }

    private static Stream<DatasetConfig> probe(DatasetProvider provider, Path path) {
        Optional<DatasetConfig> config = provider.detect(path);
        logger.debug("{} provider {} {}", path, provider.getId(), config.isPresent() ? "matched" : "did not match");
        return config.map(c -> c.providerId(provider.getId())).stream();
    }

    /**
     * Detects the format of {@code path} and opens it with the detected parameters.
     *
     * @throws IOException if no provider recognizes the file or it cannot be opened
     */
    public static Dataset open(Path path, JobExecutor executor) throws IOException {
        DatasetConfig config = detect(path).orElseThrow(() -> new IOException("Unrecognized dataset format: " + path));
        return open(config, executor);
    }

    /**
     * Opens a dataset described by {@link Properties}, which must include {@link DatasetConfig#PATH_KEY}.
     */
    public static Dataset open(Properties config, JobExecutor executor) throws IOException {
        return open(DatasetConfig.fromProperties(requireNonNull(config)), executor);
    }

    /**
     * Opens a dataset using the best available provider for the given configuration.
     * <ol>
     *   <li>If a provider ID is explicitly set in the config, only that provider is considered.</li>
     *   <li>Otherwise the providers that {@link DatasetProvider#canProcess(DatasetConfig) can process}
     *       the file extension are candidates, resolved by {@link DatasetProvider#getOrder() priority}.</li>
     * </ol>
     *
     * @throws IllegalStateException If no suitable provider is found or if there is an unresolvable ambiguity.
     */
    public static Dataset open(DatasetConfig config, JobExecutor executor) throws IOException {
        DatasetProvider provider = findBestProvider(requireNonNull(config));
        logger.debug("Opening {} with provider {}", config.path(), provider.getId());
        config.checkRequired(provider.getParameters());
        return provider.create(config, requireNonNull(executor, "executor"));
    }

    /**
     * Finds the best {@link DatasetProvider} for the given configuration.
     *
     * @throws IllegalStateException If no suitable provider is found or if there is an unresolvable ambiguity.
     */
    public static DatasetProvider findBestProvider(DatasetConfig config) {
        return findBestProvider(config, DatasetProvider.getAvailableProviders());
    }

    static DatasetProvider findBestProvider(DatasetConfig config, List<DatasetProvider> providers) {
        final Path path = requireNonNull(config.path(), "config path");
        if (config.providerId().isPresent()) {
            String providerId = config.providerId().orElseThrow();
            return providers.stream()
                    .filter(p -> p.getId().equalsIgnoreCase(providerId))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException(
                            "The specified DatasetProvider is not found or not available: " + providerId));
        }
        List<DatasetProvider> candidates =
                providers.stream().filter(p -> p.canProcess(config)).toList();
        return switch (candidates.size()) {
            case 0 -> throw new IllegalStateException("No suitable provider found for path: " + path);
            case 1 -> candidates.get(0);
            default -> resolveByPriority(candidates);
        };
    }

    private static DatasetProvider resolveByPriority(List<DatasetProvider> candidates) {
        final int highestPriority = candidates.stream()
                .mapToInt(DatasetProvider::getOrder)
                .min()
                .orElseThrow(() -> new IllegalStateException("No candidates to resolve by priority."));
        List<DatasetProvider> bestCandidates = candidates.stream()
                .filter(p -> p.getOrder() == highestPriority)
                .toList();

        if (bestCandidates.size() > 1) {
            String conflictingIds =
                    bestCandidates.stream().map(DatasetProvider::getId).collect(Collectors.joining(", "));
            throw new IllegalStateException(
                    "Format ambiguity detected. Multiple providers matched with the same priority ("
                            + highestPriority + "): [" + conflictingIds + "]. "
                            + "Please specify a provider ID in the DatasetConfig to resolve this ambiguity.");
        }
        return bestCandidates.get(0);
    }
}
