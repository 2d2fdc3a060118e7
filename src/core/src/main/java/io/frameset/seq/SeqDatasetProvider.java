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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.frameset.executor.JobExecutor;
import io.frameset.spi.DatasetConfig;
import io.frameset.spi.DatasetParameter;
import io.frameset.spi.DatasetProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link DatasetProvider} opening Norpix SEQ files as {@link SeqDataset}s.
 * <p>
 * Decoded headers are kept in a small cache keyed on path, size and
 * modification time, so that detecting a file and then opening it reads the
 * header once.
 */
public class SeqDatasetProvider implements DatasetProvider {

    /**
     * Key used as environment variable name to disable this dataset provider
     * <pre>
     * {@code export IO_FRAMESET_SEQ=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_FRAMESET_SEQ";

    /**
     * This provider's {@link #getId() unique identifier}
     */
    public static final String ID = "seq";

    /** Maximum number of decoded headers kept per provider instance. */
    public static final long HEADER_CACHE_SIZE = 256;

    public static final DatasetParameter<int[]> SCAN_SIZE = DatasetParameter.builder()
            .key("scan_size")
            .title("Scan size")
            .description(
                    """
                    Navigation shape of the dataset, e.g. "32,32" for a 32 x 32 scan. \
                    The product of its dimensions must equal the number of frames in the file.
                    """)
            .type(int[].class)
            .required(true)
            .options(new int[] {32, 32}, new int[] {1024})
            .build();

    public static final DatasetParameter<Integer> PARTITIONS = DatasetParameter.builder()
            .key("partitions")
            .title("Number of partitions")
            .description(
                    """
                    Number of partitions the frames are split into. \
                    0 derives it from the file size and the number of workers.
                    """)
            .group(DatasetParameter.GROUP_PARTITIONING)
            .type(Integer.class)
            .defaultValue(0)
            .build();

    private record HeaderKey(Path path, long size, FileTime lastModified) {}

    private final SeqDataset.HeaderReader headerReader;

    private final Cache<HeaderKey, SeqHeader> headers;

    public SeqDatasetProvider() {
        this(SeqHeaderCodec::read);
    }

    SeqDatasetProvider(SeqDataset.HeaderReader headerReader) {
        this.headerReader = requireNonNull(headerReader, "headerReader");
        this.headers = Caffeine.newBuilder().maximumSize(HEADER_CACHE_SIZE).build();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Reads uncompressed monochrome Norpix SEQ files.";
    }

    @Override
    public boolean isAvailable() {
        return DatasetProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public List<DatasetParameter<?>> getParameters() {
        return List.of(SCAN_SIZE, PARTITIONS);
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return SeqDataset.SUPPORTED_EXTENSIONS;
    }

    @Override
    public Optional<DatasetConfig> detect(Path path) {
        return SeqDataset.detectParams(path, this::readHeader);
    }

    /**
     * @throws IllegalArgumentException if the configuration has no scan size
     */
    @Override
    public SeqDataset create(DatasetConfig config, JobExecutor executor) throws IOException {
        requireNonNull(config, "config");
        Path path = requireNonNull(config.path(), "config path");
        int[] scanSize = config.checkRequired(getParameters()).getParameter(SCAN_SIZE).orElseThrow();
        return SeqDataset.builder()
                .path(path)
                .scanSize(scanSize)
                .partitionCount(config.getParameter(PARTITIONS).orElse(0))
                .headerReader(this::readHeader)
                .build()
                .initialize(executor);
    }

    SeqHeader readHeader(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
        HeaderKey key = new HeaderKey(absolute, attributes.size(), attributes.lastModifiedTime());
        try {
            return headers.get(key, this::loadHeader);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private SeqHeader loadHeader(HeaderKey key) {
        try {
            return headerReader.read(key.path());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    long cachedHeaderCount() {
        headers.cleanUp();
        return headers.estimatedSize();
    }
}
