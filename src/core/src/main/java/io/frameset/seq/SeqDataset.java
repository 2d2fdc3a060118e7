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

import io.frameset.correction.CorrectionLoader;
import io.frameset.correction.CorrectionSet;
import io.frameset.dataset.ConfigurationMismatchException;
import io.frameset.dataset.DataType;
import io.frameset.dataset.Dataset;
import io.frameset.dataset.DatasetException;
import io.frameset.dataset.DatasetMeta;
import io.frameset.dataset.Diagnostic;
import io.frameset.dataset.FileDescriptor;
import io.frameset.dataset.FileSet;
import io.frameset.dataset.Partition;
import io.frameset.dataset.Partitioner;
import io.frameset.dataset.Shape;
import io.frameset.dataset.Slice;
import io.frameset.executor.InlineJobExecutor;
import io.frameset.executor.JobExecutor;
import io.frameset.spi.DatasetConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * A single Norpix SEQ file viewed as a dataset of shape
 * {@code scanSize + (height, width)}.
 * <p>
 * A {@code SeqDataset} is created unopened by its {@link Builder} and becomes
 * usable once {@link #initialize(JobExecutor)} succeeds; a failed
 * initialization leaves it unopened. Once opened it is immutable and can hand
 * out partitions to any number of threads.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (JobExecutor executor = new ConcurrentJobExecutor(4)) {
 *     SeqDataset dataset = SeqDataset.builder()
 *             .path(Paths.get("scan.seq"))
 *             .scanSize(32, 32)
 *             .build()
 *             .initialize(executor);
 *     Job job = new SumFramesJob(dataset, dataset.getCorrections(), Partition.DEFAULT_TILE_BYTES);
 *     DenseArray sum = executor.runJob(job);
 * }
 * }</pre>
 */
@Slf4j
public class SeqDataset implements Dataset {

    /** File extensions of SEQ files. */
    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("seq");

    /**
     * Reads the header of a SEQ file.
     */
    @FunctionalInterface
    public interface HeaderReader {
        SeqHeader read(Path path) throws IOException;
    }

    /**
     * Identifies the content of an opened dataset for result caches.
     *
     * @param path the SEQ file
     * @param shape the dataset shape
     */
    public record CacheKey(Path path, Shape shape) {}

    private record State(
            SeqHeader header,
            SeqGeometry geometry,
            long fileSize,
            DatasetMeta meta,
            CorrectionSet corrections,
            int workers) {}

    private final Path path;
    private final int[] scanSize;
    private final int partitionCount;
    private final CorrectionLoader correctionLoader;
    private final HeaderReader headerReader;

    private volatile State state;

    private SeqDataset(Builder builder) {
        this.path = requireNonNull(builder.path, "path");
        this.scanSize = checkScanSize(builder.scanSize);
        if (builder.partitionCount < 0) {
            throw new IllegalArgumentException("partitionCount must not be negative: " + builder.partitionCount);
        }
        this.partitionCount = builder.partitionCount;
        this.correctionLoader = requireNonNull(builder.correctionLoader, "correctionLoader");
        this.headerReader = requireNonNull(builder.headerReader, "headerReader");
    }

    private static int[] checkScanSize(int[] scanSize) {
        requireNonNull(scanSize, "scanSize");
        if (scanSize.length == 0) {
            throw new IllegalArgumentException("scanSize needs at least one dimension");
        }
        for (int dim : scanSize) {
            if (dim < 0) {
                throw new IllegalArgumentException("negative scanSize dimension: " + Arrays.toString(scanSize));
            }
        }
        return scanSize.clone();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Opens a SEQ file on the calling thread.
     *
     * @param path the SEQ file
     * @param scanSize navigation shape, whose product must equal the number of frames in the file
     * @return the opened dataset
     * @throws IOException if the file cannot be read, is not a supported SEQ file or does not match {@code scanSize}
     */
    public static SeqDataset open(Path path, int... scanSize) throws IOException {
        try (JobExecutor executor = new InlineJobExecutor()) {
            return builder().path(path).scanSize(scanSize).build().initialize(executor);
        }
    }

    /**
     * Reads the header, derives the frame layout and loads correction files,
     * running the I/O through {@code executor}.
     *
     * @return this dataset, opened
     * @throws ConfigurationMismatchException if the product of the scan size differs from the frame count
     * @throws IOException if reading or decoding fails; the dataset stays unopened
     */
    public SeqDataset initialize(JobExecutor executor) throws IOException {
        requireNonNull(executor, "executor");
        final int workers = executor.getWorkerCount();
        this.state = executor.runFunction(() -> doInitialize(workers));
        return this;
    }

    private State doInitialize(int workers) throws IOException {
        SeqHeader header = headerReader.read(path);
        SeqHeaderCodec.validate(header);
        long fileSize = Files.size(path);
        SeqGeometry geometry = SeqGeometry.derive(header, fileSize);

        long navSize;
        try {
            navSize = new Shape(scanSize, 0).size();
        } catch (ArithmeticException e) {
            throw new ConfigurationMismatchException(
                    "scan_size doesn't match number of frames: %s overflows, %s has %d"
                            .formatted(Arrays.toString(scanSize), path.getFileName(), geometry.frameCount()),
                    e);
        }
        if (navSize != geometry.frameCount()) {
            throw new ConfigurationMismatchException(
                    "scan_size doesn't match number of frames: %s holds %d, %s has %d"
                            .formatted(Arrays.toString(scanSize), navSize, path.getFileName(), geometry.frameCount()));
        }
        Shape shape = Shape.of(scanSize, geometry.sigShape().toArray());
        DatasetMeta meta = new DatasetMeta(shape, geometry.dataType());
        CorrectionSet corrections = correctionLoader.load(path);

        log.info(
                "Opened {}: {} frames of {} {}, version {}, footer {} bytes, corrections {}",
                path,
                geometry.frameCount(),
                geometry.dataType(),
                geometry.sigShape(),
                header.version(),
                geometry.footerSize(),
                corrections);
        return new State(header, geometry, fileSize, meta, corrections, workers);
    }

    private State state() {
        State current = state;
        if (current == null) {
            throw new IllegalStateException("dataset " + path + " is not initialized");
        }
        return current;
    }

    public boolean isInitialized() {
        return state != null;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Shape getShape() {
        return state().meta().shape();
    }

    @Override
    public DataType getDataType() {
        return state().meta().dataType();
    }

    public DatasetMeta getMeta() {
        return state().meta();
    }

    public SeqHeader getHeader() {
        return state().header();
    }

    public SeqGeometry getGeometry() {
        return state().geometry();
    }

    /**
     * @return the dark frame and gain map found next to the file, possibly {@link CorrectionSet#NONE}
     */
    public CorrectionSet getCorrections() {
        return state().corrections();
    }

    /**
     * @return a file set with the single descriptor of this file, covering all frames
     */
    public FileSet getFileSet() {
        State s = state();
        SeqGeometry geometry = s.geometry();
        return FileSet.of(FileDescriptor.of(
                path,
                0,
                geometry.frameCount(),
                geometry.dataType(),
                geometry.sigShape(),
                0,
                geometry.footerSize(),
                geometry.imageOffset()));
    }

    /**
     * Number of partitions {@link #getPartitions()} creates: the configured
     * count, or one per worker and per {@link Partitioner#BYTES_PER_PARTITION}
     * of file size, never more than there are frames.
     */
    public int getPartitionCount() {
        State s = state();
        int count = partitionCount > 0 ? partitionCount : Partitioner.defaultPartitionCount(s.fileSize(), s.workers());
        return (int) Math.min(count, Math.max(1, s.geometry().frameCount()));
    }

    @Override
    public List<Partition> getPartitions() {
        State s = state();
        FileSet fileSet = getFileSet();
        List<Slice> slices =
                Partitioner.plan(s.geometry().frameCount(), getPartitionCount(), s.geometry().sigShape());
        List<Partition> partitions = new ArrayList<>(slices.size());
        for (Slice slice : slices) {
            partitions.add(new Partition(s.meta(), fileSet.restrict(slice.start(), slice.end()), slice));
        }
        return partitions;
    }

    /**
     * Every header field in file order, followed by the footer size and
     * whether dark frame and gain map were found.
     */
    public List<Diagnostic> getDiagnostics() {
        State s = state();
        List<Diagnostic> diagnostics = new ArrayList<>();
        s.header().asMap().forEach((name, value) -> diagnostics.add(Diagnostic.of(name, value)));
        diagnostics.add(Diagnostic.of("Footer size", s.geometry().footerSize()));
        diagnostics.add(Diagnostic.of("Dark frame included", s.corrections().hasDark()));
        diagnostics.add(Diagnostic.of("Gain map included", s.corrections().hasGain()));
        return List.copyOf(diagnostics);
    }

    /**
     * Re-checks that the header describes an uncompressed monochrome SEQ file.
     *
     * @throws DatasetException describing the first failed check
     */
    public void checkValid() throws DatasetException {
        SeqHeaderCodec.validate(state().header());
    }

    public CacheKey getCacheKey() {
        return new CacheKey(path, getShape());
    }

    public Set<String> getSupportedExtensions() {
        return SUPPORTED_EXTENSIONS;
    }

    /**
     * Guesses the parameters needed to open {@code path}: a single navigation
     * axis holding every frame of the file.
     *
     * @return the configuration, or empty if the file cannot be read or is not a SEQ file
     */
    public static Optional<DatasetConfig> detectParams(Path path) {
        return detectParams(path, SeqHeaderCodec::read);
    }

    static Optional<DatasetConfig> detectParams(Path path, HeaderReader headerReader) {
        requireNonNull(path, "path");
        try {
            SeqHeader header = headerReader.read(path);
            if (header.magic() != SeqHeaderCodec.MAGIC) {
                log.debug("{} is not a SEQ file, magic 0x{}", path, Long.toHexString(header.magic()));
                return Optional.empty();
            }
            long frameCount = SeqGeometry.frameCount(header, Files.size(path));
            int[] scanSize = {(int) Math.min(frameCount, Integer.MAX_VALUE)};
            return Optional.of(new DatasetConfig().path(path).setParameter(SeqDatasetProvider.SCAN_SIZE, scanSize));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to probe {} as a SEQ file: {}", path, e.getMessage());
            log.debug("Probe failure", e);
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        State s = state;
        if (s == null) {
            return "<SeqDataset %s (not initialized)>".formatted(path);
        }
        return "<SeqDataset of %s shape=%s>".formatted(s.meta().dataType(), s.meta().shape());
    }

    /**
     * Builder for unopened {@link SeqDataset}s.
     */
    public static class Builder {
        private Path path;
        private int[] scanSize;
        private int partitionCount;
        private CorrectionLoader correctionLoader = new CorrectionLoader();
        private HeaderReader headerReader = SeqHeaderCodec::read;

        private Builder() {}

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder scanSize(int... scanSize) {
            this.scanSize = scanSize;
            return this;
        }

        /**
         * @param partitionCount number of partitions, {@code 0} to derive it from file size and worker count
         */
        public Builder partitionCount(int partitionCount) {
            this.partitionCount = partitionCount;
            return this;
        }

        public Builder correctionLoader(CorrectionLoader correctionLoader) {
            this.correctionLoader = correctionLoader;
            return this;
        }

        public Builder headerReader(HeaderReader headerReader) {
            this.headerReader = headerReader;
            return this;
        }

        /**
         * @throws NullPointerException if path or scan size is missing
         * @throws IllegalArgumentException if the scan size is empty or negative
         */
        public SeqDataset build() {
            return new SeqDataset(this);
        }
    }
}
