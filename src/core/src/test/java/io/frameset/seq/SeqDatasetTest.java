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

import static io.frameset.seq.SeqTestFiles.seq;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.frameset.correction.CorrectionLoader;
import io.frameset.correction.MrcTestFiles;
import io.frameset.dataset.ConfigurationMismatchException;
import io.frameset.dataset.DataType;
import io.frameset.dataset.Diagnostic;
import io.frameset.dataset.FileDescriptor;
import io.frameset.dataset.FileSet;
import io.frameset.dataset.FormatException;
import io.frameset.dataset.Partition;
import io.frameset.dataset.Shape;
import io.frameset.dataset.UnsupportedFormatException;
import io.frameset.executor.InlineJobExecutor;
import io.frameset.executor.JobExecutor;
import io.frameset.spi.DatasetConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SeqDatasetTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        file = seq().footer(8).frames(10).write(tempDir.resolve("scan.seq"));
    }

    @Test
    void testOpen() throws IOException {
        SeqDataset dataset = SeqDataset.open(file, 2, 5);

        assertTrue(dataset.isInitialized());
        assertEquals(new Shape(new int[] {2, 5, 4, 4}, 2), dataset.getShape());
        assertEquals(DataType.UINT16, dataset.getDataType());
        assertEquals(10, dataset.getGeometry().frameCount());
        assertEquals(8, dataset.getGeometry().footerSize());
        assertEquals("Norpix seq", dataset.getHeader().name());
        assertTrue(dataset.getCorrections().isEmpty());
        assertEquals("<SeqDataset of UINT16 shape=(2, 5, 4, 4)>", dataset.toString());
    }

    @Test
    void testOpenEightBit() throws IOException {
        Path bytes = seq().bitDepth(8).frames(10).write(tempDir.resolve("bytes.seq"));

        SeqDataset dataset = SeqDataset.open(bytes, 2, 5);

        assertEquals(new Shape(new int[] {2, 5, 4, 4}, 2), dataset.getShape());
        assertEquals(DataType.UINT8, dataset.getDataType());
        assertEquals(10, dataset.getGeometry().frameCount());
        assertEquals(16, dataset.getGeometry().frameSizeBytes());
        assertEquals(0, dataset.getGeometry().footerSize());
        assertEquals("<SeqDataset of UINT8 shape=(2, 5, 4, 4)>", dataset.toString());
    }

    @Test
    void testScanSizeOverflow() {
        ConfigurationMismatchException e = assertThrows(
                ConfigurationMismatchException.class, () -> SeqDataset.open(file, 65536, 65536, 65536, 65536));
        assertThat(e).hasMessageContaining("scan_size doesn't match number of frames");
        assertThat(e).hasCauseInstanceOf(ArithmeticException.class);
    }

    @Test
    void testScanSizeMismatch() {
        ConfigurationMismatchException e =
                assertThrows(ConfigurationMismatchException.class, () -> SeqDataset.open(file, 3, 3));
        assertThat(e).hasMessageContaining("scan_size doesn't match number of frames");
    }

    @Test
    void testFailedInitializationLeavesDatasetUnopened() {
        SeqDataset dataset = SeqDataset.builder().path(file).scanSize(3, 3).build();

        assertThrows(ConfigurationMismatchException.class, () -> dataset.initialize(new InlineJobExecutor()));
        assertFalse(dataset.isInitialized());
        assertThrows(IllegalStateException.class, dataset::getShape);
        assertThrows(IllegalStateException.class, dataset::getPartitions);
        assertThat(dataset.toString()).contains("not initialized");
    }

    @Test
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> SeqDataset.builder().scanSize(10).build());
        assertThrows(NullPointerException.class, () -> SeqDataset.builder().path(file).build());
        assertThrows(IllegalArgumentException.class, () -> SeqDataset.builder().path(file).scanSize().build());
        assertThrows(IllegalArgumentException.class, () -> SeqDataset.builder().path(file).scanSize(-1, 10).build());
        assertThrows(IllegalArgumentException.class, () -> SeqDataset.builder()
                .path(file)
                .scanSize(10)
                .partitionCount(-1)
                .build());
    }

    @Test
    void testUnsupportedFiles() throws IOException {
        Path compressed = seq().compressionFormat(1).write(tempDir.resolve("compressed.seq"));
        Path color = seq().imageFormat(200).write(tempDir.resolve("color.seq"));
        Path notSeq = seq().magic(0xBEEF).write(tempDir.resolve("other.seq"));

        assertThrows(UnsupportedFormatException.class, () -> SeqDataset.open(compressed, 10));
        assertThrows(UnsupportedFormatException.class, () -> SeqDataset.open(color, 10));
        assertThrows(FormatException.class, () -> SeqDataset.open(notSeq, 10));
        assertThrows(NoSuchFileException.class, () -> SeqDataset.open(tempDir.resolve("missing.seq"), 10));
    }

    @Test
    void testTrailingPartialFrameIsIgnored() throws IOException {
        Path partial = seq().frames(6).trailingBytes(20).write(tempDir.resolve("partial.seq"));
        SeqDataset dataset = SeqDataset.open(partial, 6);
        assertEquals(6, dataset.getGeometry().frameCount());
    }

    @Test
    void testInitializeRunsThroughExecutor() throws Exception {
        JobExecutor executor = mock(JobExecutor.class);
        when(executor.getWorkerCount()).thenReturn(4);
        when(executor.runFunction(any())).thenAnswer(invocation -> {
            Callable<?> function = invocation.getArgument(0);
            return function.call();
        });

        SeqDataset dataset =
                SeqDataset.builder().path(file).scanSize(10).build().initialize(executor);

        verify(executor).runFunction(any());
        assertEquals(4, dataset.getPartitionCount());
        assertThat(dataset.getPartitions()).hasSize(4);
    }

    @Test
    void testHeaderReaderFailure() throws IOException {
        SeqDataset.HeaderReader headerReader = mock(SeqDataset.HeaderReader.class);
        when(headerReader.read(file)).thenThrow(new IOException("disk on fire"));

        SeqDataset dataset = SeqDataset.builder()
                .path(file)
                .scanSize(10)
                .headerReader(headerReader)
                .build();

        IOException e = assertThrows(IOException.class, () -> dataset.initialize(new InlineJobExecutor()));
        assertEquals("disk on fire", e.getMessage());
        assertFalse(dataset.isInitialized());
    }

    @Test
    void testFileSet() throws IOException {
        SeqDataset dataset = SeqDataset.open(file, 10);

        FileSet fileSet = dataset.getFileSet();

        assertThat(fileSet.files()).hasSize(1);
        FileDescriptor descriptor = fileSet.files().get(0);
        assertEquals(file, descriptor.path());
        assertEquals(0, descriptor.startIdx());
        assertEquals(10, descriptor.endIdx());
        assertEquals(0, descriptor.frameHeader());
        assertEquals(8, descriptor.frameFooter());
        assertEquals(8192, descriptor.fileHeader());
        assertEquals(DataType.UINT16, descriptor.nativeType());
    }

    @Test
    void testPartitions() throws IOException {
        SeqDataset dataset = SeqDataset.builder()
                .path(file)
                .scanSize(2, 5)
                .partitionCount(3)
                .build()
                .initialize(new InlineJobExecutor());

        List<Partition> partitions = dataset.getPartitions();

        assertThat(partitions).hasSize(3);
        assertThat(partitions).extracting(Partition::getStartFrame).containsExactly(0L, 3L, 6L);
        assertThat(partitions).extracting(Partition::getNumFrames).containsExactly(3L, 3L, 4L);
        for (Partition partition : partitions) {
            assertEquals(partition.getNumFrames(), partition.getFileSet().frameCount());
            assertSame(dataset.getMeta(), partition.getMeta());
        }
    }

    @Test
    void testDefaultPartitionCount() throws IOException {
        assertEquals(1, SeqDataset.open(file, 10).getPartitionCount());
    }

    @Test
    void testPartitionCountNeverExceedsFrameCount() throws IOException {
        SeqDataset dataset = SeqDataset.builder()
                .path(file)
                .scanSize(10)
                .partitionCount(25)
                .build()
                .initialize(new InlineJobExecutor());

        assertEquals(10, dataset.getPartitionCount());
        assertThat(dataset.getPartitions()).allMatch(p -> p.getNumFrames() == 1);
    }

    @Test
    void testEmptyFile() throws IOException {
        Path empty = seq().frames(0).write(tempDir.resolve("empty.seq"));

        SeqDataset dataset = SeqDataset.open(empty, 0);

        assertEquals(new Shape(new int[] {0, 4, 4}, 2), dataset.getShape());
        List<Partition> partitions = dataset.getPartitions();
        assertThat(partitions).hasSize(1);
        assertEquals(0, partitions.get(0).getNumFrames());
        assertTrue(partitions.get(0).getFileSet().isEmpty());
    }

    @Test
    void testDiagnostics() throws IOException {
        List<Diagnostic> diagnostics = SeqDataset.open(file, 10).getDiagnostics();

        assertThat(diagnostics).hasSize(SeqHeaderCodec.FIELDS.size() + 3);
        assertEquals(new Diagnostic("magic", "65261"), diagnostics.get(0));
        assertEquals(new Diagnostic("name", "Norpix seq"), diagnostics.get(1));
        assertThat(diagnostics.subList(SeqHeaderCodec.FIELDS.size(), diagnostics.size()))
                .containsExactly(
                        new Diagnostic("Footer size", "8"),
                        new Diagnostic("Dark frame included", "false"),
                        new Diagnostic("Gain map included", "false"));
    }

    @Test
    void testCorrectionFiles() throws IOException {
        float[] gain = new float[16];
        Arrays.fill(gain, 2f);
        MrcTestFiles.writeFloat32(tempDir.resolve("scan.seq" + CorrectionLoader.GAIN_SUFFIX), 4, 4, gain);

        SeqDataset dataset = SeqDataset.open(file, 10);

        assertTrue(dataset.getCorrections().hasGain());
        assertFalse(dataset.getCorrections().hasDark());
        assertThat(dataset.getDiagnostics())
                .contains(new Diagnostic("Dark frame included", "false"), new Diagnostic("Gain map included", "true"));
    }

    @Test
    void testCheckValid() throws IOException {
        SeqDataset.open(file, 10).checkValid();
    }

    @Test
    void testCacheKey() throws IOException {
        SeqDataset dataset = SeqDataset.open(file, 2, 5);
        assertEquals(new SeqDataset.CacheKey(file, dataset.getShape()), dataset.getCacheKey());
        assertThat(dataset.getSupportedExtensions()).containsExactly("seq");
    }

    @Test
    void testDetectParams() throws IOException {
        Optional<DatasetConfig> detected = SeqDataset.detectParams(file);

        assertTrue(detected.isPresent());
        DatasetConfig config = detected.orElseThrow();
        assertEquals(file, config.path());
        int[] scanSize = config.getParameter(SeqDatasetProvider.SCAN_SIZE).orElseThrow();
        assertThat(scanSize).containsExactly(10);
    }

    @Test
    void testDetectedParamsOpenTheFile() throws IOException {
        int[] scanSize = SeqDataset.detectParams(file)
                .flatMap(c -> c.getParameter(SeqDatasetProvider.SCAN_SIZE))
                .orElseThrow();
        assertEquals(10, SeqDataset.open(file, scanSize).getShape().get(0));
    }

    @Test
    void testDetectParamsNeverThrows() throws IOException {
        Path text = tempDir.resolve("notes.seq");
        Files.writeString(text, "not a sequence file");
        Path garbage = tempDir.resolve("garbage.seq");
        byte[] bytes = new byte[10_000];
        Arrays.fill(bytes, (byte) 0x7F);
        Files.write(garbage, bytes);
        Path wrongMagic = seq().magic(0xBEEF).write(tempDir.resolve("wrong.seq"));
        Path noRecordSize = seq().trueImageSize(0).write(tempDir.resolve("zero.seq"));

        assertThat(SeqDataset.detectParams(text)).isEmpty();
        assertThat(SeqDataset.detectParams(garbage)).isEmpty();
        assertThat(SeqDataset.detectParams(wrongMagic)).isEmpty();
        assertThat(SeqDataset.detectParams(noRecordSize)).isEmpty();
        assertThat(SeqDataset.detectParams(tempDir.resolve("missing.seq"))).isEmpty();
    }
}
