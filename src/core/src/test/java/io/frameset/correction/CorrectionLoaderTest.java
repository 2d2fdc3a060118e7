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
package io.frameset.correction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.frameset.dataset.DenseArray;
import io.frameset.dataset.FormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CorrectionLoaderTest {

    @TempDir
    Path tempDir;

    @Mock
    ArrayReader arrayReader;

    private Path dataset;

    @BeforeEach
    void setUp() {
        dataset = tempDir.resolve("scan.seq");
    }

    @Test
    void testSiblingNames() {
        assertEquals(
                tempDir.resolve("scan.seq.dark.mrc"), CorrectionLoader.sibling(dataset, CorrectionLoader.DARK_SUFFIX));
        assertEquals(
                tempDir.resolve("scan.seq.gain.mrc"), CorrectionLoader.sibling(dataset, CorrectionLoader.GAIN_SUFFIX));
    }

    @Test
    void testNoCorrectionFiles() throws IOException {
        CorrectionSet corrections = new CorrectionLoader(arrayReader).load(dataset);

        assertSame(CorrectionSet.NONE, corrections);
        verify(arrayReader, never()).read(any());
    }

    @Test
    void testDarkOnly() throws IOException {
        Path dark = Files.createFile(tempDir.resolve("scan.seq.dark.mrc"));
        when(arrayReader.read(dark)).thenReturn(new DenseArray(new float[16], new int[] {1, 4, 4}));

        CorrectionSet corrections = new CorrectionLoader(arrayReader).load(dataset);

        assertTrue(corrections.hasDark());
        assertFalse(corrections.hasGain());
        assertThat(corrections.getDark().orElseThrow().getShape()).containsExactly(4, 4);
    }

    @Test
    void testDarkAndGainFromMrcFiles() throws IOException {
        float[] dark = new float[16];
        float[] gain = new float[16];
        for (int i = 0; i < 16; i++) {
            dark[i] = i;
            gain[i] = 0.5f;
        }
        MrcTestFiles.writeFloat32(tempDir.resolve("scan.seq.dark.mrc"), 4, 4, dark);
        MrcTestFiles.writeFloat32(tempDir.resolve("scan.seq.gain.mrc"), 4, 4, gain);

        CorrectionSet corrections = new CorrectionLoader().load(dataset);

        assertThat(corrections.getDark().orElseThrow().getShape()).containsExactly(4, 4);
        assertEquals(15f, corrections.getDark().orElseThrow().get(15));
        assertEquals(0.5f, corrections.getGain().orElseThrow().get(0));
    }

    @Test
    void testShapeIsNotCheckedWhenLoading() throws IOException {
        MrcTestFiles.writeFloat32(tempDir.resolve("scan.seq.gain.mrc"), 2, 3, new float[6]);

        CorrectionSet corrections = new CorrectionLoader().load(dataset);

        assertThat(corrections.getGain().orElseThrow().getShape()).containsExactly(2, 3);
    }

    @Test
    void testUnreadableCorrectionFile() throws IOException {
        Files.write(tempDir.resolve("scan.seq.gain.mrc"), new byte[10]);
        assertThrows(FormatException.class, () -> new CorrectionLoader().load(dataset));
    }
}
