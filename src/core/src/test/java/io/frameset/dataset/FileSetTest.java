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
package io.frameset.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FileSetTest {

    private static final Shape SIG = new Shape(new int[] {4, 4}, 2);
    private static final Path FILE_A = Paths.get("a.seq");
    private static final Path FILE_B = Paths.get("b.seq");

    private static FileDescriptor file(Path path, long start, long end) {
        return FileDescriptor.of(path, start, end, DataType.UINT16, SIG, 0, 8, 8192);
    }

    /** Two files, frames [0, 10) and [10, 16). */
    private static FileSet twoFiles() {
        return FileSet.of(file(FILE_A, 0, 10), file(FILE_B, 10, 16));
    }

    @Test
    void testCoverage() {
        FileSet set = twoFiles();
        assertEquals(0, set.startIdx());
        assertEquals(16, set.endIdx());
        assertEquals(16, set.frameCount());
    }

    @Test
    void testRestrictWithinOneFile() {
        FileSet restricted = twoFiles().restrict(2, 7);

        assertThat(restricted.files()).hasSize(1);
        FileDescriptor descriptor = restricted.files().get(0);
        assertEquals(FILE_A, descriptor.path());
        assertEquals(2, descriptor.startIdx());
        assertEquals(7, descriptor.endIdx());
        assertEquals(5, restricted.frameCount());
    }

    @Test
    void testRestrictAcrossFiles() {
        FileSet restricted = twoFiles().restrict(8, 12);

        assertThat(restricted.files()).extracting(FileDescriptor::path).containsExactly(FILE_A, FILE_B);
        assertThat(restricted.files()).extracting(FileDescriptor::frameCount).containsExactly(2L, 2L);
        assertEquals(8, restricted.startIdx());
        assertEquals(12, restricted.endIdx());
    }

    @Test
    void testRestrictKeepsRecordOffsets() {
        FileSet set = twoFiles();
        FileDescriptor original = set.files().get(1);
        FileDescriptor restricted = set.restrict(13, 15).files().get(0);

        assertEquals(original.recordOffset(13), restricted.recordOffset(13));
        assertEquals(8192 + 3 * 40, restricted.recordOffset(13));
    }

    @Test
    void testRestrictToFileBoundary() {
        FileSet restricted = twoFiles().restrict(0, 10);
        assertThat(restricted.files()).extracting(FileDescriptor::path).containsExactly(FILE_A);
    }

    @ParameterizedTest
    @CsvSource({"0, 0", "5, 5", "10, 10", "16, 16"})
    void testEmptyRange(long start, long stop) {
        FileSet restricted = twoFiles().restrict(start, stop);
        assertTrue(restricted.isEmpty());
        assertEquals(0, restricted.frameCount());
    }

    @Test
    void testInvertedRange() {
        assertThrows(FrameRangeException.class, () -> twoFiles().restrict(5, 4));
    }

    @ParameterizedTest
    @CsvSource({"0, 17", "15, 20", "17, 17", "20, 25"})
    void testUncoveredRange(long start, long stop) {
        assertThrows(FrameRangeException.class, () -> twoFiles().restrict(start, stop));
    }

    @Test
    void testRangeBeforeFirstFrame() {
        FileSet set = FileSet.of(file(FILE_A, 5, 10));
        assertThrows(FrameRangeException.class, () -> set.restrict(3, 7));
    }

    @ParameterizedTest
    @CsvSource({"0, 5, 16", "0, 10, 16", "3, 9, 12", "9, 10, 11", "4, 4, 8", "2, 15, 15", "0, 0, 0"})
    void testRestrictIsComposable(long a, long b, long c) {
        FileSet set = twoFiles();
        assertEquals(set.restrict(a, c), set.restrict(a, b).concat(set.restrict(b, c)));
    }

    @Test
    void testGapIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FileSet.of(file(FILE_A, 0, 10), file(FILE_B, 11, 16)));
    }

    @Test
    void testOverlapIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FileSet.of(file(FILE_A, 0, 10), file(FILE_B, 9, 16)));
    }

    @Test
    void testEmptyDescriptorsAreDropped() {
        FileSet set = new FileSet(List.of(file(FILE_A, 0, 0), file(FILE_B, 0, 6)));
        assertThat(set.files()).extracting(FileDescriptor::path).containsExactly(FILE_B);
    }

    @Test
    void testEmptySet() {
        FileSet empty = new FileSet(List.of());
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.frameCount());
        assertTrue(empty.restrict(0, 0).isEmpty());
        assertThrows(FrameRangeException.class, () -> empty.restrict(0, 1));
    }
}
