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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class FileDescriptorTest {

    private static final Shape SIG = new Shape(new int[] {3, 5}, 2);
    private static final Path PATH = Paths.get("scan.seq");

    @Test
    void testSizes() {
        FileDescriptor file = FileDescriptor.of(PATH, 0, 10, DataType.UINT32, SIG, 4, 6, 1024);

        assertEquals(10, file.frameCount());
        assertEquals(60, file.frameSizeBytes());
        assertEquals(70, file.frameStride());
        assertEquals(0, file.fileStartIdx());
    }

    @Test
    void testRecordOffset() {
        FileDescriptor file = FileDescriptor.of(PATH, 100, 110, DataType.UINT16, SIG, 0, 2, 8192);

        assertEquals(8192, file.recordOffset(100));
        assertEquals(8192 + 3 * 32, file.recordOffset(103));
        assertEquals(8192 + 10 * 32, file.recordOffset(110));
        assertThrows(FrameRangeException.class, () -> file.recordOffset(99));
        assertThrows(FrameRangeException.class, () -> file.recordOffset(111));
    }

    @Test
    void testRestrict() {
        FileDescriptor file = FileDescriptor.of(PATH, 0, 10, DataType.UINT8, SIG, 0, 0, 1024);
        FileDescriptor restricted = file.restrict(4, 6);

        assertEquals(4, restricted.startIdx());
        assertEquals(6, restricted.endIdx());
        assertEquals(0, restricted.fileStartIdx());
        assertEquals(1024 + 4 * 15, restricted.recordOffset(4));
        assertTrue(restricted.contains(5));
        assertFalse(restricted.contains(6));
        assertThrows(FrameRangeException.class, () -> file.restrict(8, 12));
        assertThrows(FrameRangeException.class, () -> file.restrict(6, 4));
    }

    @Test
    void testContinuation() {
        FileDescriptor file = FileDescriptor.of(PATH, 0, 10, DataType.UINT8, SIG, 0, 0, 1024);
        assertTrue(file.restrict(0, 4).isContinuedBy(file.restrict(4, 10)));
        assertFalse(file.restrict(0, 4).isContinuedBy(file.restrict(5, 10)));

        FileDescriptor other = FileDescriptor.of(Paths.get("other.seq"), 4, 10, DataType.UINT8, SIG, 0, 0, 1024);
        assertFalse(file.restrict(0, 4).isContinuedBy(other));
    }

    @Test
    void testValidation() {
        assertThrows(
                IllegalArgumentException.class,
                () -> FileDescriptor.of(PATH, 5, 4, DataType.UINT8, SIG, 0, 0, 0));
        assertThrows(
                IllegalArgumentException.class,
                () -> FileDescriptor.of(PATH, 0, 4, DataType.UINT8, SIG, -1, 0, 0));
        assertThat(FileDescriptor.of(PATH, 4, 4, DataType.UINT8, SIG, 0, 0, 0).frameCount())
                .isZero();
    }
}
