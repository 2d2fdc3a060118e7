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
package io.frameset.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ByteRangeTest {

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ByteRange(-1, 10));
        assertThrows(IllegalArgumentException.class, () -> ByteRange.of(0, -1));
        assertEquals(0, ByteRange.of(0, 0).length());
    }

    @Test
    void testEnd() {
        assertEquals(8192L + 3 * 40, ByteRange.of(8192, 120).end());
    }
}
