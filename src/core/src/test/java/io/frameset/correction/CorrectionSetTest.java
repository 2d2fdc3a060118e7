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
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.frameset.dataset.ConfigurationMismatchException;
import io.frameset.dataset.DenseArray;
import io.frameset.dataset.Shape;
import org.junit.jupiter.api.Test;

class CorrectionSetTest {

    private static final Shape SIG = new Shape(new int[] {2, 2}, 2);

    @Test
    void testApply() throws ConfigurationMismatchException {
        DenseArray dark = new DenseArray(new float[] {1, 1, 2, 2}, new int[] {2, 2});
        DenseArray gain = new DenseArray(new float[] {2, 0.5f, 1, 3}, new int[] {2, 2});
        CorrectionSet corrections = new CorrectionSet(dark, gain);
        corrections.validate(SIG);

        float[] frame = {3, 5, 2, 4};
        corrections.apply(frame);

        assertThat(frame).containsExactly(4f, 2f, 0f, 6f);
    }

    @Test
    void testNoneLeavesFrameUntouched() throws ConfigurationMismatchException {
        CorrectionSet.NONE.validate(SIG);
        float[] frame = {3, 5, 2, 4};
        CorrectionSet.NONE.apply(frame);
        assertThat(frame).containsExactly(3f, 5f, 2f, 4f);
    }

    @Test
    void testShapeMismatch() {
        DenseArray gain = new DenseArray(new float[6], new int[] {2, 3});
        CorrectionSet corrections = new CorrectionSet(null, gain);

        ConfigurationMismatchException e =
                assertThrows(ConfigurationMismatchException.class, () -> corrections.validate(SIG));
        assertThat(e).hasMessageContaining("gain");
    }

    @Test
    void testSqueezedArraysMatchLineFrames() throws ConfigurationMismatchException {
        Shape line = new Shape(new int[] {1, 4}, 2);
        DenseArray dark = new DenseArray(new float[] {1, 2, 3, 4}, new int[] {4});
        CorrectionSet corrections = new CorrectionSet(dark, null);

        corrections.validate(line);

        float[] frame = {10, 10, 10, 10};
        corrections.apply(frame);
        assertThat(frame).containsExactly(9f, 8f, 7f, 6f);
    }

    @Test
    void testSqueezedShapeMismatch() {
        Shape line = new Shape(new int[] {1, 4}, 2);
        DenseArray dark = new DenseArray(new float[5], new int[] {5});

        assertThrows(ConfigurationMismatchException.class, () -> new CorrectionSet(dark, null).validate(line));
    }
}
