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

import io.frameset.dataset.ConfigurationMismatchException;
import io.frameset.dataset.DenseArray;
import io.frameset.dataset.Shape;
import java.util.Arrays;
import java.util.Optional;

/**
 * Optional dark frame and gain map applied to every frame of a dataset as
 * {@code (frame - dark) * gain}.
 * <p>
 * Instances are immutable and shared read-only by all partitions. The arrays
 * are not checked against the signal shape when loaded, only when
 * {@link #validate(Shape) validated} before use.
 */
public final class CorrectionSet {

    /** A correction set without dark frame nor gain map. */
    public static final CorrectionSet NONE = new CorrectionSet(null, null);

    private final DenseArray dark;
    private final DenseArray gain;

    public CorrectionSet(DenseArray dark, DenseArray gain) {
        this.dark = dark;
        this.gain = gain;
    }

    public Optional<DenseArray> getDark() {
        return Optional.ofNullable(dark);
    }

    public Optional<DenseArray> getGain() {
        return Optional.ofNullable(gain);
    }

    public boolean hasDark() {
        return dark != null;
    }

    public boolean hasGain() {
        return gain != null;
    }

    public boolean isEmpty() {
        return dark == null && gain == null;
    }

    /**
     * Checks the arrays against the signal shape of the frames they are applied to.
     *
     * @throws ConfigurationMismatchException if an array does not have the signal shape
     */
    public void validate(Shape sigShape) throws ConfigurationMismatchException {
        // loaded arrays are squeezed, so extent-1 frame axes are ignored on both sides
        int[] expected = Arrays.stream(sigShape.toArray()).filter(d -> d != 1).toArray();
        if (dark != null && !dark.squeeze().hasShape(expected)) {
            throw new ConfigurationMismatchException(
                    "dark frame %s does not match the signal shape %s".formatted(dark, sigShape));
        }
        if (gain != null && !gain.squeeze().hasShape(expected)) {
            throw new ConfigurationMismatchException(
                    "gain map %s does not match the signal shape %s".formatted(gain, sigShape));
        }
    }

    /**
     * Corrects one decoded frame in place. The set must have been validated
     * against the frame's signal shape.
     *
     * @param frame pixel values of one frame
     */
    public void apply(float[] frame) {
        if (dark != null) {
            for (int i = 0; i < dark.size(); i++) {
                frame[i] -= dark.get(i);
            }
        }
        if (gain != null) {
            for (int i = 0; i < gain.size(); i++) {
                frame[i] *= gain.get(i);
            }
        }
    }

    @Override
    public String toString() {
        return "CorrectionSet[dark=%s, gain=%s]".formatted(dark, gain);
    }
}
