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
package io.frameset.job;

import static java.util.Objects.requireNonNull;

/**
 * Element-wise sum of the frames of one partition.
 * <p>
 * Summation order differs with the order tiles are merged in, so results of
 * different runs may differ by float rounding.
 */
public final class SumResultTile implements ResultTile {

    private final float[] data;

    public SumResultTile(float[] data) {
        this.data = requireNonNull(data, "data");
    }

    public float[] getData() {
        return data;
    }

    @Override
    public void reduceInto(float[] result) {
        if (result.length != data.length) {
            throw new IllegalArgumentException(
                    "result buffer of %d elements, expected %d".formatted(result.length, data.length));
        }
        for (int i = 0; i < data.length; i++) {
            result[i] += data[i];
        }
    }
}
