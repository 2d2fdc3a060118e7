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

import io.frameset.correction.CorrectionSet;
import io.frameset.dataset.Dataset;
import io.frameset.dataset.Partition;
import io.frameset.dataset.Shape;
import java.io.IOException;
import java.util.List;

/**
 * Sums all frames of a dataset, the result has the dataset's signal shape.
 * <p>
 * Integer pixels are accumulated as 32 bit floats. When a non-empty
 * {@link CorrectionSet} is given, every frame is corrected before it is added.
 */
public class SumFramesJob implements Job {

    private final Dataset dataset;
    private final CorrectionSet corrections;
    private final long tileBytes;

    public SumFramesJob(Dataset dataset) {
        this(dataset, CorrectionSet.NONE, Partition.DEFAULT_TILE_BYTES);
    }

    public SumFramesJob(Dataset dataset, CorrectionSet corrections, long tileBytes) {
        this.dataset = requireNonNull(dataset, "dataset");
        this.corrections = requireNonNull(corrections, "corrections");
        if (tileBytes <= 0) {
            throw new IllegalArgumentException("tileBytes must be positive: " + tileBytes);
        }
        this.tileBytes = tileBytes;
    }

    @Override
    public List<Task> getTasks() throws IOException {
        return dataset.getPartitions().stream()
                .map(partition -> (Task) new SumFramesTask(partition, corrections, tileBytes))
                .toList();
    }

    @Override
    public Shape getResultShape() {
        return dataset.getShape().sig();
    }
}
