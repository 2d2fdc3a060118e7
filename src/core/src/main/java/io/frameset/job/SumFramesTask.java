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
import io.frameset.dataset.Partition;
import io.frameset.dataset.Shape;
import io.frameset.dataset.Tile;
import io.frameset.dataset.TileReader;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Sums the frames of one partition over its navigation axis.
 */
@Slf4j
public class SumFramesTask implements Task {

    private final Partition partition;
    private final CorrectionSet corrections;
    private final long tileBytes;

    public SumFramesTask(Partition partition, CorrectionSet corrections, long tileBytes) {
        this.partition = requireNonNull(partition, "partition");
        this.corrections = requireNonNull(corrections, "corrections");
        this.tileBytes = tileBytes;
    }

    @Override
    public Partition getPartition() {
        return partition;
    }

    @Override
    public List<ResultTile> call() throws IOException {
        final Shape sigShape = partition.getMeta().shape().sig();
        final int sigSize = Math.toIntExact(sigShape.size());
        if (!corrections.isEmpty()) {
            corrections.validate(sigShape);
        }

        final float[] part = new float[sigSize];
        final float[] frame = new float[sigSize];
        long tiles = 0;
        try (TileReader reader = partition.tiles(tileBytes)) {
            while (reader.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("interrupted while summing " + partition);
                }
                Tile tile = reader.next();
                for (int f = 0; f < tile.getFrameCount(); f++) {
                    tile.readFrame(f, frame);
                    corrections.apply(frame);
                    for (int p = 0; p < sigSize; p++) {
                        part[p] += frame[p];
                    }
                }
                tiles++;
            }
        }
        log.debug("Summed {} in {} tiles", partition, tiles);
        return List.of(new SumResultTile(part));
    }
}
