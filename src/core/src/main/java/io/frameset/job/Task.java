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

import io.frameset.dataset.Partition;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Processes one partition and produces its partial results.
 * <p>
 * A task owns everything it writes to until it returns; it may be abandoned
 * between two tiles without affecting other tasks.
 */
public interface Task extends Callable<List<ResultTile>> {

    Partition getPartition();

    /**
     * @throws java.io.InterruptedIOException if the executing thread is interrupted between two tiles
     * @throws IOException if the partition cannot be read
     */
    @Override
    List<ResultTile> call() throws IOException;
}
