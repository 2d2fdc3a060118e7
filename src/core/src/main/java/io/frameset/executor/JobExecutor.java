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
package io.frameset.executor;

import io.frameset.dataset.DenseArray;
import io.frameset.job.Job;
import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Runs functions and jobs on behalf of datasets and their callers.
 * <p>
 * Implementations decide where the work runs; they never retry a failed task.
 */
public interface JobExecutor extends Closeable {

    /**
     * Runs a function and waits for its result.
     *
     * @throws IOException the function's own {@link IOException}, or one wrapping any other checked exception
     */
    <T> T runFunction(Callable<T> function) throws IOException;

    /**
     * Runs every task of {@code job} and merges their result tiles.
     *
     * @return the merged result, shaped like {@link Job#getResultShape()}
     * @throws IOException the first task failure
     */
    DenseArray runJob(Job job) throws IOException;

    /**
     * @return the number of tasks this executor runs at the same time
     */
    int getWorkerCount();

    @Override
    default void close() throws IOException {
        // nothing to release by default
    }
}
