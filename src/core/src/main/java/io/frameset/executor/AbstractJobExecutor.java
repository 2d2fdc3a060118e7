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
import io.frameset.job.ResultTile;
import io.frameset.job.Task;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * Common result merging and exception translation for {@link JobExecutor}s.
 */
public abstract class AbstractJobExecutor implements JobExecutor {

    protected AbstractJobExecutor() {
        // Default constructor for subclasses
    }

    /**
     * Merges the result tiles of one task into the job result.
     */
    protected static void reduce(List<ResultTile> tiles, float[] result) {
        for (ResultTile tile : tiles) {
            tile.reduceInto(result);
        }
    }

    protected static DenseArray toResult(Job job, float[] result) {
        return new DenseArray(result, job.getResultShape().toArray());
    }

    /**
     * Calls {@code callable} translating checked exceptions other than {@link IOException}.
     */
    protected static <T> T call(Callable<T> callable) throws IOException {
        try {
            return callable.call();
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            throw interrupted(e);
        } catch (Exception e) {
            throw new IOException(e);
        }
    }

    /**
     * Unwraps the failure of a task or function run on another thread.
     */
    protected static IOException propagate(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException io) {
            return io;
        }
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IOException(cause);
    }

    protected static InterruptedIOException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        InterruptedIOException ioe = new InterruptedIOException("interrupted while waiting for a result");
        ioe.initCause(e);
        return ioe;
    }

    protected static String describe(Task task) {
        return String.valueOf(task.getPartition());
    }
}
