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

import static java.util.Objects.requireNonNull;

import io.frameset.dataset.DenseArray;
import io.frameset.job.Job;
import io.frameset.job.ResultTile;
import io.frameset.job.Task;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the tasks of a job on a thread pool and merges their results in
 * completion order.
 * <p>
 * The first failing task cancels the tasks still pending or running; running
 * tasks stop at their next tile boundary.
 */
@Slf4j
public class ConcurrentJobExecutor extends AbstractJobExecutor {

    private final ExecutorService executor;
    private final int workers;
    private final boolean ownsExecutor;

    /**
     * Creates an executor with its own pool of {@code workers} daemon threads.
     */
    public ConcurrentJobExecutor(int workers) {
        this(Executors.newFixedThreadPool(checkWorkers(workers), threadFactory()), workers, true);
    }

    /**
     * Creates an executor on top of an existing pool, which is not shut down by {@link #close()}.
     */
    public ConcurrentJobExecutor(ExecutorService executor, int workers) {
        this(executor, checkWorkers(workers), false);
    }

    private ConcurrentJobExecutor(ExecutorService executor, int workers, boolean ownsExecutor) {
        this.executor = requireNonNull(executor, "executor");
        this.workers = workers;
        this.ownsExecutor = ownsExecutor;
    }

    private static int checkWorkers(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1: " + workers);
        }
        return workers;
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "frameset-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public <T> T runFunction(Callable<T> function) throws IOException {
        Future<T> future = executor.submit(function);
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw propagate(e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw interrupted(e);
        }
    }

    @Override
    public DenseArray runJob(Job job) throws IOException {
        final List<Task> tasks = job.getTasks();
        final float[] result = job.newResultBuffer();
        final CompletionService<List<ResultTile>> completion = new ExecutorCompletionService<>(executor);
        final List<Future<List<ResultTile>>> futures = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            futures.add(completion.submit(task));
        }
        log.debug("Submitted {} tasks to {} workers", tasks.size(), workers);
        try {
            for (int i = 0; i < tasks.size(); i++) {
                reduce(completion.take().get(), result);
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            throw propagate(e);
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw interrupted(e);
        }
        return toResult(job, result);
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    @Override
    public int getWorkerCount() {
        return workers;
    }

    @Override
    public void close() throws IOException {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Worker threads did not terminate in time, interrupting them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            throw interrupted(e);
        }
    }
}
