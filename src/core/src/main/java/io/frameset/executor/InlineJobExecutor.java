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
import io.frameset.job.Task;
import java.io.IOException;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs everything on the calling thread, one task after the other.
 */
@Slf4j
public class InlineJobExecutor extends AbstractJobExecutor {

    @Override
    public <T> T runFunction(Callable<T> function) throws IOException {
        return call(function);
    }

    @Override
    public DenseArray runJob(Job job) throws IOException {
        float[] result = job.newResultBuffer();
        for (Task task : job.getTasks()) {
            log.trace("Running task for {}", describe(task));
            reduce(task.call(), result);
        }
        return toResult(job, result);
    }

    @Override
    public int getWorkerCount() {
        return 1;
    }
}
