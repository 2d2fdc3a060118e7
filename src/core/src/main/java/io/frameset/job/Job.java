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

import io.frameset.dataset.Shape;
import java.io.IOException;
import java.util.List;

/**
 * A computation over a whole dataset, expressed as one {@link Task} per
 * partition whose {@link ResultTile result tiles} are merged into a result of
 * {@link #getResultShape()}.
 */
public interface Job {

    /**
     * @return one task per partition, in partition order
     * @throws IOException if the dataset cannot be partitioned
     */
    List<Task> getTasks() throws IOException;

    /**
     * @return the shape of the merged result
     */
    Shape getResultShape();

    /**
     * @return a zeroed buffer for the merged result
     */
    default float[] newResultBuffer() {
        return new float[Math.toIntExact(getResultShape().size())];
    }
}
