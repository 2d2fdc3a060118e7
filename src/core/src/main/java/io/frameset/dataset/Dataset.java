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
package io.frameset.dataset;

import java.io.IOException;
import java.util.List;

/**
 * A logically multi-dimensional array backed by one or more files, consumed
 * one partition at a time.
 */
public interface Dataset {

    /**
     * @return navigation dimensions followed by signal dimensions
     */
    Shape getShape();

    /**
     * @return the native element type of the frames
     */
    DataType getDataType();

    /**
     * Splits the dataset into partitions that together cover every frame exactly once.
     *
     * @return partitions in ascending frame order
     * @throws IOException if the partitions cannot be computed
     */
    List<Partition> getPartitions() throws IOException;
}
