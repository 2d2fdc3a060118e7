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

/**
 * Partial result of a {@link Task}, merged into the job result.
 * <p>
 * Merging must be commutative: the job result may not depend on the order in
 * which result tiles arrive, up to floating point rounding.
 */
public interface ResultTile {

    /**
     * Adds this partial result into {@code result}.
     *
     * @param result the job result buffer, sized to the job's result shape
     */
    void reduceInto(float[] result);
}
