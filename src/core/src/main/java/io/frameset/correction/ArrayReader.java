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
package io.frameset.correction;

import io.frameset.dataset.DenseArray;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes an auxiliary array file.
 */
@FunctionalInterface
public interface ArrayReader {

    /**
     * @param path an existing file
     * @return the decoded array
     * @throws IOException if the file cannot be read or decoded
     */
    DenseArray read(Path path) throws IOException;
}
