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

import static java.util.Objects.requireNonNull;

import io.frameset.dataset.DenseArray;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the correction arrays stored next to a dataset file as
 * {@code <dataset>.dark.mrc} and {@code <dataset>.gain.mrc}.
 * <p>
 * A missing sibling file leaves the corresponding slot empty, correction data
 * is optional.
 */
@Slf4j
public class CorrectionLoader {

    public static final String DARK_SUFFIX = ".dark.mrc";
    public static final String GAIN_SUFFIX = ".gain.mrc";

    private final ArrayReader arrayReader;

    /**
     * Creates a loader decoding correction files with {@link MrcReader}.
     */
    public CorrectionLoader() {
        this(MrcReader::read);
    }

    public CorrectionLoader(ArrayReader arrayReader) {
        this.arrayReader = requireNonNull(arrayReader, "arrayReader");
    }

    /**
     * @param datasetPath path of the main dataset file
     * @return the correction arrays found next to it, squeezed to minimal rank
     * @throws IOException if a correction file exists but cannot be decoded
     */
    public CorrectionSet load(Path datasetPath) throws IOException {
        requireNonNull(datasetPath, "datasetPath");
        DenseArray dark = maybeLoad(sibling(datasetPath, DARK_SUFFIX)).orElse(null);
        DenseArray gain = maybeLoad(sibling(datasetPath, GAIN_SUFFIX)).orElse(null);
        if (dark == null && gain == null) {
            return CorrectionSet.NONE;
        }
        return new CorrectionSet(dark, gain);
    }

    static Path sibling(Path datasetPath, String suffix) {
        return datasetPath.resolveSibling(datasetPath.getFileName().toString() + suffix);
    }

    private Optional<DenseArray> maybeLoad(Path path) throws IOException {
        if (!Files.exists(path)) {
            log.debug("No correction file at {}", path);
            return Optional.empty();
        }
        DenseArray array = arrayReader.read(path).squeeze();
        log.info("Loaded correction file {} as {}", path, array);
        return Optional.of(array);
    }
}
