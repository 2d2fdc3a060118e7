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

/**
 * A frame record could not be read completely because the file ended early.
 */
public class TruncatedFileException extends DatasetException {

    private static final long serialVersionUID = 1L;

    private final long frameIndex;

    public TruncatedFileException(String source, long frameIndex, long expectedBytes, long actualBytes) {
        super("Short read in %s at frame %d: expected %d bytes, got %d"
                .formatted(source, frameIndex, expectedBytes, actualBytes));
        this.frameIndex = frameIndex;
    }

    /**
     * @return the global index of the first frame that could not be read completely
     */
    public long getFrameIndex() {
        return frameIndex;
    }
}
