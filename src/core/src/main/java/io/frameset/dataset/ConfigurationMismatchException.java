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
 * The caller supplied parameters that contradict the file, typically a
 * navigation shape whose size differs from the number of frames in the file.
 */
public class ConfigurationMismatchException extends DatasetException {

    private static final long serialVersionUID = 1L;

    public ConfigurationMismatchException(String message) {
        super(message);
    }

    public ConfigurationMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
