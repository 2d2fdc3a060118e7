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

import static java.util.Objects.requireNonNull;

/**
 * A named, human-readable fact about an opened dataset, such as a header field
 * or whether a correction file was found.
 *
 * @param name display name
 * @param value display value
 */
public record Diagnostic(String name, String value) {

    public Diagnostic {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
    }

    public static Diagnostic of(String name, Object value) {
        return new Diagnostic(name, String.valueOf(value));
    }
}
