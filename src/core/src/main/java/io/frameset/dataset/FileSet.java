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

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered file descriptors that together cover a contiguous range of global
 * frame indices without gaps or overlaps. Descriptors covering no frames are
 * dropped.
 *
 * @param files descriptors in ascending frame order
 */
public record FileSet(List<FileDescriptor> files) {

    public FileSet {
        files = requireNonNull(files, "files").stream()
                .filter(f -> f.frameCount() > 0)
                .toList();
        for (int i = 1; i < files.size(); i++) {
            FileDescriptor prev = files.get(i - 1);
            FileDescriptor next = files.get(i);
            if (prev.endIdx() != next.startIdx()) {
                throw new IllegalArgumentException("descriptors must be contiguous: %s ends at %d, %s starts at %d"
                        .formatted(prev.path(), prev.endIdx(), next.path(), next.startIdx()));
            }
        }
    }

    public static FileSet of(FileDescriptor... files) {
        return new FileSet(List.of(files));
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * @return the first covered global frame index, 0 for an empty set
     */
    public long startIdx() {
        return files.isEmpty() ? 0 : files.get(0).startIdx();
    }

    /**
     * @return the exclusive end of the covered frame indices, 0 for an empty set
     */
    public long endIdx() {
        return files.isEmpty() ? 0 : files.get(files.size() - 1).endIdx();
    }

    public long frameCount() {
        return endIdx() - startIdx();
    }

    /**
     * Returns the descriptors covering exactly {@code [start, stop)}, splitting
     * descriptors at the range boundaries.
     *
     * @throws FrameRangeException if the range is inverted or not fully covered by this set
     */
    public FileSet restrict(long start, long stop) {
        if (start > stop) {
            throw new FrameRangeException("inverted frame range [%d, %d)".formatted(start, stop));
        }
        if (start == stop && (files.isEmpty() || (start >= startIdx() && start <= endIdx()))) {
            return new FileSet(List.of());
        }
        if (files.isEmpty() || start < startIdx() || stop > endIdx()) {
            throw new FrameRangeException(
                    "[%d, %d) is not covered by the file set [%d, %d)".formatted(start, stop, startIdx(), endIdx()));
        }
        List<FileDescriptor> restricted = new ArrayList<>();
        for (FileDescriptor file : files) {
            long from = Math.max(start, file.startIdx());
            long to = Math.min(stop, file.endIdx());
            if (from < to) {
                restricted.add(file.restrict(from, to));
            }
        }
        return new FileSet(restricted);
    }

    /**
     * Appends {@code other}, which must start where this set ends. Adjacent
     * pieces of the same file are merged, so restricting to {@code [a, b)} and
     * {@code [b, c)} and concatenating yields the same set as restricting to
     * {@code [a, c)}.
     */
    public FileSet concat(FileSet other) {
        requireNonNull(other, "other");
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        List<FileDescriptor> joined = new ArrayList<>(files);
        for (FileDescriptor next : other.files) {
            FileDescriptor last = joined.get(joined.size() - 1);
            if (last.isContinuedBy(next)) {
                joined.set(joined.size() - 1, new FileDescriptor(
                        last.path(),
                        last.fileStartIdx(),
                        last.startIdx(),
                        next.endIdx(),
                        last.nativeType(),
                        last.sigShape(),
                        last.frameHeader(),
                        last.frameFooter(),
                        last.fileHeader()));
            } else {
                joined.add(next);
            }
        }
        return new FileSet(joined);
    }
}
