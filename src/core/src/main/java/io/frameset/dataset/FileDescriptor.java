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

import java.nio.file.Path;

/**
 * Describes the part a physical file plays in the logical frame sequence.
 * <p>
 * The file holds a file header of {@code fileHeader} bytes followed by
 * fixed-size frame records of {@code frameHeader + payload + frameFooter}
 * bytes. {@code fileStartIdx} is the global index of the first frame stored
 * in the file, and {@code [startIdx, endIdx)} the global frames this
 * descriptor covers; the two only differ once a descriptor has been
 * {@link #restrict(long, long) restricted}.
 *
 * @param path the file
 * @param fileStartIdx global index of the file's first frame record
 * @param startIdx first covered global frame index
 * @param endIdx exclusive end of the covered global frame indices
 * @param nativeType on-disk element type
 * @param sigShape signal shape of one frame
 * @param frameHeader bytes preceding every frame payload
 * @param frameFooter bytes following every frame payload
 * @param fileHeader bytes preceding the first frame record
 */
public record FileDescriptor(
        Path path,
        long fileStartIdx,
        long startIdx,
        long endIdx,
        DataType nativeType,
        Shape sigShape,
        int frameHeader,
        int frameFooter,
        long fileHeader) {

    public FileDescriptor {
        requireNonNull(path, "path");
        requireNonNull(nativeType, "nativeType");
        requireNonNull(sigShape, "sigShape");
        if (startIdx < fileStartIdx || endIdx < startIdx) {
            throw new IllegalArgumentException("invalid frame range [%d, %d) for a file starting at frame %d"
                    .formatted(startIdx, endIdx, fileStartIdx));
        }
        if (frameHeader < 0 || frameFooter < 0 || fileHeader < 0) {
            throw new IllegalArgumentException("header and footer sizes must not be negative");
        }
    }

    /**
     * Creates a descriptor covering all frames of a file.
     */
    public static FileDescriptor of(
            Path path,
            long startIdx,
            long endIdx,
            DataType nativeType,
            Shape sigShape,
            int frameHeader,
            int frameFooter,
            long fileHeader) {
        return new FileDescriptor(
                path, startIdx, startIdx, endIdx, nativeType, sigShape, frameHeader, frameFooter, fileHeader);
    }

    /**
     * @return number of frames covered by this descriptor
     */
    public long frameCount() {
        return endIdx - startIdx;
    }

    /**
     * @return payload bytes of one frame
     */
    public long frameSizeBytes() {
        return sigShape.size() * nativeType.itemSize();
    }

    /**
     * @return distance in bytes between the starts of two consecutive frame records
     */
    public long frameStride() {
        return frameHeader + frameSizeBytes() + frameFooter;
    }

    /**
     * @param globalIdx a global frame index covered by this descriptor
     * @return the file offset of that frame's record, frame header included
     */
    public long recordOffset(long globalIdx) {
        if (globalIdx < startIdx || globalIdx > endIdx) {
            throw new FrameRangeException("frame %d is not in [%d, %d)".formatted(globalIdx, startIdx, endIdx));
        }
        return fileHeader + (globalIdx - fileStartIdx) * frameStride();
    }

    /**
     * @return whether {@code globalIdx} is covered by this descriptor
     */
    public boolean contains(long globalIdx) {
        return globalIdx >= startIdx && globalIdx < endIdx;
    }

    /**
     * Clips this descriptor to {@code [start, stop)}.
     *
     * @throws FrameRangeException if the clipped range is outside this descriptor
     */
    public FileDescriptor restrict(long start, long stop) {
        if (start < startIdx || stop > endIdx || start > stop) {
            throw new FrameRangeException(
                    "[%d, %d) is not inside [%d, %d) of %s".formatted(start, stop, startIdx, endIdx, path));
        }
        return new FileDescriptor(
                path, fileStartIdx, start, stop, nativeType, sigShape, frameHeader, frameFooter, fileHeader);
    }

    /**
     * @return whether {@code next} continues this descriptor within the same file
     */
    boolean isContinuedBy(FileDescriptor next) {
        return path.equals(next.path)
                && fileStartIdx == next.fileStartIdx
                && endIdx == next.startIdx
                && nativeType == next.nativeType
                && sigShape.equals(next.sigShape)
                && frameHeader == next.frameHeader
                && frameFooter == next.frameFooter
                && fileHeader == next.fileHeader;
    }
}
