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
package io.frameset.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A thread-safe {@link RangeReader} over a local file.
 *
 * <p>Uses position-based reads ({@link FileChannel#read(ByteBuffer, long)}), so
 * concurrent readers never disturb each other's file position. Every partition
 * task nevertheless opens its own {@code FileRangeReader}, which keeps the
 * lifetime of a file handle bound to the task that uses it.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (FileRangeReader reader = FileRangeReader.of(Paths.get("scan.seq"))) {
 *     ByteBuffer header = reader.readRange(0, SeqHeaderCodec.HEADER_SIZE).flip();
 * }
 * }</pre>
 */
public class FileRangeReader extends AbstractRangeReader implements RangeReader {

    private final FileChannel channel;
    private final Path path;

    /**
     * Creates a new FileRangeReader for the specified file path.
     *
     * @param path the path to the file to read from (must not be null)
     * @throws IOException if the file cannot be opened for reading
     * @throws NullPointerException if path is null
     */
    public FileRangeReader(Path path) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        this.path = path;
        this.channel = FileChannel.open(path, StandardOpenOption.READ);
    }

    /**
     * Creates a new FileRangeReader for the specified file path.
     *
     * @param path the file path
     * @return a new FileRangeReader instance
     * @throws IOException if the file cannot be opened for reading
     */
    public static FileRangeReader of(Path path) throws IOException {
        return new FileRangeReader(path);
    }

    /**
     * Reads until {@code actualLength} bytes have been transferred or the end of
     * the file is reached.
     */
    @Override
    protected int readRangeNoFlip(long offset, int actualLength, ByteBuffer target) throws IOException {
        final int initialPosition = target.position();
        final int initialLimit = target.limit();

        target.limit(initialPosition + actualLength);

        int totalRead = 0;
        long currentPosition = offset;
        while (totalRead < actualLength) {
            int read = channel.read(target, currentPosition);
            if (read == -1) {
                break;
            }
            totalRead += read;
            currentPosition += read;
        }

        target.limit(initialLimit);
        return totalRead;
    }

    @Override
    public OptionalLong size() throws IOException {
        return OptionalLong.of(channel.size());
    }

    /**
     * @return the file path this reader was opened on
     */
    public Path getPath() {
        return path;
    }

    @Override
    public String getSourceIdentifier() {
        return path.toAbsolutePath().toString();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
