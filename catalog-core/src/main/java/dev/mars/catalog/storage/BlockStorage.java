/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.catalog.storage;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntSupplier;

/**
 * Fixed-size block storage for binary payloads.
 * <p>
 * A payload is split into blocks; the caller decides which block index each chunk
 * lands in through an allocator, and remembers the returned index list together
 * with the payload length. Reading needs both.
 * <p>
 * <b>Critical Contract:</b> a returned future completes only after every chunk of
 * the operation has been transferred. If any chunk fails, the whole future fails
 * with {@link StorageException}; partial success is never reported.
 *
 * @see SegmentBlockStorage
 */
public interface BlockStorage extends Closeable {

    /**
     * Writes a payload into freshly allocated blocks.
     * <p>
     * The allocator is invoked on the calling thread, once per chunk and in chunk
     * order, before any I/O is issued. An empty payload still occupies one block.
     *
     * @param data      the bytes to store
     * @param allocator supplies the block index for the next chunk
     * @return a Future with the block indices in chunk order
     */
    CompletableFuture<List<Integer>> write(byte[] data, IntSupplier allocator);

    /**
     * Reads a payload back from its blocks.
     *
     * @param blocks      the block indices in chunk order, as returned by {@link #write}
     * @param totalLength the payload length recorded at write time
     * @return a Future with exactly {@code totalLength} bytes
     */
    CompletableFuture<byte[]> read(List<Integer> blocks, int totalLength);

    /**
     * Stops accepting operations and releases the I/O threads.
     */
    @Override
    void close();
}
