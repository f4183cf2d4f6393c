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

import dev.mars.catalog.CatalogConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * {@link BlockStorage} backed by bounded segment files.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ block-a.dat   // blocks 0 .. 1023
 *  ├─ block-b.dat   // blocks 1024 .. 2047
 *  └─ ...
 * </pre>
 * Block {@code n} lives in segment {@code n / 1024} at byte offset
 * {@code (n % 1024) * 65536}. Segment names encode the segment index in hex,
 * offset by {@code 0xa}.
 * <p>
 * <b>Concurrency:</b> each logical operation opens every touched segment file once,
 * issues one task per chunk on the I/O pool against that channel, and completes
 * when all of them have. Channels are closed before the operation completes; no
 * file handle outlives a call.
 * <p>
 * <b>Space:</b> segment files only grow. Freed blocks are recycled by whoever owns
 * the allocator, the files themselves are never shrunk or compacted.
 */
public final class SegmentBlockStorage implements BlockStorage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(SegmentBlockStorage.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Block size: 64 KiB */
    public static final int BLOCK_SIZE = 64 * 1024;

    /** Blocks per segment file: 1024 (64 MiB per file) */
    public static final int BLOCKS_PER_SEGMENT = 1024;

    /** Added to the segment index before naming, keeps names clear of reserved files */
    private static final int SEGMENT_NAME_BASE = 0xa;

    private static final OpenOption[] WRITE_OPTIONS = {StandardOpenOption.CREATE, StandardOpenOption.WRITE};
    private static final OpenOption[] READ_OPTIONS = {StandardOpenOption.READ};

    // ========================================================================
    // State
    // ========================================================================

    private final Path dataDir;
    private final ExecutorService ioExecutor;
    private final boolean syncEnabled;
    private final long minFreeSpace;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates block storage over the configured data directory.
     *
     * @param config the catalog configuration
     */
    public SegmentBlockStorage(CatalogConfig config) {
        this.dataDir = config.dataDir();
        this.syncEnabled = config.syncEnabled();
        this.minFreeSpace = config.minFreeSpaceBytes();

        AtomicInteger threadCount = new AtomicInteger();
        this.ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), r -> {
            Thread t = new Thread(r, "block-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.info("SegmentBlockStorage initialized: dataDir={}, ioThreads={}, syncEnabled={}, minFreeSpace={} MB",
                dataDir, config.ioThreads(), syncEnabled, minFreeSpace / 1024 / 1024);
    }

    // ========================================================================
    // Layout
    // ========================================================================

    /**
     * Returns the file name of a segment, e.g. {@code block-a.dat} for segment 0.
     */
    public static String segmentFileName(int segment) {
        return "block-" + Integer.toHexString(segment + SEGMENT_NAME_BASE) + ".dat";
    }

    /**
     * Number of chunks a payload of {@code length} bytes occupies. Never less than one.
     */
    public static int chunkCount(int length) {
        if (length <= 0) {
            return 1;
        }
        return (int) (((long) length + BLOCK_SIZE - 1) / BLOCK_SIZE);
    }

    /**
     * Length of chunk {@code chunk} of a payload of {@code totalLength} bytes.
     * <p>
     * Every chunk is full except the one holding the final byte. Chunks past the
     * end (left by writers that always appended one extra block) are empty.
     */
    public static int chunkLength(int chunk, int totalLength) {
        long remaining = (long) totalLength - (long) chunk * BLOCK_SIZE;
        return (int) Math.max(0, Math.min(BLOCK_SIZE, remaining));
    }

    // ========================================================================
    // Write
    // ========================================================================

    @Override
    public CompletableFuture<List<Integer>> write(byte[] data, IntSupplier allocator) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Block storage is closed"));
        }

        int count = chunkCount(data.length);
        List<Integer> blocks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int block = allocator.getAsInt();
            if (block < 0) {
                return CompletableFuture.failedFuture(
                        new StorageException("Allocator returned negative block index " + block));
            }
            blocks.add(block);
        }
        List<Integer> result = List.copyOf(blocks);
        Map<Integer, List<Chunk>> plan = plan(result, data.length);

        LOG.debug("Writing {} bytes into {} blocks across {} segment(s)", data.length, count, plan.size());

        return CompletableFuture.runAsync(this::prepareForWrite, ioExecutor)
                .thenCompose(v -> {
                    List<CompletableFuture<Void>> segments = new ArrayList<>(plan.size());
                    for (Map.Entry<Integer, List<Chunk>> e : plan.entrySet()) {
                        segments.add(writeSegment(e.getKey(), e.getValue(), data));
                    }
                    return CompletableFuture.allOf(segments.toArray(new CompletableFuture<?>[0]));
                })
                .handle((v, err) -> {
                    if (err != null) {
                        StorageException failure = asStorageException("Failed to write blocks " + result, err);
                        LOG.error("{}: {}", failure.getMessage(), rootMessage(failure));
                        throw failure;
                    }
                    LOG.trace("Wrote blocks {} ({} bytes)", result, data.length);
                    return result;
                });
    }

    private CompletableFuture<Void> writeSegment(int segment, List<Chunk> chunks, byte[] data) {
        Path path = dataDir.resolve(segmentFileName(segment));
        return onSegment(path, WRITE_OPTIONS, chunks, (channel, chunk) -> {
            ByteBuffer buf = ByteBuffer.wrap(data, chunk.bufferOffset(), chunk.length());
            long position = chunk.fileOffset();
            while (buf.hasRemaining()) {
                position += channel.write(buf, position);
            }
            LOG.trace("Wrote chunk {} to {} at offset {} ({} bytes)",
                    chunk.order(), path.getFileName(), chunk.fileOffset(), chunk.length());
        }, syncEnabled);
    }

    /**
     * Creates the data directory if needed and checks free space.
     * Runs on an I/O thread.
     */
    private void prepareForWrite() {
        try {
            Files.createDirectories(dataDir);
            checkDiskSpace();
        } catch (IOException e) {
            throw new StorageException("Cannot prepare data directory " + dataDir, e);
        }
    }

    // ========================================================================
    // Read
    // ========================================================================

    @Override
    public CompletableFuture<byte[]> read(List<Integer> blocks, int totalLength) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Block storage is closed"));
        }
        if (totalLength < 0) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Negative payload length: " + totalLength));
        }
        if ((long) blocks.size() * BLOCK_SIZE < totalLength) {
            return CompletableFuture.failedFuture(new StorageException(
                    "Block list too short: " + blocks.size() + " blocks cannot hold " + totalLength + " bytes"));
        }

        byte[] out = new byte[totalLength];
        Map<Integer, List<Chunk>> plan = plan(blocks, totalLength);
        LOG.debug("Reading {} bytes from {} blocks across {} segment(s)", totalLength, blocks.size(), plan.size());

        List<CompletableFuture<Void>> segments = new ArrayList<>(plan.size());
        for (Map.Entry<Integer, List<Chunk>> e : plan.entrySet()) {
            segments.add(readSegment(e.getKey(), e.getValue(), out));
        }
        return CompletableFuture.allOf(segments.toArray(new CompletableFuture<?>[0]))
                .handle((v, err) -> {
                    if (err != null) {
                        StorageException failure = asStorageException("Failed to read blocks " + blocks, err);
                        LOG.error("{}: {}", failure.getMessage(), rootMessage(failure));
                        throw failure;
                    }
                    return out;
                });
    }

    private CompletableFuture<Void> readSegment(int segment, List<Chunk> chunks, byte[] out) {
        Path path = dataDir.resolve(segmentFileName(segment));
        return onSegment(path, READ_OPTIONS, chunks, (channel, chunk) -> {
            ByteBuffer buf = ByteBuffer.wrap(out, chunk.bufferOffset(), chunk.length());
            long position = chunk.fileOffset();
            while (buf.hasRemaining()) {
                int n = channel.read(buf, position);
                if (n < 0) {
                    throw new StorageException("Short read in " + path.getFileName() + ": chunk "
                            + chunk.order() + " expected " + chunk.length() + " bytes at offset "
                            + chunk.fileOffset() + ", got " + (position - chunk.fileOffset()));
                }
                position += n;
            }
        }, false);
    }

    // ========================================================================
    // Close
    // ========================================================================

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Block storage already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        ioExecutor.shutdown();
        LOG.info("Block storage closed: {}", dataDir);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Groups chunks by segment, keeping chunk order within each segment.
     * Empty chunks carry no bytes and are left out.
     */
    private static Map<Integer, List<Chunk>> plan(List<Integer> blocks, int totalLength) {
        Map<Integer, List<Chunk>> bySegment = new LinkedHashMap<>();
        for (int i = 0; i < blocks.size(); i++) {
            int length = chunkLength(i, totalLength);
            if (length == 0) {
                continue;
            }
            int block = blocks.get(i);
            bySegment.computeIfAbsent(block / BLOCKS_PER_SEGMENT, k -> new ArrayList<>())
                    .add(new Chunk(i, block, length));
        }
        return bySegment;
    }

    /**
     * Opens one segment file, runs one I/O task per chunk against it and closes it
     * once every task has finished. The returned future fails if opening, any chunk,
     * the optional fsync, or closing fails.
     */
    private CompletableFuture<Void> onSegment(Path path, OpenOption[] options, List<Chunk> chunks,
                                              ChunkOperation operation, boolean force) {
        return CompletableFuture.supplyAsync(() -> openChannel(path, options), ioExecutor)
                .thenCompose(channel -> {
                    CompletableFuture<?>[] pending = new CompletableFuture<?>[chunks.size()];
                    for (int i = 0; i < pending.length; i++) {
                        Chunk chunk = chunks.get(i);
                        pending[i] = CompletableFuture.runAsync(() -> {
                            try {
                                operation.apply(channel, chunk);
                            } catch (IOException e) {
                                throw new StorageException("I/O error on " + path.getFileName()
                                        + " at chunk " + chunk.order(), e);
                            }
                        }, ioExecutor);
                    }
                    CompletableFuture<Void> done = CompletableFuture.allOf(pending)
                            .handle((v, err) -> {
                                Throwable failure = err;
                                try {
                                    if (failure == null && force) {
                                        channel.force(false);
                                        LOG.trace("Synced segment {}", path.getFileName());
                                    }
                                } catch (IOException e) {
                                    failure = e;
                                } finally {
                                    try {
                                        channel.close();
                                    } catch (IOException e) {
                                        if (failure == null) {
                                            failure = e;
                                        } else {
                                            failure.addSuppressed(e);
                                        }
                                    }
                                }
                                if (failure != null) {
                                    throw asStorageException("Segment " + path.getFileName() + " failed", failure);
                                }
                                return null;
                            });
                    return done;
                });
    }

    private static FileChannel openChannel(Path path, OpenOption[] options) {
        try {
            return FileChannel.open(path, options);
        } catch (NoSuchFileException e) {
            throw new StorageException("Segment file missing: " + path, e);
        } catch (IOException e) {
            throw new StorageException("Cannot open segment file " + path, e);
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    private void checkDiskSpace() throws IOException {
        if (minFreeSpace <= 0) {
            return;
        }
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        if (usableSpace < minFreeSpace) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpace / 1024 / 1024, minFreeSpace / 1024 / 1024);
            throw new StorageException("Insufficient disk space: " + usableSpace / 1024 / 1024
                    + " MB available, need at least " + minFreeSpace / 1024 / 1024 + " MB");
        }
    }

    /**
     * Unwraps {@link CompletionException} layers and returns a {@link StorageException},
     * wrapping the cause when it is something else.
     */
    static StorageException asStorageException(String message, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof StorageException) {
            return (StorageException) cause;
        }
        return new StorageException(message, cause);
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.toString();
    }

    /**
     * One chunk of a logical read or write.
     *
     * @param order  position of the chunk within the payload
     * @param block  global block index
     * @param length bytes carried by this chunk
     */
    private record Chunk(int order, int block, int length) {

        long fileOffset() {
            return (long) (block % BLOCKS_PER_SEGMENT) * BLOCK_SIZE;
        }

        int bufferOffset() {
            return order * BLOCK_SIZE;
        }
    }

    @FunctionalInterface
    private interface ChunkOperation {
        void apply(FileChannel channel, Chunk chunk) throws IOException;
    }
}
