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
package dev.mars.catalog.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.catalog.CatalogConfig;
import dev.mars.catalog.cache.PayloadCache;
import dev.mars.catalog.crypto.CatalogCipher;
import dev.mars.catalog.metadata.BlockRun;
import dev.mars.catalog.metadata.ConfigKey;
import dev.mars.catalog.metadata.Entry;
import dev.mars.catalog.metadata.MetadataStore;
import dev.mars.catalog.metadata.Query;
import dev.mars.catalog.metadata.Variant;
import dev.mars.catalog.storage.BlockStorage;
import dev.mars.catalog.storage.SegmentBlockStorage;
import dev.mars.catalog.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link DataEngine} over a local storage folder.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ data.db        // encrypted catalog document, see {@link MetadataStore}
 *  ├─ block-a.dat    // encrypted payload blocks, see {@link SegmentBlockStorage}
 *  └─ ...
 * </pre>
 * <p>
 * The folder must be owned by a single engine instance at a time. Two engines on
 * the same folder will overwrite each other's catalog and hand out the same blocks.
 * <p>
 * <b>Payload path:</b> save encrypts the bytes, writes them through block storage
 * and records the blocks in the catalog; load checks the {@link PayloadCache},
 * then reads and decrypts. If a write fails, the blocks allocated for it return to
 * the free list.
 * <p>
 * <b>Lifecycle:</b> every data call requires a successful {@link #connect()} and
 * fails once {@link #close()} has started. A catalog that could not be decoded is
 * never written to, so its payload blocks cannot be handed out again. Close waits
 * for payload operations still in flight before saving.
 */
public final class LocalDataEngine implements DataEngine {

    private static final Logger LOG = LoggerFactory.getLogger(LocalDataEngine.class);

    private final CatalogConfig config;
    private final CatalogCipher cipher;
    private final ImageTranscoder transcoder;
    private final PayloadCache cache;
    private final MetadataStore store;
    private final BlockStorage blocks;

    /** payload futures not yet completed; also guards the lifecycle flags */
    private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

    private volatile boolean connected = false;
    private volatile boolean closed = false;

    /**
     * Creates an engine over {@code config.dataDir()}. Nothing is read until
     * {@link #connect()}.
     *
     * @param config     the catalog configuration
     * @param passphrase the catalog passphrase
     * @param transcoder produces exhibition renditions
     */
    public LocalDataEngine(CatalogConfig config, String passphrase, ImageTranscoder transcoder) {
        this(config, passphrase, transcoder, new SegmentBlockStorage(config));
    }

    LocalDataEngine(CatalogConfig config, String passphrase, ImageTranscoder transcoder, BlockStorage blocks) {
        this.config = config;
        this.cipher = new CatalogCipher(passphrase);
        this.transcoder = transcoder;
        this.cache = new PayloadCache(config.cacheMaxBytes());
        this.store = new MetadataStore(config.dataDir(), cipher, config.syncEnabled(), cache::invalidate);
        this.blocks = blocks;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public boolean connect() {
        if (closed) {
            throw new IllegalStateException("Engine is closed");
        }
        LOG.info("Connecting catalog at {}", config.dataDir());
        connected = store.load();
        return connected;
    }

    /**
     * Waits for in-flight payload operations, saves the catalog if it was loaded
     * successfully, then releases the cache and the I/O threads. A catalog that
     * failed to load is never written back.
     */
    @Override
    public void close() {
        CompletableFuture<?>[] inFlight;
        synchronized (pending) {
            if (closed) {
                LOG.debug("Engine already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
            inFlight = pending.toArray(new CompletableFuture<?>[0]);
        }
        if (inFlight.length > 0) {
            LOG.info("Waiting for {} payload operation(s) before closing", inFlight.length);
            // failures were already reported through the futures themselves
            CompletableFuture.allOf(inFlight).handle((v, err) -> null).join();
        }
        try {
            if (connected) {
                store.save();
            } else {
                LOG.warn("Catalog at {} was never loaded, not saving", config.dataDir());
            }
        } finally {
            cache.invalidateAll();
            blocks.close();
            LOG.info("Catalog closed: {}", config.dataDir());
        }
    }

    /** The metadata store behind this engine. */
    public MetadataStore metadata() {
        return store;
    }

    // ========================================================================
    // Entries & Tags
    // ========================================================================

    @Override
    public List<Entry> findEntries(Query<Entry> query) {
        requireOpen();
        return store.findEntries(query);
    }

    @Override
    public List<Entry> createEntries(Collection<Entry> entries) {
        requireOpen();
        return store.createEntries(entries);
    }

    @Override
    public List<Entry> updateEntries(Collection<Entry> entries) {
        requireOpen();
        return store.updateEntries(entries);
    }

    @Override
    public int deleteEntries(Collection<Entry> entries) {
        requireOpen();
        List<Integer> ids = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            ids.add(entry.getId());
        }
        return store.deleteEntries(ids);
    }

    @Override
    public int deleteEntryIds(Collection<Integer> ids) {
        requireOpen();
        return store.deleteEntries(ids);
    }

    @Override
    public List<String> findTags(Query<String> query) {
        requireOpen();
        return store.findTags(query);
    }

    // ========================================================================
    // Payloads
    // ========================================================================

    @Override
    public CompletableFuture<Void> savePayload(int subItemId, byte[] original) {
        return track(() -> {
            if (!store.hasSubItem(subItemId)) {
                return CompletableFuture.failedFuture(
                        new IllegalArgumentException("No image with id " + subItemId + " in the catalog"));
            }
            LOG.debug("Saving payload of image {} ({} bytes)", subItemId, original.length);
            cache.invalidate(subItemId);
            return writePayload(subItemId, original);
        });
    }

    private CompletableFuture<Void> writePayload(int subItemId, byte[] original) {
        return writeVariant(subItemId, Variant.ORIGIN, original)
                .thenCompose(v -> writeVariant(subItemId, Variant.EXHIBITION, transcoder.toExhibition(original)))
                .whenComplete((v, err) -> {
                    cache.invalidate(subItemId);
                    if (err != null) {
                        LOG.error("Saving payload of image {} failed: {}", subItemId, err.getMessage());
                    } else {
                        LOG.info("Saved payload of image {}", subItemId);
                    }
                });
    }

    private CompletableFuture<Void> writeVariant(int subItemId, Variant variant, byte[] bytes) {
        byte[] encoded = cipher.encodePayload(bytes);
        List<Integer> allocated = new ArrayList<>();
        return blocks.write(encoded, () -> {
                    int block = store.allocateBlock();
                    allocated.add(block);
                    return block;
                })
                .handle((written, err) -> {
                    if (err != null) {
                        store.releaseBlocks(allocated);
                        throw err instanceof CompletionException
                                ? (CompletionException) err
                                : new CompletionException(err);
                    }
                    if (!store.recordBlockRun(subItemId, variant, new BlockRun(written, encoded.length))) {
                        throw new CompletionException(new IllegalStateException(
                                "Image " + subItemId + " was removed while its payload was written"));
                    }
                    LOG.debug("Recorded {} of image {}: blocks={}, size={}",
                            variant.key(), subItemId, written, encoded.length);
                    return null;
                });
    }

    /**
     * Loads one variant of an image. The returned array is shared with the cache
     * and must not be modified.
     */
    @Override
    public CompletableFuture<Optional<byte[]>> loadPayload(int subItemId, Variant variant) {
        return track(() -> readPayload(subItemId, variant));
    }

    private CompletableFuture<Optional<byte[]>> readPayload(int subItemId, Variant variant) {
        Optional<byte[]> cached = cache.get(variant, subItemId);
        if (cached.isPresent()) {
            LOG.trace("Cache hit: {} of image {}", variant.key(), subItemId);
            return CompletableFuture.completedFuture(cached);
        }
        Optional<BlockRun> run = store.getBlockRun(subItemId, variant);
        if (run.isEmpty()) {
            LOG.debug("No {} stored for image {}", variant.key(), subItemId);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        BlockRun r = run.get();
        return blocks.read(r.blocks(), r.size())
                .thenApply(raw -> {
                    byte[] decoded = cipher.decodePayload(raw);
                    cache.put(variant, subItemId, decoded);
                    return Optional.of(decoded);
                });
    }

    /**
     * Starts a payload operation if the engine is open and keeps it in
     * {@link #pending} until it completes.
     */
    private <T> CompletableFuture<T> track(Supplier<CompletableFuture<T>> operation) {
        synchronized (pending) {
            if (closed || !connected) {
                return CompletableFuture.failedFuture(new StorageException(notOpenMessage()));
            }
            CompletableFuture<T> future = operation.get();
            pending.add(future);
            future.whenComplete((v, err) -> pending.remove(future));
            return future;
        }
    }

    // ========================================================================
    // Config
    // ========================================================================

    @Override
    public Optional<JsonNode> getConfig(String key) {
        requireOpen();
        return store.getConfig(key);
    }

    @Override
    public void putConfig(String key, Object value) {
        requireOpen();
        store.putConfig(key, value);
    }

    @Override
    public boolean existsConfig(String key) {
        requireOpen();
        return store.existsConfig(key);
    }

    @Override
    public <T> T getConfig(ConfigKey<T> key) {
        requireOpen();
        return store.getConfig(key);
    }

    @Override
    public <T> void putConfig(ConfigKey<T> key, T value) {
        requireOpen();
        store.putConfig(key, value);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void requireOpen() {
        if (closed || !connected) {
            throw new IllegalStateException(notOpenMessage());
        }
    }

    private String notOpenMessage() {
        return closed
                ? "Engine for " + config.dataDir() + " is closed"
                : "Catalog at " + config.dataDir() + " is not connected";
    }
}
