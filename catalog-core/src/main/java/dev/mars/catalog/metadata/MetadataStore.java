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
package dev.mars.catalog.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.catalog.crypto.CatalogCipher;
import dev.mars.catalog.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntConsumer;

/**
 * Holds the whole catalog in memory and persists it as one encrypted document.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ data.db       // encrypted JSON document (atomic replace)
 *  └─ data.db.tmp   // only present while a save is in flight
 * </pre>
 * <p>
 * <b>Block accounting:</b> every block index is either referenced by exactly one
 * image variant or queued in the free list. Removing an entry, dropping an image
 * through an update, or overwriting a variant moves the affected indices to the
 * tail of the free list; allocation takes from the head before advancing the
 * counter.
 * <p>
 * <b>Tags:</b> the global tag set only grows during a session. Removing the last
 * entry that uses a tag does not drop it; the next {@link #load()} rebuilds the set
 * from the stored entries and the tag is gone from then on.
 * <p>
 * <b>Thread Safety:</b> methods are synchronized so payload completions arriving
 * on I/O threads can record their blocks safely. Callers still have to serialize
 * logically conflicting operations on the same ids themselves.
 */
public final class MetadataStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataStore.class);

    /** Metadata document file name */
    public static final String STORAGE_FILE = "data.db";

    /** Temp file used for atomic replace */
    private static final String STORAGE_TMP_FILE = "data.db.tmp";

    /** Format version written into every document */
    public static final String FORMAT_VERSION = "v0.2.0";

    private final Path dataDir;
    private final CatalogCipher cipher;
    private final boolean syncEnabled;
    private final IntConsumer subItemRemoved;
    private final ObjectMapper mapper;

    private CatalogState state = CatalogState.empty();

    /**
     * @param dataDir        the storage folder
     * @param cipher         codec bound to the catalog passphrase
     * @param syncEnabled    whether saves are fsynced
     * @param subItemRemoved called with the id of every image whose payloads were released
     */
    public MetadataStore(Path dataDir, CatalogCipher cipher, boolean syncEnabled, IntConsumer subItemRemoved) {
        this.dataDir = dataDir;
        this.cipher = cipher;
        this.syncEnabled = syncEnabled;
        this.subItemRemoved = subItemRemoved;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ========================================================================
    // Load / Save
    // ========================================================================

    /**
     * Loads the catalog from disk.
     * <p>
     * Without a stored document the state is reset to an empty catalog and the
     * folder is created. With one, it is decoded and parsed into fresh state; if
     * that fails the current state is kept and {@code false} is returned.
     *
     * @return false if the stored document cannot be decoded with this passphrase
     * @throws StorageException if the folder cannot be created or the file cannot be read
     */
    public synchronized boolean load() {
        Path file = dataDir.resolve(STORAGE_FILE);
        if (!Files.exists(file)) {
            try {
                Files.createDirectories(dataDir);
            } catch (IOException e) {
                LOG.error("Cannot create storage folder {}: {}", dataDir, e.getMessage(), e);
                throw new StorageException("Cannot create storage folder " + dataDir, e);
            }
            state = CatalogState.empty();
            LOG.info("No catalog found at {}, starting empty", dataDir);
            return true;
        }

        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (IOException e) {
            LOG.error("Failed to read catalog {}: {}", file, e.getMessage(), e);
            throw new StorageException("Failed to read catalog " + file, e);
        }

        Optional<byte[]> json = cipher.decodeDocument(raw);
        if (json.isEmpty()) {
            LOG.warn("Catalog at {} cannot be decoded: wrong passphrase or corrupt file", dataDir);
            return false;
        }

        CatalogState loaded;
        try {
            CatalogDocument doc = mapper.readValue(json.get(), CatalogDocument.class);
            loaded = CatalogState.fromDocument(doc, mapper);
            if (!FORMAT_VERSION.equals(doc.version())) {
                LOG.info("Catalog written by format {}, current is {}", doc.version(), FORMAT_VERSION);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Catalog at {} is unreadable: {}", dataDir, e.getMessage());
            return false;
        }

        state = loaded;
        LOG.info("Catalog loaded: {} entries, {} tags, {} images with payloads, {} free blocks",
                state.entries.size(), state.tags.size(), state.blockMap.size(), state.freeBlocks.size());
        return true;
    }

    /**
     * Writes the whole catalog to disk, replacing the previous document atomically
     * (write temp, fsync, rename, fsync directory).
     *
     * @throws StorageException if the document cannot be written
     */
    public synchronized void save() {
        Path tmpPath = dataDir.resolve(STORAGE_TMP_FILE);
        Path path = dataDir.resolve(STORAGE_FILE);
        try {
            byte[] json = mapper.writeValueAsBytes(state.toDocument(mapper, FORMAT_VERSION));
            ByteBuffer buf = ByteBuffer.wrap(cipher.encodeDocument(json));

            Files.createDirectories(dataDir);
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                }
            }

            Files.move(tmpPath, path,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, path);

            if (syncEnabled) {
                syncDirectory(dataDir);
            }
            LOG.info("Catalog saved: {} entries, {} bytes", state.entries.size(), json.length);
        } catch (IOException e) {
            LOG.error("Failed to save catalog: {}", e.getMessage(), e);
            throw new StorageException("Failed to save catalog to " + path, e);
        }
    }

    // ========================================================================
    // Entries
    // ========================================================================

    public synchronized List<Entry> findEntries(Query<Entry> query) {
        return query.apply(state.entries.values());
    }

    public synchronized Optional<Entry> getEntry(int id) {
        return Optional.ofNullable(state.entries.get(id));
    }

    public synchronized List<String> findTags(Query<String> query) {
        return query.apply(state.tags);
    }

    /**
     * Adds entries, assigning ids where missing.
     * <p>
     * An entry whose id, or one of whose image ids, is already taken is skipped and
     * left out of the result.
     *
     * @return the entries that were added, with ids filled in
     */
    public synchronized List<Entry> createEntries(Collection<Entry> entries) {
        List<Entry> created = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.hasId() && state.entries.containsKey(entry.getId())) {
                LOG.warn("Skipping create: entry id {} already exists", entry.getId());
                continue;
            }
            if (!claimable(entry, Set.of(), new HashSet<>())) {
                continue;
            }
            if (!entry.hasId()) {
                entry.setId(state.nextEntryId++);
            } else {
                state.nextEntryId = Math.max(state.nextEntryId, entry.getId() + 1);
            }
            registerImages(entry);
            state.entries.put(entry.getId(), entry);
            state.foldTags(entry);
            created.add(entry);
        }
        LOG.debug("Created {} of {} entries", created.size(), entries.size());
        return created;
    }

    /**
     * Replaces stored entries by id. Entries with no stored counterpart are skipped,
     * as are entries claiming an image that stays with an entry outside the accepted
     * part of the batch, or that an earlier entry of the batch already claims.
     * <p>
     * The outcome does not depend on the order of the batch: an image may move from
     * one entry to another in either order. Images gained by an entry get ids; images
     * that no longer belong to any entry once the batch is applied have their payload
     * blocks released. What an entry owned before the update is taken from the
     * store's own records, not from the stored instance, which the caller may have
     * edited in place.
     *
     * @return the entries that replaced a stored one
     */
    public synchronized List<Entry> updateEntries(Collection<Entry> entries) {
        Map<Integer, Entry> accepted = new LinkedHashMap<>();
        for (Entry entry : entries) {
            if (!entry.hasId() || !state.entries.containsKey(entry.getId())) {
                LOG.debug("Skipping update: no entry with id {}", entry.getId());
            } else if (accepted.putIfAbsent(entry.getId(), entry) != null) {
                LOG.warn("Skipping update: entry id {} appears twice in one batch", entry.getId());
            }
        }

        // rejecting one entry keeps its images in place, which can invalidate another claim
        boolean changed = true;
        while (changed) {
            changed = false;
            Set<Integer> claimed = new HashSet<>();
            for (Iterator<Entry> it = accepted.values().iterator(); it.hasNext(); ) {
                Entry entry = it.next();
                if (!claimable(entry, accepted.keySet(), claimed)) {
                    it.remove();
                    changed = true;
                    break;
                }
            }
        }

        Set<Integer> dropped = new LinkedHashSet<>(detachImages(accepted.keySet()));
        for (Entry entry : accepted.values()) {
            registerImages(entry);
            state.entries.put(entry.getId(), entry);
            state.foldTags(entry);
        }
        dropped.removeAll(state.subItemOwners.keySet());
        for (int subItemId : dropped) {
            releaseSubItem(subItemId);
        }
        LOG.debug("Updated {} of {} entries, {} images dropped", accepted.size(), entries.size(), dropped.size());
        return new ArrayList<>(accepted.values());
    }

    /**
     * Removes entries by id and releases the payload blocks of all their images.
     *
     * @return the number of entries removed
     */
    public synchronized int deleteEntries(Collection<Integer> ids) {
        Set<Integer> removed = new LinkedHashSet<>();
        for (Integer id : ids) {
            if (id != null && state.entries.remove(id) != null) {
                removed.add(id);
            }
        }
        int freed = 0;
        for (int subItemId : detachImages(removed)) {
            freed += releaseSubItem(subItemId);
        }
        LOG.debug("Deleted {} entries, {} blocks released", removed.size(), freed);
        return removed.size();
    }

    /**
     * Checks the images of an entry against the current owners. An image is free to
     * claim when it is unowned or owned by an entry that is itself being replaced,
     * and no earlier entry of the batch claimed it.
     */
    private boolean claimable(Entry entry, Set<Integer> replaced, Set<Integer> claimed) {
        Set<Integer> own = new HashSet<>();
        for (SubItem image : entry.getImages()) {
            if (!image.hasId()) {
                continue;
            }
            Integer owner = state.subItemOwners.get(image.getId());
            if ((owner != null && !replaced.contains(owner)) || !own.add(image.getId())
                    || claimed.contains(image.getId())) {
                LOG.warn("Skipping entry {}: image id {} already in use", entry.getId(), image.getId());
                return false;
            }
        }
        claimed.addAll(own);
        return true;
    }

    /**
     * Drops the owner records of every image owned by one of {@code ownerIds}.
     *
     * @return the ids of the detached images
     */
    private List<Integer> detachImages(Set<Integer> ownerIds) {
        List<Integer> detached = new ArrayList<>();
        if (ownerIds.isEmpty()) {
            return detached;
        }
        Iterator<Map.Entry<Integer, Integer>> it = state.subItemOwners.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, Integer> owner = it.next();
            if (ownerIds.contains(owner.getValue())) {
                detached.add(owner.getKey());
                it.remove();
            }
        }
        detached.sort(null);
        return detached;
    }

    private void registerImages(Entry entry) {
        for (SubItem image : entry.getImages()) {
            if (!image.hasId()) {
                image.setId(state.nextSubItemId++);
            } else {
                state.nextSubItemId = Math.max(state.nextSubItemId, image.getId() + 1);
            }
            state.subItemOwners.put(image.getId(), entry.getId());
        }
    }

    private int releaseSubItem(int subItemId) {
        int freed = state.releaseSubItem(subItemId);
        subItemRemoved.accept(subItemId);
        return freed;
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    /**
     * Hands out a block index: the oldest freed one if any, else the next new one.
     */
    public synchronized int allocateBlock() {
        return state.allocateBlock();
    }

    /**
     * Returns allocated but unrecorded block indices to the free list.
     */
    public synchronized void releaseBlocks(Collection<Integer> blocks) {
        state.freeBlocks.addAll(blocks);
        LOG.debug("Released {} unused blocks", blocks.size());
    }

    public synchronized Optional<BlockRun> getBlockRun(int subItemId, Variant variant) {
        EnumMap<Variant, BlockRun> variants = state.blockMap.get(subItemId);
        return variants == null ? Optional.empty() : Optional.ofNullable(variants.get(variant));
    }

    /**
     * Records where a variant of an image is stored. Blocks of the run it replaces,
     * if any, go to the free list.
     * <p>
     * Only images that belong to an entry can hold blocks. For any other id, including
     * an image removed while its payload was being written, the run's blocks go
     * straight to the free list and nothing is recorded.
     *
     * @return false if no entry owns the image
     */
    public synchronized boolean recordBlockRun(int subItemId, Variant variant, BlockRun run) {
        if (!state.subItemOwners.containsKey(subItemId)) {
            state.freeBlocks.addAll(run.blocks());
            LOG.warn("Image {} is not in the catalog, released {} blocks of its {}",
                    subItemId, run.blocks().size(), variant.key());
            return false;
        }
        BlockRun previous = state.blockMap
                .computeIfAbsent(subItemId, k -> new EnumMap<>(Variant.class))
                .put(variant, run);
        if (previous != null) {
            state.freeBlocks.addAll(previous.blocks());
            LOG.debug("Replaced {} of image {}, released {} blocks", variant.key(), subItemId, previous.blocks().size());
        }
        return true;
    }

    /** True when an entry owns the image. */
    public synchronized boolean hasSubItem(int subItemId) {
        return state.subItemOwners.containsKey(subItemId);
    }

    public synchronized int nextEntryId() {
        return state.nextEntryId;
    }

    public synchronized int nextSubItemId() {
        return state.nextSubItemId;
    }

    public synchronized int nextBlockIndex() {
        return state.nextBlockIndex;
    }

    /** Snapshot of the free list, oldest first. */
    public synchronized List<Integer> freeBlocks() {
        return List.copyOf(state.freeBlocks);
    }

    // ========================================================================
    // Config
    // ========================================================================

    public synchronized Optional<JsonNode> getConfig(String key) {
        return Optional.ofNullable(state.config.get(key));
    }

    public synchronized void putConfig(String key, Object value) {
        state.config.put(key, mapper.valueToTree(value));
    }

    public synchronized boolean existsConfig(String key) {
        return state.config.containsKey(key);
    }

    /**
     * Reads a typed setting. Absent keys and values that do not convert to the
     * key's type yield the key's default.
     */
    public synchronized <T> T getConfig(ConfigKey<T> key) {
        JsonNode node = state.config.get(key.name());
        if (node == null || node.isNull()) {
            return key.defaultValue();
        }
        try {
            return mapper.treeToValue(node, key.type());
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Config {} is not a {}: {}", key.name(), key.type().getSimpleName(), e.getMessage());
            return key.defaultValue();
        }
    }

    public synchronized <T> void putConfig(ConfigKey<T> key, T value) {
        putConfig(key.name(), value);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Fsyncs a directory so the rename is durable. Skipped on Windows.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            // Some systems don't support directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
