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
import dev.mars.catalog.metadata.ConfigKey;
import dev.mars.catalog.metadata.Entry;
import dev.mars.catalog.metadata.Query;
import dev.mars.catalog.metadata.Variant;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Data access surface of one catalog.
 * <p>
 * The application works against this interface only; which backend sits behind it
 * is decided when the catalog is opened.
 * <p>
 * Metadata calls are synchronous and act on the in-memory catalog, which is
 * written to disk on {@link #close()}. Payload calls return futures.
 * <p>
 * Data calls are only accepted between a successful {@link #connect()} and
 * {@link #close()}. Otherwise synchronous calls throw {@link IllegalStateException}
 * and payload calls return a future failed with
 * {@link dev.mars.catalog.storage.StorageException}.
 *
 * @see LocalDataEngine
 */
public interface DataEngine extends Closeable {

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Loads the catalog.
     *
     * @return false if the stored catalog cannot be decoded with the given passphrase
     */
    boolean connect();

    /**
     * Waits for pending payload calls, persists the catalog and releases resources.
     * Idempotent.
     */
    @Override
    void close();

    // ========================================================================
    // Entries & Tags
    // ========================================================================

    List<Entry> findEntries(Query<Entry> query);

    /**
     * @return the created entries, with ids assigned
     */
    List<Entry> createEntries(Collection<Entry> entries);

    /**
     * @return the entries that matched a stored id and replaced it
     */
    List<Entry> updateEntries(Collection<Entry> entries);

    /**
     * @return the number of entries removed
     */
    int deleteEntries(Collection<Entry> entries);

    /**
     * @return the number of entries removed
     */
    int deleteEntryIds(Collection<Integer> ids);

    List<String> findTags(Query<String> query);

    // ========================================================================
    // Payloads
    // ========================================================================

    /**
     * Stores the original image and its exhibition rendition.
     * <p>
     * The two variants are written one after the other and are not atomic as a pair:
     * if the second write fails the first stays recorded.
     *
     * @param subItemId the image id, which must belong to an entry
     * @param original  the raw image bytes
     * @return a Future that completes when both variants are written and recorded,
     *         failed with {@link IllegalArgumentException} for an unknown image
     */
    CompletableFuture<Void> savePayload(int subItemId, byte[] original);

    /**
     * Loads one variant of an image.
     *
     * @return a Future with the bytes, or empty if the variant was never stored
     */
    CompletableFuture<Optional<byte[]>> loadPayload(int subItemId, Variant variant);

    // ========================================================================
    // Config
    // ========================================================================

    Optional<JsonNode> getConfig(String key);

    void putConfig(String key, Object value);

    boolean existsConfig(String key);

    <T> T getConfig(ConfigKey<T> key);

    <T> void putConfig(ConfigKey<T> key, T value);
}
