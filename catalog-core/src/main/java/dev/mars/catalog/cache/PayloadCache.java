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
package dev.mars.catalog.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.mars.catalog.metadata.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decoded payloads keyed by (variant, image id), so repeated loads skip the block
 * reads and the decryption.
 * <p>
 * The cache is bounded by total payload bytes and evicts the least recently used
 * payloads first. Entries live for the engine session; removing an image drops all
 * of its variants.
 */
public final class PayloadCache {

    private static final Logger LOG = LoggerFactory.getLogger(PayloadCache.class);

    private final Cache<Key, byte[]> cache;

    /**
     * @param maxBytes upper bound of cached payload bytes; 0 disables caching
     */
    public PayloadCache(long maxBytes) {
        this.cache = Caffeine.newBuilder()
                .maximumWeight(maxBytes)
                .weigher((Key key, byte[] value) -> value.length)
                .build();
        LOG.debug("PayloadCache created: maxBytes={}", maxBytes);
    }

    public Optional<byte[]> get(Variant variant, int subItemId) {
        return Optional.ofNullable(cache.getIfPresent(new Key(variant, subItemId)));
    }

    public void put(Variant variant, int subItemId, byte[] payload) {
        cache.put(new Key(variant, subItemId), payload);
    }

    /**
     * Drops every variant of one image.
     */
    public void invalidate(int subItemId) {
        for (Variant variant : Variant.values()) {
            cache.invalidate(new Key(variant, subItemId));
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /** Approximate number of cached payloads. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Key(Variant variant, int subItemId) {
    }
}
