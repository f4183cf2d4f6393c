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

import java.util.Optional;

/**
 * Named renditions of an image payload.
 */
public enum Variant {

    /** The bytes as imported. */
    ORIGIN("origin"),

    /** Rescaled rendition for on-screen display. */
    EXHIBITION("exhibition"),

    /** Small preview. */
    THUMBNAIL("thumbnail");

    private final String key;

    Variant(String key) {
        this.key = key;
    }

    /** The name used in the persisted block map. */
    public String key() {
        return key;
    }

    /**
     * Looks a variant up by its persisted name.
     */
    public static Optional<Variant> fromKey(String key) {
        for (Variant v : values()) {
            if (v.key.equals(key)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
