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

import java.util.Comparator;
import java.util.function.Predicate;

/**
 * Predicates and ordering keys over {@link Entry}.
 */
public final class Entries {

    private Entries() {
    }

    /**
     * Matches entries carrying {@code tag} on the entry itself or on any of its images.
     */
    public static Predicate<Entry> hasTag(String tag) {
        return entry -> entry.getTags().contains(tag)
                || entry.getImages().stream().anyMatch(image -> image.getSubTags().contains(tag));
    }

    /** Orders by entry id. */
    public static Comparator<Entry> byId() {
        return Comparator.comparing(Entry::getId, Comparator.nullsFirst(Comparator.<Integer>naturalOrder()));
    }

    /**
     * Orders by an application attribute, or by id when {@code name} is {@code "id"}.
     * <p>
     * Numbers compare numerically, strings lexically, anything else by its string form.
     * Entries without the attribute sort first.
     */
    public static Comparator<Entry> byAttribute(String name) {
        if ("id".equals(name)) {
            return byId();
        }
        return (a, b) -> compareValues(a.attribute(name), b.attribute(name));
    }

    static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        return a.toString().compareTo(b.toString());
    }
}
