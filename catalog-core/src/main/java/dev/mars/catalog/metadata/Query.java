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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * A filter plus an optional multi-key ordering.
 * <p>
 * Results are sorted stably by the keys in the order they were added. The single
 * {@code descending} flag applies to every key; elements that compare equal on all
 * keys keep their catalog order.
 *
 * <pre>{@code
 * Query<Entry> q = Query.where(Entries.hasTag("cat"))
 *         .orderBy(Entries.byId())
 *         .descending();
 * }</pre>
 *
 * @param <T> element type
 */
public final class Query<T> {

    private final Predicate<? super T> filter;
    private final List<Comparator<? super T>> order = new ArrayList<>();
    private boolean descending;

    private Query(Predicate<? super T> filter) {
        this.filter = filter;
    }

    /** Matches everything, unordered. */
    public static <T> Query<T> all() {
        return new Query<>(t -> true);
    }

    /** Matches elements accepted by {@code filter}. */
    public static <T> Query<T> where(Predicate<? super T> filter) {
        return new Query<>(filter);
    }

    /** Adds an ordering key. */
    public Query<T> orderBy(Comparator<? super T> key) {
        order.add(key);
        return this;
    }

    /** Reverses every ordering key. */
    public Query<T> descending() {
        this.descending = true;
        return this;
    }

    public boolean isDescending() {
        return descending;
    }

    public boolean isOrdered() {
        return !order.isEmpty();
    }

    /**
     * Filters {@code source} and sorts the matches when ordering keys are present.
     *
     * @return a new list, never the source
     */
    public List<T> apply(Collection<? extends T> source) {
        List<T> result = new ArrayList<>();
        for (T t : source) {
            if (filter.test(t)) {
                result.add(t);
            }
        }
        if (!order.isEmpty()) {
            Comparator<T> combined = (a, b) -> {
                for (Comparator<? super T> key : order) {
                    int c = key.compare(a, b);
                    if (c != 0) {
                        return descending ? -c : c;
                    }
                }
                return 0;
            };
            // List.sort is stable
            result.sort(combined);
        }
        return result;
    }
}
