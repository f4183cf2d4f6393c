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

/**
 * A typed key into the catalog's configuration map.
 * <p>
 * The map itself stays open so settings written by other versions of the
 * application survive; a key only fixes how one entry is read and what is
 * returned when it is absent or unreadable.
 *
 * <pre>{@code
 * static final ConfigKey<Integer> GRID_COLUMNS = ConfigKey.of("gridColumns", Integer.class, 4);
 * int columns = engine.getConfig(GRID_COLUMNS);
 * }</pre>
 *
 * @param name         map key
 * @param type         value type, converted through Jackson
 * @param defaultValue returned when the key is absent
 * @param <T>          value type
 */
public record ConfigKey<T>(String name, Class<T> type, T defaultValue) {

    public ConfigKey {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("config key name must not be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("config key type must not be null");
        }
    }

    public static <T> ConfigKey<T> of(String name, Class<T> type, T defaultValue) {
        return new ConfigKey<>(name, type, defaultValue);
    }
}
