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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The blocks holding one stored payload.
 *
 * @param blocks block indices in chunk order
 * @param size   payload length in bytes
 */
public record BlockRun(@JsonProperty("blocks") List<Integer> blocks,
                       @JsonProperty("size") int size) {

    public BlockRun {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        if (size < 0) {
            throw new IllegalArgumentException("Negative payload size: " + size);
        }
    }
}
