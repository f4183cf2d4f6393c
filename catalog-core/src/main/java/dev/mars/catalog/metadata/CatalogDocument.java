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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * The persisted form of the catalog, as stored (encrypted) in {@code data.db}.
 * <p>
 * Field names follow the existing on-disk format. The tag set is not persisted;
 * it is derived from the entries on load. {@code blocks} is kept as a tree because
 * older writers stored it as an array indexed by image id rather than an object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "nextIndex", "illustrations", "blocks", "unusedBlocks", "config"})
record CatalogDocument(
        @JsonProperty("version") String version,
        @JsonProperty("nextIndex") Counters nextIndex,
        @JsonProperty("illustrations") List<Entry> illustrations,
        @JsonProperty("blocks") JsonNode blocks,
        @JsonProperty("unusedBlocks") List<Integer> unusedBlocks,
        @JsonProperty("config") Map<String, JsonNode> config
) {

    /**
     * Id and block counters.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Counters(
            @JsonProperty("nextIllustrationId") int nextIllustrationId,
            @JsonProperty("nextImageId") int nextImageId,
            @JsonProperty("nextBlockIndex") int nextBlockIndex
    ) {
    }
}
