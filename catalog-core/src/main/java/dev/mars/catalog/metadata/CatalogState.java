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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * In-memory tables of one catalog session.
 * <p>
 * Entries and images are addressed by id; images point back at their owning entry
 * through {@link #subItemOwners} instead of holding a reference. A fresh instance is
 * built on every load and only swapped in once it is complete, so a failed load
 * never touches the live state.
 */
final class CatalogState {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogState.class);

    /** entry id -> entry, in catalog order */
    final Map<Integer, Entry> entries = new LinkedHashMap<>();

    /** image id -> owning entry id */
    final Map<Integer, Integer> subItemOwners = new HashMap<>();

    /** image id -> variant -> blocks */
    final Map<Integer, EnumMap<Variant, BlockRun>> blockMap = new TreeMap<>();

    /** released block indices, oldest first */
    final Deque<Integer> freeBlocks = new ArrayDeque<>();

    /** grow-only during a session, rebuilt from the entries on load */
    final Set<String> tags = new LinkedHashSet<>();

    final Map<String, JsonNode> config = new LinkedHashMap<>();

    int nextEntryId = 1;
    int nextSubItemId = 1;
    int nextBlockIndex = 0;

    static CatalogState empty() {
        return new CatalogState();
    }

    // ========================================================================
    // Tags
    // ========================================================================

    void foldTags(Entry entry) {
        tags.addAll(entry.getTags());
        for (SubItem image : entry.getImages()) {
            tags.addAll(image.getSubTags());
        }
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    int allocateBlock() {
        Integer reused = freeBlocks.pollFirst();
        if (reused != null) {
            return reused;
        }
        return nextBlockIndex++;
    }

    /**
     * Drops every variant of an image from the block map and frees its blocks.
     *
     * @return the number of blocks freed
     */
    int releaseSubItem(int subItemId) {
        EnumMap<Variant, BlockRun> variants = blockMap.remove(subItemId);
        if (variants == null) {
            return 0;
        }
        int freed = 0;
        for (BlockRun run : variants.values()) {
            freeBlocks.addAll(run.blocks());
            freed += run.blocks().size();
        }
        return freed;
    }

    // ========================================================================
    // Document conversion
    // ========================================================================

    /**
     * Rebuilds state from a parsed document.
     *
     * @throws JsonProcessingException  if a block run cannot be mapped
     * @throws IllegalArgumentException if the document breaks an id invariant
     */
    static CatalogState fromDocument(CatalogDocument doc, ObjectMapper mapper) throws JsonProcessingException {
        CatalogState state = new CatalogState();

        if (doc.nextIndex() != null) {
            state.nextEntryId = Math.max(1, doc.nextIndex().nextIllustrationId());
            state.nextSubItemId = Math.max(1, doc.nextIndex().nextImageId());
            state.nextBlockIndex = Math.max(0, doc.nextIndex().nextBlockIndex());
        }

        if (doc.illustrations() != null) {
            for (Entry entry : doc.illustrations()) {
                if (!entry.hasId()) {
                    throw new IllegalArgumentException("Stored entry without id");
                }
                if (state.entries.putIfAbsent(entry.getId(), entry) != null) {
                    throw new IllegalArgumentException("Duplicate entry id " + entry.getId());
                }
                state.nextEntryId = Math.max(state.nextEntryId, entry.getId() + 1);
                for (SubItem image : entry.getImages()) {
                    if (!image.hasId()) {
                        throw new IllegalArgumentException("Stored image without id in entry " + entry.getId());
                    }
                    if (state.subItemOwners.putIfAbsent(image.getId(), entry.getId()) != null) {
                        throw new IllegalArgumentException("Duplicate image id " + image.getId());
                    }
                    state.nextSubItemId = Math.max(state.nextSubItemId, image.getId() + 1);
                }
                state.foldTags(entry);
            }
        }

        readBlockMap(doc.blocks(), state, mapper);

        if (doc.unusedBlocks() != null) {
            for (Integer block : doc.unusedBlocks()) {
                if (block != null) {
                    state.freeBlocks.addLast(block);
                }
            }
        }

        if (doc.config() != null) {
            state.config.putAll(doc.config());
        }

        int highest = state.freeBlocks.stream().mapToInt(Integer::intValue).max().orElse(-1);
        for (EnumMap<Variant, BlockRun> variants : state.blockMap.values()) {
            for (BlockRun run : variants.values()) {
                for (int block : run.blocks()) {
                    highest = Math.max(highest, block);
                }
            }
        }
        if (highest >= state.nextBlockIndex) {
            LOG.warn("Block counter {} is behind stored block {}, advancing", state.nextBlockIndex, highest);
            state.nextBlockIndex = highest + 1;
        }
        return state;
    }

    private static void readBlockMap(JsonNode blocks, CatalogState state, ObjectMapper mapper)
            throws JsonProcessingException {
        if (blocks == null || blocks.isNull()) {
            return;
        }
        if (blocks.isArray()) {
            // older layout: position is the image id, unused positions are null
            for (int i = 0; i < blocks.size(); i++) {
                readVariants(i, blocks.get(i), state, mapper);
            }
        } else if (blocks.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = blocks.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                int subItemId;
                try {
                    subItemId = Integer.parseInt(field.getKey());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Non-numeric image id in block map: " + field.getKey(), e);
                }
                readVariants(subItemId, field.getValue(), state, mapper);
            }
        } else {
            throw new IllegalArgumentException("Unexpected block map node: " + blocks.getNodeType());
        }
    }

    private static void readVariants(int subItemId, JsonNode node, CatalogState state, ObjectMapper mapper)
            throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            return;
        }
        EnumMap<Variant, BlockRun> variants = new EnumMap<>(Variant.class);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Variant variant = Variant.fromKey(field.getKey()).orElse(null);
            if (variant == null || field.getValue() == null || !field.getValue().isObject()) {
                LOG.warn("Skipping block map record {}/{}", subItemId, field.getKey());
                continue;
            }
            variants.put(variant, mapper.treeToValue(field.getValue(), BlockRun.class));
        }
        if (!variants.isEmpty()) {
            state.blockMap.put(subItemId, variants);
        }
    }

    CatalogDocument toDocument(ObjectMapper mapper, String version) {
        ObjectNode blocks = mapper.createObjectNode();
        for (Map.Entry<Integer, EnumMap<Variant, BlockRun>> e : blockMap.entrySet()) {
            ObjectNode variants = blocks.putObject(String.valueOf(e.getKey()));
            for (Map.Entry<Variant, BlockRun> v : e.getValue().entrySet()) {
                variants.set(v.getKey().key(), mapper.valueToTree(v.getValue()));
            }
        }
        return new CatalogDocument(
                version,
                new CatalogDocument.Counters(nextEntryId, nextSubItemId, nextBlockIndex),
                new ArrayList<>(entries.values()),
                blocks,
                List.copyOf(freeBlocks),
                new LinkedHashMap<>(config));
    }
}
