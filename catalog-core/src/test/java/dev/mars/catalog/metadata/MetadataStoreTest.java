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

import dev.mars.catalog.crypto.CatalogCipher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MetadataStore}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Id assignment and uniqueness</li>
 *   <li>Find with filters and multi-key ordering</li>
 *   <li>Block allocation and reclamation through the free list</li>
 *   <li>Persistence, fail-closed loading and the older document layout</li>
 * </ul>
 */
class MetadataStoreTest {

    @TempDir
    Path tempDir;

    private Path dataDir;
    private List<Integer> removedImages;
    private MetadataStore store;

    @BeforeEach
    void setUp() {
        dataDir = tempDir.resolve("catalog");
        removedImages = new ArrayList<>();
        store = newStore("secret");
        assertTrue(store.load());
    }

    private MetadataStore newStore(String passphrase) {
        return new MetadataStore(dataDir, new CatalogCipher(passphrase), false, removedImages::add);
    }

    private static Entry entry(String... tags) {
        return new Entry().tag(tags);
    }

    // ========================================================================
    // Load
    // ========================================================================

    @Nested
    @DisplayName("Loading")
    class LoadTests {

        @Test
        @DisplayName("Missing document gives an empty catalog and creates the folder")
        void emptyCatalog() {
            assertTrue(Files.isDirectory(dataDir));
            assertEquals(1, store.nextEntryId());
            assertEquals(1, store.nextSubItemId());
            assertEquals(0, store.nextBlockIndex());
            assertTrue(store.findEntries(Query.all()).isEmpty());
            assertTrue(store.findTags(Query.all()).isEmpty());
            assertTrue(store.freeBlocks().isEmpty());
        }

        @Test
        @DisplayName("Existing folder without document is fine")
        void existingFolder() {
            assertTrue(newStore("secret").load());
        }

        @Test
        @DisplayName("Wrong passphrase fails and keeps in-memory state")
        void wrongPassphrase() {
            store.createEntries(List.of(entry("a")));
            store.save();

            MetadataStore other = newStore("not-the-secret");
            other.createEntries(List.of(entry("keep-me")));

            assertFalse(other.load());
            assertEquals(List.of("keep-me"), other.findTags(Query.all()));
            assertEquals(1, other.findEntries(Query.all()).size());
        }

        @Test
        @DisplayName("Corrupt document fails to load")
        void corruptDocument() throws Exception {
            Files.write(dataDir.resolve(MetadataStore.STORAGE_FILE), new byte[]{1, 2, 3, 4, 5});

            assertFalse(newStore("secret").load());
        }

        @Test
        @DisplayName("Decodable but malformed JSON fails to load")
        void malformedJson() throws Exception {
            byte[] bad = new CatalogCipher("secret").encodeDocument("{not json".getBytes(StandardCharsets.UTF_8));
            Files.write(dataDir.resolve(MetadataStore.STORAGE_FILE), bad);

            assertFalse(newStore("secret").load());
        }

        @Test
        @DisplayName("Document with duplicate entry ids fails to load")
        void duplicateIds() throws Exception {
            String json = "{\"version\":\"v0.2.0\",\"nextIndex\":{\"nextIllustrationId\":3,\"nextImageId\":1,"
                    + "\"nextBlockIndex\":0},\"illustrations\":[{\"id\":1,\"tags\":[],\"images\":[]},"
                    + "{\"id\":1,\"tags\":[],\"images\":[]}],\"blocks\":{},\"unusedBlocks\":[],\"config\":{}}";
            writeDocument(json);

            assertFalse(newStore("secret").load());
        }

        @Test
        @DisplayName("Older layout with array block map loads")
        void legacyDocument() throws Exception {
            String json = "{\"version\":\"v0.2.0\","
                    + "\"nextIndex\":{\"nextIllustrationId\":2,\"nextImageId\":3,\"nextBlockIndex\":4},"
                    + "\"illustrations\":[{\"id\":1,\"tags\":[\"cat\"],\"title\":\"Old\","
                    + "\"images\":[{\"id\":1,\"subTags\":[\"sleepy\"]},{\"id\":2,\"subTags\":[]}]}],"
                    + "\"blocks\":[null,{\"origin\":{\"size\":70000,\"blocks\":[0,1]},"
                    + "\"exhibition\":{\"size\":10,\"blocks\":[2]}},null],"
                    + "\"unusedBlocks\":[3],\"config\":{\"theme\":\"dark\"}}";
            writeDocument(json);

            MetadataStore legacy = newStore("secret");
            assertTrue(legacy.load());

            assertEquals(new BlockRun(List.of(0, 1), 70000), legacy.getBlockRun(1, Variant.ORIGIN).orElseThrow());
            assertEquals(new BlockRun(List.of(2), 10), legacy.getBlockRun(1, Variant.EXHIBITION).orElseThrow());
            assertTrue(legacy.getBlockRun(2, Variant.ORIGIN).isEmpty());
            assertEquals(List.of(3), legacy.freeBlocks());
            assertEquals("Old", legacy.getEntry(1).orElseThrow().attribute("title"));
            assertEquals("dark", legacy.getConfig("theme").orElseThrow().asText());
            assertTrue(legacy.findTags(Query.all()).containsAll(List.of("cat", "sleepy")));
            assertEquals(2, legacy.nextEntryId());
            assertEquals(3, legacy.nextSubItemId());
            assertEquals(3, legacy.allocateBlock());
            assertEquals(4, legacy.allocateBlock());
        }

        @Test
        @DisplayName("Counters never fall behind stored ids")
        void countersRepaired() throws Exception {
            String json = "{\"nextIndex\":{\"nextIllustrationId\":1,\"nextImageId\":1,\"nextBlockIndex\":0},"
                    + "\"illustrations\":[{\"id\":7,\"images\":[{\"id\":9}]}]}";
            writeDocument(json);

            MetadataStore repaired = newStore("secret");
            assertTrue(repaired.load());

            assertEquals(8, repaired.nextEntryId());
            assertEquals(10, repaired.nextSubItemId());
        }

        @Test
        @DisplayName("Stale block counter is advanced past stored and free blocks")
        void blockCounterRepaired() throws Exception {
            String json = "{\"nextIndex\":{\"nextIllustrationId\":2,\"nextImageId\":2,\"nextBlockIndex\":1},"
                    + "\"illustrations\":[{\"id\":1,\"images\":[{\"id\":1}]}],"
                    + "\"blocks\":{\"1\":{\"origin\":{\"blocks\":[0,5],\"size\":70000}}},"
                    + "\"unusedBlocks\":[3]}";
            writeDocument(json);

            MetadataStore repaired = newStore("secret");
            assertTrue(repaired.load());

            assertEquals(6, repaired.nextBlockIndex());
            assertEquals(3, repaired.allocateBlock());
            assertEquals(6, repaired.allocateBlock());
        }

        private void writeDocument(String json) throws Exception {
            byte[] encoded = new CatalogCipher("secret").encodeDocument(json.getBytes(StandardCharsets.UTF_8));
            Files.write(dataDir.resolve(MetadataStore.STORAGE_FILE), encoded);
        }
    }

    // ========================================================================
    // Save
    // ========================================================================

    @Nested
    @DisplayName("Saving")
    class SaveTests {

        @Test
        @DisplayName("Everything survives save and load")
        void roundTrip() {
            Entry e = entry("cat").attribute("title", "Night").attribute("score", 4)
                    .image(new SubItem().tag("moon"));
            store.createEntries(List.of(e));
            int imageId = e.getImages().get(0).getId();
            store.recordBlockRun(imageId, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 12));
            store.releaseBlocks(List.of(store.allocateBlock()));
            store.putConfig("columns", 5);
            store.save();

            MetadataStore reopened = newStore("secret");
            assertTrue(reopened.load());

            Entry loaded = reopened.getEntry(e.getId()).orElseThrow();
            assertEquals("Night", loaded.attribute("title"));
            assertEquals(4, loaded.attribute("score"));
            assertEquals(List.of("cat"), new ArrayList<>(loaded.getTags()));
            assertEquals(imageId, loaded.getImages().get(0).getId());
            assertEquals(new BlockRun(List.of(0), 12), reopened.getBlockRun(imageId, Variant.ORIGIN).orElseThrow());
            assertEquals(List.of(1), reopened.freeBlocks());
            assertEquals(2, reopened.nextBlockIndex());
            assertEquals(5, reopened.getConfig("columns").orElseThrow().asInt());
            assertEquals(List.of("cat", "moon"), reopened.findTags(Query.<String>all().orderBy(String::compareTo)));
        }

        @Test
        @DisplayName("Save leaves no temp file and the document is encrypted")
        void atomicReplace() throws Exception {
            store.createEntries(List.of(entry("visible-tag")));
            store.save();
            store.save();

            assertFalse(Files.exists(dataDir.resolve("data.db.tmp")));
            String raw = new String(Files.readAllBytes(dataDir.resolve("data.db")), StandardCharsets.ISO_8859_1);
            assertFalse(raw.contains("visible-tag"));
        }

        @Test
        @DisplayName("Document carries the format version")
        void versionTag() throws Exception {
            store.save();

            byte[] raw = Files.readAllBytes(dataDir.resolve("data.db"));
            String json = new String(new CatalogCipher("secret").decodeDocument(raw).orElseThrow(),
                    StandardCharsets.UTF_8);
            assertTrue(json.contains("\"version\":\"v0.2.0\""));
            assertTrue(json.contains("\"nextIndex\""));
        }
    }

    // ========================================================================
    // Entries
    // ========================================================================

    @Nested
    @DisplayName("Entries")
    class EntryTests {

        @Test
        @DisplayName("Auto-assigned ids strictly increase across creates")
        void idsIncrease() {
            List<Entry> first = store.createEntries(List.of(entry(), entry()));
            List<Entry> second = store.createEntries(List.of(entry()));

            assertEquals(List.of(1, 2), List.of(first.get(0).getId(), first.get(1).getId()));
            assertEquals(3, second.get(0).getId());
        }

        @Test
        @DisplayName("Image ids are unique across entries")
        void imageIds() {
            Entry a = entry().image(new SubItem()).image(new SubItem());
            Entry b = entry().image(new SubItem());

            store.createEntries(List.of(a, b));

            assertEquals(1, a.getImages().get(0).getId());
            assertEquals(2, a.getImages().get(1).getId());
            assertEquals(3, b.getImages().get(0).getId());
        }

        @Test
        @DisplayName("Explicit ids are kept and advance the counter")
        void explicitIds() {
            Entry e = new Entry(10).image(new SubItem(20));

            store.createEntries(List.of(e));
            Entry next = store.createEntries(List.of(entry().image(new SubItem()))).get(0);

            assertEquals(11, next.getId());
            assertEquals(21, next.getImages().get(0).getId());
        }

        @Test
        @DisplayName("Creating an entry with a taken id is skipped")
        void duplicateCreate() {
            store.createEntries(List.of(new Entry(5)));

            List<Entry> created = store.createEntries(List.of(new Entry(5), entry()));

            assertEquals(1, created.size());
            assertEquals(6, created.get(0).getId());
            assertEquals(2, store.findEntries(Query.all()).size());
        }

        @Test
        @DisplayName("Creating an entry with a taken image id is skipped")
        void duplicateImageCreate() {
            store.createEntries(List.of(entry().image(new SubItem(3))));

            List<Entry> created = store.createEntries(List.of(entry().image(new SubItem(3))));

            assertTrue(created.isEmpty());
        }

        @Test
        @DisplayName("Update replaces in place and skips unknown ids")
        void update() {
            store.createEntries(List.of(entry("a"), entry("b"), entry("c")));

            Entry replacement = new Entry(2).tag("b2").attribute("title", "new");
            List<Entry> updated = store.updateEntries(List.of(replacement, new Entry(99), entry()));

            assertEquals(List.of(replacement), updated);
            List<Entry> all = store.findEntries(Query.all());
            assertEquals(List.of(1, 2, 3), List.of(all.get(0).getId(), all.get(1).getId(), all.get(2).getId()));
            assertSame(replacement, all.get(1));
            assertTrue(store.findTags(Query.all()).contains("b2"));
        }

        @Test
        @DisplayName("Update assigns ids to new images")
        void updateNewImages() {
            Entry e = store.createEntries(List.of(entry().image(new SubItem()))).get(0);

            Entry replacement = new Entry(e.getId()).image(new SubItem(1)).image(new SubItem().tag("fresh"));
            store.updateEntries(List.of(replacement));

            assertEquals(2, replacement.getImages().get(1).getId());
            assertTrue(store.findTags(Query.all()).contains("fresh"));
        }

        @Test
        @DisplayName("Update dropping an image releases its blocks")
        void updateDropsImage() {
            Entry e = store.createEntries(List.of(entry().image(new SubItem()).image(new SubItem()))).get(0);
            int dropped = e.getImages().get(1).getId();
            store.recordBlockRun(dropped, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));

            store.updateEntries(List.of(new Entry(e.getId()).image(new SubItem(e.getImages().get(0).getId()))));

            assertTrue(store.getBlockRun(dropped, Variant.ORIGIN).isEmpty());
            assertEquals(List.of(0), store.freeBlocks());
            assertEquals(List.of(dropped), removedImages);
        }

        @Test
        @DisplayName("Image moved between entries in one update keeps its blocks")
        void updateMovesImage() {
            List<Entry> created = store.createEntries(List.of(entry().image(new SubItem()), entry()));
            int imageId = created.get(0).getImages().get(0).getId();
            store.recordBlockRun(imageId, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));

            List<Entry> updated = store.updateEntries(List.of(
                    new Entry(created.get(0).getId()),
                    new Entry(created.get(1).getId()).image(new SubItem(imageId))));

            assertEquals(2, updated.size());
            assertTrue(store.getBlockRun(imageId, Variant.ORIGIN).isPresent());
            assertTrue(store.freeBlocks().isEmpty());
        }

        @Test
        @DisplayName("Image moved to an entry listed before its old owner keeps its blocks")
        void updateMovesImageReceiverFirst() {
            List<Entry> created = store.createEntries(List.of(entry().image(new SubItem()), entry()));
            int imageId = created.get(0).getImages().get(0).getId();
            store.recordBlockRun(imageId, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));

            List<Entry> updated = store.updateEntries(List.of(
                    new Entry(created.get(1).getId()).image(new SubItem(imageId)),
                    new Entry(created.get(0).getId())));

            assertEquals(2, updated.size());
            assertEquals(List.of(imageId),
                    store.getEntry(created.get(1).getId()).orElseThrow().getImages().stream()
                            .map(SubItem::getId).toList());
            assertTrue(store.getBlockRun(imageId, Variant.ORIGIN).isPresent());
            assertTrue(store.freeBlocks().isEmpty());
            assertTrue(removedImages.isEmpty());
        }

        @Test
        @DisplayName("Two entries of one batch claiming the same image: the later one is skipped")
        void updateDoubleClaim() {
            List<Entry> created = store.createEntries(List.of(entry().image(new SubItem()), entry(), entry()));
            int imageId = created.get(0).getImages().get(0).getId();

            List<Entry> updated = store.updateEntries(List.of(
                    new Entry(1),
                    new Entry(2).image(new SubItem(imageId)),
                    new Entry(3).image(new SubItem(imageId))));

            assertEquals(List.of(1, 2), updated.stream().map(Entry::getId).toList());
            assertTrue(store.getEntry(3).orElseThrow().getImages().isEmpty());
            assertTrue(removedImages.isEmpty());
        }

        @Test
        @DisplayName("A skipped update keeps the images other entries of the batch wanted")
        void updateRejectionCascades() {
            List<Entry> created = store.createEntries(List.of(
                    entry().image(new SubItem()),
                    entry().image(new SubItem()),
                    entry().image(new SubItem())));
            int fromSecond = created.get(1).getImages().get(0).getId();
            int fromThird = created.get(2).getImages().get(0).getId();
            Entry second = created.get(1);

            // entry 2 wants an image entry 3 keeps, so entry 2 is skipped and entry 1 cannot take its image
            List<Entry> updated = store.updateEntries(List.of(
                    new Entry(1).image(new SubItem(created.get(0).getImages().get(0).getId()))
                            .image(new SubItem(fromSecond)),
                    new Entry(2).image(new SubItem(fromThird))));

            assertTrue(updated.isEmpty());
            assertSame(second, store.getEntry(2).orElseThrow());
            assertEquals(1, store.getEntry(1).orElseThrow().getImages().size());
            assertTrue(removedImages.isEmpty());
        }

        @Test
        @DisplayName("Images removed from a stored entry in place are released on update")
        void updateEditedInPlace() {
            store.createEntries(List.of(entry().image(new SubItem()).image(new SubItem())));
            store.recordBlockRun(2, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));

            Entry live = store.findEntries(Query.all()).get(0);
            live.getImages().remove(1);
            assertEquals(List.of(live), store.updateEntries(List.of(live)));

            assertTrue(store.getBlockRun(2, Variant.ORIGIN).isEmpty());
            assertEquals(List.of(0), store.freeBlocks());
            assertEquals(List.of(2), removedImages);
            assertFalse(store.hasSubItem(2));
            assertTrue(store.hasSubItem(1));
        }

        @Test
        @DisplayName("Delete releases images even when the stored entry was edited in place")
        void deleteEditedInPlace() {
            store.createEntries(List.of(entry().image(new SubItem())));
            store.recordBlockRun(1, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));

            store.findEntries(Query.all()).get(0).getImages().clear();
            store.deleteEntries(List.of(1));

            assertTrue(store.getBlockRun(1, Variant.ORIGIN).isEmpty());
            assertEquals(List.of(0), store.freeBlocks());
            assertEquals(List.of(1), removedImages);
        }

        @Test
        @DisplayName("Delete by id reports how many were removed")
        void delete() {
            store.createEntries(List.of(entry(), entry(), entry()));

            assertEquals(2, store.deleteEntries(List.of(1, 3, 42)));
            assertEquals(List.of(2), List.of(store.findEntries(Query.all()).get(0).getId()));
        }

        @Test
        @DisplayName("Deleted ids are not reused")
        void deletedIdsNotReused() {
            store.createEntries(List.of(entry(), entry()));
            store.deleteEntries(List.of(2));

            assertEquals(3, store.createEntries(List.of(entry())).get(0).getId());
        }
    }

    // ========================================================================
    // Find
    // ========================================================================

    @Nested
    @DisplayName("Find")
    class FindTests {

        @Test
        @DisplayName("Tag filter sorted by id descending")
        void tagFilterDescending() {
            store.createEntries(List.of(
                    entry("cat"),
                    entry("dog"),
                    entry().image(new SubItem().tag("cat")),
                    entry("bird").image(new SubItem().tag("dog")),
                    entry("cat", "dog")));

            List<Entry> found = store.findEntries(
                    Query.where(Entries.hasTag("cat")).orderBy(Entries.byId()).descending());

            assertEquals(List.of(5, 3, 1), found.stream().map(Entry::getId).toList());
            for (int i = 1; i < found.size(); i++) {
                assertTrue(found.get(i - 1).getId() > found.get(i).getId());
            }
            assertTrue(found.stream().allMatch(Entries.hasTag("cat")));
        }

        @Test
        @DisplayName("Multi-key ordering is stable")
        void multiKeyStable() {
            store.createEntries(List.of(
                    entry().attribute("score", 2).attribute("title", "b"),
                    entry().attribute("score", 1).attribute("title", "z"),
                    entry().attribute("score", 2).attribute("title", "a"),
                    entry().attribute("score", 1).attribute("title", "z")));

            List<Entry> asc = store.findEntries(Query.<Entry>all()
                    .orderBy(Entries.byAttribute("score"))
                    .orderBy(Entries.byAttribute("title")));
            List<Entry> desc = store.findEntries(Query.<Entry>all()
                    .orderBy(Entries.byAttribute("score"))
                    .orderBy(Entries.byAttribute("title"))
                    .descending());

            assertEquals(List.of(2, 4, 3, 1), asc.stream().map(Entry::getId).toList());
            assertEquals(List.of(1, 3, 2, 4), desc.stream().map(Entry::getId).toList());
        }

        @Test
        @DisplayName("Unordered find keeps catalog order")
        void unordered() {
            store.createEntries(List.of(new Entry(9), new Entry(4), new Entry(6)));

            assertEquals(List.of(9, 4, 6),
                    store.findEntries(Query.all()).stream().map(Entry::getId).toList());
        }

        @Test
        @DisplayName("Entries without the attribute sort first")
        void missingAttribute() {
            store.createEntries(List.of(entry().attribute("score", 1), entry()));

            List<Entry> found = store.findEntries(Query.<Entry>all().orderBy(Entries.byAttribute("score")));

            assertEquals(List.of(2, 1), found.stream().map(Entry::getId).toList());
        }

        @Test
        @DisplayName("Tag find filters and sorts")
        void findTags() {
            store.createEntries(List.of(entry("cat", "car", "dog").image(new SubItem().tag("cab"))));

            List<String> tags = store.findTags(Query.<String>where(t -> t.startsWith("ca"))
                    .orderBy(String::compareTo).descending());

            assertEquals(List.of("cat", "car", "cab"), tags);
        }

        @Test
        @DisplayName("Tags are never pruned during a session")
        void tagsGrowOnly() {
            Entry e = store.createEntries(List.of(entry("ephemeral"))).get(0);

            store.deleteEntries(List.of(e.getId()));

            assertTrue(store.findTags(Query.all()).contains("ephemeral"));
        }

        @Test
        @DisplayName("Unreferenced tags disappear after reload")
        void tagsRebuiltOnLoad() {
            Entry e = store.createEntries(List.of(entry("ephemeral"), entry("stays"))).get(0);
            store.deleteEntries(List.of(e.getId()));
            store.save();

            MetadataStore reopened = newStore("secret");
            assertTrue(reopened.load());

            assertEquals(List.of("stays"), reopened.findTags(Query.all()));
        }
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    @Nested
    @DisplayName("Block allocation")
    class BlockTests {

        @Test
        @DisplayName("Deleting an entry on blocks {5, 6} makes the next two allocations reuse them")
        void reuseAfterDelete() {
            for (int i = 0; i < 5; i++) {
                store.allocateBlock();
            }
            Entry e = store.createEntries(List.of(entry().image(new SubItem()))).get(0);
            int imageId = e.getImages().get(0).getId();
            store.recordBlockRun(imageId, Variant.ORIGIN,
                    new BlockRun(List.of(store.allocateBlock(), store.allocateBlock()), 100_000));

            assertEquals(1, store.deleteEntries(List.of(e.getId())));

            assertEquals(List.of(5, 6), store.freeBlocks());
            assertEquals(5, store.allocateBlock());
            assertEquals(6, store.allocateBlock());
            assertEquals(7, store.allocateBlock());
            assertEquals(List.of(imageId), removedImages);
        }

        @Test
        @DisplayName("Free list is consumed oldest first")
        void fifo() {
            store.releaseBlocks(List.of(8, 3));
            store.releaseBlocks(List.of(1));

            assertEquals(8, store.allocateBlock());
            assertEquals(3, store.allocateBlock());
            assertEquals(1, store.allocateBlock());
            assertEquals(0, store.allocateBlock());
        }

        @Test
        @DisplayName("Delete releases every variant of every image")
        void releasesAllVariants() {
            Entry e = store.createEntries(List.of(entry().image(new SubItem()).image(new SubItem()))).get(0);
            int first = e.getImages().get(0).getId();
            int second = e.getImages().get(1).getId();
            store.recordBlockRun(first, Variant.ORIGIN, new BlockRun(List.of(0, 1), 70_000));
            store.recordBlockRun(first, Variant.EXHIBITION, new BlockRun(List.of(2), 10));
            store.recordBlockRun(second, Variant.THUMBNAIL, new BlockRun(List.of(3), 10));

            store.deleteEntries(List.of(e.getId()));

            assertEquals(List.of(0, 1, 2, 3), store.freeBlocks().stream().sorted().toList());
            assertEquals(List.of(first, second), removedImages);
        }

        @Test
        @DisplayName("Overwriting a variant releases the old blocks")
        void overwriteVariant() {
            store.createEntries(List.of(entry().image(new SubItem())));
            assertTrue(store.recordBlockRun(1, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1)));
            assertTrue(store.recordBlockRun(1, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1)));

            assertEquals(List.of(0), store.freeBlocks());
            assertEquals(new BlockRun(List.of(1), 1), store.getBlockRun(1, Variant.ORIGIN).orElseThrow());
        }

        @Test
        @DisplayName("Blocks for an image no entry owns are released, not recorded")
        void unknownImage() {
            int block = store.allocateBlock();

            assertFalse(store.hasSubItem(42));
            assertFalse(store.recordBlockRun(42, Variant.ORIGIN, new BlockRun(List.of(block), 1)));

            assertTrue(store.getBlockRun(42, Variant.ORIGIN).isEmpty());
            assertEquals(List.of(block), store.freeBlocks());
        }

        @Test
        @DisplayName("Blocks recorded for a deleted image are released")
        void imageDeletedBeforeRecord() {
            Entry e = store.createEntries(List.of(entry().image(new SubItem()))).get(0);
            int imageId = e.getImages().get(0).getId();
            int block = store.allocateBlock();
            store.deleteEntries(List.of(e.getId()));

            assertFalse(store.recordBlockRun(imageId, Variant.ORIGIN, new BlockRun(List.of(block), 1)));
            assertEquals(List.of(block), store.freeBlocks());
        }

        @Test
        @DisplayName("No index is both free and referenced")
        void disjoint() {
            Entry e = store.createEntries(List.of(entry().image(new SubItem()), entry().image(new SubItem())))
                    .get(0);
            store.recordBlockRun(1, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));
            store.recordBlockRun(2, Variant.ORIGIN, new BlockRun(List.of(store.allocateBlock()), 1));
            store.deleteEntries(List.of(e.getId()));
            store.recordBlockRun(2, Variant.EXHIBITION, new BlockRun(List.of(store.allocateBlock()), 1));

            List<Integer> referenced = new ArrayList<>();
            referenced.addAll(store.getBlockRun(2, Variant.ORIGIN).orElseThrow().blocks());
            referenced.addAll(store.getBlockRun(2, Variant.EXHIBITION).orElseThrow().blocks());
            for (Integer b : referenced) {
                assertFalse(store.freeBlocks().contains(b));
            }
            assertEquals(List.of(1, 0), referenced);
        }
    }

    // ========================================================================
    // Config
    // ========================================================================

    @Nested
    @DisplayName("Config")
    class ConfigTests {

        private final ConfigKey<Integer> columns = ConfigKey.of("columns", Integer.class, 4);

        @Test
        @DisplayName("Open map get/put/exists")
        void openMap() {
            assertFalse(store.existsConfig("window"));
            assertTrue(store.getConfig("window").isEmpty());

            store.putConfig("window", Map.of("width", 800));

            assertTrue(store.existsConfig("window"));
            assertEquals(800, store.getConfig("window").orElseThrow().get("width").asInt());
        }

        @Test
        @DisplayName("Typed key returns default when absent")
        void typedDefault() {
            assertEquals(4, store.getConfig(columns));
        }

        @Test
        @DisplayName("Typed key reads stored value")
        void typedValue() {
            store.putConfig(columns, 6);

            assertEquals(6, store.getConfig(columns));
            assertEquals(6, store.getConfig("columns").orElseThrow().asInt());
        }

        @Test
        @DisplayName("Typed key falls back to default on unconvertible value")
        void typedMismatch() {
            store.putConfig("columns", Map.of("not", "a number"));

            assertEquals(4, store.getConfig(columns));
        }
    }
}
