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
/**
 * Catalog data engine: the surface the application uses to read and write a
 * catalog folder.
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * CatalogConfig config = CatalogConfig.builder().dataDir(folder).build();
 * try (DataEngine engine = new LocalDataEngine(config, passphrase, transcoder)) {
 *     if (!engine.connect()) {
 *         // wrong passphrase or damaged catalog
 *     }
 *     Entry entry = engine.createEntries(List.of(new Entry().tag("cat").image(new SubItem()))).get(0);
 *     int imageId = entry.getImages().get(0).getId();
 *     engine.savePayload(imageId, bytes).join();
 *     byte[] shown = engine.loadPayload(imageId, Variant.EXHIBITION).join().orElseThrow();
 * }
 * }</pre>
 */
package dev.mars.catalog.engine;
