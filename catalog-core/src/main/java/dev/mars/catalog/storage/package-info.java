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
 * Payload block storage.
 * <p>
 * This package stores binary payloads in fixed-size blocks:
 * <ul>
 *   <li>{@link dev.mars.catalog.storage.BlockStorage} - The storage interface</li>
 *   <li>{@link dev.mars.catalog.storage.SegmentBlockStorage} - Segment file implementation</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ block-a.dat   // segment 0: blocks 0..1023, 64 KiB each
 *  ├─ block-b.dat   // segment 1: blocks 1024..2047
 *  └─ ...
 * </pre>
 * Allocation is not done here: callers pass an allocator and keep the returned
 * block list.
 */
package dev.mars.catalog.storage;
