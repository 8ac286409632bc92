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
 * Per-table storage engine: write-ahead log, memstore, segments, flush and compaction.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.kvstore.storage.TableEngine} - Live state of one table</li>
 *   <li>{@link dev.mars.kvstore.storage.FileWriteAheadLog} - CRC-framed append-only log</li>
 *   <li>{@link dev.mars.kvstore.storage.Memstore} - Sorted in-memory write buffer</li>
 *   <li>{@link dev.mars.kvstore.storage.SegmentFile} - Immutable JSON segment files</li>
 *   <li>{@link dev.mars.kvstore.storage.FlushManager} - Memstore to segment</li>
 *   <li>{@link dev.mars.kvstore.storage.Compactor} - Segments to one segment</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Log-before-apply:</b> a write reaches the WAL before the memstore</li>
 *   <li><b>Atomic files:</b> segments appear by rename, never half-written</li>
 *   <li><b>Highest version wins:</b> reads and merges resolve keys by version, not by file</li>
 * </ul>
 *
 * @see dev.mars.kvstore.storage.TableEngine
 */
package dev.mars.kvstore.storage;
