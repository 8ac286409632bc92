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
package dev.mars.kvstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.OptionalLong;

/**
 * Drains a memstore into a new segment file and rotates the WAL.
 * <p>
 * <b>Order of effects:</b>
 * <ol>
 *   <li>snapshot the memstore (every record, tombstones and expired ones included)</li>
 *   <li>write {@code segment-N.json.tmp}, fsync, rename to {@code segment-N.json}, fsync dir</li>
 *   <li>publish the segment to readers</li>
 *   <li>rotate the WAL</li>
 *   <li>clear the memstore</li>
 * </ol>
 * A failure in step 2 leaves no segment behind and the memstore and WAL
 * untouched. Readers never miss a record: it is visible in the segment
 * before it leaves the memstore.
 * <p>
 * Callers must hold the table's exclusive lock.
 */
public final class FlushManager {

    private static final Logger LOG = LoggerFactory.getLogger(FlushManager.class);

    private final KvStoreConfig config;
    private final Clock clock;

    public FlushManager(KvStoreConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Flushes {@code memstore} into a new segment of the table in {@code tableDir}.
     *
     * @return the new segment id, or empty if the memstore was empty
     * @throws SegmentWriteException if the segment could not be written
     * @throws StorageException      if the WAL could not be rotated after the segment landed
     */
    public OptionalLong flush(Path tableDir, Memstore memstore, WriteAheadLog wal, SegmentView segments) {
        List<KvRecord> snapshot = memstore.snapshot();
        if (snapshot.isEmpty()) {
            LOG.debug("Flush skipped for {}: memstore is empty", tableDir);
            return OptionalLong.empty();
        }

        SegmentSet current = segments.current();
        long id = current.maxId() + 1;
        long maxSequence = Math.max(wal.lastSequence(), current.maxSequence());
        long tombstones = snapshot.stream().filter(KvRecord::tombstone).count();

        LOG.debug("Flush start: table={}, segment={}, records={}, tombstones={}, memBytes={}",
                tableDir, id, snapshot.size(), tombstones, memstore.approximateBytes());

        Segment segment;
        try {
            DurableFiles.checkDiskSpace(tableDir, config.minFreeSpaceBytes());
            segment = SegmentFile.write(tableDir, id, maxSequence, clock.millis(), snapshot, config.syncEnabled());
        } catch (IOException | StorageException e) {
            LOG.error("Flush of {} failed, memstore and WAL left intact: {}", tableDir, e.getMessage(), e);
            throw new SegmentWriteException("Failed to flush " + tableDir + " to segment " + id, e);
        }

        segments.publish(current.plus(segment));
        wal.rotate();
        memstore.clear();

        LOG.info("Flushed {} records from {} to {} (max sequence {})",
                snapshot.size(), tableDir, segment.path().getFileName(), maxSequence);
        return OptionalLong.of(id);
    }
}
