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
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Merges all segments of a table into one, keeping the latest live version
 * of every key.
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 *   <li>Take the visible segments, oldest to newest.</li>
 *   <li>For each key keep the record with the highest version
 *       (equal versions: the newer segment wins).</li>
 *   <li>Drop tombstones and records expired as of now.</li>
 *   <li>Write the survivors to one new segment (temp → fsync → rename).</li>
 *   <li>Publish the new view, then delete the inputs oldest first. Inputs
 *       that could not be deleted are put back into the view.</li>
 * </ol>
 * A crash during step 5 leaves some inputs next to the output. That state
 * reads correctly (the highest version still wins) and the next compaction
 * folds it in, because the merge is commutative and associative. Deleting
 * oldest first means a surviving input is never older than a retired one,
 * so a dropped tombstone cannot let an older value resurface.
 * <p>
 * Never touches the memstore. Callers must hold the table's exclusive lock.
 */
public final class Compactor {

    private static final Logger LOG = LoggerFactory.getLogger(Compactor.class);

    private final KvStoreConfig config;
    private final Clock clock;

    public Compactor(KvStoreConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Compacts the segments of the table in {@code tableDir}.
     *
     * @throws SegmentWriteException if the output segment could not be written;
     *                               the inputs are then left in place
     */
    public CompactionResult compact(Path tableDir, SegmentView segments) {
        SegmentSet current = segments.current();
        List<Segment> inputs = current.oldestFirst();
        if (inputs.isEmpty()) {
            LOG.debug("Compaction skipped for {}: no segments", tableDir);
            return CompactionResult.nothingToCompact();
        }

        long now = clock.millis();
        long recordsRead = current.recordCount();
        LOG.debug("Compaction start: table={}, inputs={}, records={}", tableDir, current, recordsRead);

        NavigableMap<String, KvRecord> latest = resolveLatest(inputs);
        long shadowed = recordsRead - latest.size();

        List<KvRecord> survivors = new ArrayList<>(latest.size());
        long tombstonesDropped = 0;
        long expiredDropped = 0;
        for (KvRecord record : latest.values()) {
            if (record.tombstone()) {
                tombstonesDropped++;
            } else if (record.expiredAt(now)) {
                expiredDropped++;
            } else {
                survivors.add(record);
            }
        }

        Segment output = null;
        if (!survivors.isEmpty()) {
            long id = current.maxId() + 1;
            try {
                DurableFiles.checkDiskSpace(tableDir, config.minFreeSpaceBytes());
                output = SegmentFile.write(tableDir, id, current.maxSequence(), now, survivors,
                        config.syncEnabled());
            } catch (IOException | StorageException e) {
                LOG.error("Compaction of {} failed, inputs left in place: {}", tableDir, e.getMessage(), e);
                throw new SegmentWriteException("Failed to compact " + tableDir + " into segment " + id, e);
            }
        }

        segments.publish(current.replace(inputs, output));
        List<Segment> kept = retire(tableDir, inputs);
        if (!kept.isEmpty()) {
            // Still on disk, so still visible: versions must keep counting past them
            List<Segment> visible = new ArrayList<>(segments.current().oldestFirst());
            visible.addAll(kept);
            segments.publish(SegmentSet.of(visible));
        }
        int retired = inputs.size() - kept.size();

        CompactionResult result = new CompactionResult(
                output == null ? OptionalLong.empty() : OptionalLong.of(output.id()),
                inputs.size(), recordsRead, survivors.size(), shadowed, tombstonesDropped, expiredDropped);
        LOG.info("Compacted {}: {} segments ({} records) -> {} ({} kept, {} shadowed, {} tombstones, {} expired), "
                        + "{} files retired",
                tableDir, inputs.size(), recordsRead,
                output == null ? "no segment" : output.path().getFileName(),
                survivors.size(), shadowed, tombstonesDropped, expiredDropped, retired);
        return result;
    }

    /**
     * Highest-version record per key across {@code oldestFirst}.
     * On equal versions the later (newer) segment wins.
     */
    static NavigableMap<String, KvRecord> resolveLatest(List<Segment> oldestFirst) {
        NavigableMap<String, KvRecord> latest = new TreeMap<>();
        for (Segment segment : oldestFirst) {
            for (KvRecord record : segment.sortedRecords()) {
                KvRecord existing = latest.get(record.key());
                if (existing == null || record.version() >= existing.version()) {
                    latest.put(record.key(), record);
                }
            }
        }
        return latest;
    }

    /**
     * Deletes {@code inputs} oldest first and returns the ones left on disk.
     */
    private List<Segment> retire(Path tableDir, List<Segment> inputs) {
        List<Segment> kept = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            Segment segment = inputs.get(i);
            try {
                Files.deleteIfExists(segment.path());
            } catch (IOException e) {
                // Newer inputs must outlive older ones; the next compaction retires the rest
                LOG.warn("Could not delete compacted segment {}, keeping it and every newer input: {}",
                        segment.path(), e.getMessage());
                kept.addAll(inputs.subList(i, inputs.size()));
                break;
            }
        }
        if (config.syncEnabled()) {
            DurableFiles.syncDirectory(tableDir);
        }
        return kept;
    }
}
