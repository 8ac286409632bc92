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

import java.io.Closeable;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live engine state of one table: its WAL, memstore and segments.
 * <p>
 * <b>Concurrency:</b>
 * <ul>
 *   <li>{@link #set}, {@link #delete}, {@link #flush} and {@link #compact}
 *       hold the table's exclusive lock for their whole duration. This is what
 *       makes per-key versions strictly increasing.</li>
 *   <li>{@link #get} takes no lock. It reads the memstore and one immutable
 *       {@link SegmentSet} snapshot, and so never observes a torn flush or
 *       compaction.</li>
 *   <li>Different tables share nothing.</li>
 * </ul>
 * <p>
 * <b>Open:</b> remove stale temp files, load segments, replay the WAL entries
 * newer than the segments into a fresh memstore. If the WAL still held
 * entries the segments cover, it is emptied before the table accepts writes.
 */
public final class TableEngine implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(TableEngine.class);

    private final Path directory;
    private final KvStoreConfig config;
    private final Clock clock;
    private final WriteAheadLog wal;
    private final Memstore memstore;
    private final SegmentView segments;
    private final FlushManager flushManager;
    private final Compactor compactor;
    private final Optional<WalCorruption> recoveredCorruption;
    private final ReentrantLock exclusive = new ReentrantLock();

    private volatile boolean closed;

    private TableEngine(Path directory, KvStoreConfig config, Clock clock, WriteAheadLog wal,
                        SegmentView segments, Optional<WalCorruption> recoveredCorruption, Memstore memstore) {
        this.directory = directory;
        this.config = config;
        this.clock = clock;
        this.wal = wal;
        this.segments = segments;
        this.recoveredCorruption = recoveredCorruption;
        this.memstore = memstore;
        this.flushManager = new FlushManager(config, clock);
        this.compactor = new Compactor(config, clock);
    }

    /**
     * Opens the table stored in {@code directory}, recovering unflushed writes from its WAL.
     *
     * @throws SegmentFormatException if a segment file cannot be read
     * @throws StorageException       if the WAL cannot be opened or read
     */
    public static TableEngine open(Path directory, KvStoreConfig config, Clock clock) {
        LOG.debug("Opening table at {}", directory);
        SegmentView segments = new SegmentView(SegmentFile.loadAll(directory));
        FileWriteAheadLog wal = FileWriteAheadLog.open(directory, config);
        try {
            Memstore memstore = new Memstore(wal, clock, key -> segments.current().latestVersion(key));
            long covered = segments.current().maxSequence();

            WalReplay replay = wal.replay();
            int applied = 0;
            int skipped = 0;
            for (WalEntry entry : replay.entries()) {
                if (entry.sequence() <= covered) {
                    skipped++;
                    continue;
                }
                memstore.apply(entry.record());
                applied++;
            }
            wal.advanceSequence(covered);
            replay.corruption().ifPresent(c ->
                    LOG.warn("Recovered table {} with a damaged WAL tail: {}", directory, c));

            LOG.info("Table opened: {} ({} segments, {} WAL entries replayed, {} already flushed)",
                    directory, segments.current().size(), applied, skipped);
            TableEngine engine = new TableEngine(directory, config, clock, wal, segments, replay.corruption(), memstore);
            if (skipped > 0) {
                engine.dropCoveredWalEntries(skipped);
            }
            return engine;
        } catch (RuntimeException e) {
            wal.close();
            throw e;
        }
    }

    // ========================================================================
    // Mutations (exclusive)
    // ========================================================================

    /**
     * Sets {@code key} to {@code value}.
     *
     * @param ttl time-to-live, or null for no expiry
     * @return the new version of {@code key}
     */
    public long set(String key, String value, Duration ttl) {
        exclusive.lock();
        try {
            ensureOpen();
            long version = memstore.set(key, value, ttl);
            afterMutation();
            return version;
        } finally {
            exclusive.unlock();
        }
    }

    /**
     * Writes a tombstone for {@code key}.
     *
     * @return the version of the tombstone
     */
    public long delete(String key) {
        exclusive.lock();
        try {
            ensureOpen();
            long version = memstore.delete(key);
            afterMutation();
            return version;
        } finally {
            exclusive.unlock();
        }
    }

    /**
     * Flushes the memstore to a new segment.
     *
     * @return the new segment id, or empty if there was nothing to flush
     */
    public OptionalLong flush() {
        exclusive.lock();
        try {
            ensureOpen();
            return flushManager.flush(directory, memstore, wal, segments);
        } finally {
            exclusive.unlock();
        }
    }

    /**
     * Merges every segment into one, dropping shadowed, deleted and expired records.
     */
    public CompactionResult compact() {
        exclusive.lock();
        try {
            ensureOpen();
            return compactor.compact(directory, segments);
        } finally {
            exclusive.unlock();
        }
    }

    // ========================================================================
    // Reads (lock-free)
    // ========================================================================

    /**
     * Returns the live record for {@code key}: the highest version across the
     * memstore and all segments, unless it is a tombstone or expired.
     */
    public Optional<KvRecord> get(String key) {
        ensureOpen();
        // Memstore first: a flush publishes its segment before clearing the memstore.
        KvRecord inMemory = memstore.get(key).orElse(null);
        KvRecord onDisk = segments.current().latest(key).orElse(null);
        KvRecord winner = inMemory != null && inMemory.supersedes(onDisk) ? inMemory : onDisk;
        if (winner == null || !winner.visibleAt(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(winner);
    }

    // ========================================================================
    // Introspection
    // ========================================================================

    public Path directory() {
        return directory;
    }

    /** Number of currently visible segments. */
    public int segmentCount() {
        return segments.current().size();
    }

    /** Number of keys held in the memstore. */
    public int memstoreSize() {
        return memstore.size();
    }

    /** The WAL tail anomaly found while opening this table, if any. */
    public Optional<WalCorruption> recoveredCorruption() {
        return recoveredCorruption;
    }

    @Override
    public void close() {
        exclusive.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            wal.close();
            LOG.debug("Table closed: {} ({} unflushed keys kept in WAL)", directory, memstore.size());
        } finally {
            exclusive.unlock();
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Size-triggered flush and count-triggered compaction. The mutation that
     * triggered them is already durable, so a failure here is logged and left
     * for the next explicit flush or compaction rather than reported as a
     * failed write.
     */
    private void afterMutation() {
        long threshold = config.memstoreFlushThresholdBytes();
        if (threshold > 0 && memstore.approximateBytes() >= threshold) {
            LOG.debug("Flush trigger for {}: memBytes={} threshold={}",
                    directory, memstore.approximateBytes(), threshold);
            try {
                flushManager.flush(directory, memstore, wal, segments);
            } catch (StorageException e) {
                LOG.error("Automatic flush of {} failed; data remains in the WAL: {}", directory, e.getMessage(), e);
                return;
            }
        }
        int trigger = config.compactionTrigger();
        if (trigger > 0 && segments.current().size() >= trigger) {
            LOG.debug("Compaction trigger for {}: segments={} trigger={}",
                    directory, segments.current().size(), trigger);
            try {
                compactor.compact(directory, segments);
            } catch (StorageException e) {
                LOG.error("Automatic compaction of {} failed; segments left as they were: {}",
                        directory, e.getMessage(), e);
            }
        }
    }

    /**
     * Removes WAL frames that a segment already holds, left behind by a crash
     * between a flush's segment rename and its WAL rotation. Once a compaction
     * retires that segment nothing else marks them as covered, and replaying
     * them would shadow newer writes.
     */
    private void dropCoveredWalEntries(int covered) {
        LOG.info("Dropping {} WAL entries of {} already held by segments", covered, directory);
        if (memstore.size() == 0) {
            wal.rotate();
        } else {
            // Uncovered entries go to a segment first, so the rotation loses nothing
            flushManager.flush(directory, memstore, wal, segments);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Table " + directory + " is closed");
        }
    }
}
