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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;

/**
 * In-memory mutable store of one table: the most recent record per key.
 * <p>
 * Every mutation follows <b>Prepare → Persist → Apply</b>:
 * <pre>{@code
 * // 1. Prepare: compute the next version and build the record (no mutations)
 * KvRecord record = KvRecord.live(key, value, nextVersion(key), expiresAt);
 *
 * // 2. Persist: durable WAL append (DURABILITY BARRIER)
 * wal.append(record);
 *
 * // 3. Apply: make it visible (only after the append succeeded)
 * records.put(key, record);
 * }</pre>
 * <p>
 * <b>Thread Safety:</b> reads ({@link #get}, {@link #snapshot}) may run
 * concurrently with anything. Mutations ({@link #set}, {@link #delete},
 * {@link #apply}, {@link #clear}) must be serialized by the owner; the
 * table engine does so with its exclusive lock.
 */
public final class Memstore {

    private static final Logger LOG = LoggerFactory.getLogger(Memstore.class);

    private final ConcurrentSkipListMap<String, KvRecord> records = new ConcurrentSkipListMap<>();
    private final AtomicLong approximateBytes = new AtomicLong();
    private final WriteAheadLog wal;
    private final Clock clock;
    private final ToLongFunction<String> persistedVersion;

    /**
     * @param wal              log every mutation is appended to before it is applied
     * @param clock            source of "now" for TTL expiry instants
     * @param persistedVersion highest version of a key already in a segment (0 if none)
     */
    public Memstore(WriteAheadLog wal, Clock clock, ToLongFunction<String> persistedVersion) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.persistedVersion = Objects.requireNonNull(persistedVersion, "persistedVersion");
    }

    /**
     * Writes a live value.
     *
     * @param ttl time-to-live, or null for a value that never expires
     * @return the version assigned to the new record
     * @throws InvalidTtlException if {@code ttl} is zero or negative
     * @throws StorageException    if the WAL append fails (the memstore is then unchanged)
     */
    public long set(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Long expiresAt = null;
        if (ttl != null) {
            if (ttl.isZero() || ttl.isNegative()) {
                throw new InvalidTtlException("TTL must be positive, got " + ttl);
            }
            try {
                expiresAt = Math.addExact(clock.millis(), ttl.toMillis());
            } catch (ArithmeticException e) {
                throw new InvalidTtlException("TTL too large: " + ttl, e);
            }
        }

        KvRecord record = KvRecord.live(key, value, nextVersion(key), expiresAt);
        wal.append(record);
        put(record);
        LOG.trace("SET key={} version={} expiresAt={}", key, record.version(), expiresAt);
        return record.version();
    }

    /**
     * Writes a tombstone for {@code key}. The key need not exist.
     *
     * @return the version assigned to the tombstone
     * @throws StorageException if the WAL append fails (the memstore is then unchanged)
     */
    public long delete(String key) {
        Objects.requireNonNull(key, "key");
        KvRecord record = KvRecord.deleted(key, nextVersion(key));
        wal.append(record);
        put(record);
        LOG.trace("DELETE key={} version={}", key, record.version());
        return record.version();
    }

    /**
     * Returns the raw memstore record for {@code key}, tombstones and expired
     * records included. Visibility is decided by the caller.
     */
    public Optional<KvRecord> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    /**
     * Re-applies a record recovered from the WAL, bypassing the log.
     * A record that does not supersede the current entry is ignored.
     */
    public void apply(KvRecord record) {
        KvRecord current = records.get(record.key());
        if (record.supersedes(current)) {
            put(record);
        } else {
            LOG.debug("Ignoring replayed record key={} version={}: current version {}",
                    record.key(), record.version(), current.version());
        }
    }

    /**
     * Point-in-time copy of every record, ordered by key.
     */
    public List<KvRecord> snapshot() {
        return new ArrayList<>(records.values());
    }

    public void clear() {
        records.clear();
        approximateBytes.set(0);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Rough footprint of the stored records, compared against the flush threshold. */
    public long approximateBytes() {
        return approximateBytes.get();
    }

    private long nextVersion(String key) {
        KvRecord current = records.get(key);
        long onDisk = persistedVersion.applyAsLong(key);
        long previous = current != null ? Math.max(current.version(), onDisk) : onDisk;
        return previous + 1;
    }

    private void put(KvRecord record) {
        KvRecord previous = records.put(record.key(), record);
        long delta = record.approximateBytes() - (previous == null ? 0 : previous.approximateBytes());
        approximateBytes.addAndGet(delta);
    }
}
