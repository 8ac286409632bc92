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

import java.io.Closeable;

/**
 * Per-table write-ahead log.
 * <p>
 * The memstore depends solely on this interface, not on the file implementation.
 * <p>
 * <b>Critical Contract:</b> {@link #append(KvRecord)} must make the entry
 * durable (fsync, when enabled) before it returns. Only then may the record
 * become visible in the memstore.
 *
 * @see FileWriteAheadLog
 */
public interface WriteAheadLog extends Closeable {

    /**
     * Replays the log on table open.
     * <p>
     * Returns every well-formed entry in sequence order. A corrupt or partial
     * tail is cut off and described in {@link WalReplay#corruption()}; it is
     * never thrown. Must be called once, before the first {@link #append}.
     *
     * @return the recovered entries and any tail anomaly
     */
    WalReplay replay();

    /**
     * Durably appends one record.
     *
     * @param record the record to log
     * @return the sequence number assigned to the entry
     * @throws StorageException if the entry could not be written or synced
     */
    long append(KvRecord record);

    /**
     * Clears the log once its entries are durably reflected in a segment.
     *
     * @throws StorageException if the log could not be truncated
     */
    void rotate();

    /**
     * Returns the sequence number of the most recent entry (0 if none yet).
     */
    long lastSequence();

    /**
     * Ensures the next sequence number handed out is greater than {@code sequence}.
     * Used on open so sequences keep increasing past those already flushed.
     */
    void advanceSequence(long sequence);

    /**
     * Closes the log, releasing its file handle.
     * <p>
     * After close, no other methods should be called.
     */
    @Override
    void close();
}
