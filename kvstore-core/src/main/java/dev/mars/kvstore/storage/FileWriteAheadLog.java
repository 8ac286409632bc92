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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * File-based implementation of {@link WriteAheadLog}.
 * <p>
 * A minimal, crash-safe, append-only log using {@link FileChannel}, one file
 * per table:
 * <pre>
 * &lt;table&gt;/
 *  └─ wal.log     // append-only, truncated to zero on rotate
 * </pre>
 * <p>
 * <b>Frame layout</b> (big-endian):
 * <pre>
 * MAGIC(4) VERSION(2) TYPE(1) SEQUENCE(8) PAYLOAD_LEN(4) PAYLOAD(n) CRC32C(4)
 * </pre>
 * The payload is the JSON encoding of a {@link KvRecord}. The CRC covers the
 * header and payload, so a torn or truncated final frame is always detected.
 * <p>
 * <b>Thread Safety:</b>
 * All methods are {@code synchronized}; the file position is only ever moved
 * while holding the monitor.
 * <p>
 * <b>Durability:</b>
 * When sync is enabled, {@link #append} forces the channel before returning,
 * and {@link #rotate} forces the truncation.
 *
 * @see WriteAheadLog
 */
public final class FileWriteAheadLog implements WriteAheadLog {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileWriteAheadLog.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Magic number: 'KVWL' in ASCII */
    static final int MAGIC = 0x4B56574C;

    /** Frame format version */
    static final short VERSION = 1;

    /** Frame type: live value */
    static final byte TYPE_SET = 1;

    /** Frame type: tombstone */
    static final byte TYPE_DELETE = 2;

    /** Header size: MAGIC(4) + VERSION(2) + TYPE(1) + SEQUENCE(8) + PAYLOAD_LEN(4) */
    static final int HEADER_SIZE = 4 + 2 + 1 + 8 + 4;

    /** CRC size */
    static final int CRC_SIZE = 4;

    /** WAL file name */
    public static final String LOG_FILE = "wal.log";

    // ========================================================================
    // State
    // ========================================================================

    private final Path logPath;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxRecordSize;

    private final FileChannel logChannel;
    private long lastSequence;
    private boolean replayed;
    private boolean failed;
    private boolean closed;

    // ========================================================================
    // Constructor / Open / Close
    // ========================================================================

    private FileWriteAheadLog(Path logPath, KvStoreConfig config, FileChannel logChannel) {
        this.logPath = logPath;
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxRecordSize = config.maxRecordSizeBytes();
        this.logChannel = logChannel;
    }

    /**
     * Opens (creating if needed) the WAL of the table stored in {@code tableDir}.
     * Call {@link #replay()} before appending.
     *
     * @param tableDir the table directory
     * @param config engine configuration (sync, verification, size limit)
     * @return the opened log
     * @throws StorageException if the file cannot be opened
     */
    public static FileWriteAheadLog open(Path tableDir, KvStoreConfig config) {
        Path logPath = tableDir.resolve(LOG_FILE);
        try {
            FileChannel channel = FileChannel.open(logPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            long size = channel.size();
            channel.position(size);
            LOG.debug("WAL opened: path={}, size={} bytes", logPath, size);
            if (!config.syncEnabled()) {
                LOG.warn("WAL {} opened with fsync DISABLED. Do NOT use in production!", logPath);
            }
            return new FileWriteAheadLog(logPath, config, channel);
        } catch (IOException e) {
            LOG.error("Failed to open WAL at {}: {}", logPath, e.getMessage(), e);
            throw new StorageException("Failed to open WAL at " + logPath, e);
        }
    }

    /** Path of the underlying log file. */
    public Path path() {
        return logPath;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            LOG.debug("WAL already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        try {
            logChannel.close();
            LOG.debug("WAL closed: {}", logPath);
        } catch (IOException e) {
            LOG.warn("Error closing WAL {}: {}", logPath, e.getMessage());
        }
    }

    // ========================================================================
    // Log Operations
    // ========================================================================

    @Override
    public synchronized WalReplay replay() {
        ensureOpen();
        try {
            long startTime = System.currentTimeMillis();
            long fileSize = logChannel.size();
            LOG.debug("Replaying WAL {} ({} bytes)", logPath, fileSize);

            List<WalEntry> entries = new ArrayList<>();
            long pos = 0;
            long previousSequence = lastSequence;
            String anomaly = null;
            ByteBuffer headerBuf = ByteBuffer.allocate(HEADER_SIZE);

            while (pos < fileSize) {
                // Read header
                headerBuf.clear();
                int headerRead = readFully(headerBuf, pos);
                if (headerRead < HEADER_SIZE) {
                    anomaly = "incomplete header: " + headerRead + " of " + HEADER_SIZE + " bytes";
                    break;
                }
                headerBuf.flip();

                int magic = headerBuf.getInt();
                short version = headerBuf.getShort();
                byte type = headerBuf.get();
                long sequence = headerBuf.getLong();
                int payloadLen = headerBuf.getInt();

                // Validate header
                if (magic != MAGIC) {
                    anomaly = "bad magic 0x" + Integer.toHexString(magic);
                    break;
                }
                if (version != VERSION) {
                    anomaly = "unsupported frame version " + version;
                    break;
                }
                if (type != TYPE_SET && type != TYPE_DELETE) {
                    anomaly = "unknown frame type " + type;
                    break;
                }
                if (payloadLen < 0 || payloadLen > maxRecordSize) {
                    anomaly = "invalid payload length " + payloadLen;
                    break;
                }

                // Read payload
                ByteBuffer payloadBuf = ByteBuffer.allocate(payloadLen);
                int payloadRead = readFully(payloadBuf, pos + HEADER_SIZE);
                if (payloadRead < payloadLen) {
                    anomaly = "incomplete payload: " + payloadRead + " of " + payloadLen + " bytes";
                    break;
                }
                payloadBuf.flip();

                // Read CRC
                ByteBuffer crcBuf = ByteBuffer.allocate(CRC_SIZE);
                int crcRead = readFully(crcBuf, pos + HEADER_SIZE + payloadLen);
                if (crcRead < CRC_SIZE) {
                    anomaly = "incomplete CRC";
                    break;
                }
                crcBuf.flip();
                int expectedCrc = crcBuf.getInt();

                // Verify CRC over header + payload
                CRC32C crc = new CRC32C();
                headerBuf.rewind();
                crc.update(headerBuf);
                crc.update(payloadBuf.duplicate());
                if ((int) crc.getValue() != expectedCrc) {
                    anomaly = "CRC mismatch (expected=" + expectedCrc + ", computed=" + (int) crc.getValue() + ")";
                    break;
                }

                if (sequence <= previousSequence) {
                    anomaly = "sequence " + sequence + " not above " + previousSequence;
                    break;
                }

                KvRecord record;
                try {
                    record = JsonCodec.decodeRecord(payloadBuf.array());
                } catch (IOException e) {
                    anomaly = "undecodable payload: " + e.getMessage();
                    break;
                }
                if (record.tombstone() != (type == TYPE_DELETE)) {
                    anomaly = "frame type " + type + " disagrees with record tombstone flag";
                    break;
                }

                entries.add(new WalEntry(sequence, record));
                previousSequence = sequence;
                LOG.trace("Replay {}: seq={}, key={}, version={}",
                        type == TYPE_SET ? "SET" : "DELETE", sequence, record.key(), record.version());

                // Advance to next frame
                pos = pos + HEADER_SIZE + payloadLen + CRC_SIZE;
            }

            Optional<WalCorruption> corruption = Optional.empty();
            if (anomaly != null) {
                WalCorruption report = new WalCorruption(pos, fileSize - pos, anomaly);
                LOG.warn("Truncating torn WAL tail in {}: {}", logPath, report);
                logChannel.truncate(pos);
                if (syncEnabled) {
                    logChannel.force(true);
                }
                corruption = Optional.of(report);
            }

            logChannel.position(logChannel.size());
            lastSequence = previousSequence;
            replayed = true;

            long elapsed = System.currentTimeMillis() - startTime;
            LOG.info("WAL replay complete for {}: {} entries recovered, last sequence {}, {} ms",
                    logPath, entries.size(), lastSequence, elapsed);

            return new WalReplay(entries, corruption);

        } catch (IOException e) {
            LOG.error("Failed to replay WAL {}: {}", logPath, e.getMessage(), e);
            throw new StorageException("Failed to replay WAL " + logPath, e);
        }
    }

    @Override
    public synchronized long append(KvRecord record) {
        ensureOpen();
        if (!replayed) {
            throw new IllegalStateException("replay() must run before the first append to " + logPath);
        }
        if (failed) {
            throw new StorageException("WAL " + logPath + " is unusable after an earlier write failure");
        }

        byte[] payload;
        try {
            payload = JsonCodec.encodeRecord(record);
        } catch (IOException e) {
            throw new StorageException("Failed to encode record for key '" + record.key() + "'", e);
        }
        if (payload.length > maxRecordSize) {
            LOG.error("Record too large: {} bytes (max: {})", payload.length, maxRecordSize);
            throw new StorageException("Record too large: " + payload.length +
                    " bytes (max: " + maxRecordSize + ")");
        }

        long sequence = lastSequence + 1;
        long writePosition = -1;
        try {
            writePosition = logChannel.position();
            int crcValue = writeFrame(record.tombstone() ? TYPE_DELETE : TYPE_SET, sequence, payload);
            if (syncEnabled) {
                logChannel.force(false);
            }
            if (verifyWrites && syncEnabled) {
                verifyWrittenFrame(writePosition, HEADER_SIZE + payload.length + CRC_SIZE, crcValue);
            }
        } catch (IOException | StorageException e) {
            LOG.error("Failed to append seq={} to {}: {}", sequence, logPath, e.getMessage(), e);
            discardPartialFrame(writePosition);
            if (e instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Failed to append to WAL " + logPath, e);
        }

        lastSequence = sequence;
        LOG.trace("Appended seq={} key={} version={} ({} bytes)",
                sequence, record.key(), record.version(), payload.length);
        return sequence;
    }

    @Override
    public synchronized void rotate() {
        ensureOpen();
        try {
            long size = logChannel.size();
            logChannel.truncate(0);
            logChannel.position(0);
            if (syncEnabled) {
                logChannel.force(true);
            }
            failed = false;
            LOG.debug("WAL rotated: {} ({} bytes released, last sequence {})", logPath, size, lastSequence);
        } catch (IOException e) {
            LOG.error("Failed to rotate WAL {}: {}", logPath, e.getMessage(), e);
            throw new StorageException("Failed to rotate WAL " + logPath, e);
        }
    }

    @Override
    public synchronized long lastSequence() {
        return lastSequence;
    }

    @Override
    public synchronized void advanceSequence(long sequence) {
        if (sequence > lastSequence) {
            LOG.debug("Advancing WAL sequence for {} from {} to {}", logPath, lastSequence, sequence);
            lastSequence = sequence;
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Writes a single frame at the current position.
     *
     * @return the CRC written into the frame
     */
    private int writeFrame(byte type, long sequence, byte[] payload) throws IOException {
        int payloadLen = payload.length;
        int frameSize = HEADER_SIZE + payloadLen + CRC_SIZE;

        ByteBuffer buf = ByteBuffer.allocate(frameSize);

        // Write header
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.put(type);
        buf.putLong(sequence);
        buf.putInt(payloadLen);

        // Write payload
        buf.put(payload);

        // Calculate and write CRC
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + payloadLen);
        int crcValue = (int) crc.getValue();
        buf.putInt(crcValue);

        buf.flip();
        while (buf.hasRemaining()) {
            logChannel.write(buf);
        }
        return crcValue;
    }

    /**
     * Cuts a half-written frame off the end of the log so later appends
     * are not stranded behind garbage that replay would stop at.
     */
    private void discardPartialFrame(long writePosition) {
        if (writePosition < 0) {
            failed = true;
            return;
        }
        try {
            logChannel.truncate(writePosition);
            logChannel.position(writePosition);
        } catch (IOException e) {
            failed = true;
            LOG.error("Could not cut partial frame from {} at {}; WAL refuses further appends: {}",
                    logPath, writePosition, e.getMessage());
        }
    }

    /**
     * Verifies a written frame by reading it back and checking the CRC.
     * <p>
     * This detects silent filesystem corruption where writes appear to succeed
     * but data is not correctly persisted (e.g., faulty disk controller, bad RAM).
     */
    private void verifyWrittenFrame(long position, int frameSize, int expectedCrc) throws IOException {
        ByteBuffer readBuf = ByteBuffer.allocate(frameSize);
        int bytesRead = readFully(readBuf, position);

        if (bytesRead != frameSize) {
            throw new StorageException(
                    "Write verification failed: expected to read " + frameSize +
                    " bytes but got " + bytesRead);
        }

        CRC32C verifyCrc = new CRC32C();
        verifyCrc.update(readBuf.array(), 0, frameSize - CRC_SIZE);
        int actualCrc = (int) verifyCrc.getValue();
        int storedCrc = readBuf.getInt(frameSize - CRC_SIZE);

        if (storedCrc != expectedCrc || actualCrc != expectedCrc) {
            throw new StorageException(
                    "Write verification failed: CRC mismatch. Written=" + expectedCrc +
                    ", Stored=" + storedCrc + ", Computed=" + actualCrc +
                    ". Possible silent data corruption!");
        }

        LOG.trace("Write verification passed at position {}", position);
    }

    private int readFully(ByteBuffer buf, long position) throws IOException {
        int total = 0;
        while (buf.hasRemaining()) {
            int n = logChannel.read(buf, position + total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("WAL " + logPath + " is closed");
        }
    }
}
