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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.zip.CRC32C;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileWriteAheadLog}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Append and replay of SET and DELETE frames</li>
 *   <li>Truncation of torn, zero-filled and CRC-corrupt tails</li>
 *   <li>Rotation and sequence continuity</li>
 * </ul>
 */
class FileWriteAheadLogTest {

    @TempDir
    Path tempDir;

    private KvStoreConfig config;
    private FileWriteAheadLog wal;

    @BeforeEach
    void setUp() {
        config = KvStoreConfig.builder()
                .dataDir(tempDir)
                .syncEnabled(true)
                .minFreeSpaceMb(0)
                .build();
        wal = FileWriteAheadLog.open(tempDir, config);
        wal.replay();
    }

    @AfterEach
    void tearDown() {
        if (wal != null) {
            wal.close();
        }
    }

    private FileWriteAheadLog reopen() {
        wal.close();
        wal = FileWriteAheadLog.open(tempDir, config);
        return wal;
    }

    private Path logFile() {
        return tempDir.resolve(FileWriteAheadLog.LOG_FILE);
    }

    // ========================================================================
    // Append / Replay
    // ========================================================================

    @Test
    void testReplay_EmptyLog_ReturnsNothing() {
        WalReplay replay = reopen().replay();

        assertTrue(replay.entries().isEmpty());
        assertTrue(replay.corruption().isEmpty());
        assertEquals(0, wal.lastSequence());
    }

    @Test
    void testAppendAndReplay_SetAndDelete() {
        long s1 = wal.append(KvRecord.live("a", "1", 1, null));
        long s2 = wal.append(KvRecord.live("b", "2", 1, 5_000L));
        long s3 = wal.append(KvRecord.deleted("a", 2));

        assertEquals(1, s1);
        assertEquals(2, s2);
        assertEquals(3, s3);

        WalReplay replay = reopen().replay();

        assertTrue(replay.corruption().isEmpty());
        List<WalEntry> entries = replay.entries();
        assertEquals(3, entries.size());
        assertEquals(new WalEntry(1, KvRecord.live("a", "1", 1, null)), entries.get(0));
        assertEquals(new WalEntry(2, KvRecord.live("b", "2", 1, 5_000L)), entries.get(1));
        assertEquals(new WalEntry(3, KvRecord.deleted("a", 2)), entries.get(2));
    }

    @Test
    void testAppend_ValueWithSeparatorsAndUnicode() {
        KvRecord record = KvRecord.live("k", "a:b:c é中", 1, null);
        wal.append(record);

        WalReplay replay = reopen().replay();

        assertEquals(record, replay.entries().get(0).record());
    }

    @Test
    void testSequence_ContinuesAfterReopen() {
        wal.append(KvRecord.live("a", "1", 1, null));
        wal.append(KvRecord.live("a", "2", 2, null));

        reopen().replay();

        assertEquals(2, wal.lastSequence());
        assertEquals(3, wal.append(KvRecord.live("a", "3", 3, null)));
    }

    @Test
    void testAdvanceSequence_OnlyMovesForward() {
        wal.advanceSequence(10);
        assertEquals(10, wal.lastSequence());

        wal.advanceSequence(4);
        assertEquals(10, wal.lastSequence());

        assertEquals(11, wal.append(KvRecord.live("a", "1", 1, null)));
    }

    @Test
    void testAppend_BeforeReplay_IsRejected() {
        FileWriteAheadLog fresh = reopen();

        assertThrows(IllegalStateException.class,
                () -> fresh.append(KvRecord.live("a", "1", 1, null)));
    }

    @Test
    void testAppend_AfterClose_Throws() {
        wal.close();

        assertThrows(StorageException.class, () -> wal.append(KvRecord.live("a", "1", 1, null)));
    }

    @Test
    void testAppend_RecordTooLarge_Throws() {
        wal.close();
        config = KvStoreConfig.builder().dataDir(tempDir).maxRecordSizeMb(1).minFreeSpaceMb(0).build();
        wal = FileWriteAheadLog.open(tempDir, config);
        wal.replay();

        String huge = "x".repeat(1024 * 1024 + 1);
        assertThrows(StorageException.class, () -> wal.append(KvRecord.live("big", huge, 1, null)));

        // The log stays usable
        assertEquals(1, wal.append(KvRecord.live("small", "v", 1, null)));
    }

    @Test
    void testVerifyWrites_AppendStillSucceeds() {
        wal.close();
        config = KvStoreConfig.builder().dataDir(tempDir).verifyWrites(true).minFreeSpaceMb(0).build();
        wal = FileWriteAheadLog.open(tempDir, config);
        wal.replay();

        wal.append(KvRecord.live("a", "1", 1, null));

        assertEquals(1, reopen().replay().entries().size());
    }

    // ========================================================================
    // Rotate
    // ========================================================================

    @Test
    void testRotate_EmptiesLogButKeepsSequence() throws IOException {
        wal.append(KvRecord.live("a", "1", 1, null));
        wal.append(KvRecord.live("b", "1", 1, null));

        wal.rotate();

        assertEquals(0, Files.size(logFile()));
        assertEquals(2, wal.lastSequence());
        assertEquals(3, wal.append(KvRecord.live("c", "1", 1, null)));

        WalReplay replay = reopen().replay();
        assertEquals(1, replay.entries().size());
        assertEquals(3, replay.entries().get(0).sequence());
    }

    // ========================================================================
    // Corruption Recovery
    // ========================================================================

    @Nested
    @DisplayName("Corrupt tails")
    class CorruptTails {

        @Test
        @DisplayName("Torn final frame is truncated and the prefix survives")
        void testTornTail() throws IOException {
            wal.append(KvRecord.live("a", "1", 1, null));
            wal.append(KvRecord.live("b", "2", 1, null));
            long intact = Files.size(logFile());
            wal.append(KvRecord.live("c", "3", 1, null));
            wal.close();

            // Chop the last frame in half
            long full = Files.size(logFile());
            truncate(logFile(), intact + (full - intact) / 2);

            wal = FileWriteAheadLog.open(tempDir, config);
            WalReplay replay = wal.replay();

            assertEquals(2, replay.entries().size());
            assertTrue(replay.corruption().isPresent());
            assertEquals(intact, replay.corruption().get().position());
            assertEquals(intact, Files.size(logFile()));
        }

        @Test
        @DisplayName("Zero-filled tail from a lost write is truncated")
        void testZeroFilledTail() throws IOException {
            wal.append(KvRecord.live("a", "1", 1, null));
            long intact = Files.size(logFile());
            wal.close();

            appendBytes(logFile(), new byte[64]);

            wal = FileWriteAheadLog.open(tempDir, config);
            WalReplay replay = wal.replay();

            assertEquals(1, replay.entries().size());
            WalCorruption corruption = replay.corruption().orElseThrow();
            assertEquals(intact, corruption.position());
            assertEquals(64, corruption.discardedBytes());
            assertTrue(corruption.reason().contains("magic"));
            assertEquals(intact, Files.size(logFile()));
        }

        @Test
        @DisplayName("Flipped payload byte fails the CRC and drops the frame")
        void testCrcMismatch() throws IOException {
            wal.append(KvRecord.live("a", "1", 1, null));
            long secondFrame = Files.size(logFile());
            wal.append(KvRecord.live("b", "2", 1, null));
            wal.close();

            corruptByteAt(logFile(), secondFrame + FileWriteAheadLog.HEADER_SIZE + 2);

            wal = FileWriteAheadLog.open(tempDir, config);
            WalReplay replay = wal.replay();

            assertEquals(1, replay.entries().size());
            assertEquals("a", replay.entries().get(0).record().key());
            assertTrue(replay.corruption().orElseThrow().reason().contains("CRC"));
        }

        @Test
        @DisplayName("Appends after recovery land behind the surviving prefix")
        void testAppendAfterRecovery() throws IOException {
            wal.append(KvRecord.live("a", "1", 1, null));
            wal.close();
            appendBytes(logFile(), "garbage".getBytes(StandardCharsets.UTF_8));

            wal = FileWriteAheadLog.open(tempDir, config);
            wal.replay();
            assertEquals(2, wal.append(KvRecord.live("b", "1", 1, null)));

            WalReplay replay = reopen().replay();
            assertEquals(2, replay.entries().size());
            assertTrue(replay.corruption().isEmpty());
        }

        @Test
        @DisplayName("Non-increasing sequence is treated as corruption")
        void testSequenceRegression() throws IOException {
            wal.append(KvRecord.live("a", "1", 1, null));
            wal.close();

            // Copy the first frame: same sequence twice
            byte[] bytes = Files.readAllBytes(logFile());
            appendBytes(logFile(), bytes);

            wal = FileWriteAheadLog.open(tempDir, config);
            WalReplay replay = wal.replay();

            assertEquals(1, replay.entries().size());
            assertTrue(replay.corruption().orElseThrow().reason().contains("sequence"));
        }

        @Test
        @DisplayName("Valid frame with an undecodable payload stops replay")
        void testUndecodablePayload() throws IOException {
            wal.append(KvRecord.live("a", "1", 1, null));
            wal.close();

            appendBytes(logFile(), frame(FileWriteAheadLog.TYPE_SET, 2,
                    "{not json".getBytes(StandardCharsets.UTF_8)));

            wal = FileWriteAheadLog.open(tempDir, config);
            WalReplay replay = wal.replay();

            assertEquals(1, replay.entries().size());
            assertTrue(replay.corruption().orElseThrow().reason().contains("undecodable"));
        }

        @Test
        @DisplayName("Unknown frame type stops replay")
        void testUnknownType() throws IOException {
            wal.close();
            appendBytes(logFile(), frame((byte) 9, 1,
                    "{}".getBytes(StandardCharsets.UTF_8)));

            wal = FileWriteAheadLog.open(tempDir, config);
            WalReplay replay = wal.replay();

            assertTrue(replay.entries().isEmpty());
            assertTrue(replay.corruption().orElseThrow().reason().contains("type"));
            assertEquals(0, Files.size(logFile()));
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static byte[] frame(byte type, long sequence, byte[] payload) {
        ByteBuffer buf = ByteBuffer.allocate(FileWriteAheadLog.HEADER_SIZE + payload.length
                + FileWriteAheadLog.CRC_SIZE);
        buf.putInt(FileWriteAheadLog.MAGIC);
        buf.putShort(FileWriteAheadLog.VERSION);
        buf.put(type);
        buf.putLong(sequence);
        buf.putInt(payload.length);
        buf.put(payload);
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, FileWriteAheadLog.HEADER_SIZE + payload.length);
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    private static void truncate(Path file, long size) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.truncate(size);
        }
    }

    private static void appendBytes(Path file, byte[] bytes) throws IOException {
        Files.write(file, bytes, StandardOpenOption.APPEND);
    }

    private static void corruptByteAt(Path file, long position) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer one = ByteBuffer.allocate(1);
            ch.read(one, position);
            one.flip();
            byte original = one.get();
            ch.write(ByteBuffer.wrap(new byte[]{(byte) (original ^ 0xFF)}), position);
        }
    }
}
