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
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * File-system helpers shared by the WAL, flush and compaction.
 * <p>
 * <b>Atomic replace:</b> write temp → fsync → rename → fsync dir.
 * A reader either sees no file or the complete file, never a torn one.
 */
public final class DurableFiles {

    private static final Logger LOG = LoggerFactory.getLogger(DurableFiles.class);

    /** Suffix of in-progress files; anything carrying it is garbage after a crash. */
    public static final String TMP_SUFFIX = ".tmp";

    private DurableFiles() {
    }

    /**
     * Atomically writes {@code content} to {@code target}.
     * <p>
     * On failure the temp file is removed and {@code target} is left as it was.
     *
     * @param target the final path
     * @param content the complete file content
     * @param sync whether to fsync the file and its directory
     * @throws IOException if any step fails
     */
    public static void writeAtomically(Path target, byte[] content, boolean sync) throws IOException {
        Path tmpPath = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try {
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(content);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (sync) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmpPath);
                }
            }

            Files.move(tmpPath, target, StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmpPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        // Fsync directory (critical on Linux)
        if (sync) {
            syncDirectory(target.getParent());
        }
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames, deletes) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    public static void syncDirectory(Path dir) {
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available under {@code dir}.
     *
     * @throws StorageException if disk space is below {@code minFreeBytes}
     */
    public static void checkDiskSpace(Path dir, long minFreeBytes) throws IOException {
        FileStore store = Files.getFileStore(dir);
        long usableSpace = store.getUsableSpace();
        long usableSpaceMb = usableSpace / 1024 / 1024;
        long minFreeSpaceMb = minFreeBytes / 1024 / 1024;

        LOG.trace("Disk space check: {} MB available, {} MB required", usableSpaceMb, minFreeSpaceMb);

        if (usableSpace < minFreeBytes) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB.");
        }
    }

    /**
     * Deletes leftover {@code *.tmp} files in {@code dir}, which can only be
     * the remains of a flush or compaction interrupted before its rename.
     *
     * @return the number of files removed
     */
    public static int deleteStaleTempFiles(Path dir) throws IOException {
        int removed = 0;
        try (var stream = Files.newDirectoryStream(dir, "*" + TMP_SUFFIX)) {
            for (Path tmp : stream) {
                Files.deleteIfExists(tmp);
                removed++;
                LOG.warn("Removed stale temp file left by an interrupted write: {}", tmp);
            }
        }
        return removed;
    }
}
