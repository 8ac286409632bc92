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
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on a storage root, held for the lifetime of a catalog.
 * <p>
 * Uses a separate lock file so the lock never interferes with segment
 * or WAL file operations. A second process (or a second catalog in the
 * same JVM) on the same root fails fast instead of corrupting it.
 */
public final class DirectoryLock implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryLock.class);

    /** Lock file name */
    public static final String LOCK_FILE = "kvstore.lock";

    private final Path lockPath;
    private final FileChannel lockChannel;
    private final FileLock exclusiveLock;

    private DirectoryLock(Path lockPath, FileChannel lockChannel, FileLock exclusiveLock) {
        this.lockPath = lockPath;
        this.lockChannel = lockChannel;
        this.exclusiveLock = exclusiveLock;
    }

    /**
     * Acquires the exclusive lock on {@code dir}.
     *
     * @throws StorageException if another process or catalog holds the lock
     */
    public static DirectoryLock acquire(Path dir) throws IOException {
        Path lockPath = dir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        FileChannel channel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on storage root: " + dir +
                        ". Another process may be using this storage.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
            return new DirectoryLock(lockPath, channel, lock);
        } catch (OverlappingFileLockException e) {
            channel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock on " + dir + ": lock already held in this JVM", e);
        }
    }

    /**
     * Releases the exclusive lock and closes the lock channel.
     */
    @Override
    public void close() {
        try {
            if (exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released: {}", lockPath);
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel.isOpen()) {
                lockChannel.close();
                LOG.trace("Lock channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }
}
