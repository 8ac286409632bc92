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
package dev.mars.kvstore.catalog;

import dev.mars.kvstore.storage.CompactionResult;
import dev.mars.kvstore.storage.DirectoryLock;
import dev.mars.kvstore.storage.DurableFiles;
import dev.mars.kvstore.storage.InvalidTtlException;
import dev.mars.kvstore.storage.KvRecord;
import dev.mars.kvstore.storage.KvStoreConfig;
import dev.mars.kvstore.storage.StorageException;
import dev.mars.kvstore.storage.TableEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Resolves namespaces and tables to their directories and live engines.
 * <p>
 * <b>Layout:</b>
 * <pre>
 * &lt;root&gt;/
 *  ├─ kvstore.lock                      // held for the catalog's lifetime
 *  └─ &lt;namespace&gt;/&lt;table&gt;/
 *      ├─ segment-000001.json           // immutable, oldest → newest by id
 *      └─ wal.log                       // append-only, cleared on flush
 * </pre>
 * <p>
 * Tables are opened lazily on first access, which replays their WAL.
 * Key-addressed calls take a {@link Session} that supplies the namespace;
 * the catalog itself keeps no current-namespace state.
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * try (Catalog catalog = Catalog.open(KvStoreConfig.load())) {
 *     catalog.createNamespace("app");
 *     catalog.createTable("app", "users");
 *
 *     Session session = catalog.newSession();
 *     catalog.useNamespace(session, "app");
 *     catalog.set(session, "users:alice", "admin", null);
 *     String role = catalog.get(session, "users:alice");
 *     catalog.flush(session, "users");
 * }
 * }</pre>
 */
public final class Catalog implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Catalog.class);

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private record TableId(String namespace, String table) {
    }

    private final KvStoreConfig config;
    private final Clock clock;
    private final Path root;
    private final DirectoryLock rootLock;
    private final ConcurrentHashMap<TableId, TableEngine> openTables = new ConcurrentHashMap<>();
    private volatile boolean closed;

    private Catalog(KvStoreConfig config, Clock clock, Path root, DirectoryLock rootLock) {
        this.config = config;
        this.clock = clock;
        this.root = root;
        this.rootLock = rootLock;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the storage root named by {@code config}, creating it if needed.
     *
     * @throws StorageException if the root cannot be created or is locked by another process
     */
    public static Catalog open(KvStoreConfig config) {
        return open(config, Clock.systemUTC());
    }

    /**
     * Opens the storage root with an explicit clock for TTL evaluation.
     */
    public static Catalog open(KvStoreConfig config, Clock clock) {
        Path root = config.dataDir();
        try {
            LOG.info("Opening kvstore at: {}", root);
            Files.createDirectories(root);
            DirectoryLock lock = DirectoryLock.acquire(root);
            try {
                DurableFiles.checkDiskSpace(root, config.minFreeSpaceBytes());
            } catch (IOException | RuntimeException e) {
                lock.close();
                throw e;
            }
            LOG.info("Kvstore opened: {}", config);
            return new Catalog(config, clock, root, lock);
        } catch (IOException e) {
            LOG.error("Failed to open kvstore at {}: {}", root, e.getMessage(), e);
            throw new StorageException("Failed to open kvstore at " + root, e);
        }
    }

    /** Storage root directory. */
    public Path root() {
        return root;
    }

    public KvStoreConfig config() {
        return config;
    }

    /** Creates a new caller context with no namespace selected. */
    public Session newSession() {
        return new Session();
    }

    /**
     * Closes every open table and releases the storage root lock.
     * Unflushed writes stay in each table's WAL and are replayed on next open.
     */
    @Override
    public void close() {
        if (closed) {
            LOG.debug("Catalog already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing kvstore at: {} ({} open tables)", root, openTables.size());
        for (TableEngine engine : openTables.values()) {
            engine.close();
        }
        openTables.clear();
        rootLock.close();
    }

    // ========================================================================
    // Namespaces
    // ========================================================================

    /**
     * Creates a namespace.
     *
     * @throws NamespaceAlreadyExistsException if it already exists
     * @throws InvalidNameException            if the name is not allowed
     */
    public void createNamespace(String namespace) {
        ensureOpen();
        validateName("namespace", namespace);
        Path dir = root.resolve(namespace);
        try {
            Files.createDirectory(dir);
        } catch (FileAlreadyExistsException e) {
            throw new NamespaceAlreadyExistsException(namespace);
        } catch (IOException e) {
            LOG.error("Failed to create namespace {}: {}", namespace, e.getMessage(), e);
            throw new StorageException("Failed to create namespace '" + namespace + "'", e);
        }
        syncIfEnabled(root);
        LOG.info("Namespace created: {}", namespace);
    }

    /**
     * Creates the namespace unless it already exists.
     *
     * @return whether it was created or already there
     */
    public OpenOutcome openOrCreateNamespace(String namespace) {
        ensureOpen();
        validateName("namespace", namespace);
        if (Files.isDirectory(root.resolve(namespace))) {
            return OpenOutcome.OPENED_EXISTING;
        }
        try {
            createNamespace(namespace);
            return OpenOutcome.CREATED;
        } catch (NamespaceAlreadyExistsException e) {
            return OpenOutcome.OPENED_EXISTING;
        }
    }

    /**
     * Selects {@code namespace} as the session's current namespace.
     *
     * @throws NamespaceNotFoundException if it does not exist
     */
    public void useNamespace(Session session, String namespace) {
        ensureOpen();
        validateName("namespace", namespace);
        requireNamespace(namespace);
        session.select(namespace);
        LOG.debug("Session switched to namespace {}", namespace);
    }

    /** All namespaces, sorted by name. */
    public List<String> listNamespaces() {
        ensureOpen();
        return listDirectories(root);
    }

    // ========================================================================
    // Tables
    // ========================================================================

    /**
     * Creates a table in an existing namespace.
     *
     * @throws NamespaceNotFoundException  if the namespace does not exist
     * @throws TableAlreadyExistsException if the table already exists
     */
    public void createTable(String namespace, String table) {
        ensureOpen();
        validateName("namespace", namespace);
        validateName("table", table);
        Path nsDir = requireNamespace(namespace);
        Path dir = nsDir.resolve(table);
        try {
            Files.createDirectory(dir);
        } catch (FileAlreadyExistsException e) {
            throw new TableAlreadyExistsException(namespace, table);
        } catch (IOException e) {
            LOG.error("Failed to create table {}/{}: {}", namespace, table, e.getMessage(), e);
            throw new StorageException("Failed to create table '" + table + "' in '" + namespace + "'", e);
        }
        syncIfEnabled(nsDir);
        LOG.info("Table created: {}/{}", namespace, table);
    }

    /**
     * Creates the table unless it already exists. The namespace must exist.
     *
     * @return whether it was created or already there
     */
    public OpenOutcome openOrCreateTable(String namespace, String table) {
        ensureOpen();
        validateName("namespace", namespace);
        validateName("table", table);
        if (Files.isDirectory(requireNamespace(namespace).resolve(table))) {
            return OpenOutcome.OPENED_EXISTING;
        }
        try {
            createTable(namespace, table);
            return OpenOutcome.CREATED;
        } catch (TableAlreadyExistsException e) {
            return OpenOutcome.OPENED_EXISTING;
        }
    }

    /**
     * Tables of {@code namespace}, sorted by name.
     *
     * @throws NamespaceNotFoundException if the namespace does not exist
     */
    public List<String> listTables(String namespace) {
        ensureOpen();
        validateName("namespace", namespace);
        return listDirectories(requireNamespace(namespace));
    }

    /**
     * The live engine of a table, opening it (and replaying its WAL) on first access.
     *
     * @throws NamespaceNotFoundException if the namespace does not exist
     * @throws TableNotFoundException     if the table does not exist
     */
    public TableEngine table(String namespace, String table) {
        ensureOpen();
        validateName("namespace", namespace);
        validateName("table", table);
        TableId id = new TableId(namespace, table);
        TableEngine engine = openTables.get(id);
        if (engine != null) {
            return engine;
        }
        Path dir = requireNamespace(namespace).resolve(table);
        if (!Files.isDirectory(dir)) {
            throw new TableNotFoundException(namespace, table);
        }
        return openTables.computeIfAbsent(id, k -> TableEngine.open(dir, config, clock));
    }

    // ========================================================================
    // Key operations
    // ========================================================================

    /**
     * Sets {@code table:key} in the session's namespace.
     *
     * @param ttl time-to-live, or null for no expiry
     * @return the new version of the key
     */
    public long set(Session session, String qualifiedKey, String value, Duration ttl) {
        return set(session, QualifiedKey.parse(qualifiedKey), value, ttl);
    }

    public long set(Session session, QualifiedKey target, String value, Duration ttl) {
        return table(session.requireNamespace(), target.table()).set(target.key(), value, ttl);
    }

    /**
     * Reads {@code table:key} in the session's namespace.
     *
     * @return the live value
     * @throws KeyNotFoundException if the key is absent, deleted or expired
     */
    public String get(Session session, String qualifiedKey) {
        QualifiedKey target = QualifiedKey.parse(qualifiedKey);
        return find(session, target)
                .map(KvRecord::value)
                .orElseThrow(() -> new KeyNotFoundException(target.table(), target.key()));
    }

    /**
     * Reads the live record for {@code target}, if any.
     */
    public Optional<KvRecord> find(Session session, QualifiedKey target) {
        return table(session.requireNamespace(), target.table()).get(target.key());
    }

    /**
     * Deletes {@code table:key} in the session's namespace by writing a tombstone.
     *
     * @return the version of the tombstone
     */
    public long delete(Session session, String qualifiedKey) {
        QualifiedKey target = QualifiedKey.parse(qualifiedKey);
        return table(session.requireNamespace(), target.table()).delete(target.key());
    }

    /**
     * Flushes a table of the session's namespace.
     *
     * @return the new segment id, or empty if the memstore was empty
     */
    public OptionalLong flush(Session session, String table) {
        return table(session.requireNamespace(), table).flush();
    }

    /**
     * Compacts a table of the session's namespace.
     */
    public CompactionResult compact(Session session, String table) {
        return table(session.requireNamespace(), table).compact();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Parses a TTL given in seconds (decimals allowed, e.g. {@code "1.5"}).
     *
     * @throws InvalidTtlException if the text is not a number or not positive
     */
    public static Duration parseTtlSeconds(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidTtlException("TTL must be a number of seconds, got nothing");
        }
        BigDecimal seconds;
        try {
            seconds = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidTtlException("TTL must be a number of seconds, got '" + text + "'", e);
        }
        long millis;
        try {
            millis = seconds.movePointRight(3).setScale(0, RoundingMode.CEILING).longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidTtlException("TTL out of range: '" + text + "'", e);
        }
        if (seconds.signum() <= 0) {
            throw new InvalidTtlException("TTL must be positive, got '" + text + "'");
        }
        return Duration.ofMillis(millis);
    }

    private Path requireNamespace(String namespace) {
        Path dir = root.resolve(namespace);
        if (!Files.isDirectory(dir)) {
            throw new NamespaceNotFoundException(namespace);
        }
        return dir;
    }

    private static void validateName(String kind, String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new InvalidNameException("Invalid " + kind + " name '" + name
                    + "': use 1-64 letters, digits, '_' or '-'");
        }
    }

    private static List<String> listDirectories(Path dir) {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path child : stream) {
                names.add(child.getFileName().toString());
            }
        } catch (IOException e) {
            LOG.error("Failed to list {}: {}", dir, e.getMessage(), e);
            throw new StorageException("Failed to list " + dir, e);
        }
        Collections.sort(names);
        return names;
    }

    private void syncIfEnabled(Path dir) {
        if (config.syncEnabled()) {
            DurableFiles.syncDirectory(dir);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Catalog at " + root + " is closed");
        }
    }
}
