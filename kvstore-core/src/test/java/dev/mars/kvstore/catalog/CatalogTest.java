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
import dev.mars.kvstore.storage.InvalidTtlException;
import dev.mars.kvstore.storage.KvStoreConfig;
import dev.mars.kvstore.storage.MutableClock;
import dev.mars.kvstore.storage.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Catalog}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Namespace and table lifecycle and their errors</li>
 *   <li>Session-scoped key addressing</li>
 *   <li>Lazy table opening and recovery across catalog restarts</li>
 *   <li>The storage root lock</li>
 * </ul>
 */
class CatalogTest {

    @TempDir
    Path tempDir;

    private Path root;
    private KvStoreConfig config;
    private MutableClock clock;
    private Catalog catalog;
    private Session session;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("kvstore");
        config = KvStoreConfig.builder()
                .dataDir(root)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .memstoreFlushThresholdKb(0)
                .build();
        clock = MutableClock.startingAt(10_000L);
        catalog = Catalog.open(config, clock);
        session = catalog.newSession();
    }

    @AfterEach
    void tearDown() {
        if (catalog != null) {
            catalog.close();
        }
    }

    private void useTable(String namespace, String table) {
        catalog.openOrCreateNamespace(namespace);
        catalog.openOrCreateTable(namespace, table);
        catalog.useNamespace(session, namespace);
    }

    // ========================================================================
    // Open / Lock
    // ========================================================================

    @Test
    void testOpen_CreatesRootAndLockFile() {
        assertTrue(Files.isDirectory(root));
        assertTrue(Files.exists(root.resolve(DirectoryLock.LOCK_FILE)));
        assertEquals(root, catalog.root());
    }

    @Test
    void testOpen_SecondCatalogOnSameRootFails() {
        assertThrows(StorageException.class, () -> Catalog.open(config, clock));
    }

    @Test
    void testOpen_AfterCloseSucceeds() {
        catalog.close();

        catalog = Catalog.open(config, clock);
        assertNotNull(catalog.listNamespaces());
    }

    @Test
    void testClosedCatalog_RejectsCalls() {
        catalog.close();

        assertThrows(StorageException.class, () -> catalog.listNamespaces());
        assertThrows(StorageException.class, () -> catalog.createNamespace("ns"));
    }

    // ========================================================================
    // Namespaces
    // ========================================================================

    @Nested
    @DisplayName("Namespaces")
    class Namespaces {

        @Test
        @DisplayName("Created namespaces are listed in name order, lock file excluded")
        void testCreateAndList() {
            catalog.createNamespace("zeta");
            catalog.createNamespace("alpha");
            catalog.createNamespace("mid_1");

            assertEquals(List.of("alpha", "mid_1", "zeta"), catalog.listNamespaces());
        }

        @Test
        @DisplayName("Creating an existing namespace fails")
        void testCreateDuplicate() {
            catalog.createNamespace("app");

            NamespaceAlreadyExistsException e = assertThrows(NamespaceAlreadyExistsException.class,
                    () -> catalog.createNamespace("app"));
            assertEquals("app", e.namespace());
        }

        @Test
        @DisplayName("openOrCreate reports whether it created")
        void testOpenOrCreate() {
            assertEquals(OpenOutcome.CREATED, catalog.openOrCreateNamespace("app"));
            assertEquals(OpenOutcome.OPENED_EXISTING, catalog.openOrCreateNamespace("app"));
        }

        @Test
        @DisplayName("Names outside the allowed alphabet are rejected")
        void testInvalidNames() {
            assertThrows(InvalidNameException.class, () -> catalog.createNamespace(""));
            assertThrows(InvalidNameException.class, () -> catalog.createNamespace(".."));
            assertThrows(InvalidNameException.class, () -> catalog.createNamespace("a/b"));
            assertThrows(InvalidNameException.class, () -> catalog.createNamespace("has space"));
            assertThrows(InvalidNameException.class, () -> catalog.createNamespace("x".repeat(65)));
            assertThrows(InvalidNameException.class, () -> catalog.createNamespace(null));
            catalog.createNamespace("x".repeat(64));
        }

        @Test
        @DisplayName("Using a missing namespace fails and keeps the current one")
        void testUseMissingNamespace() {
            catalog.createNamespace("app");
            catalog.useNamespace(session, "app");

            assertThrows(NamespaceNotFoundException.class, () -> catalog.useNamespace(session, "nope"));
            assertEquals("app", session.requireNamespace());
        }

        @Test
        @DisplayName("A fresh session has no namespace")
        void testNoNamespaceSelected() {
            assertTrue(session.namespace().isEmpty());
            assertThrows(NoNamespaceSelectedException.class, () -> catalog.get(session, "t:k"));
            assertThrows(NoNamespaceSelectedException.class, () -> catalog.set(session, "t:k", "v", null));
            assertThrows(NoNamespaceSelectedException.class, () -> catalog.flush(session, "t"));
        }
    }

    // ========================================================================
    // Tables
    // ========================================================================

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        @DisplayName("Tables are listed per namespace in name order")
        void testCreateAndList() {
            catalog.createNamespace("a");
            catalog.createNamespace("b");
            catalog.createTable("a", "users");
            catalog.createTable("a", "orders");
            catalog.createTable("b", "events");

            assertEquals(List.of("orders", "users"), catalog.listTables("a"));
            assertEquals(List.of("events"), catalog.listTables("b"));
        }

        @Test
        @DisplayName("Creating a table needs its namespace")
        void testCreateInMissingNamespace() {
            assertThrows(NamespaceNotFoundException.class, () -> catalog.createTable("nope", "t"));
            assertThrows(NamespaceNotFoundException.class, () -> catalog.listTables("nope"));
        }

        @Test
        @DisplayName("Creating an existing table fails")
        void testCreateDuplicate() {
            catalog.createNamespace("app");
            catalog.createTable("app", "users");

            TableAlreadyExistsException e = assertThrows(TableAlreadyExistsException.class,
                    () -> catalog.createTable("app", "users"));
            assertEquals("users", e.table());
            assertEquals(OpenOutcome.OPENED_EXISTING, catalog.openOrCreateTable("app", "users"));
            assertEquals(OpenOutcome.CREATED, catalog.openOrCreateTable("app", "orders"));
        }

        @Test
        @DisplayName("Addressing a missing table fails")
        void testMissingTable() {
            catalog.createNamespace("app");
            catalog.useNamespace(session, "app");

            assertThrows(TableNotFoundException.class, () -> catalog.set(session, "ghost:k", "v", null));
            assertThrows(TableNotFoundException.class, () -> catalog.get(session, "ghost:k"));
        }

        @Test
        @DisplayName("A table's engine is opened once and reused")
        void testLazyOpenIsCached() {
            catalog.createNamespace("app");
            catalog.createTable("app", "users");

            assertSame(catalog.table("app", "users"), catalog.table("app", "users"));
        }
    }

    // ========================================================================
    // Key Operations
    // ========================================================================

    @Test
    void testSetGetDelete() {
        useTable("app", "users");

        assertEquals(1, catalog.set(session, "users:alice", "admin", null));
        assertEquals("admin", catalog.get(session, "users:alice"));

        catalog.delete(session, "users:alice");

        KeyNotFoundException e = assertThrows(KeyNotFoundException.class,
                () -> catalog.get(session, "users:alice"));
        assertEquals("users", e.table());
        assertEquals("alice", e.key());
    }

    @Test
    void testGet_MissingKey() {
        useTable("app", "users");

        assertThrows(KeyNotFoundException.class, () -> catalog.get(session, "users:nobody"));
    }

    @Test
    void testGet_MalformedKey() {
        useTable("app", "users");

        assertThrows(InvalidKeyException.class, () -> catalog.get(session, "users"));
        assertThrows(InvalidKeyException.class, () -> catalog.set(session, "users:a:b", "v", null));
    }

    @Test
    void testGet_ExpiredKey() {
        useTable("app", "cache");
        catalog.set(session, "cache:token", "abc", Duration.ofSeconds(30));

        assertEquals("abc", catalog.get(session, "cache:token"));
        clock.advance(Duration.ofSeconds(30));
        assertThrows(KeyNotFoundException.class, () -> catalog.get(session, "cache:token"));
    }

    @Test
    void testSessions_AreIndependent() {
        useTable("one", "t");
        catalog.openOrCreateNamespace("two");
        catalog.openOrCreateTable("two", "t");
        Session other = catalog.newSession();
        catalog.useNamespace(other, "two");

        catalog.set(session, "t:k", "from-one", null);
        catalog.set(other, "t:k", "from-two", null);

        assertEquals("from-one", catalog.get(session, "t:k"));
        assertEquals("from-two", catalog.get(other, "t:k"));
    }

    @Test
    void testFlushAndCompact() {
        useTable("app", "users");

        assertTrue(catalog.flush(session, "users").isEmpty());
        assertFalse(catalog.compact(session, "users").compacted());

        catalog.set(session, "users:a", "1", null);
        assertEquals(OptionalLong.of(1), catalog.flush(session, "users"));
        catalog.set(session, "users:a", "2", null);
        assertEquals(OptionalLong.of(2), catalog.flush(session, "users"));

        CompactionResult result = catalog.compact(session, "users");

        assertEquals(OptionalLong.of(3), result.segmentId());
        assertEquals("2", catalog.get(session, "users:a"));
        assertTrue(Files.exists(root.resolve("app").resolve("users").resolve("segment-000003.json")));
    }

    @Test
    void testData_SurvivesCatalogRestart() {
        useTable("app", "users");
        catalog.set(session, "users:flushed", "f", null);
        catalog.flush(session, "users");
        catalog.set(session, "users:logged", "l", null);
        catalog.close();

        catalog = Catalog.open(config, clock);
        Session reopened = catalog.newSession();
        catalog.useNamespace(reopened, "app");

        assertEquals("f", catalog.get(reopened, "users:flushed"));
        assertEquals("l", catalog.get(reopened, "users:logged"));
        assertEquals(List.of("app"), catalog.listNamespaces());
        assertEquals(List.of("users"), catalog.listTables("app"));
    }

    // ========================================================================
    // TTL Parsing
    // ========================================================================

    @Test
    void testParseTtlSeconds() {
        assertEquals(Duration.ofSeconds(5), Catalog.parseTtlSeconds("5"));
        assertEquals(Duration.ofMillis(1500), Catalog.parseTtlSeconds("1.5"));
        assertEquals(Duration.ofMillis(1), Catalog.parseTtlSeconds("0.0001"));
    }

    @Test
    void testParseTtlSeconds_RejectsInvalid() {
        assertThrows(InvalidTtlException.class, () -> Catalog.parseTtlSeconds("0"));
        assertThrows(InvalidTtlException.class, () -> Catalog.parseTtlSeconds("-3"));
        assertThrows(InvalidTtlException.class, () -> Catalog.parseTtlSeconds("soon"));
        assertThrows(InvalidTtlException.class, () -> Catalog.parseTtlSeconds(null));
    }
}
