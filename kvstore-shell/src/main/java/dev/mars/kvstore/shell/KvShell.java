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
package dev.mars.kvstore.shell;

import dev.mars.kvstore.KvStoreException;
import dev.mars.kvstore.catalog.Catalog;
import dev.mars.kvstore.catalog.QualifiedKey;
import dev.mars.kvstore.catalog.Session;
import dev.mars.kvstore.storage.CompactionResult;
import dev.mars.kvstore.storage.KvStoreConfig;
import dev.mars.kvstore.storage.SegmentFile;
import dev.mars.kvstore.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Interactive shell over a {@link Catalog}.
 * <p>
 * Every command produces exactly one line starting with {@code [OK]},
 * {@code [WARN]} or {@code [ERROR]}. Engine errors are reported and the
 * shell keeps reading; only {@code exit} or end of input stops it.
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link KvStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dkvstore.dataDir=/path -Dkvstore.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code KVSTORE_DATA_DIR, KVSTORE_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code kvstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Run against ./kvstore
 * mvn -q -pl kvstore-shell -am install exec:java
 *
 * # Run against another data directory
 * mvn -q -pl kvstore-shell exec:java -Dexec.args=/path/to/data
 *
 * kvstore&gt; create-namespace app
 * [OK] Namespace 'app' created successfully.
 * kvstore&gt; use-namespace app
 * [OK] Using namespace: app
 * kvstore[app]&gt; create-table users
 * [OK] Table 'users' created in namespace 'app'.
 * kvstore[app]&gt; set users:alice:admin 60
 * [OK] Set users:alice (version 1, expires in 60s)
 * </pre>
 *
 * @see KvStoreConfig
 */
public final class KvShell {

    private static final Logger LOG = LoggerFactory.getLogger(KvShell.class);

    static final List<String> COMMANDS = List.of(
            "create-namespace <namespace>",
            "use-namespace <namespace>",
            "list-namespaces",
            "create-table <table>",
            "list-tables",
            "set <table:key:value> [ttlSeconds] (value may contain spaces; a trailing number is the TTL)",
            "get <table:key>",
            "delete <table:key>",
            "flush <table>",
            "compact <table>",
            "help",
            "exit");

    /** A trailing {@code set} token that reads as a TTL rather than part of the value. */
    private static final Pattern TTL_TOKEN = Pattern.compile("[+-]?[0-9.]+");

    private final Catalog catalog;
    private final Session session;
    private boolean running = true;

    public KvShell(Catalog catalog) {
        this.catalog = catalog;
        this.session = catalog.newSession();
    }

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|           KV Store Shell              |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        KvStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? KvStoreConfig.builder().dataDir(args[0]).build()
                : KvStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println("Type 'help' for the list of commands.");
        System.out.println();

        try (Catalog catalog = Catalog.open(config)) {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new KvShell(catalog).run(in, System.out);
        } catch (KvStoreException e) {
            System.out.println("[ERROR] " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            LOG.error("Failed to read input: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    // ========================================================================
    // Loop
    // ========================================================================

    /**
     * Reads commands until {@code exit} or end of input, printing one result line per command.
     */
    public void run(BufferedReader in, PrintStream out) throws IOException {
        while (running) {
            out.print(prompt());
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            if (line.isBlank()) {
                continue;
            }
            out.println(execute(line));
        }
    }

    /** True until {@code exit} has been executed. */
    public boolean running() {
        return running;
    }

    String prompt() {
        return session.namespace().map(ns -> "kvstore[" + ns + "]> ").orElse("kvstore> ");
    }

    /**
     * Executes one command line and returns its single-line result.
     */
    public String execute(String line) {
        String[] tokens = line.trim().split("\\s+");
        String command = tokens[0].toLowerCase();
        List<String> args = Arrays.asList(tokens).subList(1, tokens.length);
        try {
            switch (command) {
                case "create-namespace":
                    return createNamespace(args);
                case "use-namespace":
                    return useNamespace(args);
                case "list-namespaces":
                    return listNamespaces(args);
                case "create-table":
                    return createTable(args);
                case "list-tables":
                    return listTables(args);
                case "set":
                    return set(line.trim().substring(tokens[0].length()).trim());
                case "get":
                    return get(args);
                case "delete":
                    return delete(args);
                case "flush":
                    return flush(args);
                case "compact":
                    return compact(args);
                case "help":
                    return "[OK] Commands: " + String.join(" | ", COMMANDS);
                case "exit":
                case "quit":
                    running = false;
                    return "[OK] Bye.";
                default:
                    return "[ERROR] Unknown command '" + tokens[0] + "'. Type 'help' for the list of commands.";
            }
        } catch (StorageException e) {
            LOG.warn("Command failed: {}: {}", line, e.getMessage(), e);
            return "[ERROR] " + e.getMessage();
        } catch (KvStoreException e) {
            LOG.debug("Command rejected: {}: {}", line, e.getMessage());
            return "[ERROR] " + e.getMessage();
        }
    }

    // ========================================================================
    // Commands
    // ========================================================================

    private String createNamespace(List<String> args) {
        if (args.size() != 1) {
            return usage("create-namespace <namespace>");
        }
        catalog.createNamespace(args.get(0));
        return "[OK] Namespace '" + args.get(0) + "' created successfully.";
    }

    private String useNamespace(List<String> args) {
        if (args.size() != 1) {
            return usage("use-namespace <namespace>");
        }
        catalog.useNamespace(session, args.get(0));
        return "[OK] Using namespace: " + args.get(0);
    }

    private String listNamespaces(List<String> args) {
        if (!args.isEmpty()) {
            return usage("list-namespaces");
        }
        List<String> namespaces = catalog.listNamespaces();
        return namespaces.isEmpty() ? "[OK] No namespaces." : "[OK] Namespaces: " + String.join(", ", namespaces);
    }

    private String createTable(List<String> args) {
        if (args.size() != 1) {
            return usage("create-table <table>");
        }
        String namespace = session.requireNamespace();
        catalog.createTable(namespace, args.get(0));
        return "[OK] Table '" + args.get(0) + "' created in namespace '" + namespace + "'.";
    }

    private String listTables(List<String> args) {
        if (!args.isEmpty()) {
            return usage("list-tables");
        }
        String namespace = session.requireNamespace();
        List<String> tables = catalog.listTables(namespace);
        return tables.isEmpty()
                ? "[OK] No tables in namespace '" + namespace + "'."
                : "[OK] Tables in '" + namespace + "': " + String.join(", ", tables);
    }

    private String set(String arguments) {
        if (arguments.isEmpty()) {
            return usage("set <table:key:value> [ttlSeconds]");
        }
        String assignmentText = arguments;
        String ttlText = null;
        int lastSpace = lastWhitespace(arguments);
        if (lastSpace > 0 && TTL_TOKEN.matcher(arguments.substring(lastSpace + 1)).matches()) {
            ttlText = arguments.substring(lastSpace + 1);
            assignmentText = arguments.substring(0, lastSpace).trim();
        }
        QualifiedKey.Assignment assignment = QualifiedKey.parseAssignment(assignmentText);
        Duration ttl = ttlText == null ? null : Catalog.parseTtlSeconds(ttlText);
        long version = catalog.set(session, assignment.target(), assignment.value(), ttl);
        return "[OK] Set " + assignment.target() + " (version " + version
                + (ttl == null ? ")" : ", expires in " + ttlText + "s)");
    }

    private static int lastWhitespace(String text) {
        for (int i = text.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private String get(List<String> args) {
        if (args.size() != 1) {
            return usage("get <table:key>");
        }
        String value = catalog.get(session, args.get(0));
        return "[OK] " + args.get(0) + " = " + value;
    }

    private String delete(List<String> args) {
        if (args.size() != 1) {
            return usage("delete <table:key>");
        }
        QualifiedKey target = QualifiedKey.parse(args.get(0));
        catalog.delete(session, args.get(0));
        return "[OK] Marked key '" + target.key() + "' as deleted in table '" + target.table() + "'.";
    }

    private String flush(List<String> args) {
        if (args.size() != 1) {
            return usage("flush <table>");
        }
        OptionalLong segmentId = catalog.flush(session, args.get(0));
        if (segmentId.isEmpty()) {
            return "[WARN] Nothing to flush.";
        }
        return "[OK] Flushed " + session.requireNamespace() + ":" + args.get(0)
                + " to " + SegmentFile.fileName(segmentId.getAsLong());
    }

    private String compact(List<String> args) {
        if (args.size() != 1) {
            return usage("compact <table>");
        }
        CompactionResult result = catalog.compact(session, args.get(0));
        if (!result.compacted()) {
            return "[WARN] No files to compact.";
        }
        if (result.segmentId().isEmpty()) {
            return "[WARN] No valid data to compact. " + result.inputSegments() + " segment(s) removed.";
        }
        return "[OK] Table '" + args.get(0) + "' compacted successfully. New file: "
                + SegmentFile.fileName(result.segmentId().getAsLong())
                + " (" + result.recordsKept() + " records kept from " + result.inputSegments() + " segments)";
    }

    private static String usage(String synopsis) {
        return "[ERROR] Usage: " + synopsis;
    }
}
