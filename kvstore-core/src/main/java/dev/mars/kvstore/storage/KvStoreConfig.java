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
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for the key-value engine.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dkvstore.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code KVSTORE_DATA_DIR})</li>
 *   <li>Properties file ({@code kvstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>kvstore.dataDir</td><td>KVSTORE_DATA_DIR</td><td>./kvstore</td></tr>
 *   <tr><td>syncEnabled</td><td>kvstore.syncEnabled</td><td>KVSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>kvstore.verifyWrites</td><td>KVSTORE_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>kvstore.minFreeSpaceMb</td><td>KVSTORE_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 *   <tr><td>maxRecordSizeMb</td><td>kvstore.maxRecordSizeMb</td><td>KVSTORE_MAX_RECORD_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>memstoreFlushThresholdKb</td><td>kvstore.memstoreFlushThresholdKb</td>
 *       <td>KVSTORE_MEMSTORE_FLUSH_THRESHOLD_KB</td><td>1024</td></tr>
 *   <tr><td>compactionTrigger</td><td>kvstore.compactionTrigger</td>
 *       <td>KVSTORE_COMPACTION_TRIGGER</td><td>0 (disabled)</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # kvstore.properties
 * kvstore.dataDir=/var/lib/kvstore
 * kvstore.syncEnabled=true
 * kvstore.memstoreFlushThresholdKb=4096
 * kvstore.compactionTrigger=8
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * KvStoreConfig config = KvStoreConfig.builder()
 *     .dataDir(Path.of("/var/lib/kvstore"))
 *     .compactionTrigger(4)
 *     .build();
 *
 * try (Catalog catalog = Catalog.open(config)) {
 *     ...
 * }
 * </pre>
 */
public final class KvStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(KvStoreConfig.class);

    private static final String PROPERTIES_FILE = "kvstore.properties";

    /** Each setting's system property (also its properties-file key) and environment variable. */
    enum Setting {
        DATA_DIR("kvstore.dataDir", "KVSTORE_DATA_DIR"),
        SYNC_ENABLED("kvstore.syncEnabled", "KVSTORE_SYNC_ENABLED"),
        VERIFY_WRITES("kvstore.verifyWrites", "KVSTORE_VERIFY_WRITES"),
        MIN_FREE_SPACE_MB("kvstore.minFreeSpaceMb", "KVSTORE_MIN_FREE_SPACE_MB"),
        MAX_RECORD_SIZE_MB("kvstore.maxRecordSizeMb", "KVSTORE_MAX_RECORD_SIZE_MB"),
        FLUSH_THRESHOLD_KB("kvstore.memstoreFlushThresholdKb", "KVSTORE_MEMSTORE_FLUSH_THRESHOLD_KB"),
        COMPACTION_TRIGGER("kvstore.compactionTrigger", "KVSTORE_COMPACTION_TRIGGER");

        final String property;
        final String env;

        Setting(String property, String env) {
            this.property = property;
            this.env = env;
        }
    }

    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.dir"), "kvstore");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;
    private static final int DEFAULT_MAX_RECORD_SIZE_MB = 16;
    private static final int DEFAULT_FLUSH_THRESHOLD_KB = 1024;
    private static final int DEFAULT_COMPACTION_TRIGGER = 0;

    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int minFreeSpaceMb;
    private final int maxRecordSizeMb;
    private final int memstoreFlushThresholdKb;
    private final int compactionTrigger;

    private KvStoreConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxRecordSizeMb = builder.maxRecordSizeMb;
        this.memstoreFlushThresholdKb = builder.memstoreFlushThresholdKb;
        this.compactionTrigger = builder.compactionTrigger;
    }

    /** Storage root: one subdirectory per namespace. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether to verify WAL writes by reading back and checking CRC. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum encoded size in MB of a single WAL record. */
    public int maxRecordSizeMb() {
        return maxRecordSizeMb;
    }

    /** Memstore size in KB at which a table flushes on its own. 0 disables it. */
    public int memstoreFlushThresholdKb() {
        return memstoreFlushThresholdKb;
    }

    /** Segment count at which a table compacts on its own. 0 disables it. */
    public int compactionTrigger() {
        return compactionTrigger;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum WAL record size in bytes. */
    public int maxRecordSizeBytes() {
        return maxRecordSizeMb * 1024 * 1024;
    }

    /** Memstore flush threshold in bytes. */
    public long memstoreFlushThresholdBytes() {
        return (long) memstoreFlushThresholdKb * 1024;
    }

    @Override
    public String toString() {
        return "KvStoreConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxRecordSizeMb=" + maxRecordSizeMb +
                ", memstoreFlushThresholdKb=" + memstoreFlushThresholdKb +
                ", compactionTrigger=" + compactionTrigger +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder(loadPropertiesFile());
    }

    /** A builder that reads {@code fileProperties} in place of {@code kvstore.properties}. */
    static Builder builder(Properties fileProperties) {
        return new Builder(fileProperties);
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code KvStoreConfig.builder().build()}.
     */
    public static KvStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link KvStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path dataDir;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer minFreeSpaceMb;
        private Integer maxRecordSizeMb;
        private Integer memstoreFlushThresholdKb;
        private Integer compactionTrigger;

        private final Properties fileProperties;

        private Builder(Properties fileProperties) {
            this.fileProperties = fileProperties;
        }

        /** Sets the storage root. */
        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        /** Sets the storage root from a string path. */
        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables WAL write verification (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum WAL record size in MB (default: 16). */
        public Builder maxRecordSizeMb(int maxRecordSizeMb) {
            this.maxRecordSizeMb = maxRecordSizeMb;
            return this;
        }

        /** Sets the automatic flush threshold in KB (default: 1024, 0 disables). */
        public Builder memstoreFlushThresholdKb(int memstoreFlushThresholdKb) {
            this.memstoreFlushThresholdKb = memstoreFlushThresholdKb;
            return this;
        }

        /** Sets the automatic compaction segment count (default: 0, disabled). */
        public Builder compactionTrigger(int compactionTrigger) {
            this.compactionTrigger = compactionTrigger;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public KvStoreConfig build() {
            // programmatic > sysprop > env > file > default
            if (dataDir == null) {
                dataDir = resolve(Setting.DATA_DIR, Path::of, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(Setting.SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolve(Setting.VERIFY_WRITES, Boolean::parseBoolean, DEFAULT_VERIFY_WRITES);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolve(Setting.MIN_FREE_SPACE_MB, Integer::valueOf, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxRecordSizeMb == null) {
                maxRecordSizeMb = resolve(Setting.MAX_RECORD_SIZE_MB, Integer::valueOf, DEFAULT_MAX_RECORD_SIZE_MB);
            }
            if (memstoreFlushThresholdKb == null) {
                memstoreFlushThresholdKb = resolve(Setting.FLUSH_THRESHOLD_KB, Integer::valueOf,
                        DEFAULT_FLUSH_THRESHOLD_KB);
            }
            if (compactionTrigger == null) {
                compactionTrigger = resolve(Setting.COMPACTION_TRIGGER, Integer::valueOf, DEFAULT_COMPACTION_TRIGGER);
            }
            if (minFreeSpaceMb < 0 || maxRecordSizeMb < 1 || memstoreFlushThresholdKb < 0 || compactionTrigger < 0) {
                throw new IllegalArgumentException("Invalid kvstore configuration: minFreeSpaceMb=" + minFreeSpaceMb
                        + ", maxRecordSizeMb=" + maxRecordSizeMb
                        + ", memstoreFlushThresholdKb=" + memstoreFlushThresholdKb
                        + ", compactionTrigger=" + compactionTrigger);
            }

            return new KvStoreConfig(this);
        }

        /**
         * First non-blank value of {@code setting} across the external sources,
         * parsed; {@code defaultValue} when none is set or the value does not parse.
         */
        private <T> T resolve(Setting setting, Function<String, T> parser, T defaultValue) {
            for (String raw : new String[]{
                    System.getProperty(setting.property),
                    System.getenv(setting.env),
                    fileProperties.getProperty(setting.property)}) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(raw.trim());
                } catch (IllegalArgumentException e) {
                    LOG.warn("Ignoring invalid value '{}' for {}, using default {}",
                            raw.trim(), setting.property, defaultValue);
                    return defaultValue;
                }
            }
            return defaultValue;
        }
    }

    /** Reads {@code kvstore.properties} from the classpath, else from the working directory. */
    private static Properties loadPropertiesFile() {
        Properties props = new Properties();
        try (InputStream is = KvStoreConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
                return props;
            }
        } catch (IOException e) {
            LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
        }

        Path localFile = Path.of(PROPERTIES_FILE);
        if (Files.exists(localFile)) {
            try (InputStream is = Files.newInputStream(localFile)) {
                props.load(is);
            } catch (IOException e) {
                LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
            }
        }
        return props;
    }
}
