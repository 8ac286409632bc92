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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The unit of data for one key.
 * <p>
 * A record is either a live value or a tombstone. Live values may carry an
 * absolute expiry instant (epoch millis). Records are immutable; a newer
 * write for the same key produces a new record with a higher version.
 * <p>
 * The JSON shape of this record is shared by WAL payloads and segment files:
 * <pre>
 * { "key": "a", "value": "1", "version": 3, "expires_at": null, "tombstone": false }
 * </pre>
 *
 * @param key       the key, never null
 * @param value     the value, null exactly when {@code tombstone} is true
 * @param version   per-key version, starting at 1
 * @param expiresAt absolute expiry in epoch millis, or null if the record never expires
 * @param tombstone whether this record marks the key as deleted
 */
@JsonPropertyOrder({"key", "value", "version", "expires_at", "tombstone"})
public record KvRecord(
        @JsonProperty("key") String key,
        @JsonProperty("value") String value,
        @JsonProperty("version") long version,
        @JsonProperty("expires_at") Long expiresAt,
        @JsonProperty("tombstone") boolean tombstone
) {

    /** Fixed per-record overhead used by {@link #approximateBytes()}. */
    private static final int RECORD_OVERHEAD = 32;

    public KvRecord {
        Objects.requireNonNull(key, "key");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1: " + version);
        }
        if (tombstone && value != null) {
            throw new IllegalArgumentException("tombstone for key '" + key + "' must not carry a value");
        }
        if (!tombstone && value == null) {
            throw new IllegalArgumentException("live record for key '" + key + "' must carry a value");
        }
    }

    /**
     * Creates a live record.
     *
     * @param expiresAt absolute expiry in epoch millis, or null for no expiry
     */
    public static KvRecord live(String key, String value, long version, Long expiresAt) {
        return new KvRecord(key, value, version, expiresAt, false);
    }

    /**
     * Creates a tombstone record.
     */
    public static KvRecord deleted(String key, long version) {
        return new KvRecord(key, null, version, null, true);
    }

    /**
     * Returns true if the record has an expiry and {@code nowMillis} has reached it.
     */
    public boolean expiredAt(long nowMillis) {
        return expiresAt != null && nowMillis >= expiresAt;
    }

    /**
     * Returns true if a read at {@code nowMillis} should see this record's value.
     */
    public boolean visibleAt(long nowMillis) {
        return !tombstone && !expiredAt(nowMillis);
    }

    /**
     * Returns true if this record wins over {@code other} for the same key.
     * A null {@code other} always loses.
     */
    public boolean supersedes(KvRecord other) {
        return other == null || version > other.version;
    }

    /**
     * Rough in-memory footprint, used for the memstore flush threshold.
     */
    public long approximateBytes() {
        long bytes = RECORD_OVERHEAD + key.getBytes(StandardCharsets.UTF_8).length;
        if (value != null) {
            bytes += value.getBytes(StandardCharsets.UTF_8).length;
        }
        return bytes;
    }
}
