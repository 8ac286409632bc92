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

import java.util.Objects;

/**
 * A key addressed as {@code table:key}, resolved against a session's namespace.
 *
 * @param table the table name
 * @param key   the key within the table (non-empty, may not contain {@code ':'})
 */
public record QualifiedKey(String table, String key) {

    private static final char SEPARATOR = ':';

    public QualifiedKey {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(key, "key");
        if (table.isEmpty() || key.isEmpty()
                || table.indexOf(SEPARATOR) >= 0 || key.indexOf(SEPARATOR) >= 0) {
            throw new InvalidKeyException("Expected table:key but got '" + table + SEPARATOR + key + "'");
        }
    }

    /**
     * A parsed {@code table:key:value} assignment.
     *
     * @param target the addressed key
     * @param value  everything after the second separator, may itself contain {@code ':'}
     */
    public record Assignment(QualifiedKey target, String value) {
    }

    /**
     * Parses {@code table:key}.
     *
     * @throws InvalidKeyException if the text is not exactly two non-empty parts
     */
    public static QualifiedKey parse(String text) {
        if (text == null) {
            throw new InvalidKeyException("Expected table:key but got nothing");
        }
        String[] parts = text.split(String.valueOf(SEPARATOR), -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new InvalidKeyException("Expected table:key but got '" + text + "'");
        }
        return new QualifiedKey(parts[0], parts[1]);
    }

    /**
     * Parses {@code table:key:value}. The value may be empty and may contain {@code ':'}.
     *
     * @throws InvalidKeyException if the table or key part is missing
     */
    public static Assignment parseAssignment(String text) {
        if (text == null) {
            throw new InvalidKeyException("Expected table:key:value but got nothing");
        }
        String[] parts = text.split(String.valueOf(SEPARATOR), 3);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new InvalidKeyException("Expected table:key:value but got '" + text + "'");
        }
        return new Assignment(new QualifiedKey(parts[0], parts[1]), parts[2]);
    }

    @Override
    public String toString() {
        return table + SEPARATOR + key;
    }
}
