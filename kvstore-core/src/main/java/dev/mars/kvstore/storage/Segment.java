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

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An immutable segment file loaded into memory.
 *
 * @param id          creation sequence, also encoded in the file name
 * @param path        location of the segment file
 * @param maxSequence highest WAL sequence whose record this segment reflects
 * @param records     records by key (one per key)
 */
public record Segment(long id, Path path, long maxSequence, NavigableMap<String, KvRecord> records) {

    public Segment {
        records = Collections.unmodifiableNavigableMap(new TreeMap<>(records));
    }

    public Optional<KvRecord> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    /** Records in key order. */
    public Collection<KvRecord> sortedRecords() {
        return records.values();
    }

    public int size() {
        return records.size();
    }
}
