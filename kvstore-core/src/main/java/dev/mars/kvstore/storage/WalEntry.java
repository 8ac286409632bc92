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

import java.util.Objects;

/**
 * A single WAL entry: a record and the sequence number it was logged under.
 * <p>
 * The owning table is implied by the directory of the WAL file.
 *
 * @param sequence strictly increasing sequence number (1-based)
 * @param record   the logged record
 */
public record WalEntry(long sequence, KvRecord record) {

    public WalEntry {
        Objects.requireNonNull(record, "record");
    }
}
