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

/**
 * A flush or compaction could not write its output segment.
 * <p>
 * When this is thrown the table's durable state is exactly what it was
 * before the operation started: no partial segment is visible, the memstore
 * and WAL are untouched, and no input segment has been retired.
 */
public class SegmentWriteException extends StorageException {

    public SegmentWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
