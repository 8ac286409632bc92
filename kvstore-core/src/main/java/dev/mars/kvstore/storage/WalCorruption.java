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
 * Describes a malformed or truncated WAL tail found during replay.
 * <p>
 * This is a report, not an exception: replay keeps every well-formed entry
 * before {@code position}, cuts the file back to {@code position}, and hands
 * this value to the caller so the anomaly can be surfaced as a warning.
 *
 * @param position       byte offset of the first malformed frame
 * @param discardedBytes number of bytes removed from the tail
 * @param reason         human-readable cause (bad magic, CRC mismatch, ...)
 */
public record WalCorruption(long position, long discardedBytes, String reason) {

    @Override
    public String toString() {
        return "WAL corruption at offset " + position + " (" + reason + "), "
                + discardedBytes + " bytes discarded";
    }
}
