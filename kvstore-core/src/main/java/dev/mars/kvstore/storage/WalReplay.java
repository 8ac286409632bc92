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

import java.util.List;
import java.util.Optional;

/**
 * Result of replaying a WAL.
 *
 * @param entries    every well-formed entry, in sequence order
 * @param corruption the tail anomaly, if one was found and cut off
 */
public record WalReplay(List<WalEntry> entries, Optional<WalCorruption> corruption) {

    public WalReplay {
        entries = List.copyOf(entries);
    }

    public static WalReplay clean(List<WalEntry> entries) {
        return new WalReplay(entries, Optional.empty());
    }
}
