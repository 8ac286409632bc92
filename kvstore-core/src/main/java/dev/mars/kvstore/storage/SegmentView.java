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
 * The currently visible segments of one table.
 * <p>
 * Readers take {@link #current()} once and work on that immutable set, so a
 * flush or compaction publishing a new set mid-read never tears their view.
 * Only the holder of the table's exclusive lock calls {@link #publish}.
 */
public final class SegmentView {

    private volatile SegmentSet current;

    public SegmentView(SegmentSet initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public SegmentSet current() {
        return current;
    }

    public void publish(SegmentSet next) {
        this.current = Objects.requireNonNull(next, "next");
    }
}
