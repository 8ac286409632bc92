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

import java.util.OptionalLong;

/**
 * Outcome of one compaction run.
 *
 * @param segmentId         id of the output segment; empty when nothing survived
 *                          or there was nothing to compact
 * @param inputSegments     number of segments merged and retired
 * @param recordsRead       records read across all inputs
 * @param recordsKept       records written to the output
 * @param shadowed          older versions discarded in favour of a newer one
 * @param tombstonesDropped latest-version tombstones discarded
 * @param expiredDropped    latest-version expired records discarded
 */
public record CompactionResult(
        OptionalLong segmentId,
        int inputSegments,
        long recordsRead,
        long recordsKept,
        long shadowed,
        long tombstonesDropped,
        long expiredDropped
) {

    /** Result of compacting a table that has no segments. */
    public static CompactionResult nothingToCompact() {
        return new CompactionResult(OptionalLong.empty(), 0, 0, 0, 0, 0, 0);
    }

    /** True if at least one input segment was merged. */
    public boolean compacted() {
        return inputSegments > 0;
    }
}
