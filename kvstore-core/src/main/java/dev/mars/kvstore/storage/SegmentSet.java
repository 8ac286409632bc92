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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered (oldest to newest by id) set of a table's segments.
 */
public final class SegmentSet {

    private static final SegmentSet EMPTY = new SegmentSet(List.of());

    private final List<Segment> oldestFirst;

    private SegmentSet(List<Segment> oldestFirst) {
        this.oldestFirst = oldestFirst;
    }

    public static SegmentSet empty() {
        return EMPTY;
    }

    public static SegmentSet of(Collection<Segment> segments) {
        List<Segment> sorted = new ArrayList<>(segments);
        sorted.sort(Comparator.comparingLong(Segment::id));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).id() == sorted.get(i - 1).id()) {
                throw new IllegalArgumentException("duplicate segment id " + sorted.get(i).id());
            }
        }
        return new SegmentSet(List.copyOf(sorted));
    }

    public List<Segment> oldestFirst() {
        return oldestFirst;
    }

    /**
     * Returns the highest-version record for {@code key} across all segments,
     * tombstones and expired records included. On equal versions the newer
     * segment wins.
     * <p>
     * Every segment is consulted: after a compaction interrupted before it
     * retired its inputs, an older segment may still hold the winning record.
     */
    public Optional<KvRecord> latest(String key) {
        KvRecord best = null;
        for (int i = oldestFirst.size() - 1; i >= 0; i--) {
            KvRecord candidate = oldestFirst.get(i).records().get(key);
            if (candidate != null && candidate.supersedes(best)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /** Highest version of {@code key} in any segment, or 0. */
    public long latestVersion(String key) {
        return latest(key).map(KvRecord::version).orElse(0L);
    }

    /** Largest segment id, or 0 if there are no segments. */
    public long maxId() {
        return oldestFirst.isEmpty() ? 0 : oldestFirst.get(oldestFirst.size() - 1).id();
    }

    /** Highest WAL sequence reflected by any segment, or 0. */
    public long maxSequence() {
        long max = 0;
        for (Segment segment : oldestFirst) {
            max = Math.max(max, segment.maxSequence());
        }
        return max;
    }

    public int size() {
        return oldestFirst.size();
    }

    public boolean isEmpty() {
        return oldestFirst.isEmpty();
    }

    /** Total record count across segments (duplicates across segments counted each time). */
    public long recordCount() {
        long count = 0;
        for (Segment segment : oldestFirst) {
            count += segment.size();
        }
        return count;
    }

    /** A new set with {@code segment} added as the newest. */
    public SegmentSet plus(Segment segment) {
        List<Segment> next = new ArrayList<>(oldestFirst);
        next.add(segment);
        return of(next);
    }

    /**
     * A new set with {@code retired} removed and, if non-null, {@code replacement} added.
     */
    public SegmentSet replace(Collection<Segment> retired, Segment replacement) {
        Set<Long> retiredIds = new HashSet<>();
        for (Segment segment : retired) {
            retiredIds.add(segment.id());
        }
        List<Segment> next = new ArrayList<>();
        for (Segment segment : oldestFirst) {
            if (!retiredIds.contains(segment.id())) {
                next.add(segment);
            }
        }
        if (replacement != null) {
            next.add(replacement);
        }
        return of(next);
    }

    @Override
    public String toString() {
        List<Long> ids = new ArrayList<>();
        for (Segment segment : oldestFirst) {
            ids.add(segment.id());
        }
        return "SegmentSet" + ids;
    }
}
