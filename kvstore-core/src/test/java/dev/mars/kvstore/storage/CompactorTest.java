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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Compactor}.
 */
class CompactorTest {

    @TempDir
    Path tableDir;

    private MutableClock clock;
    private Compactor compactor;

    @BeforeEach
    void setUp() {
        KvStoreConfig config = KvStoreConfig.builder()
                .dataDir(tableDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
        clock = MutableClock.startingAt(100_000L);
        compactor = new Compactor(config, clock);
    }

    private Segment segment(long id, long maxSequence, KvRecord... records) throws IOException {
        return SegmentFile.write(tableDir, id, maxSequence, clock.millis(), List.of(records), false);
    }

    private SegmentView load() {
        return new SegmentView(SegmentFile.loadAll(tableDir));
    }

    private List<Path> segmentFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        try (var stream = Files.newDirectoryStream(tableDir, "segment-*.json")) {
            stream.forEach(files::add);
        }
        files.sort(null);
        return files;
    }

    @Test
    @DisplayName("Newest version survives, older one leaves no trace")
    void testMergeCorrectness() throws IOException {
        segment(1, 1, KvRecord.live("k", "v1", 1, null));
        segment(2, 2, KvRecord.live("k", "v2", 2, null));
        SegmentView view = load();

        CompactionResult result = compactor.compact(tableDir, view);

        assertEquals(OptionalLong.of(3), result.segmentId());
        assertEquals(2, result.inputSegments());
        assertEquals(1, result.shadowed());
        assertEquals(List.of(tableDir.resolve("segment-000003.json")), segmentFiles());

        Segment merged = SegmentFile.read(tableDir.resolve("segment-000003.json"));
        assertEquals(1, merged.size());
        assertEquals(KvRecord.live("k", "v2", 2, null), merged.get("k").orElseThrow());
        assertEquals(2, merged.maxSequence());
        assertFalse(Files.readString(merged.path()).contains("v1"));
        assertEquals(1, view.current().size());
    }

    @Test
    @DisplayName("Tombstoned and expired keys are dropped")
    void testDropsGarbage() throws IOException {
        segment(1, 3,
                KvRecord.live("dead", "v", 1, null),
                KvRecord.live("short", "v", 1, clock.millis() + 10),
                KvRecord.live("keep", "v", 1, null));
        segment(2, 4, KvRecord.deleted("dead", 2));
        clock.advance(Duration.ofSeconds(1));
        SegmentView view = load();

        CompactionResult result = compactor.compact(tableDir, view);

        assertEquals(1, result.tombstonesDropped());
        assertEquals(1, result.expiredDropped());
        assertEquals(1, result.recordsKept());
        Segment merged = view.current().oldestFirst().get(0);
        assertTrue(merged.get("dead").isEmpty());
        assertTrue(merged.get("short").isEmpty());
        assertTrue(merged.get("keep").isPresent());
    }

    @Test
    @DisplayName("Nothing surviving retires every input without a new segment")
    void testZeroSurvivors() throws IOException {
        segment(1, 1, KvRecord.live("k", "v", 1, null));
        segment(2, 2, KvRecord.deleted("k", 2));
        SegmentView view = load();

        CompactionResult result = compactor.compact(tableDir, view);

        assertTrue(result.compacted());
        assertTrue(result.segmentId().isEmpty());
        assertEquals(2, result.inputSegments());
        assertTrue(view.current().isEmpty());
        assertTrue(segmentFiles().isEmpty());
    }

    @Test
    void testNoSegments_IsNoOp() {
        CompactionResult result = compactor.compact(tableDir, new SegmentView(SegmentSet.empty()));

        assertFalse(result.compacted());
        assertEquals(CompactionResult.nothingToCompact(), result);
    }

    @Test
    @DisplayName("Compacting twice yields the same record set")
    void testIdempotent() throws IOException {
        segment(1, 2, KvRecord.live("a", "1", 1, null), KvRecord.live("b", "1", 1, null));
        segment(2, 4, KvRecord.live("a", "2", 2, null), KvRecord.deleted("b", 2));
        SegmentView view = load();

        compactor.compact(tableDir, view);
        NavigableMap<String, KvRecord> first = view.current().oldestFirst().get(0).records();
        CompactionResult second = compactor.compact(tableDir, view);
        NavigableMap<String, KvRecord> again = view.current().oldestFirst().get(0).records();

        assertEquals(first, again);
        assertEquals(0, second.shadowed());
        assertEquals(1, segmentFiles().size());
        assertEquals(SegmentFile.read(segmentFiles().get(0)).records(), again);
    }

    @Test
    @DisplayName("Leftover inputs from an interrupted compaction fold back in")
    void testInterruptedCompactionRecovers() throws IOException {
        // Inputs 1 and 2 still present next to their output 3
        segment(1, 1, KvRecord.live("k", "v1", 1, null));
        segment(2, 2, KvRecord.live("k", "v2", 2, null), KvRecord.live("x", "1", 1, null));
        segment(3, 2, KvRecord.live("k", "v2", 2, null), KvRecord.live("x", "1", 1, null));
        SegmentView view = load();

        assertEquals("v2", view.current().latest("k").orElseThrow().value());

        CompactionResult result = compactor.compact(tableDir, view);

        assertEquals(OptionalLong.of(4), result.segmentId());
        assertEquals(1, segmentFiles().size());
        assertEquals("v2", view.current().latest("k").orElseThrow().value());
        assertEquals("1", view.current().latest("x").orElseThrow().value());
    }

    @Test
    void testResolveLatest_TieGoesToNewerSegment() throws IOException {
        Segment older = segment(1, 1, KvRecord.live("k", "older", 5, null));
        Segment newer = segment(2, 2, KvRecord.live("k", "newer", 5, null));

        NavigableMap<String, KvRecord> latest = Compactor.resolveLatest(List.of(older, newer));

        assertEquals("newer", latest.get("k").value());
    }
}
