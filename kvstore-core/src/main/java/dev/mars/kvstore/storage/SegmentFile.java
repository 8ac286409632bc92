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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes segment files.
 * <p>
 * A segment file is a JSON document tagged with a format name and version:
 * <pre>
 * {
 *   "format" : "kvstore-segment",
 *   "format_version" : 1,
 *   "segment_id" : 3,
 *   "max_sequence" : 42,
 *   "created_at" : 1760000000000,
 *   "records" : [ { "key" : "a", "value" : "1", "version" : 1, "expires_at" : null, "tombstone" : false } ]
 * }
 * </pre>
 * Records are written in key order, so the same record set always produces
 * the same {@code records} array.
 */
public final class SegmentFile {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentFile.class);

    public static final String FORMAT = "kvstore-segment";
    public static final int FORMAT_VERSION = 1;

    private static final Pattern NAME = Pattern.compile("segment-(\\d+)\\.json");

    private SegmentFile() {
    }

    @JsonPropertyOrder({"format", "format_version", "segment_id", "max_sequence", "created_at", "records"})
    record Document(
            @JsonProperty("format") String format,
            @JsonProperty("format_version") int formatVersion,
            @JsonProperty("segment_id") long segmentId,
            @JsonProperty("max_sequence") long maxSequence,
            @JsonProperty("created_at") long createdAt,
            @JsonProperty("records") List<KvRecord> records
    ) {
    }

    /** File name for segment {@code id}, e.g. {@code segment-000007.json}. */
    public static String fileName(long id) {
        return String.format("segment-%06d.json", id);
    }

    /** Segment id encoded in {@code path}'s file name, if it is a segment file. */
    public static OptionalLong parseId(Path path) {
        Matcher m = NAME.matcher(path.getFileName().toString());
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(m.group(1)));
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring segment-like file with out-of-range id: {}", path);
            return OptionalLong.empty();
        }
    }

    /**
     * Durably writes a segment: temp file, fsync, atomic rename, directory fsync.
     *
     * @param dir         table directory
     * @param id          new segment id (must not exist yet)
     * @param maxSequence highest WAL sequence reflected by {@code records}
     * @param createdAt   creation time in epoch millis
     * @param records     records to write; sorted by key on output
     * @param sync        whether to fsync
     * @return the written segment
     * @throws IOException if writing fails; no segment file is then visible
     */
    public static Segment write(Path dir, long id, long maxSequence, long createdAt,
                                List<KvRecord> records, boolean sync) throws IOException {
        NavigableMap<String, KvRecord> byKey = new TreeMap<>();
        for (KvRecord record : records) {
            KvRecord existing = byKey.get(record.key());
            if (record.supersedes(existing)) {
                byKey.put(record.key(), record);
            }
        }

        Path target = dir.resolve(fileName(id));
        if (Files.exists(target)) {
            throw new IOException("Segment already exists: " + target);
        }
        Document document = new Document(FORMAT, FORMAT_VERSION, id, maxSequence, createdAt,
                new ArrayList<>(byKey.values()));
        byte[] content = JsonCodec.PRETTY.writeValueAsBytes(document);

        DurableFiles.writeAtomically(target, content, sync);
        LOG.debug("Segment written: {} ({} records, {} bytes)", target.getFileName(), byKey.size(), content.length);
        return new Segment(id, target, maxSequence, byKey);
    }

    /**
     * Reads one segment file.
     *
     * @throws SegmentFormatException if the file is malformed, has an unknown
     *                                format tag or a newer format version
     */
    public static Segment read(Path path) {
        long id = parseId(path).orElseThrow(
                () -> new SegmentFormatException("Not a segment file name: " + path.getFileName()));

        Document document;
        try {
            document = JsonCodec.MAPPER.readValue(path.toFile(), Document.class);
        } catch (IOException e) {
            LOG.error("Failed to read segment {}: {}", path, e.getMessage());
            throw new SegmentFormatException("Unreadable segment " + path, e);
        }

        if (!FORMAT.equals(document.format())) {
            throw new SegmentFormatException("Unknown segment format '" + document.format() + "' in " + path);
        }
        if (document.formatVersion() < 1 || document.formatVersion() > FORMAT_VERSION) {
            throw new SegmentFormatException("Unsupported segment format version " + document.formatVersion()
                    + " in " + path + " (this build reads up to " + FORMAT_VERSION + ")");
        }
        if (document.records() == null) {
            throw new SegmentFormatException("Segment " + path + " has no records array");
        }
        if (document.segmentId() != id) {
            LOG.warn("Segment {} declares id {}; using the id from its file name", path, document.segmentId());
        }

        NavigableMap<String, KvRecord> byKey = new TreeMap<>();
        for (KvRecord record : document.records()) {
            if (record == null) {
                throw new SegmentFormatException("Segment " + path + " contains a null record");
            }
            KvRecord existing = byKey.get(record.key());
            if (record.supersedes(existing)) {
                byKey.put(record.key(), record);
            }
        }
        return new Segment(id, path, document.maxSequence(), byKey);
    }

    /**
     * Loads every segment file in {@code dir}, after removing temp files left
     * by an interrupted flush or compaction.
     *
     * @return segments ordered oldest to newest
     */
    public static SegmentSet loadAll(Path dir) {
        try {
            DurableFiles.deleteStaleTempFiles(dir);
            List<Segment> segments = new ArrayList<>();
            Map<Long, Path> byId = new HashMap<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "segment-*.json")) {
                for (Path path : stream) {
                    OptionalLong id = parseId(path);
                    if (id.isEmpty()) {
                        continue;
                    }
                    Path other = byId.putIfAbsent(id.getAsLong(), path);
                    if (other != null) {
                        throw new SegmentFormatException("Segments " + other.getFileName() + " and "
                                + path.getFileName() + " in " + dir + " both have id " + id.getAsLong());
                    }
                    segments.add(read(path));
                }
            }
            SegmentSet set = SegmentSet.of(segments);
            LOG.debug("Loaded {} segments from {}: {}", set.size(), dir, set);
            return set;
        } catch (IOException e) {
            LOG.error("Failed to list segments in {}: {}", dir, e.getMessage(), e);
            throw new StorageException("Failed to list segments in " + dir, e);
        }
    }
}
