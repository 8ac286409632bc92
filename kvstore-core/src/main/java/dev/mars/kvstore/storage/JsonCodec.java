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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * Shared Jackson configuration for WAL payloads and segment documents.
 * <p>
 * {@link ObjectMapper} is thread-safe once configured, so one instance
 * serves every table.
 */
final class JsonCodec {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    /** Compact single-object writer for WAL frames. */
    private static final ObjectWriter RECORD_WRITER = MAPPER.writerFor(KvRecord.class);

    /** Pretty printer for segment files, which are meant to be human-inspectable. */
    static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();

    private JsonCodec() {
    }

    static byte[] encodeRecord(KvRecord record) throws IOException {
        return RECORD_WRITER.writeValueAsBytes(record);
    }

    static KvRecord decodeRecord(byte[] payload) throws IOException {
        return MAPPER.readValue(payload, KvRecord.class);
    }
}
