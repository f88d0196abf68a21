package dev.mars.fencestore.eventstore.pg;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.fencestore.api.events.EventEnvelope;
import dev.mars.fencestore.api.events.EventMetadata;
import dev.mars.fencestore.api.events.Snapshot;
import dev.mars.fencestore.api.events.StreamId;
import io.vertx.sqlclient.Row;

import java.util.Objects;

/**
 * Converts between Jackson documents and the JSONB columns of {@code stream_events} and
 * {@code stream_snapshots}.
 *
 * <p>JSON is written as text and cast to {@code jsonb} in SQL, and read back with {@code ::text}, so
 * the driver never re-encodes a document as a JSON string.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-23
 * @version 1.0
 */
class EventRowMapper {

    static final String EVENT_COLUMNS =
        "event_id, stream_id, version, event_type, payload::text AS payload, metadata::text AS metadata, recorded_at";

    static final String SNAPSHOT_COLUMNS =
        "stream_id, version, aggregate_type, state::text AS state, created_at";

    private final ObjectMapper objectMapper;

    EventRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @throws IllegalArgumentException if the value cannot be written as JSON
     */
    String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise " + value.getClass().getSimpleName() + " to JSON", e);
        }
    }

    EventEnvelope toEnvelope(Row row) {
        StreamId streamId = StreamId.of(row.getString("stream_id"));
        long version = row.getLong("version");
        JsonNode payload = readTree(row.getString("payload"), streamId, version);
        EventMetadata metadata = readMetadata(row.getString("metadata"), streamId, version);
        return new EventEnvelope(
            row.getUUID("event_id"),
            streamId,
            version,
            row.getString("event_type"),
            payload,
            metadata,
            row.getOffsetDateTime("recorded_at").toInstant());
    }

    Snapshot toSnapshot(Row row) {
        StreamId streamId = StreamId.of(row.getString("stream_id"));
        long version = row.getLong("version");
        return new Snapshot(
            streamId,
            version,
            row.getString("aggregate_type"),
            readTree(row.getString("state"), streamId, version),
            row.getOffsetDateTime("created_at").toInstant());
    }

    private JsonNode readTree(String json, StreamId streamId, long version) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoredDataException("Invalid JSON stored for " + streamId + "@" + version, e);
        }
    }

    private EventMetadata readMetadata(String json, StreamId streamId, long version) {
        try {
            return objectMapper.readValue(json, EventMetadata.class);
        } catch (JsonProcessingException e) {
            throw new StoredDataException("Invalid metadata stored for " + streamId + "@" + version, e);
        }
    }
}
