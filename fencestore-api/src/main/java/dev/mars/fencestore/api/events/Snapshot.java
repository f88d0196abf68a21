package dev.mars.fencestore.api.events;

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

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Materialised state of a stream as of {@code version}. Only the latest snapshot per stream is kept.
 *
 * @param streamId      the stream the state was folded from
 * @param version       last event version included in {@code state}
 * @param aggregateType optional name of the aggregate the state belongs to
 * @param state         the folded state
 * @param createdAt     when the snapshot was taken
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-04
 * @version 1.0
 */
public record Snapshot(
    StreamId streamId,
    long version,
    String aggregateType,
    JsonNode state,
    Instant createdAt
) {
    public Snapshot {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        Objects.requireNonNull(state, "Snapshot state cannot be null");
        Objects.requireNonNull(createdAt, "Created time cannot be null");
        if (version <= 0) {
            throw new IllegalArgumentException("Snapshot version must be positive");
        }
    }

    public static Snapshot of(StreamId streamId, long version, JsonNode state) {
        return new Snapshot(streamId, version, null, state, Instant.now().truncatedTo(ChronoUnit.MICROS));
    }

    public static Snapshot of(StreamId streamId, long version, String aggregateType, JsonNode state) {
        return new Snapshot(streamId, version, aggregateType, state, Instant.now().truncatedTo(ChronoUnit.MICROS));
    }
}
