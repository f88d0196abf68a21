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
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted event. Envelopes are immutable once written.
 *
 * @param eventId    unique identifier assigned at append time
 * @param streamId   the owning stream
 * @param version    position within the stream, starting at 1 with no gaps
 * @param eventType  payload discriminator
 * @param payload    the event data
 * @param metadata   tracing data
 * @param recordedAt server-assigned time of the append
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public record EventEnvelope(
    UUID eventId,
    StreamId streamId,
    long version,
    String eventType,
    JsonNode payload,
    EventMetadata metadata,
    Instant recordedAt
) {
    public EventEnvelope {
        Objects.requireNonNull(eventId, "Event ID cannot be null");
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        Objects.requireNonNull(recordedAt, "Recorded time cannot be null");
        if (version <= 0) {
            throw new IllegalArgumentException("Version must be positive");
        }
        metadata = metadata != null ? metadata : EventMetadata.empty();
    }
}
