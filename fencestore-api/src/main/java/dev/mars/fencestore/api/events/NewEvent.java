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

import java.util.Objects;

/**
 * An event waiting to be appended. The store assigns its id, version and record time.
 *
 * @param eventType discriminator consumers use to interpret the payload
 * @param payload   any JSON value
 * @param metadata  tracing data, empty when not supplied
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public record NewEvent(String eventType, JsonNode payload, EventMetadata metadata) {

    public NewEvent {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        if (eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be blank");
        }
        Objects.requireNonNull(payload, "Payload cannot be null");
        metadata = metadata != null ? metadata : EventMetadata.empty();
    }

    public static NewEvent of(String eventType, JsonNode payload) {
        return new NewEvent(eventType, payload, EventMetadata.empty());
    }
}
