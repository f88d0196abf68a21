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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.HashMap;
import java.util.Map;

/**
 * Tracing and audit data stored alongside an event. Every field is optional.
 *
 * @param correlationId identifier shared by all events of one business interaction
 * @param causationId   identifier of the command or event that caused this one
 * @param actorId       the user or service that produced the event
 * @param headers       free-form string attributes
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-18
 * @version 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventMetadata(
    String correlationId,
    String causationId,
    String actorId,
    Map<String, String> headers
) {
    private static final EventMetadata EMPTY = new EventMetadata(null, null, null, Map.of());

    public EventMetadata {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static EventMetadata empty() {
        return EMPTY;
    }

    public static EventMetadata correlated(String correlationId, String causationId) {
        return new EventMetadata(correlationId, causationId, null, Map.of());
    }

    public EventMetadata withActor(String actorId) {
        return new EventMetadata(correlationId, causationId, actorId, headers);
    }

    public EventMetadata withHeader(String name, String value) {
        Map<String, String> copy = new HashMap<>(headers);
        copy.put(name, value);
        return new EventMetadata(correlationId, causationId, actorId, copy);
    }
}
