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

import java.util.List;
import java.util.Objects;

/**
 * Argument checks shared by every {@link EventStore} implementation.
 */
public final class EventStreams {

    private EventStreams() {
        // Utility class
    }

    public static List<NewEvent> requireEvents(List<NewEvent> events) {
        Objects.requireNonNull(events, "Events cannot be null");
        if (events.isEmpty()) {
            throw new IllegalArgumentException("At least one event is required");
        }
        for (NewEvent event : events) {
            Objects.requireNonNull(event, "Events cannot contain null");
        }
        return List.copyOf(events);
    }

    public static long requireExpectedVersion(long expectedVersion) {
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Expected version cannot be negative: " + expectedVersion);
        }
        return expectedVersion;
    }

    public static long requireFromVersion(long fromVersion) {
        if (fromVersion < 0) {
            throw new IllegalArgumentException("From version cannot be negative: " + fromVersion);
        }
        return fromVersion;
    }

    public static long requireEventVersion(long version) {
        if (version <= 0) {
            throw new IllegalArgumentException("Event version must be positive: " + version);
        }
        return version;
    }
}
