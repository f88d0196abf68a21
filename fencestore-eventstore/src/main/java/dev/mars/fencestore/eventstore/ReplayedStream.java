package dev.mars.fencestore.eventstore;

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

import dev.mars.fencestore.api.events.EventEnvelope;
import dev.mars.fencestore.api.events.Snapshot;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The latest snapshot of a stream plus the events recorded after it.
 *
 * @param snapshot the snapshot replay started from, if any
 * @param events   events newer than the snapshot, oldest first
 * @param version  stream version reached after applying {@code events}; 0 for an empty stream
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-05
 * @version 1.0
 */
public record ReplayedStream(Optional<Snapshot> snapshot, List<EventEnvelope> events, long version) {

    public ReplayedStream {
        Objects.requireNonNull(snapshot, "snapshot");
        events = List.copyOf(events);
    }

    public boolean isEmpty() {
        return snapshot.isEmpty() && events.isEmpty();
    }
}
