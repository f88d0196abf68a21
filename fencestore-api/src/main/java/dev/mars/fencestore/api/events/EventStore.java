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

import dev.mars.fencestore.api.result.Result;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only store of versioned events grouped into streams.
 *
 * <p>Versions within a stream start at 1 and are contiguous. Appends to one stream are linearised
 * by the backend; nothing is ordered across streams. {@link EventStoreError.VersionConflict} is
 * returned as-is and never retried by the store, because the caller's business decision may no
 * longer hold once the true stream state is known.</p>
 *
 * <p>Invalid arguments (null stream, empty event list, negative versions) throw synchronously.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface EventStore extends AutoCloseable {

    /**
     * Appends {@code events} in order, assigning versions {@code current + 1 .. current + n}.
     *
     * @param expectedVersion if present, the version the stream must be at before the append;
     *                        a mismatch writes nothing and returns {@link EventStoreError.VersionConflict}
     * @return the stream version after the append
     */
    CompletableFuture<Result<Long, EventStoreError>> append(StreamId streamId, List<NewEvent> events,
                                                            OptionalLong expectedVersion);

    /**
     * Appends without a version check.
     */
    default CompletableFuture<Result<Long, EventStoreError>> append(StreamId streamId, List<NewEvent> events) {
        return append(streamId, events, OptionalLong.empty());
    }

    /**
     * Appends only if the stream is currently at {@code expectedVersion} (0 for a new stream).
     */
    default CompletableFuture<Result<Long, EventStoreError>> append(StreamId streamId, List<NewEvent> events,
                                                                   long expectedVersion) {
        return append(streamId, events, OptionalLong.of(expectedVersion));
    }

    /**
     * All events of the stream, oldest first. Empty for a stream that was never written.
     */
    CompletableFuture<Result<List<EventEnvelope>, EventStoreError>> load(StreamId streamId);

    /**
     * Events with {@code version >= fromVersion}, oldest first.
     */
    CompletableFuture<Result<List<EventEnvelope>, EventStoreError>> loadFrom(StreamId streamId, long fromVersion);

    CompletableFuture<Result<Boolean, EventStoreError>> exists(StreamId streamId);

    /**
     * The version of the newest event, 0 for an empty stream.
     */
    CompletableFuture<Result<Long, EventStoreError>> currentVersion(StreamId streamId);

    /**
     * Filtered, paged read. Returns {@link EventStoreError.StreamNotFound} for a stream without events.
     */
    CompletableFuture<Result<EventPage, EventStoreError>> read(EventQuery query);

    /**
     * A single event by position. Returns {@link EventStoreError.EventNotFound} if absent.
     */
    CompletableFuture<Result<EventEnvelope, EventStoreError>> loadEvent(StreamId streamId, long version);

    @Override
    void close();
}
