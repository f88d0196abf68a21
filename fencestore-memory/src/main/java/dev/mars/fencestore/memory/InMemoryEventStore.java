package dev.mars.fencestore.memory;

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
import dev.mars.fencestore.api.events.EventPage;
import dev.mars.fencestore.api.events.EventQuery;
import dev.mars.fencestore.api.events.EventStore;
import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.EventStreams;
import dev.mars.fencestore.api.events.NewEvent;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * {@link EventStore} holding every stream in memory.
 *
 * <p>Each stream is an append-only list guarded by its own monitor, so appends to one stream are
 * linearised while different streams proceed independently.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-18
 * @version 1.0
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<StreamId, StreamLog> streams = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<Result<Long, EventStoreError>> append(StreamId streamId, List<NewEvent> events,
                                                                   OptionalLong expectedVersion) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        List<NewEvent> batch = EventStreams.requireEvents(events);
        Objects.requireNonNull(expectedVersion, "Expected version cannot be null");
        if (expectedVersion.isPresent()) {
            EventStreams.requireExpectedVersion(expectedVersion.getAsLong());
        }
        ensureOpen();

        StreamLog log = streams.computeIfAbsent(streamId, id -> new StreamLog());
        Result<Long, EventStoreError> result = log.append(streamId, batch, expectedVersion,
            clock.instant().truncatedTo(ChronoUnit.MICROS));
        if (result.isOk()) {
            logger.debug("Appended {} events to stream '{}', now at version {}", batch.size(), streamId, result.value());
        } else {
            logger.debug("Append to stream '{}' rejected: {}", streamId, result.error().message());
        }
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Result<List<EventEnvelope>, EventStoreError>> load(StreamId streamId) {
        return loadFrom(streamId, 1L);
    }

    @Override
    public CompletableFuture<Result<List<EventEnvelope>, EventStoreError>> loadFrom(StreamId streamId, long fromVersion) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        EventStreams.requireFromVersion(fromVersion);
        ensureOpen();

        List<EventEnvelope> events = snapshotOf(streamId);
        int skip = (int) Math.min(events.size(), Math.max(0L, fromVersion - 1));
        return CompletableFuture.completedFuture(Result.ok(List.copyOf(events.subList(skip, events.size()))));
    }

    @Override
    public CompletableFuture<Result<Boolean, EventStoreError>> exists(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        ensureOpen();
        return CompletableFuture.completedFuture(Result.ok(!snapshotOf(streamId).isEmpty()));
    }

    @Override
    public CompletableFuture<Result<Long, EventStoreError>> currentVersion(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        ensureOpen();
        return CompletableFuture.completedFuture(Result.ok((long) snapshotOf(streamId).size()));
    }

    @Override
    public CompletableFuture<Result<EventPage, EventStoreError>> read(EventQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        ensureOpen();

        List<EventEnvelope> events = snapshotOf(query.streamId());
        if (events.isEmpty()) {
            return CompletableFuture.completedFuture(Result.err(new EventStoreError.StreamNotFound(query.streamId())));
        }
        List<EventEnvelope> matching = events.stream()
            .filter(event -> event.version() >= query.fromVersion())
            .filter(event -> query.toVersion() == null || event.version() <= query.toVersion())
            .filter(event -> query.eventType() == null || query.eventType().equals(event.eventType()))
            .collect(Collectors.toList());
        List<EventEnvelope> page = matching.stream()
            .skip(query.offset())
            .limit(query.pageSize())
            .collect(Collectors.toList());
        return CompletableFuture.completedFuture(Result.ok(EventPage.of(query, page, matching.size())));
    }

    @Override
    public CompletableFuture<Result<EventEnvelope, EventStoreError>> loadEvent(StreamId streamId, long version) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        EventStreams.requireEventVersion(version);
        ensureOpen();

        List<EventEnvelope> events = snapshotOf(streamId);
        if (version > events.size()) {
            return CompletableFuture.completedFuture(Result.err(new EventStoreError.EventNotFound(streamId, version)));
        }
        return CompletableFuture.completedFuture(Result.ok(events.get((int) (version - 1))));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("InMemoryEventStore closed with {} streams", streams.size());
            streams.clear();
        }
    }

    private List<EventEnvelope> snapshotOf(StreamId streamId) {
        StreamLog log = streams.get(streamId);
        return log == null ? List.of() : log.events();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Event store is closed");
        }
    }

    /**
     * Events of one stream; index {@code i} holds version {@code i + 1}.
     */
    private static final class StreamLog {
        private final List<EventEnvelope> events = new ArrayList<>();

        synchronized Result<Long, EventStoreError> append(StreamId streamId, List<NewEvent> batch,
                                                         OptionalLong expectedVersion, Instant recordedAt) {
            long current = events.size();
            if (expectedVersion.isPresent() && expectedVersion.getAsLong() != current) {
                return Result.err(new EventStoreError.VersionConflict(streamId, expectedVersion.getAsLong(), current));
            }
            long version = current;
            for (NewEvent event : batch) {
                version++;
                events.add(new EventEnvelope(UUID.randomUUID(), streamId, version, event.eventType(),
                    event.payload().deepCopy(), event.metadata(), recordedAt));
            }
            return Result.ok(version);
        }

        // Readers get detached copies of the payload trees.
        synchronized List<EventEnvelope> events() {
            return events.stream()
                .map(StreamLog::detached)
                .collect(Collectors.toUnmodifiableList());
        }

        private static EventEnvelope detached(EventEnvelope event) {
            return new EventEnvelope(event.eventId(), event.streamId(), event.version(), event.eventType(),
                event.payload().deepCopy(), event.metadata(), event.recordedAt());
        }
    }
}
