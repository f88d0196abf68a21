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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.fencestore.api.events.EventEnvelope;
import dev.mars.fencestore.api.events.EventStore;
import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.EventStreams;
import dev.mars.fencestore.api.events.Snapshot;
import dev.mars.fencestore.api.events.SnapshotStore;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Rebuilds stream state from the latest snapshot and the events recorded after it, and records new
 * snapshots once they have been checked against the stream.
 *
 * <p>Works against any {@link EventStore} and {@link SnapshotStore} pair; the stores themselves never
 * read each other.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-05
 * @version 1.0
 */
public class StreamReplayer {
    private static final Logger logger = LoggerFactory.getLogger(StreamReplayer.class);

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final Clock clock;

    public StreamReplayer(EventStore eventStore, SnapshotStore snapshotStore) {
        this(eventStore, snapshotStore, Clock.systemUTC());
    }

    public StreamReplayer(EventStore eventStore, SnapshotStore snapshotStore, Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CompletableFuture<Result<ReplayedStream, EventStoreError>> replay(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");

        return snapshotStore.loadSnapshot(streamId).thenCompose(loaded -> {
            if (loaded.isErr()) {
                return CompletableFuture.completedFuture(Result.<ReplayedStream, EventStoreError>err(loaded.error()));
            }
            Optional<Snapshot> snapshot = loaded.value();
            long fromVersion = snapshot.map(s -> s.version() + 1).orElse(1L);
            return eventStore.loadFrom(streamId, fromVersion).thenApply(tail -> tail.map(events -> {
                long version = events.isEmpty()
                    ? snapshot.map(Snapshot::version).orElse(0L)
                    : events.get(events.size() - 1).version();
                logger.debug("Replayed stream '{}' from version {}: {} events, now at {}",
                    streamId, fromVersion, events.size(), version);
                return new ReplayedStream(snapshot, events, version);
            }));
        });
    }

    /**
     * Folds the replayed stream into a state value.
     *
     * @param seed  initial state, built from the snapshot when one exists
     * @param apply applies one event to the state
     */
    public <S> CompletableFuture<Result<S, EventStoreError>> fold(StreamId streamId,
                                                                Function<Optional<Snapshot>, S> seed,
                                                                BiFunction<S, EventEnvelope, S> apply) {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(apply, "apply");

        return replay(streamId).thenApply(replayed -> replayed.map(stream -> {
            S state = seed.apply(stream.snapshot());
            List<EventEnvelope> events = stream.events();
            for (EventEnvelope event : events) {
                state = apply.apply(state, event);
            }
            return state;
        }));
    }

    /**
     * Saves {@code state} as the snapshot of {@code streamId} at {@code version}.
     *
     * <p>Fails with {@link EventStoreError.StreamNotFound} when the stream has no events and with
     * {@link EventStoreError.SnapshotRejected} when {@code version} is past the current stream version.</p>
     */
    public CompletableFuture<Result<Snapshot, EventStoreError>> takeSnapshot(StreamId streamId, long version,
                                                                           String aggregateType, JsonNode state) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        EventStreams.requireEventVersion(version);
        Objects.requireNonNull(state, "Snapshot state cannot be null");

        return eventStore.currentVersion(streamId).thenCompose(current -> {
            if (current.isErr()) {
                return CompletableFuture.completedFuture(Result.<Snapshot, EventStoreError>err(current.error()));
            }
            long currentVersion = current.value();
            if (currentVersion == 0L) {
                return CompletableFuture.completedFuture(
                    Result.<Snapshot, EventStoreError>err(new EventStoreError.StreamNotFound(streamId)));
            }
            if (version > currentVersion) {
                logger.warn("Rejected snapshot of stream '{}' at version {}; stream is at {}",
                    streamId, version, currentVersion);
                return CompletableFuture.completedFuture(Result.<Snapshot, EventStoreError>err(
                    new EventStoreError.SnapshotRejected(streamId, version, currentVersion)));
            }
            Snapshot snapshot = new Snapshot(streamId, version, aggregateType, state,
                clock.instant().truncatedTo(ChronoUnit.MICROS));
            return snapshotStore.saveSnapshot(snapshot)
                .thenApply(saved -> saved.map(ignored -> snapshot));
        });
    }
}
