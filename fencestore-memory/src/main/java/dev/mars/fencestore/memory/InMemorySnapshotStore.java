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

import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.Snapshot;
import dev.mars.fencestore.api.events.SnapshotStore;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the latest snapshot per stream in memory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-04
 * @version 1.0
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    private final ConcurrentMap<StreamId, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public CompletableFuture<Result<Void, EventStoreError>> saveSnapshot(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        ensureOpen();

        snapshots.put(snapshot.streamId(), detached(snapshot));
        logger.debug("Saved snapshot of stream '{}' at version {}", snapshot.streamId(), snapshot.version());
        return CompletableFuture.completedFuture(Result.ok());
    }

    @Override
    public CompletableFuture<Result<Optional<Snapshot>, EventStoreError>> loadSnapshot(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        ensureOpen();
        return CompletableFuture.completedFuture(
            Result.ok(Optional.ofNullable(snapshots.get(streamId)).map(InMemorySnapshotStore::detached)));
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            snapshots.clear();
        }
    }

    private static Snapshot detached(Snapshot snapshot) {
        return new Snapshot(snapshot.streamId(), snapshot.version(), snapshot.aggregateType(),
            snapshot.state().deepCopy(), snapshot.createdAt());
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Snapshot store is closed");
        }
    }
}
