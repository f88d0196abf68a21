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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps the latest {@link Snapshot} per stream.
 *
 * <p>The store does not consult the event store: deciding when to snapshot and replaying the events
 * after {@code snapshot.version()} is left to the caller (see the stream replayer in the event
 * store module).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-04
 * @version 1.0
 */
public interface SnapshotStore extends AutoCloseable {

    /**
     * Stores {@code snapshot}, replacing any earlier snapshot of the same stream.
     */
    CompletableFuture<Result<Void, EventStoreError>> saveSnapshot(Snapshot snapshot);

    CompletableFuture<Result<Optional<Snapshot>, EventStoreError>> loadSnapshot(StreamId streamId);

    @Override
    void close();
}
