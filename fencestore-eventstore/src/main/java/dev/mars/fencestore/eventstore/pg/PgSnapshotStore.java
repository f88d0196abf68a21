package dev.mars.fencestore.eventstore.pg;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.Snapshot;
import dev.mars.fencestore.api.events.SnapshotStore;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.result.Result;
import dev.mars.fencestore.db.FenceStoreDefaults;
import dev.mars.fencestore.db.FenceStoreManager;
import dev.mars.fencestore.db.connection.PgConnectionManager;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.db.util.ReactiveUtils;
import io.vertx.core.Future;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Latest snapshot per stream in {@code stream_snapshots}. Saving is an upsert; the store does not
 * compare the snapshot version with the event stream.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-04
 * @version 1.0
 */
public class PgSnapshotStore implements SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(PgSnapshotStore.class);

    static final String UPSERT_SQL = """
        INSERT INTO stream_snapshots (stream_id, version, aggregate_type, state, created_at)
        VALUES ($1, $2, $3, $4::text::jsonb, $5)
        ON CONFLICT (stream_id) DO UPDATE
            SET version = EXCLUDED.version,
                aggregate_type = EXCLUDED.aggregate_type,
                state = EXCLUDED.state,
                created_at = EXCLUDED.created_at
        """;

    static final String LOAD_SQL = "SELECT " + EventRowMapper.SNAPSHOT_COLUMNS
        + " FROM stream_snapshots WHERE stream_id = $1";

    private final PgConnectionManager connectionManager;
    private final String serviceId;
    private final EventRowMapper rowMapper;
    private final FenceStoreMetrics metrics;
    private volatile boolean closed = false;

    public PgSnapshotStore(PgConnectionManager connectionManager, String serviceId, ObjectMapper objectMapper,
                           FenceStoreMetrics metrics) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.serviceId = serviceId;
        this.rowMapper = new EventRowMapper(objectMapper);
        this.metrics = metrics != null ? metrics : FenceStoreMetrics.disabled();
    }

    public PgSnapshotStore(FenceStoreManager manager) {
        this(manager.getConnectionManager(), FenceStoreDefaults.DEFAULT_POOL_ID, manager.getObjectMapper(),
            manager.getMetrics());
    }

    @Override
    public CompletableFuture<Result<Void, EventStoreError>> saveSnapshot(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        ensureOpen();
        String state = rowMapper.toJson(snapshot.state());
        Tuple params = Tuple.tuple()
            .addString(snapshot.streamId().value())
            .addLong(snapshot.version())
            .addString(snapshot.aggregateType())
            .addString(state)
            .addOffsetDateTime(snapshot.createdAt().atOffset(ZoneOffset.UTC));

        long start = metrics.startTimer();
        Future<Result<Void, EventStoreError>> outcome = connectionManager.withConnection(serviceId, conn ->
                conn.preparedQuery(UPSERT_SQL).execute(params))
            .map(rows -> {
                logger.debug("Saved snapshot of stream '{}' at version {}", snapshot.streamId(), snapshot.version());
                return Result.<EventStoreError>ok();
            })
            .recover(error -> Future.succeededFuture(
                Result.<Void, EventStoreError>err(failure("saveSnapshot", snapshot.streamId(), error))))
            .onComplete(ar -> metrics.recordEventOperation("saveSnapshot", start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    @Override
    public CompletableFuture<Result<Optional<Snapshot>, EventStoreError>> loadSnapshot(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        ensureOpen();

        long start = metrics.startTimer();
        Future<Result<Optional<Snapshot>, EventStoreError>> outcome = connectionManager.withConnection(serviceId, conn ->
                conn.preparedQuery(LOAD_SQL).execute(Tuple.of(streamId.value())))
            .map(rows -> {
                Optional<Snapshot> snapshot = rows.size() == 0
                    ? Optional.empty()
                    : Optional.of(rowMapper.toSnapshot(rows.iterator().next()));
                return Result.<Optional<Snapshot>, EventStoreError>ok(snapshot);
            })
            .recover(error -> Future.succeededFuture(
                Result.<Optional<Snapshot>, EventStoreError>err(failure("loadSnapshot", streamId, error))))
            .onComplete(ar -> metrics.recordEventOperation("loadSnapshot", start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.info("PostgreSQL snapshot store closed");
        }
    }

    private EventStoreError failure(String operation, StreamId streamId, Throwable error) {
        EventStoreError mapped;
        if (error instanceof StoredDataException) {
            logger.error("{} on stream '{}' found unreadable state: {}", operation, streamId, error.getMessage());
            mapped = new EventStoreError.DeserializationError(error.getMessage(), error.getCause());
        } else {
            logger.error("{} on stream '{}' failed: {}", operation, streamId, ReactiveUtils.describe(error));
            mapped = PgEventStore.backendFailure(error);
        }
        metrics.recordEventStoreError(operation, mapped);
        return mapped;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Snapshot store is closed");
        }
    }
}
