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
import dev.mars.fencestore.api.events.EventEnvelope;
import dev.mars.fencestore.api.events.EventPage;
import dev.mars.fencestore.api.events.EventQuery;
import dev.mars.fencestore.api.events.EventStore;
import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.EventStreams;
import dev.mars.fencestore.api.events.NewEvent;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.result.Result;
import dev.mars.fencestore.db.FenceStoreDefaults;
import dev.mars.fencestore.db.FenceStoreManager;
import dev.mars.fencestore.db.connection.PgConnectionManager;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.db.util.ReactiveUtils;
import dev.mars.fencestore.db.util.SqlStates;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * {@link EventStore} backed by the {@code stream_events} table.
 *
 * <p>Appends run in one transaction that first takes a transaction-scoped advisory lock derived
 * from the stream id, so writers of the same stream are serialised while other streams proceed.
 * The {@code (stream_id, version)} unique constraint backs this up for writers that bypass the lock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-23
 * @version 1.0
 */
public class PgEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(PgEventStore.class);

    static final String STREAM_LOCK_SQL = "SELECT pg_advisory_xact_lock(hashtextextended($1, 0))";

    static final String CURRENT_VERSION_SQL =
        "SELECT COALESCE(MAX(version), 0) AS current_version FROM stream_events WHERE stream_id = $1";

    static final String INSERT_SQL = """
        INSERT INTO stream_events (event_id, stream_id, version, event_type, payload, metadata)
        VALUES ($1, $2, $3, $4, $5::text::jsonb, $6::text::jsonb)
        """;

    static final String LOAD_FROM_SQL = "SELECT " + EventRowMapper.EVENT_COLUMNS
        + " FROM stream_events WHERE stream_id = $1 AND version >= $2 ORDER BY version";

    static final String LOAD_EVENT_SQL = "SELECT " + EventRowMapper.EVENT_COLUMNS
        + " FROM stream_events WHERE stream_id = $1 AND version = $2";

    static final String EXISTS_SQL =
        "SELECT EXISTS (SELECT 1 FROM stream_events WHERE stream_id = $1) AS found";

    private static final String QUERY_FILTER =
        " AND version >= $2 AND ($3::bigint IS NULL OR version <= $3) AND ($4::text IS NULL OR event_type = $4)";

    static final String COUNT_SQL = "SELECT COUNT(*) AS total, COUNT(*) FILTER (WHERE true" + QUERY_FILTER
        + ") AS matching FROM stream_events WHERE stream_id = $1";

    static final String PAGE_SQL = "SELECT " + EventRowMapper.EVENT_COLUMNS
        + " FROM stream_events WHERE stream_id = $1" + QUERY_FILTER + " ORDER BY version LIMIT $5 OFFSET $6";

    private final PgConnectionManager connectionManager;
    private final String serviceId;
    private final EventRowMapper rowMapper;
    private final FenceStoreMetrics metrics;
    private volatile boolean closed = false;

    public PgEventStore(PgConnectionManager connectionManager, String serviceId, ObjectMapper objectMapper,
                        FenceStoreMetrics metrics) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.serviceId = serviceId;
        this.rowMapper = new EventRowMapper(objectMapper);
        this.metrics = metrics != null ? metrics : FenceStoreMetrics.disabled();
    }

    /**
     * Uses the manager's default pool, object mapper and metrics.
     */
    public PgEventStore(FenceStoreManager manager) {
        this(manager.getConnectionManager(), FenceStoreDefaults.DEFAULT_POOL_ID, manager.getObjectMapper(),
            manager.getMetrics());
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
        List<String[]> documents = serialise(batch);

        AtomicLong observed = new AtomicLong();
        Supplier<Future<Result<Long, EventStoreError>>> write = () ->
            connectionManager.withTransaction(serviceId, conn ->
                conn.preparedQuery(STREAM_LOCK_SQL).execute(Tuple.of(streamId.value()))
                    .compose(locked -> currentVersion(conn, streamId))
                    .compose(current -> {
                        observed.set(current);
                        if (expectedVersion.isPresent() && expectedVersion.getAsLong() != current) {
                            return Future.succeededFuture(Result.<Long, EventStoreError>err(
                                new EventStoreError.VersionConflict(streamId, expectedVersion.getAsLong(), current)));
                        }
                        return insert(conn, streamId, batch, documents, current)
                            .map(last -> Result.<Long, EventStoreError>ok(last));
                    }));

        long start = metrics.startTimer();
        Future<Result<Long, EventStoreError>> outcome = invoke(write)
            .recover(error -> {
                if (SqlStates.isUniqueViolation(error)) {
                    return conflictAfterRace(streamId, expectedVersion.orElse(observed.get()));
                }
                return Future.failedFuture(error);
            })
            .recover(error -> Future.succeededFuture(Result.<Long, EventStoreError>err(failure("append", streamId, error))))
            .onSuccess(result -> {
                if (result.isOk()) {
                    logger.debug("Appended {} events to stream '{}', now at version {}",
                        batch.size(), streamId, result.value());
                    metrics.recordEventsAppended(batch.size());
                } else {
                    logger.debug("Append to stream '{}' rejected: {}", streamId, result.error().message());
                    metrics.recordEventStoreError("append", result.error());
                }
            })
            .onComplete(ar -> metrics.recordEventOperation("append", start));
        return ReactiveUtils.toCompletableFuture(outcome);
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

        return execute("loadFrom", streamId, () ->
            connectionManager.withConnection(serviceId, conn ->
                conn.preparedQuery(LOAD_FROM_SQL)
                    .execute(Tuple.of(streamId.value(), Math.max(1L, fromVersion)))
                    .map(rows -> Result.<List<EventEnvelope>, EventStoreError>ok(toEnvelopes(rows)))));
    }

    @Override
    public CompletableFuture<Result<Boolean, EventStoreError>> exists(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        ensureOpen();

        return execute("exists", streamId, () ->
            connectionManager.withConnection(serviceId, conn ->
                conn.preparedQuery(EXISTS_SQL)
                    .execute(Tuple.of(streamId.value()))
                    .map(rows -> Result.<Boolean, EventStoreError>ok(rows.iterator().next().getBoolean("found")))));
    }

    @Override
    public CompletableFuture<Result<Long, EventStoreError>> currentVersion(StreamId streamId) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        ensureOpen();

        return execute("currentVersion", streamId, () ->
            connectionManager.withConnection(serviceId, conn ->
                currentVersion(conn, streamId).map(version -> Result.<Long, EventStoreError>ok(version))));
    }

    @Override
    public CompletableFuture<Result<EventPage, EventStoreError>> read(EventQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        ensureOpen();

        StreamId streamId = query.streamId();
        Tuple filter = Tuple.tuple()
            .addString(streamId.value())
            .addLong(query.fromVersion())
            .addLong(query.toVersion())
            .addString(query.eventType());

        return execute("read", streamId, () ->
            connectionManager.withConnection(serviceId, conn ->
                conn.preparedQuery(COUNT_SQL).execute(filter).compose(counts -> {
                    Row row = counts.iterator().next();
                    if (row.getLong("total") == 0L) {
                        return Future.succeededFuture(
                            Result.<EventPage, EventStoreError>err(new EventStoreError.StreamNotFound(streamId)));
                    }
                    long matching = row.getLong("matching");
                    Tuple page = Tuple.tuple()
                        .addString(streamId.value())
                        .addLong(query.fromVersion())
                        .addLong(query.toVersion())
                        .addString(query.eventType())
                        .addLong((long) query.pageSize())
                        .addLong(query.offset());
                    return conn.preparedQuery(PAGE_SQL).execute(page)
                        .map(rows -> Result.<EventPage, EventStoreError>ok(
                            EventPage.of(query, toEnvelopes(rows), matching)));
                })));
    }

    @Override
    public CompletableFuture<Result<EventEnvelope, EventStoreError>> loadEvent(StreamId streamId, long version) {
        Objects.requireNonNull(streamId, "Stream ID cannot be null");
        EventStreams.requireEventVersion(version);
        ensureOpen();

        return execute("loadEvent", streamId, () ->
            connectionManager.withConnection(serviceId, conn ->
                conn.preparedQuery(LOAD_EVENT_SQL)
                    .execute(Tuple.of(streamId.value(), version))
                    .map(rows -> {
                        if (rows.size() == 0) {
                            return Result.<EventEnvelope, EventStoreError>err(
                                new EventStoreError.EventNotFound(streamId, version));
                        }
                        return Result.<EventEnvelope, EventStoreError>ok(rowMapper.toEnvelope(rows.iterator().next()));
                    })));
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.info("PostgreSQL event store closed");
        }
    }

    private Future<Long> currentVersion(SqlConnection conn, StreamId streamId) {
        return conn.preparedQuery(CURRENT_VERSION_SQL)
            .execute(Tuple.of(streamId.value()))
            .map(rows -> rows.iterator().next().getLong("current_version"));
    }

    private Future<Long> insert(SqlConnection conn, StreamId streamId, List<NewEvent> batch,
                                List<String[]> documents, long current) {
        List<Tuple> rows = new ArrayList<>(batch.size());
        long version = current;
        for (int i = 0; i < batch.size(); i++) {
            version++;
            rows.add(Tuple.of(UUID.randomUUID(), streamId.value(), version, batch.get(i).eventType(),
                documents.get(i)[0], documents.get(i)[1]));
        }
        long last = version;
        return conn.preparedQuery(INSERT_SQL).executeBatch(rows).map(inserted -> last);
    }

    private List<String[]> serialise(List<NewEvent> batch) {
        List<String[]> documents = new ArrayList<>(batch.size());
        for (NewEvent event : batch) {
            documents.add(new String[] {rowMapper.toJson(event.payload()), rowMapper.toJson(event.metadata())});
        }
        return documents;
    }

    private List<EventEnvelope> toEnvelopes(RowSet<Row> rows) {
        List<EventEnvelope> events = new ArrayList<>(rows.size());
        for (Row row : rows) {
            events.add(rowMapper.toEnvelope(row));
        }
        return events;
    }

    /**
     * Another writer inserted the same version without taking the stream lock.
     */
    private Future<Result<Long, EventStoreError>> conflictAfterRace(StreamId streamId, long expected) {
        return connectionManager.withConnection(serviceId, conn -> currentVersion(conn, streamId))
            .map(actual -> {
                logger.warn("Unique violation appending to stream '{}'; stream is now at version {}", streamId, actual);
                return Result.<Long, EventStoreError>err(new EventStoreError.VersionConflict(streamId, expected, actual));
            });
    }

    private <T> CompletableFuture<Result<T, EventStoreError>> execute(String operation, StreamId streamId,
                                                                     Supplier<Future<Result<T, EventStoreError>>> call) {
        long start = metrics.startTimer();
        Future<Result<T, EventStoreError>> outcome = invoke(call)
            .recover(error -> Future.succeededFuture(Result.<T, EventStoreError>err(failure(operation, streamId, error))))
            .onComplete(ar -> metrics.recordEventOperation(operation, start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    /**
     * Maps a backend failure that carries no stored-data problem. Transient aborts and lost connections
     * name their SQLSTATE in the reason; anything else keeps the driver's message.
     */
    static EventStoreError.ConnectionFailed backendFailure(Throwable error) {
        String reason = EventStoreError.ConnectionFailed.of(error).reason();
        if (SqlStates.isTransient(error)) {
            return new EventStoreError.ConnectionFailed(
                "transaction aborted, SQLSTATE " + SqlStates.sqlState(error) + ": " + reason, error);
        }
        if (SqlStates.isConnectionException(error)) {
            return new EventStoreError.ConnectionFailed(
                "connection lost, SQLSTATE " + SqlStates.sqlState(error) + ": " + reason, error);
        }
        return EventStoreError.ConnectionFailed.of(error);
    }

    private EventStoreError failure(String operation, StreamId streamId, Throwable error) {
        EventStoreError mapped;
        if (error instanceof StoredDataException) {
            logger.error("{} on stream '{}' found unreadable data: {}", operation, streamId, error.getMessage());
            mapped = new EventStoreError.DeserializationError(error.getMessage(), error.getCause());
        } else if (SqlStates.isTransient(error)) {
            logger.warn("{} on stream '{}' was aborted by the server: {}", operation, streamId, ReactiveUtils.describe(error));
            mapped = backendFailure(error);
        } else {
            logger.error("{} on stream '{}' failed: {}", operation, streamId, ReactiveUtils.describe(error));
            mapped = backendFailure(error);
        }
        if (!"append".equals(operation)) {
            metrics.recordEventStoreError(operation, mapped);
        }
        return mapped;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Event store is closed");
        }
    }

    private static <T> Future<T> invoke(Supplier<Future<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
