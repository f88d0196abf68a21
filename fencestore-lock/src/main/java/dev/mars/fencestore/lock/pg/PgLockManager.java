package dev.mars.fencestore.lock.pg;

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

import dev.mars.fencestore.db.FenceStoreDefaults;
import dev.mars.fencestore.db.FenceStoreManager;
import dev.mars.fencestore.db.connection.PgConnectionManager;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.db.util.ReactiveUtils;
import dev.mars.fencestore.lock.AbstractReactiveLockManager;
import dev.mars.fencestore.lock.GuardedOutcome;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Lock manager backed by the {@code distributed_locks} table.
 *
 * <p>Each operation is one statement evaluated against the database clock, so the check and the
 * change happen atomically and clock skew between application nodes does not matter.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-28
 * @version 1.0
 */
public class PgLockManager extends AbstractReactiveLockManager {
    private static final Logger logger = LoggerFactory.getLogger(PgLockManager.class);

    static final String ACQUIRE_SQL = """
        INSERT INTO distributed_locks (lock_key, token, expires_at)
        VALUES ($1, $2, now() + ($3::float8 * interval '1 millisecond'))
        ON CONFLICT (lock_key) DO UPDATE
            SET token = EXCLUDED.token,
                expires_at = EXCLUDED.expires_at,
                acquired_at = now()
            WHERE distributed_locks.expires_at <= now()
        RETURNING token
        """;

    // live is evaluated on the statement snapshot, i.e. before the delete
    static final String RELEASE_SQL = """
        WITH live AS (
            SELECT token FROM distributed_locks WHERE lock_key = $1 AND expires_at > now()
        ), changed AS (
            DELETE FROM distributed_locks
            WHERE lock_key = $1 AND token = $2 AND expires_at > now()
            RETURNING 1
        )
        SELECT (SELECT count(*) FROM changed) AS affected, (SELECT count(*) FROM live) AS live
        """;

    static final String EXTEND_SQL = """
        WITH live AS (
            SELECT token FROM distributed_locks WHERE lock_key = $1 AND expires_at > now()
        ), changed AS (
            UPDATE distributed_locks
            SET expires_at = now() + ($3::float8 * interval '1 millisecond')
            WHERE lock_key = $1 AND token = $2 AND expires_at > now()
            RETURNING 1
        )
        SELECT (SELECT count(*) FROM changed) AS affected, (SELECT count(*) FROM live) AS live
        """;

    static final String IS_LOCKED_SQL =
        "SELECT EXISTS (SELECT 1 FROM distributed_locks WHERE lock_key = $1 AND expires_at > now()) AS locked";

    static final String PURGE_SQL = "DELETE FROM distributed_locks WHERE expires_at <= now()";

    private final PgConnectionManager connectionManager;
    private final String serviceId;

    public PgLockManager(PgConnectionManager connectionManager, String serviceId, FenceStoreMetrics metrics) {
        super(metrics);
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.serviceId = serviceId;
    }

    /**
     * Uses the manager's default pool and metrics.
     */
    public PgLockManager(FenceStoreManager manager) {
        this(manager.getConnectionManager(), FenceStoreDefaults.DEFAULT_POOL_ID, manager.getMetrics());
    }

    @Override
    protected Future<Boolean> tryAcquire(String key, String token, long ttlMillis) {
        return connectionManager.withConnection(serviceId, conn ->
            conn.preparedQuery(ACQUIRE_SQL)
                .execute(Tuple.of(key, token, (double) ttlMillis))
                .map(rows -> rows.rowCount() == 1));
    }

    @Override
    protected Future<GuardedOutcome> tryRelease(String key, String token) {
        return connectionManager.withConnection(serviceId, conn ->
            conn.preparedQuery(RELEASE_SQL)
                .execute(Tuple.of(key, token))
                .map(rows -> toOutcome(rows.iterator().next())));
    }

    @Override
    protected Future<GuardedOutcome> tryExtend(String key, String token, long ttlMillis) {
        return connectionManager.withConnection(serviceId, conn ->
            conn.preparedQuery(EXTEND_SQL)
                .execute(Tuple.of(key, token, (double) ttlMillis))
                .map(rows -> toOutcome(rows.iterator().next())));
    }

    @Override
    protected Future<Boolean> hasLiveRecord(String key) {
        return connectionManager.withConnection(serviceId, conn ->
            conn.preparedQuery(IS_LOCKED_SQL)
                .execute(Tuple.of(key))
                .map(rows -> rows.iterator().next().getBoolean("locked")));
    }

    /**
     * Deletes expired rows. Housekeeping only: every lock statement already ignores them.
     *
     * @return number of rows removed; fails exceptionally if the database is unreachable
     */
    public CompletableFuture<Integer> purgeExpired() {
        ensureOpen();
        Future<Integer> purged = connectionManager.withConnection(serviceId, conn ->
                conn.query(PURGE_SQL).execute().map(rows -> rows.rowCount()))
            .onSuccess(count -> logger.debug("Purged {} expired lock rows", count))
            .onFailure(error -> logger.error("Failed to purge expired lock rows: {}", error.getMessage()));
        return ReactiveUtils.toCompletableFuture(purged);
    }

    private static GuardedOutcome toOutcome(Row row) {
        return GuardedOutcome.of(row.getLong("affected") > 0, row.getLong("live") > 0);
    }

    @Override
    protected void closeImplementationSpecificResources() {
        // The pool belongs to the connection manager
    }

    @Override
    protected String backendName() {
        return "postgres";
    }
}
