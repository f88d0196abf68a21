package dev.mars.fencestore.db.connection;

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
import dev.mars.fencestore.db.config.PgConnectionConfig;
import dev.mars.fencestore.db.config.PgPoolConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns the Vert.x reactive pools used by the PostgreSQL lock and event store backends.
 *
 * <p>Pools are registered per service id. Every connection handed to callers has the
 * configured schema applied as its {@code search_path}, so the SQL in the backends stays
 * unqualified.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-16
 * @version 1.0
 */
public class PgConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final MeterRegistry meter;

    private final Map<String, Pool> reactivePools = new ConcurrentHashMap<>();
    private final Map<String, String> serviceSchemas = new ConcurrentHashMap<>();

    private final Vertx vertx;

    public PgConnectionManager(Vertx vertx) {
        this(vertx, null);
    }

    public PgConnectionManager(Vertx vertx, MeterRegistry meter) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.meter = meter;
        logger.debug("Initialized PgConnectionManager");
    }

    /**
     * Creates the pool for {@code serviceId} on first use and returns the existing one afterwards.
     */
    public Pool getOrCreateReactivePool(String serviceId,
                                        PgConnectionConfig connectionConfig,
                                        PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");

        return reactivePools.computeIfAbsent(resolveServiceId(serviceId), id -> {
            try {
                String configuredSchema = connectionConfig.getSchema();
                String normalized = normalizeSearchPath(configuredSchema);
                Pool pool = createReactivePool(connectionConfig, poolConfig);
                if (!normalized.isEmpty()) {
                    serviceSchemas.put(id, normalized);
                    logger.info("Configured search_path for service '{}' as: {}", id, normalized);
                } else {
                    serviceSchemas.remove(id);
                }
                logger.info("Created reactive pool for service '{}' ({}:{}/{})", id,
                    connectionConfig.getHost(), connectionConfig.getPort(), connectionConfig.getDatabase());
                countPoolEvent("fencestore.db.pool.created", id);
                return pool;
            } catch (RuntimeException e) {
                logger.error("Failed to create pool for {}: {}", id, e.getMessage());
                countPoolEvent("fencestore.db.pool.create.failed", id);
                throw e;
            }
        });
    }

    /**
     * Returns the pool registered for {@code serviceId}, or {@code null} when there is none.
     */
    public Pool getExistingPool(String serviceId) {
        return reactivePools.get(resolveServiceId(serviceId));
    }

    /**
     * Runs {@code operation} on a pooled connection after applying the service's search_path.
     */
    public <T> Future<T> withConnection(String serviceId, Function<SqlConnection, Future<T>> operation) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.get(resolvedId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No reactive pool found for service: " + resolvedId));
        }
        String searchPath = serviceSchemas.get(resolvedId);
        if (searchPath == null) {
            return pool.withConnection(operation);
        }
        return pool.withConnection(conn -> applySearchPath(conn, resolvedId, searchPath)
            .compose(v -> operation.apply(conn)));
    }

    /**
     * Runs {@code operation} inside a transaction after applying the service's search_path.
     * The transaction commits when the returned future succeeds and rolls back otherwise.
     */
    public <T> Future<T> withTransaction(String serviceId, Function<SqlConnection, Future<T>> operation) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.get(resolvedId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No reactive pool found for service: " + resolvedId));
        }
        String searchPath = serviceSchemas.get(resolvedId);
        if (searchPath == null) {
            return pool.withTransaction(operation);
        }
        return pool.withTransaction(conn -> applySearchPath(conn, resolvedId, searchPath)
            .compose(v -> operation.apply(conn)));
    }

    private Future<Void> applySearchPath(SqlConnection conn, String serviceId, String searchPath) {
        return conn.query("SET search_path TO " + searchPath)
            .execute()
            .onFailure(err -> logger.warn("Failed to apply search_path '{}' for service '{}': {}",
                searchPath, serviceId, err.toString()))
            .mapEmpty();
    }

    private String resolveServiceId(String serviceId) {
        return (serviceId == null || serviceId.isBlank())
            ? FenceStoreDefaults.DEFAULT_POOL_ID
            : serviceId;
    }

    private Pool createReactivePool(PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig.getPassword(), "password");

        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(connectionConfig.getHost())
            .setPort(connectionConfig.getPort())
            .setDatabase(connectionConfig.getDatabase())
            .setUser(connectionConfig.getUsername())
            .setPassword(connectionConfig.getPassword())
            .setSslMode(connectionConfig.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout((int) poolConfig.getConnectionTimeout().toMillis())
            .setConnectionTimeoutUnit(TimeUnit.MILLISECONDS)
            .setIdleTimeout((int) poolConfig.getIdleTimeout().toSeconds())
            .setIdleTimeoutUnit(TimeUnit.SECONDS)
            .setShared(poolConfig.isShared());

        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    /**
     * Accepts a comma separated list of identifiers made of letters, digits and underscores.
     * Anything else is rejected because the value is spliced into {@code SET search_path}.
     */
    static String normalizeSearchPath(String schemaConfig) {
        if (schemaConfig == null) return "";
        String s = schemaConfig.trim();
        if (s.isEmpty()) return "";
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema config (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) continue;
            if (sb.length() > 0) sb.append(", ");
            sb.append(p);
        }
        return sb.toString();
    }

    /**
     * Runs {@code SELECT 1} against the service's pool. Never fails; an unreachable
     * database completes with {@code false}.
     */
    public Future<Boolean> checkHealth(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        if (!reactivePools.containsKey(resolvedId)) {
            return Future.succeededFuture(false);
        }

        return withConnection(resolvedId, conn ->
            conn.query("SELECT 1").execute().map(rs -> true)
        ).recover(err -> {
            logger.warn("Health check failed for {}: {}", resolvedId, err.getMessage());
            return Future.succeededFuture(false);
        });
    }

    public Future<Void> closePoolAsync(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.remove(resolvedId);
        serviceSchemas.remove(resolvedId);
        if (pool == null) {
            logger.debug("No pool found for service: {}", resolvedId);
            return Future.succeededFuture();
        }

        return pool.close()
            .onSuccess(v -> {
                logger.debug("Closed reactive pool for service: {}", resolvedId);
                countPoolEvent("fencestore.db.pool.closed", resolvedId);
            })
            .onFailure(err -> {
                logger.warn("Failed to close reactive pool for service: {}", resolvedId, err);
                countPoolEvent("fencestore.db.pool.close.failed", resolvedId);
            });
    }

    /**
     * Closes every pool. Individual close failures are logged and do not fail the result.
     */
    public Future<Void> closeAsync() {
        if (reactivePools.isEmpty()) {
            return Future.succeededFuture();
        }

        List<Future<Void>> closeFutures = new ArrayList<>();
        for (String serviceId : new ArrayList<>(reactivePools.keySet())) {
            closeFutures.add(closePoolAsync(serviceId));
        }

        return Future.all(closeFutures)
            .<Void>mapEmpty()
            .onSuccess(v -> logger.info("PgConnectionManager closed successfully"))
            .recover(throwable -> {
                logger.warn("Some pools failed to close cleanly: {}", throwable.getMessage());
                return Future.succeededFuture();
            });
    }

    /**
     * Blocking variant of {@link #closeAsync()}. Must not be called from an event-loop thread.
     */
    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing PgConnectionManager");
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }

    private void countPoolEvent(String name, String serviceId) {
        if (meter != null) {
            Counter.builder(name)
                .tag("service", serviceId)
                .register(meter)
                .increment();
        }
    }
}
