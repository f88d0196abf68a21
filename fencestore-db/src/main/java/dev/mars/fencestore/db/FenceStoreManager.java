package dev.mars.fencestore.db;

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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.fencestore.db.config.FenceStoreConfiguration;
import dev.mars.fencestore.db.connection.PgConnectionManager;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.db.migration.SchemaMigrationManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Owns the shared infrastructure of the database-backed components: the Vert.x instance,
 * the connection pool, the metrics binder and the JSON mapper.
 *
 * <p>The pool is only created when a configured backend needs PostgreSQL. Starting the
 * manager verifies connectivity and applies pending migrations.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-16
 * @version 1.0
 */
public class FenceStoreManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FenceStoreManager.class);

    private final FenceStoreConfiguration configuration;
    private final MeterRegistry meterRegistry;
    private final boolean meterRegistryOwnedByManager;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final ObjectMapper objectMapper;
    private final FenceStoreMetrics metrics;
    private final PgConnectionManager connectionManager;
    private final Pool pool;

    private volatile boolean started = false;

    public FenceStoreManager() {
        this(new FenceStoreConfiguration());
    }

    public FenceStoreManager(FenceStoreConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry(), null, true);
    }

    public FenceStoreManager(FenceStoreConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null, false);
    }

    /**
     * Reuses an application-owned Vert.x instance; it is left open by {@link #closeReactive()}.
     */
    public FenceStoreManager(FenceStoreConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx) {
        this(configuration, meterRegistry, vertx, false);
    }

    private FenceStoreManager(FenceStoreConfiguration configuration, MeterRegistry meterRegistry, Vertx vertx,
                              boolean meterRegistryOwnedByManager) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;
        this.meterRegistryOwnedByManager = meterRegistryOwnedByManager;
        this.objectMapper = createDefaultObjectMapper();

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
            logger.info("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
            logger.info("Created new Vert.x instance (manager ownership)");
        }

        try {
            this.connectionManager = new PgConnectionManager(this.vertx, meterRegistry);

            FenceStoreConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
            this.metrics = new FenceStoreMetrics(metricsConfig.getInstanceId());
            if (metricsConfig.isEnabled()) {
                metrics.bindTo(meterRegistry);
            }

            if (configuration.getBackendConfig().requiresDatabase()) {
                this.pool = connectionManager.getOrCreateReactivePool(FenceStoreDefaults.DEFAULT_POOL_ID,
                    configuration.getDatabaseConfig(), configuration.getPoolConfig());
            } else {
                this.pool = null;
                logger.info("No PostgreSQL backend configured; skipping pool creation");
            }
        } catch (RuntimeException e) {
            logger.error("Failed to initialize FenceStore manager", e);
            if (vertxOwnedByManager) {
                this.vertx.close();
            }
            throw new IllegalStateException("Failed to initialize FenceStore manager", e);
        }

        logger.info("FenceStore manager initialized with profile: {}", configuration.getProfile());
    }

    /**
     * Verifies connectivity with {@code SELECT 1} and runs pending migrations when enabled.
     */
    public Future<Void> startReactive() {
        if (started) {
            logger.warn("FenceStore manager is already started");
            return Future.succeededFuture();
        }
        if (pool == null) {
            started = true;
            return Future.succeededFuture();
        }

        return validateDatabaseConnectivity()
            .compose(v -> runMigrations())
            .<Void>map(v -> {
                started = true;
                logger.info("FenceStore manager started");
                return null;
            })
            .recover(throwable -> {
                logger.error("Failed to start FenceStore manager: {}", throwable.getMessage());
                return Future.failedFuture(new RuntimeException("Failed to start FenceStore manager", throwable));
            });
    }

    private Future<Void> validateDatabaseConnectivity() {
        return connectionManager.withConnection(FenceStoreDefaults.DEFAULT_POOL_ID,
                conn -> conn.query("SELECT 1").execute())
            .<Void>mapEmpty()
            .onSuccess(v -> logger.debug("Database connectivity validated"));
    }

    private Future<Void> runMigrations() {
        if (!configuration.isMigrationEnabled()) {
            logger.info("Schema migration disabled by configuration");
            return Future.succeededFuture();
        }
        SchemaMigrationManager migrations = new SchemaMigrationManager(connectionManager,
            FenceStoreDefaults.DEFAULT_POOL_ID, configuration.getDatabaseConfig().getSchema());
        return migrations.migrate().mapEmpty();
    }

    /**
     * Blocking variant of {@link #startReactive()}; waits up to 30 seconds.
     *
     * @throws IllegalStateException when called on an event-loop thread
     */
    public synchronized void start() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            throw new IllegalStateException("Do not call blocking start() on event-loop thread - use startReactive() instead");
        }

        try {
            startReactive()
                .toCompletionStage()
                .toCompletableFuture()
                .get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting FenceStore manager", e);
        } catch (Exception e) {
            throw new RuntimeException("Failed to start FenceStore manager", e);
        }
    }

    public Future<Boolean> checkHealth() {
        if (pool == null) {
            return Future.succeededFuture(true);
        }
        return connectionManager.checkHealth(FenceStoreDefaults.DEFAULT_POOL_ID);
    }

    /**
     * Closes the pools, the owned meter registry and, when owned, the Vert.x instance.
     */
    public Future<Void> closeReactive() {
        started = false;
        return connectionManager.closeAsync()
            .compose(v -> {
                if (meterRegistryOwnedByManager) {
                    meterRegistry.close();
                }
                if (!vertxOwnedByManager) {
                    logger.debug("Skipping Vert.x close (external ownership)");
                    return Future.<Void>succeededFuture();
                }
                return vertx.close()
                    .onSuccess(v2 -> logger.info("Vert.x instance closed"))
                    .recover(e -> {
                        if (e instanceof RejectedExecutionException || e.getCause() instanceof RejectedExecutionException) {
                            logger.debug("Vert.x event executor already terminated; treating as closed");
                        } else {
                            logger.warn("Error closing Vert.x instance", e);
                        }
                        return Future.succeededFuture();
                    });
            })
            .onSuccess(v -> logger.info("FenceStore manager closed"));
    }

    /**
     * Blocks for up to 10 seconds, except on an event-loop thread where the close is only triggered.
     */
    @Override
    public void close() {
        if (Vertx.currentContext() != null && Vertx.currentContext().isEventLoopContext()) {
            logger.warn("Blocking close() called on event loop thread; closing asynchronously");
            closeReactive();
            return;
        }
        try {
            closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing FenceStore manager");
        } catch (Exception e) {
            logger.warn("Error during synchronous close: {}", e.getMessage());
        }
    }

    private static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public boolean isStarted() { return started; }
    public FenceStoreConfiguration getConfiguration() { return configuration; }
    public ObjectMapper getObjectMapper() { return objectMapper; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public FenceStoreMetrics getMetrics() { return metrics; }
    public PgConnectionManager getConnectionManager() { return connectionManager; }
    public Vertx getVertx() { return vertx; }

    /**
     * The default pool.
     *
     * @throws IllegalStateException when no configured backend uses PostgreSQL
     */
    public Pool getPool() {
        if (pool == null) {
            throw new IllegalStateException("No PostgreSQL backend configured");
        }
        return pool;
    }
}
