package dev.mars.fencestore.runtime;

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

import dev.mars.fencestore.api.events.EventStore;
import dev.mars.fencestore.api.events.SnapshotStore;
import dev.mars.fencestore.api.lock.LockManager;
import dev.mars.fencestore.db.FenceStoreManager;
import dev.mars.fencestore.db.config.FenceStoreConfiguration;
import dev.mars.fencestore.eventstore.pg.PgEventStore;
import dev.mars.fencestore.eventstore.pg.PgSnapshotStore;
import dev.mars.fencestore.lock.pg.PgLockManager;
import dev.mars.fencestore.lock.redis.RedisLockManager;
import dev.mars.fencestore.memory.InMemoryEventStore;
import dev.mars.fencestore.memory.InMemoryLockManager;
import dev.mars.fencestore.memory.InMemorySnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point that builds the lock manager and event stores selected by
 * {@code fencestore.lock.backend} and {@code fencestore.eventstore.backend}.
 *
 * <pre>{@code
 * try (FenceStoreServices services = FenceStoreRuntime.create(new FenceStoreConfiguration("production"))) {
 *     services.getLockManager().withLock("nightly-report", Duration.ofMinutes(5), this::runReport);
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-12
 * @version 1.0
 */
public final class FenceStoreRuntime {
    private static final Logger logger = LoggerFactory.getLogger(FenceStoreRuntime.class);

    private FenceStoreRuntime() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Builds the services from the {@code default} profile.
     */
    public static FenceStoreServices create() {
        return create(new FenceStoreConfiguration());
    }

    /**
     * Builds the services with a manager-owned meter registry.
     */
    public static FenceStoreServices create(FenceStoreConfiguration configuration) {
        Objects.requireNonNull(configuration, "FenceStoreConfiguration cannot be null");
        return start(new FenceStoreManager(configuration));
    }

    /**
     * Builds the services, registering meters with the caller's registry.
     */
    public static FenceStoreServices create(FenceStoreConfiguration configuration, MeterRegistry meterRegistry) {
        Objects.requireNonNull(configuration, "FenceStoreConfiguration cannot be null");
        Objects.requireNonNull(meterRegistry, "MeterRegistry cannot be null");
        return start(new FenceStoreManager(configuration, meterRegistry));
    }

    private static FenceStoreServices start(FenceStoreManager manager) {
        FenceStoreConfiguration.BackendConfig backends = manager.getConfiguration().getBackendConfig();
        logger.info("Starting FenceStore with lock backend {} and event store backend {}",
            backends.getLockBackend(), backends.getEventStoreBackend());

        LockManager lockManager = null;
        EventStore eventStore = null;
        try {
            manager.start();
            lockManager = createLockManager(manager, backends.getLockBackend());
            eventStore = createEventStore(manager, backends.getEventStoreBackend());
            SnapshotStore snapshotStore = createSnapshotStore(manager, backends.getEventStoreBackend());
            FenceStoreServices services = new FenceStoreServices(manager, lockManager, eventStore, snapshotStore);
            logger.info("FenceStore services ready: {}", services);
            return services;
        } catch (RuntimeException e) {
            logger.error("Failed to start FenceStore services: {}", e.getMessage());
            if (lockManager != null) {
                lockManager.close();
            }
            if (eventStore != null) {
                eventStore.close();
            }
            manager.close();
            throw e;
        }
    }

    static LockManager createLockManager(FenceStoreManager manager, FenceStoreConfiguration.LockBackend backend) {
        switch (backend) {
            case MEMORY:
                logger.warn("Using in-memory lock backend; locks are not shared between processes");
                return new InMemoryLockManager();
            case REDIS:
                return RedisLockManager.create(manager.getVertx(), manager.getConfiguration().getRedisConfig(),
                    manager.getMetrics());
            case POSTGRES:
            default:
                return new PgLockManager(manager);
        }
    }

    static EventStore createEventStore(FenceStoreManager manager, FenceStoreConfiguration.EventStoreBackend backend) {
        if (backend == FenceStoreConfiguration.EventStoreBackend.MEMORY) {
            logger.warn("Using in-memory event store; events are lost when the process exits");
            return new InMemoryEventStore();
        }
        return new PgEventStore(manager);
    }

    static SnapshotStore createSnapshotStore(FenceStoreManager manager,
                                             FenceStoreConfiguration.EventStoreBackend backend) {
        if (backend == FenceStoreConfiguration.EventStoreBackend.MEMORY) {
            return new InMemorySnapshotStore();
        }
        return new PgSnapshotStore(manager);
    }
}
