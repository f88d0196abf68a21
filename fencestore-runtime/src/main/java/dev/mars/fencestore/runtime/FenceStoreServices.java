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
import dev.mars.fencestore.eventstore.StreamReplayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The services built by {@link FenceStoreRuntime}, sharing one {@link FenceStoreManager}.
 *
 * <p>Closing the services closes every backend, then the manager with its pool and Vert.x instance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-12
 * @version 1.0
 */
public final class FenceStoreServices implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FenceStoreServices.class);

    private final FenceStoreManager manager;
    private final LockManager lockManager;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final StreamReplayer streamReplayer;
    private volatile boolean closed = false;

    FenceStoreServices(FenceStoreManager manager, LockManager lockManager, EventStore eventStore,
                       SnapshotStore snapshotStore) {
        this.manager = Objects.requireNonNull(manager, "FenceStoreManager cannot be null");
        this.lockManager = Objects.requireNonNull(lockManager, "LockManager cannot be null");
        this.eventStore = Objects.requireNonNull(eventStore, "EventStore cannot be null");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "SnapshotStore cannot be null");
        this.streamReplayer = new StreamReplayer(eventStore, snapshotStore);
    }

    public LockManager getLockManager() {
        return lockManager;
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    public SnapshotStore getSnapshotStore() {
        return snapshotStore;
    }

    public StreamReplayer getStreamReplayer() {
        return streamReplayer;
    }

    public FenceStoreManager getManager() {
        return manager;
    }

    public FenceStoreConfiguration.BackendConfig getBackendConfig() {
        return manager.getConfiguration().getBackendConfig();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly("lock manager", lockManager);
        closeQuietly("event store", eventStore);
        closeQuietly("snapshot store", snapshotStore);
        manager.close();
        logger.info("FenceStore services closed");
    }

    private static void closeQuietly(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            logger.warn("Error closing {}: {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "FenceStoreServices{" +
                "lockManager=" + lockManager.getClass().getSimpleName() +
                ", eventStore=" + eventStore.getClass().getSimpleName() +
                ", snapshotStore=" + snapshotStore.getClass().getSimpleName() +
                '}';
    }
}
