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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.events.NewEvent;
import dev.mars.fencestore.api.events.StreamId;
import dev.mars.fencestore.api.lock.LockError;
import dev.mars.fencestore.api.lock.LockGuard;
import dev.mars.fencestore.db.config.FenceStoreConfiguration;
import dev.mars.fencestore.eventstore.pg.PgEventStore;
import dev.mars.fencestore.eventstore.pg.PgSnapshotStore;
import dev.mars.fencestore.lock.pg.PgLockManager;
import dev.mars.fencestore.lock.redis.RedisLockManager;
import dev.mars.fencestore.test.categories.TestCategories;
import dev.mars.fencestore.test.containers.FenceStoreTestContainers;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class FenceStoreRuntimeIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void postgresBackendsShareOneStartedManager() throws Exception {
        Properties overrides = FenceStoreTestContainers.postgresProperties("runtime_pg");

        try (FenceStoreServices services = FenceStoreRuntime.create(new FenceStoreConfiguration("default", overrides))) {
            assertInstanceOf(PgLockManager.class, services.getLockManager());
            assertInstanceOf(PgEventStore.class, services.getEventStore());
            assertInstanceOf(PgSnapshotStore.class, services.getSnapshotStore());

            String key = "runtime-" + UUID.randomUUID();
            assertTrue(services.getLockManager().acquire(key, Duration.ofSeconds(30)).get(10, TimeUnit.SECONDS).isOk());
            assertEquals(new LockError.AlreadyLocked(key),
                services.getLockManager().acquire(key, Duration.ofSeconds(30)).get(10, TimeUnit.SECONDS).error());

            StreamId stream = StreamId.of("runtime-" + UUID.randomUUID());
            services.getEventStore().append(stream, List.of(NewEvent.of("Opened", MAPPER.createObjectNode())), 0)
                .get(10, TimeUnit.SECONDS);
            assertInstanceOf(EventStoreError.SnapshotRejected.class, services.getStreamReplayer()
                .takeSnapshot(stream, 2, null, MAPPER.createObjectNode()).get(10, TimeUnit.SECONDS).error());
            assertTrue(services.getManager().checkHealth().toCompletionStage().toCompletableFuture()
                .get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void redisLockBackendWithPostgresEvents() throws Exception {
        Properties overrides = FenceStoreTestContainers.postgresProperties("runtime_redis");
        overrides.setProperty("fencestore.lock.backend", "redis");
        overrides.setProperty("fencestore.redis.connection-string", FenceStoreTestContainers.redisConnectionString());
        overrides.setProperty("fencestore.redis.key-prefix", "runtime");

        try (FenceStoreServices services = FenceStoreRuntime.create(new FenceStoreConfiguration("default", overrides))) {
            assertInstanceOf(RedisLockManager.class, services.getLockManager());

            String key = "runtime-" + UUID.randomUUID();
            LockGuard guard = services.getLockManager().acquire(key, Duration.ofSeconds(30)).get(10, TimeUnit.SECONDS).value();
            assertTrue(services.getLockManager().isLocked(key).get(10, TimeUnit.SECONDS).value());
            assertTrue(services.getLockManager().release(guard).get(10, TimeUnit.SECONDS).isOk());
        }
    }
}
