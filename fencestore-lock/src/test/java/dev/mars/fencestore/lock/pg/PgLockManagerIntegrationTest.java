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

import dev.mars.fencestore.api.lock.LockManager;
import dev.mars.fencestore.db.FenceStoreManager;
import dev.mars.fencestore.db.config.FenceStoreConfiguration;
import dev.mars.fencestore.test.categories.TestCategories;
import dev.mars.fencestore.test.containers.FenceStoreTestContainers;
import dev.mars.fencestore.test.contract.LockManagerContract;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class PgLockManagerIntegrationTest extends LockManagerContract {

    private static FenceStoreManager manager;
    private static SimpleMeterRegistry registry;

    @BeforeAll
    static void startManager() {
        Properties overrides = FenceStoreTestContainers.postgresProperties("lock_it");
        overrides.setProperty("fencestore.metrics.instance-id", "pg-lock-it");
        registry = new SimpleMeterRegistry();
        manager = new FenceStoreManager(new FenceStoreConfiguration("default", overrides), registry);
        manager.start();
    }

    @AfterAll
    static void stopManager() {
        if (manager != null) {
            manager.close();
        }
    }

    @Override
    protected LockManager createLockManager() {
        return new PgLockManager(manager);
    }

    @Test
    void purgeRemovesExpiredRows() throws Exception {
        PgLockManager pgLocks = (PgLockManager) lockManager;
        String expiring = uniqueKey("purge");
        String live = uniqueKey("keep");
        await(pgLocks.acquire(expiring, Duration.ofMillis(100)));
        await(pgLocks.acquire(live, LONG_TTL));
        Thread.sleep(300);

        int purged = pgLocks.purgeExpired().get(10, TimeUnit.SECONDS);

        assertTrue(purged >= 1);
        assertTrue(await(pgLocks.isLocked(live)).value());
        assertFalse(await(pgLocks.isLocked(expiring)).value());
    }

    @Test
    void outcomesAreCounted() throws Exception {
        String key = uniqueKey("metered");
        double before = registry.get("fencestore.lock.contended").counter().count();
        await(lockManager.acquire(key, LONG_TTL));
        await(lockManager.acquire(key, LONG_TTL));

        assertEquals(before + 1, registry.get("fencestore.lock.contended").counter().count());
        assertTrue(registry.get("fencestore.lock.operation.time").tag("operation", "acquire").timer().count() >= 2);
    }
}
