package dev.mars.fencestore.lock.redis;

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

import dev.mars.fencestore.api.lock.LockGuard;
import dev.mars.fencestore.api.lock.LockManager;
import dev.mars.fencestore.db.config.FenceStoreConfiguration;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.test.categories.TestCategories;
import dev.mars.fencestore.test.containers.FenceStoreTestContainers;
import dev.mars.fencestore.test.contract.LockManagerContract;
import io.vertx.core.Vertx;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisAPI;
import io.vertx.redis.client.Response;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class RedisLockManagerIntegrationTest extends LockManagerContract {

    private static Vertx vertx;
    private static RedisAPI rawClient;

    @BeforeAll
    static void startRedis() {
        vertx = Vertx.vertx();
        rawClient = RedisAPI.api(Redis.createClient(vertx, FenceStoreTestContainers.redisConnectionString()));
    }

    @AfterAll
    static void stopRedis() throws Exception {
        if (rawClient != null) {
            rawClient.close();
        }
        if (vertx != null) {
            vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        }
    }

    @Override
    protected LockManager createLockManager() {
        FenceStoreConfiguration.RedisConfig config = new FenceStoreConfiguration.RedisConfig(
            FenceStoreTestContainers.redisConnectionString(), "lock", 4);
        return RedisLockManager.create(vertx, config, FenceStoreMetrics.disabled());
    }

    @Test
    void keysAreStoredUnderPrefixWithTokenAsValue() throws Exception {
        String key = uniqueKey("prefixed");
        LockGuard guard = await(lockManager.acquire(key, LONG_TTL)).value();

        Response stored = rawClient.get("lock:" + key).toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertEquals(guard.token(), stored.toString());

        Response ttl = rawClient.pttl("lock:" + key).toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        assertTrue(ttl.toLong() > 0 && ttl.toLong() <= LONG_TTL.toMillis());
    }

    @Test
    void sharedClientIsLeftOpenOnClose() throws Exception {
        RedisLockManager shared = new RedisLockManager(rawClient, "shared", FenceStoreMetrics.disabled());
        String key = uniqueKey("shared");
        assertTrue(await(shared.acquire(key, LONG_TTL)).isOk());

        shared.close();

        Response exists = rawClient.exists(List.of("shared:" + key)).toCompletionStage().toCompletableFuture()
            .get(5, TimeUnit.SECONDS);
        assertEquals(1L, exists.toLong());
    }
}
