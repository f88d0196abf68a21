package dev.mars.fencestore.db.config;

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

import dev.mars.fencestore.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class FenceStoreConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("fencestore.database.pool.max-size");
        System.clearProperty("fencestore.profile");
    }

    private static Properties props(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    void defaultsComeFromBundledProperties() {
        FenceStoreConfiguration config = new FenceStoreConfiguration("default");

        PgConnectionConfig db = config.getDatabaseConfig();
        assertEquals("localhost", db.getHost());
        assertEquals(5432, db.getPort());
        assertEquals("fencestore", db.getDatabase());
        assertEquals("public", db.getSchema());
        assertFalse(db.isSslEnabled());

        PgPoolConfig pool = config.getPoolConfig();
        assertEquals(16, pool.getMaxSize());
        assertEquals(128, pool.getMaxWaitQueueSize());
        assertEquals(Duration.ofSeconds(30), pool.getConnectionTimeout());
        assertEquals(Duration.ofMinutes(10), pool.getIdleTimeout());
        assertTrue(pool.isShared());

        assertTrue(config.isMigrationEnabled());
        assertEquals(FenceStoreConfiguration.LockBackend.POSTGRES, config.getBackendConfig().getLockBackend());
        assertEquals(FenceStoreConfiguration.EventStoreBackend.POSTGRES, config.getBackendConfig().getEventStoreBackend());
        assertTrue(config.getBackendConfig().requiresDatabase());

        FenceStoreConfiguration.RedisConfig redis = config.getRedisConfig();
        assertEquals("redis://localhost:6379", redis.getConnectionString());
        assertEquals("lock", redis.getKeyPrefix());
        assertEquals(8, redis.getMaxPoolSize());
    }

    @Test
    void profileFileOverridesDefaults() {
        FenceStoreConfiguration config = new FenceStoreConfiguration("test");

        assertEquals("test", config.getProfile());
        assertEquals("test-host", config.getDatabaseConfig().getHost());
        assertEquals("fencestore_profile", config.getDatabaseConfig().getDatabase());
        assertEquals("profile-instance", config.getMetricsConfig().getInstanceId());
        assertFalse(config.getBackendConfig().requiresDatabase());
    }

    @Test
    void activeProfileIsReadFromSystemProperty() {
        System.setProperty("fencestore.profile", "test");

        assertEquals("test", new FenceStoreConfiguration().getProfile());
    }

    @Test
    void systemPropertiesOverrideProfile() {
        System.setProperty("fencestore.database.pool.max-size", "4");

        assertEquals(4, new FenceStoreConfiguration("test").getPoolConfig().getMaxSize());
    }

    @Test
    void explicitOverridesWinOverEverything() {
        System.setProperty("fencestore.database.pool.max-size", "4");

        FenceStoreConfiguration config = new FenceStoreConfiguration("default",
            props("fencestore.database.pool.max-size", "6", "fencestore.lock.backend", "Redis"));

        assertEquals(6, config.getPoolConfig().getMaxSize());
        assertEquals(FenceStoreConfiguration.LockBackend.REDIS, config.getBackendConfig().getLockBackend());
    }

    @Test
    void programmaticDatabaseSettings() {
        FenceStoreConfiguration config = new FenceStoreConfiguration("default",
            "db.internal", 6543, "events", "svc", "secret", "fence");

        PgConnectionConfig db = config.getDatabaseConfig();
        assertEquals("db.internal", db.getHost());
        assertEquals(6543, db.getPort());
        assertEquals("events", db.getDatabase());
        assertEquals("svc", db.getUsername());
        assertEquals("secret", db.getPassword());
        assertEquals("fence", db.getSchema());
    }

    @Test
    void validationCollectsEveryProblem() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> new FenceStoreConfiguration("broken"));

        assertTrue(error.getMessage().startsWith("Configuration validation failed"));
        assertTrue(error.getMessage().contains("Database port must be between 1 and 65535"));
        assertTrue(error.getMessage().contains("Unknown lock backend: zookeeper"));
    }

    @Test
    void redisSettingsAreOnlyValidatedForRedisBackend() {
        assertDoesNotThrow(() -> new FenceStoreConfiguration("default",
            props("fencestore.redis.connection-string", "localhost:6379")));

        IllegalStateException error = assertThrows(IllegalStateException.class,
            () -> new FenceStoreConfiguration("default", props(
                "fencestore.lock.backend", "redis",
                "fencestore.redis.connection-string", "localhost:6379")));
        assertTrue(error.getMessage().contains("Redis connection string"));
    }

    @Test
    void malformedNumbersFallBackToDefaults() {
        FenceStoreConfiguration config = new FenceStoreConfiguration("default",
            props("fencestore.redis.max-pool-size", "eight", "fencestore.database.pool.idle-timeout-ms", "soon"));

        assertEquals(8, config.getRedisConfig().getMaxPoolSize());
        assertEquals(Duration.ofMinutes(10), config.getPoolConfig().getIdleTimeout());
    }

    @Test
    void requiredLookupFailsForMissingKey() {
        FenceStoreConfiguration config = new FenceStoreConfiguration("default");

        assertEquals("localhost", config.getString("fencestore.database.host"));
        assertThrows(IllegalArgumentException.class, () -> config.getString("fencestore.missing"));
    }

    @Test
    void instanceIdIsGeneratedWhenUnset() {
        String instanceId = new FenceStoreConfiguration("default").getMetricsConfig().getInstanceId();

        assertTrue(instanceId.startsWith("fencestore-"));
    }

    @Test
    void environmentVariablesReachHyphenatedKeys() {
        Properties properties = props(
            "fencestore.redis.connection-string", "redis://localhost:6379",
            "fencestore.database.pool.max-size", "16");

        FenceStoreConfiguration.applyEnvironment(properties, Map.of(
            "FENCESTORE_REDIS_CONNECTION_STRING", "redis://cache:6380",
            "FENCESTORE_DATABASE_POOL_MAX_SIZE", "32",
            "FENCESTORE_METRICS_INSTANCE_ID", "node-a",
            "FENCESTORE_DATABASE_HOST", "db.internal",
            "PATH", "/usr/bin"));

        assertEquals("redis://cache:6380", properties.getProperty("fencestore.redis.connection-string"));
        assertEquals("32", properties.getProperty("fencestore.database.pool.max-size"));
        assertEquals("node-a", properties.getProperty("fencestore.metrics.instance-id"));
        assertEquals("db.internal", properties.getProperty("fencestore.database.host"));
        assertNull(properties.getProperty("fencestore.redis.connection.string"));
        assertNull(properties.getProperty("path"));
    }

    @Test
    void unknownEnvironmentVariablesUseDottedNames() {
        Properties properties = props("fencestore.custom-setting", "a");

        FenceStoreConfiguration.applyEnvironment(properties, Map.of(
            "FENCESTORE_CUSTOM_SETTING", "b",
            "FENCESTORE_EXTRA_FLAG", "on"));

        assertEquals("b", properties.getProperty("fencestore.custom-setting"));
        assertEquals("on", properties.getProperty("fencestore.extra.flag"));
    }
}
