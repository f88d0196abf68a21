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

import dev.mars.fencestore.db.FenceStoreDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Layered configuration for the lock and event store backends.
 *
 * <p>Sources, lowest precedence first: {@code /fencestore-default.properties},
 * {@code /fencestore-<profile>.properties}, {@code FENCESTORE_*} environment variables and
 * {@code fencestore.*} system properties.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-16
 * @version 1.0
 */
public class FenceStoreConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FenceStoreConfiguration.class);

    private static final List<String> KNOWN_KEYS = List.of(
        "fencestore.database.host",
        "fencestore.database.port",
        "fencestore.database.name",
        "fencestore.database.username",
        "fencestore.database.password",
        "fencestore.database.schema",
        "fencestore.database.ssl.enabled",
        "fencestore.database.pool.max-size",
        "fencestore.database.pool.max-wait-queue-size",
        "fencestore.database.pool.connection-timeout-ms",
        "fencestore.database.pool.idle-timeout-ms",
        "fencestore.database.pool.shared",
        "fencestore.migration.enabled",
        "fencestore.lock.backend",
        "fencestore.eventstore.backend",
        "fencestore.redis.connection-string",
        "fencestore.redis.key-prefix",
        "fencestore.redis.max-pool-size",
        "fencestore.metrics.enabled",
        "fencestore.metrics.instance-id"
    );

    private final Properties properties;
    private final String profile;

    public FenceStoreConfiguration() {
        this(getActiveProfile());
    }

    public FenceStoreConfiguration(String profile) {
        this(profile, new Properties());
    }

    /**
     * Loads the profile and then applies {@code overrides} on top of every other source.
     * Used by tests and embedding applications that must not touch system properties.
     */
    public FenceStoreConfiguration(String profile, Properties overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded FenceStore configuration for profile: {}", profile);
    }

    /**
     * Programmatic database settings, applied without polluting system properties.
     */
    public FenceStoreConfiguration(String profile, String dbHost, int dbPort, String dbName,
                                   String dbUsername, String dbPassword, String dbSchema) {
        this.profile = profile;
        this.properties = loadProperties(profile);

        properties.setProperty("fencestore.database.host", dbHost);
        properties.setProperty("fencestore.database.port", String.valueOf(dbPort));
        properties.setProperty("fencestore.database.name", dbName);
        properties.setProperty("fencestore.database.username", dbUsername);
        properties.setProperty("fencestore.database.password", dbPassword);
        if (dbSchema != null && !dbSchema.isEmpty()) {
            properties.setProperty("fencestore.database.schema", dbSchema);
        }

        validateConfiguration();
        logger.info("Loaded FenceStore configuration for profile: {} with explicit database config", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("fencestore.profile",
               System.getenv("FENCESTORE_PROFILE") != null ? System.getenv("FENCESTORE_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/fencestore-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/fencestore-" + profile + ".properties");
        }

        applyEnvironment(props, System.getenv());

        // System properties win over the environment so tests can override with -D
        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("fencestore.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    /**
     * Copies {@code FENCESTORE_*} variables into {@code props}. A variable names a property when both
     * agree after lower-casing and turning {@code .} and {@code -} into {@code _}, so
     * {@code FENCESTORE_REDIS_CONNECTION_STRING} sets {@code fencestore.redis.connection-string}.
     * Variables that match no known property fall back to the dotted form.
     */
    static void applyEnvironment(Properties props, Map<String, String> environment) {
        Map<String, String> keysByEnvName = new HashMap<>();
        for (String key : KNOWN_KEYS) {
            keysByEnvName.put(envName(key), key);
        }
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith("fencestore.")) {
                keysByEnvName.put(envName(key), key);
            }
        }

        environment.forEach((name, value) -> {
            if (name.startsWith("FENCESTORE_") && !"FENCESTORE_PROFILE".equals(name)) {
                String normalised = name.toLowerCase(Locale.ROOT);
                String propKey = keysByEnvName.getOrDefault(normalised, normalised.replace('_', '.'));
                props.setProperty(propKey, value);
            }
        });
    }

    private static String envName(String key) {
        return key.toLowerCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateDatabaseConfig(errors);
        validateBackendConfig(errors);
        validateRedisConfig(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        if (getString("fencestore.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }

        int port = getInt("fencestore.database.port", 5432);
        if (port < 1 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }

        if (getString("fencestore.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        if (getString("fencestore.database.username", "").isEmpty()) {
            errors.add("Database username is required");
        }

        if (getInt("fencestore.database.pool.max-size", 16) < 1) {
            errors.add("Maximum pool size must be at least 1");
        }

        if (getLong("fencestore.database.pool.connection-timeout-ms", 30000) < 1) {
            errors.add("Connection timeout must be positive");
        }
    }

    private void validateBackendConfig(List<String> errors) {
        String lockBackend = getString("fencestore.lock.backend", "postgres");
        if (LockBackend.parse(lockBackend) == null) {
            errors.add("Unknown lock backend: " + lockBackend);
        }

        String eventBackend = getString("fencestore.eventstore.backend", "postgres");
        if (EventStoreBackend.parse(eventBackend) == null) {
            errors.add("Unknown event store backend: " + eventBackend);
        }
    }

    private void validateRedisConfig(List<String> errors) {
        if (LockBackend.parse(getString("fencestore.lock.backend", "postgres")) != LockBackend.REDIS) {
            return;
        }
        String connectionString = getString("fencestore.redis.connection-string", "");
        if (!connectionString.startsWith("redis://") && !connectionString.startsWith("rediss://")) {
            errors.add("Redis connection string must start with redis:// or rediss://");
        }
        if (getString("fencestore.redis.key-prefix", FenceStoreDefaults.DEFAULT_REDIS_KEY_PREFIX).isEmpty()) {
            errors.add("Redis key prefix must not be empty");
        }
        if (getInt("fencestore.redis.max-pool-size", 8) < 1) {
            errors.add("Redis pool size must be at least 1");
        }
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public PgConnectionConfig getDatabaseConfig() {
        return new PgConnectionConfig.Builder()
            .host(getString("fencestore.database.host", "localhost"))
            .port(getInt("fencestore.database.port", 5432))
            .database(getString("fencestore.database.name", "fencestore"))
            .username(getString("fencestore.database.username", "fencestore"))
            .password(getString("fencestore.database.password", ""))
            .schema(getString("fencestore.database.schema", "public"))
            .sslEnabled(getBoolean("fencestore.database.ssl.enabled", false))
            .build();
    }

    public PgPoolConfig getPoolConfig() {
        return new PgPoolConfig.Builder()
            .maxSize(getInt("fencestore.database.pool.max-size", 16))
            .maxWaitQueueSize(getInt("fencestore.database.pool.max-wait-queue-size", 128))
            .connectionTimeout(Duration.ofMillis(getLong("fencestore.database.pool.connection-timeout-ms", 30000)))
            .idleTimeout(Duration.ofMillis(getLong("fencestore.database.pool.idle-timeout-ms", 600000)))
            .shared(getBoolean("fencestore.database.pool.shared", true))
            .build();
    }

    public boolean isMigrationEnabled() {
        return getBoolean("fencestore.migration.enabled", true);
    }

    public BackendConfig getBackendConfig() {
        return new BackendConfig(
            LockBackend.parse(getString("fencestore.lock.backend", "postgres")),
            EventStoreBackend.parse(getString("fencestore.eventstore.backend", "postgres"))
        );
    }

    public RedisConfig getRedisConfig() {
        return new RedisConfig(
            getString("fencestore.redis.connection-string", "redis://localhost:6379"),
            getString("fencestore.redis.key-prefix", FenceStoreDefaults.DEFAULT_REDIS_KEY_PREFIX),
            getInt("fencestore.redis.max-pool-size", 8)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("fencestore.metrics.enabled", true),
            getString("fencestore.metrics.instance-id", "fencestore-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    public enum LockBackend {
        MEMORY, POSTGRES, REDIS;

        static LockBackend parse(String value) {
            for (LockBackend backend : values()) {
                if (backend.name().equalsIgnoreCase(value.trim())) {
                    return backend;
                }
            }
            return null;
        }
    }

    public enum EventStoreBackend {
        MEMORY, POSTGRES;

        static EventStoreBackend parse(String value) {
            for (EventStoreBackend backend : values()) {
                if (backend.name().equalsIgnoreCase(value.trim())) {
                    return backend;
                }
            }
            return null;
        }
    }

    public static class BackendConfig {
        private final LockBackend lockBackend;
        private final EventStoreBackend eventStoreBackend;

        public BackendConfig(LockBackend lockBackend, EventStoreBackend eventStoreBackend) {
            this.lockBackend = lockBackend;
            this.eventStoreBackend = eventStoreBackend;
        }

        public LockBackend getLockBackend() { return lockBackend; }
        public EventStoreBackend getEventStoreBackend() { return eventStoreBackend; }

        /**
         * Whether any configured backend needs the PostgreSQL pool.
         */
        public boolean requiresDatabase() {
            return lockBackend == LockBackend.POSTGRES || eventStoreBackend == EventStoreBackend.POSTGRES;
        }
    }

    public static class RedisConfig {
        private final String connectionString;
        private final String keyPrefix;
        private final int maxPoolSize;

        public RedisConfig(String connectionString, String keyPrefix, int maxPoolSize) {
            this.connectionString = connectionString;
            this.keyPrefix = keyPrefix;
            this.maxPoolSize = maxPoolSize;
        }

        public String getConnectionString() { return connectionString; }
        public String getKeyPrefix() { return keyPrefix; }
        public int getMaxPoolSize() { return maxPoolSize; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }

    public String getProfile() { return profile; }

    public Properties getProperties() {
        Properties copy = new Properties();
        copy.putAll(properties);
        return copy;
    }
}
