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

import dev.mars.fencestore.db.config.FenceStoreConfiguration;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.lock.AbstractReactiveLockManager;
import dev.mars.fencestore.lock.GuardedOutcome;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisAPI;
import io.vertx.redis.client.RedisOptions;
import io.vertx.redis.client.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Lock manager backed by Redis string keys with a PX expiry.
 *
 * <p>Acquire is {@code SET key token NX PX ttl}; release and extend run {@link RedisLockScripts}.
 * Keys are stored as {@code <prefix>:<key>}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-30
 * @version 1.0
 */
public class RedisLockManager extends AbstractReactiveLockManager {
    private static final Logger logger = LoggerFactory.getLogger(RedisLockManager.class);

    private final RedisAPI redis;
    private final String keyPrefix;
    private final boolean ownsClient;

    /**
     * Wraps a caller-owned client; {@link #close()} leaves it open.
     */
    public RedisLockManager(RedisAPI redis, String keyPrefix, FenceStoreMetrics metrics) {
        this(redis, keyPrefix, metrics, false);
    }

    private RedisLockManager(RedisAPI redis, String keyPrefix, FenceStoreMetrics metrics, boolean ownsClient) {
        super(metrics);
        this.redis = Objects.requireNonNull(redis, "redis");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        if (keyPrefix.isEmpty()) {
            throw new IllegalArgumentException("Key prefix cannot be empty");
        }
        this.ownsClient = ownsClient;
    }

    /**
     * Creates a pooled client from the configuration; the client is closed with the manager.
     */
    public static RedisLockManager create(Vertx vertx, FenceStoreConfiguration.RedisConfig config,
                                          FenceStoreMetrics metrics) {
        RedisOptions options = new RedisOptions()
            .setConnectionString(config.getConnectionString())
            .setMaxPoolSize(config.getMaxPoolSize());
        Redis client = Redis.createClient(vertx, options);
        logger.info("Created Redis lock client with key prefix '{}'", config.getKeyPrefix());
        return new RedisLockManager(RedisAPI.api(client), config.getKeyPrefix(), metrics, true);
    }

    String redisKey(String key) {
        return keyPrefix + ":" + key;
    }

    @Override
    protected Future<Boolean> tryAcquire(String key, String token, long ttlMillis) {
        return redis.set(List.of(redisKey(key), token, "NX", "PX", Long.toString(ttlMillis)))
            .map(reply -> reply != null);
    }

    @Override
    protected Future<GuardedOutcome> tryRelease(String key, String token) {
        return redis.eval(List.of(RedisLockScripts.RELEASE, "1", redisKey(key), token))
            .map(RedisLockManager::decode);
    }

    @Override
    protected Future<GuardedOutcome> tryExtend(String key, String token, long ttlMillis) {
        return redis.eval(List.of(RedisLockScripts.EXTEND, "1", redisKey(key), token, Long.toString(ttlMillis)))
            .map(RedisLockManager::decode);
    }

    @Override
    protected Future<Boolean> hasLiveRecord(String key) {
        return redis.exists(List.of(redisKey(key)))
            .map(reply -> reply != null && reply.toLong() > 0);
    }

    private static GuardedOutcome decode(Response reply) {
        if (reply == null) {
            throw new IllegalStateException("Lock script returned no reply");
        }
        return GuardedOutcome.fromScriptReply(reply.toLong());
    }

    @Override
    protected void closeImplementationSpecificResources() {
        if (ownsClient) {
            redis.close();
        }
    }

    @Override
    protected String backendName() {
        return "redis";
    }
}
