package dev.mars.fencestore.memory;

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

import dev.mars.fencestore.api.lock.LockError;
import dev.mars.fencestore.api.lock.LockGuard;
import dev.mars.fencestore.api.lock.LockKeys;
import dev.mars.fencestore.api.lock.LockManager;
import dev.mars.fencestore.api.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process {@link LockManager} for tests and embedded use.
 *
 * <p>Every state change for a key runs inside {@link ConcurrentHashMap#compute}, which makes the
 * check-and-set atomic per key. Expiry is evaluated against the injected {@link Clock}; expired
 * records are treated as absent and dropped lazily.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-18
 * @version 1.0
 */
public class InMemoryLockManager implements LockManager {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryLockManager.class);

    private final ConcurrentMap<String, LockRecord> locks = new ConcurrentHashMap<>();
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryLockManager() {
        this(Clock.systemUTC());
    }

    public InMemoryLockManager(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public CompletableFuture<Result<LockGuard, LockError>> acquire(String key, Duration ttl) {
        LockKeys.requireValidKey(key);
        long ttlMillis = LockKeys.ttlMillis(ttl);
        ensureOpen();

        String token = UUID.randomUUID().toString();
        LockRecord granted = locks.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing == null || existing.isExpired(now)) {
                return new LockRecord(token, now.plusMillis(ttlMillis));
            }
            return existing;
        });

        if (!granted.token().equals(token)) {
            logger.debug("Lock '{}' already held", key);
            return CompletableFuture.completedFuture(Result.err(new LockError.AlreadyLocked(key)));
        }
        LockGuard guard = new LockGuard(key, token);
        logger.debug("Acquired lock '{}' with token {} for {} ms", key, guard.maskedToken(), ttlMillis);
        return CompletableFuture.completedFuture(Result.ok(guard));
    }

    @Override
    public CompletableFuture<Result<Void, LockError>> release(LockGuard guard) {
        Objects.requireNonNull(guard, "Lock guard cannot be null");
        ensureOpen();

        String key = guard.key();
        AtomicReference<LockError> failure = new AtomicReference<>(new LockError.LockNotFound(key));
        locks.computeIfPresent(key, (k, record) -> {
            if (record.isExpired(clock.instant())) {
                return null;
            }
            if (!record.token().equals(guard.token())) {
                failure.set(new LockError.TokenMismatch(key));
                return record;
            }
            failure.set(null);
            return null;
        });
        return CompletableFuture.completedFuture(outcome("release", guard, failure.get()));
    }

    @Override
    public CompletableFuture<Result<Void, LockError>> extend(LockGuard guard, Duration ttl) {
        Objects.requireNonNull(guard, "Lock guard cannot be null");
        long ttlMillis = LockKeys.ttlMillis(ttl);
        ensureOpen();

        String key = guard.key();
        AtomicReference<LockError> failure = new AtomicReference<>(new LockError.LockNotFound(key));
        locks.computeIfPresent(key, (k, record) -> {
            Instant now = clock.instant();
            if (record.isExpired(now)) {
                return null;
            }
            if (!record.token().equals(guard.token())) {
                failure.set(new LockError.TokenMismatch(key));
                return record;
            }
            failure.set(null);
            return new LockRecord(record.token(), now.plusMillis(ttlMillis));
        });
        return CompletableFuture.completedFuture(outcome("extend", guard, failure.get()));
    }

    @Override
    public CompletableFuture<Result<Boolean, LockError>> isLocked(String key) {
        LockKeys.requireValidKey(key);
        ensureOpen();

        LockRecord record = locks.get(key);
        return CompletableFuture.completedFuture(Result.ok(record != null && !record.isExpired(clock.instant())));
    }

    /**
     * Drops expired records.
     *
     * @return number of records removed
     */
    public int purgeExpired() {
        ensureOpen();
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, LockRecord> entry : locks.entrySet()) {
            if (entry.getValue().isExpired(now) && locks.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            locks.clear();
            logger.debug("InMemoryLockManager closed");
        }
    }

    private Result<Void, LockError> outcome(String operation, LockGuard guard, LockError failure) {
        if (failure == null) {
            logger.debug("{} succeeded for lock '{}'", operation, guard.key());
            return Result.ok();
        }
        if (failure instanceof LockError.TokenMismatch) {
            logger.warn("{} rejected for lock '{}': token {} is not the current holder",
                operation, guard.key(), guard.maskedToken());
        } else {
            logger.debug("{} found no live lock '{}'", operation, guard.key());
        }
        return Result.err(failure);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Lock manager is closed");
        }
    }

    private record LockRecord(String token, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
