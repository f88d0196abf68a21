package dev.mars.fencestore.lock;

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
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.db.util.ReactiveUtils;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Common behaviour of the lock backends that talk to an external store through Vert.x clients.
 *
 * <p>Subclasses implement the single-round-trip primitives. This class validates arguments,
 * generates tokens, maps backend answers onto {@link LockError} variants, folds backend failures
 * into {@link LockError.Internal} and records metrics.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-28
 * @version 1.0
 */
public abstract class AbstractReactiveLockManager implements LockManager {
    private static final Logger logger = LoggerFactory.getLogger(AbstractReactiveLockManager.class);

    protected final FenceStoreMetrics metrics;
    private volatile boolean closed = false;

    protected AbstractReactiveLockManager(FenceStoreMetrics metrics) {
        this.metrics = metrics != null ? metrics : FenceStoreMetrics.disabled();
    }

    /**
     * Stores {@code token} under {@code key} unless a live record exists.
     *
     * @return {@code true} if the record was written
     */
    protected abstract Future<Boolean> tryAcquire(String key, String token, long ttlMillis);

    protected abstract Future<GuardedOutcome> tryRelease(String key, String token);

    protected abstract Future<GuardedOutcome> tryExtend(String key, String token, long ttlMillis);

    protected abstract Future<Boolean> hasLiveRecord(String key);

    /**
     * Releases clients owned by the subclass. Called once, from {@link #close()}.
     */
    protected abstract void closeImplementationSpecificResources();

    /**
     * Short backend name used in log lines.
     */
    protected abstract String backendName();

    @Override
    public CompletableFuture<Result<LockGuard, LockError>> acquire(String key, Duration ttl) {
        LockKeys.requireValidKey(key);
        long ttlMillis = LockKeys.ttlMillis(ttl);
        ensureOpen();

        String token = UUID.randomUUID().toString();
        long start = metrics.startTimer();
        Future<Result<LockGuard, LockError>> outcome = invoke(() -> tryAcquire(key, token, ttlMillis))
            .map(granted -> {
                if (!granted) {
                    logger.debug("[{}] lock '{}' already held", backendName(), key);
                    metrics.recordLockError("acquire", new LockError.AlreadyLocked(key));
                    return Result.<LockGuard, LockError>err(new LockError.AlreadyLocked(key));
                }
                LockGuard guard = new LockGuard(key, token);
                logger.debug("[{}] acquired lock '{}' with token {} for {} ms",
                    backendName(), key, guard.maskedToken(), ttlMillis);
                metrics.recordLockAcquired();
                return Result.<LockGuard, LockError>ok(guard);
            })
            .recover(error -> Future.succeededFuture(Result.err(internal("acquire", key, error))))
            .onComplete(ar -> metrics.recordLockOperation("acquire", start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    @Override
    public CompletableFuture<Result<Void, LockError>> release(LockGuard guard) {
        Objects.requireNonNull(guard, "Lock guard cannot be null");
        ensureOpen();

        long start = metrics.startTimer();
        Future<Result<Void, LockError>> outcome = invoke(() -> tryRelease(guard.key(), guard.token()))
            .map(result -> toResult("release", guard, result))
            .recover(error -> Future.succeededFuture(Result.err(internal("release", guard.key(), error))))
            .onComplete(ar -> metrics.recordLockOperation("release", start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    @Override
    public CompletableFuture<Result<Void, LockError>> extend(LockGuard guard, Duration ttl) {
        Objects.requireNonNull(guard, "Lock guard cannot be null");
        long ttlMillis = LockKeys.ttlMillis(ttl);
        ensureOpen();

        long start = metrics.startTimer();
        Future<Result<Void, LockError>> outcome = invoke(() -> tryExtend(guard.key(), guard.token(), ttlMillis))
            .map(result -> toResult("extend", guard, result))
            .recover(error -> Future.succeededFuture(Result.err(internal("extend", guard.key(), error))))
            .onComplete(ar -> metrics.recordLockOperation("extend", start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    @Override
    public CompletableFuture<Result<Boolean, LockError>> isLocked(String key) {
        LockKeys.requireValidKey(key);
        ensureOpen();

        long start = metrics.startTimer();
        Future<Result<Boolean, LockError>> outcome = invoke(() -> hasLiveRecord(key))
            .map(locked -> Result.<Boolean, LockError>ok(locked))
            .recover(error -> Future.succeededFuture(Result.err(internal("isLocked", key, error))))
            .onComplete(ar -> metrics.recordLockOperation("isLocked", start));
        return ReactiveUtils.toCompletableFuture(outcome);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeImplementationSpecificResources();
        logger.info("[{}] lock manager closed", backendName());
    }

    protected boolean isClosed() {
        return closed;
    }

    protected void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(backendName() + " lock manager is closed");
        }
    }

    private Result<Void, LockError> toResult(String operation, LockGuard guard, GuardedOutcome outcome) {
        switch (outcome) {
            case APPLIED:
                logger.debug("[{}] {} succeeded for lock '{}'", backendName(), operation, guard.key());
                if ("release".equals(operation)) {
                    metrics.recordLockReleased();
                } else {
                    metrics.recordLockExtended();
                }
                return Result.ok();
            case TOKEN_MISMATCH:
                logger.warn("[{}] {} rejected for lock '{}': token {} is not the current holder",
                    backendName(), operation, guard.key(), guard.maskedToken());
                metrics.recordLockError(operation, new LockError.TokenMismatch(guard.key()));
                return Result.err(new LockError.TokenMismatch(guard.key()));
            default:
                logger.debug("[{}] {} found no live lock '{}'", backendName(), operation, guard.key());
                metrics.recordLockError(operation, new LockError.LockNotFound(guard.key()));
                return Result.err(new LockError.LockNotFound(guard.key()));
        }
    }

    private LockError internal(String operation, String key, Throwable error) {
        logger.error("[{}] {} failed for lock '{}': {}", backendName(), operation, key, error.getMessage());
        LockError.Internal internal = LockError.Internal.of(key, error);
        metrics.recordLockError(operation, internal);
        return internal;
    }

    /**
     * Turns an exception thrown while building the backend call into a failed future.
     */
    private static <T> Future<T> invoke(Supplier<Future<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
