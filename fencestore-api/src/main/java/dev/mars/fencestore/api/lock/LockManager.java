package dev.mars.fencestore.api.lock;

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

import dev.mars.fencestore.api.result.Result;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Time-bounded exclusive locks keyed by resource name.
 *
 * <p>Every state-changing operation is a single atomic conditional write on the backend. Nothing
 * is retried internally: {@link LockError.AlreadyLocked}, {@link LockError.TokenMismatch} and
 * {@link LockError.LockNotFound} are returned to the caller, who decides whether to retry, back
 * off or abort.</p>
 *
 * <p>Arguments are validated synchronously: a null or blank key, a null guard or a zero or negative
 * TTL throws before any backend call is made.</p>
 *
 * <p>A caller that times out waiting for {@link #acquire} must treat the outcome as unknown: the
 * backend write may have landed, in which case the record simply expires after its TTL.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public interface LockManager extends AutoCloseable {

    /**
     * Atomically creates the lock record for {@code key} if it is absent or expired.
     *
     * @param key the resource to lock, non-blank
     * @param ttl how long the grant lasts without an extend, positive
     * @return the guard on success, {@link LockError.AlreadyLocked} if another holder owns a live record
     */
    CompletableFuture<Result<LockGuard, LockError>> acquire(String key, Duration ttl);

    /**
     * Deletes the lock record only if it is live and carries the guard's token.
     *
     * @return {@link LockError.TokenMismatch} if another token holds the key,
     *         {@link LockError.LockNotFound} if there is no live record
     */
    CompletableFuture<Result<Void, LockError>> release(LockGuard guard);

    /**
     * Resets the expiry of a live lock record to {@code ttl} from now, only if it carries the
     * guard's token. Same failure outcomes as {@link #release}.
     *
     * @throws UnsupportedOperationException if {@link #supportsExtend()} is false
     */
    default CompletableFuture<Result<Void, LockError>> extend(LockGuard guard, Duration ttl) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support extend");
    }

    /**
     * Whether this backend implements {@link #extend}.
     */
    default boolean supportsExtend() {
        return true;
    }

    /**
     * Advisory check for a live record. The answer may be stale by the time it is read and must
     * never replace {@link #acquire}.
     */
    CompletableFuture<Result<Boolean, LockError>> isLocked(String key);

    /**
     * Acquires {@code key}, runs {@code action} and releases the lock whatever the action's outcome.
     *
     * <p>If the lock cannot be acquired the acquire error is returned and the action never runs.
     * If the release fails after a successful action (typically {@link LockError.LockNotFound}
     * because the TTL elapsed mid-action) the release error is returned, since the action may have
     * overlapped with another holder. An action that fails exceptionally makes the returned future
     * fail with the same exception once the release has been attempted.</p>
     */
    default <T> CompletableFuture<Result<T, LockError>> withLock(String key, Duration ttl,
                                                                 Supplier<CompletableFuture<T>> action) {
        return acquire(key, ttl).thenCompose(acquired -> {
            if (acquired.isErr()) {
                return CompletableFuture.completedFuture(Result.<T, LockError>err(acquired.error()));
            }
            LockGuard guard = acquired.value();
            CompletableFuture<T> work;
            try {
                work = action.get();
            } catch (RuntimeException e) {
                work = CompletableFuture.failedFuture(e);
            }
            return work.handle((value, failure) -> release(guard).thenCompose(released -> {
                    if (failure != null) {
                        return CompletableFuture.<Result<T, LockError>>failedFuture(failure);
                    }
                    if (released.isErr()) {
                        return CompletableFuture.completedFuture(Result.<T, LockError>err(released.error()));
                    }
                    return CompletableFuture.completedFuture(Result.<T, LockError>ok(value));
                }))
                .thenCompose(Function.identity());
        });
    }

    /**
     * Releases backend resources owned by this manager. Locks it granted are left to expire.
     */
    @Override
    void close();
}
