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

import dev.mars.fencestore.api.error.FenceStoreErrorCodes;

/**
 * Closed set of failures a {@link LockManager} reports.
 *
 * <p>{@link AlreadyLocked}, {@link TokenMismatch} and {@link LockNotFound} are steady-state
 * outcomes under contention or after expiry. {@link Internal} covers backend connectivity and
 * protocol failures.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public sealed interface LockError
    permits LockError.AlreadyLocked, LockError.TokenMismatch, LockError.LockNotFound, LockError.Internal {

    String key();

    String code();

    String message();

    /**
     * True for the outcomes caused by another holder owning the key.
     */
    default boolean isContention() {
        return this instanceof AlreadyLocked || this instanceof TokenMismatch;
    }

    record AlreadyLocked(String key) implements LockError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.LOCK_ALREADY_HELD;
        }

        @Override
        public String message() {
            return "Lock already held: " + key;
        }
    }

    record TokenMismatch(String key) implements LockError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.LOCK_TOKEN_MISMATCH;
        }

        @Override
        public String message() {
            return "Lock token does not match current holder: " + key;
        }
    }

    record LockNotFound(String key) implements LockError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.LOCK_NOT_FOUND;
        }

        @Override
        public String message() {
            return "Lock not found or expired: " + key;
        }
    }

    record Internal(String key, String reason, Throwable cause) implements LockError {

        public static Internal of(String key, Throwable cause) {
            return new Internal(key, cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
        }

        @Override
        public String code() {
            return FenceStoreErrorCodes.LOCK_BACKEND_FAILURE;
        }

        @Override
        public String message() {
            return "Lock backend failure for '" + key + "': " + reason;
        }
    }
}
