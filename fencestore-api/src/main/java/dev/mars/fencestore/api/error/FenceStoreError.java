package dev.mars.fencestore.api.error;

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

import dev.mars.fencestore.api.events.EventStoreError;
import dev.mars.fencestore.api.lock.LockError;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable error record for surfacing lock and event store errors to other layers.
 *
 * @param code      The standard error code (e.g., FSERR0250)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public record FenceStoreError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code and message, using current timestamp.
     */
    public static FenceStoreError of(String code, String message) {
        return new FenceStoreError(code, message, Instant.now(), null);
    }

    /**
     * Creates an error with code, message, and details, using current timestamp.
     */
    public static FenceStoreError of(String code, String message, String details) {
        return new FenceStoreError(code, message, Instant.now(), details);
    }

    public static FenceStoreError from(LockError error) {
        Objects.requireNonNull(error, "error");
        String details = error instanceof LockError.Internal internal && internal.cause() != null
            ? internal.cause().toString()
            : null;
        return of(error.code(), error.message(), details);
    }

    public static FenceStoreError from(EventStoreError error) {
        Objects.requireNonNull(error, "error");
        Throwable cause = null;
        if (error instanceof EventStoreError.ConnectionFailed failed) {
            cause = failed.cause();
        } else if (error instanceof EventStoreError.DeserializationError failed) {
            cause = failed.cause();
        }
        return of(error.code(), error.message(), cause != null ? cause.toString() : null);
    }

    /**
     * Creates an invalid request error.
     */
    public static FenceStoreError invalidRequest(String message) {
        return of(FenceStoreErrorCodes.INVALID_REQUEST, message);
    }

    /**
     * Creates an internal error.
     */
    public static FenceStoreError internalError(String message) {
        return of(FenceStoreErrorCodes.INTERNAL_ERROR, message);
    }
}
