package dev.mars.fencestore.api.events;

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
 * Closed set of failures reported by {@link EventStore} and {@link SnapshotStore}.
 *
 * <p>{@link VersionConflict} is the expected outcome of concurrent writers and is never retried by
 * the store. {@link ConnectionFailed} is the only variant a caller may retry unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public sealed interface EventStoreError
    permits EventStoreError.VersionConflict, EventStoreError.StreamNotFound, EventStoreError.EventNotFound,
            EventStoreError.SnapshotRejected, EventStoreError.ConnectionFailed, EventStoreError.DeserializationError {

    String code();

    String message();

    default boolean isRetryable() {
        return this instanceof ConnectionFailed;
    }

    /**
     * The stream was not at {@code expected} when the append ran; {@code actual} is the version
     * observed at that point.
     */
    record VersionConflict(StreamId streamId, long expected, long actual) implements EventStoreError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.EVENT_VERSION_CONFLICT;
        }

        @Override
        public String message() {
            return "Version conflict on stream '" + streamId + "': expected " + expected + ", actual " + actual;
        }
    }

    record StreamNotFound(StreamId streamId) implements EventStoreError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.STREAM_NOT_FOUND;
        }

        @Override
        public String message() {
            return "Stream not found: " + streamId;
        }
    }

    record EventNotFound(StreamId streamId, long version) implements EventStoreError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.EVENT_NOT_FOUND;
        }

        @Override
        public String message() {
            return "Event not found: " + streamId + "@" + version;
        }
    }

    record SnapshotRejected(StreamId streamId, long snapshotVersion, long currentVersion) implements EventStoreError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.SNAPSHOT_REJECTED;
        }

        @Override
        public String message() {
            return "Snapshot version " + snapshotVersion + " exceeds current version " + currentVersion
                + " of stream '" + streamId + "'";
        }
    }

    record ConnectionFailed(String reason, Throwable cause) implements EventStoreError {

        public static ConnectionFailed of(Throwable cause) {
            return new ConnectionFailed(cause.getMessage() != null ? cause.getMessage() : cause.toString(), cause);
        }

        @Override
        public String code() {
            return FenceStoreErrorCodes.DATABASE_CONNECTION_FAILED;
        }

        @Override
        public String message() {
            return "Event store backend failure: " + reason;
        }
    }

    record DeserializationError(String reason, Throwable cause) implements EventStoreError {
        @Override
        public String code() {
            return FenceStoreErrorCodes.EVENT_DESERIALIZATION_FAILED;
        }

        @Override
        public String message() {
            return "Failed to deserialize stored data: " + reason;
        }
    }
}
