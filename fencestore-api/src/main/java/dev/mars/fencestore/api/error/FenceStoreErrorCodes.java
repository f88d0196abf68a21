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

/**
 * Standard error codes for FenceStore.
 *
 * Error code ranges:
 * - FSERR0001-0049: General/System errors
 * - FSERR0100-0149: Lock errors
 * - FSERR0250-0299: Event Store errors
 * - FSERR0500-0549: Database/Connection errors
 */
public final class FenceStoreErrorCodes {

    private FenceStoreErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "FSERR0001";
    public static final String INVALID_REQUEST = "FSERR0002";

    // ========================================================================
    // Lock Errors (0100-0149)
    // ========================================================================
    public static final String LOCK_ALREADY_HELD = "FSERR0100";
    public static final String LOCK_TOKEN_MISMATCH = "FSERR0101";
    public static final String LOCK_NOT_FOUND = "FSERR0102";
    public static final String LOCK_BACKEND_FAILURE = "FSERR0103";

    // ========================================================================
    // Event Store Errors (0250-0299)
    // ========================================================================
    public static final String EVENT_VERSION_CONFLICT = "FSERR0250";
    public static final String STREAM_NOT_FOUND = "FSERR0251";
    public static final String EVENT_NOT_FOUND = "FSERR0252";
    public static final String SNAPSHOT_REJECTED = "FSERR0253";
    public static final String EVENT_DESERIALIZATION_FAILED = "FSERR0254";

    // ========================================================================
    // Database/Connection Errors (0500-0549)
    // ========================================================================
    public static final String DATABASE_CONNECTION_FAILED = "FSERR0500";
}
