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

import java.time.Duration;
import java.util.Objects;

/**
 * Argument checks shared by every {@link LockManager} implementation.
 */
public final class LockKeys {

    private LockKeys() {
        // Utility class
    }

    public static String requireValidKey(String key) {
        Objects.requireNonNull(key, "Lock key cannot be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Lock key cannot be blank");
        }
        return key;
    }

    public static Duration requirePositiveTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "Lock TTL cannot be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Lock TTL must be positive, got: " + ttl);
        }
        return ttl;
    }

    /**
     * TTL in whole milliseconds, rounding sub-millisecond values up to one.
     */
    public static long ttlMillis(Duration ttl) {
        return Math.max(1L, requirePositiveTtl(ttl).toMillis());
    }
}
