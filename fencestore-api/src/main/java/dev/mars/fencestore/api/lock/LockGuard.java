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

import java.util.Objects;

/**
 * Proof of a held lock: the protected key and the fencing token issued when it was acquired.
 *
 * <p>Only the holder of the guard can release or extend the lock. The backend keeps a time-bounded
 * record for the key; once that record expires or is taken over, the guard is stale and every
 * operation presenting it is rejected.</p>
 *
 * @param key   the protected resource identifier
 * @param token the opaque, unpredictable fencing token
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public record LockGuard(String key, String token) {

    public LockGuard {
        LockKeys.requireValidKey(key);
        Objects.requireNonNull(token, "Lock token cannot be null");
        if (token.isBlank()) {
            throw new IllegalArgumentException("Lock token cannot be blank");
        }
    }

    @Override
    public String toString() {
        return "LockGuard{key='" + key + "', token='" + maskedToken() + "'}";
    }

    /**
     * Token prefix safe for log output.
     */
    public String maskedToken() {
        return token.length() <= 8 ? "****" : token.substring(0, 8) + "****";
    }
}
