package dev.mars.fencestore.db;

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
 * Internal constants shared by the database-backed components.
 */
public final class FenceStoreDefaults {

    /**
     * Service id under which {@link dev.mars.fencestore.db.connection.PgConnectionManager}
     * registers the pool owned by {@link FenceStoreManager}.
     */
    public static final String DEFAULT_POOL_ID = "fencestore-main";

    /** Key namespace used when locks live in Redis. */
    public static final String DEFAULT_REDIS_KEY_PREFIX = "lock";

    private FenceStoreDefaults() {
        // Prevent instantiation
    }
}
