package dev.mars.fencestore.db.util;

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

import io.vertx.pgclient.PgException;

/**
 * SQLSTATE classification for failures raised by the Vert.x PostgreSQL client.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-21
 * @version 1.0
 */
public final class SqlStates {

    public static final String UNIQUE_VIOLATION = "23505";
    public static final String SERIALIZATION_FAILURE = "40001";
    public static final String DEADLOCK_DETECTED = "40P01";

    private SqlStates() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Returns the SQLSTATE of the first {@link PgException} in the cause chain, or {@code null}.
     */
    public static String sqlState(Throwable error) {
        Throwable cause = error;
        while (cause != null && !(cause instanceof PgException)) {
            cause = cause.getCause();
        }
        return cause == null ? null : ((PgException) cause).getSqlState();
    }

    public static boolean isUniqueViolation(Throwable error) {
        return UNIQUE_VIOLATION.equals(sqlState(error));
    }

    public static boolean isTransient(Throwable error) {
        String state = sqlState(error);
        return SERIALIZATION_FAILURE.equals(state) || DEADLOCK_DETECTED.equals(state);
    }

    /**
     * Class 08 covers connection exceptions reported by the server.
     */
    public static boolean isConnectionException(Throwable error) {
        String state = sqlState(error);
        return state != null && state.startsWith("08");
    }
}
