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

import dev.mars.fencestore.test.categories.TestCategories;
import io.vertx.pgclient.PgException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag(TestCategories.CORE)
class SqlStatesTest {

    private static PgException pgException(String sqlState) {
        PgException exception = mock(PgException.class);
        when(exception.getSqlState()).thenReturn(sqlState);
        return exception;
    }

    @Test
    void findsSqlStateInCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer", pgException("23505"));

        assertEquals("23505", SqlStates.sqlState(wrapped));
        assertTrue(SqlStates.isUniqueViolation(wrapped));
        assertFalse(SqlStates.isTransient(wrapped));
    }

    @Test
    void classifiesTransientAndConnectionStates() {
        assertTrue(SqlStates.isTransient(pgException("40001")));
        assertTrue(SqlStates.isTransient(pgException("40P01")));
        assertTrue(SqlStates.isConnectionException(pgException("08006")));
        assertFalse(SqlStates.isConnectionException(pgException("23505")));
    }

    @Test
    void nonPostgresFailuresHaveNoState() {
        IllegalStateException error = new IllegalStateException("pool closed");

        assertNull(SqlStates.sqlState(error));
        assertFalse(SqlStates.isUniqueViolation(error));
        assertEquals("pool closed", ReactiveUtils.describe(new RuntimeException("wrapper", error)));
    }
}
