package dev.mars.fencestore.lock.pg;

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

import dev.mars.fencestore.api.lock.LockError;
import dev.mars.fencestore.api.lock.LockGuard;
import dev.mars.fencestore.api.result.Result;
import dev.mars.fencestore.db.connection.PgConnectionManager;
import dev.mars.fencestore.db.metrics.FenceStoreMetrics;
import dev.mars.fencestore.test.categories.TestCategories;
import io.vertx.core.Future;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Failure paths of the PostgreSQL backend; the statements themselves run in
 * {@link PgLockManagerIntegrationTest}.
 */
@Tag(TestCategories.CORE)
@ExtendWith(MockitoExtension.class)
class PgLockManagerTest {

    @Mock
    private PgConnectionManager connectionManager;

    @Test
    void databaseFailureBecomesInternalError() throws Exception {
        when(connectionManager.withConnection(eq("locks"), any()))
            .thenReturn(Future.failedFuture(new IllegalStateException("pool closed")));
        PgLockManager lockManager = new PgLockManager(connectionManager, "locks", FenceStoreMetrics.disabled());

        Result<Void, LockError> result = lockManager.release(new LockGuard("job", "token-1234567890"))
            .get(5, TimeUnit.SECONDS);

        LockError.Internal internal = assertInstanceOf(LockError.Internal.class, result.error());
        assertEquals("pool closed", internal.reason());
    }

    @Test
    void purgeFailurePropagates() {
        when(connectionManager.withConnection(eq("locks"), any()))
            .thenReturn(Future.failedFuture(new IllegalStateException("pool closed")));
        PgLockManager lockManager = new PgLockManager(connectionManager, "locks", null);

        ExecutionException error = assertThrows(ExecutionException.class,
            () -> lockManager.purgeExpired().get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void invalidArgumentsNeverReachTheDatabase() {
        PgLockManager lockManager = new PgLockManager(connectionManager, "locks", FenceStoreMetrics.disabled());

        assertThrows(IllegalArgumentException.class, () -> lockManager.acquire(" ", Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> lockManager.acquire("job", Duration.ZERO));
        assertThrows(NullPointerException.class, () -> lockManager.release(null));
        verifyNoInteractions(connectionManager);
    }

    @Test
    void closedManagerRejectsCalls() {
        PgLockManager lockManager = new PgLockManager(connectionManager, "locks", FenceStoreMetrics.disabled());
        lockManager.close();

        assertThrows(IllegalStateException.class, () -> lockManager.isLocked("job"));
        assertThrows(IllegalStateException.class, lockManager::purgeExpired);
    }
}
