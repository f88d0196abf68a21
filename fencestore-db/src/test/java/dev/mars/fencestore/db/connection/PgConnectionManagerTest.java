package dev.mars.fencestore.db.connection;

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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PgConnectionManagerTest {

    private Vertx vertx;
    private PgConnectionManager connectionManager;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        connectionManager = new PgConnectionManager(vertx, new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() throws Exception {
        connectionManager.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    @Test
    void searchPathIsNormalized() {
        assertEquals("", PgConnectionManager.normalizeSearchPath(null));
        assertEquals("", PgConnectionManager.normalizeSearchPath("  "));
        assertEquals("fence", PgConnectionManager.normalizeSearchPath(" fence "));
        assertEquals("fence, public", PgConnectionManager.normalizeSearchPath("fence,,public"));
    }

    @Test
    void searchPathRejectsInjection() {
        assertThrows(IllegalArgumentException.class,
            () -> PgConnectionManager.normalizeSearchPath("public; DROP TABLE distributed_locks"));
    }

    @Test
    void unknownServiceFailsWithoutTouchingTheDatabase() {
        ExecutionException error = assertThrows(ExecutionException.class, () ->
            connectionManager.withConnection("missing", conn -> conn.query("SELECT 1").execute())
                .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertNull(connectionManager.getExistingPool("missing"));
    }

    @Test
    void healthOfUnknownServiceIsFalse() throws Exception {
        assertFalse(connectionManager.checkHealth("missing")
            .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS));
    }

    @Test
    void closingUnknownPoolSucceeds() throws Exception {
        connectionManager.closePoolAsync("missing").toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
}
