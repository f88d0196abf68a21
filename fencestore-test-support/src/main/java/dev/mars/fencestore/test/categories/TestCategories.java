package dev.mars.fencestore.test.categories;

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
 * Test category constants used with JUnit 5 {@code @Tag} annotations.
 *
 * <h3>Test Categories:</h3>
 * <ul>
 *   <li><strong>CORE</strong> - Fast unit tests, in-memory backends and mocked dependencies</li>
 *   <li><strong>INTEGRATION</strong> - Tests with TestContainers and real PostgreSQL or Redis</li>
 *   <li><strong>SLOW</strong> - Long-running tests that wait on real TTL expiry</li>
 * </ul>
 *
 * <pre>{@code
 * @Tag(TestCategories.INTEGRATION)
 * @Testcontainers(disabledWithoutDocker = true)
 * class PgLockManagerIntegrationTest extends LockManagerContract {
 *     ...
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-26
 * @version 1.0
 * @see org.junit.jupiter.api.Tag
 */
public final class TestCategories {

    /**
     * Core tests - no external infrastructure, each test completes in well under a second.
     */
    public static final String CORE = "core";

    /**
     * Integration tests - TestContainers with real PostgreSQL or Redis.
     */
    public static final String INTEGRATION = "integration";

    /**
     * Slow tests - depend on wall-clock waits.
     */
    public static final String SLOW = "slow";

    private TestCategories() {
        // Utility class - prevent instantiation
    }
}
