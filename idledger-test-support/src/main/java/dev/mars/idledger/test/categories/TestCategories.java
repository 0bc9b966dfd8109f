package dev.mars.idledger.test.categories;

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
 *   <li><strong>CORE</strong> - Fast unit tests against the in-memory event log and projection store</li>
 *   <li><strong>INTEGRATION</strong> - Tests with TestContainers and a real PostgreSQL</li>
 * </ul>
 *
 * <h3>Maven Profile Usage:</h3>
 * <pre>{@code
 * mvn test                       # everything; integration tests are skipped without Docker
 * mvn test -Pcore-tests          # core tests only
 * mvn test -Pintegration-tests   # TestContainers tests only
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 * @see org.junit.jupiter.api.Tag
 */
public final class TestCategories {

    /**
     * Core tests - no external infrastructure, each test well under a second.
     */
    public static final String CORE = "core";

    /**
     * Integration tests - PostgreSQL in a TestContainer, shared through
     * {@link dev.mars.idledger.test.containers.SharedPostgresExtension}.
     */
    public static final String INTEGRATION = "integration";

    private TestCategories() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }
}
