package dev.mars.idledger.test;

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

import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Centralized PostgreSQL version constants for all IdLedger tests.
 *
 * Only ONE PostgreSQL image is used across the project so Docker does not accumulate
 * several PostgreSQL versions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class PostgreSQLTestConstants {

    /**
     * The PostgreSQL Docker image used by every test. {@code pg_current_xact_id()} and
     * {@code pg_current_snapshot()}, which the event log relies on, need PostgreSQL 13 or later.
     */
    public static final String POSTGRES_IMAGE = "postgres:15.13-alpine3.20";

    public static final String DEFAULT_DATABASE_NAME = "idledger_test";

    public static final String DEFAULT_USERNAME = "idledger_test";

    public static final String DEFAULT_PASSWORD = "idledger_test";

    /**
     * Shared memory size for PostgreSQL containers (256MB).
     */
    public static final long DEFAULT_SHARED_MEMORY_SIZE = 256 * 1024 * 1024L;

    private PostgreSQLTestConstants() {
        // Prevent instantiation
    }

    /**
     * Creates a standard PostgreSQL container with default settings.
     *
     * @return configured, not yet started, PostgreSQL container
     */
    public static PostgreSQLContainer<?> createStandardContainer() {
        return new PostgreSQLContainer<>(POSTGRES_IMAGE)
                .withDatabaseName(DEFAULT_DATABASE_NAME)
                .withUsername(DEFAULT_USERNAME)
                .withPassword(DEFAULT_PASSWORD)
                .withSharedMemorySize(DEFAULT_SHARED_MEMORY_SIZE)
                .withReuse(false);
    }
}
