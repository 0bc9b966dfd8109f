package dev.mars.idledger.db.config;

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

import dev.mars.idledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CORE tests for IdLedgerConfiguration property layering and validation.
 */
@Tag(TestCategories.CORE)
class IdLedgerConfigurationTest {

    @Test
    void testDefaultsAreLoadedFromClasspath() {
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("default");

        PgConnectionConfig db = configuration.getDatabaseConfig();
        assertEquals("localhost", db.getHost());
        assertEquals(5432, db.getPort());
        assertEquals("idledger", db.getDatabase());

        IdLedgerConfiguration.ProjectionConfig projection = configuration.getProjectionConfig();
        assertTrue(projection.isEnabled());
        assertEquals(200, projection.getBatchSize());
        assertEquals(Duration.ofSeconds(1), projection.getPollingInterval());
        assertTrue(projection.isLockEnabled());
        assertEquals("default", configuration.getDefaultInstanceId());
        assertFalse(configuration.isSchemaInitializationEnabled());
    }

    @Test
    void testProfilePropertiesOverrideDefaults() {
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("profiletest");

        assertEquals("profiletest", configuration.getProfile());
        assertEquals("idledger_profile", configuration.getDatabaseConfig().getDatabase());
        assertEquals(7, configuration.getProjectionConfig().getBatchSize());
        assertEquals(Duration.ofMillis(250), configuration.getProjectionConfig().getPollingInterval());
        // untouched keys keep their default
        assertEquals("localhost", configuration.getDatabaseConfig().getHost());
    }

    @Test
    void testExplicitOverridesWin() {
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("profiletest", Map.of(
            "idledger.database.host", "db.internal",
            "idledger.database.port", "6543",
            "idledger.projection.lock-enabled", "false"));

        assertEquals("db.internal", configuration.getDatabaseConfig().getHost());
        assertEquals(6543, configuration.getDatabaseConfig().getPort());
        assertFalse(configuration.getProjectionConfig().isLockEnabled());
    }

    @Test
    void testEnvironmentVariablesAreMappedToPropertyKeys() {
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("default");

        Properties props = configuration.loadProperties("default", Map.of(
            "IDLEDGER_DATABASE_HOST", "env-host",
            "IDLEDGER_PROJECTION_BATCH__SIZE", "42",
            "OTHER_VARIABLE", "ignored"));

        assertEquals("env-host", props.getProperty("idledger.database.host"));
        assertEquals("42", props.getProperty("idledger.projection.batch-size"));
        assertNull(props.getProperty("other.variable"));
    }

    @Test
    void testPropertyKeyMapping() {
        assertEquals("idledger.database.pool.max-size", IdLedgerConfiguration.toPropertyKey("IDLEDGER_DATABASE_POOL_MAX__SIZE"));
        assertEquals("idledger.profile", IdLedgerConfiguration.toPropertyKey("IDLEDGER_PROFILE"));
    }

    @Test
    void testValidationReportsAllProblems() {
        IllegalStateException error = assertThrows(IllegalStateException.class, () ->
            new IdLedgerConfiguration("default", Map.of(
                "idledger.database.port", "70000",
                "idledger.database.name", "",
                "idledger.projection.batch-size", "0")));

        assertTrue(error.getMessage().contains("Database port must be between 1 and 65535"));
        assertTrue(error.getMessage().contains("Database name is required"));
        assertTrue(error.getMessage().contains("Projection batch size must be between 1 and 10000"));
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("default", Map.of(
            "idledger.database.pool.max-size", "many",
            "idledger.projection.max-retry-delay", "soon"));

        assertEquals(16, configuration.getPoolConfig().getMaxSize());
        assertEquals(Duration.ofSeconds(30), configuration.getProjectionConfig().getMaxRetryDelay());
    }

    @Test
    void testMissingRequiredPropertyThrows() {
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("default");
        assertThrows(IllegalArgumentException.class, () -> configuration.getString("idledger.does.not.exist"));
    }
}
