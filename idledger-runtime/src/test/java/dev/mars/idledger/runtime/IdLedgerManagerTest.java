package dev.mars.idledger.runtime;

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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.idledger.command.ObjectDetails;
import dev.mars.idledger.db.config.IdLedgerConfiguration;
import dev.mars.idledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CORE tests for the manager that need no database.
 */
@Tag(TestCategories.CORE)
class IdLedgerManagerTest {

    private static IdLedgerConfiguration unreachableDatabase() {
        return new IdLedgerConfiguration("default", Map.of(
            "idledger.database.host", "127.0.0.1",
            "idledger.database.port", "1",
            "idledger.database.pool.connection-timeout-ms", "2000",
            "idledger.metrics.instance-id", "manager-test"));
    }

    @Test
    void testComponentsWiredWithoutConnecting() throws Exception {
        IdLedgerManager manager = new IdLedgerManager(unreachableDatabase());
        try {
            assertFalse(manager.isStarted());
            assertFalse(manager.isHealthy());
            assertNotNull(manager.getOrgCommands());
            assertNotNull(manager.getUserCommands());
            assertNotNull(manager.getOrgMemberCommands());
            assertNotNull(manager.getIdpConfigCommands());
            assertNotNull(manager.getProjectionRunner());
            assertEquals("manager-test", manager.getMetrics().getInstanceId());
            assertTrue(manager.getMetrics().isBound());
        } finally {
            manager.closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void testObjectMapperWritesIsoDates() throws Exception {
        IdLedgerManager manager = new IdLedgerManager(unreachableDatabase());
        try {
            ObjectDetails details = new ObjectDetails("org-1", "org-1", 3, Instant.parse("2025-10-18T10:15:30Z"));

            JsonNode json = manager.getObjectMapper().valueToTree(details);

            assertEquals("2025-10-18T10:15:30Z", json.get("changeDate").asText());
            assertEquals(3, json.get("sequence").asLong());
        } finally {
            manager.closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void testStartFailsWhenDatabaseUnreachable() throws Exception {
        IdLedgerManager manager = new IdLedgerManager(unreachableDatabase());
        try {
            RuntimeException error = assertThrows(RuntimeException.class, manager::start);

            assertTrue(error.getMessage().contains("Failed to start IdLedger manager"));
            assertFalse(manager.isStarted());
            assertFalse(manager.isHealthy());
        } finally {
            manager.closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    void testClosedManagerCannotStart() throws Exception {
        IdLedgerManager manager = new IdLedgerManager(unreachableDatabase());
        manager.closeReactive().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

        assertTrue(manager.startReactive().failed());
        assertTrue(manager.closeReactive().succeeded());
    }
}
