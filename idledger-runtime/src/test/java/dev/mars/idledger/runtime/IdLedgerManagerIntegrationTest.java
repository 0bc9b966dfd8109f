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

import dev.mars.idledger.command.idp.IdpConfigCommands;
import dev.mars.idledger.command.user.UserCommands;
import dev.mars.idledger.db.config.IdLedgerConfiguration;
import dev.mars.idledger.domain.idp.IdpStylingType;
import dev.mars.idledger.projection.org.OrgMemberProjection;
import dev.mars.idledger.projection.store.ProjectionPosition;
import dev.mars.idledger.test.categories.TestCategories;
import dev.mars.idledger.test.containers.SharedPostgresExtension;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Starts a full manager against the shared PostgreSQL container.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(SharedPostgresExtension.class)
class IdLedgerManagerIntegrationTest {

    private Vertx vertx;
    private SimpleMeterRegistry registry;
    private IdLedgerManager manager;
    private final List<String> lifecycleEvents = new CopyOnWriteArrayList<>();
    private String instanceId;

    @BeforeEach
    void setUp() {
        PostgreSQLContainer<?> postgres = SharedPostgresExtension.getContainer();
        IdLedgerConfiguration configuration = new IdLedgerConfiguration("default", Map.of(
            "idledger.database.host", postgres.getHost(),
            "idledger.database.port", String.valueOf(postgres.getFirstMappedPort()),
            "idledger.database.name", postgres.getDatabaseName(),
            "idledger.database.username", postgres.getUsername(),
            "idledger.database.password", postgres.getPassword(),
            "idledger.database.schema.initialize", "true",
            "idledger.projection.polling-interval", "PT0.2S"));

        vertx = Vertx.vertx();
        vertx.eventBus().<JsonObject>consumer(IdLedgerManager.EVENT_BUS_ADDR,
            message -> lifecycleEvents.add(message.body().getString("event")));
        registry = new SimpleMeterRegistry();
        manager = new IdLedgerManager(configuration, registry, vertx);
        instanceId = "it-" + UUID.randomUUID();
    }

    @AfterEach
    void tearDown() throws Exception {
        await(manager.closeReactive());
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
    }

    @Test
    void testStartRunsCommandsAndProjections() throws Exception {
        manager.start();

        assertTrue(manager.isStarted());
        assertTrue(manager.isHealthy());
        assertTrue(await(manager.checkHealth()));

        String orgId = await(manager.getOrgCommands().addOrg(instanceId, "acme", "admin")).id();
        String userId = await(manager.getUserCommands().addHumanUser(instanceId, orgId,
            new UserCommands.AddHumanUser("alice", "Alice", "Smith", "alice@acme.test"), "admin")).id();
        await(manager.getOrgMemberCommands().addOrgMember(instanceId, orgId, userId, List.of("ORG_OWNER"), "admin"));
        String idpId = await(manager.getIdpConfigCommands().addJwtIdpConfig(instanceId, orgId,
            new IdpConfigCommands.AddJwtIdpConfig("corporate", IdpStylingType.UNSPECIFIED, false,
                "https://jwt.acme.test/token", "https://issuer.acme.test", "https://jwt.acme.test/keys", "x-auth"),
            "admin")).id();

        await(manager.getProjectionRunner().triggerAndWait(instanceId));

        List<Row> memberships = await(manager.getConnectionManager().withConnection(null, conn -> conn
            .preparedQuery("SELECT user_id, roles FROM projections.org_members WHERE instance_id = $1 AND org_id = $2")
            .execute(Tuple.of(instanceId, orgId))
            .map(rows -> {
                List<Row> result = new ArrayList<>();
                rows.forEach(result::add);
                return result;
            })));
        assertEquals(1, memberships.size());
        assertEquals(userId, memberships.get(0).getString("user_id"));

        Long idpRows = await(manager.getConnectionManager().withConnection(null, conn -> conn
            .preparedQuery("SELECT count(*) AS c FROM projections.idp_configs WHERE instance_id = $1 AND id = $2")
            .execute(Tuple.of(instanceId, idpId))
            .map(rows -> rows.iterator().next().getLong("c"))));
        assertEquals(1L, idpRows);

        ProjectionPosition position = await(manager.getProjectionRunner().position(OrgMemberProjection.NAME, instanceId));
        assertEquals(orgId, position.aggregateId());
        assertTrue(registry.get("idledger.commands").tag("outcome", "success").counters().size() > 0);
    }

    @Test
    void testPollingProjectsWithoutExplicitTrigger() throws Exception {
        manager.start();

        String orgId = await(manager.getOrgCommands().addOrg(instanceId, "acme", "admin")).id();
        String userId = await(manager.getUserCommands().addHumanUser(instanceId, orgId,
            new UserCommands.AddHumanUser("bob", "Bob", "Jones", "bob@acme.test"), "admin")).id();
        await(manager.getOrgMemberCommands().addOrgMember(instanceId, orgId, userId, List.of("ORG_USER"), "admin"));

        long deadline = System.currentTimeMillis() + 10_000;
        long count = 0;
        while (count == 0 && System.currentTimeMillis() < deadline) {
            count = await(manager.getConnectionManager().withConnection(null, conn -> conn
                .preparedQuery("SELECT count(*) AS c FROM projections.org_members WHERE instance_id = $1")
                .execute(Tuple.of(instanceId))
                .map(rows -> rows.iterator().next().getLong("c"))));
            if (count == 0) {
                Thread.sleep(100);
            }
        }
        assertEquals(1L, count);
    }

    @Test
    void testLifecycleEventsPublished() throws Exception {
        manager.start();

        long deadline = System.currentTimeMillis() + 5_000;
        while (!lifecycleEvents.contains("manager.ready") && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(lifecycleEvents)
            .containsExactlyInAnyOrder("database.ready", "schema.ready", "projections.started", "manager.ready");
    }

    @Test
    void testCloseStopsManager() throws Exception {
        manager.start();
        await(manager.closeReactive());

        assertFalse(manager.isStarted());
        assertFalse(manager.isHealthy());
        assertTrue(manager.startReactive().failed());

        // the application's Vert.x stays usable
        assertEquals("ok", await(vertx.executeBlocking(() -> "ok")));
    }
}
