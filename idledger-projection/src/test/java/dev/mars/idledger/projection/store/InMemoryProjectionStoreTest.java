package dev.mars.idledger.projection.store;

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

import dev.mars.idledger.api.error.ErrorKind;
import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.api.event.EventPosition;
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.domain.AggregateTypes;
import dev.mars.idledger.domain.org.OrgEventTypes;
import dev.mars.idledger.domain.user.UserEventTypes;
import dev.mars.idledger.projection.org.OrgMemberProjection;
import dev.mars.idledger.projection.statement.Statement;
import dev.mars.idledger.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class InMemoryProjectionStoreTest {

    private static final String INSTANCE = "inst-1";

    private final OrgMemberProjection projection = new OrgMemberProjection();
    private final InMemoryProjectionStore store = new InMemoryProjectionStore();
    private long position = 0;

    private StoredEvent event(String aggregateType, String aggregateId, String resourceOwner, String type,
                              long sequence, JsonObject payload) {
        position++;
        return new StoredEvent(INSTANCE, aggregateType, aggregateId, resourceOwner, type, sequence,
            Instant.parse("2025-10-18T10:00:00Z").plusSeconds(position), payload, null, new EventPosition(position, position));
    }

    private StoredEvent memberAdded(String orgId, String userId, long sequence, String userOwner, String... roles) {
        return event(AggregateTypes.ORG, orgId, orgId, OrgEventTypes.MEMBER_ADDED, sequence, new JsonObject()
            .put("userId", userId).put("roles", new JsonArray(List.of(roles))).put("userResourceOwner", userOwner));
    }

    private List<Statement> reduce(StoredEvent... events) {
        List<Statement> statements = new ArrayList<>();
        for (StoredEvent event : events) {
            statements.add(projection.reduce(event));
        }
        return statements;
    }

    private BatchOutcome apply(List<Statement> statements) {
        Future<BatchOutcome> outcome = store.applyBatch(projection.name(), INSTANCE, true,
            from -> Future.succeededFuture(statements));
        assertTrue(outcome.succeeded(), () -> String.valueOf(outcome.cause()));
        return outcome.result();
    }

    private List<Map<String, Object>> rows() {
        return store.rows(OrgMemberProjection.TABLE);
    }

    @Test
    void testBatchIsIdempotent() {
        List<Statement> batch = reduce(
            memberAdded("org-1", "user-1", 2, "org-1", "role"),
            memberAdded("org-1", "user-2", 3, "org-2", "role"),
            event(AggregateTypes.ORG, "org-1", "org-1", OrgEventTypes.MEMBER_CHANGED, 4,
                new JsonObject().put("userId", "user-1").put("roles", new JsonArray().add("role").add("changed"))),
            event(AggregateTypes.ORG, "org-1", "org-1", OrgEventTypes.MEMBER_REMOVED, 5,
                new JsonObject().put("userId", "user-2")));

        apply(batch);
        List<Map<String, Object>> once = rows();
        BatchOutcome again = apply(batch);

        assertEquals(once, rows());
        assertEquals(1, once.size());
        assertEquals(List.of("role", "changed"), once.get(0).get(OrgMemberProjection.ROLES));
        assertEquals(4L, once.get(0).get(OrgMemberProjection.SEQUENCE));
        assertEquals(4, again.eventCount());
        assertEquals(new EventPosition(4, 4), again.position().position());
    }

    @Test
    void testOrgRemovedMarksOwnedAndForeignMemberships() {
        apply(reduce(
            memberAdded("org-1", "user-1", 2, "org-1", "role"),
            memberAdded("org-2", "user-2", 2, "org-1", "role"),
            memberAdded("org-2", "user-3", 3, "org-2", "role"),
            event(AggregateTypes.ORG, "org-1", "org-1", OrgEventTypes.ORG_REMOVED, 3, new JsonObject())));

        Map<String, Object> ownedRow = row("org-1", "user-1");
        assertEquals(true, ownedRow.get(OrgMemberProjection.OWNER_REMOVED));
        assertEquals(true, ownedRow.get(OrgMemberProjection.OWNER_REMOVED_USER));
        assertEquals(3L, ownedRow.get(OrgMemberProjection.SEQUENCE));

        Map<String, Object> foreignUserRow = row("org-2", "user-2");
        assertEquals(false, foreignUserRow.get(OrgMemberProjection.OWNER_REMOVED));
        assertEquals(true, foreignUserRow.get(OrgMemberProjection.OWNER_REMOVED_USER));

        Map<String, Object> untouched = row("org-2", "user-3");
        assertEquals(false, untouched.get(OrgMemberProjection.OWNER_REMOVED));
        assertEquals(false, untouched.get(OrgMemberProjection.OWNER_REMOVED_USER));
        assertEquals(3L, untouched.get(OrgMemberProjection.SEQUENCE));
    }

    @Test
    void testUserRemovedDeletesEveryMembershipOfUser() {
        apply(reduce(
            memberAdded("org-1", "user-1", 2, "org-1", "role"),
            memberAdded("org-2", "user-1", 2, "org-1", "role"),
            memberAdded("org-2", "user-2", 3, "org-2", "role"),
            event(AggregateTypes.USER, "user-1", "org-1", UserEventTypes.USER_REMOVED, 4, new JsonObject())));

        assertEquals(1, rows().size());
        assertEquals("user-2", rows().get(0).get(OrgMemberProjection.USER_ID));
    }

    @Test
    void testFailedBatchRestoresTablesAndPosition() {
        apply(reduce(memberAdded("org-1", "user-1", 2, "org-1", "role")));
        ProjectionPosition before = store.position(projection.name(), INSTANCE).result();

        store.failNextBatch(new IllegalStateException("disk full"));
        Future<BatchOutcome> failed = store.applyBatch(projection.name(), INSTANCE, true,
            from -> Future.succeededFuture(reduce(memberAdded("org-1", "user-2", 3, "org-1", "role"))));

        assertTrue(failed.failed());
        assertTrue(IdLedgerException.isKind(failed.cause(), ErrorKind.UNAVAILABLE));
        assertEquals(1, rows().size());
        assertEquals(before, store.position(projection.name(), INSTANCE).result());

        // the lock was released with the failure
        apply(reduce(memberAdded("org-1", "user-2", 3, "org-1", "role")));
        assertEquals(2, rows().size());
    }

    @Test
    void testReducerFailureKeepsPosition() {
        Future<BatchOutcome> failed = store.applyBatch(projection.name(), INSTANCE, true,
            from -> Future.failedFuture(new IllegalStateException("query failed")));

        assertTrue(failed.failed());
        assertEquals(ProjectionPosition.initial(), store.position(projection.name(), INSTANCE).result());
    }

    @Test
    void testLockedPositionSkipsBatch() {
        assertTrue(store.tryLock(projection.name(), INSTANCE));

        BatchOutcome outcome = apply(reduce(memberAdded("org-1", "user-1", 2, "org-1", "role")));

        assertTrue(outcome.skipped());
        assertTrue(rows().isEmpty());

        Future<BatchOutcome> unlocked = store.applyBatch(projection.name(), INSTANCE, false,
            from -> Future.succeededFuture(reduce(memberAdded("org-1", "user-1", 2, "org-1", "role"))));
        assertFalse(unlocked.result().skipped());

        store.unlock(projection.name(), INSTANCE);
        assertFalse(apply(List.of()).skipped());
    }

    @Test
    void testStaleUnlockedBatchIsDropped() {
        StoredEvent added = memberAdded("org-1", "user-1", 2, "org-1", "role");
        StoredEvent orgRemoved = event(AggregateTypes.ORG, "org-1", "org-1", OrgEventTypes.ORG_REMOVED, 3, new JsonObject());

        // another runner applies both events after this batch read the initial position
        Future<BatchOutcome> stale = store.applyBatch(projection.name(), INSTANCE, false, from -> {
            assertEquals(ProjectionPosition.initial(), from);
            Future<BatchOutcome> fast = store.applyBatch(projection.name(), INSTANCE, false,
                current -> Future.succeededFuture(reduce(added, orgRemoved)));
            assertEquals(2, fast.result().eventCount());
            return Future.succeededFuture(reduce(added));
        });

        assertTrue(stale.succeeded(), () -> String.valueOf(stale.cause()));
        assertEquals(BatchOutcome.Status.SUPERSEDED, stale.result().status());
        assertTrue(stale.result().skipped());
        assertEquals(true, row("org-1", "user-1").get(OrgMemberProjection.OWNER_REMOVED));
        assertEquals(orgRemoved.position(), store.position(projection.name(), INSTANCE).result().position());
    }

    private Map<String, Object> row(String orgId, String userId) {
        return rows().stream()
            .filter(r -> orgId.equals(r.get(OrgMemberProjection.ORG_ID)) && userId.equals(r.get(OrgMemberProjection.USER_ID)))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no row for " + orgId + "/" + userId));
    }
}
