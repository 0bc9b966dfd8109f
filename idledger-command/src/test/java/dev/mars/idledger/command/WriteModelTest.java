package dev.mars.idledger.command;

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

import dev.mars.idledger.api.event.EventPosition;
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.command.idp.JwtConfigWriteModel;
import dev.mars.idledger.command.org.OrgMemberWriteModel;
import dev.mars.idledger.domain.idp.IdpConfigState;
import dev.mars.idledger.test.categories.TestCategories;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CORE tests of write model reduction.
 */
@Tag(TestCategories.CORE)
class WriteModelTest {

    private static final Instant T0 = Instant.parse("2025-10-18T08:00:00Z");

    private static StoredEvent orgEvent(long sequence, String type, JsonObject payload) {
        return new StoredEvent("inst", "org", "org1", "org1", type, sequence, T0.plusSeconds(sequence),
            payload, "admin", new EventPosition(sequence, sequence));
    }

    private static List<StoredEvent> memberHistory() {
        List<StoredEvent> events = new ArrayList<>();
        events.add(orgEvent(1, "org.added", new JsonObject().put("name", "acme")));
        events.add(orgEvent(2, "org.member.added", new JsonObject()
            .put("userId", "user-id").put("roles", new JsonArray().add("role")).put("userResourceOwner", "org1")));
        events.add(orgEvent(3, "org.member.added", new JsonObject()
            .put("userId", "other").put("roles", new JsonArray().add("viewer"))));
        events.add(orgEvent(4, "org.some.future.event", new JsonObject().put("userId", "user-id")));
        events.add(orgEvent(5, "org.member.changed", new JsonObject()
            .put("userId", "user-id").put("roles", new JsonArray().add("role").add("changed"))));
        return events;
    }

    @Test
    void testReplayIsDeterministic() {
        OrgMemberWriteModel first = new OrgMemberWriteModel("inst", "org1", "user-id");
        OrgMemberWriteModel second = new OrgMemberWriteModel("inst", "org1", "user-id");

        first.reduceAll(memberHistory());
        second.reduceAll(memberHistory());

        assertEquals(first.getRoles(), second.getRoles());
        assertEquals(first.exists(), second.exists());
        assertEquals(first.getProcessedSequence(), second.getProcessedSequence());
        assertEquals(first.getChangeDate(), second.getChangeDate());
        assertEquals(List.of("role", "changed"), first.getRoles());
    }

    @Test
    void testUnknownAndForeignEventsStillAdvanceSequence() {
        OrgMemberWriteModel model = new OrgMemberWriteModel("inst", "org1", "user-id");

        model.reduceAll(memberHistory().subList(0, 4));

        assertEquals(4, model.getProcessedSequence());
        assertEquals(List.of("role"), model.getRoles());
        assertEquals("org1", model.getResourceOwner());
        assertEquals(T0.plusSeconds(1), model.getCreationDate());
    }

    @Test
    void testEmptyStreamIsZeroState() {
        OrgMemberWriteModel model = new OrgMemberWriteModel("inst", "org1", "user-id");

        model.reduceAll(List.of());

        assertFalse(model.exists());
        assertFalse(model.isOrgActive());
        assertEquals(0, model.getProcessedSequence());
        assertNull(model.getResourceOwner());
        assertTrue(model.getRoles().isEmpty());
    }

    @Test
    void testOutOfOrderEventsAreRejected() {
        OrgMemberWriteModel model = new OrgMemberWriteModel("inst", "org1", "user-id");
        model.reduce(memberHistory().get(1));

        assertThrows(IllegalStateException.class, () -> model.reduce(memberHistory().get(0)));
        assertThrows(IllegalArgumentException.class, () -> model.reduce(new StoredEvent("inst", "user", "org1", "org1",
            "user.removed", 9, T0, null, null, EventPosition.START)));
    }

    @Test
    void testJwtConfigLifecycle() {
        JwtConfigWriteModel model = new JwtConfigWriteModel("inst", "org1", "idp-1");
        JsonObject id = new JsonObject().put("idpConfigId", "idp-1");

        model.reduceAll(List.of(
            orgEvent(1, "org.added", new JsonObject().put("name", "acme")),
            orgEvent(2, "org.idp.jwt.config.added", id.copy()
                .put("jwtEndpoint", "https://jwt").put("issuer", "https://issuer")
                .put("keysEndpoint", "https://keys").put("headerName", "x-auth")),
            orgEvent(3, "org.idp.jwt.config.changed", id.copy().put("issuer", "https://issuer2")),
            orgEvent(4, "org.idp.config.deactivated", id.copy()),
            orgEvent(5, "org.idp.config.deactivated", new JsonObject().put("idpConfigId", "idp-2"))));

        assertEquals(IdpConfigState.INACTIVE, model.getState());
        assertEquals("https://issuer2", model.getIssuer());
        assertEquals("https://keys", model.getKeysEndpoint());
        assertEquals(5, model.getProcessedSequence());

        model.reduce(orgEvent(6, "org.idp.config.reactivated", id.copy()));
        assertEquals(IdpConfigState.ACTIVE, model.getState());
        model.reduce(orgEvent(7, "org.idp.config.removed", id.copy()));
        assertEquals(IdpConfigState.REMOVED, model.getState());
        assertFalse(model.exists());
    }
}
