package dev.mars.idledger.command.idp;

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
import dev.mars.idledger.api.error.IdLedgerErrorCodes;
import dev.mars.idledger.api.event.EventFilter;
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.command.ObjectDetails;
import dev.mars.idledger.command.WriteModelLoader;
import dev.mars.idledger.command.org.OrgCommands;
import dev.mars.idledger.domain.idp.IdpConfigEventTypes;
import dev.mars.idledger.domain.idp.IdpConfigState;
import dev.mars.idledger.domain.idp.IdpStylingType;
import dev.mars.idledger.domain.idp.IdpType;
import dev.mars.idledger.eventstore.InMemoryEventLog;
import dev.mars.idledger.test.categories.TestCategories;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.mars.idledger.command.CommandTestSupport.failed;
import static dev.mars.idledger.command.CommandTestSupport.sequentialIds;
import static dev.mars.idledger.command.CommandTestSupport.succeeded;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class IdpConfigCommandsTest {

    private static final String INSTANCE = "inst-1";

    private InMemoryEventLog eventLog;
    private OrgCommands orgs;
    private IdpConfigCommands idps;
    private String orgId;

    @BeforeEach
    void setUp() {
        eventLog = new InMemoryEventLog();
        orgs = new OrgCommands(eventLog, sequentialIds("org"), null);
        idps = new IdpConfigCommands(eventLog, sequentialIds("idp"), null);
        orgId = succeeded(orgs.addOrg(INSTANCE, "acme", "admin")).id();
    }

    private static IdpConfigCommands.AddJwtIdpConfig jwtRequest(String name) {
        return new IdpConfigCommands.AddJwtIdpConfig(name, IdpStylingType.GOOGLE, true,
            "https://jwt.acme.test/token", "https://issuer.acme.test", "https://jwt.acme.test/keys", "x-auth");
    }

    private List<StoredEvent> orgStream() {
        return succeeded(eventLog.query(EventFilter.forAggregate(INSTANCE, "org", orgId)));
    }

    private IdpConfigWriteModel config(String idpConfigId) {
        return succeeded(new WriteModelLoader(eventLog).load(new IdpConfigWriteModel(INSTANCE, orgId, idpConfigId)));
    }

    @Test
    void testAddJwtConfigAppendsBothEventsAtomically() {
        ObjectDetails details = succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));

        assertEquals("idp-1", details.id());
        assertEquals(3, details.sequence());

        List<StoredEvent> events = orgStream();
        assertEquals(IdpConfigEventTypes.CONFIG_ADDED, events.get(1).eventType());
        assertEquals(IdpConfigEventTypes.JWT_CONFIG_ADDED, events.get(2).eventType());
        assertEquals("idp-1", events.get(2).payload().getString("idpConfigId"));
        assertEquals("x-auth", events.get(2).payload().getString("headerName"));

        IdpConfigWriteModel model = config("idp-1");
        assertEquals(IdpType.JWT, model.getIdpType());
        assertEquals(IdpStylingType.GOOGLE, model.getStylingType());
        assertEquals(IdpConfigState.ACTIVE, model.getState());
    }

    @Test
    void testConfigNameIsUniquePerOrganization() {
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));

        failed(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"), ErrorKind.ALREADY_EXISTS);
        assertEquals(3, orgStream().size());

        String otherOrg = succeeded(orgs.addOrg(INSTANCE, "globex", "admin")).id();
        succeeded(idps.addJwtIdpConfig(INSTANCE, otherOrg, jwtRequest("corporate"), "admin"));
    }

    @Test
    void testAddToMissingOrganizationFails() {
        assertEquals(IdLedgerErrorCodes.ORG_NOT_FOUND,
            failed(idps.addJwtIdpConfig(INSTANCE, "missing", jwtRequest("corporate"), "admin"), ErrorKind.NOT_FOUND).getCode());
        failed(idps.addJwtIdpConfig(INSTANCE, orgId,
            new IdpConfigCommands.AddJwtIdpConfig("corporate", null, false, " ", "iss", "keys", "h"), "admin"),
            ErrorKind.INVALID_ARGUMENT);
    }

    @Test
    void testChangeJwtConfigWritesOnlyChangedFields() {
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));

        succeeded(idps.changeJwtConfig(INSTANCE, orgId, "idp-1", new IdpConfigCommands.ChangeJwtConfig(
            "https://jwt.acme.test/token", "https://new-issuer.acme.test", "https://jwt.acme.test/keys", "x-auth"), "admin"));

        JsonObject payload = orgStream().get(3).payload();
        assertEquals(IdpConfigEventTypes.JWT_CONFIG_CHANGED, orgStream().get(3).eventType());
        assertEquals("https://new-issuer.acme.test", payload.getString("issuer"));
        assertFalse(payload.containsKey("jwtEndpoint"));
        assertFalse(payload.containsKey("keysEndpoint"));
        assertFalse(payload.containsKey("headerName"));

        assertEquals(IdLedgerErrorCodes.IDP_CONFIG_NOT_CHANGED,
            failed(idps.changeJwtConfig(INSTANCE, orgId, "idp-1", new IdpConfigCommands.ChangeJwtConfig(
                "https://jwt.acme.test/token", "https://new-issuer.acme.test", "https://jwt.acme.test/keys", "x-auth"), "admin"),
                ErrorKind.PRECONDITION_FAILED).getCode());
        assertEquals(IdLedgerErrorCodes.JWT_CONFIG_NOT_FOUND,
            failed(idps.changeJwtConfig(INSTANCE, orgId, "idp-9", new IdpConfigCommands.ChangeJwtConfig(
                "a", "b", "c", "d"), "admin"), ErrorKind.NOT_FOUND).getCode());
    }

    @Test
    void testRenameMovesNameReservation() {
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));

        succeeded(idps.changeIdpConfig(INSTANCE, orgId, "idp-1",
            new IdpConfigCommands.ChangeIdpConfig("partners", IdpStylingType.GOOGLE, true), "admin"));

        JsonObject payload = orgStream().get(3).payload();
        assertEquals("partners", payload.getString("name"));
        assertEquals("corporate", payload.getString("oldName"));
        assertFalse(payload.containsKey("stylingType"));
        assertFalse(payload.containsKey("autoRegister"));
        assertEquals("partners", config("idp-1").getName());

        // the old name is free again, the new one is taken
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));
        failed(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("partners"), "admin"), ErrorKind.ALREADY_EXISTS);

        failed(idps.changeIdpConfig(INSTANCE, orgId, "idp-1",
            new IdpConfigCommands.ChangeIdpConfig("partners", IdpStylingType.GOOGLE, true), "admin"),
            ErrorKind.PRECONDITION_FAILED);
    }

    @Test
    void testDeactivateReactivateLifecycle() {
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));

        assertEquals(IdLedgerErrorCodes.IDP_CONFIG_NOT_INACTIVE,
            failed(idps.reactivateIdpConfig(INSTANCE, orgId, "idp-1", "admin"), ErrorKind.PRECONDITION_FAILED).getCode());

        succeeded(idps.deactivateIdpConfig(INSTANCE, orgId, "idp-1", "admin"));
        assertEquals(IdpConfigState.INACTIVE, config("idp-1").getState());
        assertEquals(IdLedgerErrorCodes.IDP_CONFIG_NOT_ACTIVE,
            failed(idps.deactivateIdpConfig(INSTANCE, orgId, "idp-1", "admin"), ErrorKind.PRECONDITION_FAILED).getCode());

        succeeded(idps.reactivateIdpConfig(INSTANCE, orgId, "idp-1", "admin"));
        assertEquals(IdpConfigState.ACTIVE, config("idp-1").getState());
    }

    @Test
    void testRemovedConfigIsNotFound() {
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));
        succeeded(idps.removeIdpConfig(INSTANCE, orgId, "idp-1", "admin"));

        failed(idps.removeIdpConfig(INSTANCE, orgId, "idp-1", "admin"), ErrorKind.NOT_FOUND);
        failed(idps.deactivateIdpConfig(INSTANCE, orgId, "idp-1", "admin"), ErrorKind.NOT_FOUND);
        failed(idps.changeJwtConfig(INSTANCE, orgId, "idp-1",
            new IdpConfigCommands.ChangeJwtConfig("a", "b", "c", "d"), "admin"), ErrorKind.NOT_FOUND);

        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));
    }

    @Test
    void testRemovingOrganizationRemovesItsConfigs() {
        succeeded(idps.addJwtIdpConfig(INSTANCE, orgId, jwtRequest("corporate"), "admin"));
        succeeded(orgs.removeOrg(INSTANCE, orgId, "admin"));

        assertEquals(IdpConfigState.REMOVED, config("idp-1").getState());
        failed(idps.deactivateIdpConfig(INSTANCE, orgId, "idp-1", "admin"), ErrorKind.NOT_FOUND);
    }
}
