package dev.mars.idledger.command.user;

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
import dev.mars.idledger.domain.user.HumanAddedPayload;
import dev.mars.idledger.domain.user.UserEventTypes;
import dev.mars.idledger.domain.user.UserState;
import dev.mars.idledger.eventstore.InMemoryEventLog;
import dev.mars.idledger.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.mars.idledger.command.CommandTestSupport.failed;
import static dev.mars.idledger.command.CommandTestSupport.sequentialIds;
import static dev.mars.idledger.command.CommandTestSupport.succeeded;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class UserCommandsTest {

    private static final String INSTANCE = "inst-1";

    private InMemoryEventLog eventLog;
    private UserCommands users;
    private String orgId;

    @BeforeEach
    void setUp() {
        eventLog = new InMemoryEventLog();
        users = new UserCommands(eventLog, sequentialIds("user"), null);
        orgId = succeeded(new OrgCommands(eventLog, sequentialIds("org"), null).addOrg(INSTANCE, "acme", "admin")).id();
    }

    private static UserCommands.AddHumanUser human(String username) {
        return new UserCommands.AddHumanUser(username, "Alice", "Smith", username + "@acme.test");
    }

    private UserWriteModel user(String userId) {
        return succeeded(new WriteModelLoader(eventLog).load(new UserWriteModel(INSTANCE, userId)));
    }

    @Test
    void testAddHumanUserOwnedByOrganization() {
        ObjectDetails details = succeeded(users.addHumanUser(INSTANCE, orgId, human(" alice "), "admin"));

        assertEquals("user-1", details.id());
        assertEquals(orgId, details.resourceOwner());
        assertEquals(1, details.sequence());

        List<StoredEvent> stream = succeeded(eventLog.query(EventFilter.forAggregate(INSTANCE, "user", "user-1")));
        assertEquals(UserEventTypes.HUMAN_ADDED, stream.get(0).eventType());
        assertEquals("alice", stream.get(0).payloadAs(HumanAddedPayload.class).username());
        assertEquals(UserState.ACTIVE, user("user-1").getState());
    }

    @Test
    void testAddHumanUserValidation() {
        failed(users.addHumanUser(INSTANCE, orgId, null, "admin"), ErrorKind.INVALID_ARGUMENT);
        failed(users.addHumanUser(INSTANCE, orgId, new UserCommands.AddHumanUser("bob", "", "Jones", "bob@acme.test"), "admin"),
            ErrorKind.INVALID_ARGUMENT);
        assertEquals(IdLedgerErrorCodes.USER_INVALID,
            failed(users.addHumanUser(INSTANCE, orgId, new UserCommands.AddHumanUser("bob", "Bob", "Jones", "bob"), "admin"),
                ErrorKind.INVALID_ARGUMENT).getCode());
        assertEquals(IdLedgerErrorCodes.ORG_NOT_FOUND,
            failed(users.addHumanUser(INSTANCE, "missing", human("bob"), "admin"), ErrorKind.NOT_FOUND).getCode());
        assertEquals(1, eventLog.size());
    }

    @Test
    void testUsernameIsUniquePerInstance() {
        succeeded(users.addHumanUser(INSTANCE, orgId, human("alice"), "admin"));

        failed(users.addHumanUser(INSTANCE, orgId, human("alice"), "admin"), ErrorKind.ALREADY_EXISTS);

        String otherInstanceOrg = succeeded(new OrgCommands(eventLog, sequentialIds("org"), null)
            .addOrg("inst-2", "acme", "admin")).id();
        succeeded(users.addHumanUser("inst-2", otherInstanceOrg, human("alice"), "admin"));
    }

    @Test
    void testDeactivateReactivatePreconditions() {
        String userId = succeeded(users.addHumanUser(INSTANCE, orgId, human("alice"), "admin")).id();

        assertEquals(IdLedgerErrorCodes.USER_NOT_INACTIVE,
            failed(users.reactivateUser(INSTANCE, userId, "admin"), ErrorKind.PRECONDITION_FAILED).getCode());

        assertEquals(2, succeeded(users.deactivateUser(INSTANCE, userId, "admin")).sequence());
        assertEquals(UserState.INACTIVE, user(userId).getState());
        assertEquals(IdLedgerErrorCodes.USER_NOT_ACTIVE,
            failed(users.deactivateUser(INSTANCE, userId, "admin"), ErrorKind.PRECONDITION_FAILED).getCode());

        succeeded(users.reactivateUser(INSTANCE, userId, "admin"));
        assertEquals(UserState.ACTIVE, user(userId).getState());
    }

    @Test
    void testRemoveUserReleasesUsername() {
        String userId = succeeded(users.addHumanUser(INSTANCE, orgId, human("alice"), "admin")).id();

        succeeded(users.removeUser(INSTANCE, userId, "admin"));

        assertEquals(UserState.REMOVED, user(userId).getState());
        failed(users.removeUser(INSTANCE, userId, "admin"), ErrorKind.NOT_FOUND);
        failed(users.deactivateUser(INSTANCE, "user-404", "admin"), ErrorKind.NOT_FOUND);
        succeeded(users.addHumanUser(INSTANCE, orgId, human("alice"), "admin"));
    }
}
