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

import dev.mars.idledger.api.error.IdLedgerErrorCodes;
import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.api.event.EventDraft;
import dev.mars.idledger.api.event.EventLog;
import dev.mars.idledger.api.event.UniqueConstraint;
import dev.mars.idledger.command.CommandHandler;
import dev.mars.idledger.command.IdGenerator;
import dev.mars.idledger.command.ObjectDetails;
import dev.mars.idledger.command.org.OrgWriteModel;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import dev.mars.idledger.domain.UniqueTypes;
import dev.mars.idledger.domain.user.HumanAddedPayload;
import dev.mars.idledger.domain.user.UserEventTypes;
import dev.mars.idledger.domain.user.UserRemovedPayload;
import dev.mars.idledger.domain.user.UserState;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Commands on human users. Usernames are unique per instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class UserCommands extends CommandHandler {

    /**
     * Request to add a human user to an organization.
     */
    public record AddHumanUser(String username, String firstName, String lastName, String email) {
    }

    public UserCommands(EventLog eventLog, IdGenerator idGenerator, IdLedgerMetrics metrics) {
        super(eventLog, idGenerator, metrics);
    }

    public Future<ObjectDetails> addHumanUser(String instanceId, String orgId, AddHumanUser request, String editorUser) {
        return execute("addHumanUser", () -> {
            requireInstance(instanceId);
            required(orgId, "orgId");
            if (request == null) {
                throw IdLedgerException.missingField("request");
            }
            String username = required(request.username(), "username");
            String firstName = required(request.firstName(), "firstName");
            String lastName = required(request.lastName(), "lastName");
            String email = required(request.email(), "email");
            if (!email.contains("@")) {
                throw IdLedgerException.invalidArgument(IdLedgerErrorCodes.USER_INVALID, "Email address is invalid: " + email);
            }
            String userId = idGenerator.next();

            return loader.load(new OrgWriteModel(instanceId, orgId))
                .compose(org -> {
                    if (!org.exists()) {
                        return Future.failedFuture(IdLedgerException.notFound(
                            IdLedgerErrorCodes.ORG_NOT_FOUND, "Organization not found: " + orgId));
                    }
                    return loader.load(new UserWriteModel(instanceId, userId));
                })
                .compose(user -> {
                    if (user.getProcessedSequence() > 0) {
                        return Future.failedFuture(IdLedgerException.alreadyExists(
                            IdLedgerErrorCodes.USER_INVALID, "User id already in use: " + userId));
                    }
                    EventDraft added = EventDraft.of(UserEventTypes.HUMAN_ADDED, orgId,
                            new HumanAddedPayload(username, firstName, lastName, email))
                        .withEditor(editorUser)
                        .withUniqueConstraint(UniqueConstraint.add(UniqueTypes.USERNAME, username,
                            "Username already taken: " + username));
                    return push(user, userId, List.of(added));
                });
        });
    }

    public Future<ObjectDetails> deactivateUser(String instanceId, String userId, String editorUser) {
        return execute("deactivateUser", () -> loadExisting(instanceId, userId).compose(user -> {
            if (user.getState() != UserState.ACTIVE) {
                return Future.failedFuture(IdLedgerException.preconditionFailed(
                    IdLedgerErrorCodes.USER_NOT_ACTIVE, "User is not active: " + userId));
            }
            return push(user, userId, List.of(stateEvent(UserEventTypes.USER_DEACTIVATED, user, editorUser)));
        }));
    }

    public Future<ObjectDetails> reactivateUser(String instanceId, String userId, String editorUser) {
        return execute("reactivateUser", () -> loadExisting(instanceId, userId).compose(user -> {
            if (user.getState() != UserState.INACTIVE) {
                return Future.failedFuture(IdLedgerException.preconditionFailed(
                    IdLedgerErrorCodes.USER_NOT_INACTIVE, "User is not inactive: " + userId));
            }
            return push(user, userId, List.of(stateEvent(UserEventTypes.USER_REACTIVATED, user, editorUser)));
        }));
    }

    public Future<ObjectDetails> removeUser(String instanceId, String userId, String editorUser) {
        return execute("removeUser", () -> loadExisting(instanceId, userId).compose(user -> {
            EventDraft removed = EventDraft.of(UserEventTypes.USER_REMOVED, user.getResourceOwner(),
                    new UserRemovedPayload(user.getUsername()))
                .withEditor(editorUser)
                .withUniqueConstraint(UniqueConstraint.remove(UniqueTypes.USERNAME, user.getUsername()));
            return push(user, userId, List.of(removed));
        }));
    }

    private Future<UserWriteModel> loadExisting(String instanceId, String userId) {
        requireInstance(instanceId);
        required(userId, "userId");
        return loader.load(new UserWriteModel(instanceId, userId)).compose(user -> user.exists()
            ? Future.succeededFuture(user)
            : Future.failedFuture(IdLedgerException.notFound(IdLedgerErrorCodes.USER_NOT_FOUND, "User not found: " + userId)));
    }

    private static EventDraft stateEvent(String eventType, UserWriteModel user, String editorUser) {
        return EventDraft.of(eventType, user.getResourceOwner(), new JsonObject()).withEditor(editorUser);
    }
}
