package dev.mars.idledger.command.org;

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
import dev.mars.idledger.command.user.UserWriteModel;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import dev.mars.idledger.domain.UniqueTypes;
import dev.mars.idledger.domain.org.MemberAddedPayload;
import dev.mars.idledger.domain.org.MemberChangedPayload;
import dev.mars.idledger.domain.org.MemberRemovedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;
import io.vertx.core.Future;

import java.util.HashSet;
import java.util.List;

/**
 * Commands on organization memberships. Membership events are stored on the organization's
 * stream, so concurrent changes to members of the same organization race on one sequence.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class OrgMemberCommands extends CommandHandler {

    public OrgMemberCommands(EventLog eventLog, IdGenerator idGenerator, IdLedgerMetrics metrics) {
        super(eventLog, idGenerator, metrics);
    }

    /**
     * Adds an existing user to an existing organization.
     */
    public Future<ObjectDetails> addOrgMember(String instanceId, String orgId, String userId, List<String> roles,
                                              String editorUser) {
        return execute("addOrgMember", () -> {
            requireInstance(instanceId);
            required(orgId, "orgId");
            required(userId, "userId");
            List<String> memberRoles = requiredRoles(roles, IdLedgerErrorCodes.MEMBER_INVALID);

            return loader.load(new UserWriteModel(instanceId, userId))
                .compose(user -> {
                    if (!user.exists()) {
                        return Future.failedFuture(IdLedgerException.notFound(
                            IdLedgerErrorCodes.USER_NOT_FOUND, "User not found: " + userId));
                    }
                    return loader.load(new OrgMemberWriteModel(instanceId, orgId, userId))
                        .compose(member -> {
                            if (!member.isOrgActive()) {
                                return Future.failedFuture(orgNotFound(orgId));
                            }
                            if (member.exists()) {
                                return Future.failedFuture(IdLedgerException.alreadyExists(
                                    IdLedgerErrorCodes.MEMBER_ALREADY_EXISTS,
                                    "User " + userId + " is already a member of organization " + orgId));
                            }
                            EventDraft added = EventDraft.of(OrgEventTypes.MEMBER_ADDED, orgId,
                                    new MemberAddedPayload(userId, memberRoles, user.getResourceOwner()))
                                .withEditor(editorUser)
                                .withUniqueConstraint(UniqueConstraint.add(UniqueTypes.ORG_MEMBER,
                                    UniqueTypes.orgMemberKey(orgId, userId), "Member already exists"));
                            return push(member, userId, List.of(added));
                        });
                });
        });
    }

    /**
     * Replaces the roles of a member. The new roles must differ from the current ones.
     */
    public Future<ObjectDetails> changeOrgMember(String instanceId, String orgId, String userId, List<String> roles,
                                                 String editorUser) {
        return execute("changeOrgMember", () -> {
            List<String> memberRoles = requiredRoles(roles, IdLedgerErrorCodes.MEMBER_INVALID);
            return loadExistingMember(instanceId, orgId, userId).compose(member -> {
                if (new HashSet<>(member.getRoles()).equals(new HashSet<>(memberRoles))) {
                    return Future.failedFuture(IdLedgerException.preconditionFailed(
                        IdLedgerErrorCodes.MEMBER_NOT_CHANGED, "Member roles are unchanged"));
                }
                EventDraft changed = EventDraft.of(OrgEventTypes.MEMBER_CHANGED, orgId,
                        new MemberChangedPayload(userId, memberRoles))
                    .withEditor(editorUser);
                return push(member, userId, List.of(changed));
            });
        });
    }

    public Future<ObjectDetails> removeOrgMember(String instanceId, String orgId, String userId, String editorUser) {
        return execute("removeOrgMember", () -> remove(instanceId, orgId, userId, OrgEventTypes.MEMBER_REMOVED, editorUser));
    }

    /**
     * Removes a member because the user itself is being removed.
     */
    public Future<ObjectDetails> cascadeRemoveOrgMember(String instanceId, String orgId, String userId, String editorUser) {
        return execute("cascadeRemoveOrgMember",
            () -> remove(instanceId, orgId, userId, OrgEventTypes.MEMBER_CASCADE_REMOVED, editorUser));
    }

    private Future<ObjectDetails> remove(String instanceId, String orgId, String userId, String eventType,
                                         String editorUser) {
        return loadExistingMember(instanceId, orgId, userId).compose(member -> {
            EventDraft removed = EventDraft.of(eventType, orgId, new MemberRemovedPayload(userId))
                .withEditor(editorUser)
                .withUniqueConstraint(UniqueConstraint.remove(UniqueTypes.ORG_MEMBER,
                    UniqueTypes.orgMemberKey(orgId, userId)));
            return push(member, userId, List.of(removed));
        });
    }

    private Future<OrgMemberWriteModel> loadExistingMember(String instanceId, String orgId, String userId) {
        requireInstance(instanceId);
        required(orgId, "orgId");
        required(userId, "userId");
        return loader.load(new OrgMemberWriteModel(instanceId, orgId, userId)).compose(member -> {
            if (!member.isOrgActive()) {
                return Future.failedFuture(orgNotFound(orgId));
            }
            if (!member.exists()) {
                return Future.failedFuture(IdLedgerException.notFound(IdLedgerErrorCodes.MEMBER_NOT_FOUND,
                    "User " + userId + " is not a member of organization " + orgId));
            }
            return Future.succeededFuture(member);
        });
    }

    private static IdLedgerException orgNotFound(String orgId) {
        return IdLedgerException.notFound(IdLedgerErrorCodes.ORG_NOT_FOUND, "Organization not found: " + orgId);
    }
}
