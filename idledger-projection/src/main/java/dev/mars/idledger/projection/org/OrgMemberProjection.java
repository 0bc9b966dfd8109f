package dev.mars.idledger.projection.org;

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

import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.domain.AggregateTypes;
import dev.mars.idledger.domain.org.MemberAddedPayload;
import dev.mars.idledger.domain.org.MemberChangedPayload;
import dev.mars.idledger.domain.org.MemberRemovedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;
import dev.mars.idledger.domain.user.UserEventTypes;
import dev.mars.idledger.projection.AggregateReducer;
import dev.mars.idledger.projection.EventReducer;
import dev.mars.idledger.projection.Projection;
import dev.mars.idledger.projection.statement.Column;
import dev.mars.idledger.projection.statement.Condition;
import dev.mars.idledger.projection.statement.CreateStatement;
import dev.mars.idledger.projection.statement.DeleteStatement;
import dev.mars.idledger.projection.statement.MultiStatement;
import dev.mars.idledger.projection.statement.Statement;
import dev.mars.idledger.projection.statement.UpdateStatement;

import java.util.List;

/**
 * Read model of organization memberships, one row per (instance, organization, user).
 *
 * <p>Rows are not deleted when their organization is removed: {@code owner_removed} marks rows
 * of the removed organization and {@code owner_removed_user} marks rows whose user belongs to
 * it. Readers filter on both columns.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class OrgMemberProjection implements Projection {

    public static final String NAME = "projections.org_members";
    public static final String TABLE = "projections.org_members";

    public static final String ORG_ID = "org_id";
    public static final String USER_ID = "user_id";
    public static final String USER_RESOURCE_OWNER = "user_resource_owner";
    public static final String OWNER_REMOVED_USER = "owner_removed_user";
    public static final String ROLES = "roles";
    public static final String CREATION_DATE = "creation_date";
    public static final String CHANGE_DATE = "change_date";
    public static final String SEQUENCE = "sequence";
    public static final String RESOURCE_OWNER = "resource_owner";
    public static final String INSTANCE_ID = "instance_id";
    public static final String OWNER_REMOVED = "owner_removed";

    private final List<AggregateReducer> reducers = List.of(
        new AggregateReducer(AggregateTypes.ORG, List.of(
            new EventReducer(OrgEventTypes.MEMBER_ADDED, this::reduceAdded),
            new EventReducer(OrgEventTypes.MEMBER_CHANGED, this::reduceChanged),
            new EventReducer(OrgEventTypes.MEMBER_REMOVED, this::reduceRemoved),
            new EventReducer(OrgEventTypes.MEMBER_CASCADE_REMOVED, this::reduceRemoved),
            new EventReducer(OrgEventTypes.ORG_REMOVED, this::reduceOrgRemoved))),
        new AggregateReducer(AggregateTypes.USER, List.of(
            new EventReducer(UserEventTypes.USER_REMOVED, this::reduceUserRemoved))));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<AggregateReducer> reducers() {
        return reducers;
    }

    Statement reduceAdded(StoredEvent event) {
        MemberAddedPayload payload = event.payloadAs(MemberAddedPayload.class);
        String userResourceOwner = payload.userResourceOwner() != null
            ? payload.userResourceOwner()
            : event.resourceOwner();
        return new CreateStatement(event, TABLE, List.of(
                Column.of(USER_ID, payload.userId()),
                Column.of(USER_RESOURCE_OWNER, userResourceOwner),
                Column.of(OWNER_REMOVED_USER, false),
                Column.of(ROLES, payload.roles()),
                Column.of(CREATION_DATE, event.creationDate()),
                Column.of(CHANGE_DATE, event.creationDate()),
                Column.of(SEQUENCE, event.sequence()),
                Column.of(RESOURCE_OWNER, event.resourceOwner()),
                Column.of(INSTANCE_ID, event.instanceId()),
                Column.of(OWNER_REMOVED, false),
                Column.of(ORG_ID, event.aggregateId())),
            List.of(INSTANCE_ID, ORG_ID, USER_ID));
    }

    Statement reduceChanged(StoredEvent event) {
        MemberChangedPayload payload = event.payloadAs(MemberChangedPayload.class);
        return new UpdateStatement(event, TABLE,
            List.of(
                Column.of(ROLES, payload.roles()),
                Column.of(CHANGE_DATE, event.creationDate()),
                Column.of(SEQUENCE, event.sequence())),
            memberOf(event, payload.userId()));
    }

    Statement reduceRemoved(StoredEvent event) {
        MemberRemovedPayload payload = event.payloadAs(MemberRemovedPayload.class);
        return new DeleteStatement(event, TABLE, memberOf(event, payload.userId()));
    }

    Statement reduceUserRemoved(StoredEvent event) {
        return new DeleteStatement(event, TABLE, List.of(
            Condition.eq(USER_ID, event.aggregateId()),
            Condition.eq(INSTANCE_ID, event.instanceId())));
    }

    Statement reduceOrgRemoved(StoredEvent event) {
        return new MultiStatement(event, List.of(
            new UpdateStatement(event, TABLE,
                List.of(
                    Column.of(CHANGE_DATE, event.creationDate()),
                    Column.of(SEQUENCE, event.sequence()),
                    Column.of(OWNER_REMOVED, true)),
                List.of(
                    Condition.eq(RESOURCE_OWNER, event.aggregateId()),
                    Condition.eq(INSTANCE_ID, event.instanceId()))),
            new UpdateStatement(event, TABLE,
                List.of(
                    Column.of(CHANGE_DATE, event.creationDate()),
                    Column.of(SEQUENCE, event.sequence()),
                    Column.of(OWNER_REMOVED_USER, true)),
                List.of(
                    Condition.eq(USER_RESOURCE_OWNER, event.aggregateId()),
                    Condition.eq(INSTANCE_ID, event.instanceId())))));
    }

    private static List<Condition> memberOf(StoredEvent event, String userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId is missing");
        }
        return List.of(
            Condition.eq(USER_ID, userId),
            Condition.eq(ORG_ID, event.aggregateId()),
            Condition.eq(INSTANCE_ID, event.instanceId()));
    }
}
