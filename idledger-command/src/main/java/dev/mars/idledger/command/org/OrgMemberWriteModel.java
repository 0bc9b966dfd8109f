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

import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.command.WriteModel;
import dev.mars.idledger.domain.AggregateTypes;
import dev.mars.idledger.domain.org.MemberAddedPayload;
import dev.mars.idledger.domain.org.MemberChangedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;
import dev.mars.idledger.domain.org.OrgState;

import java.util.List;

/**
 * Membership of one user in one organization, folded from the organization's stream together
 * with the organization's own lifecycle.
 */
public class OrgMemberWriteModel extends WriteModel {

    private final String userId;

    private OrgState orgState = OrgState.UNSPECIFIED;
    private boolean member;
    private List<String> roles = List.of();

    public OrgMemberWriteModel(String instanceId, String orgId, String userId) {
        super(instanceId, AggregateTypes.ORG, orgId);
        this.userId = userId;

        on(OrgEventTypes.ORG_ADDED, event -> orgState = OrgState.ACTIVE);
        on(OrgEventTypes.ORG_REMOVED, event -> orgState = OrgState.REMOVED);
        on(OrgEventTypes.MEMBER_ADDED, MemberAddedPayload.class, (event, payload) -> {
            member = true;
            roles = payload.roles();
        });
        on(OrgEventTypes.MEMBER_CHANGED, MemberChangedPayload.class, (event, payload) -> roles = payload.roles());
        on(OrgEventTypes.MEMBER_REMOVED, event -> removeMember());
        on(OrgEventTypes.MEMBER_CASCADE_REMOVED, event -> removeMember());
    }

    private void removeMember() {
        member = false;
        roles = List.of();
    }

    @Override
    protected boolean accepts(StoredEvent event) {
        if (event.isOfType(OrgEventTypes.ORG_ADDED) || event.isOfType(OrgEventTypes.ORG_REMOVED)) {
            return true;
        }
        return userId.equals(event.payload().getString("userId"));
    }

    /**
     * True if the organization is active and the user is a member of it.
     */
    @Override
    public boolean exists() {
        return isOrgActive() && member;
    }

    public boolean isOrgActive() {
        return orgState == OrgState.ACTIVE;
    }

    public String getUserId() {
        return userId;
    }

    public List<String> getRoles() {
        return roles;
    }
}
