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

import dev.mars.idledger.command.WriteModel;
import dev.mars.idledger.domain.AggregateTypes;
import dev.mars.idledger.domain.org.OrgAddedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;
import dev.mars.idledger.domain.org.OrgState;

public class OrgWriteModel extends WriteModel {

    private String name;
    private OrgState state = OrgState.UNSPECIFIED;

    public OrgWriteModel(String instanceId, String orgId) {
        super(instanceId, AggregateTypes.ORG, orgId);
        on(OrgEventTypes.ORG_ADDED, OrgAddedPayload.class, (event, payload) -> {
            name = payload.name();
            state = OrgState.ACTIVE;
        });
        on(OrgEventTypes.ORG_REMOVED, event -> state = OrgState.REMOVED);
    }

    @Override
    public boolean exists() {
        return state == OrgState.ACTIVE;
    }

    public String getName() {
        return name;
    }

    public OrgState getState() {
        return state;
    }
}
