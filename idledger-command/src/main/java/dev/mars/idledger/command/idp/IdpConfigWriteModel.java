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

import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.command.WriteModel;
import dev.mars.idledger.domain.AggregateTypes;
import dev.mars.idledger.domain.idp.IdpConfigAddedPayload;
import dev.mars.idledger.domain.idp.IdpConfigChangedPayload;
import dev.mars.idledger.domain.idp.IdpConfigEventTypes;
import dev.mars.idledger.domain.idp.IdpConfigState;
import dev.mars.idledger.domain.idp.IdpStylingType;
import dev.mars.idledger.domain.idp.IdpType;
import dev.mars.idledger.domain.org.OrgEventTypes;

/**
 * One identity-provider configuration of an organization. Only events carrying this
 * configuration's id change the state; removing the organization removes the configuration.
 */
public class IdpConfigWriteModel extends WriteModel {

    private final String idpConfigId;

    private String name;
    private IdpType idpType = IdpType.UNSPECIFIED;
    private IdpStylingType stylingType = IdpStylingType.UNSPECIFIED;
    private boolean autoRegister;
    private IdpConfigState state = IdpConfigState.UNSPECIFIED;

    public IdpConfigWriteModel(String instanceId, String orgId, String idpConfigId) {
        super(instanceId, AggregateTypes.ORG, orgId);
        this.idpConfigId = idpConfigId;

        on(IdpConfigEventTypes.CONFIG_ADDED, IdpConfigAddedPayload.class, (event, payload) -> {
            name = payload.name();
            idpType = payload.idpType() != null ? payload.idpType() : IdpType.UNSPECIFIED;
            stylingType = payload.stylingType() != null ? payload.stylingType() : IdpStylingType.UNSPECIFIED;
            autoRegister = payload.autoRegister();
            state = IdpConfigState.ACTIVE;
        });
        on(IdpConfigEventTypes.CONFIG_CHANGED, IdpConfigChangedPayload.class, (event, payload) -> {
            if (payload.name() != null) {
                name = payload.name();
            }
            if (payload.stylingType() != null) {
                stylingType = payload.stylingType();
            }
            if (payload.autoRegister() != null) {
                autoRegister = payload.autoRegister();
            }
        });
        on(IdpConfigEventTypes.CONFIG_DEACTIVATED, event -> state = IdpConfigState.INACTIVE);
        on(IdpConfigEventTypes.CONFIG_REACTIVATED, event -> state = IdpConfigState.ACTIVE);
        on(IdpConfigEventTypes.CONFIG_REMOVED, event -> state = IdpConfigState.REMOVED);
        on(OrgEventTypes.ORG_REMOVED, event -> {
            if (state.exists()) {
                state = IdpConfigState.REMOVED;
            }
        });
    }

    @Override
    protected boolean accepts(StoredEvent event) {
        return event.isOfType(OrgEventTypes.ORG_REMOVED)
            || idpConfigId.equals(event.payload().getString("idpConfigId"));
    }

    @Override
    public boolean exists() {
        return state.exists();
    }

    public String getIdpConfigId() {
        return idpConfigId;
    }

    public String getName() {
        return name;
    }

    public IdpType getIdpType() {
        return idpType;
    }

    public IdpStylingType getStylingType() {
        return stylingType;
    }

    public boolean isAutoRegister() {
        return autoRegister;
    }

    public IdpConfigState getState() {
        return state;
    }
}
