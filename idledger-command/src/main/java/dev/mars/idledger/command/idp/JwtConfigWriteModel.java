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
import dev.mars.idledger.domain.idp.IdpConfigEventTypes;
import dev.mars.idledger.domain.idp.IdpConfigState;
import dev.mars.idledger.domain.idp.JwtConfigAddedPayload;
import dev.mars.idledger.domain.idp.JwtConfigChangedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;

/**
 * JWT settings of one identity-provider configuration. The lifecycle follows the
 * configuration it belongs to.
 */
public class JwtConfigWriteModel extends WriteModel {

    private final String idpConfigId;

    private String jwtEndpoint;
    private String issuer;
    private String keysEndpoint;
    private String headerName;
    private IdpConfigState state = IdpConfigState.UNSPECIFIED;

    public JwtConfigWriteModel(String instanceId, String orgId, String idpConfigId) {
        super(instanceId, AggregateTypes.ORG, orgId);
        this.idpConfigId = idpConfigId;

        on(IdpConfigEventTypes.JWT_CONFIG_ADDED, JwtConfigAddedPayload.class, (event, payload) -> {
            jwtEndpoint = payload.jwtEndpoint();
            issuer = payload.issuer();
            keysEndpoint = payload.keysEndpoint();
            headerName = payload.headerName();
            state = IdpConfigState.ACTIVE;
        });
        on(IdpConfigEventTypes.JWT_CONFIG_CHANGED, JwtConfigChangedPayload.class, (event, payload) -> {
            if (payload.jwtEndpoint() != null) {
                jwtEndpoint = payload.jwtEndpoint();
            }
            if (payload.issuer() != null) {
                issuer = payload.issuer();
            }
            if (payload.keysEndpoint() != null) {
                keysEndpoint = payload.keysEndpoint();
            }
            if (payload.headerName() != null) {
                headerName = payload.headerName();
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

    public String getJwtEndpoint() {
        return jwtEndpoint;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getKeysEndpoint() {
        return keysEndpoint;
    }

    public String getHeaderName() {
        return headerName;
    }

    public IdpConfigState getState() {
        return state;
    }
}
