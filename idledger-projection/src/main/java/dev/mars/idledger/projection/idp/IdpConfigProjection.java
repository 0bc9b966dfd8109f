package dev.mars.idledger.projection.idp;

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
import dev.mars.idledger.domain.idp.IdpConfigAddedPayload;
import dev.mars.idledger.domain.idp.IdpConfigChangedPayload;
import dev.mars.idledger.domain.idp.IdpConfigEventTypes;
import dev.mars.idledger.domain.idp.IdpConfigIdPayload;
import dev.mars.idledger.domain.idp.IdpConfigRemovedPayload;
import dev.mars.idledger.domain.idp.IdpConfigState;
import dev.mars.idledger.domain.idp.IdpStylingType;
import dev.mars.idledger.domain.idp.IdpType;
import dev.mars.idledger.domain.idp.JwtConfigAddedPayload;
import dev.mars.idledger.domain.idp.JwtConfigChangedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;
import dev.mars.idledger.projection.AggregateReducer;
import dev.mars.idledger.projection.EventReducer;
import dev.mars.idledger.projection.Projection;
import dev.mars.idledger.projection.statement.Column;
import dev.mars.idledger.projection.statement.Condition;
import dev.mars.idledger.projection.statement.CreateStatement;
import dev.mars.idledger.projection.statement.DeleteStatement;
import dev.mars.idledger.projection.statement.Statement;
import dev.mars.idledger.projection.statement.UpdateStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Read model of the identity-provider configurations of organizations, one row per
 * configuration with its JWT settings inlined.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class IdpConfigProjection implements Projection {

    public static final String NAME = "projections.idp_configs";
    public static final String TABLE = "projections.idp_configs";

    public static final String ID = "id";
    public static final String INSTANCE_ID = "instance_id";
    public static final String RESOURCE_OWNER = "resource_owner";
    public static final String CREATION_DATE = "creation_date";
    public static final String CHANGE_DATE = "change_date";
    public static final String SEQUENCE = "sequence";
    public static final String STATE = "state";
    public static final String NAME_COLUMN = "name";
    public static final String IDP_TYPE = "idp_type";
    public static final String STYLING_TYPE = "styling_type";
    public static final String AUTO_REGISTER = "auto_register";
    public static final String JWT_ENDPOINT = "jwt_endpoint";
    public static final String ISSUER = "issuer";
    public static final String KEYS_ENDPOINT = "keys_endpoint";
    public static final String HEADER_NAME = "header_name";
    public static final String OWNER_REMOVED = "owner_removed";

    private final List<AggregateReducer> reducers = List.of(
        new AggregateReducer(AggregateTypes.ORG, List.of(
            new EventReducer(IdpConfigEventTypes.CONFIG_ADDED, this::reduceAdded),
            new EventReducer(IdpConfigEventTypes.CONFIG_CHANGED, this::reduceChanged),
            new EventReducer(IdpConfigEventTypes.CONFIG_DEACTIVATED, event -> reduceState(event, IdpConfigState.INACTIVE)),
            new EventReducer(IdpConfigEventTypes.CONFIG_REACTIVATED, event -> reduceState(event, IdpConfigState.ACTIVE)),
            new EventReducer(IdpConfigEventTypes.CONFIG_REMOVED, this::reduceRemoved),
            new EventReducer(IdpConfigEventTypes.JWT_CONFIG_ADDED, this::reduceJwtAdded),
            new EventReducer(IdpConfigEventTypes.JWT_CONFIG_CHANGED, this::reduceJwtChanged),
            new EventReducer(OrgEventTypes.ORG_REMOVED, this::reduceOrgRemoved))));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<AggregateReducer> reducers() {
        return reducers;
    }

    Statement reduceAdded(StoredEvent event) {
        IdpConfigAddedPayload payload = event.payloadAs(IdpConfigAddedPayload.class);
        IdpType idpType = payload.idpType() != null ? payload.idpType() : IdpType.UNSPECIFIED;
        IdpStylingType stylingType = payload.stylingType() != null ? payload.stylingType() : IdpStylingType.UNSPECIFIED;
        return new CreateStatement(event, TABLE, List.of(
                Column.of(ID, requireId(payload.idpConfigId())),
                Column.of(CREATION_DATE, event.creationDate()),
                Column.of(CHANGE_DATE, event.creationDate()),
                Column.of(SEQUENCE, event.sequence()),
                Column.of(RESOURCE_OWNER, event.resourceOwner()),
                Column.of(INSTANCE_ID, event.instanceId()),
                Column.of(STATE, IdpConfigState.ACTIVE.value()),
                Column.of(NAME_COLUMN, payload.name()),
                Column.of(IDP_TYPE, idpType.value()),
                Column.of(STYLING_TYPE, stylingType.value()),
                Column.of(AUTO_REGISTER, payload.autoRegister()),
                Column.of(OWNER_REMOVED, false)),
            List.of(INSTANCE_ID, ID));
    }

    Statement reduceChanged(StoredEvent event) {
        IdpConfigChangedPayload payload = event.payloadAs(IdpConfigChangedPayload.class);
        List<Column> values = changeColumns(event);
        if (payload.name() != null) {
            values.add(Column.of(NAME_COLUMN, payload.name()));
        }
        if (payload.stylingType() != null) {
            values.add(Column.of(STYLING_TYPE, payload.stylingType().value()));
        }
        if (payload.autoRegister() != null) {
            values.add(Column.of(AUTO_REGISTER, payload.autoRegister()));
        }
        return new UpdateStatement(event, TABLE, values, configOf(event, payload.idpConfigId()));
    }

    Statement reduceState(StoredEvent event, IdpConfigState state) {
        IdpConfigIdPayload payload = event.payloadAs(IdpConfigIdPayload.class);
        List<Column> values = changeColumns(event);
        values.add(Column.of(STATE, state.value()));
        return new UpdateStatement(event, TABLE, values, configOf(event, payload.idpConfigId()));
    }

    Statement reduceRemoved(StoredEvent event) {
        IdpConfigRemovedPayload payload = event.payloadAs(IdpConfigRemovedPayload.class);
        return new DeleteStatement(event, TABLE, configOf(event, payload.idpConfigId()));
    }

    Statement reduceJwtAdded(StoredEvent event) {
        JwtConfigAddedPayload payload = event.payloadAs(JwtConfigAddedPayload.class);
        List<Column> values = changeColumns(event);
        values.add(Column.of(JWT_ENDPOINT, payload.jwtEndpoint()));
        values.add(Column.of(ISSUER, payload.issuer()));
        values.add(Column.of(KEYS_ENDPOINT, payload.keysEndpoint()));
        values.add(Column.of(HEADER_NAME, payload.headerName()));
        return new UpdateStatement(event, TABLE, values, configOf(event, payload.idpConfigId()));
    }

    Statement reduceJwtChanged(StoredEvent event) {
        JwtConfigChangedPayload payload = event.payloadAs(JwtConfigChangedPayload.class);
        List<Column> values = changeColumns(event);
        if (payload.jwtEndpoint() != null) {
            values.add(Column.of(JWT_ENDPOINT, payload.jwtEndpoint()));
        }
        if (payload.issuer() != null) {
            values.add(Column.of(ISSUER, payload.issuer()));
        }
        if (payload.keysEndpoint() != null) {
            values.add(Column.of(KEYS_ENDPOINT, payload.keysEndpoint()));
        }
        if (payload.headerName() != null) {
            values.add(Column.of(HEADER_NAME, payload.headerName()));
        }
        return new UpdateStatement(event, TABLE, values, configOf(event, payload.idpConfigId()));
    }

    Statement reduceOrgRemoved(StoredEvent event) {
        List<Column> values = changeColumns(event);
        values.add(Column.of(OWNER_REMOVED, true));
        return new UpdateStatement(event, TABLE, values, List.of(
            Condition.eq(RESOURCE_OWNER, event.aggregateId()),
            Condition.eq(INSTANCE_ID, event.instanceId())));
    }

    private static List<Column> changeColumns(StoredEvent event) {
        List<Column> values = new ArrayList<>();
        values.add(Column.of(CHANGE_DATE, event.creationDate()));
        values.add(Column.of(SEQUENCE, event.sequence()));
        return values;
    }

    private static List<Condition> configOf(StoredEvent event, String idpConfigId) {
        return List.of(
            Condition.eq(ID, requireId(idpConfigId)),
            Condition.eq(INSTANCE_ID, event.instanceId()));
    }

    private static String requireId(String idpConfigId) {
        if (idpConfigId == null) {
            throw new IllegalArgumentException("idpConfigId is missing");
        }
        return idpConfigId;
    }
}
