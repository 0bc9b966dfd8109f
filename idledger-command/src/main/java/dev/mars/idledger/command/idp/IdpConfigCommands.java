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
import io.vertx.core.Future;

import java.util.List;
import java.util.Objects;

/**
 * Commands on the JWT identity-provider configurations of an organization.
 *
 * <p>Change commands only write the attributes that differ from the current state, and fail
 * with {@code PRECONDITION_FAILED} when nothing differs. Configuration names are unique per
 * organization.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class IdpConfigCommands extends CommandHandler {

    public record AddJwtIdpConfig(String name,
                                  IdpStylingType stylingType,
                                  boolean autoRegister,
                                  String jwtEndpoint,
                                  String issuer,
                                  String keysEndpoint,
                                  String headerName) {
    }

    public record ChangeIdpConfig(String name, IdpStylingType stylingType, boolean autoRegister) {
    }

    public record ChangeJwtConfig(String jwtEndpoint, String issuer, String keysEndpoint, String headerName) {
    }

    public IdpConfigCommands(EventLog eventLog, IdGenerator idGenerator, IdLedgerMetrics metrics) {
        super(eventLog, idGenerator, metrics);
    }

    /**
     * Adds a configuration of type JWT together with its JWT settings.
     */
    public Future<ObjectDetails> addJwtIdpConfig(String instanceId, String orgId, AddJwtIdpConfig request,
                                                 String editorUser) {
        return execute("addJwtIdpConfig", () -> {
            requireInstance(instanceId);
            required(orgId, "orgId");
            if (request == null) {
                throw IdLedgerException.missingField("request");
            }
            String name = required(request.name(), "name");
            String jwtEndpoint = required(request.jwtEndpoint(), "jwtEndpoint");
            String issuer = required(request.issuer(), "issuer");
            String keysEndpoint = required(request.keysEndpoint(), "keysEndpoint");
            String headerName = required(request.headerName(), "headerName");
            IdpStylingType stylingType = request.stylingType() != null ? request.stylingType() : IdpStylingType.UNSPECIFIED;
            String idpConfigId = idGenerator.next();

            return loader.load(new OrgWriteModel(instanceId, orgId)).compose(org -> {
                if (!org.exists()) {
                    return Future.failedFuture(IdLedgerException.notFound(
                        IdLedgerErrorCodes.ORG_NOT_FOUND, "Organization not found: " + orgId));
                }
                EventDraft configAdded = EventDraft.of(IdpConfigEventTypes.CONFIG_ADDED, orgId,
                        new IdpConfigAddedPayload(idpConfigId, name, IdpType.JWT, stylingType, request.autoRegister()))
                    .withEditor(editorUser)
                    .withUniqueConstraint(UniqueConstraint.add(UniqueTypes.IDP_CONFIG_NAME,
                        UniqueTypes.idpConfigNameKey(orgId, name), "Identity provider name already taken: " + name));
                EventDraft jwtAdded = EventDraft.of(IdpConfigEventTypes.JWT_CONFIG_ADDED, orgId,
                        new JwtConfigAddedPayload(idpConfigId, jwtEndpoint, issuer, keysEndpoint, headerName))
                    .withEditor(editorUser);
                return push(org, idpConfigId, List.of(configAdded, jwtAdded));
            });
        });
    }

    public Future<ObjectDetails> changeIdpConfig(String instanceId, String orgId, String idpConfigId,
                                                 ChangeIdpConfig request, String editorUser) {
        return execute("changeIdpConfig", () -> {
            if (request == null) {
                throw IdLedgerException.missingField("request");
            }
            String name = required(request.name(), "name");
            IdpStylingType stylingType = request.stylingType() != null ? request.stylingType() : IdpStylingType.UNSPECIFIED;

            return loadExistingConfig(instanceId, orgId, idpConfigId).compose(config -> {
                boolean nameChanged = !name.equals(config.getName());
                IdpConfigChangedPayload payload = new IdpConfigChangedPayload(
                    idpConfigId,
                    nameChanged ? name : null,
                    nameChanged ? config.getName() : null,
                    stylingType != config.getStylingType() ? stylingType : null,
                    request.autoRegister() != config.isAutoRegister() ? request.autoRegister() : null);
                if (!payload.hasChanges()) {
                    return Future.failedFuture(IdLedgerException.preconditionFailed(
                        IdLedgerErrorCodes.IDP_CONFIG_NOT_CHANGED, "Identity provider configuration is unchanged"));
                }

                EventDraft changed = EventDraft.of(IdpConfigEventTypes.CONFIG_CHANGED, orgId, payload)
                    .withEditor(editorUser);
                if (nameChanged) {
                    changed = changed
                        .withUniqueConstraint(UniqueConstraint.remove(UniqueTypes.IDP_CONFIG_NAME,
                            UniqueTypes.idpConfigNameKey(orgId, config.getName())))
                        .withUniqueConstraint(UniqueConstraint.add(UniqueTypes.IDP_CONFIG_NAME,
                            UniqueTypes.idpConfigNameKey(orgId, name), "Identity provider name already taken: " + name));
                }
                return push(config, idpConfigId, List.of(changed));
            });
        });
    }

    public Future<ObjectDetails> changeJwtConfig(String instanceId, String orgId, String idpConfigId,
                                                 ChangeJwtConfig request, String editorUser) {
        return execute("changeJwtConfig", () -> {
            requireInstance(instanceId);
            required(orgId, "orgId");
            required(idpConfigId, "idpConfigId");
            if (request == null) {
                throw IdLedgerException.missingField("request");
            }
            String jwtEndpoint = required(request.jwtEndpoint(), "jwtEndpoint");
            String issuer = required(request.issuer(), "issuer");
            String keysEndpoint = required(request.keysEndpoint(), "keysEndpoint");
            String headerName = required(request.headerName(), "headerName");

            return loader.load(new JwtConfigWriteModel(instanceId, orgId, idpConfigId)).compose(jwt -> {
                if (!jwt.exists()) {
                    return Future.failedFuture(IdLedgerException.notFound(
                        IdLedgerErrorCodes.JWT_CONFIG_NOT_FOUND, "JWT configuration not found: " + idpConfigId));
                }
                JwtConfigChangedPayload payload = new JwtConfigChangedPayload(
                    idpConfigId,
                    changedOrNull(jwtEndpoint, jwt.getJwtEndpoint()),
                    changedOrNull(issuer, jwt.getIssuer()),
                    changedOrNull(keysEndpoint, jwt.getKeysEndpoint()),
                    changedOrNull(headerName, jwt.getHeaderName()));
                if (!payload.hasChanges()) {
                    return Future.failedFuture(IdLedgerException.preconditionFailed(
                        IdLedgerErrorCodes.IDP_CONFIG_NOT_CHANGED, "JWT configuration is unchanged"));
                }
                EventDraft changed = EventDraft.of(IdpConfigEventTypes.JWT_CONFIG_CHANGED, orgId, payload)
                    .withEditor(editorUser);
                return push(jwt, idpConfigId, List.of(changed));
            });
        });
    }

    public Future<ObjectDetails> deactivateIdpConfig(String instanceId, String orgId, String idpConfigId,
                                                     String editorUser) {
        return execute("deactivateIdpConfig", () -> loadExistingConfig(instanceId, orgId, idpConfigId).compose(config -> {
            if (config.getState() != IdpConfigState.ACTIVE) {
                return Future.failedFuture(IdLedgerException.preconditionFailed(
                    IdLedgerErrorCodes.IDP_CONFIG_NOT_ACTIVE, "Identity provider configuration is not active"));
            }
            EventDraft deactivated = EventDraft.of(IdpConfigEventTypes.CONFIG_DEACTIVATED, orgId,
                new IdpConfigIdPayload(idpConfigId)).withEditor(editorUser);
            return push(config, idpConfigId, List.of(deactivated));
        }));
    }

    public Future<ObjectDetails> reactivateIdpConfig(String instanceId, String orgId, String idpConfigId,
                                                     String editorUser) {
        return execute("reactivateIdpConfig", () -> loadExistingConfig(instanceId, orgId, idpConfigId).compose(config -> {
            if (config.getState() != IdpConfigState.INACTIVE) {
                return Future.failedFuture(IdLedgerException.preconditionFailed(
                    IdLedgerErrorCodes.IDP_CONFIG_NOT_INACTIVE, "Identity provider configuration is not inactive"));
            }
            EventDraft reactivated = EventDraft.of(IdpConfigEventTypes.CONFIG_REACTIVATED, orgId,
                new IdpConfigIdPayload(idpConfigId)).withEditor(editorUser);
            return push(config, idpConfigId, List.of(reactivated));
        }));
    }

    public Future<ObjectDetails> removeIdpConfig(String instanceId, String orgId, String idpConfigId, String editorUser) {
        return execute("removeIdpConfig", () -> loadExistingConfig(instanceId, orgId, idpConfigId).compose(config -> {
            EventDraft removed = EventDraft.of(IdpConfigEventTypes.CONFIG_REMOVED, orgId,
                    new IdpConfigRemovedPayload(idpConfigId, config.getName()))
                .withEditor(editorUser)
                .withUniqueConstraint(UniqueConstraint.remove(UniqueTypes.IDP_CONFIG_NAME,
                    UniqueTypes.idpConfigNameKey(orgId, config.getName())));
            return push(config, idpConfigId, List.of(removed));
        }));
    }

    private Future<IdpConfigWriteModel> loadExistingConfig(String instanceId, String orgId, String idpConfigId) {
        requireInstance(instanceId);
        required(orgId, "orgId");
        required(idpConfigId, "idpConfigId");
        return loader.load(new IdpConfigWriteModel(instanceId, orgId, idpConfigId)).compose(config -> config.exists()
            ? Future.succeededFuture(config)
            : Future.failedFuture(IdLedgerException.notFound(IdLedgerErrorCodes.IDP_CONFIG_NOT_FOUND,
                "Identity provider configuration not found: " + idpConfigId)));
    }

    private static String changedOrNull(String requested, String current) {
        return Objects.equals(requested, current) ? null : requested;
    }
}
