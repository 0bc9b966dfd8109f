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
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import dev.mars.idledger.domain.UniqueTypes;
import dev.mars.idledger.domain.org.OrgAddedPayload;
import dev.mars.idledger.domain.org.OrgEventTypes;
import dev.mars.idledger.domain.org.OrgRemovedPayload;
import io.vertx.core.Future;

import java.util.List;

/**
 * Commands on organizations. Organization names are unique per instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class OrgCommands extends CommandHandler {

    public OrgCommands(EventLog eventLog, IdGenerator idGenerator, IdLedgerMetrics metrics) {
        super(eventLog, idGenerator, metrics);
    }

    public Future<ObjectDetails> addOrg(String instanceId, String name, String editorUser) {
        return execute("addOrg", () -> {
            requireInstance(instanceId);
            String orgName = required(name, "name");
            String orgId = idGenerator.next();

            OrgWriteModel model = new OrgWriteModel(instanceId, orgId);
            return loader.load(model).compose(org -> {
                if (org.getProcessedSequence() > 0) {
                    return Future.failedFuture(IdLedgerException.alreadyExists(
                        IdLedgerErrorCodes.ORG_INVALID, "Organization id already in use: " + orgId));
                }
                EventDraft added = EventDraft.of(OrgEventTypes.ORG_ADDED, orgId, new OrgAddedPayload(orgName))
                    .withEditor(editorUser)
                    .withUniqueConstraint(UniqueConstraint.add(UniqueTypes.ORG_NAME, orgName,
                        "Organization name already taken: " + orgName));
                return push(org, orgId, List.of(added));
            });
        });
    }

    public Future<ObjectDetails> removeOrg(String instanceId, String orgId, String editorUser) {
        return execute("removeOrg", () -> {
            requireInstance(instanceId);
            required(orgId, "orgId");

            return loader.load(new OrgWriteModel(instanceId, orgId)).compose(org -> {
                if (!org.exists()) {
                    return Future.failedFuture(IdLedgerException.notFound(
                        IdLedgerErrorCodes.ORG_NOT_FOUND, "Organization not found: " + orgId));
                }
                EventDraft removed = EventDraft.of(OrgEventTypes.ORG_REMOVED, orgId, new OrgRemovedPayload(org.getName()))
                    .withEditor(editorUser)
                    .withUniqueConstraint(UniqueConstraint.remove(UniqueTypes.ORG_NAME, org.getName()));
                return push(org, orgId, List.of(removed));
            });
        });
    }
}
