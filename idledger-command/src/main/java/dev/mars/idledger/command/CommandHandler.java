package dev.mars.idledger.command;

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

import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.api.event.EventDraft;
import dev.mars.idledger.api.event.EventLog;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Base class of the command handlers.
 *
 * <p>A command loads its write models, checks its preconditions and appends the resulting
 * events after the write model's processed sequence. Failures are reported through the returned
 * future as {@link IdLedgerException}s; handlers never retry, see
 * {@link Commands#retryOnConflict}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public abstract class CommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(CommandHandler.class);

    protected final EventLog eventLog;
    protected final WriteModelLoader loader;
    protected final IdGenerator idGenerator;
    protected final IdLedgerMetrics metrics;

    protected CommandHandler(EventLog eventLog, IdGenerator idGenerator, IdLedgerMetrics metrics) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog cannot be null");
        this.loader = new WriteModelLoader(eventLog);
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
        this.metrics = metrics != null ? metrics : IdLedgerMetrics.noop();
    }

    /**
     * Runs a command, turning exceptions thrown while validating into a failed future and
     * recording the outcome.
     */
    protected <T> Future<T> execute(String command, Supplier<Future<T>> body) {
        Future<T> result;
        try {
            result = body.get();
        } catch (IdLedgerException e) {
            result = Future.failedFuture(e);
        }
        return result
            .onSuccess(value -> {
                logger.debug("Command {} succeeded: {}", command, value);
                metrics.recordCommand(command, "success");
            })
            .onFailure(error -> {
                if (error instanceof IdLedgerException e) {
                    logger.debug("Command {} rejected: {}", command, e.toString());
                    metrics.recordCommand(command, e.getKind().name());
                } else {
                    logger.warn("Command {} failed", command, error);
                    metrics.recordCommand(command, "error");
                }
            });
    }

    /**
     * Appends events after the model's processed sequence and describes the result.
     */
    protected Future<ObjectDetails> push(WriteModel model, String objectId, List<EventDraft> events) {
        return eventLog.append(model.getInstanceId(), model.getAggregateType(), model.getAggregateId(),
                model.getProcessedSequence(), events)
            .map(appended -> ObjectDetails.of(objectId, appended));
    }

    protected static String required(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw IdLedgerException.missingField(fieldName);
        }
        return value.trim();
    }

    protected static void requireInstance(String instanceId) {
        required(instanceId, "instanceId");
    }

    /**
     * Checks that a role list is non-empty and has no blank entries.
     */
    protected static List<String> requiredRoles(Collection<String> roles, String code) {
        if (roles == null || roles.isEmpty()) {
            throw IdLedgerException.invalidArgument(code, "At least one role is required");
        }
        for (String role : roles) {
            if (role == null || role.isBlank()) {
                throw IdLedgerException.invalidArgument(code, "Roles cannot be blank");
            }
        }
        return List.copyOf(roles);
    }
}
