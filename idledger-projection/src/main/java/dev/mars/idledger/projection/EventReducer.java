package dev.mars.idledger.projection;

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
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.projection.statement.Statement;

import java.util.Objects;
import java.util.function.Function;

/**
 * Turns events of one type into a statement.
 *
 * @param eventType type of the events this reducer accepts
 * @param reducer   pure function of the event
 */
public record EventReducer(String eventType, Function<StoredEvent, Statement> reducer) {

    public EventReducer {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(reducer, "reducer cannot be null");
    }

    /**
     * Reduces an event. Fails with {@code INVALID_ARGUMENT} for events of another type and for
     * payloads that cannot be read.
     */
    public Statement reduce(StoredEvent event) {
        if (!event.isOfType(eventType)) {
            throw IdLedgerException.invalidArgument(IdLedgerErrorCodes.PROJECTION_REDUCE_FAILED,
                "Reducer for " + eventType + " cannot reduce event of type " + event.eventType());
        }
        try {
            return Objects.requireNonNull(reducer.apply(event), "reducer returned no statement");
        } catch (IdLedgerException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw IdLedgerException.invalidArgument(IdLedgerErrorCodes.PROJECTION_REDUCE_FAILED,
                "Cannot reduce " + eventType + " at " + event.aggregateId() + "/" + event.sequence() + ": " + e.getMessage());
        }
    }
}
