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

import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.projection.statement.NoOpStatement;
import dev.mars.idledger.projection.statement.Statement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A read model derived from the event log.
 *
 * <p>A projection declares which events it consumes through its {@link #reducers()}. The
 * {@link dev.mars.idledger.projection.runner.ProjectionRunner} fetches those events in log order,
 * reduces each one to a {@link Statement} and executes the statements together with the new
 * position of the projection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public interface Projection {

    /**
     * Unique name, also the key of the projection's position.
     */
    String name();

    List<AggregateReducer> reducers();

    /**
     * Reduces one event. Events without a registered reducer yield a {@link NoOpStatement}.
     */
    default Statement reduce(StoredEvent event) {
        for (AggregateReducer aggregate : reducers()) {
            if (!aggregate.aggregateType().equals(event.aggregateType())) {
                continue;
            }
            for (EventReducer reducer : aggregate.eventReducers()) {
                if (event.isOfType(reducer.eventType())) {
                    return reducer.reduce(event);
                }
            }
        }
        return new NoOpStatement(event);
    }

    default Set<String> aggregateTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (AggregateReducer aggregate : reducers()) {
            types.add(aggregate.aggregateType());
        }
        return types;
    }

    default Set<String> eventTypes() {
        Set<String> types = new LinkedHashSet<>();
        for (AggregateReducer aggregate : reducers()) {
            for (EventReducer reducer : aggregate.eventReducers()) {
                types.add(reducer.eventType());
            }
        }
        return types;
    }
}
