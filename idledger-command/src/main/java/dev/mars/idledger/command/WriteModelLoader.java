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

import dev.mars.idledger.api.event.EventLog;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Loads write models by querying their stream from the event log and folding it.
 */
public class WriteModelLoader {
    private static final Logger logger = LoggerFactory.getLogger(WriteModelLoader.class);

    private final EventLog eventLog;

    public WriteModelLoader(EventLog eventLog) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog cannot be null");
    }

    public <M extends WriteModel> Future<M> load(M model) {
        return eventLog.query(model.filter())
            .map(events -> {
                model.reduceAll(events);
                logger.debug("Loaded {} for {}/{} at sequence {}", model.getClass().getSimpleName(),
                    model.getAggregateType(), model.getAggregateId(), model.getProcessedSequence());
                return model;
            });
    }
}
