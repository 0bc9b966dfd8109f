package dev.mars.idledger.db.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Micrometer metrics for the event log, command handlers and projections.
 *
 * <p>Until {@link #bindTo(MeterRegistry)} is called every record method is a no-op, so
 * components can always be handed an instance.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class IdLedgerMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(IdLedgerMetrics.class);

    private final String instanceId;
    private volatile MeterRegistry registry;

    // Counters
    private Counter eventsAppended;
    private Counter appendConflicts;
    private Counter projectionEventsApplied;
    private Counter projectionFailures;

    // Timers
    private Timer appendTime;

    public IdLedgerMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    /**
     * An instance that records nothing.
     */
    public static IdLedgerMetrics noop() {
        return new IdLedgerMetrics("noop");
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        eventsAppended = Counter.builder("idledger.events.appended")
            .description("Total number of events appended to the event log")
            .tag("instance", instanceId)
            .register(registry);

        appendConflicts = Counter.builder("idledger.events.conflicts")
            .description("Appends rejected because the expected sequence was stale")
            .tag("instance", instanceId)
            .register(registry);

        projectionEventsApplied = Counter.builder("idledger.projection.events")
            .description("Total number of events applied by projections")
            .tag("instance", instanceId)
            .register(registry);

        projectionFailures = Counter.builder("idledger.projection.failures")
            .description("Projection batches that failed and were rolled back")
            .tag("instance", instanceId)
            .register(registry);

        appendTime = Timer.builder("idledger.events.append.time")
            .description("Time taken to append events")
            .tag("instance", instanceId)
            .register(registry);

        this.registry = registry;
        logger.info("IdLedger metrics registered for instance: {}", instanceId);
    }

    public boolean isBound() {
        return registry != null;
    }

    public void recordAppend(String aggregateType, int eventCount, Duration duration) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        eventsAppended.increment(eventCount);
        appendTime.record(duration);
        Counter.builder("idledger.events.appended.by.aggregate")
            .tag("instance", instanceId)
            .tag("aggregate_type", aggregateType)
            .register(current)
            .increment(eventCount);
    }

    public void recordConflict(String aggregateType) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        appendConflicts.increment();
        Counter.builder("idledger.events.conflicts.by.aggregate")
            .tag("instance", instanceId)
            .tag("aggregate_type", aggregateType)
            .register(current)
            .increment();
    }

    /**
     * @param command name of the command, e.g. {@code addOrgMember}
     * @param outcome {@code success} or the error kind of the failure
     */
    public void recordCommand(String command, String outcome) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        Counter.builder("idledger.commands")
            .description("Commands executed, by outcome")
            .tag("instance", instanceId)
            .tag("command", command)
            .tag("outcome", outcome)
            .register(current)
            .increment();
    }

    public void recordProjectionBatch(String projection, int eventCount, Duration duration) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        projectionEventsApplied.increment(eventCount);
        Timer.builder("idledger.projection.batch.time")
            .tag("instance", instanceId)
            .tag("projection", projection)
            .register(current)
            .record(duration);
    }

    public void recordProjectionFailure(String projection) {
        MeterRegistry current = registry;
        if (current == null) {
            return;
        }
        projectionFailures.increment();
        Counter.builder("idledger.projection.failures.by.projection")
            .tag("instance", instanceId)
            .tag("projection", projection)
            .register(current)
            .increment();
    }

    public String getInstanceId() {
        return instanceId;
    }
}
