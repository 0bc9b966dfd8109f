package dev.mars.idledger.projection.runner;

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

import dev.mars.idledger.api.event.EventFilter;
import dev.mars.idledger.api.event.EventLog;
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.db.config.IdLedgerConfiguration.ProjectionConfig;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import dev.mars.idledger.projection.Projection;
import dev.mars.idledger.projection.statement.Statement;
import dev.mars.idledger.projection.store.BatchOutcome;
import dev.mars.idledger.projection.store.ProjectionPosition;
import dev.mars.idledger.projection.store.ProjectionStore;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps projections up to date with the event log.
 *
 * <p>Every projection advances independently per instance. A run drains the backlog in batches
 * of at most {@code batchSize} events; each batch fetches the events after the stored position,
 * reduces them and applies the statements together with the new position. Runs are started by a
 * periodic Vert.x timer, by appends of this process and by {@link #trigger}/{@link #triggerAndWait}.
 * Inside one runner at most one run per projection and instance is in flight; requests arriving
 * meanwhile are coalesced into a single follow-up run. Several runners are kept apart by the
 * store's position lock when enabled, and by idempotent statements otherwise.</p>
 *
 * <p>A failed batch leaves the position unchanged. Timer and append triggered runs then back off
 * exponentially from the polling interval up to {@code maxRetryDelay}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class ProjectionRunner implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionRunner.class);

    private static final long LOCK_RETRY_DELAY_MS = 50;

    private final Vertx vertx;
    private final EventLog eventLog;
    private final ProjectionStore store;
    private final List<Projection> projections;
    private final ProjectionConfig config;
    private final IdLedgerMetrics metrics;
    private final Set<String> aggregateTypes = new LinkedHashSet<>();

    private final Map<String, Worker> workers = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private long pollingTimerId = -1;

    public ProjectionRunner(Vertx vertx, EventLog eventLog, ProjectionStore store, List<Projection> projections,
                            ProjectionConfig config, IdLedgerMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.projections = List.copyOf(Objects.requireNonNull(projections, "projections cannot be null"));
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = metrics != null ? metrics : IdLedgerMetrics.noop();

        Set<String> names = new LinkedHashSet<>();
        for (Projection projection : this.projections) {
            if (!names.add(projection.name())) {
                throw new IllegalArgumentException("Duplicate projection name: " + projection.name());
            }
            aggregateTypes.addAll(projection.aggregateTypes());
        }
    }

    /**
     * Starts the polling timer and, if configured, the append trigger.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Projection runner is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long intervalMs = Math.max(1, config.getPollingInterval().toMillis());
        pollingTimerId = vertx.setPeriodic(intervalMs, id -> poll());
        if (config.isTriggerOnAppend()) {
            eventLog.addAppendListener(this::onAppended);
        }
        logger.info("Started projection runner for {} (polling every {}, batch size {}, lock {})",
            names(), config.getPollingInterval(), config.getBatchSize(), config.isLockEnabled() ? "on" : "off");
    }

    /**
     * Requests a run of every projection for the instance without waiting for it.
     */
    public void trigger(String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        for (Projection projection : projections) {
            worker(projection, instanceId).request(false);
        }
    }

    /**
     * Runs every projection for the instance until it has applied all events visible when this
     * method was called.
     *
     * @return completes when all projections caught up, fails with the first batch failure
     */
    public Future<Void> triggerAndWait(String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Projection runner is closed"));
        }
        List<Future<Void>> runs = new ArrayList<>(projections.size());
        for (Projection projection : projections) {
            runs.add(worker(projection, instanceId).request(true));
        }
        return Future.all(runs).mapEmpty();
    }

    public ProjectionState state(String projectionName, String instanceId) {
        Worker worker = workers.get(key(projectionName, instanceId));
        return worker != null ? worker.state : ProjectionState.IDLE;
    }

    public Future<ProjectionPosition> position(String projectionName, String instanceId) {
        return store.position(projectionName, instanceId);
    }

    private void poll() {
        if (closed.get()) {
            return;
        }
        eventLog.instanceIds(aggregateTypes)
            .onSuccess(instanceIds -> instanceIds.forEach(this::trigger))
            .onFailure(error -> logger.warn("Failed to list instances for projections: {}", error.getMessage()));
    }

    private void onAppended(List<StoredEvent> events) {
        if (closed.get()) {
            return;
        }
        Set<String> instanceIds = new LinkedHashSet<>();
        for (StoredEvent event : events) {
            if (aggregateTypes.contains(event.aggregateType())) {
                instanceIds.add(event.instanceId());
            }
        }
        instanceIds.forEach(this::trigger);
    }

    private Worker worker(Projection projection, String instanceId) {
        return workers.computeIfAbsent(key(projection.name(), instanceId), k -> new Worker(projection, instanceId));
    }

    private Future<Void> delay(long delayMs) {
        Promise<Void> promise = Promise.promise();
        vertx.setTimer(delayMs, id -> promise.complete());
        return promise.future();
    }

    private List<String> names() {
        List<String> names = new ArrayList<>();
        for (Projection projection : projections) {
            names.add(projection.name());
        }
        return names;
    }

    private static String key(String projectionName, String instanceId) {
        return projectionName + "|" + instanceId;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (pollingTimerId != -1) {
                vertx.cancelTimer(pollingTimerId);
                pollingTimerId = -1;
            }
            logger.info("Closed projection runner for {}", names());
        }
    }

    /**
     * Serializes the runs of one projection for one instance.
     */
    private final class Worker {
        private final Projection projection;
        private final String instanceId;

        private volatile ProjectionState state = ProjectionState.IDLE;
        private Future<Void> running = Future.succeededFuture();
        private Promise<Void> queued;
        private boolean queuedWaits;
        private int failures;
        private long retryNotBefore;

        Worker(Projection projection, String instanceId) {
            this.projection = projection;
            this.instanceId = instanceId;
        }

        /**
         * @param waits whether the caller waits for completion; waiting runs ignore the backoff
         *              and retry while another runner holds the position
         */
        synchronized Future<Void> request(boolean waits) {
            if (!waits && failures > 0 && System.currentTimeMillis() < retryNotBefore) {
                return Future.succeededFuture();
            }
            if (queued != null) {
                queuedWaits |= waits;
                return queued.future();
            }
            Promise<Void> next = Promise.promise();
            queued = next;
            queuedWaits = waits;
            running.onComplete(ar -> start(next));
            return next.future();
        }

        private void start(Promise<Void> next) {
            boolean waits;
            synchronized (this) {
                if (queued == next) {
                    queued = null;
                }
                waits = queuedWaits;
                running = next.future();
            }
            drain(waits).onComplete(ar -> {
                if (ar.succeeded()) {
                    next.complete();
                } else {
                    next.fail(ar.cause());
                }
            });
        }

        private Future<Void> drain(boolean waits) {
            if (closed.get()) {
                return Future.succeededFuture();
            }
            return runBatch().compose(outcome -> {
                if (outcome.status() == BatchOutcome.Status.SUPERSEDED) {
                    return drain(waits);
                }
                if (outcome.skipped()) {
                    return waits ? delay(LOCK_RETRY_DELAY_MS).compose(v -> drain(true)) : Future.succeededFuture();
                }
                if (outcome.eventCount() >= config.getBatchSize()) {
                    return drain(waits);
                }
                return Future.succeededFuture();
            });
        }

        private Future<BatchOutcome> runBatch() {
            long started = System.nanoTime();
            return store.applyBatch(projection.name(), instanceId, config.isLockEnabled(), from -> {
                    state = ProjectionState.FETCHING;
                    EventFilter filter = EventFilter.builder()
                        .instanceId(instanceId)
                        .aggregateTypes(projection.aggregateTypes())
                        .eventTypes(projection.eventTypes())
                        .positionAfter(from.position())
                        .limit(config.getBatchSize())
                        .build();
                    return eventLog.query(filter).map(events -> {
                        state = ProjectionState.REDUCING;
                        List<Statement> statements = new ArrayList<>(events.size());
                        for (StoredEvent event : events) {
                            statements.add(projection.reduce(event));
                        }
                        state = ProjectionState.APPLYING;
                        return statements;
                    });
                })
                .onComplete(ar -> {
                    state = ProjectionState.IDLE;
                    if (ar.succeeded()) {
                        onBatchApplied(ar.result(), Duration.ofNanos(System.nanoTime() - started));
                    } else {
                        onBatchFailed(ar.cause());
                    }
                });
        }

        private synchronized void onBatchApplied(BatchOutcome outcome, Duration duration) {
            failures = 0;
            if (outcome.eventCount() > 0) {
                metrics.recordProjectionBatch(projection.name(), outcome.eventCount(), duration);
                logger.debug("Projection {} applied {} events for instance {} up to {}",
                    projection.name(), outcome.eventCount(), instanceId, outcome.position().position());
            }
        }

        private synchronized void onBatchFailed(Throwable error) {
            failures++;
            long delayMs = backoff(failures).toMillis();
            retryNotBefore = System.currentTimeMillis() + delayMs;
            metrics.recordProjectionFailure(projection.name());
            logger.warn("Projection {} failed for instance {} (attempt {}), retrying in {} ms: {}",
                projection.name(), instanceId, failures, delayMs, error.getMessage());
        }
    }

    /**
     * Delay before the next automatic run after {@code failures} consecutive failures.
     */
    Duration backoff(int failures) {
        Duration delay = config.getPollingInterval();
        Duration max = config.getMaxRetryDelay();
        for (int i = 1; i < failures && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
