package dev.mars.idledger.eventstore;

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
import dev.mars.idledger.api.event.EventAppendListener;
import dev.mars.idledger.api.event.EventDraft;
import dev.mars.idledger.api.event.EventFilter;
import dev.mars.idledger.api.event.EventLog;
import dev.mars.idledger.api.event.EventPosition;
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.api.event.UniqueConstraint;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link EventLog} held in memory, for embedding and tests.
 *
 * <p>Appends are serialized on this instance. Every append gets its own transaction id and
 * every event its own position, both increasing, so position order equals append order.</p>
 */
public class InMemoryEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventLog.class);

    private final List<StoredEvent> events = new ArrayList<>();
    private final Set<String> uniqueValues = new HashSet<>();
    private final List<EventAppendListener> listeners = new CopyOnWriteArrayList<>();
    private final IdLedgerMetrics metrics;
    private final Clock clock;

    private long transactionCounter = 0;
    private long positionCounter = 0;
    private Throwable nextAppendFailure;

    public InMemoryEventLog() {
        this(IdLedgerMetrics.noop(), Clock.systemUTC());
    }

    public InMemoryEventLog(IdLedgerMetrics metrics, Clock clock) {
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Makes the next append fail with the given error before anything is written.
     */
    public synchronized void failNextAppend(Throwable failure) {
        this.nextAppendFailure = failure;
    }

    @Override
    public Future<List<StoredEvent>> append(String instanceId, String aggregateType, String aggregateId,
                                            long expectedSequence, List<EventDraft> drafts) {
        List<StoredEvent> stored;
        long started = System.nanoTime();
        try {
            PgEventLog.validateAppend(instanceId, aggregateType, aggregateId, expectedSequence, drafts);
            stored = appendLocked(instanceId, aggregateType, aggregateId, expectedSequence, drafts);
        } catch (IdLedgerException e) {
            if (e.getCode().equals(IdLedgerErrorCodes.SEQUENCE_CONFLICT)) {
                metrics.recordConflict(aggregateType);
            }
            return Future.failedFuture(e);
        } catch (RuntimeException e) {
            return Future.failedFuture(IdLedgerException.unavailable(
                IdLedgerErrorCodes.EVENT_APPEND_FAILED, "Failed to append events: " + e.getMessage(), e));
        }

        metrics.recordAppend(aggregateType, stored.size(), Duration.ofNanos(System.nanoTime() - started));
        for (EventAppendListener listener : listeners) {
            try {
                listener.onAppended(stored);
            } catch (Exception e) {
                logger.warn("Append listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
        return Future.succeededFuture(stored);
    }

    private synchronized List<StoredEvent> appendLocked(String instanceId, String aggregateType, String aggregateId,
                                                        long expectedSequence, List<EventDraft> drafts) {
        if (nextAppendFailure != null) {
            Throwable failure = nextAppendFailure;
            nextAppendFailure = null;
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(failure);
        }

        long current = currentSequence(instanceId, aggregateType, aggregateId);
        if (current != expectedSequence) {
            throw IdLedgerException.conflict(String.format(
                "Stale append to %s/%s: expected sequence %d but stream is at %d",
                aggregateType, aggregateId, expectedSequence, current));
        }

        // work on a copy so a collision leaves the reservations untouched
        Set<String> reserved = new HashSet<>(uniqueValues);
        for (EventDraft draft : drafts) {
            for (UniqueConstraint constraint : draft.uniqueConstraints()) {
                String key = instanceId + "|" + constraint.uniqueType() + "|" + constraint.uniqueField();
                if (constraint.action() == UniqueConstraint.Action.REMOVE) {
                    reserved.remove(key);
                } else if (!reserved.add(key)) {
                    throw IdLedgerException.alreadyExists(IdLedgerErrorCodes.UNIQUE_CONSTRAINT_VIOLATED,
                        constraint.errorMessage() != null
                            ? constraint.errorMessage()
                            : "Unique value already taken: " + constraint.uniqueType() + "/" + constraint.uniqueField());
                }
            }
        }

        long transactionId = ++transactionCounter;
        Instant now = clock.instant();
        List<StoredEvent> stored = new ArrayList<>(drafts.size());
        long sequence = expectedSequence;
        for (EventDraft draft : drafts) {
            stored.add(new StoredEvent(instanceId, aggregateType, aggregateId, draft.resourceOwner(),
                draft.eventType(), ++sequence, now, draft.payload().copy(), draft.editorUser(),
                new EventPosition(transactionId, ++positionCounter)));
        }

        uniqueValues.clear();
        uniqueValues.addAll(reserved);
        events.addAll(stored);
        return List.copyOf(stored);
    }

    private long currentSequence(String instanceId, String aggregateType, String aggregateId) {
        long max = 0;
        for (StoredEvent event : events) {
            if (event.instanceId().equals(instanceId)
                && event.aggregateType().equals(aggregateType)
                && event.aggregateId().equals(aggregateId)) {
                max = Math.max(max, event.sequence());
            }
        }
        return max;
    }

    @Override
    public synchronized Future<List<StoredEvent>> query(EventFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        List<StoredEvent> result = new ArrayList<>();
        for (StoredEvent event : events) {
            if (filter.matches(event)) {
                result.add(event);
            }
        }
        result.sort(Comparator.comparing(StoredEvent::position));
        if (filter.getLimit() > 0 && result.size() > filter.getLimit()) {
            result = new ArrayList<>(result.subList(0, filter.getLimit()));
        }
        return Future.succeededFuture(result);
    }

    @Override
    public synchronized Future<Long> latestSequence(String instanceId, String aggregateType, String aggregateId) {
        return Future.succeededFuture(currentSequence(instanceId, aggregateType, aggregateId));
    }

    @Override
    public synchronized Future<Set<String>> instanceIds(Collection<String> aggregateTypes) {
        Set<String> ids = new LinkedHashSet<>();
        for (StoredEvent event : events) {
            if (aggregateTypes.contains(event.aggregateType())) {
                ids.add(event.instanceId());
            }
        }
        return Future.succeededFuture(ids);
    }

    @Override
    public void addAppendListener(EventAppendListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Number of stored events, across all instances.
     */
    public synchronized int size() {
        return events.size();
    }
}
