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

import dev.mars.idledger.api.event.EventFilter;
import dev.mars.idledger.api.event.StoredEvent;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * State of one aggregate stream rebuilt by folding its events, used to validate a command.
 *
 * <p>Subclasses register one reduction per event type with {@link #on}. Events of other
 * types, and events rejected by {@link #accepts(StoredEvent)}, still advance
 * {@link #getProcessedSequence()} but leave the state untouched, so the processed sequence is
 * always the sequence to append after.</p>
 *
 * <p>Reductions must only depend on the event, so folding the same events twice gives the
 * same state. A model that saw no events is in its zero state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public abstract class WriteModel {

    private final String instanceId;
    private final String aggregateType;
    private final String aggregateId;
    private final Map<String, Consumer<StoredEvent>> reductions = new HashMap<>();

    private String resourceOwner;
    private long processedSequence;
    private Instant creationDate;
    private Instant changeDate;

    protected WriteModel(String instanceId, String aggregateType, String aggregateId) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId cannot be null");
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
    }

    /**
     * Registers the reduction of an event type whose payload binds to {@code payloadType}.
     */
    protected <T> void on(String eventType, Class<T> payloadType, BiConsumer<StoredEvent, T> reduction) {
        Objects.requireNonNull(payloadType, "payloadType cannot be null");
        Objects.requireNonNull(reduction, "reduction cannot be null");
        register(eventType, event -> reduction.accept(event, event.payloadAs(payloadType)));
    }

    /**
     * Registers the reduction of an event type whose payload is not needed.
     */
    protected void on(String eventType, Consumer<StoredEvent> reduction) {
        register(eventType, Objects.requireNonNull(reduction, "reduction cannot be null"));
    }

    private void register(String eventType, Consumer<StoredEvent> reduction) {
        if (reductions.putIfAbsent(eventType, reduction) != null) {
            throw new IllegalStateException("Reduction already registered for event type: " + eventType);
        }
    }

    /**
     * Narrows the events that change this model's state within the stream.
     */
    protected boolean accepts(StoredEvent event) {
        return true;
    }

    /**
     * Filter selecting this model's stream.
     */
    public EventFilter filter() {
        return EventFilter.forAggregate(instanceId, aggregateType, aggregateId);
    }

    /**
     * Folds one event. Events must arrive in ascending sequence order.
     */
    public final void reduce(StoredEvent event) {
        if (!aggregateId.equals(event.aggregateId()) || !aggregateType.equals(event.aggregateType())) {
            throw new IllegalArgumentException("Event " + event.eventType() + " of " + event.aggregateType() + "/"
                + event.aggregateId() + " does not belong to " + aggregateType + "/" + aggregateId);
        }
        if (event.sequence() <= processedSequence) {
            throw new IllegalStateException("Event sequence " + event.sequence()
                + " is not after processed sequence " + processedSequence);
        }

        processedSequence = event.sequence();
        changeDate = event.creationDate();
        if (creationDate == null) {
            creationDate = event.creationDate();
            resourceOwner = event.resourceOwner();
        }

        if (accepts(event)) {
            Consumer<StoredEvent> reduction = reductions.get(event.eventType());
            if (reduction != null) {
                reduction.accept(event);
            }
        }
    }

    public final void reduceAll(List<StoredEvent> events) {
        events.forEach(this::reduce);
    }

    /**
     * Whether the entity this model describes currently exists.
     */
    public abstract boolean exists();

    public String getInstanceId() {
        return instanceId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * Resource owner of the stream's first event, null for an empty stream.
     */
    public String getResourceOwner() {
        return resourceOwner;
    }

    /**
     * Sequence of the last folded event of the stream, 0 for an empty stream.
     */
    public long getProcessedSequence() {
        return processedSequence;
    }

    public Instant getCreationDate() {
        return creationDate;
    }

    public Instant getChangeDate() {
        return changeDate;
    }
}
