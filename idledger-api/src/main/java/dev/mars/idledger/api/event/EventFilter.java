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
package dev.mars.idledger.api.event;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Filter for {@link EventLog#query(EventFilter)}.
 *
 * <p>Empty sets mean "any". Results are always ordered by {@link EventPosition}, which within
 * a single aggregate stream is ascending sequence order.</p>
 *
 * <p>When {@link #getPositionAfter()} is present the query is a projection read: the log only
 * returns events whose writing transaction can no longer be overtaken by a transaction still in
 * flight, so that a reader advancing its position never skips a late commit.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class EventFilter {

    private final String instanceId;
    private final Set<String> aggregateTypes;
    private final Set<String> aggregateIds;
    private final Set<String> eventTypes;
    private final String resourceOwner;
    private final long sequenceGreaterThan;
    private final Instant createdAfter;
    private final EventPosition positionAfter;
    private final int limit;

    private EventFilter(Builder builder) {
        this.instanceId = builder.instanceId;
        this.aggregateTypes = Set.copyOf(builder.aggregateTypes);
        this.aggregateIds = Set.copyOf(builder.aggregateIds);
        this.eventTypes = Set.copyOf(builder.eventTypes);
        this.resourceOwner = builder.resourceOwner;
        this.sequenceGreaterThan = builder.sequenceGreaterThan;
        this.createdAfter = builder.createdAfter;
        this.positionAfter = builder.positionAfter;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * All events of one aggregate stream.
     */
    public static EventFilter forAggregate(String instanceId, String aggregateType, String aggregateId) {
        return builder()
            .instanceId(instanceId)
            .aggregateTypes(aggregateType)
            .aggregateIds(aggregateId)
            .build();
    }

    public Optional<String> getInstanceId() { return Optional.ofNullable(instanceId); }
    public Set<String> getAggregateTypes() { return aggregateTypes; }
    public Set<String> getAggregateIds() { return aggregateIds; }
    public Set<String> getEventTypes() { return eventTypes; }
    public Optional<String> getResourceOwner() { return Optional.ofNullable(resourceOwner); }
    public long getSequenceGreaterThan() { return sequenceGreaterThan; }
    public Optional<Instant> getCreatedAfter() { return Optional.ofNullable(createdAfter); }
    public Optional<EventPosition> getPositionAfter() { return Optional.ofNullable(positionAfter); }
    public int getLimit() { return limit; }

    /**
     * Evaluates the filter against a single event, ignoring limit.
     */
    public boolean matches(StoredEvent event) {
        if (instanceId != null && !instanceId.equals(event.instanceId())) {
            return false;
        }
        if (!aggregateTypes.isEmpty() && !aggregateTypes.contains(event.aggregateType())) {
            return false;
        }
        if (!aggregateIds.isEmpty() && !aggregateIds.contains(event.aggregateId())) {
            return false;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.eventType())) {
            return false;
        }
        if (resourceOwner != null && !resourceOwner.equals(event.resourceOwner())) {
            return false;
        }
        if (event.sequence() <= sequenceGreaterThan) {
            return false;
        }
        if (createdAfter != null && !event.creationDate().isAfter(createdAfter)) {
            return false;
        }
        return positionAfter == null || event.position().isAfter(positionAfter);
    }

    public static class Builder {
        private String instanceId;
        private final Set<String> aggregateTypes = new LinkedHashSet<>();
        private final Set<String> aggregateIds = new LinkedHashSet<>();
        private final Set<String> eventTypes = new LinkedHashSet<>();
        private String resourceOwner;
        private long sequenceGreaterThan;
        private Instant createdAfter;
        private EventPosition positionAfter;
        private int limit;

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder aggregateTypes(String... types) {
            return aggregateTypes(Arrays.asList(types));
        }

        public Builder aggregateTypes(Collection<String> types) {
            this.aggregateTypes.addAll(Objects.requireNonNull(types, "types cannot be null"));
            return this;
        }

        public Builder aggregateIds(String... ids) {
            return aggregateIds(Arrays.asList(ids));
        }

        public Builder aggregateIds(Collection<String> ids) {
            this.aggregateIds.addAll(Objects.requireNonNull(ids, "ids cannot be null"));
            return this;
        }

        public Builder eventTypes(String... types) {
            return eventTypes(Arrays.asList(types));
        }

        public Builder eventTypes(Collection<String> types) {
            this.eventTypes.addAll(Objects.requireNonNull(types, "types cannot be null"));
            return this;
        }

        public Builder resourceOwner(String resourceOwner) {
            this.resourceOwner = resourceOwner;
            return this;
        }

        public Builder sequenceGreaterThan(long sequence) {
            if (sequence < 0) {
                throw new IllegalArgumentException("Sequence lower bound cannot be negative");
            }
            this.sequenceGreaterThan = sequence;
            return this;
        }

        public Builder createdAfter(Instant createdAfter) {
            this.createdAfter = createdAfter;
            return this;
        }

        public Builder positionAfter(EventPosition position) {
            this.positionAfter = position;
            return this;
        }

        /**
         * Maximum number of events to return, 0 for no limit.
         */
        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("Limit cannot be negative");
            }
            this.limit = limit;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(this);
        }
    }

    @Override
    public String toString() {
        return "EventFilter{" +
            "instanceId='" + instanceId + '\'' +
            ", aggregateTypes=" + aggregateTypes +
            ", aggregateIds=" + aggregateIds +
            ", eventTypes=" + eventTypes +
            ", resourceOwner='" + resourceOwner + '\'' +
            ", sequenceGreaterThan=" + sequenceGreaterThan +
            ", createdAfter=" + createdAfter +
            ", positionAfter=" + positionAfter +
            ", limit=" + limit +
            '}';
    }
}
