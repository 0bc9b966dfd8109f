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

/**
 * Global position of an event in the log.
 *
 * <p>Events are totally ordered by the id of the transaction that wrote them, then by their
 * insert position. Within one aggregate stream this order is the same as ascending sequence.
 * Projections store the position of the last event they applied and resume strictly after it.</p>
 *
 * @param transactionId id of the writing transaction
 * @param position      insert position, unique across the log
 */
public record EventPosition(long transactionId, long position) implements Comparable<EventPosition> {

    /** Position before the first event. */
    public static final EventPosition START = new EventPosition(0L, 0L);

    public EventPosition {
        if (transactionId < 0 || position < 0) {
            throw new IllegalArgumentException("Event position cannot be negative: " + transactionId + "/" + position);
        }
    }

    public boolean isAfter(EventPosition other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(EventPosition other) {
        int byTransaction = Long.compare(transactionId, other.transactionId);
        return byTransaction != 0 ? byTransaction : Long.compare(position, other.position);
    }

    @Override
    public String toString() {
        return transactionId + "/" + position;
    }
}
