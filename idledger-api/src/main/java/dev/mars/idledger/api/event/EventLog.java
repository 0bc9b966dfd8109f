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

import io.vertx.core.Future;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Append-only, per-aggregate ordered log of domain events. The single source of truth.
 *
 * <p>All operations are non-blocking and complete their {@link Future} on the Vert.x context
 * of the underlying client. Failures are reported as
 * {@link dev.mars.idledger.api.error.IdLedgerException}s.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public interface EventLog extends AutoCloseable {

    /**
     * Appends events to one aggregate stream, atomically and only if the stream's current
     * maximum sequence equals {@code expectedSequence} (0 for a stream that does not exist yet).
     *
     * <p>On a sequence mismatch the future fails with {@code CONFLICT} and nothing is appended.
     * If a unique constraint attached to one of the drafts collides, the future fails with
     * {@code ALREADY_EXISTS} and nothing is appended.</p>
     *
     * @return the stored events with their assigned sequences {@code expectedSequence + 1 ... + n}
     */
    Future<List<StoredEvent>> append(String instanceId,
                                     String aggregateType,
                                     String aggregateId,
                                     long expectedSequence,
                                     List<EventDraft> events);

    /**
     * Returns a finite, replayable list of the events matching the filter.
     */
    Future<List<StoredEvent>> query(EventFilter filter);

    /**
     * Current maximum sequence of an aggregate stream, 0 if the stream has no events.
     */
    Future<Long> latestSequence(String instanceId, String aggregateType, String aggregateId);

    /**
     * Instances that have at least one event of the given aggregate types.
     */
    Future<Set<String>> instanceIds(Collection<String> aggregateTypes);

    /**
     * Registers a callback for events committed by this process.
     */
    void addAppendListener(EventAppendListener listener);

    /**
     * Releases resources held by the log. The default implementation does nothing.
     */
    @Override
    default void close() {
    }
}
