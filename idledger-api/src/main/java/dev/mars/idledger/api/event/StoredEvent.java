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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Objects;

/**
 * An event as persisted in the log. Immutable.
 *
 * <p>The payload schema is determined by {@code eventType}. Typed access goes through
 * {@link #payloadAs(Class)}, which binds the JSON payload with Jackson.</p>
 *
 * @param instanceId    tenant instance the event belongs to
 * @param aggregateType type of the aggregate, e.g. {@code org}
 * @param aggregateId   id of the aggregate
 * @param resourceOwner owning organization
 * @param eventType     payload discriminator, e.g. {@code org.member.added}
 * @param sequence      position in the aggregate stream, starting at 1
 * @param creationDate  commit time of the event
 * @param payload       event data, never null (empty object when the event carries none)
 * @param editorUser    user that issued the command, may be null
 * @param position      global position in the log
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public record StoredEvent(
    String instanceId,
    String aggregateType,
    String aggregateId,
    String resourceOwner,
    String eventType,
    long sequence,
    Instant creationDate,
    JsonObject payload,
    String editorUser,
    EventPosition position
) {

    public StoredEvent {
        Objects.requireNonNull(instanceId, "instanceId cannot be null");
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        Objects.requireNonNull(aggregateId, "aggregateId cannot be null");
        Objects.requireNonNull(resourceOwner, "resourceOwner cannot be null");
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(creationDate, "creationDate cannot be null");
        Objects.requireNonNull(position, "position cannot be null");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive: " + sequence);
        }
        payload = payload == null ? new JsonObject() : payload;
    }

    /**
     * Sequence of the preceding event in the same stream, 0 for the first event.
     */
    public long previousSequence() {
        return sequence - 1;
    }

    /**
     * Binds the payload to the given type.
     */
    public <T> T payloadAs(Class<T> type) {
        return payload.mapTo(type);
    }

    public boolean isOfType(String type) {
        return eventType.equals(type);
    }
}
