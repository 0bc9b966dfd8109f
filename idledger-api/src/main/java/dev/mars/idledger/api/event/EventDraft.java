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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An event that has not been appended yet. The log assigns sequence, creation date
 * and position on append.
 *
 * @param eventType         payload discriminator
 * @param resourceOwner     owning organization
 * @param payload           event data
 * @param editorUser        user issuing the command, may be null
 * @param uniqueConstraints unique values to reserve or release together with this event
 */
public record EventDraft(
    String eventType,
    String resourceOwner,
    JsonObject payload,
    String editorUser,
    List<UniqueConstraint> uniqueConstraints
) {

    public EventDraft {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(resourceOwner, "resourceOwner cannot be null");
        payload = payload == null ? new JsonObject() : payload;
        uniqueConstraints = uniqueConstraints == null ? List.of() : List.copyOf(uniqueConstraints);
    }

    /**
     * Creates a draft whose payload is the Jackson serialization of {@code payload}.
     * A null payload produces an empty JSON object.
     */
    public static EventDraft of(String eventType, String resourceOwner, Object payload) {
        return new EventDraft(eventType, resourceOwner, toJson(payload), null, List.of());
    }

    public EventDraft withEditor(String editor) {
        return new EventDraft(eventType, resourceOwner, payload, editor, uniqueConstraints);
    }

    public EventDraft withUniqueConstraint(UniqueConstraint constraint) {
        List<UniqueConstraint> all = new ArrayList<>(uniqueConstraints);
        all.add(Objects.requireNonNull(constraint, "constraint cannot be null"));
        return new EventDraft(eventType, resourceOwner, payload, editorUser, all);
    }

    private static JsonObject toJson(Object payload) {
        if (payload == null) {
            return new JsonObject();
        }
        if (payload instanceof JsonObject json) {
            return json;
        }
        return JsonObject.mapFrom(payload);
    }
}
