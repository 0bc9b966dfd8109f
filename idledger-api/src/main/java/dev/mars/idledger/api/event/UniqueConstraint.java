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

import java.util.Objects;

/**
 * Reservation or release of a unique value, applied in the same transaction as the
 * events it is attached to. Values are unique per instance and {@code uniqueType}.
 *
 * @param uniqueType   namespace of the value, e.g. {@code org_name}
 * @param uniqueField  the value itself
 * @param action       whether the value is reserved or released
 * @param errorMessage message reported when a reservation collides with an existing one
 */
public record UniqueConstraint(String uniqueType, String uniqueField, Action action, String errorMessage) {

    public enum Action {
        ADD,
        REMOVE
    }

    public UniqueConstraint {
        Objects.requireNonNull(uniqueType, "uniqueType cannot be null");
        Objects.requireNonNull(uniqueField, "uniqueField cannot be null");
        Objects.requireNonNull(action, "action cannot be null");
    }

    public static UniqueConstraint add(String uniqueType, String uniqueField, String errorMessage) {
        return new UniqueConstraint(uniqueType, uniqueField, Action.ADD, errorMessage);
    }

    public static UniqueConstraint remove(String uniqueType, String uniqueField) {
        return new UniqueConstraint(uniqueType, uniqueField, Action.REMOVE, null);
    }
}
