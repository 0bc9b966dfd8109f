package dev.mars.idledger.projection.store;

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

import dev.mars.idledger.api.event.EventPosition;
import dev.mars.idledger.projection.statement.Statement;

import java.time.Instant;
import java.util.Objects;

/**
 * Where a projection stands for one instance: the position of the last applied event and that
 * event's stream coordinates.
 *
 * @param position      position of the last applied event, {@link EventPosition#START} if none
 * @param aggregateType aggregate type of the last applied event, null if none
 * @param aggregateId   aggregate id of the last applied event, null if none
 * @param sequence      sequence of the last applied event, 0 if none
 * @param eventDate     creation date of the last applied event, null if none
 */
public record ProjectionPosition(EventPosition position,
                                 String aggregateType,
                                 String aggregateId,
                                 long sequence,
                                 Instant eventDate) {

    public ProjectionPosition {
        Objects.requireNonNull(position, "position cannot be null");
    }

    public static ProjectionPosition initial() {
        return new ProjectionPosition(EventPosition.START, null, null, 0L, null);
    }

    public static ProjectionPosition of(Statement statement) {
        return new ProjectionPosition(statement.getPosition(), statement.getAggregateType(),
            statement.getAggregateId(), statement.getSequence(), statement.getEvent().creationDate());
    }
}
