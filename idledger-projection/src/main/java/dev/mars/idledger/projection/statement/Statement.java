package dev.mars.idledger.projection.statement;

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
import dev.mars.idledger.api.event.StoredEvent;

import java.util.List;
import java.util.Objects;

/**
 * The write a projection derives from one event.
 *
 * <p>A statement carries the event it was reduced from; the projection position is advanced to
 * that event once the statement is executed. Statements are pure data: rendering them with
 * {@link #toSql()} has no side effects and executing the result twice leaves the read model as
 * executing it once.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public abstract class Statement {

    private final StoredEvent event;

    protected Statement(StoredEvent event) {
        this.event = Objects.requireNonNull(event, "event cannot be null");
    }

    /**
     * Renders the statement into the commands to execute, in order. Placeholders restart at
     * {@code $1} for every command.
     */
    public abstract List<SqlStatement> toSql();

    public StoredEvent getEvent() {
        return event;
    }

    public String getInstanceId() {
        return event.instanceId();
    }

    public String getAggregateType() {
        return event.aggregateType();
    }

    public String getAggregateId() {
        return event.aggregateId();
    }

    public long getSequence() {
        return event.sequence();
    }

    public long getPreviousSequence() {
        return event.previousSequence();
    }

    public EventPosition getPosition() {
        return event.position();
    }

    static String placeholders(int from, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('$').append(from + i);
        }
        return sb.toString();
    }

    static void appendWhere(StringBuilder sql, List<Condition> conditions, List<Object> args) {
        sql.append(" WHERE ");
        for (int i = 0; i < conditions.size(); i++) {
            if (i > 0) {
                sql.append(" AND ");
            }
            Condition condition = conditions.get(i);
            args.add(condition.value());
            sql.append('(').append(condition.column()).append(" = $").append(args.size()).append(')');
        }
    }

    static <T> List<T> requireNonEmpty(List<T> list, String name) {
        Objects.requireNonNull(list, name + " cannot be null");
        if (list.isEmpty()) {
            throw new IllegalArgumentException(name + " cannot be empty");
        }
        return List.copyOf(list);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + event.aggregateType() + "/" + event.aggregateId()
            + "@" + event.sequence() + ", " + event.eventType() + "}";
    }
}
