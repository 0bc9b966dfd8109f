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

import dev.mars.idledger.api.error.ErrorKind;
import dev.mars.idledger.api.error.IdLedgerErrorCodes;
import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.api.event.EventAppendListener;
import dev.mars.idledger.api.event.EventDraft;
import dev.mars.idledger.api.event.EventFilter;
import dev.mars.idledger.api.event.EventLog;
import dev.mars.idledger.api.event.EventPosition;
import dev.mars.idledger.api.event.StoredEvent;
import dev.mars.idledger.api.event.UniqueConstraint;
import dev.mars.idledger.db.connection.PgConnectionManager;
import dev.mars.idledger.db.error.PgErrorMapper;
import dev.mars.idledger.db.metrics.IdLedgerMetrics;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * PostgreSQL implementation of {@link EventLog} on the Vert.x 5.x reactive client.
 *
 * <p>An append is one transaction: the current maximum sequence of the stream is compared
 * with the expected one, the unique-constraint actions of the drafts are applied, and the
 * events are inserted with explicit sequences. A writer that read the same maximum sequence
 * concurrently loses on the primary key of {@code eventstore.events}; both outcomes are
 * reported as {@code CONFLICT}.</p>
 *
 * <p>Queries with a {@link EventPosition} lower bound only return events of transactions
 * older than the oldest transaction still in flight, so a reader advancing its position
 * never skips an event committed late by an earlier transaction.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class PgEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(PgEventLog.class);

    private static final String SELECT_COLUMNS = """
        SELECT instance_id, aggregate_type, aggregate_id, sequence, event_type, resource_owner,
               editor_user, payload, creation_date, tx_id, position
        FROM eventstore.events
        """;

    private static final String MAX_SEQUENCE_SQL = """
        SELECT COALESCE(MAX(sequence), 0) AS max_sequence
        FROM eventstore.events
        WHERE instance_id = $1 AND aggregate_type = $2 AND aggregate_id = $3
        """;

    private static final String INSERT_EVENT_SQL = """
        INSERT INTO eventstore.events
            (instance_id, aggregate_type, aggregate_id, sequence, event_type, resource_owner, editor_user, payload)
        VALUES ($1, $2, $3, $4, $5, $6, $7, $8::jsonb)
        RETURNING creation_date, tx_id, position
        """;

    private static final String INSERT_UNIQUE_SQL =
        "INSERT INTO eventstore.unique_constraints (instance_id, unique_type, unique_field) VALUES ($1, $2, $3)";

    private static final String DELETE_UNIQUE_SQL =
        "DELETE FROM eventstore.unique_constraints WHERE instance_id = $1 AND unique_type = $2 AND unique_field = $3";

    private final PgConnectionManager connectionManager;
    private final String serviceId;
    private final IdLedgerMetrics metrics;
    private final List<EventAppendListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    public PgEventLog(PgConnectionManager connectionManager, String serviceId, IdLedgerMetrics metrics) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager cannot be null");
        this.serviceId = serviceId;
        this.metrics = metrics != null ? metrics : IdLedgerMetrics.noop();
        logger.info("Created PgEventLog for service: {}", serviceId);
    }

    @Override
    public Future<List<StoredEvent>> append(String instanceId, String aggregateType, String aggregateId,
                                            long expectedSequence, List<EventDraft> events) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Event log is closed"));
        }
        try {
            validateAppend(instanceId, aggregateType, aggregateId, expectedSequence, events);
        } catch (IdLedgerException e) {
            return Future.failedFuture(e);
        }

        long started = System.nanoTime();
        return connectionManager.withTransaction(serviceId, conn ->
                currentSequence(conn, instanceId, aggregateType, aggregateId)
                    .compose(current -> {
                        if (current != expectedSequence) {
                            return Future.failedFuture(IdLedgerException.conflict(String.format(
                                "Stale append to %s/%s: expected sequence %d but stream is at %d",
                                aggregateType, aggregateId, expectedSequence, current)));
                        }
                        return applyUniqueConstraints(conn, instanceId, events);
                    })
                    .compose(v -> insertEvents(conn, instanceId, aggregateType, aggregateId, expectedSequence, events)))
            .recover(error -> Future.failedFuture(
                PgErrorMapper.toUnavailable(error, IdLedgerErrorCodes.EVENT_APPEND_FAILED, "Failed to append events")))
            .onSuccess(stored -> {
                logger.debug("Appended {} events to {}/{} (instance {}) after sequence {}",
                    stored.size(), aggregateType, aggregateId, instanceId, expectedSequence);
                metrics.recordAppend(aggregateType, stored.size(), Duration.ofNanos(System.nanoTime() - started));
                notifyListeners(stored);
            })
            .onFailure(error -> {
                if (IdLedgerException.isKind(error, ErrorKind.CONFLICT)) {
                    logger.debug("Append conflict on {}/{}: {}", aggregateType, aggregateId, error.getMessage());
                    metrics.recordConflict(aggregateType);
                } else {
                    logger.warn("Append to {}/{} failed: {}", aggregateType, aggregateId, error.getMessage());
                }
            });
    }

    static void validateAppend(String instanceId, String aggregateType, String aggregateId,
                               long expectedSequence, List<EventDraft> events) {
        if (instanceId == null || instanceId.isBlank()) {
            throw IdLedgerException.missingField("instanceId");
        }
        if (aggregateType == null || aggregateType.isBlank()) {
            throw IdLedgerException.missingField("aggregateType");
        }
        if (aggregateId == null || aggregateId.isBlank()) {
            throw IdLedgerException.missingField("aggregateId");
        }
        if (expectedSequence < 0) {
            throw IdLedgerException.invalidArgument(IdLedgerErrorCodes.INVALID_ARGUMENT,
                "Expected sequence cannot be negative: " + expectedSequence);
        }
        if (events == null || events.isEmpty()) {
            throw IdLedgerException.invalidArgument(IdLedgerErrorCodes.EMPTY_APPEND, "No events to append");
        }
    }

    private Future<Long> currentSequence(SqlConnection conn, String instanceId, String aggregateType, String aggregateId) {
        return conn.preparedQuery(MAX_SEQUENCE_SQL)
            .execute(Tuple.of(instanceId, aggregateType, aggregateId))
            .map(rows -> rows.iterator().next().getLong("max_sequence"));
    }

    private Future<Void> applyUniqueConstraints(SqlConnection conn, String instanceId, List<EventDraft> events) {
        Future<Void> chain = Future.succeededFuture();
        for (EventDraft draft : events) {
            for (UniqueConstraint constraint : draft.uniqueConstraints()) {
                chain = chain.compose(v -> applyUniqueConstraint(conn, instanceId, constraint));
            }
        }
        return chain;
    }

    private Future<Void> applyUniqueConstraint(SqlConnection conn, String instanceId, UniqueConstraint constraint) {
        Tuple params = Tuple.of(instanceId, constraint.uniqueType(), constraint.uniqueField());
        if (constraint.action() == UniqueConstraint.Action.REMOVE) {
            return conn.preparedQuery(DELETE_UNIQUE_SQL).execute(params).mapEmpty();
        }
        return conn.preparedQuery(INSERT_UNIQUE_SQL).execute(params)
            .<Void>mapEmpty()
            .recover(error -> {
                if (PgErrorMapper.isUniqueViolation(error)) {
                    String message = constraint.errorMessage() != null
                        ? constraint.errorMessage()
                        : "Unique value already taken: " + constraint.uniqueType() + "/" + constraint.uniqueField();
                    return Future.failedFuture(IdLedgerException.alreadyExists(
                        IdLedgerErrorCodes.UNIQUE_CONSTRAINT_VIOLATED, message));
                }
                return Future.failedFuture(error);
            });
    }

    private Future<List<StoredEvent>> insertEvents(SqlConnection conn, String instanceId, String aggregateType,
                                                   String aggregateId, long expectedSequence, List<EventDraft> events) {
        List<StoredEvent> stored = new ArrayList<>(events.size());
        Future<Void> chain = Future.succeededFuture();
        long sequence = expectedSequence;
        for (EventDraft draft : events) {
            long next = ++sequence;
            chain = chain.compose(v -> conn.preparedQuery(INSERT_EVENT_SQL)
                .execute(Tuple.of(instanceId, aggregateType, aggregateId, next, draft.eventType(),
                    draft.resourceOwner(), draft.editorUser(), draft.payload().encode()))
                .map(rows -> {
                    Row row = rows.iterator().next();
                    stored.add(new StoredEvent(instanceId, aggregateType, aggregateId, draft.resourceOwner(),
                        draft.eventType(), next, row.getOffsetDateTime("creation_date").toInstant(),
                        draft.payload(), draft.editorUser(),
                        new EventPosition(row.getLong("tx_id"), row.getLong("position"))));
                    return null;
                }));
        }
        return chain
            .map(v -> List.copyOf(stored))
            .recover(error -> {
                if (PgErrorMapper.isUniqueViolation(error) || PgErrorMapper.isConcurrencyFailure(error)) {
                    return Future.failedFuture(IdLedgerException.conflict(String.format(
                        "Concurrent append to %s/%s won the race after sequence %d",
                        aggregateType, aggregateId, expectedSequence), error));
                }
                return Future.failedFuture(error);
            });
    }

    private void notifyListeners(List<StoredEvent> events) {
        for (EventAppendListener listener : listeners) {
            try {
                listener.onAppended(events);
            } catch (Exception e) {
                logger.warn("Append listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }

    @Override
    public Future<List<StoredEvent>> query(EventFilter filter) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Event log is closed"));
        }
        Objects.requireNonNull(filter, "filter cannot be null");

        try {
            StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE 1=1");
            List<Object> params = new ArrayList<>();
            int paramIndex = 1;

            if (filter.getInstanceId().isPresent()) {
                sql.append(" AND instance_id = $").append(paramIndex++);
                params.add(filter.getInstanceId().get());
            }
            if (!filter.getAggregateTypes().isEmpty()) {
                sql.append(" AND aggregate_type = ANY($").append(paramIndex++).append(")");
                params.add(filter.getAggregateTypes().toArray(new String[0]));
            }
            if (!filter.getAggregateIds().isEmpty()) {
                sql.append(" AND aggregate_id = ANY($").append(paramIndex++).append(")");
                params.add(filter.getAggregateIds().toArray(new String[0]));
            }
            if (!filter.getEventTypes().isEmpty()) {
                sql.append(" AND event_type = ANY($").append(paramIndex++).append(")");
                params.add(filter.getEventTypes().toArray(new String[0]));
            }
            if (filter.getResourceOwner().isPresent()) {
                sql.append(" AND resource_owner = $").append(paramIndex++);
                params.add(filter.getResourceOwner().get());
            }
            if (filter.getSequenceGreaterThan() > 0) {
                sql.append(" AND sequence > $").append(paramIndex++);
                params.add(filter.getSequenceGreaterThan());
            }
            if (filter.getCreatedAfter().isPresent()) {
                sql.append(" AND creation_date > $").append(paramIndex++);
                params.add(filter.getCreatedAfter().get().atOffset(ZoneOffset.UTC));
            }
            if (filter.getPositionAfter().isPresent()) {
                EventPosition after = filter.getPositionAfter().get();
                sql.append(" AND (tx_id, position) > ($").append(paramIndex++)
                    .append(", $").append(paramIndex++).append(")");
                params.add(after.transactionId());
                params.add(after.position());
                // hide transactions that may still be followed by an older, uncommitted one
                sql.append(" AND tx_id < pg_snapshot_xmin(pg_current_snapshot())::text::bigint");
            }

            if (isSingleStream(filter)) {
                sql.append(" ORDER BY sequence");
            } else {
                sql.append(" ORDER BY tx_id, position");
            }

            if (filter.getLimit() > 0) {
                sql.append(" LIMIT $").append(paramIndex);
                params.add(filter.getLimit());
            }

            return connectionManager.withConnection(serviceId, conn -> conn.preparedQuery(sql.toString())
                    .execute(Tuple.tuple(params))
                    .map(rows -> {
                        List<StoredEvent> events = new ArrayList<>(rows.size());
                        for (Row row : rows) {
                            events.add(mapRow(row));
                        }
                        return events;
                    }))
                .recover(error -> Future.failedFuture(
                    PgErrorMapper.toUnavailable(error, IdLedgerErrorCodes.EVENT_QUERY_FAILED, "Failed to query events")));
        } catch (Exception e) {
            return Future.failedFuture(e);
        }
    }

    private static boolean isSingleStream(EventFilter filter) {
        return filter.getPositionAfter().isEmpty()
            && filter.getAggregateTypes().size() == 1
            && filter.getAggregateIds().size() == 1;
    }

    private static StoredEvent mapRow(Row row) {
        Object payload = row.getValue("payload");
        JsonObject json = payload instanceof JsonObject object ? object : new JsonObject(String.valueOf(payload));
        return new StoredEvent(
            row.getString("instance_id"),
            row.getString("aggregate_type"),
            row.getString("aggregate_id"),
            row.getString("resource_owner"),
            row.getString("event_type"),
            row.getLong("sequence"),
            row.getOffsetDateTime("creation_date").toInstant(),
            json,
            row.getString("editor_user"),
            new EventPosition(row.getLong("tx_id"), row.getLong("position")));
    }

    @Override
    public Future<Long> latestSequence(String instanceId, String aggregateType, String aggregateId) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Event log is closed"));
        }
        return connectionManager.withConnection(serviceId, conn -> currentSequence(conn, instanceId, aggregateType, aggregateId))
            .recover(error -> Future.failedFuture(
                PgErrorMapper.toUnavailable(error, IdLedgerErrorCodes.EVENT_QUERY_FAILED, "Failed to read latest sequence")));
    }

    @Override
    public Future<Set<String>> instanceIds(Collection<String> aggregateTypes) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Event log is closed"));
        }
        String[] types = aggregateTypes.toArray(new String[0]);
        return connectionManager.withConnection(serviceId, conn -> conn
                .preparedQuery("SELECT DISTINCT instance_id FROM eventstore.events WHERE aggregate_type = ANY($1) ORDER BY instance_id")
                .execute(Tuple.of(types))
                .map(rows -> {
                    Set<String> ids = new LinkedHashSet<>();
                    for (Row row : rows) {
                        ids.add(row.getString("instance_id"));
                    }
                    return ids;
                }))
            .recover(error -> Future.failedFuture(
                PgErrorMapper.toUnavailable(error, IdLedgerErrorCodes.EVENT_QUERY_FAILED, "Failed to list instances")));
    }

    @Override
    public void addAppendListener(EventAppendListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            listeners.clear();
            logger.info("Closed PgEventLog for service: {}", serviceId);
        }
    }
}
