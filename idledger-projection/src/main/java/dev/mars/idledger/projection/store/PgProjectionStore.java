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

import dev.mars.idledger.api.error.ErrorKind;
import dev.mars.idledger.api.error.IdLedgerErrorCodes;
import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.api.event.EventPosition;
import dev.mars.idledger.db.connection.PgConnectionManager;
import dev.mars.idledger.db.error.PgErrorMapper;
import dev.mars.idledger.projection.statement.SqlStatement;
import dev.mars.idledger.projection.statement.Statement;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowIterator;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link ProjectionStore} on PostgreSQL. Statements and the new position of a batch are
 * written in one transaction on the connection that holds the projection's row in
 * {@code projections.current_states}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class PgProjectionStore implements ProjectionStore {
    private static final Logger logger = LoggerFactory.getLogger(PgProjectionStore.class);

    private static final String ENSURE_STATE_SQL = """
        INSERT INTO projections.current_states (projection_name, instance_id)
        VALUES ($1, $2)
        ON CONFLICT (projection_name, instance_id) DO NOTHING
        """;

    private static final String SELECT_STATE_SQL = """
        SELECT last_tx_id, last_position, aggregate_type, aggregate_id, sequence, event_date
        FROM projections.current_states
        WHERE projection_name = $1 AND instance_id = $2
        """;

    // matches no row if another runner moved the position since this batch read it
    private static final String ADVANCE_STATE_SQL = """
        UPDATE projections.current_states
        SET last_tx_id = $3, last_position = $4, aggregate_type = $5, aggregate_id = $6,
            sequence = $7, event_date = $8, last_updated = now()
        WHERE projection_name = $1 AND instance_id = $2
          AND last_tx_id = $9 AND last_position = $10
        """;

    private final PgConnectionManager connectionManager;
    private final String serviceId;
    private volatile boolean closed = false;

    public PgProjectionStore(PgConnectionManager connectionManager, String serviceId) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager cannot be null");
        this.serviceId = serviceId;
    }

    @Override
    public Future<BatchOutcome> applyBatch(String projectionName, String instanceId, boolean lock, BatchReducer reducer) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Projection store is closed"));
        }
        String selectSql = lock ? SELECT_STATE_SQL + "FOR UPDATE SKIP LOCKED" : SELECT_STATE_SQL;

        return connectionManager.withTransaction(serviceId, conn -> conn.preparedQuery(ENSURE_STATE_SQL)
                .execute(Tuple.of(projectionName, instanceId))
                .compose(inserted -> conn.preparedQuery(selectSql).execute(Tuple.of(projectionName, instanceId)))
                .compose(rows -> {
                    RowIterator<Row> iterator = rows.iterator();
                    if (!iterator.hasNext()) {
                        logger.debug("Projection {} for instance {} is held by another runner", projectionName, instanceId);
                        return Future.succeededFuture(BatchOutcome.locked());
                    }
                    ProjectionPosition from = mapPosition(iterator.next());
                    return reducer.reduce(from).compose(statements -> {
                        if (statements.isEmpty()) {
                            return Future.succeededFuture(BatchOutcome.applied(0, from));
                        }
                        ProjectionPosition to = ProjectionPosition.of(statements.get(statements.size() - 1));
                        return execute(conn, statements)
                            .compose(v -> advance(conn, projectionName, instanceId, from, to))
                            .map(v -> BatchOutcome.applied(statements.size(), to));
                    });
                }))
            .recover(error -> {
                if (isPositionMoved(error)) {
                    logger.debug("Projection {} for instance {} was advanced by another runner, batch rolled back",
                        projectionName, instanceId);
                    return Future.succeededFuture(BatchOutcome.superseded());
                }
                return Future.failedFuture(PgErrorMapper.toUnavailable(error,
                    IdLedgerErrorCodes.PROJECTION_APPLY_FAILED, "Failed to apply batch of " + projectionName));
            });
    }

    private Future<Void> execute(SqlConnection conn, List<Statement> statements) {
        Future<Void> chain = Future.succeededFuture();
        for (Statement statement : statements) {
            for (SqlStatement sql : statement.toSql()) {
                chain = chain.compose(v -> conn.preparedQuery(sql.sql())
                    .execute(toTuple(sql.args()))
                    .onFailure(error -> logger.debug("Statement failed for {}: {}", statement, sql.sql()))
                    .mapEmpty());
            }
        }
        return chain;
    }

    /**
     * Moves the position from {@code from} to {@code to}. Fails, rolling the batch back, when the
     * stored position is no longer {@code from}.
     */
    private Future<Void> advance(SqlConnection conn, String projectionName, String instanceId,
                                 ProjectionPosition from, ProjectionPosition to) {
        Tuple params = Tuple.of(projectionName, instanceId)
            .addLong(to.position().transactionId())
            .addLong(to.position().position())
            .addString(to.aggregateType())
            .addString(to.aggregateId())
            .addLong(to.sequence())
            .addValue(to.eventDate() != null ? to.eventDate().atOffset(ZoneOffset.UTC) : null)
            .addLong(from.position().transactionId())
            .addLong(from.position().position());
        return conn.preparedQuery(ADVANCE_STATE_SQL).execute(params).compose(result -> {
            if (result.rowCount() == 0) {
                return Future.failedFuture(new IdLedgerException(ErrorKind.CONFLICT,
                    IdLedgerErrorCodes.PROJECTION_POSITION_MOVED,
                    "Position of " + projectionName + " moved past " + from.position()));
            }
            return Future.succeededFuture();
        });
    }

    private static boolean isPositionMoved(Throwable error) {
        return error instanceof IdLedgerException e
            && IdLedgerErrorCodes.PROJECTION_POSITION_MOVED.equals(e.getCode());
    }

    @Override
    public Future<ProjectionPosition> position(String projectionName, String instanceId) {
        return connectionManager.withConnection(serviceId, conn -> conn.preparedQuery(SELECT_STATE_SQL)
                .execute(Tuple.of(projectionName, instanceId))
                .map(rows -> {
                    RowIterator<Row> iterator = rows.iterator();
                    return iterator.hasNext() ? mapPosition(iterator.next()) : ProjectionPosition.initial();
                }))
            .recover(error -> Future.failedFuture(PgErrorMapper.toUnavailable(error,
                IdLedgerErrorCodes.DATABASE_UNAVAILABLE, "Failed to read position of " + projectionName)));
    }

    private static ProjectionPosition mapPosition(Row row) {
        Long sequence = row.getLong("sequence");
        OffsetDateTime eventDate = row.getOffsetDateTime("event_date");
        return new ProjectionPosition(
            new EventPosition(row.getLong("last_tx_id"), row.getLong("last_position")),
            row.getString("aggregate_type"),
            row.getString("aggregate_id"),
            sequence != null ? sequence : 0L,
            eventDate != null ? eventDate.toInstant() : null);
    }

    /**
     * Binds statement arguments: instants as {@code timestamptz}, collections as text arrays.
     */
    static Tuple toTuple(List<Object> args) {
        List<Object> params = new ArrayList<>(args.size());
        for (Object arg : args) {
            if (arg instanceof Instant instant) {
                params.add(instant.atOffset(ZoneOffset.UTC));
            } else if (arg instanceof Collection<?> values) {
                params.add(values.stream().map(String::valueOf).toArray(String[]::new));
            } else {
                params.add(arg);
            }
        }
        return Tuple.tuple(params);
    }

    @Override
    public void close() {
        closed = true;
    }
}
