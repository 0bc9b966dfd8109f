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

import dev.mars.idledger.api.error.IdLedgerErrorCodes;
import dev.mars.idledger.api.error.IdLedgerException;
import dev.mars.idledger.projection.statement.Column;
import dev.mars.idledger.projection.statement.Condition;
import dev.mars.idledger.projection.statement.CreateStatement;
import dev.mars.idledger.projection.statement.DeleteStatement;
import dev.mars.idledger.projection.statement.MultiStatement;
import dev.mars.idledger.projection.statement.NoOpStatement;
import dev.mars.idledger.projection.statement.Statement;
import dev.mars.idledger.projection.statement.UpdateStatement;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ProjectionStore} that interprets statements against tables held in memory, for
 * embedding and tests.
 *
 * <p>Rows are maps from column name to value. Upserts, updates and deletes behave as their SQL
 * renditions do, so a batch applied twice leaves the same rows as applied once. A failing batch
 * restores the tables it started from.</p>
 */
public class InMemoryProjectionStore implements ProjectionStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryProjectionStore.class);

    private final Map<String, List<Map<String, Object>>> tables = new HashMap<>();
    private final Map<String, ProjectionPosition> positions = new HashMap<>();
    private final Set<String> locks = ConcurrentHashMap.newKeySet();
    private RuntimeException nextBatchFailure;

    /**
     * Makes the next batch fail after its statements were applied and before the position is
     * advanced.
     */
    public synchronized void failNextBatch(RuntimeException failure) {
        this.nextBatchFailure = failure;
    }

    /**
     * Takes a projection's position as another runner would. Returns false if already taken.
     */
    public boolean tryLock(String projectionName, String instanceId) {
        return locks.add(key(projectionName, instanceId));
    }

    public void unlock(String projectionName, String instanceId) {
        locks.remove(key(projectionName, instanceId));
    }

    @Override
    public Future<BatchOutcome> applyBatch(String projectionName, String instanceId, boolean lock, BatchReducer reducer) {
        String key = key(projectionName, instanceId);
        if (lock && !locks.add(key)) {
            logger.debug("Projection {} for instance {} is held by another runner", projectionName, instanceId);
            return Future.succeededFuture(BatchOutcome.locked());
        }

        Future<BatchOutcome> outcome;
        try {
            ProjectionPosition from = currentPosition(key);
            outcome = reducer.reduce(from).map(statements -> apply(key, from, statements));
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }
        if (lock) {
            outcome = outcome.onComplete(ar -> locks.remove(key));
        }
        return outcome;
    }

    private synchronized BatchOutcome apply(String key, ProjectionPosition from, List<Statement> statements) {
        if (statements.isEmpty()) {
            return BatchOutcome.applied(0, from);
        }
        if (!currentPosition(key).position().equals(from.position())) {
            logger.debug("Position {} was advanced by another runner, batch dropped", key);
            return BatchOutcome.superseded();
        }
        Map<String, List<Map<String, Object>>> snapshot = copyOf(tables);
        try {
            for (Statement statement : statements) {
                execute(statement);
            }
            if (nextBatchFailure != null) {
                RuntimeException failure = nextBatchFailure;
                nextBatchFailure = null;
                throw failure;
            }
        } catch (RuntimeException e) {
            tables.clear();
            tables.putAll(snapshot);
            throw IdLedgerException.unavailable(IdLedgerErrorCodes.PROJECTION_APPLY_FAILED,
                "Failed to apply projection batch: " + e.getMessage(), e);
        }
        ProjectionPosition to = ProjectionPosition.of(statements.get(statements.size() - 1));
        positions.put(key, to);
        return BatchOutcome.applied(statements.size(), to);
    }

    private void execute(Statement statement) {
        if (statement instanceof CreateStatement create) {
            upsert(create);
        } else if (statement instanceof UpdateStatement update) {
            for (Map<String, Object> row : matching(update.getTable(), update.getConditions())) {
                for (Column value : update.getValues()) {
                    row.put(value.name(), value.value());
                }
            }
        } else if (statement instanceof DeleteStatement delete) {
            table(delete.getTable()).removeIf(row -> matchesAll(row, delete.getConditions()));
        } else if (statement instanceof MultiStatement multi) {
            for (Statement part : multi.getStatements()) {
                execute(part);
            }
        } else if (!(statement instanceof NoOpStatement)) {
            throw new IllegalArgumentException("Unsupported statement: " + statement);
        }
    }

    private void upsert(CreateStatement create) {
        Map<String, Object> inserted = new LinkedHashMap<>();
        for (Column column : create.getColumns()) {
            inserted.put(column.name(), column.value());
        }
        List<Map<String, Object>> rows = table(create.getTable());
        if (!create.getConflictColumns().isEmpty()) {
            for (Map<String, Object> row : rows) {
                boolean conflicting = true;
                for (String column : create.getConflictColumns()) {
                    conflicting &= Objects.equals(row.get(column), inserted.get(column));
                }
                if (conflicting) {
                    row.putAll(inserted);
                    return;
                }
            }
        }
        rows.add(inserted);
    }

    private List<Map<String, Object>> matching(String table, List<Condition> conditions) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : table(table)) {
            if (matchesAll(row, conditions)) {
                result.add(row);
            }
        }
        return result;
    }

    private static boolean matchesAll(Map<String, Object> row, List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (!condition.matches(row)) {
                return false;
            }
        }
        return true;
    }

    private List<Map<String, Object>> table(String name) {
        return tables.computeIfAbsent(name, n -> new ArrayList<>());
    }

    @Override
    public synchronized Future<ProjectionPosition> position(String projectionName, String instanceId) {
        return Future.succeededFuture(currentPosition(key(projectionName, instanceId)));
    }

    private synchronized ProjectionPosition currentPosition(String key) {
        return positions.getOrDefault(key, ProjectionPosition.initial());
    }

    /**
     * Copy of the rows of a table.
     */
    public synchronized List<Map<String, Object>> rows(String table) {
        return copyOf(Map.of(table, tables.getOrDefault(table, List.of()))).get(table);
    }

    private static Map<String, List<Map<String, Object>>> copyOf(Map<String, List<Map<String, Object>>> source) {
        Map<String, List<Map<String, Object>>> copy = new HashMap<>();
        source.forEach((name, rows) -> {
            List<Map<String, Object>> copiedRows = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                copiedRows.add(new LinkedHashMap<>(row));
            }
            copy.put(name, copiedRows);
        });
        return copy;
    }

    private static String key(String projectionName, String instanceId) {
        return projectionName + "|" + instanceId;
    }
}
