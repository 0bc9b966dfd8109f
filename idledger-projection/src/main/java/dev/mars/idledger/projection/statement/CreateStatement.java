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

import dev.mars.idledger.api.event.StoredEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Inserts one row. With conflict columns the insert becomes an upsert that overwrites every
 * other column of an existing row with the same key.
 */
public class CreateStatement extends Statement {

    private final String table;
    private final List<Column> columns;
    private final List<String> conflictColumns;

    public CreateStatement(StoredEvent event, String table, List<Column> columns) {
        this(event, table, columns, List.of());
    }

    public CreateStatement(StoredEvent event, String table, List<Column> columns, List<String> conflictColumns) {
        super(event);
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.columns = requireNonEmpty(columns, "columns");
        this.conflictColumns = List.copyOf(Objects.requireNonNull(conflictColumns, "conflictColumns cannot be null"));
    }

    @Override
    public List<SqlStatement> toSql() {
        List<Object> args = new ArrayList<>(columns.size());
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table).append(" (");
        sql.append(columns.stream().map(Column::name).collect(Collectors.joining(", ")));
        sql.append(") VALUES (").append(placeholders(1, columns.size())).append(')');
        for (Column column : columns) {
            args.add(column.value());
        }

        if (!conflictColumns.isEmpty()) {
            sql.append(" ON CONFLICT (").append(String.join(", ", conflictColumns)).append(')');
            List<String> updated = columns.stream()
                .map(Column::name)
                .filter(name -> !conflictColumns.contains(name))
                .collect(Collectors.toList());
            if (updated.isEmpty()) {
                sql.append(" DO NOTHING");
            } else {
                sql.append(" DO UPDATE SET ")
                    .append(updated.stream().map(name -> name + " = EXCLUDED." + name).collect(Collectors.joining(", ")));
            }
        }
        return List.of(new SqlStatement(sql.toString(), args));
    }

    public String getTable() {
        return table;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<String> getConflictColumns() {
        return conflictColumns;
    }
}
