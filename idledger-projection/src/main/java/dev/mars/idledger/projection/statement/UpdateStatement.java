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
 * Sets columns on every row matching all conditions.
 */
public class UpdateStatement extends Statement {

    private final String table;
    private final List<Column> values;
    private final List<Condition> conditions;

    public UpdateStatement(StoredEvent event, String table, List<Column> values, List<Condition> conditions) {
        super(event);
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.values = requireNonEmpty(values, "values");
        this.conditions = requireNonEmpty(conditions, "conditions");
    }

    @Override
    public List<SqlStatement> toSql() {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("UPDATE ").append(table).append(" SET ");
        if (values.size() == 1) {
            // PostgreSQL rejects the parenthesized form for a single column
            sql.append(values.get(0).name()).append(" = $1");
        } else {
            sql.append('(').append(values.stream().map(Column::name).collect(Collectors.joining(", ")))
                .append(") = (").append(placeholders(1, values.size())).append(')');
        }
        for (Column value : values) {
            args.add(value.value());
        }
        appendWhere(sql, conditions, args);
        return List.of(new SqlStatement(sql.toString(), args));
    }

    public String getTable() {
        return table;
    }

    public List<Column> getValues() {
        return values;
    }

    public List<Condition> getConditions() {
        return conditions;
    }
}
