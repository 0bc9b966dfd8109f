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

/**
 * Several writes derived from one event, executed in order, e.g. the tombstones set on two
 * columns when an organization is removed.
 */
public class MultiStatement extends Statement {

    private final List<Statement> statements;

    public MultiStatement(StoredEvent event, List<Statement> statements) {
        super(event);
        this.statements = requireNonEmpty(statements, "statements");
        for (Statement statement : this.statements) {
            if (statement.getEvent() != event) {
                throw new IllegalArgumentException("All parts of a multi statement must come from the same event");
            }
        }
    }

    @Override
    public List<SqlStatement> toSql() {
        List<SqlStatement> rendered = new ArrayList<>();
        for (Statement statement : statements) {
            rendered.addAll(statement.toSql());
        }
        return rendered;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
