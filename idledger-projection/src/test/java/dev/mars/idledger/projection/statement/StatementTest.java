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
import dev.mars.idledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static dev.mars.idledger.projection.ProjectionTestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class StatementTest {

    private final StoredEvent event = event("org", "org.some.event", "{}");

    @Test
    void testPlainInsertHasNoConflictClause() {
        SqlStatement sql = new CreateStatement(event, "t", List.of(Column.of("a", 1), Column.of("b", null))).toSql().get(0);

        assertEquals("INSERT INTO t (a, b) VALUES ($1, $2)", sql.sql());
        assertEquals(Arrays.asList(1, null), sql.args());
    }

    @Test
    void testUpsertOfKeyColumnsOnlyDoesNothing() {
        SqlStatement sql = new CreateStatement(event, "t", List.of(Column.of("id", "x")), List.of("id")).toSql().get(0);

        assertEquals("INSERT INTO t (id) VALUES ($1) ON CONFLICT (id) DO NOTHING", sql.sql());
    }

    @Test
    void testSingleColumnUpdateIsNotParenthesized() {
        SqlStatement sql = new UpdateStatement(event, "t", List.of(Column.of("a", 1)), List.of(Condition.eq("id", "x")))
            .toSql().get(0);

        assertEquals("UPDATE t SET a = $1 WHERE (id = $2)", sql.sql());
        assertEquals(List.of(1, "x"), sql.args());
    }

    @Test
    void testUpdateAndDeleteRequireConditions() {
        assertThrows(IllegalArgumentException.class,
            () -> new UpdateStatement(event, "t", List.of(Column.of("a", 1)), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new DeleteStatement(event, "t", List.of()));
        assertThrows(NullPointerException.class, () -> Condition.eq("id", null));
    }

    @Test
    void testMultiStatementRestartsPlaceholdersPerPart() {
        MultiStatement multi = new MultiStatement(event, List.of(
            new DeleteStatement(event, "t", List.of(Condition.eq("a", 1))),
            new DeleteStatement(event, "u", List.of(Condition.eq("b", 2)))));

        List<SqlStatement> sql = multi.toSql();
        assertEquals("DELETE FROM t WHERE (a = $1)", sql.get(0).sql());
        assertEquals("DELETE FROM u WHERE (b = $1)", sql.get(1).sql());
    }

    @Test
    void testMultiStatementPartsMustShareEvent() {
        StoredEvent other = event("org", "org.other.event", "{}");

        assertThrows(IllegalArgumentException.class, () -> new MultiStatement(event, List.of(
            new DeleteStatement(other, "t", List.of(Condition.eq("a", 1))))));
    }
}
