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

import java.util.Map;
import java.util.Objects;

/**
 * Equality of a column with a value, rendered as {@code (column = $n)}.
 */
public record Condition(String column, Object value) {

    public Condition {
        Objects.requireNonNull(column, "column cannot be null");
        Objects.requireNonNull(value, () -> "value of condition on " + column + " cannot be null");
    }

    public static Condition eq(String column, Object value) {
        return new Condition(column, value);
    }

    public boolean matches(Map<String, Object> row) {
        return Objects.equals(row.get(column), value);
    }
}
