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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One rendered SQL command with {@code $n} placeholders and its arguments in placeholder order.
 * Arguments may contain nulls.
 */
public record SqlStatement(String sql, List<Object> args) {

    public SqlStatement {
        Objects.requireNonNull(sql, "sql cannot be null");
        args = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(args, "args cannot be null")));
    }
}
