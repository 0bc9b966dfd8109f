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

import java.util.Objects;

/**
 * A column and the value written to it. The value may be null.
 */
public record Column(String name, Object value) {

    public Column {
        Objects.requireNonNull(name, "name cannot be null");
    }

    public static Column of(String name, Object value) {
        return new Column(name, value);
    }
}
