package dev.mars.idledger.projection;

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

import java.util.List;
import java.util.Objects;

/**
 * The event reducers a projection registers for one aggregate type.
 */
public record AggregateReducer(String aggregateType, List<EventReducer> eventReducers) {

    public AggregateReducer {
        Objects.requireNonNull(aggregateType, "aggregateType cannot be null");
        eventReducers = List.copyOf(Objects.requireNonNull(eventReducers, "eventReducers cannot be null"));
    }
}
