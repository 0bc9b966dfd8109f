package dev.mars.idledger.command;

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

import java.time.Instant;
import java.util.List;

/**
 * Result of a successful command: the affected object and the stream position it reached.
 *
 * @param id            id of the created or changed object
 * @param resourceOwner organization owning the object
 * @param sequence      sequence of the last appended event
 * @param changeDate    creation date of the last appended event
 */
public record ObjectDetails(String id, String resourceOwner, long sequence, Instant changeDate) {

    public static ObjectDetails of(String id, List<StoredEvent> appended) {
        StoredEvent last = appended.get(appended.size() - 1);
        return new ObjectDetails(id, last.resourceOwner(), last.sequence(), last.creationDate());
    }
}
