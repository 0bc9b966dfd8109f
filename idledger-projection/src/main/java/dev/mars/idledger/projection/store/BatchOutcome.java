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

/**
 * Result of one projection batch.
 *
 * @param status     whether the batch was applied, and why not if it was not
 * @param eventCount number of events applied
 * @param position   position after the batch, null unless applied
 */
public record BatchOutcome(Status status, int eventCount, ProjectionPosition position) {

    public enum Status {
        APPLIED,
        /** Another runner held the projection's position row. */
        LOCKED,
        /** Another runner advanced the position after this batch read it; nothing was committed. */
        SUPERSEDED
    }

    public static BatchOutcome locked() {
        return new BatchOutcome(Status.LOCKED, 0, null);
    }

    public static BatchOutcome superseded() {
        return new BatchOutcome(Status.SUPERSEDED, 0, null);
    }

    public static BatchOutcome applied(int eventCount, ProjectionPosition position) {
        return new BatchOutcome(Status.APPLIED, eventCount, position);
    }

    public boolean skipped() {
        return status != Status.APPLIED;
    }
}
