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

import dev.mars.idledger.projection.statement.Statement;
import io.vertx.core.Future;

import java.util.List;

/**
 * Executes projection statements and keeps the position of every projection per instance.
 *
 * <p>A batch is atomic: the statements and the new position are committed together or not at
 * all. If the batch fails the position is left where it was and the same events are fetched
 * again by the next run.</p>
 *
 * <p>The position is advanced only if it still is the one the batch was reduced from. A batch
 * whose position another runner moved in the meantime commits nothing and reports
 * {@link BatchOutcome.Status#SUPERSEDED}, so runners sharing a projection without the lock never
 * overwrite newer results with older ones.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public interface ProjectionStore extends AutoCloseable {

    /**
     * Produces the statements of a batch from the position the projection stands at.
     * One statement per event, in log order; the last one defines the new position.
     */
    @FunctionalInterface
    interface BatchReducer {
        Future<List<Statement>> reduce(ProjectionPosition from);
    }

    /**
     * Runs one batch.
     *
     * @param projectionName name of the projection
     * @param instanceId     instance the batch belongs to
     * @param lock           whether to take the projection's position exclusively; when another
     *                       runner holds it the batch is skipped
     * @param reducer        produces the statements to apply
     * @return the outcome; fails with the error of the reducer or of the execution
     */
    Future<BatchOutcome> applyBatch(String projectionName, String instanceId, boolean lock, BatchReducer reducer);

    /**
     * Current position of a projection, {@link ProjectionPosition#initial()} if it never ran.
     */
    Future<ProjectionPosition> position(String projectionName, String instanceId);

    @Override
    default void close() {
    }
}
