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
package dev.mars.idledger.api.error;

/**
 * Failure categories surfaced to command callers.
 */
public enum ErrorKind {

    /** Malformed or missing command input. Nothing was appended. */
    INVALID_ARGUMENT,

    /** The referenced aggregate has no events or is in its terminal removed state. */
    NOT_FOUND,

    /** A uniqueness rule would be violated. */
    ALREADY_EXISTS,

    /** A business rule other than uniqueness blocks the transition. */
    PRECONDITION_FAILED,

    /** Optimistic concurrency lost on append. Re-read the write model and retry the whole command. */
    CONFLICT,

    /** Storage I/O failure. */
    UNAVAILABLE;

    /**
     * Whether a caller may reasonably re-run the failed operation unchanged.
     */
    public boolean isRetryable() {
        return this == CONFLICT || this == UNAVAILABLE;
    }
}
