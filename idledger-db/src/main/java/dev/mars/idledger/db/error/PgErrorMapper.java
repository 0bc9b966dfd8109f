package dev.mars.idledger.db.error;

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

import dev.mars.idledger.api.error.IdLedgerException;
import io.vertx.pgclient.PgException;

import java.util.Optional;

/**
 * Translates PostgreSQL client failures into {@link IdLedgerException}s.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class PgErrorMapper {

    public static final String UNIQUE_VIOLATION = "23505";
    public static final String SERIALIZATION_FAILURE = "40001";
    public static final String DEADLOCK_DETECTED = "40P01";

    private PgErrorMapper() {
        // Utility class - no instantiation
    }

    /**
     * SQLSTATE of the first {@link PgException} in the cause chain.
     */
    public static Optional<String> sqlState(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof PgException pg) {
                return Optional.ofNullable(pg.getSqlState());
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    public static boolean isUniqueViolation(Throwable throwable) {
        return sqlState(throwable).map(UNIQUE_VIOLATION::equals).orElse(false);
    }

    /**
     * Transaction aborted by PostgreSQL because of a concurrent writer.
     */
    public static boolean isConcurrencyFailure(Throwable throwable) {
        return sqlState(throwable)
            .map(state -> SERIALIZATION_FAILURE.equals(state) || DEADLOCK_DETECTED.equals(state))
            .orElse(false);
    }

    /**
     * Returns the throwable unchanged if it already is an {@link IdLedgerException}, otherwise
     * wraps it as {@code UNAVAILABLE} with the given code.
     */
    public static IdLedgerException toUnavailable(Throwable throwable, String code, String message) {
        if (throwable instanceof IdLedgerException e) {
            return e;
        }
        return IdLedgerException.unavailable(code, message + ": " + throwable.getMessage(), throwable);
    }
}
