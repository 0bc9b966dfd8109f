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

import dev.mars.idledger.api.error.ErrorKind;
import dev.mars.idledger.api.error.IdLedgerException;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Helpers for callers of command handlers.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class Commands {
    private static final Logger logger = LoggerFactory.getLogger(Commands.class);

    private Commands() {
        // Utility class - no instantiation
    }

    /**
     * Runs a whole command again, write model loading included, while it fails with
     * {@code CONFLICT}, up to {@code maxAttempts} times in total. Other failures are returned
     * immediately.
     */
    public static <T> Future<T> retryOnConflict(Supplier<Future<T>> command, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        return attempt(command, 1, maxAttempts);
    }

    private static <T> Future<T> attempt(Supplier<Future<T>> command, int attempt, int maxAttempts) {
        return command.get().recover(error -> {
            if (attempt < maxAttempts && IdLedgerException.isKind(error, ErrorKind.CONFLICT)) {
                logger.debug("Command lost a concurrent append, retrying (attempt {} of {})", attempt + 1, maxAttempts);
                return attempt(command, attempt + 1, maxAttempts);
            }
            return Future.failedFuture(error);
        });
    }
}
