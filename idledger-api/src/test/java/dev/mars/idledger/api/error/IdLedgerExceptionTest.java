package dev.mars.idledger.api.error;

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

import dev.mars.idledger.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class IdLedgerExceptionTest {

    @Test
    void testFactoriesSetKindAndCode() {
        assertEquals(ErrorKind.CONFLICT, IdLedgerException.conflict("stale").getKind());
        assertEquals(IdLedgerErrorCodes.SEQUENCE_CONFLICT, IdLedgerException.conflict("stale").getCode());

        IdLedgerException missing = IdLedgerException.missingField("userId");
        assertEquals(ErrorKind.INVALID_ARGUMENT, missing.getKind());
        assertEquals(IdLedgerErrorCodes.MISSING_REQUIRED_FIELD, missing.getCode());
        assertTrue(missing.getMessage().contains("userId"));

        assertTrue(IdLedgerException.notFound(IdLedgerErrorCodes.ORG_NOT_FOUND, "gone").is(ErrorKind.NOT_FOUND));
    }

    @Test
    void testIsKindWalksCauseChain() {
        Throwable wrapped = new CompletionException(IdLedgerException.alreadyExists(IdLedgerErrorCodes.ORG_NAME_TAKEN, "taken"));

        assertTrue(IdLedgerException.isKind(wrapped, ErrorKind.ALREADY_EXISTS));
        assertFalse(IdLedgerException.isKind(wrapped, ErrorKind.CONFLICT));
        assertFalse(IdLedgerException.isKind(new RuntimeException(), ErrorKind.CONFLICT));
    }

    @Test
    void testOnlyConflictAndUnavailableAreRetryable() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind == ErrorKind.CONFLICT || kind == ErrorKind.UNAVAILABLE, kind.isRetryable(), kind.name());
        }
    }
}
