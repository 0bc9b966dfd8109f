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

import java.util.Objects;

/**
 * Failure raised by the event log and the command handlers.
 *
 * <p>Every instance carries an {@link ErrorKind} that callers switch on and a stable
 * {@link IdLedgerErrorCodes error code} for logs and API responses.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public class IdLedgerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String code;

    public IdLedgerException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null);
    }

    public IdLedgerException(ErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.code = Objects.requireNonNull(code, "code cannot be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public boolean is(ErrorKind expected) {
        return kind == expected;
    }

    /**
     * Returns true if the throwable, or one of its causes, is an IdLedgerException of the given kind.
     */
    public static boolean isKind(Throwable throwable, ErrorKind expected) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof IdLedgerException e && e.kind == expected) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static IdLedgerException invalidArgument(String code, String message) {
        return new IdLedgerException(ErrorKind.INVALID_ARGUMENT, code, message);
    }

    public static IdLedgerException missingField(String fieldName) {
        return new IdLedgerException(ErrorKind.INVALID_ARGUMENT, IdLedgerErrorCodes.MISSING_REQUIRED_FIELD,
            "Missing required field: " + fieldName);
    }

    public static IdLedgerException notFound(String code, String message) {
        return new IdLedgerException(ErrorKind.NOT_FOUND, code, message);
    }

    public static IdLedgerException alreadyExists(String code, String message) {
        return new IdLedgerException(ErrorKind.ALREADY_EXISTS, code, message);
    }

    public static IdLedgerException preconditionFailed(String code, String message) {
        return new IdLedgerException(ErrorKind.PRECONDITION_FAILED, code, message);
    }

    public static IdLedgerException conflict(String message) {
        return new IdLedgerException(ErrorKind.CONFLICT, IdLedgerErrorCodes.SEQUENCE_CONFLICT, message);
    }

    public static IdLedgerException conflict(String message, Throwable cause) {
        return new IdLedgerException(ErrorKind.CONFLICT, IdLedgerErrorCodes.SEQUENCE_CONFLICT, message, cause);
    }

    public static IdLedgerException unavailable(String code, String message, Throwable cause) {
        return new IdLedgerException(ErrorKind.UNAVAILABLE, code, message, cause);
    }

    @Override
    public String toString() {
        return "IdLedgerException{" +
            "kind=" + kind +
            ", code='" + code + '\'' +
            ", message='" + getMessage() + '\'' +
            '}';
    }
}
