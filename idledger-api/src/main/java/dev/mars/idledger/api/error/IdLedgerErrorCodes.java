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
 * Standard error codes for IdLedger.
 *
 * Error code ranges:
 * - IDLERR0001-0049: General/System errors
 * - IDLERR0050-0099: Event log errors
 * - IDLERR0100-0149: Organization errors
 * - IDLERR0150-0199: User errors
 * - IDLERR0200-0249: Membership errors
 * - IDLERR0250-0299: Identity provider configuration errors
 * - IDLERR0300-0349: Projection errors
 * - IDLERR0500-0549: Database/Connection errors
 */
public final class IdLedgerErrorCodes {

    private IdLedgerErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "IDLERR0001";
    public static final String INVALID_ARGUMENT = "IDLERR0002";
    public static final String MISSING_REQUIRED_FIELD = "IDLERR0003";

    // ========================================================================
    // Event Log Errors (0050-0099)
    // ========================================================================
    public static final String SEQUENCE_CONFLICT = "IDLERR0050";
    public static final String UNIQUE_CONSTRAINT_VIOLATED = "IDLERR0051";
    public static final String EVENT_APPEND_FAILED = "IDLERR0052";
    public static final String EVENT_QUERY_FAILED = "IDLERR0053";
    public static final String EMPTY_APPEND = "IDLERR0054";

    // ========================================================================
    // Organization Errors (0100-0149)
    // ========================================================================
    public static final String ORG_NOT_FOUND = "IDLERR0100";
    public static final String ORG_NAME_TAKEN = "IDLERR0101";
    public static final String ORG_INVALID = "IDLERR0102";

    // ========================================================================
    // User Errors (0150-0199)
    // ========================================================================
    public static final String USER_NOT_FOUND = "IDLERR0150";
    public static final String USERNAME_TAKEN = "IDLERR0151";
    public static final String USER_INVALID = "IDLERR0152";
    public static final String USER_NOT_ACTIVE = "IDLERR0153";
    public static final String USER_NOT_INACTIVE = "IDLERR0154";

    // ========================================================================
    // Membership Errors (0200-0249)
    // ========================================================================
    public static final String MEMBER_NOT_FOUND = "IDLERR0200";
    public static final String MEMBER_ALREADY_EXISTS = "IDLERR0201";
    public static final String MEMBER_INVALID = "IDLERR0202";
    public static final String MEMBER_NOT_CHANGED = "IDLERR0203";

    // ========================================================================
    // Identity Provider Configuration Errors (0250-0299)
    // ========================================================================
    public static final String IDP_CONFIG_NOT_FOUND = "IDLERR0250";
    public static final String IDP_CONFIG_NAME_TAKEN = "IDLERR0251";
    public static final String IDP_CONFIG_INVALID = "IDLERR0252";
    public static final String IDP_CONFIG_NOT_CHANGED = "IDLERR0253";
    public static final String IDP_CONFIG_NOT_ACTIVE = "IDLERR0254";
    public static final String IDP_CONFIG_NOT_INACTIVE = "IDLERR0255";
    public static final String JWT_CONFIG_NOT_FOUND = "IDLERR0256";

    // ========================================================================
    // Projection Errors (0300-0349)
    // ========================================================================
    public static final String PROJECTION_REDUCE_FAILED = "IDLERR0300";
    public static final String PROJECTION_APPLY_FAILED = "IDLERR0301";
    public static final String PROJECTION_POSITION_MOVED = "IDLERR0302";

    // ========================================================================
    // Database/Connection Errors (0500-0549)
    // ========================================================================
    public static final String DATABASE_UNAVAILABLE = "IDLERR0500";
    public static final String DATABASE_TIMEOUT = "IDLERR0501";
}
