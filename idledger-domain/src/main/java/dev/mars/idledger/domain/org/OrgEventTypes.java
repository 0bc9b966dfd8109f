package dev.mars.idledger.domain.org;

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
 * Event types of the {@code org} aggregate.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class OrgEventTypes {

    public static final String ORG_ADDED = "org.added";
    public static final String ORG_REMOVED = "org.removed";

    public static final String MEMBER_ADDED = "org.member.added";
    public static final String MEMBER_CHANGED = "org.member.changed";
    public static final String MEMBER_REMOVED = "org.member.removed";
    /** Member removed because the user itself was removed. */
    public static final String MEMBER_CASCADE_REMOVED = "org.member.cascade.removed";

    private OrgEventTypes() {
        // Utility class - no instantiation
    }
}
