package dev.mars.idledger.domain;

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
 * Namespaces of the unique values reserved in the event log, and the keys used in them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class UniqueTypes {

    public static final String ORG_NAME = "org_name";
    public static final String USERNAME = "username";
    public static final String IDP_CONFIG_NAME = "idp_config_name";
    public static final String ORG_MEMBER = "org_member";

    private UniqueTypes() {
        // Utility class - no instantiation
    }

    /**
     * IDP configuration names are unique per resource owner.
     */
    public static String idpConfigNameKey(String resourceOwner, String name) {
        return resourceOwner + ":" + name;
    }

    public static String orgMemberKey(String orgId, String userId) {
        return orgId + ":" + userId;
    }
}
