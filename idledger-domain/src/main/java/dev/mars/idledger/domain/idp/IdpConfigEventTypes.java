package dev.mars.idledger.domain.idp;

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
 * Identity-provider configuration events. They are stored on the {@code org} aggregate that
 * owns the configuration and carry the configuration id in their payload.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-10-18
 * @version 1.0
 */
public final class IdpConfigEventTypes {

    public static final String CONFIG_ADDED = "org.idp.config.added";
    public static final String CONFIG_CHANGED = "org.idp.config.changed";
    public static final String CONFIG_DEACTIVATED = "org.idp.config.deactivated";
    public static final String CONFIG_REACTIVATED = "org.idp.config.reactivated";
    public static final String CONFIG_REMOVED = "org.idp.config.removed";

    public static final String JWT_CONFIG_ADDED = "org.idp.jwt.config.added";
    public static final String JWT_CONFIG_CHANGED = "org.idp.jwt.config.changed";

    private IdpConfigEventTypes() {
        // Utility class - no instantiation
    }
}
