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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payload of {@code org.idp.config.changed}. Only changed attributes are set; unchanged ones
 * are null and not written.
 *
 * @param oldName previous name, present when the name changed so its reservation can be released
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdpConfigChangedPayload(String idpConfigId,
                                      String name,
                                      String oldName,
                                      IdpStylingType stylingType,
                                      Boolean autoRegister) {

    public boolean hasChanges() {
        return name != null || stylingType != null || autoRegister != null;
    }
}
