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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Payload of {@code org.member.added}.
 *
 * @param userId            the member
 * @param roles             roles granted in the organization
 * @param userResourceOwner organization owning the user, carried so projections can flag the
 *                          membership when that organization is removed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemberAddedPayload(String userId, List<String> roles, String userResourceOwner) {

    public MemberAddedPayload {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }
}
