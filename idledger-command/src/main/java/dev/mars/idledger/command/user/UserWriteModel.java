package dev.mars.idledger.command.user;

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

import dev.mars.idledger.command.WriteModel;
import dev.mars.idledger.domain.AggregateTypes;
import dev.mars.idledger.domain.user.HumanAddedPayload;
import dev.mars.idledger.domain.user.UserEventTypes;
import dev.mars.idledger.domain.user.UserState;

public class UserWriteModel extends WriteModel {

    private String username;
    private String firstName;
    private String lastName;
    private String email;
    private UserState state = UserState.UNSPECIFIED;

    public UserWriteModel(String instanceId, String userId) {
        super(instanceId, AggregateTypes.USER, userId);
        on(UserEventTypes.HUMAN_ADDED, HumanAddedPayload.class, (event, payload) -> {
            username = payload.username();
            firstName = payload.firstName();
            lastName = payload.lastName();
            email = payload.email();
            state = UserState.ACTIVE;
        });
        on(UserEventTypes.USER_DEACTIVATED, event -> state = UserState.INACTIVE);
        on(UserEventTypes.USER_REACTIVATED, event -> state = UserState.ACTIVE);
        on(UserEventTypes.USER_REMOVED, event -> state = UserState.REMOVED);
    }

    @Override
    public boolean exists() {
        return state.exists();
    }

    public String getUsername() {
        return username;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public UserState getState() {
        return state;
    }
}
