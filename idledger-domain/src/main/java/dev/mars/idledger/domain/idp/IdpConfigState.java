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
 * Lifecycle of an identity-provider configuration. The numeric value is stored in the
 * {@code state} column of the read model.
 */
public enum IdpConfigState {
    UNSPECIFIED(0),
    ACTIVE(1),
    INACTIVE(2),
    REMOVED(3);

    private final int value;

    IdpConfigState(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * True for configurations that exist and were not removed.
     */
    public boolean exists() {
        return this == ACTIVE || this == INACTIVE;
    }
}
