/*
 * Copyright (c) 2023-2025 Kronotop
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.dataapi.client.cursor;

public enum CursorState {
    /**
     * Nothing has been consumed yet, the cursor can still be reconfigured.
     */
    IDLE("idle"),
    /**
     * Consumption has begun.
     */
    STARTED("started"),
    /**
     * Terminal state, the cursor yields nothing more.
     */
    CLOSED("closed");

    private final String name;

    CursorState(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
