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

package com.dataapi.common;

/**
 * Raised when a cursor operation is not permitted in the cursor's current state, e.g.
 * reconfiguring a cursor that already started, or materializing a closed one.
 */
public class CursorException extends DataApiException {
    private final String cursorState;

    public CursorException(String message, String cursorState) {
        super(message + " (cursor state: " + cursorState + ")");
        this.cursorState = cursorState;
    }

    /**
     * Returns the name of the state the cursor was in when the operation was rejected.
     *
     * @return the lower-case state name
     */
    public String getCursorState() {
        return cursorState;
    }
}
