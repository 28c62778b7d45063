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

import javax.annotation.Nullable;

/**
 * Raised when an operation does not complete within its time budget.
 */
public class DataApiTimeoutException extends DataApiException {
    public static final String GENERIC = "generic";
    public static final String REQUEST = "request";

    private final String timeoutType;
    private final String timeoutLabel;

    public DataApiTimeoutException(String message, String timeoutType, @Nullable String timeoutLabel) {
        super(message);
        this.timeoutType = timeoutType;
        this.timeoutLabel = timeoutLabel;
    }

    public DataApiTimeoutException(String message, String timeoutType, @Nullable String timeoutLabel, Throwable cause) {
        super(message, cause);
        this.timeoutType = timeoutType;
        this.timeoutLabel = timeoutLabel;
    }

    /**
     * Returns which kind of budget was exceeded: {@link #GENERIC} for an overall deadline spanning
     * several requests, {@link #REQUEST} for a single HTTP request.
     *
     * @return the timeout type
     */
    public String getTimeoutType() {
        return timeoutType;
    }

    @Nullable
    public String getTimeoutLabel() {
        return timeoutLabel;
    }
}
