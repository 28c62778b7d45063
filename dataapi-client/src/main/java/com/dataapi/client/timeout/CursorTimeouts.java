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

package com.dataapi.client.timeout;

import com.dataapi.common.utils.Utils;

import javax.annotation.Nullable;

/**
 * Time constraints of a cursor: a cap for each page request and an optional budget covering all of them.
 *
 * @param requestTimeoutMs    per-request cap in milliseconds, null for none
 * @param requestTimeoutLabel name reported when the per-request cap is exceeded
 * @param overallTimeoutMs    budget for every fetch the cursor performs, null for none
 * @param overallTimeoutLabel name reported when the overall budget is exceeded
 */
public record CursorTimeouts(@Nullable Long requestTimeoutMs,
                             @Nullable String requestTimeoutLabel,
                             @Nullable Long overallTimeoutMs,
                             @Nullable String overallTimeoutLabel) {
    public static final String REQUEST_TIMEOUT_LABEL = "request_timeout_ms";
    public static final String OVERALL_TIMEOUT_LABEL = "overall_timeout_ms";
    public static final String GENERAL_METHOD_TIMEOUT_LABEL = "general_method_timeout_ms";

    public static final CursorTimeouts NONE = new CursorTimeouts(null, null, null, null);

    public static CursorTimeouts of(@Nullable Long requestTimeoutMs, @Nullable Long overallTimeoutMs) {
        return new CursorTimeouts(requestTimeoutMs, REQUEST_TIMEOUT_LABEL, overallTimeoutMs, OVERALL_TIMEOUT_LABEL);
    }

    /**
     * Derives the constraints for the copy a bulk operation works on.
     *
     * <p>A method-level timeout becomes the new overall budget, and the per-request cap shrinks to it
     * if it is shorter. Without one, the constraints are unchanged.</p>
     *
     * @param generalMethodTimeoutMs the operation-level timeout, null for none
     * @return the revised constraints
     */
    public CursorTimeouts forBulkOperation(@Nullable Long generalMethodTimeoutMs) {
        if (generalMethodTimeoutMs == null) {
            return this;
        }
        Long request = Utils.minOfNullable(generalMethodTimeoutMs, requestTimeoutMs);
        String requestLabel = request.equals(requestTimeoutMs) ? requestTimeoutLabel : GENERAL_METHOD_TIMEOUT_LABEL;
        return new CursorTimeouts(request, requestLabel, generalMethodTimeoutMs, GENERAL_METHOD_TIMEOUT_LABEL);
    }

    public TimeoutBudget startBudget() {
        return TimeoutBudget.start(overallTimeoutMs, overallTimeoutLabel);
    }
}
