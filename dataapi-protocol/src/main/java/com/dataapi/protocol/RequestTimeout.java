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

package com.dataapi.protocol;

import javax.annotation.Nullable;

/**
 * Time constraints attached to a single request.
 *
 * @param requestMs the maximum duration of this request in milliseconds, null for no limit
 * @param nominalMs the overall budget this request is a part of, for error reporting only
 * @param label     a human-readable name of the budget that produced {@code requestMs}
 */
public record RequestTimeout(@Nullable Long requestMs, @Nullable Long nominalMs, @Nullable String label) {
    public static final RequestTimeout NONE = new RequestTimeout(null, null, null);

    public static RequestTimeout ofMillis(long requestMs) {
        return new RequestTimeout(requestMs, null, null);
    }

    public boolean isUnlimited() {
        return requestMs == null;
    }
}
