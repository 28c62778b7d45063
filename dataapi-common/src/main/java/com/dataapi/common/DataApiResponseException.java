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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Raised when the Data API answers a command with an {@code errors} array instead of a result.
 */
public class DataApiResponseException extends DataApiException {
    private final List<Map<String, Object>> errorDescriptors;

    public DataApiResponseException(String message, List<Map<String, Object>> errorDescriptors) {
        super(message);
        this.errorDescriptors = Collections.unmodifiableList(errorDescriptors);
    }

    public List<Map<String, Object>> getErrorDescriptors() {
        return errorDescriptors;
    }
}
