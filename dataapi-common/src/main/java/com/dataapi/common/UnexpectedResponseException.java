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
 * Raised when a response from the Data API lacks a field the client requires to make sense of it.
 * The whole response is retained for diagnostics.
 */
public class UnexpectedResponseException extends DataApiException {
    private final transient Object rawResponse;

    public UnexpectedResponseException(String message, Object rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public Object getRawResponse() {
        return rawResponse;
    }
}
