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

package com.dataapi.client;

/**
 * The DataApiClient class provides methods to connect to a Data API endpoint and retrieve a StatefulDataApiConnection.
 * It supports connecting with explicit options or with the ones found in the application config.
 */
public class DataApiClient {

    public static StatefulDataApiConnection connect() {
        return connect(ClientOptions.load());
    }

    public static StatefulDataApiConnection connect(ClientOptions options) {
        return new StatefulDataApiConnection(options, new HttpDataApiAsyncCommands(options));
    }
}
