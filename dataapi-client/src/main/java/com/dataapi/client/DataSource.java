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

import com.dataapi.client.serdes.SerdesOptions;
import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;

import javax.annotation.Nullable;

/**
 * A collection or a table a cursor reads from.
 */
public interface DataSource {
    String getName();

    String getKeyspace();

    @Nullable
    DataApiCommands sync();

    @Nullable
    DataApiAsyncCommands async();

    SerdesOptions getSerdesOptions();

    /**
     * Returns the per-request timeout that cursors created by this data source start with.
     *
     * @return the timeout in milliseconds, null for none
     */
    @Nullable
    Long getRequestTimeoutMs();
}
