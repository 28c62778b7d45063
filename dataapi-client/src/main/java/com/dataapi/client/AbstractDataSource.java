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
import com.dataapi.client.timeout.CursorTimeouts;
import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;

import javax.annotation.Nullable;

public abstract class AbstractDataSource implements DataSource {
    private final String name;
    private final String keyspace;
    private final DataApiCommands sync;
    private final DataApiAsyncCommands async;
    private final SerdesOptions serdesOptions;
    private final Long requestTimeoutMs;

    protected AbstractDataSource(String name,
                                 String keyspace,
                                 @Nullable DataApiCommands sync,
                                 @Nullable DataApiAsyncCommands async,
                                 SerdesOptions serdesOptions,
                                 @Nullable Long requestTimeoutMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        this.name = name;
        this.keyspace = keyspace;
        this.sync = sync;
        this.async = async;
        this.serdesOptions = serdesOptions;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getKeyspace() {
        return keyspace;
    }

    @Override
    public DataApiCommands sync() {
        return sync;
    }

    @Override
    public DataApiAsyncCommands async() {
        return async;
    }

    @Override
    public SerdesOptions getSerdesOptions() {
        return serdesOptions;
    }

    @Override
    public Long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    /**
     * Constraints new cursors start with: the configured request timeout and no overall budget.
     */
    protected CursorTimeouts defaultCursorTimeouts() {
        return CursorTimeouts.of(requestTimeoutMs, null);
    }

    @Override
    public String toString() {
        return String.format("%s(name=\"%s\", keyspace=\"%s\")", getClass().getSimpleName(), name, keyspace);
    }
}
