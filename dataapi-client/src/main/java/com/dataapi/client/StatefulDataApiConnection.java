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

import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;

/**
 * Represents a connection to a Data API keyspace. The blocking API is derived from the asynchronous one.
 */
public class StatefulDataApiConnection {
    private final ClientOptions options;
    private final DataApiAsyncCommands async;
    private final DataApiCommands sync;

    public StatefulDataApiConnection(ClientOptions options, DataApiAsyncCommands async) {
        this.options = options;
        this.async = async;
        this.sync = newDataApiCommandsImpl();
    }

    public static StatefulDataApiConnection connect(ClientOptions options) {
        return DataApiClient.connect(options);
    }

    public DataApiAsyncCommands async() {
        return async;
    }

    public DataApiCommands sync() {
        return sync;
    }

    public ClientOptions getOptions() {
        return options;
    }

    public DocumentCollection collection(String name) {
        return new DocumentCollection(name, options.keyspace(), sync, async, options.serdesOptions(), options.requestTimeoutMs());
    }

    public Table table(String name) {
        return new Table(name, options.keyspace(), sync, async, options.serdesOptions(), options.requestTimeoutMs());
    }

    private DataApiCommands newDataApiCommandsImpl() {
        return syncHandler(DataApiCommands.class);
    }

    @SuppressWarnings("unchecked")
    private <T> T syncHandler(Class<?>... interfaces) {
        return (T) Proxy.newProxyInstance(DataApiCommands.class.getClassLoader(), interfaces, syncInvocationHandler());
    }

    private InvocationHandler syncInvocationHandler() {
        return new FutureSyncInvocationHandler(DataApiAsyncCommands.class, async());
    }
}
