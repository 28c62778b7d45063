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

package com.dataapi.client.engine;

import com.dataapi.protocol.CommandType;
import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Base of the shapes that page through a {@code find} command.
 */
public abstract class AbstractFindShape<R> implements WireShape<R> {

    @Override
    public String commandName() {
        return CommandType.FIND.getName();
    }

    @Override
    public ObjectNode send(DataApiCommands commands, String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout) {
        return commands.find(target, args, pageState, timeout);
    }

    @Override
    public CompletableFuture<ObjectNode> sendAsync(DataApiAsyncCommands commands, String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout) {
        return commands.find(target, args, pageState, timeout);
    }
}
