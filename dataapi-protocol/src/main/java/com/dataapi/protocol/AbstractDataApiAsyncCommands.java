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

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

public abstract class AbstractDataApiAsyncCommands implements DataApiAsyncCommands {
    private final DataApiCommandBuilder commandBuilder;

    protected AbstractDataApiAsyncCommands() {
        this.commandBuilder = new DataApiCommandBuilder();
    }

    @Override
    public CompletableFuture<ObjectNode> find(String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout) {
        return dispatch(target, commandBuilder.find(args, pageState), timeout);
    }

    @Override
    public CompletableFuture<ObjectNode> findAndRerank(String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout) {
        return dispatch(target, commandBuilder.findAndRerank(args, pageState), timeout);
    }
}
