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

import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * The command a query sends for each page and the way its responses are read.
 *
 * @param <R> the type of the decoded items
 */
public interface WireShape<R> {
    String commandName();

    ObjectNode send(DataApiCommands commands, String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout);

    CompletableFuture<ObjectNode> sendAsync(DataApiAsyncCommands commands, String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout);

    /**
     * Decodes a response. Either the whole page is returned or an exception is thrown.
     *
     * @param response the response to a command sent by this shape
     * @param args     the arguments the command was built from
     * @return the decoded page
     * @throws com.dataapi.common.UnexpectedResponseException if a required field is missing
     */
    Page<R> parse(ObjectNode response, FindArgs args);
}
