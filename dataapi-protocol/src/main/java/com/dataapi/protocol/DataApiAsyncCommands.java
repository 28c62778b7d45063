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

/**
 * Asynchronous access to a Data API endpoint. Every method sends exactly one request and completes
 * with the parsed JSON response, or exceptionally with a timeout or response error.
 */
public interface DataApiAsyncCommands {
    CompletableFuture<ObjectNode> find(String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout);

    CompletableFuture<ObjectNode> findAndRerank(String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout);

    CompletableFuture<ObjectNode> dispatch(String target, Command command, RequestTimeout timeout);
}
