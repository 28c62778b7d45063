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

/**
 * Blocking counterpart of {@link DataApiAsyncCommands}.
 */
public interface DataApiCommands {
    ObjectNode find(String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout);

    ObjectNode findAndRerank(String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout);

    ObjectNode dispatch(String target, Command command, RequestTimeout timeout);
}
