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

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.List;

/**
 * One server round trip's worth of results.
 *
 * @param items         decoded items in server order
 * @param nextPageState the continuation token, null once the server has nothing more to return
 * @param status        the {@code status} object of the response, if any
 */
public record Page<R>(List<R> items, @Nullable String nextPageState, @Nullable ObjectNode status) {
}
