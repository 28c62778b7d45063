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

import com.dataapi.client.DataSource;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the pages of a single logical query. Implementations are immutable: reconfiguring a query
 * produces a new engine.
 *
 * @param <R> the type of the decoded items
 */
public interface QueryEngine<R> {
    Page<R> fetchPage(@Nullable String pageState, RequestTimeout timeout);

    CompletableFuture<Page<R>> fetchPageAsync(@Nullable String pageState, RequestTimeout timeout);

    /**
     * @return the collection or table this engine reads from
     * @throws com.dataapi.common.MissingDataSourceException if the engine has no data source
     */
    DataSource getDataSource();

    /**
     * @return a copy of the query arguments
     */
    FindArgs getArgs();

    QueryEngine<R> withArgs(FindArgs args);
}
