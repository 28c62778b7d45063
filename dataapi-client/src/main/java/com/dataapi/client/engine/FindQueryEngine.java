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
import com.dataapi.common.MissingDataSourceException;
import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;

/**
 * Query engine shared by every kind of find. It owns a snapshot of the query arguments and
 * delegates the command and response format to a {@link WireShape}.
 *
 * @param <R> the type of the decoded items
 */
public class FindQueryEngine<R> implements QueryEngine<R> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FindQueryEngine.class);
    private static final String EMPTY_PAGE_STATE = "(empty page state)";

    private final DataSource dataSource;
    private final FindArgs args;
    private final WireShape<R> shape;

    public FindQueryEngine(@Nullable DataSource dataSource, FindArgs args, WireShape<R> shape) {
        this.dataSource = dataSource;
        this.args = args.copy();
        this.shape = shape;
    }

    private static String describe(@Nullable String pageState) {
        return pageState == null || pageState.isEmpty() ? EMPTY_PAGE_STATE : pageState;
    }

    @Override
    public Page<R> fetchPage(@Nullable String pageState, RequestTimeout timeout) {
        DataSource source = getDataSource();
        DataApiCommands commands = source.sync();
        if (commands == null) {
            throw new MissingDataSourceException("Data source '" + source.getName() + "' has no synchronous commands");
        }
        LOGGER.debug("cursor fetching a page: {} from {}", describe(pageState), source.getName());
        ObjectNode response = shape.send(commands, source.getName(), args, pageState, timeout);
        Page<R> page = shape.parse(response, args);
        LOGGER.debug("cursor finished fetching a page: {} from {}", describe(pageState), source.getName());
        return page;
    }

    @Override
    public CompletableFuture<Page<R>> fetchPageAsync(@Nullable String pageState, RequestTimeout timeout) {
        DataSource source;
        CompletableFuture<ObjectNode> response;
        try {
            source = getDataSource();
            DataApiAsyncCommands commands = source.async();
            if (commands == null) {
                throw new MissingDataSourceException("Data source '" + source.getName() + "' has no asynchronous commands");
            }
            LOGGER.debug("cursor fetching a page: {} from {}, async", describe(pageState), source.getName());
            response = shape.sendAsync(commands, source.getName(), args, pageState, timeout);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return response.thenApply((result) -> {
            Page<R> page = shape.parse(result, args);
            LOGGER.debug("cursor finished fetching a page: {} from {}, async", describe(pageState), source.getName());
            return page;
        });
    }

    @Override
    public DataSource getDataSource() {
        if (dataSource == null) {
            throw new MissingDataSourceException("Query engine has no data source");
        }
        return dataSource;
    }

    @Override
    public FindArgs getArgs() {
        return args.copy();
    }

    @Override
    public FindQueryEngine<R> withArgs(FindArgs args) {
        return new FindQueryEngine<>(dataSource, args, shape);
    }

    public WireShape<R> getShape() {
        return shape;
    }
}
