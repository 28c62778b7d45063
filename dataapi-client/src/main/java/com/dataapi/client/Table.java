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

import com.dataapi.client.cursor.AsyncFindCursor;
import com.dataapi.client.cursor.FindCursor;
import com.dataapi.client.engine.FindQueryEngine;
import com.dataapi.client.engine.TableFindShape;
import com.dataapi.client.serdes.SerdesOptions;
import com.dataapi.client.serdes.TableRowDecoder;
import com.dataapi.client.timeout.CursorTimeouts;
import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;
import com.dataapi.protocol.FindArgs;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * A table with a fixed set of typed columns. Rows are decoded with the schema sent along with each page.
 */
public class Table extends AbstractDataSource {
    private final TableFindShape findShape;

    public Table(String name,
                 String keyspace,
                 @Nullable DataApiCommands sync,
                 @Nullable DataApiAsyncCommands async,
                 SerdesOptions serdesOptions,
                 @Nullable Long requestTimeoutMs) {
        super(name, keyspace, sync, async, serdesOptions, requestTimeoutMs);
        this.findShape = new TableFindShape(new TableRowDecoder(serdesOptions));
    }

    public FindCursor<Map<String, Object>, Map<String, Object>> find() {
        return find(FindArgs.Builder.empty());
    }

    public FindCursor<Map<String, Object>, Map<String, Object>> find(FindArgs args) {
        return find(args, defaultCursorTimeouts());
    }

    public FindCursor<Map<String, Object>, Map<String, Object>> find(FindArgs args, CursorTimeouts timeouts) {
        return FindCursor.create(new FindQueryEngine<>(this, args, findShape), timeouts);
    }

    public AsyncFindCursor<Map<String, Object>, Map<String, Object>> findAsync(FindArgs args) {
        return findAsync(args, defaultCursorTimeouts());
    }

    public AsyncFindCursor<Map<String, Object>, Map<String, Object>> findAsync(FindArgs args, CursorTimeouts timeouts) {
        return AsyncFindCursor.create(new FindQueryEngine<>(this, args, findShape), timeouts);
    }
}
