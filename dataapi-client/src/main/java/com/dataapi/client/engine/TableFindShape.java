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

import com.dataapi.client.serdes.TableRowDecoder;
import com.dataapi.protocol.FindArgs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * {@code find} on a table. Rows are decoded against the projection schema carried by each response.
 */
public class TableFindShape extends AbstractFindShape<Map<String, Object>> {
    private final TableRowDecoder decoder;

    public TableFindShape(TableRowDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public Page<Map<String, Object>> parse(ObjectNode response, FindArgs args) {
        ArrayNode rows = ResponseFields.documents(commandName(), response);
        String nextPageState = ResponseFields.nextPageState(commandName(), response);
        ObjectNode status = ResponseFields.status(response);
        JsonNode schema = status == null ? null : status.get(ResponseFields.PROJECTION_SCHEMA);
        if (!(schema instanceof ObjectNode)) {
            throw ResponseFields.faulty(commandName(), ResponseFields.PROJECTION_SCHEMA, response);
        }
        List<Map<String, Object>> items = decoder.decodeRows(rows, (ObjectNode) schema, args.isIncludeSimilarity());
        return new Page<>(items, nextPageState, status);
    }
}
