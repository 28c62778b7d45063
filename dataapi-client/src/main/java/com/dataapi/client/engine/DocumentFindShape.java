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

import com.dataapi.client.serdes.DocumentDecoder;
import com.dataapi.protocol.FindArgs;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * {@code find} on a collection. Documents are schemaless and decoded one by one.
 */
public class DocumentFindShape extends AbstractFindShape<Map<String, Object>> {
    private final DocumentDecoder decoder;

    public DocumentFindShape(DocumentDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public Page<Map<String, Object>> parse(ObjectNode response, FindArgs args) {
        ArrayNode documents = ResponseFields.documents(commandName(), response);
        String nextPageState = ResponseFields.nextPageState(commandName(), response);
        List<Map<String, Object>> items = decoder.decodeDocuments(documents);
        return new Page<>(items, nextPageState, ResponseFields.status(response));
    }
}
