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
import com.dataapi.common.UnexpectedResponseException;
import com.dataapi.protocol.CommandType;
import com.dataapi.protocol.DataApiAsyncCommands;
import com.dataapi.protocol.DataApiCommands;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@code findAndRerank} on a collection. Documents are paired positionally with the entries of
 * {@code status.documentResponses}.
 */
public class HybridRerankShape implements WireShape<RerankedResult<Map<String, Object>>> {
    private static final String SCORES = "scores";

    private final DocumentDecoder decoder;

    public HybridRerankShape(DocumentDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public String commandName() {
        return CommandType.FIND_AND_RERANK.getName();
    }

    @Override
    public ObjectNode send(DataApiCommands commands, String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout) {
        return commands.findAndRerank(target, args, pageState, timeout);
    }

    @Override
    public CompletableFuture<ObjectNode> sendAsync(DataApiAsyncCommands commands, String target, FindArgs args, @Nullable String pageState, RequestTimeout timeout) {
        return commands.findAndRerank(target, args, pageState, timeout);
    }

    @Override
    public Page<RerankedResult<Map<String, Object>>> parse(ObjectNode response, FindArgs args) {
        ArrayNode documents = ResponseFields.documents(commandName(), response);
        String nextPageState = ResponseFields.nextPageState(commandName(), response);
        ObjectNode status = ResponseFields.status(response);
        JsonNode documentResponses = status == null ? null : status.get(ResponseFields.DOCUMENT_RESPONSES);
        if (documentResponses != null && documentResponses.isNull()) {
            documentResponses = null;
        }

        if (documentResponses == null) {
            if (args.isIncludeScores()) {
                throw ResponseFields.faulty(commandName(), ResponseFields.DOCUMENT_RESPONSES, response);
            }
        } else if (!documentResponses.isArray() || documentResponses.size() != documents.size()) {
            throw new UnexpectedResponseException(
                    String.format("Faulty response from %s API command (%d documents, mismatching 'documentResponses').",
                            commandName(), documents.size()),
                    response
            );
        }

        List<RerankedResult<Map<String, Object>>> items = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            Map<String, Object> document = decoder.decodeDocument(documents.get(i));
            JsonNode scores = documentResponses == null ? null : documentResponses.get(i).get(SCORES);
            items.add(new RerankedResult<>(document, decodeScores(scores, response)));
        }
        return new Page<>(items, nextPageState, status);
    }

    private Map<String, Double> decodeScores(@Nullable JsonNode scores, ObjectNode response) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (scores == null || scores.isNull()) {
            return result;
        }
        if (!scores.isObject()) {
            throw new UnexpectedResponseException("Unexpected type of 'scores': " + scores.getNodeType(), response);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = scores.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> score = fields.next();
            JsonNode value = score.getValue();
            if (value.isNull()) {
                result.put(score.getKey(), null);
            } else if (value.isNumber()) {
                result.put(score.getKey(), value.doubleValue());
            } else {
                // Non-finite scores arrive as strings
                result.put(score.getKey(), Double.parseDouble(value.asText()));
            }
        }
        return result;
    }
}
