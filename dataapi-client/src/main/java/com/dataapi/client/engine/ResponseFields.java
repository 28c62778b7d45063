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

import com.dataapi.common.UnexpectedResponseException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

final class ResponseFields {
    static final String DATA = "data";
    static final String STATUS = "status";
    static final String DOCUMENTS = "documents";
    static final String NEXT_PAGE_STATE = "nextPageState";
    static final String PROJECTION_SCHEMA = "projectionSchema";
    static final String DOCUMENT_RESPONSES = "documentResponses";

    private ResponseFields() {
    }

    static UnexpectedResponseException faulty(String commandName, String missing, ObjectNode response) {
        return new UnexpectedResponseException(
                String.format("Faulty response from %s API command (no '%s').", commandName, missing),
                response
        );
    }

    static ArrayNode documents(String commandName, ObjectNode response) {
        JsonNode documents = response.path(DATA).path(DOCUMENTS);
        if (!documents.isArray()) {
            throw faulty(commandName, DOCUMENTS, response);
        }
        return (ArrayNode) documents;
    }

    @Nullable
    static String nextPageState(String commandName, ObjectNode response) {
        JsonNode data = response.path(DATA);
        if (!data.has(NEXT_PAGE_STATE)) {
            throw faulty(commandName, NEXT_PAGE_STATE, response);
        }
        JsonNode token = data.get(NEXT_PAGE_STATE);
        if (token.isNull()) {
            return null;
        }
        if (!token.isTextual()) {
            throw new UnexpectedResponseException("Unexpected type of 'nextPageState': " + token.getNodeType(), response);
        }
        return token.asText();
    }

    @Nullable
    static ObjectNode status(ObjectNode response) {
        JsonNode status = response.get(STATUS);
        if (status instanceof ObjectNode) {
            return (ObjectNode) status;
        }
        return null;
    }
}
