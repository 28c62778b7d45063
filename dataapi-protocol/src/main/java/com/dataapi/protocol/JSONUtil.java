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

import com.dataapi.common.DataApiException;
import com.dataapi.common.UnexpectedResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * The JSONUtil class provides utility methods for reading and writing JSON data using the Jackson ObjectMapper.
 * Floating point numbers are read as {@link java.math.BigDecimal} so that no precision is lost before the
 * values reach the client-side decoders.
 */
public class JSONUtil {
    public static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public static ObjectNode readObject(byte[] content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(content);
        } catch (IOException e) {
            throw new DataApiException("JSON deserialization failed", e);
        }
        if (node == null || !node.isObject()) {
            throw new UnexpectedResponseException("Response body is not a JSON object", node);
        }
        return (ObjectNode) node;
    }

    public static byte[] writeValueAsBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new DataApiException("JSON serialization failed", e);
        }
    }

    public static JsonNode valueToTree(Object value) {
        return objectMapper.valueToTree(value);
    }
}
