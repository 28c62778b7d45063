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

package com.dataapi.client.serdes;

import com.dataapi.common.UnexpectedResponseException;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns collection documents, as parsed from a response, into plain Java values.
 *
 * <p>Extended-JSON wrappers are unwrapped: {@code {"$date": ms}} becomes an {@link Instant},
 * {@code {"$uuid": "..."}} a {@link UUID} and {@code {"$binary": "..."}} a byte array. The {@code $vector} field
 * is decoded with {@link VectorCodec}. Integral numbers map to the narrowest of Integer, Long and BigInteger,
 * other numbers to BigDecimal.</p>
 */
public class DocumentDecoder {
    public static final String VECTOR_FIELD = "$vector";
    private static final String DATE_KEY = "$date";
    private static final String UUID_KEY = "$uuid";
    private static final String OBJECT_ID_KEY = "$objectId";

    private final SerdesOptions options;

    public DocumentDecoder(SerdesOptions options) {
        this.options = options;
    }

    public Map<String, Object> decodeDocument(JsonNode document) {
        if (!document.isObject()) {
            throw new UnexpectedResponseException("Document is not a JSON object", document);
        }
        return decodeObject(document);
    }

    public List<Map<String, Object>> decodeDocuments(JsonNode documents) {
        List<Map<String, Object>> result = new ArrayList<>(documents.size());
        for (JsonNode document : documents) {
            result.add(decodeDocument(document));
        }
        return result;
    }

    private Map<String, Object> decodeObject(JsonNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (VECTOR_FIELD.equals(field.getKey())) {
                result.put(field.getKey(), VectorCodec.decode(field.getValue(), options));
            } else {
                result.put(field.getKey(), decodeValue(field.getValue()));
            }
        }
        return result;
    }

    @Nullable
    public Object decodeValue(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            if (node.size() == 1) {
                if (node.has(DATE_KEY) && node.get(DATE_KEY).isIntegralNumber()) {
                    return Instant.ofEpochMilli(node.get(DATE_KEY).longValue());
                }
                if (node.has(UUID_KEY) && node.get(UUID_KEY).isTextual()) {
                    return UUID.fromString(node.get(UUID_KEY).asText());
                }
                if (node.has(OBJECT_ID_KEY) && node.get(OBJECT_ID_KEY).isTextual()) {
                    return node.get(OBJECT_ID_KEY).asText();
                }
                if (node.has(VectorCodec.BINARY_KEY) && node.get(VectorCodec.BINARY_KEY).isTextual()) {
                    return VectorCodec.decodeBinary(node.get(VectorCodec.BINARY_KEY).asText());
                }
            }
            return decodeObject(node);
        }
        if (node.isArray()) {
            List<Object> result = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                result.add(decodeValue(item));
            }
            return result;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            if (node.canConvertToInt()) {
                return node.intValue();
            }
            if (node.canConvertToLong()) {
                return node.longValue();
            }
            return node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        throw new UnexpectedResponseException("Unsupported JSON value: " + node.getNodeType(), node);
    }
}
