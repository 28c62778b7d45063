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
import com.google.common.io.BaseEncoding;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the JSON forms of a vector, either a numeric array or {@code {"$binary": "<base64>"}}, into the
 * representation selected by {@link SerdesOptions}.
 */
public class VectorCodec {
    public static final String BINARY_KEY = "$binary";

    private VectorCodec() {
    }

    @Nullable
    public static List<Float> decode(@Nullable JsonNode node, SerdesOptions options) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        DataApiVector vector;
        if (node.isArray()) {
            float[] values = new float[node.size()];
            for (int i = 0; i < values.length; i++) {
                JsonNode item = node.get(i);
                if (!item.isNumber()) {
                    throw new UnexpectedResponseException("Vector contains a non-numeric component: " + item, node);
                }
                // BigDecimal components come from the decimal-safe parser
                values[i] = item.floatValue();
            }
            vector = new DataApiVector(values);
        } else if (node.isObject() && node.has(BINARY_KEY)) {
            vector = DataApiVector.fromBytes(decodeBinary(node.get(BINARY_KEY).asText()));
        } else {
            throw new UnexpectedResponseException("Unrecognized vector representation", node);
        }
        if (options.customDatatypesInReading()) {
            return vector;
        }
        return new ArrayList<>(vector);
    }

    static byte[] decodeBinary(String base64) {
        try {
            return BaseEncoding.base64().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new UnexpectedResponseException("Malformed base64 payload: " + base64, base64);
        }
    }
}
