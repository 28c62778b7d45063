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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Decodes table rows according to the {@code projectionSchema} the Data API sends along with every page.
 *
 * <p>Every column of the schema is present in a decoded row: columns the server omitted are filled with
 * {@code null}, or with an empty container for list, set and map columns. A row carrying a field that the schema
 * does not describe is rejected. Decoders are built once per schema and cached.</p>
 */
public class TableRowDecoder {
    public static final String SIMILARITY_PSEUDO_COLUMN = "$similarity";
    private static final int MAXIMUM_CACHED_SCHEMAS = 256;

    private final SerdesOptions options;
    private final DocumentDecoder fallbackDecoder;
    private final LoadingCache<SchemaKey, RowDecoder> rowDecoders;

    public TableRowDecoder(SerdesOptions options) {
        this.options = options;
        this.fallbackDecoder = new DocumentDecoder(options);
        this.rowDecoders = CacheBuilder.newBuilder()
                .maximumSize(MAXIMUM_CACHED_SCHEMAS)
                .build(new CacheLoader<>() {
                    @Override
                    public @Nonnull RowDecoder load(@Nonnull SchemaKey key) {
                        return createRowDecoder(key.schema(), key.includeSimilarity());
                    }
                });
    }

    /**
     * Decodes a page of rows.
     *
     * @param rows              the {@code data.documents} array of a response
     * @param projectionSchema  the {@code status.projectionSchema} object of the same response
     * @param includeSimilarity whether a {@value #SIMILARITY_PSEUDO_COLUMN} float column is expected in every row
     * @return the decoded rows in response order
     */
    public List<Map<String, Object>> decodeRows(JsonNode rows, ObjectNode projectionSchema, boolean includeSimilarity) {
        if (rows.isEmpty()) {
            return new ArrayList<>();
        }
        RowDecoder rowDecoder;
        try {
            rowDecoder = rowDecoders.getUnchecked(new SchemaKey(projectionSchema, includeSimilarity));
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            result.add(rowDecoder.decode(row));
        }
        return result;
    }

    private RowDecoder createRowDecoder(ObjectNode schema, boolean includeSimilarity) {
        Map<String, ColumnDecoder> decoders = new LinkedHashMap<>();
        Map<String, Supplier<Object>> fillers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> columns = schema.fields();
        while (columns.hasNext()) {
            Map.Entry<String, JsonNode> column = columns.next();
            decoders.put(column.getKey(), createColumnDecoder(column.getValue()));
            fillers.put(column.getKey(), filler(column.getValue()));
        }
        if (includeSimilarity) {
            // Requesting similarity overrides whatever the schema says about this name
            decoders.put(SIMILARITY_PSEUDO_COLUMN, scalarDecoder(ColumnType.FLOAT));
            fillers.put(SIMILARITY_PSEUDO_COLUMN, () -> null);
        }
        return new RowDecoder(decoders, fillers);
    }

    private ColumnType typeOf(JsonNode descriptor) {
        if (descriptor.isTextual()) {
            return ColumnType.fromApiName(descriptor.asText());
        }
        return ColumnType.fromApiName(descriptor.path("type").asText(null));
    }

    private Supplier<Object> filler(JsonNode descriptor) {
        return switch (typeOf(descriptor)) {
            case LIST -> ArrayList::new;
            case SET -> LinkedHashSet::new;
            case MAP -> LinkedHashMap::new;
            default -> () -> null;
        };
    }

    ColumnDecoder createColumnDecoder(JsonNode descriptor) {
        ColumnType type = typeOf(descriptor);
        switch (type) {
            case VECTOR:
                return value -> VectorCodec.decode(value, options);
            case LIST: {
                ColumnDecoder item = createColumnDecoder(valueTypeOf(descriptor));
                return value -> {
                    List<Object> list = new ArrayList<>(value.size());
                    for (JsonNode element : value) {
                        list.add(item.decodeNullable(element));
                    }
                    return list;
                };
            }
            case SET: {
                ColumnDecoder item = createColumnDecoder(valueTypeOf(descriptor));
                return value -> {
                    Set<Object> set = new LinkedHashSet<>();
                    for (JsonNode element : value) {
                        set.add(item.decodeNullable(element));
                    }
                    return set;
                };
            }
            case MAP: {
                ColumnDecoder keyDecoder = createColumnDecoder(keyTypeOf(descriptor));
                ColumnDecoder valueDecoder = createColumnDecoder(valueTypeOf(descriptor));
                return value -> decodeMap(value, keyDecoder, valueDecoder);
            }
            case UNSUPPORTED:
                return fallbackDecoder::decodeValue;
            default:
                return scalarDecoder(type);
        }
    }

    private JsonNode valueTypeOf(JsonNode descriptor) {
        JsonNode valueType = descriptor.path("valueType");
        if (valueType.isMissingNode() || valueType.isNull()) {
            throw new UnexpectedResponseException("Collection column descriptor has no 'valueType'", descriptor);
        }
        return valueType;
    }

    private JsonNode keyTypeOf(JsonNode descriptor) {
        JsonNode keyType = descriptor.path("keyType");
        if (keyType.isMissingNode() || keyType.isNull()) {
            throw new UnexpectedResponseException("Map column descriptor has no 'keyType'", descriptor);
        }
        return keyType;
    }

    private Map<Object, Object> decodeMap(JsonNode value, ColumnDecoder keyDecoder, ColumnDecoder valueDecoder) {
        Map<Object, Object> map = new LinkedHashMap<>();
        if (value.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = value.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                JsonNode key = TextNode.valueOf(entry.getKey());
                map.put(keyDecoder.decodeNullable(key), valueDecoder.decodeNullable(entry.getValue()));
            }
        } else if (value.isArray()) {
            // Non-string keys arrive as an association list: [[k1, v1], [k2, v2], ...]
            for (JsonNode pair : value) {
                if (!pair.isArray() || pair.size() != 2) {
                    throw new UnexpectedResponseException("Malformed map entry: " + pair, value);
                }
                map.put(keyDecoder.decodeNullable(pair.get(0)), valueDecoder.decodeNullable(pair.get(1)));
            }
        } else {
            throw new UnexpectedResponseException("Unexpected value for a map column: " + value, value);
        }
        return map;
    }

    private ColumnDecoder scalarDecoder(ColumnType type) {
        return switch (type) {
            case TEXT, ASCII, INET, DURATION -> JsonNode::asText;
            case BOOLEAN -> JsonNode::asBoolean;
            case INT, SMALLINT, TINYINT -> value -> value.isNumber() ? value.intValue() : Integer.parseInt(value.asText());
            case BIGINT, COUNTER -> value -> value.isNumber() ? value.longValue() : Long.parseLong(value.asText());
            case VARINT -> value -> value.isNumber() ? value.bigIntegerValue() : new BigDecimal(value.asText()).toBigIntegerExact();
            // Non-finite values ("NaN", "Infinity", "-Infinity") arrive as strings
            case FLOAT -> value -> value.isNumber() ? value.floatValue() : Float.parseFloat(value.asText());
            case DOUBLE -> value -> value.isNumber() ? value.doubleValue() : Double.parseDouble(value.asText());
            case DECIMAL -> value -> value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText());
            case BLOB -> value -> value.isObject()
                    ? VectorCodec.decodeBinary(value.path(VectorCodec.BINARY_KEY).asText())
                    : VectorCodec.decodeBinary(value.asText());
            case UUID, TIMEUUID -> value -> java.util.UUID.fromString(value.asText());
            case DATE -> value -> LocalDate.parse(value.asText());
            case TIME -> value -> LocalTime.parse(value.asText());
            case TIMESTAMP -> value -> value.isNumber() ? Instant.ofEpochMilli(value.longValue()) : Instant.parse(value.asText());
            default -> throw new IllegalArgumentException("Not a scalar column type: " + type);
        };
    }

    @FunctionalInterface
    interface ColumnDecoder {
        Object decode(JsonNode value);

        @Nullable
        default Object decodeNullable(@Nullable JsonNode value) {
            if (value == null || value.isNull() || value.isMissingNode()) {
                return null;
            }
            return decode(value);
        }
    }

    private record SchemaKey(ObjectNode schema, boolean includeSimilarity) {
    }

    private static final class RowDecoder {
        private final Map<String, ColumnDecoder> decoders;
        private final Map<String, Supplier<Object>> fillers;

        RowDecoder(Map<String, ColumnDecoder> decoders, Map<String, Supplier<Object>> fillers) {
            this.decoders = decoders;
            this.fillers = fillers;
        }

        Map<String, Object> decode(JsonNode row) {
            if (!row.isObject()) {
                throw new UnexpectedResponseException("Row is not a JSON object", row);
            }
            Set<String> unexpected = new TreeSet<>();
            row.fieldNames().forEachRemaining(name -> {
                if (!decoders.containsKey(name)) {
                    unexpected.add("\"" + name + "\"");
                }
            });
            if (!unexpected.isEmpty()) {
                throw new UnexpectedResponseException("Returned row has unexpected fields: " + String.join(", ", unexpected), row);
            }

            Map<String, Object> decoded = new LinkedHashMap<>();
            for (Map.Entry<String, ColumnDecoder> column : decoders.entrySet()) {
                JsonNode value = row.get(column.getKey());
                if (value == null) {
                    decoded.put(column.getKey(), fillers.get(column.getKey()).get());
                } else {
                    decoded.put(column.getKey(), column.getValue().decodeNullable(value));
                }
            }
            return decoded;
        }
    }
}
