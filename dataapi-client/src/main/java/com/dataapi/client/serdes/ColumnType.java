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

import java.util.Locale;

/**
 * Column types a table's projection schema may report.
 */
public enum ColumnType {
    TEXT,
    ASCII,
    INET,
    DURATION,
    BOOLEAN,
    INT,
    SMALLINT,
    TINYINT,
    BIGINT,
    COUNTER,
    VARINT,
    FLOAT,
    DOUBLE,
    DECIMAL,
    BLOB,
    UUID,
    TIMEUUID,
    DATE,
    TIME,
    TIMESTAMP,
    VECTOR,
    LIST,
    SET,
    MAP,
    UNSUPPORTED;

    public static ColumnType fromApiName(String name) {
        if (name == null) {
            return UNSUPPORTED;
        }
        try {
            return ColumnType.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNSUPPORTED;
        }
    }
}
