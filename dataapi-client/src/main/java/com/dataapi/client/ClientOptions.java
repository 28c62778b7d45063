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

import com.dataapi.client.serdes.SerdesOptions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import javax.annotation.Nullable;
import java.net.URI;

/**
 * Settings of a connection, read from the {@code dataapi} section of a Typesafe config.
 *
 * @param endpoint               base URL of the Data API, e.g. {@code http://localhost:8181/v1}
 * @param keyspace               keyspace holding the collections and tables
 * @param token                  sent in the {@code Token} header of every request
 * @param logCommandForDebugging log every outgoing command at DEBUG level
 * @param requestTimeoutMs       cap of a single HTTP request, null for none
 * @param connectTimeoutMs       cap of establishing a connection, null for none
 * @param serdesOptions          response decoding preferences
 */
public record ClientOptions(URI endpoint,
                            String keyspace,
                            String token,
                            boolean logCommandForDebugging,
                            @Nullable Long requestTimeoutMs,
                            @Nullable Long connectTimeoutMs,
                            SerdesOptions serdesOptions) {
    public static final String ROOT = "dataapi";

    public static ClientOptions load() {
        return fromConfig(ConfigFactory.load());
    }

    public static ClientOptions fromConfig(Config config) {
        Config section = config.getConfig(ROOT);
        return new ClientOptions(
                URI.create(section.getString("endpoint")),
                section.getString("keyspace"),
                section.getString("token"),
                section.getBoolean("log_command_for_debugging"),
                millisOrNull(section, "timeouts.request_timeout_ms"),
                millisOrNull(section, "timeouts.connect_timeout_ms"),
                new SerdesOptions(section.getBoolean("serdes.custom_datatypes_in_reading"))
        );
    }

    // Zero stands for "no timeout"
    @Nullable
    private static Long millisOrNull(Config config, String path) {
        long value = config.getLong(path);
        if (value < 0) {
            throw new IllegalArgumentException(path + " cannot be negative: " + value);
        }
        return value == 0 ? null : value;
    }

    public ClientOptions withKeyspace(String keyspace) {
        return new ClientOptions(endpoint, keyspace, token, logCommandForDebugging, requestTimeoutMs, connectTimeoutMs, serdesOptions);
    }
}
