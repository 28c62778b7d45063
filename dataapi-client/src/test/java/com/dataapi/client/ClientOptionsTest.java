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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientOptionsTest {

    @Test
    void test_reference_defaults() {
        ClientOptions options = ClientOptions.fromConfig(ConfigFactory.defaultReference());

        assertThat(options.endpoint().toString()).isEqualTo("http://localhost:8181/v1");
        assertThat(options.keyspace()).isEqualTo("default_keyspace");
        assertThat(options.logCommandForDebugging()).isFalse();
        assertThat(options.requestTimeoutMs()).isEqualTo(10000L);
        assertThat(options.connectTimeoutMs()).isEqualTo(10000L);
        assertThat(options.serdesOptions().customDatatypesInReading()).isTrue();
    }

    @Test
    void test_test_config_overrides_reference() {
        ClientOptions options = ClientOptions.fromConfig(ConfigFactory.load("test.conf"));

        assertThat(options.keyspace()).isEqualTo("test_keyspace");
        assertThat(options.token()).isEqualTo("test-token");
        assertThat(options.logCommandForDebugging()).isTrue();
        assertThat(options.requestTimeoutMs()).isEqualTo(2000L);
        assertThat(options.connectTimeoutMs()).isNull();
    }

    @Test
    void test_negative_timeout() {
        Config config = ConfigFactory.load("test.conf")
                .withValue("dataapi.timeouts.request_timeout_ms", ConfigValueFactory.fromAnyRef(-1));

        assertThatThrownBy(() -> ClientOptions.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timeouts.request_timeout_ms");
    }

    @Test
    void test_with_keyspace() {
        ClientOptions options = ClientOptions.fromConfig(ConfigFactory.load("test.conf")).withKeyspace("other");

        assertThat(options.keyspace()).isEqualTo("other");
        assertThat(options.token()).isEqualTo("test-token");
    }
}
