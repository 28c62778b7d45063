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

import com.dataapi.client.FakeDataApiServer;
import com.dataapi.client.serdes.DocumentDecoder;
import com.dataapi.client.serdes.SerdesOptions;
import com.dataapi.common.MissingDataSourceException;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.dataapi.client.FakeDataApiServer.documents;
import static com.dataapi.client.FakeDataApiServer.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindQueryEngineTest {
    private final FakeDataApiServer server = new FakeDataApiServer();
    private final DocumentFindShape shape = new DocumentFindShape(new DocumentDecoder(SerdesOptions.DEFAULT));

    @Test
    void test_fetch_page() {
        server.respond(page(documents(0, 2), "next"));
        FindQueryEngine<Map<String, Object>> engine = new FindQueryEngine<>(server.collection("people"), new FindArgs(), shape);

        Page<Map<String, Object>> page = engine.fetchPage(null, RequestTimeout.ofMillis(100));

        assertThat(page.items()).hasSize(2);
        assertThat(page.nextPageState()).isEqualTo("next");
        assertThat(page.status()).isNull();
        assertThat(server.timeouts()).containsExactly(RequestTimeout.ofMillis(100));
    }

    @Test
    void test_fetch_page_async() {
        server.respond(page(documents(0, 1), null));
        FindQueryEngine<Map<String, Object>> engine = new FindQueryEngine<>(server.collection("people"), new FindArgs(), shape);

        Page<Map<String, Object>> page = engine.fetchPageAsync("token", RequestTimeout.NONE).join();

        assertThat(page.items()).hasSize(1);
        assertThat(server.commands().get(0).body().path("options").path("pageState").asText()).isEqualTo("token");
    }

    @Test
    void test_args_are_a_snapshot() {
        FindArgs args = FindArgs.Builder.limit(5);
        FindQueryEngine<Map<String, Object>> engine = new FindQueryEngine<>(server.collection("people"), args, shape);
        args.limit(10);

        assertThat(engine.getArgs().getLimit()).isEqualTo(5);
        engine.getArgs().limit(20);
        assertThat(engine.getArgs().getLimit()).isEqualTo(5);
        assertThat(engine.withArgs(args).getArgs().getLimit()).isEqualTo(10);
    }

    @Test
    void test_missing_data_source() {
        FindQueryEngine<Map<String, Object>> engine = new FindQueryEngine<>(null, new FindArgs(), shape);

        assertThatThrownBy(() -> engine.fetchPage(null, RequestTimeout.NONE)).isInstanceOf(MissingDataSourceException.class);
        CompletableFuture<Page<Map<String, Object>>> future = engine.fetchPageAsync(null, RequestTimeout.NONE);
        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(engine::getDataSource).isInstanceOf(MissingDataSourceException.class);
    }
}
