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

package com.dataapi.client.cursor;

import com.dataapi.client.DocumentCollection;
import com.dataapi.client.FakeDataApiServer;
import com.dataapi.client.engine.DocumentFindShape;
import com.dataapi.client.engine.FindQueryEngine;
import com.dataapi.client.serdes.DataApiVector;
import com.dataapi.client.serdes.DocumentDecoder;
import com.dataapi.client.serdes.SerdesOptions;
import com.dataapi.client.timeout.CursorTimeouts;
import com.dataapi.common.CursorException;
import com.dataapi.common.DataApiTimeoutException;
import com.dataapi.common.MissingDataSourceException;
import com.dataapi.common.UnexpectedResponseException;
import com.dataapi.protocol.FindArgs;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static com.dataapi.client.FakeDataApiServer.documents;
import static com.dataapi.client.FakeDataApiServer.json;
import static com.dataapi.client.FakeDataApiServer.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindCursorTest {
    private final FakeDataApiServer server = new FakeDataApiServer();
    private final DocumentCollection collection = server.collection("people");

    private static List<Object> seqs(List<Map<String, Object>> documents) {
        return documents.stream().map(document -> document.get("seq")).collect(Collectors.toList());
    }

    @Test
    void test_iterates_every_page_in_order() {
        server.pages(3, 3, 2);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();

        List<Map<String, Object>> result = new ArrayList<>();
        while (cursor.hasNext()) {
            result.add(cursor.next());
        }

        assertThat(seqs(result)).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThat(cursor.consumed()).isEqualTo(8);
        assertThat(cursor.pagesRetrieved()).isEqualTo(3);
        assertThat(server.requestCount()).isEqualTo(3);
        assertThat(server.commands().get(0).toString()).isEqualTo("{\"find\":{\"options\":{}}}");
        assertThat(server.commands().get(1).body().path("options").path("pageState").asText()).isEqualTo("p1");
        assertThat(server.commands().get(2).body().path("options").path("pageState").asText()).isEqualTo("p2");
    }

    @Test
    void test_next_after_exhaustion() {
        server.pages(1);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        cursor.next();

        assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThatThrownBy(cursor::next).isInstanceOf(NoSuchElementException.class);
        assertThat(server.requestCount()).isEqualTo(1);
    }

    @Test
    void test_to_list() {
        server.pages(3, 3, 2);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();

        assertThat(seqs(cursor.toList())).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThat(cursor.consumed()).isEqualTo(8);
    }

    @Test
    void test_to_list_resumes_from_current_position() {
        server.pages(3, 2);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        cursor.next();

        assertThat(seqs(cursor.toList())).containsExactly(1, 2, 3, 4);
        assertThat(cursor.consumed()).isEqualTo(5);
    }

    @Test
    void test_empty_result() {
        server.respond(page(documents(0, 0), null));
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();

        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThat(cursor.pagesRetrieved()).isEqualTo(1);
    }

    @Test
    void test_empty_page_with_continuation_token() {
        server.respond(page(documents(0, 0), "p1")).respond(page(documents(0, 2), null));
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();

        assertThat(seqs(cursor.toList())).containsExactly(0, 1);
        assertThat(cursor.pagesRetrieved()).isEqualTo(2);
    }

    @Test
    void test_close_is_idempotent() {
        server.pages(3);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        cursor.next();

        cursor.close();
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThat(cursor.bufferedCount()).isZero();

        cursor.close();
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThat(cursor.bufferedCount()).isZero();
        assertThat(cursor.consumed()).isEqualTo(1);
        assertThat(cursor.hasNext()).isFalse();
    }

    @Test
    void test_rewind() {
        server.respond(page(documents(0, 2), "p1")).respond(page(documents(2, 1), null));
        server.respond(page(documents(0, 2), "p1"));
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find(FindArgs.Builder.limit(3));
        List<Map<String, Object>> first = cursor.toList();

        cursor.rewind();
        assertThat(cursor.state()).isEqualTo(CursorState.IDLE);
        assertThat(cursor.consumed()).isZero();
        assertThat(cursor.pagesRetrieved()).isZero();
        assertThat(cursor.bufferedCount()).isZero();
        assertThat(cursor.getArgs().getLimit()).isEqualTo(3);

        assertThat(cursor.next()).isEqualTo(first.get(0));
        assertThat(server.commands().get(2).body().path("options").has("pageState")).isFalse();
    }

    @Test
    void test_clone_strips_mapper_and_history() {
        server.pages(3).pages(3);
        FindCursor<Map<String, Object>, Object> mapped = collection.find(FindArgs.Builder.sort(Map.of("seq", 1)))
                .map(document -> document.get("seq"));
        assertThat(mapped.next()).isEqualTo(0);

        FindCursor<Map<String, Object>, Map<String, Object>> clone = mapped.clone();
        assertThat(clone.state()).isEqualTo(CursorState.IDLE);
        assertThat(clone.consumed()).isZero();
        assertThat(clone.hasMapper()).isFalse();
        assertThat(clone.getArgs()).isEqualTo(mapped.getArgs());

        assertThat(clone.next()).isEqualTo(Map.of("_id", 3, "seq", 3));
        assertThat(mapped.consumed()).isEqualTo(1);
    }

    @Test
    void test_map_composition() {
        server.pages(2, 1);
        FindCursor<Map<String, Object>, Integer> cursor = collection.find()
                .map(document -> (Integer) document.get("seq"))
                .map(seq -> seq * 10);

        assertThat(cursor.toList()).containsExactly(0, 10, 20);
    }

    @Test
    void test_consume_buffer() {
        server.pages(3, 2);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        assertThat(cursor.consumeBuffer()).isEmpty();
        assertThat(server.requestCount()).isZero();

        assertThat(cursor.hasNext()).isTrue();
        assertThat(cursor.state()).isEqualTo(CursorState.IDLE);
        assertThat(seqs(cursor.consumeBuffer(2))).containsExactly(0, 1);
        assertThat(seqs(cursor.consumeBuffer(5))).containsExactly(2);
        assertThat(cursor.consumeBuffer(1)).isEmpty();
        assertThat(cursor.consumed()).isEqualTo(3);
        assertThat(server.requestCount()).isEqualTo(1);

        assertThatThrownBy(() -> cursor.consumeBuffer(-1)).isInstanceOf(IllegalArgumentException.class);

        assertThat(cursor.next().get("seq")).isEqualTo(3);
        assertThat(cursor.consumed()).isEqualTo(4);
    }

    @Test
    void test_for_each_stops_early() {
        server.pages(5);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        List<Map<String, Object>> seen = new ArrayList<>();

        cursor.forEach(document -> {
            seen.add(document);
            return seen.size() < 2;
        });

        assertThat(seqs(seen)).containsExactly(0, 1);
        assertThat(cursor.state()).isEqualTo(CursorState.STARTED);
        assertThat(cursor.consumed()).isEqualTo(2);
        assertThat(seqs(cursor.toList())).containsExactly(2, 3, 4);
    }

    @Test
    void test_for_each_keeps_progress_when_failing() {
        server.respond(page(documents(0, 2), "p1"))
                .fail(new DataApiTimeoutException("Request timed out", DataApiTimeoutException.REQUEST, "request_timeout_ms"));
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        List<Map<String, Object>> seen = new ArrayList<>();

        assertThatThrownBy(() -> cursor.forEach(seen::add)).isInstanceOf(DataApiTimeoutException.class);
        assertThat(seen).hasSize(2);
        assertThat(cursor.consumed()).isEqualTo(2);
        assertThat(cursor.pagesRetrieved()).isEqualTo(1);
        assertThat(cursor.state()).isEqualTo(CursorState.STARTED);
    }

    @Test
    void test_failed_to_list_leaves_cursor_untouched() {
        server.respond(page(documents(0, 2), "p1"))
                .fail(new DataApiTimeoutException("Request timed out", DataApiTimeoutException.REQUEST, "request_timeout_ms"));
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        cursor.next();

        assertThatThrownBy(cursor::toList).isInstanceOf(DataApiTimeoutException.class);
        assertThat(cursor.consumed()).isEqualTo(1);
        assertThat(cursor.bufferedCount()).isEqualTo(1);
        assertThat(cursor.pagesRetrieved()).isEqualTo(1);
    }

    @Test
    void test_bulk_operations_require_alive_cursor() {
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        cursor.close();

        assertThatThrownBy(cursor::toList)
                .isInstanceOf(CursorException.class)
                .hasMessageContaining("Cursor is stopped.")
                .extracting(e -> ((CursorException) e).getCursorState())
                .isEqualTo("closed");
        assertThatThrownBy(() -> cursor.forEach(document -> true)).isInstanceOf(CursorException.class);
        assertThatThrownBy(cursor::stream).isInstanceOf(CursorException.class);
    }

    @Test
    void test_missing_next_page_state_is_malformed() {
        server.respond(json("{'data': {'documents': [{'_id': 1}]}}"));
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();

        assertThatThrownBy(cursor::next)
                .isInstanceOf(UnexpectedResponseException.class)
                .hasMessageContaining("nextPageState");
        assertThat(cursor.pagesRetrieved()).isZero();
        assertThat(cursor.consumed()).isZero();
        assertThat(cursor.state()).isEqualTo(CursorState.IDLE);
    }

    @Test
    void test_reconfiguration_requires_idle() {
        server.pages(2);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        cursor.next();

        assertThatThrownBy(() -> cursor.filter(Map.of("a", 1)))
                .isInstanceOf(CursorException.class)
                .hasMessageContaining("Cursor is not idle anymore.")
                .extracting(e -> ((CursorException) e).getCursorState())
                .isEqualTo("started");
        assertThatThrownBy(() -> cursor.limit(1)).isInstanceOf(CursorException.class);
        assertThatThrownBy(() -> cursor.map(document -> document)).isInstanceOf(CursorException.class);
    }

    @Test
    void test_shape_changing_settings_require_no_mapper() {
        FindCursor<Map<String, Object>, Object> cursor = collection.find().map(document -> document.get("_id"));

        assertThatThrownBy(() -> cursor.project(Map.of("a", true)))
                .isInstanceOf(CursorException.class)
                .hasMessageContaining("Cannot set projection after map.");
        assertThatThrownBy(() -> cursor.includeSimilarity(true)).isInstanceOf(CursorException.class);
        assertThatThrownBy(() -> cursor.includeSortVector(true)).isInstanceOf(CursorException.class);
        assertThatThrownBy(() -> cursor.includeScores(true)).isInstanceOf(CursorException.class);
        assertThat(cursor.sort(Map.of("a", 1)).getArgs().getSort()).isEqualTo(Map.of("a", 1));
    }

    @Test
    void test_setters_return_new_cursor() {
        server.pages(1);
        FindCursor<Map<String, Object>, Map<String, Object>> original = collection.find(FindArgs.Builder.filter(Map.of("a", 1)));
        FindCursor<Map<String, Object>, Map<String, Object>> limited = original.limit(5).skip(2).includeSimilarity(true);

        assertThat(original.getArgs().getLimit()).isNull();
        assertThat(limited).isNotSameAs(original);
        limited.toList();

        ObjectNode options = (ObjectNode) server.commands().get(0).body().get("options");
        assertThat(options.toString()).isEqualTo("{\"limit\":5,\"skip\":2,\"includeSimilarity\":true}");
        assertThat(server.commands().get(0).body().get("filter").toString()).isEqualTo("{\"a\":1}");
    }

    @Test
    void test_has_next_does_not_consume() {
        server.pages(1);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();

        assertThat(cursor.hasNext()).isTrue();
        assertThat(cursor.hasNext()).isTrue();
        assertThat(cursor.state()).isEqualTo(CursorState.IDLE);
        assertThat(cursor.consumed()).isZero();

        cursor.next();
        assertThat(cursor.hasNext()).isFalse();
        assertThat(cursor.state()).isEqualTo(CursorState.CLOSED);
        assertThat(server.requestCount()).isEqualTo(1);
    }

    @Test
    void test_sort_vector() {
        ObjectNode response = page(documents(0, 1), null);
        response.set("status", json("{'sortVector': [0.5, -0.25]}"));
        server.respond(response);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find().includeSortVector(true);

        List<Float> sortVector = cursor.getSortVector();
        assertThat(sortVector).isInstanceOf(DataApiVector.class).containsExactly(0.5f, -0.25f);
        assertThat(cursor.state()).isEqualTo(CursorState.IDLE);
        assertThat(server.commands().get(0).body().path("options").path("includeSortVector").asBoolean()).isTrue();
    }

    @Test
    void test_sort_vector_as_plain_list() {
        ObjectNode response = page(documents(0, 1), null);
        response.set("status", json("{'sortVector': [1.5]}"));
        server.respond(response);
        DocumentCollection plain = server.collection("people", new SerdesOptions(false), null);

        List<Float> sortVector = plain.find().getSortVector();
        assertThat(sortVector).isInstanceOf(ArrayList.class).containsExactly(1.5f);
    }

    @Test
    void test_sort_vector_absent() {
        server.pages(1);
        assertThat(collection.find().getSortVector()).isNull();
    }

    @Test
    void test_stream() {
        server.pages(2, 2);
        List<Object> result = collection.find().stream()
                .map(document -> document.get("seq"))
                .collect(Collectors.toList());
        assertThat(result).containsExactly(0, 1, 2, 3);
    }

    @Test
    void test_missing_data_source() {
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = FindCursor.create(
                new FindQueryEngine<>(null, new FindArgs(), new DocumentFindShape(new DocumentDecoder(SerdesOptions.DEFAULT))),
                CursorTimeouts.NONE
        );

        assertThatThrownBy(cursor::next).isInstanceOf(MissingDataSourceException.class);
        assertThatThrownBy(cursor::dataSource).isInstanceOf(MissingDataSourceException.class);
        assertThat(cursor.state()).isEqualTo(CursorState.IDLE);
    }

    @Test
    void test_expired_overall_timeout() {
        server.pages(1);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find(new FindArgs(), CursorTimeouts.of(null, 0L));

        assertThatThrownBy(cursor::next)
                .isInstanceOf(DataApiTimeoutException.class)
                .extracting(e -> ((DataApiTimeoutException) e).getTimeoutType())
                .isEqualTo(DataApiTimeoutException.GENERIC);
        assertThat(server.requestCount()).isZero();
    }

    @Test
    void test_request_timeout_is_passed_to_each_fetch() {
        server.pages(1, 1);
        DocumentCollection timed = server.collection("people", SerdesOptions.DEFAULT, 5000L);
        timed.find().toList();

        assertThat(server.timeouts()).hasSize(2);
        assertThat(server.timeouts()).allSatisfy(timeout -> {
            assertThat(timeout.requestMs()).isEqualTo(5000L);
            assertThat(timeout.label()).isEqualTo(CursorTimeouts.REQUEST_TIMEOUT_LABEL);
        });
    }

    @Test
    void test_bulk_timeout_caps_request_timeout() {
        server.pages(1);
        DocumentCollection timed = server.collection("people", SerdesOptions.DEFAULT, 5000L);
        timed.find().toList(2000L);

        assertThat(server.timeouts().get(0).requestMs()).isLessThanOrEqualTo(2000L);
    }

    @Test
    void test_to_string() {
        server.pages(2);
        FindCursor<Map<String, Object>, Map<String, Object>> cursor = collection.find();
        assertThat(cursor.toString()).isEqualTo("FindCursor(\"people\", idle, consumed so far: 0)");

        cursor.next();
        assertThat(cursor.toString()).isEqualTo("FindCursor(\"people\", started, consumed so far: 1)");
    }
}
