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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CursorBufferTest {

    @Test
    void test_consume() {
        CursorBuffer<String> buffer = new CursorBuffer<>();
        buffer.replaceWith(List.of("a", "b", "c"));

        assertThat(buffer.consume(2)).containsExactly("a", "b");
        assertThat(buffer.consume(2)).containsExactly("c");
        assertThat(buffer.consume(2)).isEmpty();
        assertThat(buffer.consume(0)).isEmpty();
        assertThatThrownBy(() -> buffer.consume(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void test_replace_discards_previous_items() {
        CursorBuffer<String> buffer = new CursorBuffer<>();
        buffer.replaceWith(List.of("a", "b"));
        buffer.replaceWith(List.of("c"));

        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.poll()).isEqualTo("c");
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void test_copy_is_independent() {
        CursorBuffer<String> buffer = new CursorBuffer<>();
        buffer.replaceWith(List.of("a", "b"));
        CursorBuffer<String> copy = buffer.copy();

        copy.poll();
        assertThat(buffer.size()).isEqualTo(2);
        assertThat(copy.size()).isEqualTo(1);
    }
}
