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

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DataApiCommandBuilderTest {
    private final DataApiCommandBuilder cmd = new DataApiCommandBuilder();

    @Test
    public void test_FIND_empty() {
        Command command = cmd.find(new FindArgs(), null);
        assertEquals(CommandType.FIND, command.type());
        assertEquals("{\"find\":{\"options\":{}}}", command.toString());
    }

    @Test
    public void test_FIND_filter_projection_sort() {
        FindArgs args = FindArgs.Builder.filter(Map.of("genre", "sci-fi")).
                projection("title", "year").
                sort(Map.of("year", -1));
        Command command = cmd.find(args, null);
        assertEquals(
                "{\"find\":{\"filter\":{\"genre\":\"sci-fi\"},\"projection\":{\"title\":true,\"year\":true}," +
                        "\"sort\":{\"year\":-1},\"options\":{}}}",
                command.toString()
        );
    }

    @Test
    public void test_FIND_options_and_page_state() {
        FindArgs args = FindArgs.Builder.limit(10).
                skip(5).
                includeSimilarity(true).
                includeSortVector(false);
        Command command = cmd.find(args, "token-1");
        assertEquals(
                "{\"find\":{\"options\":{\"limit\":10,\"skip\":5,\"includeSimilarity\":true," +
                        "\"includeSortVector\":false,\"pageState\":\"token-1\"}}}",
                command.toString()
        );
    }

    @Test
    public void test_FIND_zero_limit_is_dropped() {
        Command command = cmd.find(FindArgs.Builder.limit(0), null);
        assertEquals("{\"find\":{\"options\":{}}}", command.toString());
    }

    @Test
    public void test_FIND_empty_page_state_is_dropped() {
        Command command = cmd.find(new FindArgs(), "");
        assertEquals("{\"find\":{\"options\":{}}}", command.toString());
    }

    @Test
    public void test_FIND_ignores_hybrid_options() {
        FindArgs args = new FindArgs().hybridLimits(20).rerankOn("body").includeScores(true);
        Command command = cmd.find(args, null);
        assertEquals("{\"find\":{\"options\":{}}}", command.toString());
    }

    @Test
    public void test_FIND_AND_RERANK() {
        Map<String, Object> sort = new LinkedHashMap<>();
        sort.put("$hybrid", "tales of the sea");
        FindArgs args = FindArgs.Builder.sort(sort).
                limit(5).
                hybridLimits(20).
                includeScores(true).
                includeSortVector(true).
                rerankOn("body").
                rerankQuery("sea");
        Command command = cmd.findAndRerank(args, "p2");
        assertEquals(CommandType.FIND_AND_RERANK, command.type());
        assertEquals(
                "{\"findAndRerank\":{\"sort\":{\"$hybrid\":\"tales of the sea\"},\"options\":{\"limit\":5," +
                        "\"hybridLimits\":20,\"includeScores\":true,\"rerankOn\":\"body\",\"rerankQuery\":\"sea\"," +
                        "\"includeSortVector\":true,\"pageState\":\"p2\"}}}",
                command.toString()
        );
    }

    @Test
    public void test_FIND_AND_RERANK_hybrid_limits_per_field() {
        Map<String, Integer> limits = new LinkedHashMap<>();
        limits.put("$vector", 30);
        limits.put("$lexical", 10);
        Command command = cmd.findAndRerank(new FindArgs().hybridLimits(limits).skip(3).includeSimilarity(true), null);
        assertEquals(
                "{\"findAndRerank\":{\"options\":{\"hybridLimits\":{\"$vector\":30,\"$lexical\":10}}}}",
                command.toString()
        );
    }

    @Test
    public void test_FIND_AND_RERANK_zero_hybrid_limit_is_dropped() {
        Command command = cmd.findAndRerank(new FindArgs().hybridLimits(0), null);
        assertEquals("{\"findAndRerank\":{\"options\":{}}}", command.toString());
    }

    @Test
    public void test_nested_filter() {
        Map<String, Object> filter = Map.of("$and", List.of(Map.of("a", 1)));
        Command command = cmd.find(FindArgs.Builder.filter(filter), null);
        assertEquals("{\"find\":{\"filter\":{\"$and\":[{\"a\":1}]},\"options\":{}}}", command.toString());
    }

    @Test
    public void test_null_args() {
        assertThrows(IllegalArgumentException.class, () -> cmd.find(null, null));
    }
}
