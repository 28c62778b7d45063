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

/**
 * Keys used inside the {@code options} object of {@code find} and {@code findAndRerank}
 * payloads.
 *
 * <ul>
 *   <li>LIMIT, PAGE_STATE, INCLUDE_SORT_VECTOR: both commands</li>
 *   <li>SKIP, INCLUDE_SIMILARITY: {@code find} only</li>
 *   <li>HYBRID_LIMITS, INCLUDE_SCORES, RERANK_ON, RERANK_QUERY: {@code findAndRerank} only</li>
 * </ul>
 */
public enum OptionKeywords {
    LIMIT("limit"),
    SKIP("skip"),
    INCLUDE_SIMILARITY("includeSimilarity"),
    INCLUDE_SORT_VECTOR("includeSortVector"),
    INCLUDE_SCORES("includeScores"),
    HYBRID_LIMITS("hybridLimits"),
    RERANK_ON("rerankOn"),
    RERANK_QUERY("rerankQuery"),
    PAGE_STATE("pageState");

    private final String key;

    OptionKeywords(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
