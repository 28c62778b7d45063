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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A document returned by a find-and-rerank query, along with the scores it received.
 *
 * @param document the document
 * @param scores   score kind (e.g. {@code $rerank}, {@code $vector}, {@code $lexical}) to value
 */
public record RerankedResult<D>(D document, Map<String, Double> scores) {
    public RerankedResult {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }
}
