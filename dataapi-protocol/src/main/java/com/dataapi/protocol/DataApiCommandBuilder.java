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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

public class DataApiCommandBuilder extends BaseDataApiCommandBuilder {

    public DataApiCommandBuilder() {
        this(JSONUtil.objectMapper);
    }

    public DataApiCommandBuilder(ObjectMapper mapper) {
        super(mapper);
    }

    /**
     * Constructs a {@code find} command for one page of results.
     *
     * @param findArgs  the query arguments
     * @param pageState the continuation token returned with the previous page, or null for the first page
     * @return a {@link Command} carrying the complete find payload
     */
    public Command find(FindArgs findArgs, @Nullable String pageState) {
        return paginated(CommandType.FIND, findArgs, pageState);
    }

    /**
     * Constructs a {@code findAndRerank} command for one page of hybrid search results.
     *
     * @param findArgs  the query arguments, including the hybrid options
     * @param pageState the continuation token returned with the previous page, or null for the first page
     * @return a {@link Command} carrying the complete findAndRerank payload
     */
    public Command findAndRerank(FindArgs findArgs, @Nullable String pageState) {
        return paginated(CommandType.FIND_AND_RERANK, findArgs, pageState);
    }

    private Command paginated(CommandType type, FindArgs findArgs, @Nullable String pageState) {
        if (findArgs == null) {
            throw new IllegalArgumentException("find arguments cannot be null");
        }
        ObjectNode body = mapper.createObjectNode();
        findArgs.build(type, body);
        if (pageState != null && !pageState.isEmpty()) {
            ((ObjectNode) body.get("options")).put(OptionKeywords.PAGE_STATE.getKey(), pageState);
        }
        return createCommand(type, body);
    }
}
