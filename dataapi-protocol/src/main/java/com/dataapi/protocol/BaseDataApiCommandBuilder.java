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

public class BaseDataApiCommandBuilder {

    protected final ObjectMapper mapper;

    public BaseDataApiCommandBuilder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Creates a new command for the specified command type, wrapping the given body under the
     * command name.
     *
     * @param type the command type that names the payload
     * @param body the command body
     * @return a newly created command instance
     */
    protected Command createCommand(CommandType type, ObjectNode body) {
        ObjectNode payload = mapper.createObjectNode();
        payload.set(type.getName(), body);
        return new Command(type, payload);
    }
}
