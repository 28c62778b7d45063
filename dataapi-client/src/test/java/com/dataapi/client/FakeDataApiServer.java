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
import com.dataapi.protocol.AbstractDataApiAsyncCommands;
import com.dataapi.protocol.Command;
import com.dataapi.protocol.DataApiCommandBuilder;
import com.dataapi.protocol.DataApiCommands;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.JSONUtil;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted stand-in for a Data API endpoint. Responses are served in the order they were queued, and
 * every received command is recorded.
 */
public class FakeDataApiServer {
    private final Deque<Object> script = new ConcurrentLinkedDeque<>();
    private final List<Command> commands = new CopyOnWriteArrayList<>();
    private final List<RequestTimeout> timeouts = new CopyOnWriteArrayList<>();
    private final DataApiCommandBuilder commandBuilder = new DataApiCommandBuilder();
    private int nextSeq;
    private int nextToken = 1;

    /**
     * Parses JSON written with single quotes.
     */
    public static ObjectNode json(String text) {
        return JSONUtil.readObject(text.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
    }

    public static ObjectNode page(ArrayNode documents, @Nullable String nextPageState) {
        ObjectNode response = JSONUtil.objectMapper.createObjectNode();
        ObjectNode data = response.putObject("data");
        data.set("documents", documents);
        data.put("nextPageState", nextPageState);
        return response;
    }

    /**
     * Builds {@code count} documents {@code {"_id": n, "seq": n}} starting at {@code from}.
     */
    public static ArrayNode documents(int from, int count) {
        ArrayNode documents = JSONUtil.objectMapper.createArrayNode();
        for (int seq = from; seq < from + count; seq++) {
            documents.addObject().put("_id", seq).put("seq", seq);
        }
        return documents;
    }

    public FakeDataApiServer respond(ObjectNode response) {
        script.add(response);
        return this;
    }

    public FakeDataApiServer fail(RuntimeException error) {
        script.add(error);
        return this;
    }

    /**
     * Queues one page per size. Documents are numbered {@code {"_id": n, "seq": n}} across pages,
     * tokens are {@code p1, p2, ...} and the last page carries a null token.
     */
    public FakeDataApiServer pages(int... sizes) {
        for (int i = 0; i < sizes.length; i++) {
            ArrayNode documents = documents(nextSeq, sizes[i]);
            nextSeq += sizes[i];
            String token = i == sizes.length - 1 ? null : "p" + nextToken++;
            respond(page(documents, token));
        }
        return this;
    }

    ObjectNode handle(Command command, RequestTimeout timeout) {
        commands.add(command);
        timeouts.add(timeout);
        Object next = script.poll();
        if (next == null) {
            throw new AssertionError("Unexpected request: " + command);
        }
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        return ((ObjectNode) next).deepCopy();
    }

    public List<Command> commands() {
        return new ArrayList<>(commands);
    }

    public List<RequestTimeout> timeouts() {
        return new ArrayList<>(timeouts);
    }

    public int requestCount() {
        return commands.size();
    }

    public int pending() {
        return script.size();
    }

    public DataApiCommands sync() {
        return new DataApiCommands() {
            @Override
            public ObjectNode find(String target, FindArgs args, String pageState, RequestTimeout timeout) {
                return dispatch(target, commandBuilder.find(args, pageState), timeout);
            }

            @Override
            public ObjectNode findAndRerank(String target, FindArgs args, String pageState, RequestTimeout timeout) {
                return dispatch(target, commandBuilder.findAndRerank(args, pageState), timeout);
            }

            @Override
            public ObjectNode dispatch(String target, Command command, RequestTimeout timeout) {
                return handle(command, timeout);
            }
        };
    }

    public AbstractDataApiAsyncCommands async() {
        return new AbstractDataApiAsyncCommands() {
            @Override
            public CompletableFuture<ObjectNode> dispatch(String target, Command command, RequestTimeout timeout) {
                return CompletableFuture.supplyAsync(() -> handle(command, timeout));
            }
        };
    }

    public DocumentCollection collection(String name) {
        return collection(name, SerdesOptions.DEFAULT, null);
    }

    public DocumentCollection collection(String name, SerdesOptions serdesOptions, @Nullable Long requestTimeoutMs) {
        return new DocumentCollection(name, "test_keyspace", sync(), async(), serdesOptions, requestTimeoutMs);
    }

    public Table table(String name) {
        return new Table(name, "test_keyspace", sync(), async(), SerdesOptions.DEFAULT, null);
    }
}
