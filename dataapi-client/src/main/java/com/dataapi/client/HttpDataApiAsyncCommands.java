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

import com.dataapi.common.DataApiException;
import com.dataapi.common.DataApiResponseException;
import com.dataapi.common.DataApiTimeoutException;
import com.dataapi.common.UnexpectedResponseException;
import com.dataapi.protocol.AbstractDataApiAsyncCommands;
import com.dataapi.protocol.Command;
import com.dataapi.protocol.JSONUtil;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Sends commands to a Data API endpoint over HTTP, one POST per command.
 */
public class HttpDataApiAsyncCommands extends AbstractDataApiAsyncCommands {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpDataApiAsyncCommands.class);
    private static final String TOKEN_HEADER = "Token";
    private static final String CONTENT_TYPE = "application/json";
    private static final TypeReference<Map<String, Object>> DESCRIPTOR_TYPE = new TypeReference<>() {
    };

    private final ClientOptions options;
    private final HttpClient httpClient;

    public HttpDataApiAsyncCommands(ClientOptions options) {
        this(options, newHttpClient(options));
    }

    public HttpDataApiAsyncCommands(ClientOptions options, HttpClient httpClient) {
        this.options = options;
        this.httpClient = httpClient;
    }

    private static HttpClient newHttpClient(ClientOptions options) {
        HttpClient.Builder builder = HttpClient.newBuilder();
        if (options.connectTimeoutMs() != null) {
            builder.connectTimeout(Duration.ofMillis(options.connectTimeoutMs()));
        }
        return builder.build();
    }

    URI targetUri(String target) {
        String base = options.endpoint().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/" + options.keyspace() + "/" + target);
    }

    @Override
    public CompletableFuture<ObjectNode> dispatch(String target, Command command, RequestTimeout timeout) {
        URI uri = targetUri(target);
        if (options.logCommandForDebugging()) {
            LOGGER.debug("Sending {} command to {}: {}", command.type().getName(), uri, command);
        }
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .header(TOKEN_HEADER, options.token())
                .header("Content-Type", CONTENT_TYPE)
                .header("Accept", CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofByteArray(JSONUtil.writeValueAsBytes(command.payload())));
        if (timeout.requestMs() != null) {
            request.timeout(Duration.ofMillis(timeout.requestMs()));
        }
        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        throw translate(throwable, command, timeout);
                    }
                    return parseResponse(response, command);
                });
    }

    private RuntimeException translate(Throwable throwable, Command command, RequestTimeout timeout) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause()
                : throwable;
        if (cause instanceof HttpTimeoutException) {
            return new DataApiTimeoutException(
                    String.format("%s command timed out after %d ms", command.type().getName(), timeout.requestMs()),
                    DataApiTimeoutException.REQUEST,
                    timeout.label(),
                    cause
            );
        }
        if (cause instanceof DataApiException) {
            return (DataApiException) cause;
        }
        if (cause instanceof IOException) {
            return new DataApiException("Failed to send " + command.type().getName() + " command", cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new DataApiException(cause);
    }

    private ObjectNode parseResponse(HttpResponse<byte[]> response, Command command) {
        ObjectNode body;
        try {
            body = JSONUtil.readObject(response.body());
        } catch (DataApiException e) {
            if (response.statusCode() >= 400) {
                throw new DataApiResponseException(
                        String.format("%s command failed with HTTP status %d", command.type().getName(), response.statusCode()),
                        List.of()
                );
            }
            throw e;
        }

        JsonNode errors = body.path("errors");
        boolean hasErrors = errors.isArray() && !errors.isEmpty();
        if (response.statusCode() >= 400 || (hasErrors && !body.has("data") && !body.has("status"))) {
            List<Map<String, Object>> descriptors = errorDescriptors(errors);
            throw new DataApiResponseException(errorMessage(command, response.statusCode(), descriptors), descriptors);
        }
        if (hasErrors) {
            LOGGER.warn("{} command returned a result along with errors: {}", command.type().getName(), errors);
        }
        return body;
    }

    private List<Map<String, Object>> errorDescriptors(JsonNode errors) {
        List<Map<String, Object>> descriptors = new ArrayList<>();
        if (!errors.isArray()) {
            return descriptors;
        }
        for (JsonNode error : errors) {
            if (!error.isObject()) {
                throw new UnexpectedResponseException("Unexpected error descriptor: " + error, errors);
            }
            descriptors.add(JSONUtil.objectMapper.convertValue(error, DESCRIPTOR_TYPE));
        }
        return descriptors;
    }

    private String errorMessage(Command command, int statusCode, List<Map<String, Object>> descriptors) {
        if (descriptors.isEmpty()) {
            return String.format("%s command failed with HTTP status %d", command.type().getName(), statusCode);
        }
        return descriptors.stream()
                .map((descriptor) -> String.valueOf(descriptor.getOrDefault("message", descriptor)))
                .collect(Collectors.joining("; "));
    }
}
