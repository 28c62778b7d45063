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
import com.dataapi.common.DataApiTimeoutException;
import com.dataapi.protocol.RequestTimeout;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invocation-handler to synchronize API calls which use futures as backend. Every call is forwarded to the
 * method of the asynchronous API with the same signature, and the returned future is awaited.
 *
 * <p>The wait is capped by the {@link RequestTimeout} argument of the call, if any. The asynchronous
 * implementation enforces the same deadline, the cap only guards against a future that never completes.</p>
 */
class FutureSyncInvocationHandler implements InvocationHandler {
    private static final long AWAIT_GRACE_MS = 1000;

    private final Class<?> asyncCommandsInterface;

    private final Object asyncApi;

    private final Map<Method, Method> apiMethodCache = new ConcurrentHashMap<>();

    FutureSyncInvocationHandler(Class<?> asyncCommandsInterface, Object asyncApi) {
        this.asyncCommandsInterface = asyncCommandsInterface;
        this.asyncApi = asyncApi;
    }

    private static RequestTimeout findTimeout(Object[] args) {
        if (args != null) {
            for (Object arg : args) {
                if (arg instanceof RequestTimeout) {
                    return (RequestTimeout) arg;
                }
            }
        }
        return RequestTimeout.NONE;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return handleObjectMethod(proxy, method, args);
        }

        try {
            Method targetMethod = apiMethodCache.computeIfAbsent(method, key -> {
                try {
                    return asyncCommandsInterface.getMethod(key.getName(), key.getParameterTypes());
                } catch (NoSuchMethodException e) {
                    throw new IllegalStateException(e);
                }
            });

            Object result = targetMethod.invoke(asyncApi, args);
            if (result instanceof CompletableFuture) {
                return await((CompletableFuture<?>) result, findTimeout(args));
            }
            return result;
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private Object await(CompletableFuture<?> future, RequestTimeout timeout) throws Throwable {
        try {
            if (timeout.isUnlimited()) {
                return future.get();
            }
            return future.get(timeout.requestMs() + AWAIT_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DataApiTimeoutException(
                    String.format("Command timed out after %d ms", timeout.requestMs()),
                    DataApiTimeoutException.REQUEST,
                    timeout.label(),
                    e
            );
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataApiException("Interrupted while waiting for a response", e);
        }
    }

    private Object handleObjectMethod(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "Synchronous proxy of " + asyncApi;
            default:
                throw new UnsupportedOperationException(method.getName());
        }
    }
}
