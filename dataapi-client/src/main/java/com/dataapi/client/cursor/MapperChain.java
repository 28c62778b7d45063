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

import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * A transform applied to raw items when they are yielded. Mappers only compose, they are never removed.
 *
 * @param <R> raw item type
 * @param <T> mapped item type
 */
public final class MapperChain<R, T> {
    private static final MapperChain<?, ?> IDENTITY = new MapperChain<>(null);

    private final Function<R, T> function;

    private MapperChain(@Nullable Function<R, T> function) {
        this.function = function;
    }

    @SuppressWarnings("unchecked")
    public static <R> MapperChain<R, R> identity() {
        return (MapperChain<R, R>) IDENTITY;
    }

    /**
     * Returns a chain that applies this chain first, then {@code next}.
     */
    public <U> MapperChain<R, U> andThen(Function<? super T, ? extends U> next) {
        if (function == null) {
            return new MapperChain<>(raw -> next.apply(apply(raw)));
        }
        Function<R, T> current = function;
        return new MapperChain<>(raw -> next.apply(current.apply(raw)));
    }

    @SuppressWarnings("unchecked")
    public T apply(R raw) {
        if (function == null) {
            return (T) raw;
        }
        return function.apply(raw);
    }

    public boolean isIdentity() {
        return function == null;
    }
}
