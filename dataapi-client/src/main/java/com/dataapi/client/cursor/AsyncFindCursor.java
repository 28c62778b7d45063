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

import com.dataapi.client.engine.QueryEngine;
import com.dataapi.client.timeout.CursorTimeouts;
import com.dataapi.client.timeout.TimeoutBudget;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Asynchronous cursor over the results of a find. Only page fetches are asynchronous: when the buffer
 * holds items, the returned futures are already complete.
 *
 * <p>A cursor must not be used by several callers at once. At most one page request may be in flight.</p>
 *
 * @param <R> raw item type
 * @param <T> item type after the mapper
 */
public class AsyncFindCursor<R, T> extends AbstractCursor<R, T> implements AutoCloseable {

    AsyncFindCursor(QueryEngine<R> engine, MapperChain<R, T> mapper, CursorTimeouts timeouts,
                    TimeoutBudget budget, CursorProgress<R> progress) {
        super(engine, mapper, timeouts, budget, progress);
    }

    public AsyncFindCursor(QueryEngine<R> engine, MapperChain<R, T> mapper, CursorTimeouts timeouts) {
        this(engine, mapper, timeouts, timeouts.startBudget(), new CursorProgress<>());
    }

    public static <R> AsyncFindCursor<R, R> create(QueryEngine<R> engine, CursorTimeouts timeouts) {
        return new AsyncFindCursor<>(engine, MapperChain.identity(), timeouts);
    }

    private CompletableFuture<Void> tryFillBuffer() {
        if (!needsFetch()) {
            return CompletableFuture.completedFuture(null);
        }
        RequestTimeout timeout;
        try {
            timeout = nextRequestTimeout();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return engine.fetchPageAsync(nextPageState(), timeout).thenCompose((page) -> {
            install(page);
            return tryFillBuffer();
        });
    }

    /**
     * Completes with whether more items can be consumed. May fetch a page, but never consumes an item.
     * An exhausted cursor is closed.
     */
    public CompletableFuture<Boolean> hasNext() {
        if (state() == CursorState.CLOSED) {
            return CompletableFuture.completedFuture(false);
        }
        return tryFillBuffer().thenApply((v) -> {
            if (isBufferEmpty()) {
                close();
                return false;
            }
            return true;
        });
    }

    /**
     * Completes with the next item, or exceptionally with {@link java.util.NoSuchElementException} when
     * the results are exhausted.
     */
    public CompletableFuture<T> next() {
        return tryFillBuffer().thenApply((v) -> yieldNext());
    }

    public CompletableFuture<List<Float>> getSortVector() {
        return tryFillBuffer().thenApply((v) -> sortVectorFromLastResponse());
    }

    public CompletableFuture<List<T>> toList() {
        return toList(null);
    }

    /**
     * Materializes the items not consumed yet. The cursor only advances if the whole operation succeeds.
     *
     * @param generalMethodTimeoutMs a budget for all the requests this call makes, null for none
     */
    public CompletableFuture<List<T>> toList(@Nullable Long generalMethodTimeoutMs) {
        AsyncFindCursor<R, T> working;
        try {
            ensureAlive();
            working = workingCopy(generalMethodTimeoutMs);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        List<T> result = new ArrayList<>();
        return working.drain((item) -> {
            result.add(item);
            return true;
        }).thenApply((v) -> {
            this.progress = working.progress;
            return result;
        });
    }

    public CompletableFuture<Void> forEach(Predicate<? super T> action) {
        return forEach(action, null);
    }

    /**
     * Applies {@code action} to each remaining item until the results run out or the action returns false.
     * The items handed to the action count as consumed even if the operation fails.
     *
     * @param action                 receives the items, returns false to stop
     * @param generalMethodTimeoutMs a budget for all the requests this call makes, null for none
     */
    public CompletableFuture<Void> forEach(Predicate<? super T> action, @Nullable Long generalMethodTimeoutMs) {
        AsyncFindCursor<R, T> working;
        try {
            ensureAlive();
            working = workingCopy(generalMethodTimeoutMs);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return working.drain(action).whenComplete((v, e) -> this.progress = working.progress);
    }

    // One recursion step per page, items within a page are handled in a plain loop.
    private CompletableFuture<Void> drain(Predicate<? super T> action) {
        return tryFillBuffer().thenCompose((v) -> {
            if (isBufferEmpty()) {
                close();
                return CompletableFuture.completedFuture(null);
            }
            while (!isBufferEmpty()) {
                if (!action.test(yieldNext())) {
                    return CompletableFuture.completedFuture(null);
                }
            }
            return drain(action);
        });
    }

    private AsyncFindCursor<R, T> workingCopy(@Nullable Long generalMethodTimeoutMs) {
        CursorTimeouts revised = timeouts.forBulkOperation(generalMethodTimeoutMs);
        TimeoutBudget workingBudget = revised == timeouts ? budget : revised.startBudget();
        return new AsyncFindCursor<>(engine, mapper, revised, workingBudget, progress.copy());
    }

    private AsyncFindCursor<R, T> withArgs(FindArgs args) {
        return new AsyncFindCursor<>(engine.withArgs(args), mapper, timeouts);
    }

    public AsyncFindCursor<R, T> filter(@Nullable Map<String, Object> filter) {
        ensureIdle();
        return withArgs(engine.getArgs().filter(filter));
    }

    public AsyncFindCursor<R, T> project(@Nullable Map<String, Object> projection) {
        ensureIdle();
        ensureNotMapped("projection");
        return withArgs(engine.getArgs().projection(projection));
    }

    public AsyncFindCursor<R, T> sort(@Nullable Map<String, Object> sort) {
        ensureIdle();
        return withArgs(engine.getArgs().sort(sort));
    }

    public AsyncFindCursor<R, T> limit(@Nullable Integer limit) {
        ensureIdle();
        return withArgs(engine.getArgs().limit(limit));
    }

    public AsyncFindCursor<R, T> skip(@Nullable Integer skip) {
        ensureIdle();
        return withArgs(engine.getArgs().skip(skip));
    }

    public AsyncFindCursor<R, T> includeSimilarity(@Nullable Boolean includeSimilarity) {
        ensureIdle();
        ensureNotMapped("includeSimilarity");
        return withArgs(engine.getArgs().includeSimilarity(includeSimilarity));
    }

    public AsyncFindCursor<R, T> includeSortVector(@Nullable Boolean includeSortVector) {
        ensureIdle();
        ensureNotMapped("includeSortVector");
        return withArgs(engine.getArgs().includeSortVector(includeSortVector));
    }

    public AsyncFindCursor<R, T> includeScores(@Nullable Boolean includeScores) {
        ensureIdle();
        ensureNotMapped("includeScores");
        return withArgs(engine.getArgs().includeScores(includeScores));
    }

    public <U> AsyncFindCursor<R, U> map(Function<? super T, ? extends U> function) {
        ensureIdle();
        return new AsyncFindCursor<>(engine, mapper.andThen(function), timeouts);
    }

    @Override
    public AsyncFindCursor<R, R> clone() {
        return AsyncFindCursor.create(engine, timeouts);
    }
}
