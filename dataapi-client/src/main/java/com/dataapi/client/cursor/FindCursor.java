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
import com.google.common.collect.Streams;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Blocking cursor over the results of a find. Pages are fetched lazily, one request at a time, as the
 * buffer runs dry.
 *
 * <pre>{@code
 * try (FindCursor<Map<String, Object>, Object> cursor = collection.find(FindArgs.Builder.limit(10)).map(doc -> doc.get("_id"))) {
 *     cursor.forEachRemaining(System.out::println);
 * }
 * }</pre>
 *
 * @param <R> raw item type
 * @param <T> item type after the mapper
 */
public class FindCursor<R, T> extends AbstractCursor<R, T> implements Iterator<T>, AutoCloseable {

    FindCursor(QueryEngine<R> engine, MapperChain<R, T> mapper, CursorTimeouts timeouts,
               TimeoutBudget budget, CursorProgress<R> progress) {
        super(engine, mapper, timeouts, budget, progress);
    }

    public FindCursor(QueryEngine<R> engine, MapperChain<R, T> mapper, CursorTimeouts timeouts) {
        this(engine, mapper, timeouts, timeouts.startBudget(), new CursorProgress<>());
    }

    public static <R> FindCursor<R, R> create(QueryEngine<R> engine, CursorTimeouts timeouts) {
        return new FindCursor<>(engine, MapperChain.identity(), timeouts);
    }

    private void tryFillBuffer() {
        while (needsFetch()) {
            install(engine.fetchPage(nextPageState(), nextRequestTimeout()));
        }
    }

    /**
     * Whether more items can be consumed. May fetch a page, but never consumes an item. An exhausted
     * cursor is closed.
     */
    @Override
    public boolean hasNext() {
        if (state() == CursorState.CLOSED) {
            return false;
        }
        tryFillBuffer();
        if (isBufferEmpty()) {
            close();
            return false;
        }
        return true;
    }

    @Override
    public T next() {
        tryFillBuffer();
        return yieldNext();
    }

    public Stream<T> stream() {
        ensureAlive();
        return Streams.stream(this);
    }

    /**
     * Returns the vector the query was sorted by, if the server echoed it back. Triggers the first
     * page fetch on an idle cursor without changing its state.
     *
     * @return the sort vector, or null
     */
    @Nullable
    public List<Float> getSortVector() {
        tryFillBuffer();
        return sortVectorFromLastResponse();
    }

    public List<T> toList() {
        return toList(null);
    }

    /**
     * Materializes the items not consumed yet.
     *
     * @param generalMethodTimeoutMs a budget for all the requests this call makes, null for none
     * @return the remaining items
     * @throws com.dataapi.common.CursorException if the cursor is closed
     */
    public List<T> toList(@Nullable Long generalMethodTimeoutMs) {
        ensureAlive();
        FindCursor<R, T> working = workingCopy(generalMethodTimeoutMs);
        List<T> result = new ArrayList<>();
        while (working.hasNext()) {
            result.add(working.next());
        }
        this.progress = working.progress;
        return result;
    }

    public void forEach(Predicate<? super T> action) {
        forEach(action, null);
    }

    /**
     * Applies {@code action} to each remaining item until the results run out or the action returns false.
     * The items handed to the action count as consumed even if the action throws.
     *
     * @param action                 receives the items, returns false to stop
     * @param generalMethodTimeoutMs a budget for all the requests this call makes, null for none
     * @throws com.dataapi.common.CursorException if the cursor is closed
     */
    public void forEach(Predicate<? super T> action, @Nullable Long generalMethodTimeoutMs) {
        ensureAlive();
        FindCursor<R, T> working = workingCopy(generalMethodTimeoutMs);
        try {
            while (working.hasNext()) {
                if (!action.test(working.next())) {
                    break;
                }
            }
        } finally {
            this.progress = working.progress;
        }
    }

    private FindCursor<R, T> workingCopy(@Nullable Long generalMethodTimeoutMs) {
        CursorTimeouts revised = timeouts.forBulkOperation(generalMethodTimeoutMs);
        TimeoutBudget workingBudget = revised == timeouts ? budget : revised.startBudget();
        return new FindCursor<>(engine, mapper, revised, workingBudget, progress.copy());
    }

    private FindCursor<R, T> withArgs(FindArgs args) {
        return new FindCursor<>(engine.withArgs(args), mapper, timeouts);
    }

    public FindCursor<R, T> filter(@Nullable Map<String, Object> filter) {
        ensureIdle();
        return withArgs(engine.getArgs().filter(filter));
    }

    public FindCursor<R, T> project(@Nullable Map<String, Object> projection) {
        ensureIdle();
        ensureNotMapped("projection");
        return withArgs(engine.getArgs().projection(projection));
    }

    public FindCursor<R, T> sort(@Nullable Map<String, Object> sort) {
        ensureIdle();
        return withArgs(engine.getArgs().sort(sort));
    }

    public FindCursor<R, T> limit(@Nullable Integer limit) {
        ensureIdle();
        return withArgs(engine.getArgs().limit(limit));
    }

    public FindCursor<R, T> skip(@Nullable Integer skip) {
        ensureIdle();
        return withArgs(engine.getArgs().skip(skip));
    }

    public FindCursor<R, T> includeSimilarity(@Nullable Boolean includeSimilarity) {
        ensureIdle();
        ensureNotMapped("includeSimilarity");
        return withArgs(engine.getArgs().includeSimilarity(includeSimilarity));
    }

    public FindCursor<R, T> includeSortVector(@Nullable Boolean includeSortVector) {
        ensureIdle();
        ensureNotMapped("includeSortVector");
        return withArgs(engine.getArgs().includeSortVector(includeSortVector));
    }

    public FindCursor<R, T> includeScores(@Nullable Boolean includeScores) {
        ensureIdle();
        ensureNotMapped("includeScores");
        return withArgs(engine.getArgs().includeScores(includeScores));
    }

    /**
     * Returns a new cursor whose items go through {@code function} after the current mapper.
     */
    public <U> FindCursor<R, U> map(Function<? super T, ? extends U> function) {
        ensureIdle();
        return new FindCursor<>(engine, mapper.andThen(function), timeouts);
    }

    /**
     * Returns a fresh idle cursor with the same query and timeouts, without mapper.
     */
    @Override
    public FindCursor<R, R> clone() {
        return FindCursor.create(engine, timeouts);
    }
}
