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

import com.dataapi.client.DataSource;
import com.dataapi.client.engine.Page;
import com.dataapi.client.engine.QueryEngine;
import com.dataapi.client.serdes.VectorCodec;
import com.dataapi.client.timeout.CursorTimeouts;
import com.dataapi.client.timeout.TimeoutBudget;
import com.dataapi.common.CursorException;
import com.dataapi.common.MissingDataSourceException;
import com.dataapi.protocol.FindArgs;
import com.dataapi.protocol.RequestTimeout;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * State machine shared by the blocking and the asynchronous cursors.
 *
 * <p>A cursor starts {@link CursorState#IDLE}, moves to {@link CursorState#STARTED} when the first item is
 * yielded and ends {@link CursorState#CLOSED} once the server has no more items or when closed explicitly.
 * Query parameters can only be changed while idle, and every change produces a new cursor.</p>
 *
 * @param <R> raw item type, as decoded from the response
 * @param <T> item type after the mapper
 */
public abstract class AbstractCursor<R, T> {
    private static final String SORT_VECTOR = "sortVector";

    protected final QueryEngine<R> engine;
    protected final MapperChain<R, T> mapper;
    protected final CursorTimeouts timeouts;
    protected final TimeoutBudget budget;
    CursorProgress<R> progress;

    AbstractCursor(QueryEngine<R> engine, MapperChain<R, T> mapper, CursorTimeouts timeouts,
                   TimeoutBudget budget, CursorProgress<R> progress) {
        this.engine = engine;
        this.mapper = mapper;
        this.timeouts = timeouts;
        this.budget = budget;
        this.progress = progress;
    }

    public CursorState state() {
        return progress.state();
    }

    public boolean isAlive() {
        return progress.state() != CursorState.CLOSED;
    }

    /**
     * @return the number of items handed out so far, by iteration, bulk operations or {@link #consumeBuffer}
     */
    public long consumed() {
        return progress.consumed();
    }

    public int bufferedCount() {
        return progress.buffer().size();
    }

    public int pagesRetrieved() {
        return progress.pagesRetrieved();
    }

    public int cursorId() {
        return System.identityHashCode(this);
    }

    /**
     * @return the collection or table this cursor reads from
     * @throws MissingDataSourceException if the cursor has lost it
     */
    public DataSource dataSource() {
        return engine.getDataSource();
    }

    public FindArgs getArgs() {
        return engine.getArgs();
    }

    public CursorTimeouts getTimeouts() {
        return timeouts;
    }

    public boolean hasMapper() {
        return !mapper.isIdentity();
    }

    /**
     * Closes the cursor and discards the buffered items. Closing a closed cursor does nothing.
     */
    public void close() {
        progress.close();
    }

    /**
     * Brings the cursor back to its pristine {@link CursorState#IDLE} state. Parameters and mapper are kept.
     */
    public void rewind() {
        progress = new CursorProgress<>();
    }

    public List<R> consumeBuffer() {
        return consumeBuffer(progress.buffer().size());
    }

    /**
     * Hands out up to {@code n} raw items straight from the buffer, counting them as consumed.
     * Never fetches a page and can be called in any state.
     *
     * @param n the maximum number of items
     * @return the items, fewer than {@code n} (possibly none) if the buffer runs out
     * @throws IllegalArgumentException if {@code n} is negative
     */
    public List<R> consumeBuffer(int n) {
        List<R> items = progress.buffer().consume(n);
        progress.countConsumed(items.size());
        return items;
    }

    protected void ensureAlive() {
        if (progress.state() == CursorState.CLOSED) {
            throw new CursorException("Cursor is stopped.", progress.state().getName());
        }
    }

    protected void ensureIdle() {
        if (progress.state() != CursorState.IDLE) {
            throw new CursorException("Cursor is not idle anymore.", progress.state().getName());
        }
    }

    protected void ensureNotMapped(String setting) {
        if (!mapper.isIdentity()) {
            throw new CursorException("Cannot set " + setting + " after map.", progress.state().getName());
        }
    }

    protected boolean needsFetch() {
        return progress.needsFetch();
    }

    /**
     * Computes the timeout of the next page request.
     *
     * @throws com.dataapi.common.DataApiTimeoutException if the overall deadline has already passed
     */
    protected RequestTimeout nextRequestTimeout() {
        return budget.remainingTimeout(timeouts.requestTimeoutMs(), timeouts.requestTimeoutLabel());
    }

    @Nullable
    protected String nextPageState() {
        return progress.nextPageState();
    }

    protected void install(Page<R> page) {
        progress.install(page);
    }

    protected boolean isBufferEmpty() {
        return progress.buffer().isEmpty();
    }

    /**
     * Pops the head of the buffer, assuming a fill has been attempted. An empty buffer at this point
     * means the results are exhausted.
     */
    protected T yieldNext() {
        if (progress.buffer().isEmpty()) {
            progress.close();
            throw new NoSuchElementException("Cursor has no more items");
        }
        return mapper.apply(progress.take());
    }

    @Nullable
    protected List<Float> sortVectorFromLastResponse() {
        ObjectNode status = progress.lastResponseStatus();
        if (status == null) {
            return null;
        }
        return VectorCodec.decode(status.get(SORT_VECTOR), dataSource().getSerdesOptions());
    }

    private String dataSourceName() {
        try {
            return engine.getDataSource().getName();
        } catch (MissingDataSourceException e) {
            return "";
        }
    }

    @Override
    public String toString() {
        return String.format("%s(\"%s\", %s, consumed so far: %d)",
                getClass().getSimpleName(), dataSourceName(), progress.state().getName(), progress.consumed());
    }
}
