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

import com.dataapi.client.engine.Page;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The mutable part of a cursor. Bulk operations work on a copy and install it back on the cursor when done.
 */
final class CursorProgress<R> {
    private CursorState state;
    private final CursorBuffer<R> buffer;
    private int pagesRetrieved;
    private long consumed;
    private String nextPageState;
    private ObjectNode lastResponseStatus;

    CursorProgress() {
        this.state = CursorState.IDLE;
        this.buffer = new CursorBuffer<>();
    }

    private CursorProgress(CursorProgress<R> other) {
        this.state = other.state;
        this.buffer = other.buffer.copy();
        this.pagesRetrieved = other.pagesRetrieved;
        this.consumed = other.consumed;
        this.nextPageState = other.nextPageState;
        this.lastResponseStatus = other.lastResponseStatus;
    }

    CursorProgress<R> copy() {
        return new CursorProgress<>(this);
    }

    void install(Page<R> page) {
        buffer.replaceWith(page.items());
        nextPageState = page.nextPageState();
        lastResponseStatus = page.status();
        pagesRetrieved++;
    }

    /**
     * Whether the buffer is empty and the server may still have items to return. The first
     * page is always requested, later ones only while the server hands out a continuation token.
     */
    boolean needsFetch() {
        if (state == CursorState.CLOSED || !buffer.isEmpty()) {
            return false;
        }
        return pagesRetrieved == 0 || nextPageState != null;
    }

    void close() {
        state = CursorState.CLOSED;
        buffer.clear();
    }

    R take() {
        R item = buffer.poll();
        consumed++;
        state = CursorState.STARTED;
        return item;
    }

    void countConsumed(int n) {
        consumed += n;
    }

    CursorState state() {
        return state;
    }

    CursorBuffer<R> buffer() {
        return buffer;
    }

    int pagesRetrieved() {
        return pagesRetrieved;
    }

    long consumed() {
        return consumed;
    }

    String nextPageState() {
        return nextPageState;
    }

    ObjectNode lastResponseStatus() {
        return lastResponseStatus;
    }
}
