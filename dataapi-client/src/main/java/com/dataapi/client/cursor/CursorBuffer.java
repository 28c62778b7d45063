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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * FIFO of the items of the current page that have not been handed out yet.
 */
public class CursorBuffer<R> {
    private final ArrayDeque<R> items;

    public CursorBuffer() {
        this.items = new ArrayDeque<>();
    }

    private CursorBuffer(ArrayDeque<R> items) {
        this.items = items;
    }

    public R poll() {
        return items.poll();
    }

    /**
     * Removes up to {@code n} items from the head of the buffer.
     *
     * @param n the maximum number of items to remove
     * @return the removed items, fewer than {@code n} if the buffer runs out
     */
    public List<R> consume(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("A negative amount of items was requested.");
        }
        List<R> result = new ArrayList<>(Math.min(n, items.size()));
        while (result.size() < n && !items.isEmpty()) {
            result.add(items.poll());
        }
        return result;
    }

    public void replaceWith(Collection<R> page) {
        items.clear();
        items.addAll(page);
    }

    public void clear() {
        items.clear();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public CursorBuffer<R> copy() {
        return new CursorBuffer<>(new ArrayDeque<>(items));
    }
}
