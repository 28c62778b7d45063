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

package com.dataapi.client.timeout;

import com.dataapi.common.DataApiTimeoutException;
import com.dataapi.protocol.RequestTimeout;
import com.google.common.base.Ticker;

import javax.annotation.Nullable;
import java.util.concurrent.TimeUnit;

/**
 * Tracks an optional overall deadline shared by a sequence of requests and derives the timeout of the next one.
 *
 * <p>The deadline starts counting when the budget is created. An instance without an overall timeout never
 * expires and simply hands out the per-request cap.</p>
 */
public final class TimeoutBudget {
    private final Ticker ticker;
    private final long startedNanos;
    private final Long overallTimeoutMs;
    private final String label;

    private TimeoutBudget(Ticker ticker, @Nullable Long overallTimeoutMs, @Nullable String label) {
        this.ticker = ticker;
        this.startedNanos = ticker.read();
        this.overallTimeoutMs = overallTimeoutMs;
        this.label = label;
    }

    public static TimeoutBudget start(@Nullable Long overallTimeoutMs, @Nullable String label) {
        return start(Ticker.systemTicker(), overallTimeoutMs, label);
    }

    public static TimeoutBudget start(Ticker ticker, @Nullable Long overallTimeoutMs, @Nullable String label) {
        if (overallTimeoutMs != null && overallTimeoutMs < 0) {
            throw new IllegalArgumentException("overall timeout cannot be negative: " + overallTimeoutMs);
        }
        return new TimeoutBudget(ticker, overallTimeoutMs, label);
    }

    public static TimeoutBudget unlimited() {
        return new TimeoutBudget(Ticker.systemTicker(), null, null);
    }

    @Nullable
    public Long getOverallTimeoutMs() {
        return overallTimeoutMs;
    }

    @Nullable
    public String getLabel() {
        return label;
    }

    public boolean hasDeadline() {
        return overallTimeoutMs != null;
    }

    long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read() - startedNanos);
    }

    /**
     * Computes the timeout of the next request.
     *
     * @param capMs    the per-request cap, null for none
     * @param capLabel the name of the per-request cap, reported if it is the binding constraint
     * @return the minimum of the cap and the time left before the deadline, unlimited if both are absent
     * @throws DataApiTimeoutException with type {@code generic} if the deadline has already passed
     */
    public RequestTimeout remainingTimeout(@Nullable Long capMs, @Nullable String capLabel) {
        if (overallTimeoutMs == null) {
            return new RequestTimeout(capMs, null, capMs == null ? null : capLabel);
        }
        long remaining = overallTimeoutMs - elapsedMillis();
        if (remaining <= 0) {
            throw new DataApiTimeoutException("Operation timed out.", DataApiTimeoutException.GENERIC, label);
        }
        if (capMs != null && capMs <= remaining) {
            return new RequestTimeout(capMs, overallTimeoutMs, capLabel);
        }
        return new RequestTimeout(remaining, overallTimeoutMs, label);
    }
}
