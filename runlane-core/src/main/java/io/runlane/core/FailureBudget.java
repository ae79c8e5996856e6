/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.runlane.core;

import io.runlane.output.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Circuit breaker over the global failure count.
 * <p>
 * The counter only ever grows. Once it reaches {@code maxFailures} the budget is exceeded for
 * the rest of the run and the scheduler stops dispatching new cases.
 */
public class FailureBudget {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final int maxFailures;
    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicBoolean exceeded = new AtomicBoolean();

    /**
     * @param maxFailures threshold, or a value &lt;= 0 for unbounded
     */
    public FailureBudget(int maxFailures) {
        this.maxFailures = Math.max(RunConfig.UNBOUNDED, maxFailures);
    }

    /**
     * Counts one failure and re-evaluates the threshold.
     *
     * @return true if the budget is exceeded after this failure
     */
    public boolean recordFailure() {
        int count = failures.incrementAndGet();
        if (maxFailures > 0 && count >= maxFailures && exceeded.compareAndSet(false, true)) {
            logger.warn("failure budget exceeded: {} of {} allowed failures, no new cases will be dispatched",
                    count, maxFailures);
        }
        return exceeded.get();
    }

    public boolean isExceeded() {
        return exceeded.get();
    }

    public int getFailureCount() {
        return failures.get();
    }

    public int getMaxFailures() {
        return maxFailures;
    }

    public boolean isBounded() {
        return maxFailures > 0;
    }

}
