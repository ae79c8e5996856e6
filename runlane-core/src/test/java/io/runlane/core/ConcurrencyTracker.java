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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records how many test bodies run at the same time, overall and per key, and in which order
 * they start and end.
 */
public class ConcurrencyTracker {

    private final Map<String, AtomicInteger> currentConcurrent = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> maxConcurrent = new ConcurrentHashMap<>();
    private final List<String> executionOrder = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger totalConcurrent = new AtomicInteger();
    private final AtomicInteger maxTotalConcurrent = new AtomicInteger();

    public void enter(String key, String name) {
        updateMax(maxTotalConcurrent, totalConcurrent.incrementAndGet());
        int count = currentConcurrent.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        updateMax(maxConcurrent.computeIfAbsent(key, k -> new AtomicInteger()), count);
        executionOrder.add("START:" + key + ":" + name);
    }

    public void exit(String key, String name) {
        executionOrder.add("END:" + key + ":" + name);
        totalConcurrent.decrementAndGet();
        AtomicInteger current = currentConcurrent.get(key);
        if (current != null) {
            current.decrementAndGet();
        }
    }

    /**
     * A test body that is tracked under the given key while it sleeps.
     */
    public TestBody body(String key, String name, long sleepMillis) {
        return ctx -> {
            enter(key, name);
            try {
                Thread.sleep(sleepMillis);
            } finally {
                exit(key, name);
            }
        };
    }

    public int getMaxConcurrent(String key) {
        AtomicInteger max = maxConcurrent.get(key);
        return max != null ? max.get() : 0;
    }

    public int getMaxTotalConcurrent() {
        return maxTotalConcurrent.get();
    }

    public List<String> getExecutionOrder() {
        synchronized (executionOrder) {
            return new ArrayList<>(executionOrder);
        }
    }

    private static void updateMax(AtomicInteger max, int value) {
        int current;
        do {
            current = max.get();
            if (value <= current) {
                return;
            }
        } while (!max.compareAndSet(current, value));
    }

}
