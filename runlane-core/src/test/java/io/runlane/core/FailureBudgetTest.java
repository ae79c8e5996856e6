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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureBudgetTest {

    @Test
    void testTripsWhenThresholdReached() {
        FailureBudget budget = new FailureBudget(3);
        assertTrue(budget.isBounded());
        assertFalse(budget.recordFailure());
        assertFalse(budget.recordFailure());
        assertTrue(budget.recordFailure());
        assertTrue(budget.isExceeded());
        // stays tripped
        assertTrue(budget.recordFailure());
        assertEquals(4, budget.getFailureCount());
    }

    @Test
    void testUnbounded() {
        FailureBudget budget = new FailureBudget(0);
        assertFalse(budget.isBounded());
        for (int i = 0; i < 1000; i++) {
            assertFalse(budget.recordFailure());
        }
        assertEquals(1000, budget.getFailureCount());
        assertEquals(RunConfig.UNBOUNDED, new FailureBudget(-5).getMaxFailures());
    }

    @Test
    void testConcurrentFailuresAreAllCounted() throws Exception {
        FailureBudget budget = new FailureBudget(500);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 10; t++) {
            Thread thread = new Thread(() -> {
                for (int i = 0; i < 100; i++) {
                    budget.recordFailure();
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        assertEquals(1000, budget.getFailureCount());
        assertTrue(budget.isExceeded());
    }

}
