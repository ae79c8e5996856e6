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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Thread-safe store of registered cases, partitioned into a parallel and a sequential group.
 * <p>
 * Discovery workers may register concurrently. The scheduler calls {@link #drain()} exactly once;
 * after that, any registration fails with {@link LateRegistrationException}.
 */
public class CaseRegistry {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<TestCase> parallelCases = new ArrayList<>();
    private final List<TestCase> sequentialCases = new ArrayList<>();
    private final Set<String> caseIds = new HashSet<>();
    private boolean drained;

    public void registerParallel(TestCase testCase) {
        add(testCase, parallelCases);
    }

    public void registerSequential(TestCase testCase) {
        add(testCase, sequentialCases);
    }

    /**
     * Registers a case in the group matching its own {@link ExecutionMode}.
     */
    public void register(TestCase testCase) {
        Objects.requireNonNull(testCase, "testCase");
        if (testCase.getMode() == ExecutionMode.SEQUENTIAL) {
            registerSequential(testCase);
        } else {
            registerParallel(testCase);
        }
    }

    private synchronized void add(TestCase testCase, List<TestCase> group) {
        Objects.requireNonNull(testCase, "testCase");
        if (drained) {
            throw new LateRegistrationException(testCase.getId());
        }
        if (!caseIds.add(testCase.getId())) {
            throw new IllegalArgumentException("duplicate case id: " + testCase.getId());
        }
        group.add(testCase);
        logger.debug("registered case: {}", testCase);
    }

    /**
     * Returns a stable snapshot of both groups, in registration order, and closes the registry.
     *
     * @throws IllegalStateException if already drained
     */
    public synchronized DrainedCases drain() {
        if (drained) {
            throw new IllegalStateException("registry already drained");
        }
        drained = true;
        DrainedCases result = new DrainedCases(
                Collections.unmodifiableList(new ArrayList<>(parallelCases)),
                Collections.unmodifiableList(new ArrayList<>(sequentialCases)));
        logger.debug("drained registry: {} parallel, {} sequential", result.parallel().size(), result.sequential().size());
        return result;
    }

    public synchronized boolean isDrained() {
        return drained;
    }

    public synchronized int size() {
        return parallelCases.size() + sequentialCases.size();
    }

    /**
     * Snapshot returned by {@link #drain()}.
     */
    public record DrainedCases(List<TestCase> parallel, List<TestCase> sequential) {

        public int size() {
            return parallel.size() + sequential.size();
        }

    }

}
