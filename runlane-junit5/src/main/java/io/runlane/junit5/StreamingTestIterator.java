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
package io.runlane.junit5;

import io.runlane.core.CaseRunEvent;
import io.runlane.core.ErrorRunEvent;
import io.runlane.core.FailureDetail;
import io.runlane.core.RunEvent;
import io.runlane.core.TestResult;
import io.runlane.core.TestRunEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A blocking iterator that yields {@link DynamicNode} instances as tests finish.
 * <p>
 * Bridges the engine's event stream to JUnit's {@code @TestFactory} pattern: {@link #hasNext()}
 * blocks until the next event arrives on the run's thread, so tests show up in the JUnit tree
 * while the run is still going.
 * <p>
 * Supports two modes:
 * <ul>
 *   <li><b>Flat mode</b>: each test becomes a top-level {@link DynamicTest}</li>
 *   <li><b>Hierarchical mode</b>: cases become {@link DynamicContainer}s containing their tests</li>
 * </ul>
 * Cases run in parallel, so in hierarchical mode tests are collected per case until that case's
 * {@code case_finished} arrives.
 */
public class StreamingTestIterator implements Iterator<DynamicNode> {

    private final Iterator<RunEvent> events;
    private final boolean hierarchical;

    private DynamicNode bufferedNode;
    private boolean finished;

    // Hierarchical mode state
    private final Map<String, List<DynamicTest>> caseTests = new HashMap<>();

    /**
     * @param events       the event stream of one run, ending after {@code suite_finished}
     * @param hierarchical if true, group tests under case containers
     */
    public StreamingTestIterator(Iterator<RunEvent> events, boolean hierarchical) {
        this.events = events;
        this.hierarchical = hierarchical;
    }

    @Override
    public boolean hasNext() {
        if (bufferedNode != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        bufferedNode = pollForNextNode();
        return bufferedNode != null;
    }

    @Override
    public DynamicNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more test events");
        }
        DynamicNode node = bufferedNode;
        bufferedNode = null;
        return node;
    }

    public Stream<DynamicNode> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
    }

    private DynamicNode pollForNextNode() {
        while (events.hasNext()) {
            DynamicNode node = processEvent(events.next());
            if (node != null) {
                return node;
            }
        }
        finished = true;
        return null;
    }

    private DynamicNode processEvent(RunEvent event) {
        switch (event.getType()) {
            case CASE_STARTED:
                if (hierarchical) {
                    caseTests.put(((CaseRunEvent) event).caseId(), new ArrayList<>());
                }
                return null;
            case TEST_FINISHED: {
                TestResult result = ((TestRunEvent) event).result();
                if (!hierarchical) {
                    return createDynamicTest(result.getCaseId() + "/" + result.getTestId(), result);
                }
                collect(result.getCaseId(), createDynamicTest(result.getTestId(), result));
                return null;
            }
            case ERROR: {
                ErrorRunEvent error = (ErrorRunEvent) event;
                String owner = error.testId() == null ? error.caseId() : error.caseId() + "/" + error.testId();
                String name = "[" + error.failure().kind().getKey() + "] " + owner;
                DynamicTest test = createFailingTest(name, error.failure());
                if (!hierarchical) {
                    return test;
                }
                collect(error.caseId(), test);
                return null;
            }
            case CASE_FINISHED: {
                if (!hierarchical) {
                    return null;
                }
                String caseId = ((CaseRunEvent) event).caseId();
                List<DynamicTest> tests = caseTests.remove(caseId);
                return DynamicContainer.dynamicContainer(caseId, tests == null ? Stream.empty() : tests.stream());
            }
            case SUITE_FINISHED:
                finished = true;
                return null;
            default:
                return null;
        }
    }

    private void collect(String caseId, DynamicTest test) {
        caseTests.computeIfAbsent(caseId, k -> new ArrayList<>()).add(test);
    }

    private static DynamicTest createDynamicTest(String displayName, TestResult result) {
        if (!result.isFailed()) {
            // passed, the test body does nothing
            return DynamicTest.dynamicTest(displayName, () -> {
            });
        }
        return createFailingTest(displayName, result.getFailure());
    }

    private static DynamicTest createFailingTest(String displayName, FailureDetail failure) {
        return DynamicTest.dynamicTest(displayName, () -> {
            Throwable error = failure == null ? null : failure.error();
            if (error != null) {
                // preserves the original stack trace
                throw error;
            }
            Assertions.fail(failure != null ? failure.message() : "test failed");
        });
    }

}
