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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test utilities for engine tests.
 * Pattern: build cases from lambdas, run them through a {@link Runner} with a deterministic
 * config, then assert on the returned statistics and the recorded event stream.
 */
public class TestUtils {

    /**
     * A runner with declaration order (seed 0), two workers and a short test timeout.
     */
    public static Runner.Builder runner() {
        return Runner.builder()
                .seed(0)
                .workerCount(2)
                .timeoutPerTest(Duration.ofSeconds(10));
    }

    public static TestBody pass() {
        return ctx -> {
        };
    }

    public static TestBody failing(String message) {
        return ctx -> {
            throw new AssertionError(message);
        };
    }

    public static TestBody sleep(long millis) {
        return ctx -> Thread.sleep(millis);
    }

    /**
     * A case with {@code count} passing tests named t1..tN.
     */
    public static TestCase passingCase(String caseId, int count) {
        TestCase.Builder builder = TestCase.builder(caseId);
        for (int i = 1; i <= count; i++) {
            builder.test("t" + i, pass());
        }
        return builder.build();
    }

    /**
     * Everything the subscription received. Only call after the run has finished.
     */
    public static List<RunEvent> events(Subscription subscription) {
        return subscription.timeout(Duration.ofSeconds(5)).stream().collect(Collectors.toList());
    }

    public static List<String> kinds(List<RunEvent> events) {
        List<String> kinds = new ArrayList<>();
        for (RunEvent event : events) {
            kinds.add(event.getKind());
        }
        return kinds;
    }

    public static List<RunEvent> ofType(List<RunEvent> events, RunEventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    /**
     * Test ids of {@code test_started} events for one case, in emission order.
     */
    public static List<String> startedTests(List<RunEvent> events, String caseId) {
        List<String> ids = new ArrayList<>();
        for (RunEvent event : ofType(events, RunEventType.TEST_STARTED)) {
            TestRunEvent tre = (TestRunEvent) event;
            if (caseId.equals(tre.caseId())) {
                ids.add(tre.testId());
            }
        }
        return ids;
    }

    public static TestResult finishedTest(List<RunEvent> events, String caseId, String testId) {
        for (RunEvent event : ofType(events, RunEventType.TEST_FINISHED)) {
            TestResult result = ((TestRunEvent) event).result();
            if (caseId.equals(result.getCaseId()) && testId.equals(result.getTestId())) {
                return result;
            }
        }
        return null;
    }

}
