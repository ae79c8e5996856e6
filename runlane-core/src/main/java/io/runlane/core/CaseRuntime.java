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
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Runs one case from setup to teardown, inside a single worker slot.
 * <p>
 * Tests of the case run one after the other in a fixed, seeded order and are never interleaved.
 * Teardown always runs, after every started test has reached a terminal status.
 */
public class CaseRuntime implements Callable<CaseResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Suite suite;
    private final TestCase testCase;
    private final CaseResult result;

    private CaseHandle handle;

    public CaseRuntime(Suite suite, TestCase testCase) {
        this.suite = suite;
        this.testCase = testCase;
        this.result = new CaseResult(testCase);
    }

    @Override
    public CaseResult call() {
        EventBus eventBus = suite.getEventBus();
        result.setStartTime(System.currentTimeMillis());
        eventBus.publish(CaseRunEvent.started(testCase));
        logger.debug("case started: {}", testCase);
        try {
            List<TestUnit> selected = selectedTests();
            handle = suite.getCoordinator().beginCase(testCase);
            if (handle.isSetupFailed()) {
                failAll(selected, handle.getSetupFailure());
            } else {
                runAll(selected);
            }
        } finally {
            if (handle != null) {
                for (FailureDetail failure : suite.getCoordinator().endCase(handle)) {
                    addTeardownFailure(null, failure);
                }
            }
            result.setEndTime(System.currentTimeMillis());
            eventBus.publish(CaseRunEvent.finished(testCase, result));
            logger.debug("case finished: {}", result);
        }
        return result;
    }

    private void runAll(List<TestUnit> tests) {
        SuiteResult suiteResult = suite.getResult();
        for (int i = 0; i < tests.size(); i++) {
            if (suiteResult.isFailureBudgetExceeded()) {
                int remaining = tests.size() - i;
                result.setNotRunCount(remaining);
                suiteResult.addNotRun(remaining);
                logger.info("failure budget exceeded, {} remaining tests of {} not run", remaining, testCase.getId());
                return;
            }
            TestResult testResult = new TestRuntime(this, tests.get(i)).call();
            result.addTestResult(testResult);
            suiteResult.record(testResult);
        }
    }

    /**
     * Every test the failed setup would have gated fails with the setup failure as its cause,
     * and still reports {@code test_finished}.
     */
    private void failAll(List<TestUnit> tests, FailureDetail setupFailure) {
        result.setSetupFailure(setupFailure);
        for (TestUnit test : tests) {
            TestResult testResult = TestResult.setupFailed(testCase.getId(), test.getId(), setupFailure);
            result.addTestResult(testResult);
            suite.getResult().record(testResult);
            suite.getEventBus().publish(TestRunEvent.finished(testResult));
        }
    }

    /**
     * Drops excluded tests and fixes the execution order for the rest.
     */
    private List<TestUnit> selectedTests() {
        TagFilter filter = suite.getTagFilter();
        List<TestUnit> selected = new ArrayList<>();
        int excluded = 0;
        for (TestUnit test : testCase.getTests()) {
            if (filter.isExcluded(test)) {
                excluded++;
                logger.debug("excluded: {}/{}", testCase.getId(), test);
            } else {
                selected.add(test);
            }
        }
        result.setExcludedCount(excluded);
        suite.getResult().addExcluded(excluded);
        return order(selected, suite.getConfig().getSeed(), testCase.getId());
    }

    /**
     * Deterministic shuffle: the same seed, case id and tests always give the same order.
     * A seed of 0 keeps declaration order.
     */
    static List<TestUnit> order(List<TestUnit> tests, long seed, String caseId) {
        if (seed == 0 || tests.size() < 2) {
            return tests;
        }
        List<TestUnit> shuffled = new ArrayList<>(tests);
        Collections.shuffle(shuffled, new Random(seed ^ caseId.hashCode()));
        return shuffled;
    }

    void addTeardownFailure(String testId, FailureDetail failure) {
        result.addTeardownFailure(failure);
        suite.getEventBus().publish(ErrorRunEvent.of(testCase.getId(), testId, failure));
    }

    // ========== Accessors ==========

    public Suite getSuite() {
        return suite;
    }

    public TestCase getTestCase() {
        return testCase;
    }

    public CaseHandle getHandle() {
        return handle;
    }

    public CaseResult getResult() {
        return result;
    }

}
