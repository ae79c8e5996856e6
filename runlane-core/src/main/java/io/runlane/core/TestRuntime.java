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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes one test on its own test thread and produces its terminal {@link TestResult}.
 * <p>
 * Per-test setups and the body run on the test thread. The calling worker races the test's
 * completion against the timeout; on timeout the test thread is interrupted and abandoned,
 * which never affects tests running in other slots. Anything the test throws is converted
 * into a status and a {@link FailureDetail}.
 * <p>
 * Stopping a timed-out test is best-effort: its thread is only interrupted. A body that ignores the
 * interrupt keeps running while the next test of the same case starts, so the two can overlap.
 * Whatever it writes after the timeout goes to the {@code runlane.test} logger and never into a
 * {@link TestResult}.
 */
public class TestRuntime implements Callable<TestResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final CaseRuntime caseRuntime;
    private final TestUnit test;
    private final String testKey;
    private final AtomicReference<TestStatus> status = new AtomicReference<>(TestStatus.PENDING);

    public TestRuntime(CaseRuntime caseRuntime, TestUnit test) {
        this.caseRuntime = caseRuntime;
        this.test = test;
        this.testKey = caseRuntime.getTestCase().getId() + "/" + test.getId();
    }

    @Override
    public TestResult call() {
        Suite suite = caseRuntime.getSuite();
        CaseHandle handle = caseRuntime.getHandle();
        String caseId = handle.getCaseId();
        Duration timeout = test.getTimeout() != null ? test.getTimeout() : suite.getConfig().getTimeoutPerTest();

        suite.getEventBus().publish(TestRunEvent.started(caseId, test.getId()));
        transition(TestStatus.PENDING, TestStatus.RUNNING);

        boolean capture = suite.getConfig().isCaptureOutput();
        LogContext logContext = capture ? LogContext.beginCapture(suite.getRunId(), testKey) : null;
        TestScope scope = new TestScope(caseId, test.getId());
        AtomicReference<Context> contextRef = new AtomicReference<>(handle.getContext());
        AtomicReference<String> threadName = new AtomicReference<>();

        long startTime = System.currentTimeMillis();
        Future<Void> future = suite.getTestExecutor().submit(() -> {
            threadName.set(Thread.currentThread().getName());
            LogContext.set(logContext);
            try {
                Context context = contextRef.get();
                for (TestSetup setup : caseRuntime.getTestCase().getTestSetups()) {
                    try {
                        context = context.merge(setup.setUp(context, scope));
                    } catch (Exception | AssertionError e) {
                        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                        throw new SetupFailureException("setup of test '" + testKey + "' failed: " + message, e);
                    }
                    contextRef.set(context);
                }
                test.getBody().run(context);
                return null;
            } finally {
                LogContext.clear();
            }
        });

        TestStatus terminal;
        FailureDetail failure = null;
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            terminal = TestStatus.PASSED;
        } catch (TimeoutException e) {
            future.cancel(true);
            terminal = TestStatus.TIMED_OUT;
            failure = FailureDetail.of(FailureKind.TEST_TIMEOUT, new TestTimeoutException("test '" + testKey + "'", timeout));
        } catch (ExecutionException e) {
            terminal = TestStatus.FAILED;
            failure = toFailure(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            terminal = TestStatus.FAILED;
            failure = FailureDetail.of(FailureKind.TEST_FAILURE, "interrupted while waiting for test '" + testKey + "'");
        }
        long endTime = System.currentTimeMillis();
        transition(TestStatus.RUNNING, terminal);

        String output = logContext != null ? logContext.end() : null;
        List<Teardown> teardowns = scope.end();
        for (FailureDetail teardownFailure : suite.getCoordinator().endTest(handle, test.getId(), teardowns, contextRef.get())) {
            caseRuntime.addTeardownFailure(test.getId(), teardownFailure);
        }

        TestResult result = new TestResult(caseId, test.getId(), terminal, startTime, endTime, failure,
                output == null || output.isEmpty() ? null : output, threadName.get());
        if (failure != null) {
            logger.info("{} {}: {}", testKey, terminal.getKey(), failure.message());
        } else {
            logger.debug("{} {} in {}ms", testKey, terminal.getKey(), result.getDurationMillis());
        }
        suite.getEventBus().publish(TestRunEvent.finished(result));
        return result;
    }

    private static FailureDetail toFailure(Throwable error) {
        if (error instanceof SetupFailureException sfe && sfe.getCause() != null) {
            Throwable cause = sfe.getCause();
            return new FailureDetail(FailureKind.SETUP_FAILURE, sfe.getMessage(), cause.getClass().getSimpleName(), sfe);
        }
        return FailureDetail.of(FailureKind.TEST_FAILURE, error);
    }

    private void transition(TestStatus from, TestStatus to) {
        if (!status.compareAndSet(from, to)) {
            throw new IllegalStateException("illegal status transition for " + testKey + ": "
                    + status.get() + " -> " + to);
        }
    }

    public TestStatus getStatus() {
        return status.get();
    }

    public TestUnit getTest() {
        return test;
    }

    /**
     * Lifecycle scope handed to per-test setups. Its teardowns run after the test, on the group thread.
     */
    static class TestScope implements LifecycleScope {

        private final String caseId;
        private final String testId;
        private final List<Teardown> teardowns = new ArrayList<>();
        private boolean ended;

        TestScope(String caseId, String testId) {
            this.caseId = caseId;
            this.testId = testId;
        }

        @Override
        public String getCaseId() {
            return caseId;
        }

        @Override
        public String getTestId() {
            return testId;
        }

        @Override
        public synchronized void onExit(Teardown teardown) {
            if (ended) {
                throw new IllegalStateException("test already ended: " + caseId + "/" + testId);
            }
            teardowns.add(teardown);
        }

        synchronized List<Teardown> end() {
            ended = true;
            return new ArrayList<>(teardowns);
        }

    }

}
