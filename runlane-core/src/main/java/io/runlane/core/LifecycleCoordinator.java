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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Manages group setup and teardown around cases.
 * <p>
 * Active cases live in an arena keyed by case id. Each case gets a dedicated group thread that
 * runs its setup, holds on to the resulting context for as long as its tests need it, and finally
 * runs all teardowns in reverse order of registration. Teardowns never run on a test thread, so
 * they still run when a test thread was abandoned after a timeout.
 */
public class LifecycleCoordinator {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Map<String, CaseHandle> arena = new ConcurrentHashMap<>();
    private final Duration setupTimeout;

    /**
     * @param setupTimeout how long group setup may take before it is treated as failed
     */
    public LifecycleCoordinator(Duration setupTimeout) {
        this.setupTimeout = setupTimeout;
    }

    /**
     * Starts a case: registers its declared teardowns and runs its group setup on the group thread.
     * A failing setup does not throw; it is recorded on the returned handle.
     *
     * @throws IllegalStateException if a case with the same id is already active
     */
    public CaseHandle beginCase(TestCase testCase) {
        CaseHandle handle = new CaseHandle(testCase);
        if (arena.putIfAbsent(testCase.getId(), handle) != null) {
            handle.shutdown();
            throw new IllegalStateException("case already active: " + testCase.getId());
        }
        for (Teardown teardown : testCase.getTeardowns()) {
            handle.onExit(teardown);
        }
        GroupSetup setup = testCase.getSetup();
        if (setup == null) {
            return handle;
        }
        Future<Context> future = handle.submit(() -> setup.setUp(handle));
        try {
            handle.setContext(future.get(setupTimeout.toMillis(), TimeUnit.MILLISECONDS));
            logger.debug("group setup done: {}", testCase.getId());
        } catch (ExecutionException e) {
            failSetup(handle, e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            handle.replaceGroupThread();
            failSetup(handle, new TestTimeoutException("group setup of case '" + testCase.getId() + "'", setupTimeout));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            handle.replaceGroupThread();
            failSetup(handle, e);
        }
        return handle;
    }

    private void failSetup(CaseHandle handle, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        SetupFailureException error = new SetupFailureException(
                "group setup of case '" + handle.getCaseId() + "' failed: " + message, cause);
        handle.setSetupFailure(new FailureDetail(FailureKind.SETUP_FAILURE, message,
                cause.getClass().getSimpleName(), error));
        logger.warn("group setup failed: {} - {}", handle.getCaseId(), message);
    }

    public void registerTeardown(CaseHandle handle, Teardown teardown) {
        handle.onExit(teardown);
    }

    /**
     * Runs every teardown of the case, last registered first, on the group thread, waits for them,
     * then releases the group thread. Idempotent: a second call returns an empty list.
     *
     * @return one detail per teardown that raised
     */
    public List<FailureDetail> endCase(CaseHandle handle) {
        List<Teardown> teardowns = handle.end();
        if (teardowns == null) {
            return Collections.emptyList();
        }
        try {
            return runTeardowns(handle, null, teardowns, handle.getContext());
        } finally {
            handle.shutdown();
            arena.remove(handle.getCaseId(), handle);
            logger.debug("case ended: {}", handle.getCaseId());
        }
    }

    /**
     * Runs teardowns registered by the per-test setup of one test, on the case's group thread.
     */
    public List<FailureDetail> endTest(CaseHandle handle, String testId, List<Teardown> teardowns, Context context) {
        return runTeardowns(handle, testId, teardowns, context);
    }

    private List<FailureDetail> runTeardowns(CaseHandle handle, String testId, List<Teardown> teardowns, Context context) {
        if (teardowns.isEmpty()) {
            return Collections.emptyList();
        }
        String owner = testId == null ? handle.getCaseId() : handle.getCaseId() + "/" + testId;
        Future<List<FailureDetail>> future = handle.submit(() -> {
            List<FailureDetail> failures = new ArrayList<>();
            for (int i = teardowns.size() - 1; i >= 0; i--) {
                try {
                    teardowns.get(i).tearDown(context);
                } catch (Throwable t) {
                    String message = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
                    TeardownFailureException error = new TeardownFailureException(
                            "teardown of '" + owner + "' failed: " + message, t);
                    failures.add(new FailureDetail(FailureKind.TEARDOWN_FAILURE, message,
                            t.getClass().getSimpleName(), error));
                    logger.warn("teardown failed: {} - {}", owner, message, t);
                }
            }
            return failures;
        });
        try {
            return future.get();
        } catch (ExecutionException e) {
            return List.of(FailureDetail.of(FailureKind.TEARDOWN_FAILURE, e.getCause()));
        } catch (InterruptedException e) {
            // the teardowns are already queued on the group thread and still run
            Thread.currentThread().interrupt();
            return List.of(FailureDetail.of(FailureKind.TEARDOWN_FAILURE,
                    "interrupted while waiting for teardown of '" + owner + "'"));
        }
    }

    /**
     * @return the active handle for a case, or null
     */
    public CaseHandle getHandle(String caseId) {
        return arena.get(caseId);
    }

    public int getActiveCount() {
        return arena.size();
    }

}
