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
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * The live state of one case between {@link LifecycleCoordinator#beginCase(TestCase)} and
 * {@link LifecycleCoordinator#endCase(CaseHandle)}.
 * <p>
 * Owns the case's group thread, on which group setup and every teardown run. The group context
 * is written once by that thread after setup and only read afterwards.
 */
public class CaseHandle implements LifecycleScope {

    private final TestCase testCase;
    private final List<Teardown> teardowns = new ArrayList<>();

    private volatile ExecutorService groupExecutor;

    private volatile Context context = Context.empty();
    private volatile FailureDetail setupFailure;
    private boolean ended; // guarded by this

    CaseHandle(TestCase testCase) {
        this.testCase = testCase;
        this.groupExecutor = newGroupExecutor();
    }

    private ExecutorService newGroupExecutor() {
        String threadName = "runlane-case-" + testCase.getId();
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String getCaseId() {
        return testCase.getId();
    }

    @Override
    public String getTestId() {
        return null;
    }

    @Override
    public synchronized void onExit(Teardown teardown) {
        if (ended) {
            throw new IllegalStateException("case already ended: " + getCaseId());
        }
        teardowns.add(teardown);
    }

    public TestCase getTestCase() {
        return testCase;
    }

    /**
     * The context produced by group setup, empty if there was none or it failed.
     */
    public Context getContext() {
        return context;
    }

    void setContext(Context context) {
        this.context = context == null ? Context.empty() : context;
    }

    /**
     * @return the group setup failure, or null
     */
    public FailureDetail getSetupFailure() {
        return setupFailure;
    }

    void setSetupFailure(FailureDetail setupFailure) {
        this.setupFailure = setupFailure;
    }

    public boolean isSetupFailed() {
        return setupFailure != null;
    }

    public synchronized boolean isEnded() {
        return ended;
    }

    /**
     * Closes the scope for registrations and hands over the teardowns in registration order.
     *
     * @return the teardowns, or null if the case had already ended
     */
    synchronized List<Teardown> end() {
        if (ended) {
            return null;
        }
        ended = true;
        List<Teardown> result = new ArrayList<>(teardowns);
        teardowns.clear();
        return result;
    }

    <T> Future<T> submit(Callable<T> task) {
        return groupExecutor.submit(task);
    }

    /**
     * Gives up on a group thread that is stuck in work that ignored its interrupt, such as a group
     * setup that timed out. Later work, the teardowns included, runs on a fresh group thread.
     */
    void replaceGroupThread() {
        ExecutorService stuck = groupExecutor;
        groupExecutor = newGroupExecutor();
        stuck.shutdownNow();
    }

    void shutdown() {
        // queued work, such as teardowns, still completes
        groupExecutor.shutdown();
    }

    @Override
    public String toString() {
        return "CaseHandle[" + getCaseId() + "]";
    }

}
