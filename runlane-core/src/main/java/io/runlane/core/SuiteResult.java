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
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single aggregation point of a run.
 * <p>
 * Workers report through {@link #record(TestResult)} and friends; all counters are atomic so
 * increments coming from concurrent slots are serialized without locking.
 */
public class SuiteResult {

    private final List<CaseResult> caseResults = Collections.synchronizedList(new ArrayList<>());
    private final FailureBudget failureBudget;
    private final long seed;
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger excluded = new AtomicInteger();
    private final AtomicInteger notRun = new AtomicInteger();
    private volatile long startTime;
    private volatile long endTime;

    public SuiteResult(FailureBudget failureBudget, long seed) {
        this.failureBudget = failureBudget;
        this.seed = seed;
    }

    /**
     * Counts a terminal test result, charging the failure budget when it failed.
     *
     * @return true if the failure budget is exceeded after this result
     */
    public boolean record(TestResult result) {
        completed.incrementAndGet();
        if (result.isFailed()) {
            return failureBudget.recordFailure();
        }
        return failureBudget.isExceeded();
    }

    public void addExcluded(int count) {
        excluded.addAndGet(count);
    }

    public void addNotRun(int count) {
        notRun.addAndGet(count);
    }

    public void addCaseResult(CaseResult result) {
        caseResults.add(result);
    }

    public List<CaseResult> getCaseResults() {
        synchronized (caseResults) {
            return new ArrayList<>(caseResults);
        }
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    /**
     * Every test that was not excluded, whether it reached a terminal status or was never started.
     */
    public int getTotal() {
        return completed.get() + notRun.get();
    }

    public int getCompleted() {
        return completed.get();
    }

    public int getFailures() {
        return failureBudget.getFailureCount();
    }

    public int getExcluded() {
        return excluded.get();
    }

    public int getNotRun() {
        return notRun.get();
    }

    public boolean isFailureBudgetExceeded() {
        return failureBudget.isExceeded();
    }

    public FailureBudget getFailureBudget() {
        return failureBudget;
    }

    /**
     * Messages of all failed tests, for diagnostics.
     */
    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (CaseResult cr : getCaseResults()) {
            for (TestResult tr : cr.getTestResults()) {
                if (tr.isFailed()) {
                    errors.add(tr.getCaseId() + "/" + tr.getTestId() + ": " + tr.getFailureMessage());
                }
            }
        }
        return errors;
    }

    public RunStatistics toStatistics() {
        return new RunStatistics(
                getTotal(),
                getFailures(),
                getExcluded(),
                getNotRun(),
                isFailureBudgetExceeded(),
                getDurationMillis(),
                seed);
    }

}
