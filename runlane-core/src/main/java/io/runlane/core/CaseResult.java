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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CaseResult {

    private final String caseId;
    private final ExecutionMode mode;
    private final List<TestResult> testResults = Collections.synchronizedList(new ArrayList<>());
    private final List<FailureDetail> teardownFailures = Collections.synchronizedList(new ArrayList<>());
    private volatile FailureDetail setupFailure;
    private volatile int excludedCount;
    private volatile int notRunCount;
    private long startTime;
    private long endTime;

    public CaseResult(TestCase testCase) {
        this.caseId = testCase.getId();
        this.mode = testCase.getMode();
    }

    public String getCaseId() {
        return caseId;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    void addTestResult(TestResult result) {
        testResults.add(result);
    }

    public List<TestResult> getTestResults() {
        synchronized (testResults) {
            return new ArrayList<>(testResults);
        }
    }

    void setSetupFailure(FailureDetail setupFailure) {
        this.setupFailure = setupFailure;
    }

    public FailureDetail getSetupFailure() {
        return setupFailure;
    }

    void addTeardownFailure(FailureDetail failure) {
        teardownFailures.add(failure);
    }

    public List<FailureDetail> getTeardownFailures() {
        synchronized (teardownFailures) {
            return new ArrayList<>(teardownFailures);
        }
    }

    void setExcludedCount(int excludedCount) {
        this.excludedCount = excludedCount;
    }

    public int getExcludedCount() {
        return excludedCount;
    }

    void setNotRunCount(int notRunCount) {
        this.notRunCount = notRunCount;
    }

    /**
     * Tests of this case that never started because the failure budget was exceeded.
     */
    public int getNotRunCount() {
        return notRunCount;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    // ========== Aggregation ==========

    public int getTestCount() {
        return testResults.size();
    }

    public int getPassedCount() {
        synchronized (testResults) {
            return (int) testResults.stream().filter(TestResult::isPassed).count();
        }
    }

    public int getFailedCount() {
        synchronized (testResults) {
            return (int) testResults.stream().filter(TestResult::isFailed).count();
        }
    }

    public boolean isFailed() {
        return setupFailure != null || getFailedCount() > 0;
    }

    public boolean isPassed() {
        return !isFailed();
    }

    // ========== Serialization ==========

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("caseId", caseId);
        map.put("mode", mode.name().toLowerCase());
        map.put("passed", isPassed());
        map.put("testCount", getTestCount());
        map.put("failedCount", getFailedCount());
        map.put("excludedCount", excludedCount);
        if (notRunCount > 0) {
            map.put("notRunCount", notRunCount);
        }
        map.put("durationMs", getDurationMillis());
        if (setupFailure != null) {
            map.put("setupFailure", setupFailure.toJson());
        }
        List<FailureDetail> teardowns = getTeardownFailures();
        if (!teardowns.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (FailureDetail detail : teardowns) {
                list.add(detail.toJson());
            }
            map.put("teardownFailures", list);
        }
        return map;
    }

    @Override
    public String toString() {
        return caseId + ": " + getPassedCount() + " passed, " + getFailedCount() + " failed";
    }

}
