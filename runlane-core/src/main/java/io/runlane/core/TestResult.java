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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal outcome of one test. Immutable.
 */
public class TestResult {

    private final String caseId;
    private final String testId;
    private final TestStatus status;
    private final long startTime;
    private final long endTime;
    private final FailureDetail failure;
    private final String output;
    private final String threadName;

    TestResult(String caseId, String testId, TestStatus status, long startTime, long endTime,
               FailureDetail failure, String output, String threadName) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + status);
        }
        this.caseId = caseId;
        this.testId = testId;
        this.status = status;
        this.startTime = startTime;
        this.endTime = endTime;
        this.failure = failure;
        this.output = output;
        this.threadName = threadName;
    }

    /**
     * Result for a test that never ran because the setup gating it raised.
     */
    static TestResult setupFailed(String caseId, String testId, FailureDetail setupFailure) {
        long now = System.currentTimeMillis();
        FailureDetail detail = new FailureDetail(FailureKind.SETUP_FAILURE,
                "setup failed: " + setupFailure.message(), setupFailure.type(), setupFailure.error());
        return new TestResult(caseId, testId, TestStatus.FAILED, now, now, detail, null, null);
    }

    public String getCaseId() {
        return caseId;
    }

    public String getTestId() {
        return testId;
    }

    public TestStatus getStatus() {
        return status;
    }

    public boolean isPassed() {
        return status == TestStatus.PASSED;
    }

    public boolean isFailed() {
        return status.isFailure();
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

    /**
     * @return the failure detail, or null if passed
     */
    public FailureDetail getFailure() {
        return failure;
    }

    public String getFailureMessage() {
        return failure == null ? null : failure.message();
    }

    /**
     * @return text captured while the test ran, or null if none
     */
    public String getOutput() {
        return output;
    }

    public String getThreadName() {
        return threadName;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("caseId", caseId);
        map.put("testId", testId);
        map.put("status", status.getKey());
        map.put("durationMs", getDurationMillis());
        if (failure != null) {
            map.put("failureDetail", failure.toJson());
        }
        if (output != null && !output.isEmpty()) {
            map.put("output", output);
        }
        return map;
    }

    @Override
    public String toString() {
        return caseId + "/" + testId + ": " + status.getKey();
    }

}
