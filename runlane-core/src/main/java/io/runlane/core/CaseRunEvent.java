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
 * Case-level events (CASE_STARTED, CASE_FINISHED).
 */
public record CaseRunEvent(
        RunEventType type,
        TestCase testCase,
        CaseResult result,  // null for STARTED
        long timeStamp
) implements RunEvent {

    public static CaseRunEvent started(TestCase testCase) {
        return new CaseRunEvent(RunEventType.CASE_STARTED, testCase, null, System.currentTimeMillis());
    }

    public static CaseRunEvent finished(TestCase testCase, CaseResult result) {
        return new CaseRunEvent(RunEventType.CASE_FINISHED, testCase, result, System.currentTimeMillis());
    }

    public String caseId() {
        return testCase != null ? testCase.getId() : null;
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public long getTimeStamp() {
        return timeStamp;
    }

    @Override
    public Map<String, Object> toJson() {
        if (type == RunEventType.CASE_FINISHED && result != null) {
            return result.toJson();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (testCase != null) {
            map.put("caseId", testCase.getId());
            map.put("mode", testCase.getMode().name().toLowerCase());
            map.put("testCount", testCase.getTests().size());
        }
        return map;
    }
}
