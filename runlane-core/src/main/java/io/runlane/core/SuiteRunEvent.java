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
 * Suite-level events (SUITE_STARTED, SUITE_FINISHED).
 */
public record SuiteRunEvent(
        RunEventType type,
        RunConfig config,
        RunStatistics statistics,  // null for STARTED
        long timeStamp
) implements RunEvent {

    public static SuiteRunEvent started(RunConfig config) {
        return new SuiteRunEvent(RunEventType.SUITE_STARTED, config, null, System.currentTimeMillis());
    }

    public static SuiteRunEvent finished(RunConfig config, RunStatistics statistics) {
        return new SuiteRunEvent(RunEventType.SUITE_FINISHED, config, statistics, System.currentTimeMillis());
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
        if (type == RunEventType.SUITE_FINISHED && statistics != null) {
            return statistics.toJson();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (config != null) {
            map.put("workerCount", config.getWorkerCount());
            map.put("timeoutMs", config.getTimeoutPerTest().toMillis());
            if (config.isFailureBudgetBounded()) {
                map.put("maxFailures", config.getMaxFailures());
            }
            map.put("seed", config.getSeed());
        }
        return map;
    }
}
