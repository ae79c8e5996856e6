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
 * Aggregate outcome of a run, returned by {@link Suite#run(RunConfig)}.
 *
 * @param total                 every registered test that was not excluded, including {@code notRun}
 * @param failures              tests that ended {@code failed} or {@code timed_out}
 * @param excluded              tests skipped because of an excluded tag
 * @param notRun                tests never started because the failure budget was exceeded
 * @param failureBudgetExceeded whether the circuit breaker tripped
 * @param elapsedMs             wall-clock duration of the run
 * @param seed                  the seed used to shuffle tests within each case
 */
public record RunStatistics(
        int total,
        int failures,
        int excluded,
        int notRun,
        boolean failureBudgetExceeded,
        long elapsedMs,
        long seed
) {

    public int passed() {
        return total - failures - notRun;
    }

    public boolean isPassed() {
        return failures == 0 && !failureBudgetExceeded;
    }

    /**
     * The process exit status a caller should use: non-zero when anything failed.
     */
    public int exitCode() {
        return isPassed() ? 0 : 1;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put("failures", failures);
        map.put("excluded", excluded);
        map.put("notRun", notRun);
        map.put("failureBudgetExceeded", failureBudgetExceeded);
        map.put("elapsedMs", elapsedMs);
        map.put("seed", seed);
        return map;
    }

}
