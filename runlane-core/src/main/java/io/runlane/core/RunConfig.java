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

import net.minidev.json.parser.JSONParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options recognized by {@link Suite#run(RunConfig)}.
 * <p>
 * Can be built in code, or loaded from a JSON file whose unknown keys are ignored:
 * <pre>
 * {
 *   "workerCount": 4,
 *   "timeoutPerTest": "30s",
 *   "maxFailures": 10,
 *   "seed": 12345,
 *   "excludeTags": ["slow", "@flaky"],
 *   "captureOutput": true,
 *   "logLevel": "debug"
 * }
 * </pre>
 * A {@code maxFailures} that is absent, null or not positive means unbounded.
 * A {@code seed} of 0 keeps tests in declaration order.
 */
public final class RunConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final int UNBOUNDED = 0;

    private final int workerCount;
    private final Duration timeoutPerTest;
    private final int maxFailures;
    private final long seed;
    private final Set<String> excludeTags;
    private final boolean captureOutput;
    private final String logLevel;

    private RunConfig(Builder builder) {
        this.workerCount = builder.workerCount;
        this.timeoutPerTest = builder.timeoutPerTest;
        this.maxFailures = builder.maxFailures;
        this.seed = builder.seed != null ? builder.seed : defaultSeed();
        this.excludeTags = Collections.unmodifiableSet(TagFilter.normalize(builder.excludeTags));
        this.captureOutput = builder.captureOutput;
        this.logLevel = builder.logLevel;
    }

    public static int defaultWorkerCount() {
        return 2 * Runtime.getRuntime().availableProcessors();
    }

    private static long defaultSeed() {
        // never 0, which would disable shuffling
        return (System.nanoTime() % 1_000_000L) + 1;
    }

    public static RunConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.workerCount = workerCount;
        builder.timeoutPerTest = timeoutPerTest;
        builder.maxFailures = maxFailures;
        builder.seed = seed;
        builder.excludeTags.addAll(excludeTags);
        builder.captureOutput = captureOutput;
        builder.logLevel = logLevel;
        return builder;
    }

    /**
     * Builds a config from loosely typed values, e.g. parsed JSON. Unrecognized keys are ignored.
     *
     * @throws IllegalArgumentException if a recognized key holds a value of the wrong shape
     */
    public static RunConfig fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        Object value = map.get("workerCount");
        if (value != null) {
            builder.workerCount(toInt("workerCount", value));
        }
        value = map.get("timeoutPerTest");
        if (value != null) {
            builder.timeoutPerTest(toDuration(value));
        }
        value = map.get("maxFailures");
        if (value != null) {
            builder.maxFailures(toInt("maxFailures", value));
        }
        value = map.get("seed");
        if (value != null) {
            builder.seed(toLong("seed", value));
        }
        value = map.get("excludeTags");
        if (value instanceof Collection<?> list) {
            for (Object tag : list) {
                builder.excludeTags(String.valueOf(tag));
            }
        } else if (value instanceof String s) {
            builder.excludeTags(s.split(","));
        } else if (value != null) {
            throw new IllegalArgumentException("excludeTags must be a list or a comma-delimited string: " + value);
        }
        value = map.get("captureOutput");
        if (value != null) {
            builder.captureOutput(value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString()));
        }
        value = map.get("logLevel");
        if (value != null) {
            builder.logLevel(value.toString());
        }
        return builder.build();
    }

    /**
     * Loads a config from a JSON file.
     */
    @SuppressWarnings("unchecked")
    public static RunConfig load(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new RunlaneException("failed to read config: " + path, e);
        }
        Object parsed;
        try {
            parsed = new JSONParser(JSONParser.MODE_RFC4627).parse(json);
        } catch (Exception e) {
            throw new RunlaneException("invalid json in config " + path + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof Map)) {
            throw new RunlaneException("config must be a JSON object: " + path);
        }
        return fromMap((Map<String, Object>) parsed);
    }

    private static int toInt(String key, Object value) {
        long l = toLong(key, value);
        if (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(key + " out of range: " + value);
        }
        return (int) l;
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + value, e);
        }
    }

    /**
     * Numbers are milliseconds. Strings may be ISO-8601 ({@code PT2S}) or carry a
     * {@code ms}, {@code s} or {@code m} suffix.
     */
    static Duration toDuration(Object value) {
        if (value instanceof Duration d) {
            return d;
        }
        if (value instanceof Number n) {
            return Duration.ofMillis(n.longValue());
        }
        String text = value.toString().trim().toLowerCase();
        try {
            if (text.startsWith("pt")) {
                return Duration.parse(text.toUpperCase());
            }
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            }
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            return Duration.ofMillis(Long.parseLong(text));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid duration: " + value, e);
        }
    }

    // ========== Accessors ==========

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getTimeoutPerTest() {
        return timeoutPerTest;
    }

    /**
     * @return the failure threshold, or {@link #UNBOUNDED}
     */
    public int getMaxFailures() {
        return maxFailures;
    }

    public boolean isFailureBudgetBounded() {
        return maxFailures > 0;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isShuffle() {
        return seed != 0;
    }

    public Set<String> getExcludeTags() {
        return excludeTags;
    }

    public boolean isCaptureOutput() {
        return captureOutput;
    }

    public String getLogLevel() {
        return logLevel;
    }

    @Override
    public String toString() {
        return "RunConfig{workerCount=" + workerCount
                + ", timeoutPerTest=" + timeoutPerTest.toMillis() + "ms"
                + ", maxFailures=" + (maxFailures > 0 ? maxFailures : "unbounded")
                + ", seed=" + seed
                + ", excludeTags=" + excludeTags + "}";
    }

    // ========== Builder ==========

    public static class Builder {

        private int workerCount = defaultWorkerCount();
        private Duration timeoutPerTest = DEFAULT_TIMEOUT;
        private int maxFailures = UNBOUNDED;
        private Long seed;
        private final List<String> excludeTags = new ArrayList<>();
        private boolean captureOutput = true;
        private String logLevel;

        Builder() {
        }

        public Builder workerCount(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("workerCount must be >= 1: " + value);
            }
            this.workerCount = value;
            return this;
        }

        public Builder timeoutPerTest(Duration value) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException("timeoutPerTest must be positive: " + value);
            }
            this.timeoutPerTest = value;
            return this;
        }

        /**
         * Values that are not positive mean unbounded.
         */
        public Builder maxFailures(int value) {
            this.maxFailures = Math.max(UNBOUNDED, value);
            return this;
        }

        public Builder seed(long value) {
            this.seed = value;
            return this;
        }

        public Builder excludeTags(String... values) {
            excludeTags.addAll(Arrays.asList(values));
            return this;
        }

        public Builder excludeTags(Collection<String> values) {
            if (values != null) {
                excludeTags.addAll(values);
            }
            return this;
        }

        public Builder captureOutput(boolean value) {
            this.captureOutput = value;
            return this;
        }

        /**
         * One of trace, debug, info, warn, error. Applied to the {@code runlane} logger when Logback is present.
         */
        public Builder logLevel(String value) {
            this.logLevel = value;
            return this;
        }

        public RunConfig build() {
            return new RunConfig(this);
        }

    }

}
