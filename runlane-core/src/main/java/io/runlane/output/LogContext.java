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
package io.runlane.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide coordinator for output captured while tests run.
 * <p>
 * Each running test gets its own capture, keyed by run id and test key and bound to the test's thread.
 * Test code writes through {@link #print(Object)} or {@link #log(LogLevel, String)}; the text is
 * buffered for the test result and also cascaded to the {@code runlane.test} SLF4J category.
 * Concurrent tests never see each other's text.
 * <pre>
 * TestUnit.of("login", ctx -&gt; {
 *     LogContext.print("logging in as " + ctx.get("user"));
 *     ...
 * });
 * </pre>
 */
public class LogContext {

    private static final ThreadLocal<LogContext> CURRENT = new ThreadLocal<>();

    private static final Map<String, LogContext> ACTIVE = new ConcurrentHashMap<>();

    // ========== Category Loggers ==========

    /** Logger for the engine (scheduler, lifecycle, registry, event bus) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("runlane.runtime");

    /** Logger that captured test output cascades to */
    public static final Logger TEST_LOGGER = LoggerFactory.getLogger("runlane.test");

    private static volatile LogLevel threshold = LogLevel.INFO;

    private final String captureKey;
    private final String testKey;
    private final StringBuffer buffer = new StringBuffer();
    private volatile boolean ended;

    private LogContext(String captureKey, String testKey) {
        this.captureKey = captureKey;
        this.testKey = testKey;
    }

    // ========== Capture Lifecycle ==========

    /**
     * Starts capturing for a test. The returned context must be bound to the thread running the test.
     *
     * @throws IllegalStateException if a capture for this key is already active
     */
    public static LogContext beginCapture(String testKey) {
        return beginCapture(null, testKey);
    }

    /**
     * Starts capturing for a test of one run. Runs going on at the same time in the same JVM
     * use different run ids, so the same test key can be captured by each of them.
     *
     * @throws IllegalStateException if a capture for this run and key is already active
     */
    public static LogContext beginCapture(String runId, String testKey) {
        String captureKey = runId == null ? testKey : runId + ":" + testKey;
        LogContext ctx = new LogContext(captureKey, testKey);
        if (ACTIVE.putIfAbsent(captureKey, ctx) != null) {
            throw new IllegalStateException("capture already active for: " + captureKey);
        }
        return ctx;
    }

    /**
     * Ends capturing for a test and returns what was captured. Text written afterwards, for
     * example by a timed-out test that is still winding down, only goes to SLF4J.
     *
     * @return the captured text, empty if nothing was captured or no capture was active
     */
    public static String endCapture(String testKey) {
        LogContext ctx = ACTIVE.get(testKey);
        return ctx == null ? "" : ctx.end();
    }

    /**
     * Ends this capture, see {@link #endCapture(String)}.
     *
     * @return the captured text, empty if this capture already ended
     */
    public String end() {
        if (!ACTIVE.remove(captureKey, this)) {
            return "";
        }
        ended = true;
        return buffer.toString();
    }

    public static boolean isCapturing(String testKey) {
        return ACTIVE.containsKey(testKey);
    }

    // ========== Thread-Local Access ==========

    /**
     * @return the capture bound to the current thread, or null
     */
    public static LogContext get() {
        return CURRENT.get();
    }

    public static void set(LogContext ctx) {
        CURRENT.set(ctx);
    }

    public static void clear() {
        CURRENT.remove();
    }

    public String getTestKey() {
        return testKey;
    }

    public String getCaptureKey() {
        return captureKey;
    }

    /**
     * Set the minimum log level for capture. Lower levels are neither captured nor cascaded.
     */
    public static void setLogLevel(LogLevel level) {
        threshold = level;
    }

    public static LogLevel getLogLevel() {
        return threshold;
    }

    /**
     * Set the runtime log level for SLF4J/Logback.
     * Uses reflection to avoid compile-time dependency on Logback.
     * Sets the level on the "runlane" logger, which affects all subcategories.
     *
     * @param level the log level (trace, debug, info, warn, error)
     * @return true if the level was set successfully, false if Logback is not available
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("runtime log level not supported: not using Logback");
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, "runlane");
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("set runtime log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

    // ========== Logging ==========

    /**
     * Writes to the capture bound to the current thread, or straight to SLF4J if there is none.
     */
    public static void print(Object message) {
        LogContext ctx = CURRENT.get();
        if (ctx != null) {
            ctx.log(LogLevel.INFO, String.valueOf(message));
        } else {
            TEST_LOGGER.info("{}", message);
        }
    }

    public void log(LogLevel level, String message) {
        if (!level.isEnabled(threshold)) {
            return;
        }
        if (!ended) {
            buffer.append(message).append('\n');
        }
        cascade(level, message);
    }

    public void log(LogLevel level, String format, Object... args) {
        log(level, format(format, args));
    }

    private void cascade(LogLevel level, String message) {
        switch (level) {
            case TRACE -> TEST_LOGGER.trace("[{}] {}", testKey, message);
            case DEBUG -> TEST_LOGGER.debug("[{}] {}", testKey, message);
            case INFO -> TEST_LOGGER.info("[{}] {}", testKey, message);
            case WARN -> TEST_LOGGER.warn("[{}] {}", testKey, message);
            case ERROR -> TEST_LOGGER.error("[{}] {}", testKey, message);
        }
    }

    /**
     * SLF4J-style formatting: each {} is replaced by the next argument.
     */
    public static String format(String format, Object... args) {
        if (format == null || args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            if (argIndex < args.length && format.startsWith("{}", i)) {
                sb.append(args[argIndex++]);
                i += 2;
            } else {
                sb.append(format.charAt(i++));
            }
        }
        return sb.toString();
    }

}
