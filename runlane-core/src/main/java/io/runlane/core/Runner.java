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

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for running test cases programmatically.
 * <p>
 * Usage:
 * <pre>
 * RunStatistics stats = Runner.builder()
 *     .registerParallel(TestCase.builder("users")
 *         .setup(scope -&gt; Context.of("db", openDb()))
 *         .test("create", ctx -&gt; ...)
 *         .test("delete", ctx -&gt; ...)
 *         .build())
 *     .workerCount(4)
 *     .maxFailures(10)
 *     .listener(event -&gt; System.out.println(event.toJson()))
 *     .run();
 * </pre>
 */
public final class Runner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private Runner() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder with cases, each routed by its own execution mode.
     */
    public static Builder cases(TestCase... values) {
        Builder builder = new Builder();
        for (TestCase testCase : values) {
            builder.register(testCase);
        }
        return builder;
    }

    /**
     * Registration and configuration for a single run. {@link #run()} may be called once;
     * registering after that fails with {@link LateRegistrationException}.
     */
    public static class Builder {

        private final CaseRegistry registry = new CaseRegistry();
        private final EventBus eventBus = new EventBus();
        private final List<Subscription> listenerSubscriptions = new ArrayList<>();
        private final AtomicBoolean triggered = new AtomicBoolean();

        private RunConfig.Builder config = RunConfig.builder();
        private Duration listenerWait = Duration.ofSeconds(30);

        Builder() {
        }

        // ========== Registration ==========

        public Builder register(TestCase testCase) {
            registry.register(testCase);
            return this;
        }

        public Builder registerParallel(TestCase testCase) {
            registry.registerParallel(testCase);
            return this;
        }

        public Builder registerSequential(TestCase testCase) {
            registry.registerSequential(testCase);
            return this;
        }

        public Builder register(Collection<TestCase> values) {
            for (TestCase testCase : values) {
                registry.register(testCase);
            }
            return this;
        }

        // ========== Configuration ==========

        public Builder workerCount(int value) {
            config.workerCount(value);
            return this;
        }

        public Builder timeoutPerTest(Duration value) {
            config.timeoutPerTest(value);
            return this;
        }

        public Builder maxFailures(int value) {
            config.maxFailures(value);
            return this;
        }

        public Builder seed(long value) {
            config.seed(value);
            return this;
        }

        public Builder excludeTags(String... values) {
            config.excludeTags(values);
            return this;
        }

        public Builder captureOutput(boolean value) {
            config.captureOutput(value);
            return this;
        }

        public Builder logLevel(String value) {
            config.logLevel(value);
            return this;
        }

        /**
         * Replace all configuration with the given config.
         */
        public Builder config(RunConfig value) {
            this.config = value.toBuilder();
            return this;
        }

        /**
         * Replace all configuration with a JSON config file. See {@link RunConfig#load(Path)}.
         */
        public Builder configFile(Path path) {
            return config(RunConfig.load(path));
        }

        /**
         * How long {@link #run()} waits for listeners to handle {@code suite_finished}. Default 30 seconds.
         */
        public Builder listenerWait(Duration value) {
            this.listenerWait = value;
            return this;
        }

        // ========== Observation ==========

        /**
         * Add a listener, called on its own thread for every event of the run.
         */
        public Builder listener(RunListener listener) {
            listenerSubscriptions.add(eventBus.subscribe(listener));
            return this;
        }

        /**
         * Subscribe to the event stream before the run starts.
         */
        public Subscription subscribe() {
            return eventBus.subscribe();
        }

        public EventBus getEventBus() {
            return eventBus;
        }

        public CaseRegistry getRegistry() {
            return registry;
        }

        /**
         * Build the Suite without running it.
         */
        public Suite buildSuite() {
            return new Suite(registry, eventBus);
        }

        // ========== Execution ==========

        /**
         * Runs every registered case and blocks until the run has finished and every
         * listener has seen {@code suite_finished}.
         *
         * @throws IllegalStateException if called a second time
         */
        public RunStatistics run() {
            if (!triggered.compareAndSet(false, true)) {
                throw new IllegalStateException("run already triggered");
            }
            RunStatistics statistics = buildSuite().run(config.build());
            for (Subscription subscription : listenerSubscriptions) {
                try {
                    if (!subscription.awaitCompletion(listenerWait)) {
                        logger.warn("listener did not finish within {}ms", listenerWait.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            return statistics;
        }

    }

}
