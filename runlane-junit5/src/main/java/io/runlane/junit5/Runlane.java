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
package io.runlane.junit5;

import io.runlane.core.RunConfig;
import io.runlane.core.RunStatistics;
import io.runlane.core.Runner;
import io.runlane.core.Subscription;
import io.runlane.core.TestCase;
import io.runlane.output.LogContext;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.TestFactory;
import org.slf4j.Logger;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Fluent API for running test cases from JUnit 5.
 * <p>
 * Tests appear in the JUnit tree as they finish, while the run continues in the background.
 * <pre>
 * class UserTests {
 *     &#64;Runlane.Test
 *     Iterable&lt;DynamicNode&gt; users() {
 *         return Runlane.cases(UserCases.crud(), UserCases.search())
 *             .workerCount(4)
 *             .maxFailures(5);
 *     }
 * }
 * </pre>
 */
public class Runlane implements Iterable<DynamicNode> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    /**
     * Marks a method as a runlane test factory. The method should return a {@link Runlane} instance.
     */
    @Target(ElementType.METHOD)
    @Retention(RetentionPolicy.RUNTIME)
    @TestFactory
    public @interface Test {
    }

    private final Runner.Builder delegate;
    private boolean hierarchical = true;
    private long timeoutMinutes = 30;

    private Runlane() {
        this.delegate = Runner.builder();
    }

    /**
     * Creates an instance that runs the given cases, each routed by its own execution mode.
     */
    public static Runlane cases(TestCase... cases) {
        Runlane runlane = new Runlane();
        for (TestCase testCase : cases) {
            runlane.delegate.register(testCase);
        }
        return runlane;
    }

    public Runlane registerParallel(TestCase testCase) {
        delegate.registerParallel(testCase);
        return this;
    }

    public Runlane registerSequential(TestCase testCase) {
        delegate.registerSequential(testCase);
        return this;
    }

    public Runlane workerCount(int count) {
        delegate.workerCount(count);
        return this;
    }

    public Runlane timeoutPerTest(Duration timeout) {
        delegate.timeoutPerTest(timeout);
        return this;
    }

    public Runlane maxFailures(int max) {
        delegate.maxFailures(max);
        return this;
    }

    public Runlane seed(long seed) {
        delegate.seed(seed);
        return this;
    }

    /**
     * Tests carrying any of these tags are skipped.
     */
    public Runlane excludeTags(String... tags) {
        delegate.excludeTags(tags);
        return this;
    }

    public Runlane config(RunConfig config) {
        delegate.config(config);
        return this;
    }

    /**
     * Enable or disable hierarchical test structure.
     * <p>
     * When enabled (default), cases appear as containers with their tests as children.
     * When disabled, all tests appear at the root level as {@code caseId/testId}.
     */
    public Runlane hierarchical(boolean enabled) {
        this.hierarchical = enabled;
        return this;
    }

    /**
     * Maximum time to wait for the next event before giving up on the run.
     */
    public Runlane timeoutMinutes(long minutes) {
        this.timeoutMinutes = minutes;
        return this;
    }

    /**
     * Starts the run in the background and returns a stream that yields tests as they finish.
     */
    public Stream<DynamicNode> stream() {
        Subscription subscription = delegate.subscribe().timeout(Duration.ofMinutes(timeoutMinutes));
        CompletableFuture.supplyAsync(delegate::run).whenComplete((RunStatistics stats, Throwable error) -> {
            if (error != null) {
                logger.error("run failed: {}", error.getMessage(), error);
                subscription.close();
            }
        });
        return new StreamingTestIterator(subscription, hierarchical).stream();
    }

    @Override
    public Iterator<DynamicNode> iterator() {
        return stream().iterator();
    }

    @Override
    public String toString() {
        return "Runlane{cases=" + delegate.getRegistry().size() + ", hierarchical=" + hierarchical + "}";
    }

}
