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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One run of the engine over everything registered in a {@link CaseRegistry}.
 * <p>
 * Parallel cases are dispatched first, at most {@code workerCount} at a time, each holding one
 * worker slot from setup to teardown. Sequential cases follow, one at a time, in discovery order,
 * and only once every parallel case has finished. Once the failure budget is exceeded no further
 * case or test is started; whatever is in flight finishes and tears down normally.
 * <p>
 * A suite runs once. Use {@link Runner} for the common case.
 */
public class Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final AtomicLong RUN_COUNTER = new AtomicLong();

    private final String runId = "run-" + RUN_COUNTER.incrementAndGet();
    private final CaseRegistry registry;
    private final EventBus eventBus;
    private final AtomicBoolean started = new AtomicBoolean();

    private RunConfig config;
    private TagFilter tagFilter;
    private SuiteResult result;
    private LifecycleCoordinator coordinator;
    private ExecutorService testExecutor;

    public Suite(CaseRegistry registry, EventBus eventBus) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    public static Suite of(CaseRegistry registry) {
        return new Suite(registry, new EventBus());
    }

    /**
     * Drains the registry and runs every case. Blocks until all cases have finished and
     * {@code suite_finished} has been published.
     *
     * @throws IllegalStateException if this suite has already been run
     */
    public RunStatistics run(RunConfig config) {
        Objects.requireNonNull(config, "config");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("suite has already been run");
        }
        this.config = config;
        this.tagFilter = TagFilter.of(config.getExcludeTags());
        this.result = new SuiteResult(new FailureBudget(config.getMaxFailures()), config.getSeed());
        this.coordinator = new LifecycleCoordinator(config.getTimeoutPerTest());
        this.testExecutor = Executors.newCachedThreadPool(threadFactory("runlane-test-", true));
        if (config.getLogLevel() != null) {
            LogContext.setRuntimeLogLevel(config.getLogLevel());
        }
        logger.info("{} started: {}", runId, config);
        result.setStartTime(System.currentTimeMillis());
        eventBus.publish(SuiteRunEvent.started(config));
        RunStatistics statistics;
        try {
            CaseRegistry.DrainedCases drained = registry.drain();
            logger.debug("dispatching {} parallel and {} sequential cases",
                    drained.parallel().size(), drained.sequential().size());
            runParallel(drained.parallel());
            runSequential(drained.sequential());
        } finally {
            // abandoned tests that are still running get interrupted once more
            testExecutor.shutdownNow();
            result.setEndTime(System.currentTimeMillis());
            statistics = result.toStatistics();
            eventBus.publish(SuiteRunEvent.finished(config, statistics));
            if (statistics.isPassed()) {
                logger.info("run finished: {} passed, {} excluded, {} not run in {}ms",
                        statistics.passed(), statistics.excluded(), statistics.notRun(), statistics.elapsedMs());
            } else {
                logger.warn("run finished: {} of {} failed, {} excluded, {} not run in {}ms{}",
                        statistics.failures(), statistics.total(), statistics.excluded(), statistics.notRun(),
                        statistics.elapsedMs(), statistics.failureBudgetExceeded() ? " (failure budget exceeded)" : "");
            }
        }
        return statistics;
    }

    private void runParallel(List<TestCase> cases) {
        if (cases.isEmpty()) {
            return;
        }
        int workerCount = config.getWorkerCount();
        Semaphore slots = new Semaphore(workerCount);
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(workerCount, cases.size()), threadFactory("runlane-worker-", false));
        List<Future<CaseResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < cases.size(); i++) {
                TestCase testCase = cases.get(i);
                try {
                    slots.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("interrupted while dispatching, {} cases not started", cases.size() - i);
                    skip(cases.subList(i, cases.size()));
                    break;
                }
                if (result.isFailureBudgetExceeded()) {
                    slots.release();
                    skip(cases.subList(i, cases.size()));
                    break;
                }
                futures.add(executor.submit(() -> {
                    try {
                        return new CaseRuntime(this, testCase).call();
                    } finally {
                        slots.release();
                    }
                }));
            }
            for (Future<CaseResult> future : futures) {
                try {
                    result.addCaseResult(future.get());
                } catch (ExecutionException e) {
                    throw new RunlaneException("case execution failed", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RunlaneException("interrupted while waiting for cases", e);
                }
            }
        } finally {
            executor.shutdown();
        }
    }

    private void runSequential(List<TestCase> cases) {
        for (int i = 0; i < cases.size(); i++) {
            if (result.isFailureBudgetExceeded()) {
                skip(cases.subList(i, cases.size()));
                return;
            }
            result.addCaseResult(new CaseRuntime(this, cases.get(i)).call());
        }
    }

    /**
     * Accounts for cases that were never dispatched so that every registered test ends up
     * counted exactly once.
     */
    private void skip(List<TestCase> cases) {
        if (cases.isEmpty()) {
            return;
        }
        int notRun = 0;
        int excluded = 0;
        for (TestCase testCase : cases) {
            for (TestUnit test : testCase.getTests()) {
                if (tagFilter.isExcluded(test)) {
                    excluded++;
                } else {
                    notRun++;
                }
            }
        }
        result.addNotRun(notRun);
        result.addExcluded(excluded);
        logger.info("{} cases not started, {} tests not run", cases.size(), notRun);
    }

    static ThreadFactory threadFactory(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }

    // ========== Accessors ==========

    /**
     * Identifies this run among runs going on at the same time in the same JVM.
     */
    public String getRunId() {
        return runId;
    }

    public CaseRegistry getRegistry() {
        return registry;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    /**
     * @return the configuration of the current run, or null before {@link #run(RunConfig)}
     */
    public RunConfig getConfig() {
        return config;
    }

    public SuiteResult getResult() {
        return result;
    }

    public LifecycleCoordinator getCoordinator() {
        return coordinator;
    }

    public TagFilter getTagFilter() {
        return tagFilter;
    }

    ExecutorService getTestExecutor() {
        return testExecutor;
    }

}
