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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.runlane.core.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scheduler tests: dispatch, lifecycle, timeouts, the failure budget and exclusion.
 */
class SuiteTest {

    @Test
    void testPassFailPassInOneCase() {
        AtomicInteger teardowns = new AtomicInteger();
        Runner.Builder runner = runner().workerCount(2)
                .registerParallel(TestCase.builder("mixed")
                        .test("first", pass())
                        .test("second", failing("expected failure"))
                        .test("third", pass())
                        .teardown(ctx -> teardowns.incrementAndGet())
                        .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertEquals(3, stats.total());
        assertEquals(1, stats.failures());
        assertEquals(2, stats.passed());
        assertFalse(stats.failureBudgetExceeded());
        assertEquals(1, stats.exitCode());
        assertEquals(1, teardowns.get());

        List<RunEvent> events = events(subscription);
        assertEquals(1, ofType(events, RunEventType.CASE_FINISHED).size());
        TestResult second = finishedTest(events, "mixed", "second");
        assertEquals(TestStatus.FAILED, second.getStatus());
        assertEquals(FailureKind.TEST_FAILURE, second.getFailure().kind());
        assertEquals("expected failure", second.getFailureMessage());
        assertEquals("AssertionError", second.getFailure().type());
    }

    @Test
    void testGroupSetupFailureFailsEveryTest() {
        AtomicInteger bodies = new AtomicInteger();
        AtomicInteger teardowns = new AtomicInteger();
        TestBody counting = ctx -> bodies.incrementAndGet();
        Runner.Builder runner = runner()
                .registerParallel(TestCase.builder("broken")
                        .setup(scope -> {
                            throw new IllegalStateException("database unavailable");
                        })
                        .test("a", counting)
                        .test("b", counting)
                        .test("c", counting)
                        .teardown(ctx -> teardowns.incrementAndGet())
                        .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertEquals(0, bodies.get());
        assertEquals(3, stats.total());
        assertEquals(3, stats.failures());
        assertEquals(1, teardowns.get());

        List<RunEvent> events = events(subscription);
        assertTrue(startedTests(events, "broken").isEmpty());
        List<RunEvent> finished = ofType(events, RunEventType.TEST_FINISHED);
        assertEquals(3, finished.size());
        for (RunEvent event : finished) {
            TestResult result = ((TestRunEvent) event).result();
            assertEquals(TestStatus.FAILED, result.getStatus());
            assertEquals(FailureKind.SETUP_FAILURE, result.getFailure().kind());
            assertTrue(result.getFailureMessage().contains("database unavailable"), result.getFailureMessage());
            assertEquals("IllegalStateException", result.getFailure().type());
        }
        CaseRunEvent caseFinished = (CaseRunEvent) ofType(events, RunEventType.CASE_FINISHED).get(0);
        assertNotNull(caseFinished.result().getSetupFailure());
    }

    @Test
    void testTimeoutDoesNotAffectOtherSlots() {
        long start = System.currentTimeMillis();
        Runner.Builder runner = runner().workerCount(2)
                .timeoutPerTest(Duration.ofMillis(50))
                .registerParallel(TestCase.builder("slow")
                        .test("hangs", sleep(200))
                        .test("after", pass())
                        .build())
                .registerParallel(TestCase.builder("sibling")
                        .test("one", sleep(10))
                        .test("two", sleep(10))
                        .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertEquals(4, stats.total());
        assertEquals(1, stats.failures());
        List<RunEvent> events = events(subscription);
        TestResult hangs = finishedTest(events, "slow", "hangs");
        assertEquals(TestStatus.TIMED_OUT, hangs.getStatus());
        assertEquals(FailureKind.TEST_TIMEOUT, hangs.getFailure().kind());
        assertEquals("TestTimeoutException", hangs.getFailure().type());
        assertTrue(hangs.getDurationMillis() < 200, "took " + hangs.getDurationMillis());
        assertEquals(TestStatus.PASSED, finishedTest(events, "slow", "after").getStatus());
        assertEquals(TestStatus.PASSED, finishedTest(events, "sibling", "one").getStatus());
        assertEquals(TestStatus.PASSED, finishedTest(events, "sibling", "two").getStatus());
        assertTrue(System.currentTimeMillis() - start < 5000);
    }

    @Test
    void testPerTestTimeoutOverridesConfig() {
        RunStatistics stats = runner().timeoutPerTest(Duration.ofSeconds(10))
                .registerParallel(TestCase.builder("override")
                        .test(TestUnit.builder("short").timeout(Duration.ofMillis(50)).body(sleep(2000)).build())
                        .build())
                .run();
        assertEquals(1, stats.failures());
    }

    @Test
    void testFailureBudgetStopsFurtherCases() {
        AtomicBoolean secondStarted = new AtomicBoolean();
        AtomicInteger teardowns = new AtomicInteger();
        Runner.Builder runner = runner().workerCount(1).maxFailures(1)
                .registerParallel(TestCase.builder("first")
                        .test("fails", failing("boom"))
                        .teardown(ctx -> teardowns.incrementAndGet())
                        .build())
                .registerParallel(TestCase.builder("second")
                        .setup(scope -> {
                            secondStarted.set(true);
                            return null;
                        })
                        .test("never", pass())
                        .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertTrue(stats.failureBudgetExceeded());
        assertEquals(2, stats.total());
        assertEquals(1, stats.failures());
        assertEquals(1, stats.notRun());
        assertEquals(0, stats.passed());
        assertEquals(1, stats.exitCode());
        assertFalse(secondStarted.get());
        assertEquals(1, teardowns.get());

        List<RunEvent> events = events(subscription);
        List<RunEvent> caseStarted = ofType(events, RunEventType.CASE_STARTED);
        assertEquals(1, caseStarted.size());
        assertEquals("first", ((CaseRunEvent) caseStarted.get(0)).caseId());
        SuiteRunEvent suiteFinished = (SuiteRunEvent) events.get(events.size() - 1);
        assertTrue(suiteFinished.statistics().failureBudgetExceeded());
    }

    @Test
    void testFailureBudgetStopsRemainingTestsOfRunningCase() {
        RunStatistics stats = runner().maxFailures(1)
                .registerParallel(TestCase.builder("stops")
                        .test("fails", failing("boom"))
                        .test("skipped1", pass())
                        .test("skipped2", pass())
                        .build())
                .run();
        assertEquals(3, stats.total());
        assertEquals(2, stats.notRun());
        assertEquals(0, stats.passed());
    }

    @Test
    void testTotalIncludesTestsSkippedByBreaker() {
        Runner.Builder runner = runner().workerCount(1).maxFailures(1)
                .registerParallel(TestCase.builder("first")
                        .test("fails", failing("boom"))
                        .build())
                .registerParallel(TestCase.builder("second")
                        .test("a", pass())
                        .test("b", pass())
                        .test(TestUnit.builder("c").excluded().body(pass()).build())
                        .build());
        Suite suite = runner.buildSuite();
        RunStatistics stats = suite.run(RunConfig.builder().seed(0).workerCount(1).maxFailures(1).build());

        assertEquals(3, stats.total());
        assertEquals(1, stats.failures());
        assertEquals(2, stats.notRun());
        assertEquals(1, stats.excluded());
        assertEquals(0, stats.passed());
        assertEquals(1, suite.getResult().getCompleted());
    }

    @Test
    void testFailureBudgetCancelsSequentialPhase() {
        AtomicBoolean sequentialRan = new AtomicBoolean();
        RunStatistics stats = runner().workerCount(1).maxFailures(1)
                .registerParallel(TestCase.builder("parallel")
                        .test("fails", failing("boom"))
                        .build())
                .registerSequential(TestCase.builder("sequential")
                        .test("never", ctx -> sequentialRan.set(true))
                        .test(TestUnit.builder("ignored").excluded().body(pass()).build())
                        .build())
                .run();
        assertFalse(sequentialRan.get());
        assertEquals(2, stats.total());
        assertEquals(1, stats.notRun());
        assertEquals(1, stats.excluded());
    }

    @Test
    void testUnboundedBudgetRunsEverything() {
        Runner.Builder runner = runner().workerCount(1);
        for (int i = 0; i < 5; i++) {
            runner.registerParallel(TestCase.builder("case" + i).test("fails", failing("boom")).build());
        }
        RunStatistics stats = runner.run();
        assertEquals(5, stats.total());
        assertEquals(5, stats.failures());
        assertFalse(stats.failureBudgetExceeded());
    }

    @Test
    void testExcludedTestsNeverRun() {
        AtomicInteger bodies = new AtomicInteger();
        TestCase.Builder builder = TestCase.builder("tagged").test("kept", pass());
        for (int i = 1; i <= 5; i++) {
            builder.test(TestUnit.builder("x" + i).excluded().body(ctx -> bodies.incrementAndGet()).build());
        }
        Runner.Builder runner = runner().registerParallel(builder.build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertEquals(0, bodies.get());
        assertEquals(5, stats.excluded());
        assertEquals(1, stats.total());
        assertEquals(List.of("kept"), startedTests(events(subscription), "tagged"));
    }

    @Test
    void testConfiguredExcludeTags() {
        RunStatistics stats = runner().excludeTags("@slow")
                .registerParallel(TestCase.builder("mixed")
                        .test(TestUnit.builder("fast").tags("smoke").body(pass()).build())
                        .test(TestUnit.builder("slow").tags("slow").body(failing("should not run")).build())
                        .build())
                .run();
        assertEquals(1, stats.total());
        assertEquals(0, stats.failures());
        assertEquals(1, stats.excluded());
    }

    @Test
    void testWorkerSlotsBoundConcurrency() {
        ConcurrencyTracker tracker = new ConcurrencyTracker();
        Runner.Builder runner = runner().workerCount(2);
        for (int c = 1; c <= 4; c++) {
            String caseId = "case" + c;
            TestCase.Builder builder = TestCase.builder(caseId);
            for (int t = 1; t <= 3; t++) {
                builder.test("t" + t, tracker.body(caseId, "t" + t, 30));
            }
            runner.registerParallel(builder.build());
        }
        RunStatistics stats = runner.run();

        assertEquals(12, stats.total());
        assertEquals(0, stats.failures());
        assertTrue(tracker.getMaxTotalConcurrent() <= 2, "max concurrent " + tracker.getMaxTotalConcurrent());
        for (int c = 1; c <= 4; c++) {
            assertEquals(1, tracker.getMaxConcurrent("case" + c), "tests of a case interleaved");
        }
    }

    @Test
    void testSequentialCasesRunAfterParallelPhaseInOrder() {
        Runner.Builder runner = runner().workerCount(3)
                .registerParallel(TestCase.builder("p1").test("t", sleep(30)).build())
                .registerParallel(TestCase.builder("p2").test("t", sleep(30)).build())
                .registerSequential(TestCase.builder("s1").test("t", pass()).build())
                .registerSequential(TestCase.builder("s2").test("t", pass()).build())
                .registerSequential(TestCase.builder("s3").test("t", pass()).build());
        Subscription subscription = runner.subscribe();
        runner.run();

        List<String> timeline = new ArrayList<>();
        for (RunEvent event : events(subscription)) {
            if (event instanceof CaseRunEvent cre) {
                timeline.add(event.getKind() + ":" + cre.caseId());
            }
        }
        int lastParallelEnd = Math.max(timeline.indexOf("case_finished:p1"), timeline.indexOf("case_finished:p2"));
        int firstSequentialStart = timeline.indexOf("case_started:s1");
        assertTrue(lastParallelEnd < firstSequentialStart, timeline.toString());
        assertEquals(List.of(
                "case_started:s1", "case_finished:s1",
                "case_started:s2", "case_finished:s2",
                "case_started:s3", "case_finished:s3"), timeline.subList(firstSequentialStart, timeline.size()));
    }

    @Test
    void testSameSeedGivesSameOrder() {
        List<String> first = runOrder(42L);
        List<String> second = runOrder(42L);
        assertEquals(10, first.size());
        assertEquals(first, second);
    }

    @Test
    void testZeroSeedKeepsDeclarationOrder() {
        List<String> declared = List.of("t1", "t2", "t3", "t4", "t5", "t6", "t7", "t8", "t9", "t10");
        assertEquals(declared, runOrder(0L));
        boolean shuffled = false;
        for (long seed = 1; seed <= 5; seed++) {
            List<String> order = runOrder(seed);
            assertEquals(new ArrayList<>(declared).stream().sorted().toList(), order.stream().sorted().toList());
            shuffled |= !order.equals(declared);
        }
        assertTrue(shuffled);
    }

    private static List<String> runOrder(long seed) {
        Runner.Builder runner = runner().seed(seed).registerParallel(passingCase("shuffle", 10));
        Subscription subscription = runner.subscribe();
        runner.run();
        return startedTests(events(subscription), "shuffle");
    }

    @Test
    void testTeardownRunsOnceAfterAllTests() {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger teardowns = new AtomicInteger();
        runner().timeoutPerTest(Duration.ofMillis(100))
                .registerParallel(TestCase.builder("lifecycle")
                        .test("a", ctx -> order.add("test:a"))
                        .test("b", ctx -> {
                            order.add("test:b");
                            Thread.sleep(1000);
                        })
                        .test("c", ctx -> {
                            order.add("test:c");
                            throw new RuntimeException("boom");
                        })
                        .teardown(ctx -> {
                            teardowns.incrementAndGet();
                            order.add("teardown");
                        })
                        .build())
                .run();
        assertEquals(1, teardowns.get());
        assertEquals(List.of("test:a", "test:b", "test:c", "teardown"), order);
    }

    @Test
    void testTotalMatchesRegisteredMinusExcluded() {
        Runner.Builder runner = runner().workerCount(3);
        int expected = 0;
        for (int c = 1; c <= 6; c++) {
            TestCase.Builder builder = TestCase.builder("case" + c);
            for (int t = 1; t <= c; t++) {
                if (t % 3 == 0) {
                    builder.test(TestUnit.builder("t" + t).excluded().body(pass()).build());
                } else {
                    builder.test("t" + t, t % 2 == 0 ? failing("even") : pass());
                    expected++;
                }
            }
            if (c % 2 == 0) {
                runner.registerSequential(builder.build());
            } else {
                runner.registerParallel(builder.build());
            }
        }
        Suite suite = runner.buildSuite();
        RunStatistics stats = suite.run(RunConfig.builder().seed(7).workerCount(3).build());

        assertEquals(expected, stats.total());
        int perCaseFailures = 0;
        int perCaseTotal = 0;
        for (CaseResult cr : suite.getResult().getCaseResults()) {
            perCaseFailures += cr.getFailedCount();
            perCaseTotal += cr.getTestCount();
        }
        assertEquals(stats.failures(), perCaseFailures);
        assertEquals(stats.total(), perCaseTotal);
        assertEquals(6, suite.getResult().getCaseResults().size());
    }

    @Test
    void testEveryTestReachesOneTerminalStatus() {
        Runner.Builder runner = runner().workerCount(4).timeoutPerTest(Duration.ofMillis(100));
        for (int c = 1; c <= 5; c++) {
            runner.registerParallel(TestCase.builder("case" + c)
                    .test("pass", pass())
                    .test("fail", failing("boom"))
                    .test("timeout", sleep(500))
                    .build());
        }
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        List<RunEvent> events = events(subscription);
        List<RunEvent> finished = ofType(events, RunEventType.TEST_FINISHED);
        assertEquals(15, finished.size());
        assertEquals(15, ofType(events, RunEventType.TEST_STARTED).size());
        assertEquals(15, finished.stream()
                .map(e -> ((TestRunEvent) e).caseId() + "/" + ((TestRunEvent) e).testId())
                .distinct().count());
        assertEquals(15, stats.total());
        assertEquals(10, stats.failures());
    }

    @Test
    void testGroupContextIsSharedAndPerTestContextIsIsolated() {
        List<Object> seen = Collections.synchronizedList(new ArrayList<>());
        RunStatistics stats = runner()
                .registerParallel(TestCase.builder("context")
                        .setup(scope -> Context.of("db", "jdbc:test"))
                        .setupEach((ctx, scope) -> Context.of("testId", scope.getTestId()))
                        .test("a", ctx -> seen.add(ctx.get("db") + ":" + ctx.get("testId")))
                        .test("b", ctx -> seen.add(ctx.get("db") + ":" + ctx.get("testId")))
                        .build())
                .run();
        assertEquals(0, stats.failures());
        assertEquals(List.of("jdbc:test:a", "jdbc:test:b"), seen);
    }

    @Test
    void testPerTestSetupFailureFailsOnlyThatTest() {
        Runner.Builder runner = runner()
                .registerParallel(TestCase.builder("each")
                        .setupEach((ctx, scope) -> {
                            if ("b".equals(scope.getTestId())) {
                                throw new IllegalStateException("no fixture for b");
                            }
                            return Context.empty();
                        })
                        .test("a", pass())
                        .test("b", pass())
                        .test("c", pass())
                        .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertEquals(3, stats.total());
        assertEquals(1, stats.failures());
        TestResult b = finishedTest(events(subscription), "each", "b");
        assertEquals(FailureKind.SETUP_FAILURE, b.getFailure().kind());
        assertEquals("IllegalStateException", b.getFailure().type());
    }

    @Test
    void testTeardownFailureIsReportedButDoesNotChangeResults() {
        Runner.Builder runner = runner()
                .registerParallel(TestCase.builder("dirty")
                        .test("ok", pass())
                        .teardown(ctx -> {
                            throw new IllegalStateException("cleanup failed");
                        })
                        .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        assertEquals(0, stats.failures());
        assertTrue(stats.isPassed());
        List<RunEvent> errors = ofType(events(subscription), RunEventType.ERROR);
        assertEquals(1, errors.size());
        ErrorRunEvent error = (ErrorRunEvent) errors.get(0);
        assertEquals("dirty", error.caseId());
        assertEquals(FailureKind.TEARDOWN_FAILURE, error.failure().kind());
        assertEquals("cleanup failed", error.failure().message());
    }

    @Test
    void testEventOrderForOneCase() {
        Runner.Builder runner = runner().registerParallel(passingCase("single", 2));
        Subscription subscription = runner.subscribe();
        runner.run();
        assertEquals(List.of(
                "suite_started",
                "case_started",
                "test_started", "test_finished",
                "test_started", "test_finished",
                "case_finished",
                "suite_finished"), kinds(events(subscription)));
    }

    @Test
    void testCapturedOutputIsPerTest() {
        Runner.Builder runner = runner().workerCount(2);
        for (int c = 1; c <= 3; c++) {
            String caseId = "case" + c;
            runner.registerParallel(TestCase.builder(caseId)
                    .test("print", ctx -> {
                        for (int i = 0; i < 5; i++) {
                            io.runlane.output.LogContext.print(caseId + " line " + i);
                            Thread.sleep(2);
                        }
                    })
                    .build());
        }
        Subscription subscription = runner.subscribe();
        runner.run();
        List<RunEvent> events = events(subscription);
        for (int c = 1; c <= 3; c++) {
            String output = finishedTest(events, "case" + c, "print").getOutput();
            assertNotNull(output);
            for (int i = 0; i < 5; i++) {
                assertTrue(output.contains("case" + c + " line " + i), output);
            }
            assertFalse(output.contains("case" + (c % 3 + 1) + " line"), output);
        }
    }

    @Test
    void testConcurrentRunsWithSameTestKeys() throws Exception {
        CompletableFuture<RunStatistics> first = CompletableFuture.supplyAsync(() -> loginRun("first").run());
        CompletableFuture<RunStatistics> second = CompletableFuture.supplyAsync(() -> loginRun("second").run());
        RunStatistics a = first.get(30, TimeUnit.SECONDS);
        RunStatistics b = second.get(30, TimeUnit.SECONDS);
        assertEquals(1, a.total());
        assertEquals(1, a.passed());
        assertEquals(1, b.total());
        assertEquals(1, b.passed());
    }

    private static Runner.Builder loginRun(String text) {
        return runner().registerParallel(TestCase.builder("login")
                .test("ok", ctx -> {
                    io.runlane.output.LogContext.print(text);
                    Thread.sleep(300);
                })
                .build());
    }

    @Test
    void testRunFinishesWhenSetupIgnoresInterrupt() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger teardowns = new AtomicInteger();
        Runner.Builder runner = runner().workerCount(1).timeoutPerTest(Duration.ofMillis(200))
                .registerParallel(TestCase.builder("stubborn")
                        .setup(scope -> {
                            while (release.getCount() > 0) {
                                try {
                                    release.await();
                                } catch (InterruptedException e) {
                                    // keeps waiting
                                }
                            }
                            return Context.empty();
                        })
                        .teardown(ctx -> teardowns.incrementAndGet())
                        .test("a", pass())
                        .build())
                .registerParallel(passingCase("next", 1));
        try {
            RunStatistics stats = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> runner.run());
            assertEquals(2, stats.total());
            assertEquals(1, stats.failures());
            assertEquals(1, teardowns.get());
        } finally {
            release.countDown();
        }
    }

    @Test
    void testLateOutputOfTimedOutTestIsNotCaptured() {
        CountDownLatch late = new CountDownLatch(1);
        Runner.Builder runner = runner().registerParallel(TestCase.builder("late")
                .test(TestUnit.builder("slow").timeout(Duration.ofMillis(100)).body(ctx -> {
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException e) {
                        // carries on after the interrupt, well after the timeout was handled
                        Thread.sleep(300);
                    }
                    io.runlane.output.LogContext.print("late line");
                    late.countDown();
                }).build())
                .test("next", ctx -> {
                    assertTrue(late.await(5, TimeUnit.SECONDS));
                    io.runlane.output.LogContext.print("next line");
                })
                .build());
        Subscription subscription = runner.subscribe();
        RunStatistics stats = runner.run();

        List<RunEvent> events = events(subscription);
        TestResult slow = finishedTest(events, "late", "slow");
        TestResult next = finishedTest(events, "late", "next");
        assertEquals(TestStatus.TIMED_OUT, slow.getStatus());
        assertNull(slow.getOutput());
        assertEquals(TestStatus.PASSED, next.getStatus());
        assertEquals("next line\n", next.getOutput());
        assertEquals(1, stats.failures());
    }

    @Test
    void testSuiteRunsOnce() {
        Suite suite = Suite.of(new CaseRegistry());
        suite.run(RunConfig.builder().seed(0).build());
        assertThrows(IllegalStateException.class, () -> suite.run(RunConfig.defaults()));
    }

    @Test
    void testEmptyRun() {
        RunStatistics stats = runner().run();
        assertEquals(0, stats.total());
        assertTrue(stats.isPassed());
        assertEquals(0, stats.exitCode());
    }

    @Test
    void testOrderHelperIsDeterministic() {
        List<TestUnit> tests = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tests.add(TestUnit.of("t" + i, pass()));
        }
        assertSame(tests, CaseRuntime.order(tests, 0, "c"));
        assertEquals(CaseRuntime.order(tests, 99, "c"), CaseRuntime.order(tests, 99, "c"));
        assertEquals(8, CaseRuntime.order(tests, 99, "c").size());
    }

}
