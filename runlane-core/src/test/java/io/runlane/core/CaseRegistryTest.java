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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static io.runlane.core.TestUtils.passingCase;
import static org.junit.jupiter.api.Assertions.*;

class CaseRegistryTest {

    @Test
    void testDrainKeepsRegistrationOrderPerGroup() {
        CaseRegistry registry = new CaseRegistry();
        registry.registerParallel(passingCase("p1", 1));
        registry.registerSequential(passingCase("s1", 1));
        registry.registerParallel(passingCase("p2", 1));
        registry.register(TestCase.builder("s2").sequential().build());
        registry.register(TestCase.builder("p3").build());

        CaseRegistry.DrainedCases drained = registry.drain();
        assertEquals(List.of("p1", "p2", "p3"), ids(drained.parallel()));
        assertEquals(List.of("s1", "s2"), ids(drained.sequential()));
        assertEquals(5, drained.size());
        assertThrows(UnsupportedOperationException.class, () -> drained.parallel().add(passingCase("x", 1)));
    }

    @Test
    void testRegisterMethodWinsOverDeclaredMode() {
        CaseRegistry registry = new CaseRegistry();
        registry.registerParallel(TestCase.builder("declared-sequential").sequential().build());
        assertEquals(1, registry.drain().parallel().size());
    }

    @Test
    void testLateRegistration() {
        CaseRegistry registry = new CaseRegistry();
        registry.registerParallel(passingCase("early", 1));
        registry.drain();
        assertTrue(registry.isDrained());
        LateRegistrationException e = assertThrows(LateRegistrationException.class,
                () -> registry.registerSequential(passingCase("late", 1)));
        assertTrue(e.getMessage().contains("late"));
        assertThrows(LateRegistrationException.class, () -> registry.register(passingCase("late2", 1)));
    }

    @Test
    void testDrainOnlyOnce() {
        CaseRegistry registry = new CaseRegistry();
        registry.drain();
        assertThrows(IllegalStateException.class, registry::drain);
    }

    @Test
    void testDuplicateCaseId() {
        CaseRegistry registry = new CaseRegistry();
        registry.registerParallel(passingCase("same", 1));
        assertThrows(IllegalArgumentException.class, () -> registry.registerSequential(passingCase("same", 1)));
        assertEquals(1, registry.size());
    }

    @Test
    void testConcurrentRegistration() throws Exception {
        CaseRegistry registry = new CaseRegistry();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        registry.registerParallel(passingCase("case-" + thread + "-" + i, 1));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(400, registry.drain().parallel().size());
    }

    private static List<String> ids(List<TestCase> cases) {
        List<String> ids = new ArrayList<>();
        for (TestCase testCase : cases) {
            ids.add(testCase.getId());
        }
        return ids;
    }

}
