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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named group of {@link TestUnit}s sharing optional setup and teardown.
 * <p>
 * Example:
 * <pre>
 * TestCase users = TestCase.builder("users")
 *     .setup(scope -&gt; {
 *         Db db = Db.start();
 *         scope.onExit(ctx -&gt; db.stop());
 *         return Context.of("db", db);
 *     })
 *     .test("insert", ctx -&gt; ctx.get("db", Db.class).insert("a"))
 *     .test(TestUnit.builder("bulk").tags("slow").body(ctx -&gt; bulkInsert(ctx)).build())
 *     .build();
 * </pre>
 */
public class TestCase {

    private final String id;
    private final ExecutionMode mode;
    private final List<TestUnit> tests;
    private final GroupSetup setup;
    private final List<TestSetup> testSetups;
    private final List<Teardown> teardowns;

    private TestCase(Builder builder) {
        this.id = builder.id;
        this.mode = builder.mode;
        this.tests = Collections.unmodifiableList(new ArrayList<>(builder.tests));
        this.setup = builder.setup;
        this.testSetups = Collections.unmodifiableList(new ArrayList<>(builder.testSetups));
        this.teardowns = Collections.unmodifiableList(new ArrayList<>(builder.teardowns));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public List<TestUnit> getTests() {
        return tests;
    }

    public GroupSetup getSetup() {
        return setup;
    }

    public List<TestSetup> getTestSetups() {
        return testSetups;
    }

    /**
     * Declared teardowns in declaration order. They run in reverse order.
     */
    public List<Teardown> getTeardowns() {
        return teardowns;
    }

    @Override
    public String toString() {
        return id + " (" + mode.name().toLowerCase() + ", " + tests.size() + " tests)";
    }

    public static class Builder {

        private final String id;
        private final List<TestUnit> tests = new ArrayList<>();
        private final Set<String> testIds = new HashSet<>();
        private final List<TestSetup> testSetups = new ArrayList<>();
        private final List<Teardown> teardowns = new ArrayList<>();
        private ExecutionMode mode = ExecutionMode.PARALLEL;
        private GroupSetup setup;

        Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("case id must not be blank");
            }
            this.id = id;
        }

        public Builder mode(ExecutionMode value) {
            this.mode = Objects.requireNonNull(value, "mode");
            return this;
        }

        public Builder parallel() {
            return mode(ExecutionMode.PARALLEL);
        }

        public Builder sequential() {
            return mode(ExecutionMode.SEQUENTIAL);
        }

        public Builder test(TestUnit test) {
            Objects.requireNonNull(test, "test");
            if (!testIds.add(test.getId())) {
                throw new IllegalArgumentException("duplicate test id '" + test.getId() + "' in case " + id);
            }
            tests.add(test);
            return this;
        }

        public Builder test(String testId, TestBody body) {
            return test(TestUnit.of(testId, body));
        }

        public Builder setup(GroupSetup value) {
            this.setup = value;
            return this;
        }

        public Builder setupEach(TestSetup value) {
            testSetups.add(Objects.requireNonNull(value, "setup"));
            return this;
        }

        public Builder teardown(Teardown value) {
            teardowns.add(Objects.requireNonNull(value, "teardown"));
            return this;
        }

        public TestCase build() {
            return new TestCase(this);
        }

    }

}
