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

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single executable unit within a {@link TestCase}.
 * <p>
 * Immutable; the runtime status of an execution is held by the engine, not here.
 */
public class TestUnit {

    private final String id;
    private final Set<String> tags;
    private final TestBody body;
    private final Duration timeout;

    private TestUnit(Builder builder) {
        this.id = builder.id;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public static TestUnit of(String id, TestBody body) {
        return builder(id).body(body).build();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean hasTag(String tag) {
        return tags.contains(TagFilter.normalize(tag));
    }

    public boolean isExcluded() {
        return tags.contains(TagFilter.EXCLUDED);
    }

    public TestBody getBody() {
        return body;
    }

    /**
     * Overrides the run-wide per-test timeout, or null to use it.
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return id + (tags.isEmpty() ? "" : " " + tags);
    }

    public static class Builder {

        private final String id;
        private final Set<String> tags = new LinkedHashSet<>();
        private TestBody body;
        private Duration timeout;

        Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("test id must not be blank");
            }
            this.id = id;
        }

        public Builder tags(String... values) {
            tags.addAll(TagFilter.normalize(Arrays.asList(values)));
            return this;
        }

        /**
         * Marks the test with the reserved {@code excluded} tag, so it never runs.
         */
        public Builder excluded() {
            tags.add(TagFilter.EXCLUDED);
            return this;
        }

        public Builder timeout(Duration value) {
            if (value != null && (value.isNegative() || value.isZero())) {
                throw new IllegalArgumentException("timeout must be positive: " + value);
            }
            this.timeout = value;
            return this;
        }

        public Builder body(TestBody value) {
            this.body = value;
            return this;
        }

        public TestUnit build() {
            Objects.requireNonNull(body, "body of test " + id);
            return new TestUnit(this);
        }

    }

}
