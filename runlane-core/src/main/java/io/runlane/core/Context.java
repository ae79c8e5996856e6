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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable key-value data threaded from group setup, through per-test setup, into a test body.
 * <p>
 * Every "modification" returns a new instance, so a test can never observe changes made
 * by a sibling test to its own copy.
 */
public final class Context {

    private static final Context EMPTY = new Context(Collections.emptyMap());

    private final Map<String, Object> values;

    private Context(Map<String, Object> values) {
        this.values = values;
    }

    public static Context empty() {
        return EMPTY;
    }

    public static Context of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Context(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Context of(String key, Object value) {
        return EMPTY.with(key, value);
    }

    public Context with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new Context(Collections.unmodifiableMap(copy));
    }

    /**
     * Returns a context holding the entries of this one overridden by those of {@code other}.
     */
    public Context merge(Map<String, ?> other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (values.isEmpty()) {
            return of(other);
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(other);
        return new Context(Collections.unmodifiableMap(copy));
    }

    public Context merge(Context other) {
        return other == null ? this : merge(other.values);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public <T> T get(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new ClassCastException("context value '" + key + "' is a "
                    + value.getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(value);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> toMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Context other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Context" + values;
    }

}
