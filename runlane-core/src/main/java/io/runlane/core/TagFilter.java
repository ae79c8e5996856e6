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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides which tests are excluded from a run.
 * <p>
 * Tags are compared without a leading {@code @}, so {@code @slow} and {@code slow} are the same tag.
 * A test carrying the reserved {@link #EXCLUDED} tag is always excluded, whatever the configuration.
 */
public class TagFilter {

    public static final String EXCLUDED = "excluded";

    private static final TagFilter DEFAULT = new TagFilter(Collections.emptySet());

    private final Set<String> excludeTags;

    private TagFilter(Set<String> excludeTags) {
        this.excludeTags = excludeTags;
    }

    public static TagFilter of(Collection<String> excludeTags) {
        if (excludeTags == null || excludeTags.isEmpty()) {
            return DEFAULT;
        }
        return new TagFilter(Collections.unmodifiableSet(normalize(excludeTags)));
    }

    public static String normalize(String tag) {
        if (tag == null) {
            return null;
        }
        String trimmed = tag.trim();
        return trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    }

    public static Set<String> normalize(Collection<String> tags) {
        Set<String> result = new LinkedHashSet<>();
        for (String tag : tags) {
            String name = normalize(tag);
            if (name != null && !name.isEmpty()) {
                result.add(name);
            }
        }
        return result;
    }

    public boolean isExcluded(TestUnit test) {
        if (test.isExcluded()) {
            return true;
        }
        for (String tag : test.getTags()) {
            if (excludeTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getExcludeTags() {
        return excludeTags;
    }

}
