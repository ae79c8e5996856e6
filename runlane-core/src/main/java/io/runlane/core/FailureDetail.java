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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Why a test, or a lifecycle callback around it, did not pass.
 *
 * @param kind    the failure classification
 * @param message human readable message, never null
 * @param type    simple class name of the underlying error, may be null
 * @param error   the underlying error, may be null
 */
public record FailureDetail(
        FailureKind kind,
        String message,
        String type,
        Throwable error
) {

    public static FailureDetail of(FailureKind kind, Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isEmpty()) {
            message = error.getClass().getName();
        }
        return new FailureDetail(kind, message, error.getClass().getSimpleName(), error);
    }

    public static FailureDetail of(FailureKind kind, String message) {
        return new FailureDetail(kind, message, null, null);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", kind.getKey());
        map.put("message", message);
        if (type != null) {
            map.put("type", type);
        }
        return map;
    }

}
