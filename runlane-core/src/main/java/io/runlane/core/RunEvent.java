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

import java.util.Map;

/**
 * Immutable event published on the {@link EventBus}: a type, a payload and the emission time.
 *
 * <p>Usage:</p>
 * <pre>
 * listener = event -&gt; {
 *     if (event instanceof TestRunEvent e &amp;&amp; e.getType() == RunEventType.TEST_FINISHED) {
 *         print(e.result());
 *     }
 * };
 * </pre>
 */
public interface RunEvent {

    RunEventType getType();

    /**
     * Epoch milliseconds at which the event was created.
     */
    long getTimeStamp();

    /**
     * The payload, with enough data to render one line of output.
     */
    Map<String, Object> toJson();

    /**
     * The wire name of the event type, e.g. {@code case_started}.
     */
    default String getKind() {
        return getType().getKey();
    }

}
