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

/**
 * Observer of runtime events.
 *
 * <p>Each listener subscribed through {@link EventBus#subscribe(RunListener)} is called from its
 * own dispatcher thread, one event at a time, in emission order. A slow listener delays only itself.</p>
 *
 * <p>Usage example:</p>
 * <pre>
 * Runner.builder()
 *     .register(cases)
 *     .listener(event -&gt; {
 *         if (event.getType() == RunEventType.TEST_FINISHED) {
 *             System.out.println(event.toJson());
 *         }
 *     })
 *     .run();
 * </pre>
 */
@FunctionalInterface
public interface RunListener {

    void onEvent(RunEvent event);

}
