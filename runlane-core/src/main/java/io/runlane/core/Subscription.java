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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One subscriber's view of the {@link EventBus}: an ordered, blocking stream of events.
 * <p>
 * The stream ends after the {@code suite_finished} event or when the subscription is closed.
 */
public class Subscription implements Iterator<RunEvent>, AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

    // poison pill put on close()
    private static final Object CLOSED = new Object();

    private final EventBus eventBus;
    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final CountDownLatch completed = new CountDownLatch(1);

    private volatile boolean closed;
    private volatile boolean dispatching;
    private Duration timeout = DEFAULT_TIMEOUT;
    private RunEvent buffered;
    private boolean finished;

    Subscription(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    void offer(RunEvent event) {
        if (!closed) {
            queue.offer(event);
        }
    }

    /**
     * Maximum time {@link #hasNext()} waits for the next event before failing. Listener
     * subscriptions ignore it: their dispatcher waits as long as the run takes.
     */
    public Subscription timeout(Duration value) {
        this.timeout = value;
        return this;
    }

    @Override
    public boolean hasNext() {
        return advance(true);
    }

    private boolean advance(boolean timed) {
        if (buffered != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            Object next;
            if (timed) {
                next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (next == null) {
                    throw new RunlaneException("timeout waiting for events after " + timeout.toMillis() + "ms");
                }
            } else {
                next = queue.take();
            }
            if (next == CLOSED) {
                finish();
                return false;
            }
            buffered = (RunEvent) next;
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish();
            return false;
        }
    }

    @Override
    public RunEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more events");
        }
        RunEvent event = buffered;
        buffered = null;
        if (event.getType() == RunEventType.SUITE_FINISHED) {
            finish();
        }
        return event;
    }

    public Stream<RunEvent> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
    }

    /**
     * Removes and returns the events queued so far, without blocking.
     */
    public List<RunEvent> drain() {
        List<Object> items = new ArrayList<>();
        queue.drainTo(items);
        List<RunEvent> events = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != CLOSED) {
                events.add((RunEvent) item);
            }
        }
        return events;
    }

    void dispatchTo(RunListener listener, String threadName) {
        dispatching = true;
        Thread thread = new Thread(() -> {
            try {
                // ends only on suite_finished or close()
                while (advance(false)) {
                    RunEvent event = next();
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        logger.warn("listener failed on {}: {}", event.getKind(), e.getMessage(), e);
                    }
                }
            } finally {
                completed.countDown();
            }
        }, threadName);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Waits until the stream has ended. For a listener subscription this means the listener
     * has returned from handling {@code suite_finished}.
     *
     * @return false if the wait timed out
     */
    public boolean awaitCompletion(Duration wait) throws InterruptedException {
        return completed.await(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isFinished() {
        return completed.getCount() == 0;
    }

    private void finish() {
        finished = true;
        eventBus.unsubscribe(this);
        if (!dispatching) {
            completed.countDown();
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            eventBus.unsubscribe(this);
            queue.offer(CLOSED);
        }
    }

}
