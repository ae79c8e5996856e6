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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process broadcast channel for {@link RunEvent}s.
 * <p>
 * Every subscriber owns an unbounded queue. {@link #publish(RunEvent)} only enqueues, so it never
 * waits on a subscriber, and all subscribers receive events in the same emission order.
 * There is no replay: a subscriber only sees events published after it subscribed.
 */
public class EventBus {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger listenerCounter = new AtomicInteger();

    /**
     * Fire-and-forget delivery to all current subscribers.
     */
    public void publish(RunEvent event) {
        Objects.requireNonNull(event, "event");
        // serialized so that concurrent publishers are seen in the same order by every subscriber
        synchronized (this) {
            for (Subscription subscription : subscriptions) {
                subscription.offer(event);
            }
        }
        if (logger.isTraceEnabled()) {
            logger.trace("published {} {}", event.getKind(), event.toJson());
        }
    }

    /**
     * Subscribes a pull-style consumer. Iterating the returned subscription blocks until the
     * next event and ends after {@code suite_finished}.
     */
    public Subscription subscribe() {
        Subscription subscription = new Subscription(this);
        synchronized (this) {
            subscriptions.add(subscription);
        }
        return subscription;
    }

    /**
     * Subscribes a push-style listener, called from a dedicated daemon thread.
     */
    public Subscription subscribe(RunListener listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = subscribe();
        subscription.dispatchTo(listener, "runlane-listener-" + listenerCounter.incrementAndGet());
        return subscription;
    }

    void unsubscribe(Subscription subscription) {
        synchronized (this) {
            subscriptions.remove(subscription);
        }
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

}
