package com.phillippitts.interviewcopilot.service.events;

import com.phillippitts.interviewcopilot.service.session.SerialExecutor;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Typed event channel with a single consumer loop.
 *
 * <p>Events are delivered to the consumer one at a time in publication order. Replaces
 * per-event-kind callbacks: producers publish records implementing one event interface and the
 * consumer dispatches on the concrete type.
 *
 * @param <E> event type
 */
public final class EventChannel<E> {

    private final SerialExecutor loop;
    private final Consumer<? super E> consumer;

    public EventChannel(String name, Executor executor, Map<String, String> logContext,
                        Consumer<? super E> consumer) {
        this.loop = new SerialExecutor(name, executor, logContext);
        this.consumer = Objects.requireNonNull(consumer, "consumer");
    }

    /**
     * Publishes an event.
     *
     * @return false if the channel is closed and the event was dropped
     */
    public boolean publish(E event) {
        Objects.requireNonNull(event, "event");
        if (loop.isClosed()) {
            return false;
        }
        loop.execute(() -> consumer.accept(event));
        return true;
    }

    /** Stops delivery; undelivered events are discarded. */
    public void close() {
        loop.close();
    }

    public boolean isClosed() {
        return loop.isClosed();
    }
}
