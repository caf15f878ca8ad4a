package com.perfwatch.core.event;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Asynchronous fan-out of engine events to subscribers.
 *
 * <h3>Delivery</h3>
 * <p>
 * Every subscriber gets its own single-thread executor with a bounded queue.
 * Events therefore reach one subscriber in publish order, and a slow or
 * failing subscriber never blocks the publisher or the other subscribers.
 * </p>
 *
 * <h3>Overflow</h3>
 * <p>
 * When a subscriber's queue is full the event is dropped for that subscriber
 * only, counted on the dropped-events counter and logged at WARN.
 * </p>
 *
 * @param <E> event type
 * @since 1.0.0
 */
public final class EventDispatcher<E> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EventDispatcher.class);

    private final String name;
    private final int queueCapacity;
    private final long drainTimeoutMs;

    private final List<Channel> channels = new CopyOnWriteArrayList<>();
    private final AtomicInteger subscriberSeq = new AtomicInteger();
    private final Counter dropped;
    private volatile boolean closed;

    /**
     * @param name           used in thread names and log messages
     * @param queueCapacity  pending events per subscriber
     * @param drainTimeoutMs how long {@link #close()} waits for queues to drain
     * @param dropped        incremented for every event lost to a full queue
     */
    public EventDispatcher(String name, int queueCapacity, long drainTimeoutMs, Counter dropped) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dropped = Objects.requireNonNull(dropped, "dropped must not be null");
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0, got: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        this.drainTimeoutMs = drainTimeoutMs;
    }

    /**
     * Register a listener.
     *
     * @param listener receives events on a dedicated thread
     * @return handle that cancels the subscription when closed
     * @throws IllegalStateException if the dispatcher is closed
     */
    public Subscription subscribe(Consumer<? super E> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (closed) {
            throw new IllegalStateException("Dispatcher '" + name + "' is closed");
        }
        Channel channel = new Channel(name + "-subscriber-" + subscriberSeq.incrementAndGet(), listener);
        channels.add(channel);
        LOG.debug("Subscriber {} registered", channel.threadName);
        return channel;
    }

    /**
     * Queue {@code event} for every current subscriber. Never blocks.
     */
    public void publish(E event) {
        Objects.requireNonNull(event, "event must not be null");
        if (closed) {
            LOG.debug("Dispatcher '{}' closed, discarding event {}", name, event);
            return;
        }
        for (Channel channel : channels) {
            channel.offer(event);
        }
    }

    public int subscriberCount() {
        return channels.size();
    }

    /**
     * @return number of events dropped because a subscriber queue was full
     */
    public long droppedCount() {
        return (long) dropped.count();
    }

    /**
     * Stop accepting events and wait up to the drain timeout for queued
     * events to be delivered.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Channel channel : channels) {
            channel.executor.shutdown();
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
        for (Channel channel : channels) {
            try {
                long remaining = deadline - System.nanoTime();
                if (!channel.executor.awaitTermination(Math.max(0L, remaining), TimeUnit.NANOSECONDS)) {
                    LOG.warn("Subscriber {} did not drain within {} ms, {} event(s) discarded",
                            channel.threadName, drainTimeoutMs, channel.executor.shutdownNow().size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                channel.executor.shutdownNow();
            }
        }
        channels.clear();
        LOG.info("Dispatcher '{}' closed ({} event(s) dropped in total)", name, droppedCount());
    }

    // ---------------------------------------------------------------
    // Per-subscriber channel
    // ---------------------------------------------------------------

    private final class Channel implements Subscription {

        private final String threadName;
        private final Consumer<? super E> listener;
        private final ThreadPoolExecutor executor;

        Channel(String threadName, Consumer<? super E> listener) {
            this.threadName = threadName;
            this.listener = listener;
            this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(queueCapacity),
                    r -> {
                        Thread t = new Thread(r, threadName);
                        t.setDaemon(true);
                        return t;
                    });
        }

        void offer(E event) {
            try {
                executor.execute(() -> deliver(event));
            } catch (RejectedExecutionException e) {
                if (!executor.isShutdown()) {
                    dropped.increment();
                    LOG.warn("Subscriber {} queue full ({}), dropping event {}", threadName, queueCapacity, event);
                }
            }
        }

        private void deliver(E event) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                LOG.error("Subscriber {} failed on event {}: {}", threadName, event, e.getMessage(), e);
            }
        }

        @Override
        public boolean isActive() {
            return !executor.isShutdown();
        }

        @Override
        public void close() {
            if (channels.remove(this)) {
                executor.shutdown();
                LOG.debug("Subscriber {} unsubscribed", threadName);
            }
        }
    }
}
