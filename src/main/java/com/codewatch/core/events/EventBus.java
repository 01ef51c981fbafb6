package com.codewatch.core.events;

import com.codewatch.core.metrics.CodewatchMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for one review.
 * <p>
 * Every subscriber owns a bounded queue drained by its own delivery task, so publishing
 * never waits on a subscriber. A subscriber whose queue is full, or whose callback throws,
 * is dropped and the drop is logged. Events of one source reach every subscriber in
 * publication order; a bounded history lets late subscribers replay what they missed.
 * Thread-safe for concurrent publish and subscribe operations.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_SIZE = 1000;
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private static final Object COMPLETE = new Object();
    private static final Object STOP = new Object();
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static volatile ExecutorService defaultDelivery;

    private final String reviewId;
    private final int historySize;
    private final int queueCapacity;
    private final ExecutorService deliveryExecutor;
    private final CodewatchMetrics metrics;

    private final Object lock = new Object();
    private final ArrayDeque<ReviewEvent> history = new ArrayDeque<>();
    private final Map<String, Long> lastSequenceBySource = new HashMap<>();
    private final CopyOnWriteArrayList<SubscriberHandle> subscribers = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, EventEmitter> emitters = new ConcurrentHashMap<>();
    private boolean closed;

    public EventBus(String reviewId) {
        this(reviewId, DEFAULT_HISTORY_SIZE, DEFAULT_QUEUE_CAPACITY, sharedDeliveryExecutor(), null);
    }

    public EventBus(String reviewId, int historySize, int queueCapacity,
                    ExecutorService deliveryExecutor, CodewatchMetrics metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.reviewId = reviewId;
        this.historySize = Math.max(0, historySize);
        this.queueCapacity = queueCapacity;
        this.deliveryExecutor = deliveryExecutor;
        this.metrics = metrics;
    }

    public String reviewId() {
        return reviewId;
    }

    /**
     * Returns the one emitter for a source. Sequences are allocated there.
     */
    public EventEmitter emitter(String sourceId) {
        return emitters.computeIfAbsent(sourceId, id -> new EventEmitter(this, id));
    }

    /**
     * Publish an event to every registered subscriber.
     * <p>
     * Never blocks on a subscriber and never fails because of one.
     *
     * @throws IllegalArgumentException if the sequence does not increase for the event's source
     */
    public void publish(ReviewEvent event) {
        synchronized (lock) {
            if (closed) {
                log.debug("Review {} bus closed, discarding {} from {}",
                        reviewId, event.eventType(), event.sourceId());
                return;
            }
            Long last = lastSequenceBySource.get(event.sourceId());
            if (last != null && event.sequence() <= last) {
                throw new IllegalArgumentException("Out-of-order sequence " + event.sequence()
                        + " for source " + event.sourceId() + " (last " + last + ")");
            }
            lastSequenceBySource.put(event.sourceId(), event.sequence());

            log.debug("Publishing event: {} #{} from {} for review {}",
                    event.eventType(), event.sequence(), event.sourceId(), reviewId);

            if (historySize > 0) {
                history.addLast(event);
                while (history.size() > historySize) {
                    history.removeFirst();
                }
            }

            for (SubscriberHandle subscriber : subscribers) {
                if (!subscriber.offer(event)) {
                    dropLocked(subscriber, "queue full (" + queueCapacity + " events)");
                }
            }
        }
    }

    /**
     * Subscribe to events published from now on.
     *
     * @param consumer callback invoked for each event, on the subscriber's delivery thread
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<ReviewEvent> consumer) {
        return subscribe(consumer, false, null);
    }

    /**
     * Subscribe, optionally replaying the retained history first.
     *
     * @param consumer callback invoked for each event
     * @param replay   whether to deliver the retained history before live events
     * @param onClose  invoked once when delivery ends for any reason (nullable)
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(Consumer<ReviewEvent> consumer, boolean replay, Runnable onClose) {
        var handle = new SubscriberHandle(consumer, onClose);
        synchronized (lock) {
            if (replay) {
                int skip = Math.max(0, history.size() - queueCapacity);
                int index = 0;
                for (ReviewEvent event : history) {
                    if (index++ >= skip) {
                        handle.offer(event);
                    }
                }
            }
            if (closed) {
                handle.queue.add(COMPLETE);
            } else {
                subscribers.add(handle);
            }
        }
        try {
            deliveryExecutor.execute(handle::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected subscriber for review {}: {}", reviewId, e.getMessage());
            synchronized (lock) {
                subscribers.remove(handle);
            }
            handle.finish();
        }
        log.debug("Subscribed to review {} (replay={}, subscribers={})", reviewId, replay, subscribers.size());
        return handle;
    }

    /**
     * Returns the retained history, oldest first.
     */
    public List<ReviewEvent> history() {
        synchronized (lock) {
            return new ArrayList<>(history);
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * Ends the review's stream. Subscribers receive what is already queued and then complete.
     * Later publishes are discarded; later subscribers get the history replay and complete.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            for (SubscriberHandle subscriber : subscribers) {
                subscriber.queue.add(COMPLETE);
            }
            subscribers.clear();
        }
        log.debug("Closed event bus for review {}", reviewId);
    }

    private void dropLocked(SubscriberHandle subscriber, String reason) {
        if (!subscribers.remove(subscriber)) {
            return;
        }
        subscriber.queue.clear();
        subscriber.queue.add(STOP);
        log.warn("Removed subscriber from review {}: {}", reviewId, reason);
        if (metrics != null) {
            metrics.recordSubscriberDropped(reason.startsWith("queue full") ? "queue_full" : "error");
        }
    }

    private static ExecutorService sharedDeliveryExecutor() {
        ExecutorService executor = defaultDelivery;
        if (executor == null) {
            synchronized (EventBus.class) {
                executor = defaultDelivery;
                if (executor == null) {
                    executor = newDeliveryExecutor();
                    defaultDelivery = executor;
                }
            }
        }
        return executor;
    }

    /**
     * Creates a pool for subscriber delivery tasks; each live subscriber holds one thread.
     */
    public static ExecutorService newDeliveryExecutor() {
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "codewatch-events-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Handle for cancelling a subscription.
     */
    public interface Subscription {

        /** Stops delivery. Calling it more than once has no effect. */
        void unsubscribe();

        /** Whether events are still being delivered. */
        boolean isActive();

        /**
         * Waits until delivery has ended (completed, dropped or unsubscribed).
         *
         * @return {@code true} if delivery ended within the timeout
         */
        boolean awaitTermination(Duration timeout) throws InterruptedException;
    }

    private final class SubscriberHandle implements Subscription {
        // One slot beyond capacity is kept free for the terminal marker
        private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>(queueCapacity + 1);
        private final Consumer<ReviewEvent> consumer;
        private final Runnable onClose;
        private final CountDownLatch terminated = new CountDownLatch(1);
        private volatile boolean active = true;

        private SubscriberHandle(Consumer<ReviewEvent> consumer, Runnable onClose) {
            this.consumer = consumer;
            this.onClose = onClose;
        }

        private boolean offer(ReviewEvent event) {
            if (queue.size() >= queueCapacity) {
                return false;
            }
            return queue.offer(event);
        }

        private void drain() {
            try {
                while (true) {
                    Object item = queue.take();
                    if (item == COMPLETE || item == STOP) {
                        return;
                    }
                    if (!active) {
                        return;
                    }
                    ReviewEvent event = (ReviewEvent) item;
                    try {
                        consumer.accept(event);
                    } catch (RuntimeException e) {
                        log.warn("Subscriber threw processing event {} #{} from {}: {}",
                                event.eventType(), event.sequence(), event.sourceId(), e.getMessage(), e);
                        synchronized (lock) {
                            dropLocked(this, "subscriber error: " + e.getMessage());
                        }
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                finish();
            }
        }

        private void finish() {
            active = false;
            if (terminated.getCount() > 0) {
                terminated.countDown();
                if (onClose != null) {
                    try {
                        onClose.run();
                    } catch (RuntimeException e) {
                        log.warn("Subscription close callback failed for review {}: {}", reviewId, e.getMessage());
                    }
                }
            }
        }

        @Override
        public void unsubscribe() {
            synchronized (lock) {
                if (!active) {
                    return;
                }
                active = false;
                subscribers.remove(this);
                queue.clear();
                queue.add(STOP);
            }
            log.debug("Unsubscribed from review {}", reviewId);
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public boolean awaitTermination(Duration timeout) throws InterruptedException {
            return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
