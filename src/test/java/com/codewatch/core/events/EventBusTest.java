package com.codewatch.core.events;

import com.codewatch.core.metrics.CodewatchMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ExecutorService delivery;
    private SimpleMeterRegistry registry;
    private EventBus bus;

    @BeforeEach
    void setUp() {
        delivery = EventBus.newDeliveryExecutor();
        registry = new SimpleMeterRegistry();
        bus = new EventBus("REV-1", 100, 1024, delivery, new CodewatchMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        bus.close();
        delivery.shutdownNow();
    }

    // -- Emitters and sequencing -------------------------------------------

    @Nested
    @DisplayName("emitters")
    class EmitterTests {

        @Test
        @DisplayName("sequence numbers start at 1 per source")
        void sequencesStartAtOnePerSource() {
            var a = bus.emitter("agent_a");
            var b = bus.emitter("agent_b");

            assertEquals(1, a.emit("thinking", Map.of()).sequence());
            assertEquals(2, a.emit("thinking", Map.of()).sequence());
            assertEquals(1, b.emit("thinking", Map.of()).sequence());
        }

        @Test
        @DisplayName("one emitter per source")
        void oneEmitterPerSource() {
            assertSame(bus.emitter("agent_a"), bus.emitter("agent_a"));
        }

        @Test
        @DisplayName("step sink stamps step id and source")
        void stepSinkStampsStepId() {
            EventSink sink = bus.emitter("agent_a").forStep("step-1");

            ReviewEvent event = sink.emit("finding_discovered", Map.of("line", 3));

            assertEquals("step-1", event.stepId());
            assertEquals("agent_a", event.sourceId());
            assertEquals("REV-1", event.reviewId());
            assertEquals(Integer.valueOf(3), event.get("line"));
        }

        @Test
        @DisplayName("concurrent emits from one source arrive in sequence order")
        void concurrentEmitsArriveInOrder() throws Exception {
            List<Long> sequences = new CopyOnWriteArrayList<>();
            EventBus.Subscription subscription = bus.subscribe(e -> sequences.add(e.sequence()));
            var emitter = bus.emitter("agent_a");

            var threads = new ArrayList<Thread>();
            for (int t = 0; t < 8; t++) {
                var thread = new Thread(() -> {
                    for (int i = 0; i < 100; i++) {
                        emitter.emit("thinking", Map.of());
                    }
                });
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }
            bus.close();
            assertTrue(subscription.awaitTermination(WAIT));

            assertEquals(800, sequences.size());
            for (int i = 1; i < sequences.size(); i++) {
                assertTrue(sequences.get(i) > sequences.get(i - 1), "sequence must increase at index " + i);
            }
        }
    }

    // -- Publish ------------------------------------------------------------

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("rejects a sequence that does not increase for its source")
        void rejectsOutOfOrderSequence() {
            bus.publish(new ReviewEvent("thinking", "agent_a", 2, Instant.now(), Map.of(), "REV-1", null));

            assertThrows(IllegalArgumentException.class, () -> bus.publish(
                    new ReviewEvent("thinking", "agent_a", 2, Instant.now(), Map.of(), "REV-1", null)));
            assertDoesNotThrow(() -> bus.publish(
                    new ReviewEvent("thinking", "agent_b", 1, Instant.now(), Map.of(), "REV-1", null)));
        }

        @Test
        @DisplayName("publish after close is discarded")
        void publishAfterCloseDiscarded() {
            bus.emitter("agent_a").emit("thinking", Map.of());
            bus.close();

            bus.emitter("agent_a").emit("thinking", Map.of());

            assertEquals(1, bus.history().size());
            assertTrue(bus.isClosed());
        }

        @Test
        @DisplayName("history keeps only the most recent events")
        void historyIsBounded() {
            var small = new EventBus("REV-2", 3, 16, delivery, null);
            var emitter = small.emitter("agent_a");
            for (int i = 0; i < 5; i++) {
                emitter.emit("thinking", Map.of());
            }

            List<ReviewEvent> history = small.history();
            assertEquals(3, history.size());
            assertEquals(3, history.get(0).sequence());
            small.close();
        }
    }

    // -- Subscriptions ------------------------------------------------------

    @Nested
    @DisplayName("subscriptions")
    class SubscriptionTests {

        @Test
        @DisplayName("delivers events in order and completes on close")
        void deliversAndCompletes() throws Exception {
            List<String> received = new CopyOnWriteArrayList<>();
            var closed = new CountDownLatch(1);
            EventBus.Subscription subscription = bus.subscribe(e -> received.add(e.eventType()), false, closed::countDown);

            var emitter = bus.emitter("coordinator");
            emitter.emit("plan_created", Map.of());
            emitter.emit("plan_step_started", Map.of());
            bus.close();

            assertTrue(closed.await(5, TimeUnit.SECONDS));
            assertTrue(subscription.awaitTermination(WAIT));
            assertFalse(subscription.isActive());
            assertEquals(List.of("plan_created", "plan_step_started"), received);
        }

        @Test
        @DisplayName("late subscriber with replay sees history first")
        void lateSubscriberReplaysHistory() throws Exception {
            var emitter = bus.emitter("coordinator");
            emitter.emit("review_started", Map.of());
            emitter.emit("plan_created", Map.of());

            List<String> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription subscription = bus.subscribe(e -> received.add(e.eventType()), true, null);
            emitter.emit("plan_step_started", Map.of());
            bus.close();

            assertTrue(subscription.awaitTermination(WAIT));
            assertEquals(List.of("review_started", "plan_created", "plan_step_started"), received);
        }

        @Test
        @DisplayName("subscribing to a closed bus replays history and completes")
        void subscribeAfterClose() throws Exception {
            bus.emitter("system").emit("review_started", Map.of());
            bus.close();

            List<String> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription subscription = bus.subscribe(e -> received.add(e.eventType()), true, null);

            assertTrue(subscription.awaitTermination(WAIT));
            assertEquals(List.of("review_started"), received);
        }

        @Test
        @DisplayName("unsubscribe stops delivery and is idempotent")
        void unsubscribeIsIdempotent() throws Exception {
            var count = new AtomicInteger();
            EventBus.Subscription subscription = bus.subscribe(e -> count.incrementAndGet());

            subscription.unsubscribe();
            subscription.unsubscribe();
            assertTrue(subscription.awaitTermination(WAIT));

            bus.emitter("agent_a").emit("thinking", Map.of());
            assertEquals(0, count.get());
            assertEquals(0, bus.subscriberCount());
        }

        @Test
        @DisplayName("a throwing subscriber is dropped without affecting others")
        void throwingSubscriberDropped() throws Exception {
            EventBus.Subscription bad = bus.subscribe(e -> {
                throw new IllegalStateException("boom");
            });
            List<ReviewEvent> received = new CopyOnWriteArrayList<>();
            EventBus.Subscription good = bus.subscribe(received::add);

            var emitter = bus.emitter("agent_a");
            emitter.emit("thinking", Map.of());
            assertTrue(bad.awaitTermination(WAIT));
            emitter.emit("thinking", Map.of());
            bus.close();

            assertTrue(good.awaitTermination(WAIT));
            assertEquals(2, received.size());
            assertEquals(1.0, registry.find("codewatch.events.subscribers_dropped")
                    .tag("reason", "error").counter().count());
        }

        @Test
        @DisplayName("a subscriber that falls behind is dropped while the publisher continues")
        void slowSubscriberDropped() throws Exception {
            var small = new EventBus("REV-3", 10, 2, delivery, new CodewatchMetrics(registry));
            var release = new CountDownLatch(1);
            EventBus.Subscription slow = small.subscribe(e -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            });
            List<ReviewEvent> fast = new CopyOnWriteArrayList<>();
            EventBus.Subscription quick = small.subscribe(fast::add);

            var emitter = small.emitter("agent_a");
            for (int i = 0; i < 5; i++) {
                emitter.emit("thinking", Map.of());
                Thread.sleep(20);
            }
            release.countDown();

            assertTrue(slow.awaitTermination(WAIT));
            assertFalse(slow.isActive());
            small.close();
            assertTrue(quick.awaitTermination(WAIT));
            assertEquals(5, fast.size());
            assertEquals(1.0, registry.find("codewatch.events.subscribers_dropped")
                    .tag("reason", "queue_full").counter().count());
        }
    }
}
