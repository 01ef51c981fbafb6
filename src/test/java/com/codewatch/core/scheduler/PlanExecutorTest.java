package com.codewatch.core.scheduler;

import com.codewatch.core.engine.CancellationToken;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.StepStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PlanExecutorTest {

    private ExecutorService pool;
    private List<String> dispatched;
    private Map<String, Set<String>> failedDepsSeen;
    private List<Batch> batches;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        dispatched = new CopyOnWriteArrayList<>();
        failedDepsSeen = new ConcurrentHashMap<>();
        batches = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static Plan fanInPlan() {
        return new Plan("plan-1", List.of(
                new PlanStep("s1", "security", Set.of(), true),
                new PlanStep("s2", "bug", Set.of(), true),
                new PlanStep("s3", "verify", Set.of("s1", "s2"), false)));
    }

    private StepDispatcher dispatcher(Set<String> failing) {
        return (step, failedDeps) -> {
            dispatched.add(step.stepId());
            failedDepsSeen.put(step.stepId(), failedDeps);
            return CompletableFuture.supplyAsync(() -> failing.contains(step.stepId())
                    ? StepOutcome.failed(step.stepId(), step.capabilityId(), "internal: boom", 1, 0, failedDeps)
                    : StepOutcome.completed(step.stepId(), step.capabilityId(),
                            CapabilityResult.empty("ok"), 1, 0, failedDeps), pool);
        };
    }

    private BatchListener recordBatches() {
        return (batch, outcomes) -> batches.add(batch);
    }

    // -- Ordering -----------------------------------------------------------

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("parallel steps run in one batch before their dependent")
        void fanInRunsInTwoBatches() {
            var executor = new PlanExecutor(fanInPlan(), id -> true);

            Map<String, StepOutcome> outcomes = executor.execute(dispatcher(Set.of()), recordBatches(),
                    CancellationToken.none());

            assertEquals(2, batches.size());
            assertEquals(List.of("s1", "s2"), batches.get(0).stepIds());
            assertTrue(batches.get(0).parallel());
            assertEquals(List.of("s3"), batches.get(1).stepIds());
            assertEquals(List.of("s1", "s2", "s3"), new ArrayList<>(outcomes.keySet()));
            assertTrue(executor.isDone());
            assertEquals(2, executor.batchCount());
        }

        @Test
        @DisplayName("a failed dependency still releases its dependent with the failure flagged")
        void failedDependencyReleasesDependent() {
            var executor = new PlanExecutor(fanInPlan(), id -> true);

            Map<String, StepOutcome> outcomes = executor.execute(dispatcher(Set.of("s1")), recordBatches(),
                    CancellationToken.none());

            assertEquals(StepStatus.FAILED, outcomes.get("s1").status());
            assertEquals(StepStatus.COMPLETED, outcomes.get("s2").status());
            assertEquals(StepStatus.COMPLETED, outcomes.get("s3").status());
            assertEquals(Set.of("s1"), failedDepsSeen.get("s3"));
            assertTrue(outcomes.get("s3").upstreamFailed());
        }

        @Test
        @DisplayName("every step is dispatched exactly once")
        void eachStepDispatchedOnce() {
            var plan = new Plan("plan-2", List.of(
                    new PlanStep("a", "x", Set.of(), true),
                    new PlanStep("b", "x", Set.of("a"), true),
                    new PlanStep("c", "x", Set.of("a"), true),
                    new PlanStep("d", "x", Set.of("b", "c"), false),
                    new PlanStep("e", "x", Set.of(), false)));
            var executor = new PlanExecutor(plan, id -> true);

            executor.execute(dispatcher(Set.of("b")), recordBatches(), CancellationToken.none());

            assertEquals(5, dispatched.size());
            assertEquals(5, Set.copyOf(dispatched).size());
            assertTrue(dispatched.indexOf("a") < dispatched.indexOf("b"));
            assertTrue(dispatched.indexOf("c") < dispatched.indexOf("d"));
        }

        @Test
        @DisplayName("parallel steps of one batch are in flight together")
        void parallelStepsOverlap() throws Exception {
            var bothStarted = new CountDownLatch(2);
            var concurrent = new AtomicInteger();
            var maxConcurrent = new AtomicInteger();
            StepDispatcher overlapping = (step, failedDeps) -> CompletableFuture.supplyAsync(() -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                bothStarted.countDown();
                try {
                    bothStarted.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                concurrent.decrementAndGet();
                return StepOutcome.completed(step.stepId(), step.capabilityId(),
                        CapabilityResult.empty("ok"), 1, 0, failedDeps);
            }, pool);
            var executor = new PlanExecutor(fanInPlan(), id -> true);

            executor.execute(overlapping, recordBatches(), CancellationToken.none());

            assertEquals(2, maxConcurrent.get());
        }

        @Test
        @DisplayName("a dispatcher that throws fails only that step")
        void throwingDispatcherFailsStep() {
            var executor = new PlanExecutor(fanInPlan(), id -> true);
            StepDispatcher dispatcher = (step, failedDeps) -> {
                if (step.stepId().equals("s2")) {
                    throw new IllegalStateException("pool gone");
                }
                return CompletableFuture.completedFuture(StepOutcome.completed(step.stepId(),
                        step.capabilityId(), CapabilityResult.empty("ok"), 1, 0, failedDeps));
            };

            Map<String, StepOutcome> outcomes = executor.execute(dispatcher, recordBatches(),
                    CancellationToken.none());

            assertEquals(StepStatus.FAILED, outcomes.get("s2").status());
            assertTrue(outcomes.get("s2").error().contains("pool gone"));
            assertEquals(StepStatus.COMPLETED, outcomes.get("s3").status());
        }
    }

    // -- Lifecycle ----------------------------------------------------------

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("an invalid plan is rejected at construction")
        void invalidPlanRejected() {
            var plan = new Plan("p", List.of(new PlanStep("s1", "x", Set.of("s1"), true)));

            assertThrows(PlanException.class, () -> new PlanExecutor(plan, id -> true));
        }

        @Test
        @DisplayName("a plan executes only once")
        void executesOnce() {
            var executor = new PlanExecutor(fanInPlan(), id -> true);
            executor.execute(dispatcher(Set.of()), recordBatches(), CancellationToken.none());

            assertThrows(IllegalStateException.class,
                    () -> executor.execute(dispatcher(Set.of()), recordBatches(), CancellationToken.none()));
        }

        @Test
        @DisplayName("cancellation resolves undispatched steps as cancelled")
        void cancellationResolvesPendingSteps() {
            var token = new CancellationToken();
            var executor = new PlanExecutor(fanInPlan(), id -> true);
            BatchListener cancelAfterFirst = (batch, outcomes) -> {
                batches.add(batch);
                token.cancel();
            };

            Map<String, StepOutcome> outcomes = executor.execute(dispatcher(Set.of()), cancelAfterFirst, token);

            assertEquals(1, batches.size());
            assertFalse(dispatched.contains("s3"));
            StepOutcome s3 = outcomes.get("s3");
            assertEquals(StepStatus.FAILED, s3.status());
            assertEquals("cancelled", s3.error());
            assertTrue(s3.cancelled());
            assertEquals(0, s3.attempts());
            assertTrue(executor.isDone());
        }

        @Test
        @DisplayName("statuses start pending")
        void statusesStartPending() {
            var executor = new PlanExecutor(fanInPlan(), id -> true);

            assertEquals(StepStatus.PENDING, executor.status("s1"));
            assertEquals(3, executor.snapshot().size());
            assertFalse(executor.isDone());
        }
    }
}
