package com.codewatch.core.engine;

import com.codewatch.Samples;
import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityRegistry;
import com.codewatch.core.capability.ErrorKind;
import com.codewatch.core.capability.ScriptedCapability;
import com.codewatch.core.capability.builtin.BugCapability;
import com.codewatch.core.capability.builtin.FixVerificationCapability;
import com.codewatch.core.capability.builtin.SecurityCapability;
import com.codewatch.core.consolidation.FindingConsolidator;
import com.codewatch.core.events.EventBus;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.events.ReviewEvent;
import com.codewatch.core.metrics.CodewatchMetrics;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.Location;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.PlanStep;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.ReviewReport;
import com.codewatch.core.model.ReviewStatus;
import com.codewatch.core.model.Severity;
import com.codewatch.core.model.StepResult;
import com.codewatch.core.model.StepStatus;
import com.codewatch.core.model.VerificationStatus;
import com.codewatch.core.plan.PlanFactory;
import com.codewatch.core.retry.RetryPolicy;
import com.codewatch.core.retry.RetrySupervisor;
import com.codewatch.core.scheduler.PlanException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.codewatch.core.capability.ScriptedCapability.fails;
import static com.codewatch.core.capability.ScriptedCapability.finds;
import static org.junit.jupiter.api.Assertions.*;

class ReviewCoordinatorTest {

    private static final String REVIEW_ID = "REV-1";

    private ExecutorService stepPool;
    private ExecutorService invocations;
    private SimpleMeterRegistry registry;
    private EventBus bus;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        stepPool = Executors.newFixedThreadPool(3);
        invocations = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        bus = new EventBus(REVIEW_ID);
        token = new CancellationToken();
    }

    @AfterEach
    void tearDown() {
        bus.close();
        stepPool.shutdownNow();
        invocations.shutdownNow();
    }

    private ReviewCoordinator coordinator(Capability... capabilities) {
        var capabilityRegistry = new CapabilityRegistry(List.of(capabilities));
        var metrics = new CodewatchMetrics(registry);
        var supervisor = new RetrySupervisor(new RetryPolicy(3, Duration.ZERO, Duration.ZERO),
                Duration.ofSeconds(5), invocations, (delay, cancellation) -> cancellation.isCancelled(), metrics);
        return new ReviewCoordinator(capabilityRegistry, new PlanFactory(capabilityRegistry),
                new FindingConsolidator(0.5), supervisor, stepPool, metrics);
    }

    private ReviewCoordinator builtin() {
        return coordinator(new SecurityCapability(), new BugCapability(), new FixVerificationCapability());
    }

    private static ReviewInput sample() {
        return new ReviewInput(Samples.vulnerable(), "app.py");
    }

    private List<String> eventTypes() {
        return bus.history().stream().map(ReviewEvent::eventType).toList();
    }

    private StepResult step(ReviewReport report, String stepId) {
        return report.stepResults().stream().filter(r -> r.stepId().equals(stepId)).findFirst().orElseThrow();
    }

    // -- Full review --------------------------------------------------------

    @Nested
    @DisplayName("full review")
    class FullReviewTests {

        @Test
        @DisplayName("reports every finding, ordered by severity, with verified fixes")
        void completedReview() {
            ReviewReport report = builtin().review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.COMPLETED, report.status());
            assertEquals("plan-REV-1", report.planId());
            assertEquals(8, report.findings().size());
            assertEquals(Severity.CRITICAL, report.findings().get(0).severity());
            assertEquals(6, report.findings().get(0).location().lineStart());
            assertEquals(Severity.LOW, report.findings().get(7).severity());
            assertEquals(6, report.fixes().size());
            assertTrue(report.fixes().stream().allMatch(f -> f.verificationStatus() == VerificationStatus.VERIFIED));
            assertEquals(6, report.metrics().fixesVerified());
            assertEquals(3, report.metrics().stepsCompleted());
            assertEquals(0, report.metrics().stepsFailed());
            assertEquals("Found 8 issue(s) (2 critical, 1 high, 4 medium, 1 low); 3/3 steps completed",
                    report.summary());
            assertTrue(report.errors().isEmpty());
            assertFalse(report.cancelled());
        }

        @Test
        @DisplayName("events frame the review and each step")
        void eventOrder() {
            builtin().review(REVIEW_ID, sample(), bus, token);

            List<ReviewEvent> events = bus.history();
            List<String> types = eventTypes();
            assertEquals(EventTypes.REVIEW_STARTED, types.get(0));
            assertEquals(EventTypes.PLAN_CREATED, types.get(1));
            assertEquals(EventTypes.FINAL_REPORT, types.get(types.size() - 2));
            assertEquals(EventTypes.REVIEW_COMPLETED, types.get(types.size() - 1));
            assertEquals(2, types.stream().filter(EventTypes.FINDINGS_CONSOLIDATED::equals).count());

            for (String stepId : List.of("step-1-security", "step-2-bug", "step-3-verify")) {
                int started = -1;
                int completed = -1;
                for (int i = 0; i < events.size(); i++) {
                    ReviewEvent e = events.get(i);
                    if (!stepId.equals(e.stepId())) {
                        continue;
                    }
                    if (EventTypes.PLAN_STEP_STARTED.equals(e.eventType())) {
                        started = i;
                    } else if (EventTypes.PLAN_STEP_COMPLETED.equals(e.eventType())) {
                        completed = i;
                    } else {
                        assertTrue(started >= 0 && i > started, e.eventType() + " before start of " + stepId);
                        assertEquals(-1, completed, e.eventType() + " after completion of " + stepId);
                    }
                }
                assertTrue(started >= 0 && completed > started, stepId);
            }
        }

        @Test
        @DisplayName("the verification step starts only after both analysis steps completed")
        void verificationAfterAnalysis() {
            builtin().review(REVIEW_ID, sample(), bus, token);

            List<ReviewEvent> events = bus.history();
            int verifyStarted = indexOf(events, EventTypes.PLAN_STEP_STARTED, "step-3-verify");
            assertTrue(indexOf(events, EventTypes.PLAN_STEP_COMPLETED, "step-1-security") < verifyStarted);
            assertTrue(indexOf(events, EventTypes.PLAN_STEP_COMPLETED, "step-2-bug") < verifyStarted);
        }

        @Test
        @DisplayName("sequence numbers increase per source")
        void sequencesPerSource() {
            builtin().review(REVIEW_ID, sample(), bus, token);

            var last = new java.util.HashMap<String, Long>();
            for (ReviewEvent e : bus.history()) {
                Long previous = last.put(e.sourceId(), e.sequence());
                assertTrue(previous == null || e.sequence() > previous, e.sourceId());
            }
            assertEquals(1L, bus.history().get(0).sequence());
        }

        @Test
        @DisplayName("records review and step metrics")
        void recordsMetrics() {
            builtin().review(REVIEW_ID, sample(), bus, token);

            assertEquals(1.0, registry.find("codewatch.reviews.total").tag("status", "completed").counter().count());
            assertEquals(1L, registry.find("codewatch.step.duration")
                    .tag("capability", "security").tag("result", "completed").timer().count());
        }
    }

    // -- Consolidation --------------------------------------------------------

    @Nested
    @DisplayName("consolidation")
    class ConsolidationTests {

        @Test
        @DisplayName("duplicate findings from two capabilities are merged")
        void duplicatesMerged() {
            ReviewReport report = coordinator(
                    ScriptedCapability.analysis("a", finds("sql_injection", 3, 0.7)),
                    ScriptedCapability.analysis("b", finds("sql_injection", 3, 0.9)))
                    .review(REVIEW_ID, sample(), bus, token);

            assertEquals(1, report.findings().size());
            assertEquals("b_agent", report.findings().get(0).sourceId());
            assertEquals(1, report.findings().get(0).mergedFindingIds().size());
            assertEquals(1, report.metrics().duplicatesRemoved());
        }

        @Test
        @DisplayName("a fix for an unknown finding is rejected and reported")
        void danglingFixRejected() {
            var capability = ScriptedCapability.analysis("a", (input, ctx, sink) -> CapabilityResult.of(List.of(),
                    List.of(Fix.proposed("F-missing", sink.sourceId(), "old", "new", "why", 0.5)), "one fix"));

            ReviewReport report = coordinator(capability).review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.COMPLETED, report.status());
            assertTrue(report.fixes().isEmpty());
            assertEquals(1, report.rejectedFixes().size());
            assertEquals("step-1-a", report.rejectedFixes().get(0).stepId());
            assertTrue(eventTypes().contains(EventTypes.FIX_REJECTED));
        }
    }

    // -- Failures -------------------------------------------------------------

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("one failed capability gives a partial report")
        void partialReview() {
            ReviewReport report = coordinator(new SecurityCapability(),
                    ScriptedCapability.analysis("bug", fails(ErrorKind.MALFORMED_INPUT)),
                    new FixVerificationCapability())
                    .review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.PARTIAL, report.status());
            assertEquals(3, report.findings().size());
            StepResult bug = step(report, "step-2-bug");
            assertEquals(StepStatus.FAILED, bug.status());
            assertEquals(1, bug.attempts());
            StepResult verify = step(report, "step-3-verify");
            assertEquals(StepStatus.COMPLETED, verify.status());
            assertTrue(verify.upstreamFailed());
            assertEquals(3, report.metrics().fixesVerified());
            assertEquals(List.of("step-2-bug: malformed_input: malformed_input failure"), report.errors());

            ReviewEvent error = bus.history().stream()
                    .filter(e -> EventTypes.AGENT_ERROR.equals(e.eventType())).findFirst().orElseThrow();
            assertEquals("malformed_input", error.get("error_type"));
            assertEquals(Boolean.FALSE, error.get("recoverable"));
        }

        @Test
        @DisplayName("a step returning a finding without a file fails alone and the report is still produced")
        void findingWithoutFile() {
            var broken = ScriptedCapability.analysis("a", (input, ctx, sink) -> {
                Finding good = ScriptedCapability.finding(ctx, sink.sourceId(), "sql_injection", 5, 5, 0.9);
                Finding noFile = new Finding(good.findingId() + "-2", good.stepId(), good.sourceId(),
                        good.category(), good.severity(), "command_injection", good.title(),
                        good.description(), new Location(null, 1, 1, "x"), 0.8, List.of());
                return CapabilityResult.of(List.of(noFile, good), List.of(), "2 findings");
            });

            ReviewReport report = coordinator(broken, ScriptedCapability.analysis("b", finds("eval_usage", 7, 0.7)))
                    .review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.PARTIAL, report.status());
            assertEquals(StepStatus.FAILED, step(report, "step-1-a").status());
            assertEquals(1, step(report, "step-1-a").attempts());
            assertEquals(1, report.findings().size());
            assertEquals("app.py", report.findings().get(0).location().file());
            List<String> types = eventTypes();
            assertTrue(types.contains(EventTypes.FINAL_REPORT));
            assertEquals(EventTypes.REVIEW_COMPLETED, types.get(types.size() - 1));
        }

        @Test
        @DisplayName("a fix proposed as already verified fails its step and is never reported")
        void preVerifiedFix() {
            var capability = ScriptedCapability.analysis("a", (input, ctx, sink) -> {
                Finding finding = ScriptedCapability.finding(ctx, sink.sourceId(), "sql_injection", 5, 5, 0.9);
                Fix fix = new Fix("X-1", finding.findingId(), sink.sourceId(), "old", "new", "why", 0.9,
                        VerificationStatus.VERIFIED);
                return CapabilityResult.of(List.of(finding), List.of(fix), "1 finding");
            });

            ReviewReport report = coordinator(capability, ScriptedCapability.analysis("b", finds("eval_usage", 7, 0.7)))
                    .review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.PARTIAL, report.status());
            assertTrue(report.fixes().isEmpty());
            assertEquals(0, report.metrics().fixesVerified());
        }

        @Test
        @DisplayName("a recoverable failure is retried within the step")
        void retriedStep() {
            ReviewReport report = coordinator(
                    ScriptedCapability.analysis("a", fails(ErrorKind.TIMEOUT), finds("sql_injection", 3, 0.9)))
                    .review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.COMPLETED, report.status());
            assertEquals(2, step(report, "step-1-a").attempts());
            assertEquals(1, eventTypes().stream().filter(EventTypes.AGENT_RETRY::equals).count());
            assertEquals(1, report.findings().size());
        }

        @Test
        @DisplayName("when every step fails the report is failed and empty")
        void allFailed() {
            ReviewReport report = coordinator(
                    ScriptedCapability.analysis("a", fails(ErrorKind.INTERNAL)),
                    ScriptedCapability.analysis("b", fails(ErrorKind.TRANSIENT_IO)))
                    .review(REVIEW_ID, sample(), bus, token);

            assertEquals(ReviewStatus.FAILED, report.status());
            assertTrue(report.findings().isEmpty());
            assertTrue(report.fixes().isEmpty());
            assertEquals(2, report.errors().size());
            assertEquals("Review failed: all 2 steps failed", report.summary());
            assertEquals(3, step(report, "step-2-b").attempts());

            ReviewEvent completed = bus.history().get(bus.history().size() - 1);
            assertEquals(EventTypes.REVIEW_COMPLETED, completed.eventType());
            assertEquals("failed", completed.get("status"));
        }

        @Test
        @DisplayName("an explicit plan naming an unknown capability is rejected")
        void invalidExplicitPlan() {
            var plan = new Plan("plan-x", List.of(new PlanStep("s1", "style", Set.of(), true)));

            var error = assertThrows(PlanException.class,
                    () -> builtin().review(REVIEW_ID, sample(), plan, bus, token));

            assertEquals(PlanException.Reason.UNKNOWN_CAPABILITY, error.reason());
            List<String> types = eventTypes();
            assertTrue(types.contains(EventTypes.AGENT_ERROR));
            assertEquals(EventTypes.REVIEW_COMPLETED, types.get(types.size() - 1));
        }

        @Test
        @DisplayName("an explicit plan runs as given")
        void explicitPlan() {
            var plan = new Plan("plan-custom", List.of(
                    new PlanStep("scan", "security", Set.of(), false),
                    new PlanStep("check", "verify", Set.of("scan"), false)));

            ReviewReport report = builtin().review(REVIEW_ID, sample(), plan, bus, token);

            assertEquals("plan-custom", report.planId());
            assertEquals(List.of("scan", "check"), report.stepResults().stream().map(StepResult::stepId).toList());
            assertEquals(3, report.findings().size());
        }
    }

    // -- Cancellation -------------------------------------------------------

    @Test
    @DisplayName("cancellation stops running steps and skips pending ones")
    void cancellation() throws Exception {
        var started = new CountDownLatch(1);
        var blocking = ScriptedCapability.analysis("slow", (input, ctx, sink) -> {
            started.countDown();
            ctx.cancellation().await(Duration.ofSeconds(10));
            return CapabilityResult.empty("woke up");
        });
        ReviewCoordinator coordinator = coordinator(blocking, new FixVerificationCapability());

        CompletableFuture<ReviewReport> review = CompletableFuture.supplyAsync(
                () -> coordinator.review(REVIEW_ID, sample(), bus, token));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        token.cancel();
        ReviewReport report = review.get(5, TimeUnit.SECONDS);

        assertTrue(report.cancelled());
        assertEquals(ReviewStatus.FAILED, report.status());
        StepResult verify = step(report, "step-2-verify");
        assertEquals(StepStatus.FAILED, verify.status());
        assertEquals("cancelled", verify.error());
        assertEquals(0, verify.attempts());
        assertEquals(1, blocking.invocations());
        assertTrue(bus.history().stream().noneMatch(e -> EventTypes.PLAN_STEP_STARTED.equals(e.eventType())
                && "step-2-verify".equals(e.stepId())));
    }

    private static int indexOf(List<ReviewEvent> events, String type, String stepId) {
        for (int i = 0; i < events.size(); i++) {
            if (type.equals(events.get(i).eventType()) && stepId.equals(events.get(i).stepId())) {
                return i;
            }
        }
        return -1;
    }
}
