package com.codewatch.core.capability.builtin;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityContext;
import com.codewatch.core.capability.CapabilityRole;
import com.codewatch.core.events.EventSink;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.FixVerification;
import com.codewatch.core.model.ReviewInput;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statically checks every pending fix against the rule that raised its finding.
 */
@Component
@Order(100)
public class FixVerificationCapability implements Capability {

    public static final String ID = "verify";
    public static final String SOURCE_ID = "verification_agent";
    static final String METHOD = "static_analysis";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public CapabilityRole role() {
        return CapabilityRole.VERIFICATION;
    }

    @Override
    public String description() {
        return "Fix verification";
    }

    @Override
    public CapabilityResult analyze(ReviewInput input, CapabilityContext context, EventSink emitter) {
        List<Fix> pending = context.fixes().stream().filter(Fix::isPending).toList();
        emitter.emit(EventTypes.AGENT_STARTED, Map.of(
                "agent", SOURCE_ID,
                "attempt", context.attempt(),
                "pending_fixes", pending.size(),
                "upstream_failed", context.upstreamFailed()));

        var verifications = new ArrayList<FixVerification>();
        for (Fix fix : pending) {
            context.cancellation().throwIfCancelled();
            emitter.emit(EventTypes.TOOL_CALL_START, Map.of(
                    "tool", "verify_fix",
                    "arguments", Map.of("fix_id", fix.fixId())));
            FixVerification verification = verify(fix, context.finding(fix.findingId()));
            verifications.add(verification);
            emitter.emit(EventTypes.TOOL_CALL_RESULT, Map.of(
                    "tool", "verify_fix",
                    "fix_id", fix.fixId(),
                    "passed", verification.passed()));
            emitter.emit(EventTypes.FIX_VERIFIED, Map.of(
                    "fix_id", fix.fixId(),
                    "finding_id", fix.findingId(),
                    "passed", verification.passed(),
                    "method", METHOD,
                    "checks", verification.checks()));
        }

        long passed = verifications.stream().filter(FixVerification::passed).count();
        String summary = "Verified " + passed + " of " + verifications.size() + " fix(es)";
        emitter.emit(EventTypes.AGENT_COMPLETED, Map.of(
                "agent", SOURCE_ID,
                "verified", passed,
                "checked", verifications.size(),
                "summary", summary));
        return CapabilityResult.verified(verifications, summary);
    }

    FixVerification verify(Fix fix, Optional<Finding> finding) {
        var checks = new ArrayList<String>();
        boolean passed = true;

        String proposed = fix.proposedCode() == null ? "" : fix.proposedCode().strip();
        if (proposed.isEmpty()) {
            checks.add("FAIL proposed code is empty");
            return new FixVerification(fix.fixId(), false, METHOD, checks);
        }
        checks.add("PASS proposed code is present");

        if (proposed.equals(fix.originalCode() == null ? "" : fix.originalCode().strip())) {
            checks.add("FAIL proposed code is identical to the original");
            passed = false;
        } else {
            checks.add("PASS code changed");
        }

        if (finding.isEmpty()) {
            checks.add("FAIL finding " + fix.findingId() + " is unknown");
            return new FixVerification(fix.fixId(), false, METHOD, checks);
        }

        String issueType = finding.get().issueType();
        boolean stillMatches = RuleCatalog.rulesFor(issueType).stream().anyMatch(rule -> rule.matches(proposed));
        if (stillMatches) {
            checks.add("FAIL " + issueType + " pattern still present");
            passed = false;
        } else {
            checks.add("PASS " + issueType + " pattern removed");
        }

        switch (issueType.toLowerCase()) {
            case "sql_injection" -> {
                boolean parameterized = proposed.contains("?") || proposed.contains("%s");
                checks.add((parameterized ? "PASS" : "FAIL") + " query uses placeholders");
                passed &= parameterized;
            }
            case "hardcoded_secret" -> {
                boolean external = proposed.contains("os.environ") || proposed.contains("getenv");
                checks.add((external ? "PASS" : "FAIL") + " secret read from environment");
                passed &= external;
            }
            case "command_injection" -> {
                boolean noShell = !proposed.contains("shell=True") && !proposed.contains("os.system");
                checks.add((noShell ? "PASS" : "FAIL") + " no shell invocation");
                passed &= noShell;
            }
            default -> { }
        }
        return new FixVerification(fix.fixId(), passed, METHOD, checks);
    }
}
