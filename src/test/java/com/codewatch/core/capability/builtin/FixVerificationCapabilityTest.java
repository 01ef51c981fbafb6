package com.codewatch.core.capability.builtin;

import com.codewatch.core.capability.CapabilityContext;
import com.codewatch.core.engine.CancellationToken;
import com.codewatch.core.events.EventBus;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.events.ReviewEvent;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.FindingCategory;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.FixVerification;
import com.codewatch.core.model.Location;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.Severity;
import com.codewatch.core.model.VerificationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FixVerificationCapabilityTest {

    private final FixVerificationCapability verifier = new FixVerificationCapability();

    private static Finding finding(String type) {
        return Finding.discovered("step-1-security", "security_agent", FindingCategory.SECURITY,
                Severity.HIGH, type, type, "d", Location.line("app.py", 3, "code"), 0.9);
    }

    private static Fix fix(Finding finding, String original, String proposed) {
        return Fix.proposed(finding.findingId(), "security_agent", original, proposed, "why", 0.8);
    }

    // -- Checks -------------------------------------------------------------

    @Nested
    @DisplayName("verify")
    class VerifyTests {

        @Test
        @DisplayName("passes a parameterized query")
        void passesParameterizedQuery() {
            Finding sql = finding("sql_injection");
            Fix fix = fix(sql, "cursor.execute(f\"SELECT * FROM t WHERE id = {uid}\")",
                    "cursor.execute(\"SELECT * FROM t WHERE id = ?\", (uid,))");

            FixVerification verification = verifier.verify(fix, Optional.of(sql));

            assertTrue(verification.passed(), verification.checks().toString());
            assertEquals(FixVerificationCapability.METHOD, verification.method());
        }

        @Test
        @DisplayName("fails a fix that keeps the vulnerable pattern")
        void failsWhenPatternRemains() {
            Finding sql = finding("sql_injection");
            Fix fix = fix(sql, "cursor.execute(f\"SELECT {a}\")", "cursor.execute(f\"SELECT {b}\")");

            FixVerification verification = verifier.verify(fix, Optional.of(sql));

            assertFalse(verification.passed());
            assertTrue(verification.checks().contains("FAIL sql_injection pattern still present"));
        }

        @Test
        @DisplayName("fails an unchanged or empty fix")
        void failsUnchangedOrEmpty() {
            Finding bug = finding("bare_except");

            assertFalse(verifier.verify(fix(bug, "except:", "except:"), Optional.of(bug)).passed());
            assertFalse(verifier.verify(fix(bug, "except:", "  "), Optional.of(bug)).passed());
        }

        @Test
        @DisplayName("fails a fix for an unknown finding")
        void failsUnknownFinding() {
            Finding bug = finding("bare_except");

            assertFalse(verifier.verify(fix(bug, "except:", "except Exception:"), Optional.empty()).passed());
        }

        @Test
        @DisplayName("a secret fix must read from the environment")
        void secretFromEnvironment() {
            Finding secret = finding("hardcoded_secret");

            assertTrue(verifier.verify(fix(secret, "TOKEN = \"abcd1234\"",
                    "TOKEN = os.environ.get(\"TOKEN\")"), Optional.of(secret)).passed());
            assertFalse(verifier.verify(fix(secret, "TOKEN = \"abcd1234\"",
                    "TOKEN = load_token()"), Optional.of(secret)).passed());
        }

        @Test
        @DisplayName("a command fix must not use the shell")
        void commandWithoutShell() {
            Finding command = finding("command_injection");

            assertTrue(verifier.verify(fix(command, "os.system(cmd)",
                    "subprocess.run(shlex.split(cmd), check=True)"), Optional.of(command)).passed());
        }
    }

    @Test
    @DisplayName("verifies every pending fix and reports each one")
    void analyzeVerifiesPendingFixes() {
        Finding sql = finding("sql_injection");
        Fix good = fix(sql, "cursor.execute(f\"SELECT {a}\")", "cursor.execute(\"SELECT ?\", (a,))");
        Fix bad = fix(sql, "cursor.execute(f\"SELECT {a}\")", "cursor.execute(f\"SELECT {a} \")");
        Fix done = good.resolve(true);
        var bus = new EventBus("REV-1");
        var context = new CapabilityContext("REV-1", "plan-REV-1", "step-3-verify", "verify", 1,
                Set.of("step-2-bug"), List.of(sql), List.of(good, bad, done), new CancellationToken());

        CapabilityResult result = verifier.analyze(new ReviewInput("x", "app.py"), context,
                bus.emitter(FixVerificationCapability.SOURCE_ID).forStep("step-3-verify"));
        bus.close();

        assertTrue(result.findings().isEmpty());
        assertEquals(2, result.verifications().size());
        assertTrue(result.verifications().get(0).passed());
        assertFalse(result.verifications().get(1).passed());

        List<ReviewEvent> verified = bus.history().stream()
                .filter(e -> EventTypes.FIX_VERIFIED.equals(e.eventType())).toList();
        assertEquals(2, verified.size());
        assertEquals(good.fixId(), verified.get(0).get("fix_id"));
        assertEquals(Boolean.TRUE, verified.get(0).get("passed"));
        assertEquals(VerificationStatus.VERIFIED, done.verificationStatus());
    }
}
