package com.codewatch.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a capability returns from one invocation.
 *
 * @param findings      findings discovered in this invocation
 * @param fixes         fixes proposed for those (or earlier) findings
 * @param verifications verification outcomes for existing fixes
 * @param status        capability-reported status
 * @param summary       one-line summary
 */
public record CapabilityResult(
    List<Finding> findings,
    List<Fix> fixes,
    List<FixVerification> verifications,
    CapabilityStatus status,
    String summary
) implements Serializable {

    // Nulls are kept, lists and entries alike, so the supervisor can report them as schema violations
    public CapabilityResult {
        findings = snapshot(findings);
        fixes = snapshot(fixes);
        verifications = snapshot(verifications);
    }

    public static CapabilityResult of(List<Finding> findings, List<Fix> fixes, String summary) {
        return new CapabilityResult(findings, fixes, List.of(), CapabilityStatus.COMPLETED, summary);
    }

    public static CapabilityResult verified(List<FixVerification> verifications, String summary) {
        return new CapabilityResult(List.of(), List.of(), verifications, CapabilityStatus.COMPLETED, summary);
    }

    public static CapabilityResult empty(String summary) {
        return of(List.of(), List.of(), summary);
    }

    private static <T> List<T> snapshot(List<T> list) {
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
