package com.codewatch.core.consolidation;

import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.RejectedFix;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cumulative consolidated state of a review, replaced wholesale at each barrier.
 *
 * @param findings          deduplicated findings in discovery order
 * @param fixes             fixes attached to surviving findings
 * @param aliases           removed finding id to surviving finding id
 * @param duplicatesRemoved duplicates removed so far
 * @param rejectedFixes     fixes refused so far
 */
public record ConsolidatedFindings(
    List<Finding> findings,
    List<Fix> fixes,
    Map<String, String> aliases,
    int duplicatesRemoved,
    List<RejectedFix> rejectedFixes
) {

    public static final ConsolidatedFindings EMPTY =
            new ConsolidatedFindings(List.of(), List.of(), Map.of(), 0, List.of());

    public ConsolidatedFindings {
        findings = List.copyOf(findings);
        fixes = List.copyOf(fixes);
        aliases = Map.copyOf(aliases);
        rejectedFixes = List.copyOf(rejectedFixes);
    }

    public Optional<Fix> fix(String fixId) {
        return fixes.stream().filter(f -> f.fixId().equals(fixId)).findFirst();
    }

    /** Replaces one fix, keeping its position. */
    public ConsolidatedFindings withFix(Fix updated) {
        List<Fix> replaced = fixes.stream()
                .map(f -> f.fixId().equals(updated.fixId()) ? updated : f)
                .toList();
        return new ConsolidatedFindings(findings, replaced, aliases, duplicatesRemoved, rejectedFixes);
    }
}
