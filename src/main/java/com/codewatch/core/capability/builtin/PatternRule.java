package com.codewatch.core.capability.builtin;

import com.codewatch.core.model.FindingCategory;
import com.codewatch.core.model.Severity;

import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * A line-oriented detection rule.
 *
 * @param issueType   finding type, e.g. {@code sql_injection}
 * @param category    finding category
 * @param severity    severity assigned to matches
 * @param pattern     regex matched against each source line
 * @param title       finding title
 * @param description finding description
 * @param confidence  confidence assigned to matches
 * @param fixer       rewrites a matching line into a fixed one, or returns null if it cannot
 * @param explanation explanation attached to proposed fixes
 */
public record PatternRule(
    String issueType,
    FindingCategory category,
    Severity severity,
    Pattern pattern,
    String title,
    String description,
    double confidence,
    UnaryOperator<String> fixer,
    String explanation
) {

    public boolean matches(String line) {
        return pattern.matcher(line).find();
    }

    /**
     * Proposes a replacement for a matching line. Empty when the rule has no fixer or
     * the rewrite leaves the line unchanged.
     */
    public Optional<String> proposeFix(String line) {
        if (fixer == null) {
            return Optional.empty();
        }
        String fixed = fixer.apply(line);
        if (fixed == null || fixed.equals(line)) {
            return Optional.empty();
        }
        return Optional.of(fixed);
    }
}
