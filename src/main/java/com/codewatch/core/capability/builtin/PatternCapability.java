package com.codewatch.core.capability.builtin;

import com.codewatch.core.capability.Capability;
import com.codewatch.core.capability.CapabilityContext;
import com.codewatch.core.capability.CapabilityException;
import com.codewatch.core.events.EventSink;
import com.codewatch.core.events.EventTypes;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.Location;
import com.codewatch.core.model.ReviewInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for capabilities that scan source line by line with a fixed rule set.
 * Each rule scan is reported as a {@code search_pattern} tool call.
 */
public abstract class PatternCapability implements Capability {

    private static final Logger log = LoggerFactory.getLogger(PatternCapability.class);

    private final String id;
    private final String sourceId;
    private final List<PatternRule> rules;

    protected PatternCapability(String id, String sourceId, List<PatternRule> rules) {
        this.id = id;
        this.sourceId = sourceId;
        this.rules = List.copyOf(rules);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    public List<PatternRule> rules() {
        return rules;
    }

    @Override
    public CapabilityResult analyze(ReviewInput input, CapabilityContext context, EventSink emitter) {
        if (input == null || input.code() == null) {
            throw CapabilityException.malformedInput("No source code supplied");
        }
        String[] lines = input.code().split("\n", -1);
        emitter.emit(EventTypes.AGENT_STARTED, Map.of(
                "agent", sourceId,
                "attempt", context.attempt(),
                "lines", lines.length));
        emitter.emit(EventTypes.THINKING, Map.of(
                "message", "Scanning " + input.filename() + " with " + rules.size() + " " + id + " rules"));

        var findings = new ArrayList<Finding>();
        var fixes = new ArrayList<Fix>();
        for (PatternRule rule : rules) {
            context.cancellation().throwIfCancelled();
            emitter.emit(EventTypes.TOOL_CALL_START, Map.of(
                    "tool", "search_pattern",
                    "arguments", Map.of("pattern", rule.pattern().pattern(), "type", rule.issueType())));
            int matches = 0;
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                if (!rule.matches(line)) {
                    continue;
                }
                matches++;
                Finding finding = Finding.discovered(context.stepId(), sourceId, rule.category(),
                        rule.severity(), rule.issueType(), rule.title(), rule.description(),
                        Location.line(input.filename(), i + 1, line.strip()), rule.confidence());
                findings.add(finding);
                emitter.emit(EventTypes.FINDING_DISCOVERED, findingPayload(finding));

                rule.proposeFix(line).ifPresent(proposed -> {
                    Fix fix = Fix.proposed(finding.findingId(), sourceId, line.strip(), proposed.strip(),
                            rule.explanation(), Math.max(0.0, rule.confidence() - 0.1));
                    fixes.add(fix);
                    emitter.emit(EventTypes.FIX_PROPOSED, Map.of(
                            "fix_id", fix.fixId(),
                            "finding_id", fix.findingId(),
                            "proposed_code", fix.proposedCode(),
                            "confidence", fix.confidence()));
                });
            }
            emitter.emit(EventTypes.TOOL_CALL_RESULT, Map.of(
                    "tool", "search_pattern",
                    "type", rule.issueType(),
                    "matches", matches));
        }

        String summary = "Found " + findings.size() + " " + id + " issue(s) in " + input.filename();
        emitter.emit(EventTypes.AGENT_COMPLETED, Map.of(
                "agent", sourceId,
                "findings", findings.size(),
                "fixes", fixes.size(),
                "summary", summary));
        log.debug("{} scanned {} lines: {} findings, {} fixes", id, lines.length, findings.size(), fixes.size());
        return CapabilityResult.of(findings, fixes, summary);
    }

    static Map<String, Object> findingPayload(Finding finding) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("finding_id", finding.findingId());
        payload.put("type", finding.issueType());
        payload.put("category", finding.category().wireName());
        payload.put("severity", finding.severity().wireName());
        payload.put("title", finding.title());
        payload.put("line", finding.location().lineStart());
        payload.put("confidence", finding.confidence());
        return payload;
    }
}
