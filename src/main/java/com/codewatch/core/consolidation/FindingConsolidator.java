package com.codewatch.core.consolidation;

import com.codewatch.core.config.CodewatchProperties;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.RejectedFix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges a batch of capability output into the review's consolidated state.
 * <p>
 * Incoming findings are compared with everything consolidated so far. Of two similar
 * findings the higher confidence one survives, the earlier one on a tie, and keeps its
 * position and id; the loser's id is recorded on it as a merge marker. Fixes aimed at a
 * removed finding are re-targeted to the survivor. A fix that references no finding of
 * the review is rejected. The result depends only on input order, never on timing.
 */
@Component
public class FindingConsolidator {

    private static final Logger log = LoggerFactory.getLogger(FindingConsolidator.class);

    private final FindingSimilarity similarity;

    @Autowired
    public FindingConsolidator(CodewatchProperties properties) {
        this(properties.getLineOverlapThreshold());
    }

    public FindingConsolidator(double overlapThreshold) {
        this.similarity = new FindingSimilarity(overlapThreshold);
    }

    /**
     * @param current       state after the previous barrier
     * @param incoming      findings of the batch, in step plan order
     * @param incomingFixes fixes of the batch, in step plan order
     * @param fixStepIds    fix id to the step that proposed it, for rejection records
     */
    public ConsolidationResult consolidate(ConsolidatedFindings current, List<Finding> incoming,
                                           List<Fix> incomingFixes, Map<String, String> fixStepIds) {
        var working = new ArrayList<>(current.findings());
        var aliases = new HashMap<>(current.aliases());
        var added = new LinkedHashMap<String, Finding>();
        int removed = 0;

        for (Finding finding : incoming) {
            if (indexOf(working, finding.findingId()) >= 0) {
                log.debug("Finding {} already consolidated, skipping", finding.findingId());
                continue;
            }
            int match = indexOfSimilar(working, finding);
            if (match < 0) {
                working.add(finding);
                added.put(finding.findingId(), finding);
                continue;
            }

            Finding existing = working.get(match);
            boolean incomingWins = finding.confidence() > existing.confidence();
            Finding survivor = incomingWins ? finding : existing;
            Finding loser = incomingWins ? existing : finding;

            Finding merged = survivor.withMerged(loser.findingId());
            for (String earlier : loser.mergedFindingIds()) {
                merged = merged.withMerged(earlier);
            }
            working.set(match, merged);
            redirect(aliases, loser.findingId(), survivor.findingId());

            if (incomingWins) {
                added.remove(loser.findingId());
                added.put(survivor.findingId(), merged);
            } else if (added.containsKey(survivor.findingId())) {
                added.put(survivor.findingId(), merged);
            }
            removed++;
            log.info("Duplicate finding {} ({} line {}) merged into {} (confidence {} vs {})",
                    loser.findingId(), loser.issueType(), loser.location().lineStart(),
                    survivor.findingId(), loser.confidence(), survivor.confidence());
        }

        Set<String> known = new HashSet<>();
        working.forEach(f -> known.add(f.findingId()));

        var fixes = new ArrayList<Fix>();
        for (Fix fix : current.fixes()) {
            fixes.add(retarget(fix, aliases));
        }

        var rejected = new ArrayList<RejectedFix>();
        for (Fix fix : incomingFixes) {
            try {
                fixes.add(attach(fix, aliases, known));
            } catch (ConsolidationException e) {
                String stepId = fixStepIds != null ? fixStepIds.get(fix.fixId()) : null;
                log.warn("Rejected fix {} from step {}: {}", fix.fixId(), stepId, e.getMessage());
                rejected.add(new RejectedFix(fix.fixId(), fix.findingId(), stepId, e.getMessage()));
            }
        }

        var allRejected = new ArrayList<>(current.rejectedFixes());
        allRejected.addAll(rejected);
        var state = new ConsolidatedFindings(working, fixes, aliases,
                current.duplicatesRemoved() + removed, allRejected);
        return new ConsolidationResult(state, List.copyOf(added.values()), removed, rejected);
    }

    public ConsolidationResult consolidate(ConsolidatedFindings current, List<Finding> incoming,
                                           List<Fix> incomingFixes) {
        return consolidate(current, incoming, incomingFixes, Map.of());
    }

    private Fix attach(Fix fix, Map<String, String> aliases, Set<String> known) {
        String target = resolve(aliases, fix.findingId());
        if (!known.contains(target)) {
            throw new ConsolidationException(fix.fixId(), fix.findingId(),
                    "Fix references unknown finding " + fix.findingId());
        }
        return target.equals(fix.findingId()) ? fix : fix.retarget(target);
    }

    private static Fix retarget(Fix fix, Map<String, String> aliases) {
        String target = resolve(aliases, fix.findingId());
        return target.equals(fix.findingId()) ? fix : fix.retarget(target);
    }

    private static String resolve(Map<String, String> aliases, String findingId) {
        String id = findingId;
        String next = aliases.get(id);
        int hops = 0;
        while (next != null && hops++ < aliases.size()) {
            id = next;
            next = aliases.get(id);
        }
        return id;
    }

    private static void redirect(Map<String, String> aliases, String from, String to) {
        aliases.replaceAll((removedId, survivorId) -> survivorId.equals(from) ? to : survivorId);
        aliases.put(from, to);
    }

    private int indexOfSimilar(List<Finding> findings, Finding candidate) {
        for (int i = 0; i < findings.size(); i++) {
            if (similarity.similar(findings.get(i), candidate)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOf(List<Finding> findings, String findingId) {
        for (int i = 0; i < findings.size(); i++) {
            if (findings.get(i).findingId().equals(findingId)) {
                return i;
            }
        }
        return -1;
    }
}
