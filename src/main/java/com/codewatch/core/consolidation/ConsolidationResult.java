package com.codewatch.core.consolidation;

import com.codewatch.core.model.Finding;
import com.codewatch.core.model.RejectedFix;

import java.util.List;

/**
 * What one barrier's consolidation changed.
 *
 * @param state             the new cumulative state
 * @param added             incoming findings that survived as new entries
 * @param duplicatesRemoved duplicates removed in this batch
 * @param rejected          fixes refused in this batch
 */
public record ConsolidationResult(
    ConsolidatedFindings state,
    List<Finding> added,
    int duplicatesRemoved,
    List<RejectedFix> rejected
) {

    public ConsolidationResult {
        added = List.copyOf(added);
        rejected = List.copyOf(rejected);
    }
}
