package com.codewatch.core.consolidation;

import com.codewatch.core.CodewatchException;

/**
 * A capability output that violates a consolidation invariant, such as a fix pointing
 * at a finding that does not exist in the review.
 */
public class ConsolidationException extends CodewatchException {

    private final String fixId;
    private final String findingId;

    public ConsolidationException(String fixId, String findingId, String message) {
        super(message);
        this.fixId = fixId;
        this.findingId = findingId;
    }

    public String fixId() {
        return fixId;
    }

    public String findingId() {
        return findingId;
    }
}
