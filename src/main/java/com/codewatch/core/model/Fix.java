package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.UUID;

/**
 * A fix proposed for a finding.
 *
 * @param fixId              unique id
 * @param findingId          the finding this fix addresses; must exist in the same review
 * @param sourceId           agent that proposed the fix
 * @param originalCode       code being replaced
 * @param proposedCode       replacement code
 * @param explanation        why the replacement fixes the issue
 * @param confidence         confidence in [0, 1]
 * @param verificationStatus verification state
 */
public record Fix(
    @JsonProperty("fix_id") String fixId,
    @JsonProperty("finding_id") String findingId,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("original_code") String originalCode,
    @JsonProperty("proposed_code") String proposedCode,
    String explanation,
    double confidence,
    @JsonProperty("verification_status") VerificationStatus verificationStatus
) implements Serializable {

    public static Fix proposed(String findingId, String sourceId, String originalCode,
                               String proposedCode, String explanation, double confidence) {
        return new Fix("X-" + UUID.randomUUID(), findingId, sourceId, originalCode, proposedCode,
                explanation, confidence, VerificationStatus.PENDING);
    }

    public boolean isPending() {
        return verificationStatus == VerificationStatus.PENDING;
    }

    /**
     * Resolves a pending fix.
     *
     * @throws IllegalStateException if the fix was already verified or rejected
     */
    public Fix resolve(boolean passed) {
        if (!isPending()) {
            throw new IllegalStateException(
                    "Fix " + fixId + " already resolved as " + verificationStatus.wireName());
        }
        return new Fix(fixId, findingId, sourceId, originalCode, proposedCode, explanation,
                confidence, passed ? VerificationStatus.VERIFIED : VerificationStatus.UNVERIFIED);
    }

    /**
     * Re-targets this fix at a surviving finding after deduplication.
     */
    public Fix retarget(String survivingFindingId) {
        return new Fix(fixId, survivingFindingId, sourceId, originalCode, proposedCode,
                explanation, confidence, verificationStatus);
    }
}
