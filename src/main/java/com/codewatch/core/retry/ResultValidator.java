package com.codewatch.core.retry;

import com.codewatch.core.capability.CapabilityContext;
import com.codewatch.core.capability.CapabilityException;
import com.codewatch.core.capability.ErrorKind;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.CapabilityStatus;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.FixVerification;
import com.codewatch.core.model.VerificationStatus;

/**
 * Schema checks applied to every capability result before the supervisor accepts it.
 */
final class ResultValidator {

    private ResultValidator() {}

    static void validate(CapabilityResult result, CapabilityContext context, String sourceId) {
        if (result == null) {
            throw CapabilityException.schemaViolation("Capability returned no result");
        }
        if (result.status() == CapabilityStatus.FAILED) {
            throw new CapabilityException(ErrorKind.REPORTED_FAILURE,
                    result.summary() != null ? result.summary() : "Capability reported failure");
        }
        if (result.findings() == null || result.fixes() == null || result.verifications() == null) {
            throw CapabilityException.schemaViolation("Result lists must not be null");
        }
        for (Finding finding : result.findings()) {
            validateFinding(finding, context, sourceId);
        }
        for (Fix fix : result.fixes()) {
            if (fix == null || fix.fixId() == null || fix.findingId() == null) {
                throw CapabilityException.schemaViolation("Fix is missing fix_id or finding_id");
            }
            if (fix.confidence() < 0.0 || fix.confidence() > 1.0) {
                throw CapabilityException.schemaViolation("Fix " + fix.fixId()
                        + " confidence out of range: " + fix.confidence());
            }
            // Verification outcomes arrive as FixVerification and are applied by the coordinator
            if (fix.verificationStatus() != VerificationStatus.PENDING) {
                throw CapabilityException.schemaViolation("Fix " + fix.fixId() + " must be proposed as pending, not "
                        + (fix.verificationStatus() == null ? "null" : fix.verificationStatus().wireName()));
            }
        }
        for (FixVerification verification : result.verifications()) {
            if (verification == null || verification.fixId() == null) {
                throw CapabilityException.schemaViolation("Verification is missing fix_id");
            }
        }
    }

    private static void validateFinding(Finding finding, CapabilityContext context, String sourceId) {
        if (finding == null || finding.findingId() == null) {
            throw CapabilityException.schemaViolation("Finding is missing finding_id");
        }
        String id = finding.findingId();
        if (!context.stepId().equals(finding.stepId())) {
            throw CapabilityException.schemaViolation("Finding " + id + " carries step "
                    + finding.stepId() + " but was produced by " + context.stepId());
        }
        if (!sourceId.equals(finding.sourceId())) {
            throw CapabilityException.schemaViolation("Finding " + id + " carries source "
                    + finding.sourceId() + " instead of " + sourceId);
        }
        if (finding.category() == null || finding.severity() == null || finding.location() == null) {
            throw CapabilityException.schemaViolation("Finding " + id + " is missing category, severity or location");
        }
        if (finding.location().file() == null || finding.location().file().isBlank()) {
            throw CapabilityException.schemaViolation("Finding " + id + " has no file in its location");
        }
        if (finding.issueType() == null || finding.issueType().isBlank()) {
            throw CapabilityException.schemaViolation("Finding " + id + " is missing its type");
        }
        if (finding.confidence() < 0.0 || finding.confidence() > 1.0) {
            throw CapabilityException.schemaViolation("Finding " + id
                    + " confidence out of range: " + finding.confidence());
        }
    }
}
