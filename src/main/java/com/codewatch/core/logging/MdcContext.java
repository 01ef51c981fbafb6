package com.codewatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Codewatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setReview(String reviewId) {
        MDC.put("reviewId", reviewId);
    }

    public static void setStep(String reviewId, String stepId, String capabilityId) {
        MDC.put("reviewId", reviewId);
        MDC.put("stepId", stepId);
        MDC.put("capabilityId", capabilityId);
    }

    public static void setBatch(String reviewId, int batchNumber) {
        MDC.put("reviewId", reviewId);
        MDC.put("batchNumber", String.valueOf(batchNumber));
    }

    public static void clear() {
        MDC.remove("reviewId");
        MDC.remove("stepId");
        MDC.remove("capabilityId");
        MDC.remove("batchNumber");
    }
}
