package com.codewatch.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setStepPopulatesKeys() {
        MdcContext.setStep("REV-1", "step-1-security", "security");

        assertEquals("REV-1", MDC.get("reviewId"));
        assertEquals("step-1-security", MDC.get("stepId"));
        assertEquals("security", MDC.get("capabilityId"));
    }

    @Test
    void setBatchPopulatesKeys() {
        MdcContext.setBatch("REV-1", 2);

        assertEquals("2", MDC.get("batchNumber"));
    }

    @Test
    void clearRemovesOnlyCodewatchKeys() {
        MDC.put("other", "kept");
        MdcContext.setStep("REV-1", "s", "c");

        MdcContext.clear();

        assertNull(MDC.get("reviewId"));
        assertNull(MDC.get("stepId"));
        assertEquals("kept", MDC.get("other"));
    }
}
