package com.codewatch.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FixTest {

    private final Fix fix = Fix.proposed("F-1", "security_agent", "old", "new", "why", 0.8);

    @Test
    void proposedFixIsPending() {
        assertTrue(fix.isPending());
        assertTrue(fix.fixId().startsWith("X-"));
    }

    @Test
    void resolvesOnce() {
        Fix verified = fix.resolve(true);

        assertEquals(VerificationStatus.VERIFIED, verified.verificationStatus());
        assertEquals(VerificationStatus.UNVERIFIED, fix.resolve(false).verificationStatus());
        assertThrows(IllegalStateException.class, () -> verified.resolve(false));
    }

    @Test
    void retargetKeepsEverythingElse() {
        Fix moved = fix.retarget("F-2");

        assertEquals("F-2", moved.findingId());
        assertEquals(fix.fixId(), moved.fixId());
        assertEquals(fix.verificationStatus(), moved.verificationStatus());
    }
}
