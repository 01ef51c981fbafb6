package com.codewatch.core.capability.builtin;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Detects injection, secrets, unsafe deserialization and weak cryptography.
 */
@Component
@Order(1)
public class SecurityCapability extends PatternCapability {

    public static final String ID = "security";
    public static final String SOURCE_ID = "security_agent";

    public SecurityCapability() {
        super(ID, SOURCE_ID, RuleCatalog.SECURITY);
    }

    @Override
    public String description() {
        return "Security vulnerability scan";
    }
}
