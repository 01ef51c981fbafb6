package com.codewatch.core.capability.builtin;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Detects common Python correctness bugs.
 */
@Component
@Order(2)
public class BugCapability extends PatternCapability {

    public static final String ID = "bug";
    public static final String SOURCE_ID = "bug_agent";

    public BugCapability() {
        super(ID, SOURCE_ID, RuleCatalog.BUG);
    }

    @Override
    public String description() {
        return "Bug and error-handling scan";
    }
}
