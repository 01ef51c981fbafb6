package com.codewatch.core.events;

/**
 * Event type names carried in {@link ReviewEvent#eventType()}.
 */
public final class EventTypes {

    private EventTypes() {}

    // Review lifecycle
    public static final String REVIEW_STARTED = "review_started";
    public static final String REVIEW_COMPLETED = "review_completed";
    public static final String REVIEW_CANCELLED = "review_cancelled";

    // Planning
    public static final String PLAN_CREATED = "plan_created";
    public static final String PLAN_STEP_STARTED = "plan_step_started";
    public static final String PLAN_STEP_COMPLETED = "plan_step_completed";

    // Agent lifecycle
    public static final String AGENT_STARTED = "agent_started";
    public static final String AGENT_COMPLETED = "agent_completed";
    public static final String AGENT_RETRY = "agent_retry";
    public static final String AGENT_ERROR = "agent_error";

    // Agent activity
    public static final String THINKING = "thinking";
    public static final String TOOL_CALL_START = "tool_call_start";
    public static final String TOOL_CALL_RESULT = "tool_call_result";

    // Findings and fixes
    public static final String FINDING_DISCOVERED = "finding_discovered";
    public static final String FIX_PROPOSED = "fix_proposed";
    public static final String FIX_VERIFIED = "fix_verified";
    public static final String FIX_REJECTED = "fix_rejected";
    public static final String FINDINGS_CONSOLIDATED = "findings_consolidated";
    public static final String FINAL_REPORT = "final_report";
}
