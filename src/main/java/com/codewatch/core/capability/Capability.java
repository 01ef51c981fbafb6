package com.codewatch.core.capability;

import com.codewatch.core.events.EventSink;
import com.codewatch.core.model.CapabilityResult;
import com.codewatch.core.model.ReviewInput;

/**
 * A pluggable analysis unit invoked by the coordinator.
 * <p>
 * Implementations publish their own sub-events (tool calls, findings, fixes) through the
 * supplied {@link EventSink}, which is bound to {@link #sourceId()} and the running step.
 * Findings must carry the step id from the context.
 */
public interface Capability {

    /** Registry key referenced by plan steps. */
    String id();

    /** Event source identity of this capability. */
    String sourceId();

    default CapabilityRole role() {
        return CapabilityRole.ANALYSIS;
    }

    default String description() {
        return id();
    }

    /**
     * Runs the analysis.
     *
     * @throws CapabilityException on failure; recoverable kinds are retried
     */
    CapabilityResult analyze(ReviewInput input, CapabilityContext context, EventSink emitter);
}
