package com.codewatch.dispatch.cli;

import com.codewatch.core.events.EventTypes;
import com.codewatch.core.events.ReviewEvent;
import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Fix;
import com.codewatch.core.model.ReportMetrics;
import com.codewatch.core.model.ReviewReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Codewatch CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        print("@|bold,fg(yellow) CODEWATCH v0.1.0|@");
        System.out.println("----------------------------------");
    }

    public static void info(String message) {
        print("@|fg(cyan) [CODEWATCH]|@ " + message);
    }

    public static void success(String message) {
        print("@|fg(green) +|@ " + message);
    }

    public static void error(String message) {
        print("@|fg(red) x|@ " + message);
    }

    public static void capability(String id, String role, String sourceId, String description) {
        print("  @|bold " + id + "|@ (" + role + ", " + sourceId + ") " + description);
    }

    /** One line per event, prefixed by its source. */
    public static void event(ReviewEvent event) {
        String line = describe(event);
        if (line == null) {
            return;
        }
        String prefix = switch (event.eventType()) {
            case EventTypes.REVIEW_STARTED, EventTypes.REVIEW_COMPLETED, EventTypes.REVIEW_CANCELLED ->
                    "@|bold,fg(cyan) [REVIEW]|@";
            case EventTypes.PLAN_CREATED, EventTypes.PLAN_STEP_STARTED, EventTypes.PLAN_STEP_COMPLETED,
                    EventTypes.FINDINGS_CONSOLIDATED -> "@|fg(yellow) [PLAN]|@";
            case EventTypes.AGENT_RETRY -> "@|fg(magenta) [RETRY " + event.sourceId() + "]|@";
            case EventTypes.AGENT_ERROR, EventTypes.FIX_REJECTED -> "@|fg(red) [ERROR]|@";
            case EventTypes.FINDING_DISCOVERED -> "@|fg(red) [FINDING]|@";
            case EventTypes.FIX_PROPOSED, EventTypes.FIX_VERIFIED -> "@|fg(green) [FIX]|@";
            default -> "@|fg(blue) [" + event.sourceId() + "]|@";
        };
        print(prefix + " " + line);
    }

    private static String describe(ReviewEvent e) {
        return switch (e.eventType()) {
            case EventTypes.REVIEW_STARTED -> "started " + e.get("filename") + " (" + e.get("lines") + " lines)";
            case EventTypes.REVIEW_COMPLETED -> "finished: " + e.get("status");
            case EventTypes.REVIEW_CANCELLED -> "cancellation requested";
            case EventTypes.PLAN_CREATED -> "plan " + e.get("plan_id");
            case EventTypes.PLAN_STEP_STARTED -> e.stepId() + " started (" + e.get("agent") + ")"
                    + (Boolean.TRUE.equals(e.get("upstream_failed")) ? " with failed dependencies" : "");
            case EventTypes.PLAN_STEP_COMPLETED -> e.stepId() + " " + e.get("status")
                    + " after " + e.get("attempts") + " attempt(s)";
            case EventTypes.FINDINGS_CONSOLIDATED -> "batch " + e.get("batch") + ": "
                    + e.get("new_findings") + " new, " + e.get("duplicates_removed") + " duplicates removed";
            case EventTypes.AGENT_RETRY -> "attempt " + e.get("attempt") + " failed (" + e.get("error_kind")
                    + "), retrying in " + e.get("delay_ms") + "ms";
            case EventTypes.AGENT_ERROR -> e.get("agent") + ": " + e.get("message");
            case EventTypes.FIX_REJECTED -> "fix " + e.get("fix_id") + " rejected: " + e.get("reason");
            case EventTypes.FINDING_DISCOVERED -> e.get("severity") + " " + e.get("type") + " at line " + e.get("line");
            case EventTypes.FIX_PROPOSED -> "proposed for " + e.get("finding_id");
            case EventTypes.FIX_VERIFIED -> e.get("fix_id") + (Boolean.TRUE.equals(e.get("passed")) ? " verified" : " not verified");
            case EventTypes.THINKING -> String.valueOf((Object) e.get("message"));
            case EventTypes.AGENT_STARTED, EventTypes.AGENT_COMPLETED, EventTypes.TOOL_CALL_START,
                    EventTypes.TOOL_CALL_RESULT, EventTypes.FINAL_REPORT -> null;
            default -> e.eventType();
        };
    }

    public static void report(ReviewReport report) {
        System.out.println("----------------------------------");
        String color = switch (report.status()) {
            case COMPLETED -> "fg(green)";
            case PARTIAL -> "fg(yellow)";
            default -> "fg(red)";
        };
        print("@|bold REVIEW " + report.reviewId() + "|@ @|" + color + " " + report.status().wireName().toUpperCase() + "|@"
                + (report.cancelled() ? " @|fg(red) (cancelled)|@" : ""));
        System.out.println(report.summary());
        System.out.println();

        for (Finding finding : report.findings()) {
            print("  @|" + severityColor(finding) + " " + finding.severity().wireName().toUpperCase() + "|@ "
                    + finding.location().file() + ":" + finding.location().lineStart() + " "
                    + finding.title() + " [" + finding.issueType() + "]");
            System.out.println("      " + finding.location().codeSnippet());
            for (Fix fix : report.fixes()) {
                if (fix.findingId().equals(finding.findingId())) {
                    print("      @|fg(green) fix (" + fix.verificationStatus().wireName() + "):|@ " + fix.proposedCode());
                }
            }
        }
        for (String error : report.errors()) {
            error(error);
        }
        metrics(report.metrics());
    }

    private static void metrics(ReportMetrics m) {
        System.out.println("----------------------------------");
        print("@|bold Review Metrics|@");
        System.out.println("  Steps: " + m.stepsCompleted() + " completed, " + m.stepsFailed() + " failed ("
                + m.totalAttempts() + " attempts)");
        System.out.println("  Findings: " + m.totalFindings() + " (" + m.duplicatesRemoved() + " duplicates removed)");
        System.out.println("  Fixes verified: " + m.fixesVerified());
        System.out.println("  Duration: " + formatDuration(m.durationMs()));
    }

    private static String severityColor(Finding finding) {
        return switch (finding.severity()) {
            case CRITICAL, HIGH -> "fg(red),bold";
            case MEDIUM -> "fg(yellow)";
            default -> "fg(white)";
        };
    }

    private static void print(String markup) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(markup));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
