package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A single issue discovered by a capability.
 * <p>
 * The {@code findingId} is generated once, at discovery, and every later event or fix
 * refers to it verbatim. The only field that changes afterwards is
 * {@code mergedFindingIds}, set by consolidation when duplicates are folded into this one.
 *
 * @param findingId        globally unique id
 * @param stepId           plan step that produced the finding
 * @param sourceId         agent identity that produced the finding
 * @param category         finding category
 * @param severity         severity
 * @param issueType        rule type, e.g. {@code sql_injection}
 * @param title            short title
 * @param description      explanation of the issue
 * @param location         where the issue is
 * @param confidence       confidence in [0, 1]
 * @param mergedFindingIds ids of duplicates removed in favour of this finding
 */
public record Finding(
    @JsonProperty("finding_id") String findingId,
    @JsonProperty("step_id") String stepId,
    @JsonProperty("source_id") String sourceId,
    FindingCategory category,
    Severity severity,
    @JsonProperty("type") String issueType,
    String title,
    String description,
    Location location,
    double confidence,
    @JsonProperty("merged_finding_ids") List<String> mergedFindingIds
) implements Serializable {

    public Finding {
        mergedFindingIds = mergedFindingIds == null ? List.of() : List.copyOf(mergedFindingIds);
    }

    /**
     * Creates a newly discovered finding with a fresh id.
     */
    public static Finding discovered(String stepId, String sourceId, FindingCategory category,
                                     Severity severity, String issueType, String title,
                                     String description, Location location, double confidence) {
        return new Finding(newId(), stepId, sourceId, category, severity, issueType, title,
                description, location, confidence, List.of());
    }

    public static String newId() {
        return "F-" + UUID.randomUUID();
    }

    /**
     * Returns a copy carrying the given duplicate id as a merge marker.
     */
    public Finding withMerged(String duplicateId) {
        var merged = new ArrayList<>(mergedFindingIds);
        merged.add(duplicateId);
        return new Finding(findingId, stepId, sourceId, category, severity, issueType, title,
                description, location, confidence, merged);
    }
}
