package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of verifying one proposed fix.
 *
 * @param fixId   the verified fix
 * @param passed  whether every check passed
 * @param method  verification method, e.g. {@code static_analysis}
 * @param checks  human-readable check results
 */
public record FixVerification(
    @JsonProperty("fix_id") String fixId,
    boolean passed,
    String method,
    List<String> checks
) implements Serializable {

    public FixVerification {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }
}
