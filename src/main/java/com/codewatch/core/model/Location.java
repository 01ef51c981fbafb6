package com.codewatch.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Location of a finding in the reviewed source.
 *
 * @param file        file name as submitted
 * @param lineStart   first line, 1-based
 * @param lineEnd     last line, inclusive
 * @param codeSnippet source text of the affected lines
 */
public record Location(
    String file,
    @JsonProperty("line_start") int lineStart,
    @JsonProperty("line_end") int lineEnd,
    @JsonProperty("code_snippet") String codeSnippet
) implements Serializable {

    public Location {
        if (lineStart < 1 || lineEnd < lineStart) {
            throw new IllegalArgumentException(
                    "Invalid line range " + lineStart + "-" + lineEnd + " in " + file);
        }
    }

    public static Location line(String file, int line, String snippet) {
        return new Location(file, line, line, snippet);
    }

    public int lineCount() {
        return lineEnd - lineStart + 1;
    }
}
