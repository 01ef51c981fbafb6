package com.codewatch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Source submitted for review.
 *
 * @param code         the source text
 * @param filename     file name used in finding locations
 * @param capabilities capability ids to run; empty means every registered analysis capability
 */
public record ReviewInput(
    String code,
    String filename,
    List<String> capabilities
) implements Serializable {

    public ReviewInput {
        filename = filename == null || filename.isBlank() ? "code.py" : filename;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public ReviewInput(String code, String filename) {
        this(code, filename, List.of());
    }

    public int lineCount() {
        return code == null ? 0 : code.split("\n", -1).length;
    }
}
