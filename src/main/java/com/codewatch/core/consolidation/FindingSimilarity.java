package com.codewatch.core.consolidation;

import com.codewatch.core.model.Finding;
import com.codewatch.core.model.Location;

/**
 * Decides whether two findings describe the same issue: same category and type, same
 * file, and line ranges overlapping by at least the threshold share of the shorter range.
 */
public class FindingSimilarity {

    private final double overlapThreshold;

    public FindingSimilarity(double overlapThreshold) {
        if (overlapThreshold <= 0.0 || overlapThreshold > 1.0) {
            throw new IllegalArgumentException("overlapThreshold must be in (0, 1], got " + overlapThreshold);
        }
        this.overlapThreshold = overlapThreshold;
    }

    public double overlapThreshold() {
        return overlapThreshold;
    }

    public boolean similar(Finding a, Finding b) {
        if (a.category() != b.category()) {
            return false;
        }
        if (!a.issueType().equalsIgnoreCase(b.issueType())) {
            return false;
        }
        if (!normalizePath(a.location().file()).equals(normalizePath(b.location().file()))) {
            return false;
        }
        return overlapRatio(a.location(), b.location()) >= overlapThreshold;
    }

    /** Overlapping lines divided by the length of the shorter range; 0 when disjoint. */
    static double overlapRatio(Location a, Location b) {
        int start = Math.max(a.lineStart(), b.lineStart());
        int end = Math.min(a.lineEnd(), b.lineEnd());
        if (end < start) {
            return 0.0;
        }
        int shorter = Math.min(a.lineCount(), b.lineCount());
        return (double) (end - start + 1) / shorter;
    }

    static String normalizePath(String file) {
        if (file == null) {
            return "";
        }
        String path = file.trim().replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        return path;
    }
}
