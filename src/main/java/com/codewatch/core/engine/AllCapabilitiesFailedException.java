package com.codewatch.core.engine;

import com.codewatch.core.CodewatchException;

import java.util.List;

/**
 * Every step of a review failed; there is nothing to report but the errors.
 */
public class AllCapabilitiesFailedException extends CodewatchException {

    private final String reviewId;
    private final List<String> errors;

    public AllCapabilitiesFailedException(String reviewId, List<String> errors) {
        super("All steps of review " + reviewId + " failed: " + errors);
        this.reviewId = reviewId;
        this.errors = List.copyOf(errors);
    }

    public String reviewId() {
        return reviewId;
    }

    public List<String> errors() {
        return errors;
    }
}
