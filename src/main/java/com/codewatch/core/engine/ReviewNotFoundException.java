package com.codewatch.core.engine;

import com.codewatch.core.CodewatchException;

public class ReviewNotFoundException extends CodewatchException {

    public ReviewNotFoundException(String reviewId) {
        super("Review not found: " + reviewId);
    }
}
