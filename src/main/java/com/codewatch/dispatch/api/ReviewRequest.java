package com.codewatch.dispatch.api;

import com.codewatch.core.model.Plan;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/reviews.
 *
 * @param code         source to review
 * @param filename     file name for finding locations; nullable, defaults to code.py
 * @param capabilities analysis capabilities to run; nullable, defaults to all
 * @param plan         explicit plan; nullable, the default plan is built when absent
 */
public record ReviewRequest(
    String code,
    String filename,
    List<String> capabilities,
    Plan plan
) {}
