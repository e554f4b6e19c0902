package com.surveygateway.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the identity that admission counters are keyed by.
 */
public interface CallerIdentityResolver {

    /**
     * @return a non-blank identity of at most {@link com.surveygateway.shared.model.CallerCounter#CALLER_ID_MAX_LENGTH} chars
     */
    String resolve(HttpServletRequest request);
}
