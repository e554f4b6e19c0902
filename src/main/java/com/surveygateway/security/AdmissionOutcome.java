package com.surveygateway.security;

/**
 * Result of an admission decision for one request.
 */
public enum AdmissionOutcome {
    ADMITTED,
    /** Arrived within the minimum spacing; counts against the caller's error budget. */
    TOO_FAST,
    /** Error budget exhausted; permanent until counters are reset externally. */
    RATE_LIMIT_EXCEEDED,
    /** Lifetime call cap reached; permanent until the cap is raised. */
    VOLUME_CAP_EXCEEDED;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
