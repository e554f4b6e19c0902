package com.surveygateway.security;

import java.time.Duration;

/**
 * Immutable outcome of the admission procedure, with the counter values it left behind.
 */
public class AdmissionDecision {

    private final String callerId;
    private final AdmissionOutcome outcome;
    private final long totalCalls;
    private final long rateLimitErrors;
    private final Duration retryAfter;

    public AdmissionDecision(String callerId, AdmissionOutcome outcome, long totalCalls,
                             long rateLimitErrors, Duration retryAfter) {
        this.callerId = callerId;
        this.outcome = outcome;
        this.totalCalls = totalCalls;
        this.rateLimitErrors = rateLimitErrors;
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    /**
     * Decision used when per-caller limiting is switched off; no counters are consulted.
     */
    public static AdmissionDecision unlimited(String callerId) {
        return new AdmissionDecision(callerId, AdmissionOutcome.ADMITTED, 0L, 0L, Duration.ZERO);
    }

    public String getCallerId() {
        return callerId;
    }

    public AdmissionOutcome getOutcome() {
        return outcome;
    }

    public boolean isAdmitted() {
        return outcome.isAdmitted();
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getRateLimitErrors() {
        return rateLimitErrors;
    }

    /**
     * How long a TOO_FAST caller should wait before the next attempt can pass; zero otherwise.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String toString() {
        return "AdmissionDecision{callerId=" + callerId + ", outcome=" + outcome
                + ", totalCalls=" + totalCalls + ", rateLimitErrors=" + rateLimitErrors
                + ", retryAfter=" + retryAfter + "}";
    }
}
