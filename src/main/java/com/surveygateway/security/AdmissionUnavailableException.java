package com.surveygateway.security;

/**
 * The counter store could not produce a decision (outage, or contention beyond the attempt budget).
 * Requests are never admitted in this state.
 */
public class AdmissionUnavailableException extends RuntimeException {

    public AdmissionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
