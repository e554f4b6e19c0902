package com.surveygateway.api;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/**
 * A request that the gateway refuses or cannot complete.
 * {@link #getMessage()} carries the internal detail for logs, never shown to callers.
 */
public class GatewayException extends RuntimeException {

    private final GatewayError error;
    private final String callerMessage;
    private final Duration retryAfter;
    private final Map<String, String> fieldErrors;

    public GatewayException(GatewayError error, String detail) {
        this(error, detail, null, null, Collections.emptyMap(), null);
    }

    public GatewayException(GatewayError error, String detail, Throwable cause) {
        this(error, detail, null, null, Collections.emptyMap(), cause);
    }

    private GatewayException(GatewayError error, String detail, String callerMessage,
                             Duration retryAfter, Map<String, String> fieldErrors, Throwable cause) {
        super(detail, cause);
        this.error = error;
        this.callerMessage = callerMessage;
        this.retryAfter = retryAfter;
        this.fieldErrors = fieldErrors;
    }

    public static GatewayException withRetryAfter(GatewayError error, String detail, Duration retryAfter) {
        return new GatewayException(error, detail, null, retryAfter, Collections.emptyMap(), null);
    }

    /**
     * For validation failures, where the detail is safe and useful to show the caller.
     */
    public static GatewayException invalidRequest(String callerMessage) {
        return invalidRequest(callerMessage, Collections.emptyMap());
    }

    public static GatewayException invalidRequest(String callerMessage, Map<String, String> fieldErrors) {
        return new GatewayException(GatewayError.INVALID_REQUEST, callerMessage, callerMessage, null,
                Collections.unmodifiableMap(fieldErrors), null);
    }

    public GatewayError getError() {
        return error;
    }

    public String getCallerMessage() {
        return callerMessage != null ? callerMessage : error.getMessage();
    }

    /**
     * Per-field validation messages, empty unless this is an {@link GatewayError#INVALID_REQUEST}.
     */
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    /**
     * @return time to wait before retrying, or null when not applicable
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * Retry-After header value: whole seconds, rounded up, at least 1.
     */
    public long getRetryAfterSeconds() {
        if (retryAfter == null) {
            return 0;
        }
        long seconds = retryAfter.getSeconds();
        if (retryAfter.getNano() > 0) {
            seconds++;
        }
        return Math.max(1, seconds);
    }
}
