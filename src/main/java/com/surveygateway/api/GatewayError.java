package com.surveygateway.api;

import org.springframework.http.HttpStatus;

/**
 * Caller-visible gateway outcomes. The message is what the browser sees; internal detail
 * travels separately on {@link GatewayException} and is only logged.
 */
public enum GatewayError {
    SERVICE_DISABLED(HttpStatus.SERVICE_UNAVAILABLE, "Service Temporarily Unavailable"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Unauthorized Access"),
    TOO_FAST(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    VOLUME_CAP_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Too many requests"),
    UPSTREAM_ERROR(HttpStatus.BAD_GATEWAY, "Upstream API Error"),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "Invalid request"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");

    private final HttpStatus status;
    private final String message;

    GatewayError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
