package com.surveygateway.observability;

import com.surveygateway.security.AdmissionOutcome;

/**
 * Interface for gateway metrics to support both enabled and disabled modes.
 */
public interface GatewayMetricsServiceInterface {
    void recordAdmission(AdmissionOutcome outcome);
    void recordAdmissionRetry();
    void recordRejection(String errorCode);
    void recordUpstreamLatency(long durationMs, String model, boolean success);
}
