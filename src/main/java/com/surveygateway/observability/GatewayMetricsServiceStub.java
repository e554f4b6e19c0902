package com.surveygateway.observability;

import com.surveygateway.security.AdmissionOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * No-op implementation when gateway metrics are disabled.
 */
@Service
@ConditionalOnProperty(name = "gateway.metrics.enabled", havingValue = "false")
public class GatewayMetricsServiceStub implements GatewayMetricsServiceInterface {

    @Override
    public void recordAdmission(AdmissionOutcome outcome) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordAdmissionRetry() {
        // No-op when metrics are disabled
    }

    @Override
    public void recordRejection(String errorCode) {
        // No-op when metrics are disabled
    }

    @Override
    public void recordUpstreamLatency(long durationMs, String model, boolean success) {
        // No-op when metrics are disabled
    }
}
