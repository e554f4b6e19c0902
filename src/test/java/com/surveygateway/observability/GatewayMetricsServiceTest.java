package com.surveygateway.observability;

import com.surveygateway.security.AdmissionOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayMetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GatewayMetricsService metricsService = new GatewayMetricsService(registry, "gpt-4-turbo");

    @Test
    void admissionsAreCountedByOutcome() {
        metricsService.recordAdmission(AdmissionOutcome.ADMITTED);
        metricsService.recordAdmission(AdmissionOutcome.ADMITTED);
        metricsService.recordAdmission(AdmissionOutcome.TOO_FAST);

        assertThat(registry.get("gateway.admission.decisions").tag("outcome", "ADMITTED").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("gateway.admission.decisions").tag("outcome", "TOO_FAST").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void rejectionsAndRetriesAreCounted() {
        metricsService.recordRejection("UNAUTHORIZED");
        metricsService.recordAdmissionRetry();

        assertThat(registry.get("gateway.rejections").tag("error", "UNAUTHORIZED").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("gateway.admission.retries").counter().count()).isEqualTo(1.0);
    }

    @Test
    void defaultModelKeepsItsOwnTag() {
        metricsService.recordUpstreamLatency(120, "gpt-4-turbo", true);

        assertThat(registry.get("gateway.upstream.latency").tag("model", "gpt-4-turbo").timer().count())
                .isEqualTo(1L);
    }

    @Test
    void callerChosenModelsShareOneTimerPerResult() {
        for (int i = 0; i < 200; i++) {
            metricsService.recordUpstreamLatency(10, "m-" + i, i % 2 == 0);
        }
        metricsService.recordUpstreamLatency(10, "m".repeat(500), true);
        metricsService.recordUpstreamLatency(10, null, true);

        assertThat(registry.find("gateway.upstream.latency").timers()).hasSize(2);
        assertThat(registry.get("gateway.upstream.latency").tag("model", "other").tag("result", "success")
                .timer().count()).isEqualTo(102L);
    }
}
