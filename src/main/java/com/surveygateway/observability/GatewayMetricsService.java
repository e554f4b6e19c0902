package com.surveygateway.observability;

import com.surveygateway.security.AdmissionOutcome;
import com.surveygateway.util.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed gateway metrics, exposed through the actuator metrics endpoint.
 *
 * Metrics:
 * - gateway.admission.decisions: Counter of admission decisions, tagged by outcome
 * - gateway.admission.retries: Counter of admission transactions re-run after a conflict
 * - gateway.rejections: Counter of rejected requests, tagged by error code
 * - gateway.upstream.latency: Timer for upstream completion calls, tagged by model and result.
 *   Only the configured default model is tagged by name; caller-chosen models share the "other" tag.
 */
@Service
@ConditionalOnProperty(name = "gateway.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class GatewayMetricsService implements GatewayMetricsServiceInterface {

    private static final String SERVICE_TAG = "survey-ai-gateway";
    static final String OTHER_MODEL_TAG = "other";

    private final MeterRegistry meterRegistry;
    private final String defaultModel;
    private final Counter admissionRetryCounter;

    public GatewayMetricsService(MeterRegistry meterRegistry,
                                 @Value("${upstream.default-model:gpt-4-turbo}") String defaultModel) {
        this.meterRegistry = meterRegistry;
        this.defaultModel = defaultModel;
        this.admissionRetryCounter = Counter.builder("gateway.admission.retries")
                .description("Admission transactions re-run after a concurrency conflict")
                .tag("service", SERVICE_TAG)
                .register(meterRegistry);
    }

    @Override
    public void recordAdmission(AdmissionOutcome outcome) {
        Counter.builder("gateway.admission.decisions")
                .description("Admission decisions by outcome")
                .tag("service", SERVICE_TAG)
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordAdmissionRetry() {
        admissionRetryCounter.increment();
    }

    @Override
    public void recordRejection(String errorCode) {
        Counter.builder("gateway.rejections")
                .description("Rejected requests by error code")
                .tag("service", SERVICE_TAG)
                .tag("error", Strings.safe(errorCode))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordUpstreamLatency(long durationMs, String model, boolean success) {
        Timer.builder("gateway.upstream.latency")
                .description("Upstream completion call latency")
                .tag("service", SERVICE_TAG)
                .tag("model", modelTag(model))
                .tag("result", success ? "success" : "failure")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    String modelTag(String model) {
        return defaultModel != null && defaultModel.equals(model) ? defaultModel : OTHER_MODEL_TAG;
    }
}
