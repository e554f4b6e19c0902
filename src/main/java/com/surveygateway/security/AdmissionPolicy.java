package com.surveygateway.security;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.shared.model.CallerCounter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * The admission rules, applied to a caller's counter at a given instant.
 * Pure with respect to storage: it only mutates the counter it is handed, and the caller
 * is responsible for doing so inside a transaction that holds the counter's row lock.
 *
 * Rules, in order:
 * <ol>
 *   <li>error budget spent ({@code rateLimitErrors >= ipMaxRateLimitErrors}): RATE_LIMIT_EXCEEDED, no change</li>
 *   <li>volume cap reached ({@code totalCalls >= ipMaxCalls}): VOLUME_CAP_EXCEEDED, no change</li>
 *   <li>too soon after the last accepted call: TOO_FAST, error count + 1</li>
 *   <li>otherwise ADMITTED: last call = now, total calls + 1</li>
 * </ol>
 * A threshold of zero or less disables its rule. An elapsed time exactly equal to the
 * configured interval is accepted.
 */
@Component
public class AdmissionPolicy {

    private final GatewayConfigSnapshot config;

    public AdmissionPolicy(GatewayConfigSnapshot config) {
        this.config = config;
    }

    public AdmissionDecision apply(CallerCounter counter, Instant now) {
        int maxErrors = config.getIpMaxRateLimitErrors();
        if (maxErrors > 0 && counter.getRateLimitErrors() >= maxErrors) {
            return snapshot(counter, AdmissionOutcome.RATE_LIMIT_EXCEEDED, Duration.ZERO);
        }

        int maxCalls = config.getIpMaxCalls();
        if (maxCalls > 0 && counter.getTotalCalls() >= maxCalls) {
            return snapshot(counter, AdmissionOutcome.VOLUME_CAP_EXCEEDED, Duration.ZERO);
        }

        Duration minInterval = minimumInterval();
        Instant lastCall = counter.getLastCallAt();
        if (!minInterval.isZero() && lastCall != null) {
            Duration elapsed = Duration.between(lastCall, now);
            if (elapsed.compareTo(minInterval) < 0) {
                counter.recordRateLimitError();
                return snapshot(counter, AdmissionOutcome.TOO_FAST, minInterval.minus(elapsed));
            }
        }

        counter.recordAcceptedCall(now);
        return snapshot(counter, AdmissionOutcome.ADMITTED, Duration.ZERO);
    }

    /**
     * Configured spacing as a Duration; zero when spacing checks are disabled.
     */
    Duration minimumInterval() {
        double seconds = config.getIpRateLimitSeconds();
        if (!(seconds > 0)) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }

    private static AdmissionDecision snapshot(CallerCounter counter, AdmissionOutcome outcome, Duration retryAfter) {
        return new AdmissionDecision(counter.getCallerId(), outcome,
                counter.getTotalCalls(), counter.getRateLimitErrors(), retryAfter);
    }
}
