package com.surveygateway.observability;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.security.AdmissionDecision;
import com.surveygateway.shared.dto.ChatRequest;
import com.surveygateway.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Optional structured audit trail of gateway decisions, written to the "gateway.audit" logger.
 * Controlled by gateway.logging.enabled (decisions) and gateway.logging.payloads (payload summaries).
 * Never influences outcomes: every method is a pure observer.
 */
@Service
public class AuditLogService {

    private static final Logger audit = LoggerFactory.getLogger("gateway.audit");

    private final GatewayConfigSnapshot config;
    private final int maxPayloadChars;

    public AuditLogService(GatewayConfigSnapshot config,
                           @Value("${gateway.logging.max-payload-chars:2000}") int maxPayloadChars) {
        this.config = config;
        this.maxPayloadChars = maxPayloadChars;
    }

    public void requestReceived(String callerId, String origin) {
        if (config.isAuditLoggingEnabled()) {
            audit.info("event=request_received caller={} origin={}", callerId, Strings.safe(origin));
        }
    }

    public void rejected(String callerId, String errorCode, String detail) {
        if (config.isAuditLoggingEnabled()) {
            audit.info("event=request_rejected caller={} error={} detail={}", callerId, errorCode, detail);
        }
    }

    public void admission(AdmissionDecision decision) {
        if (config.isAuditLoggingEnabled()) {
            audit.info("event=admission caller={} outcome={} totalCalls={} maxCalls={} rateLimitErrors={} rateLimitSeconds={}",
                    decision.getCallerId(), decision.getOutcome(), decision.getTotalCalls(),
                    config.getIpMaxCalls(), decision.getRateLimitErrors(), config.getIpRateLimitSeconds());
        }
    }

    public void upstreamResult(String callerId, String model, long durationMs, boolean success) {
        if (config.isAuditLoggingEnabled()) {
            audit.info("event=upstream_result caller={} model={} durationMs={} success={}",
                    callerId, model, durationMs, success);
        }
    }

    public void requestPayload(String callerId, ChatRequest request) {
        if (config.isPayloadLoggingEnabled()) {
            audit.info("event=request_payload caller={} model={} historySize={} prompt=\"{}\"",
                    callerId, request.getModel(), request.getHistory().size(),
                    Strings.truncate(request.getPrompt(), maxPayloadChars));
        }
    }

    public void upstreamPayload(String callerId, String payloadJson) {
        if (config.isPayloadLoggingEnabled()) {
            audit.info("event=upstream_payload caller={} payload={}", callerId,
                    Strings.truncate(payloadJson, maxPayloadChars));
        }
    }

    public void responsePayload(String callerId, String text) {
        if (config.isPayloadLoggingEnabled()) {
            audit.info("event=response_payload caller={} text=\"{}\"", callerId,
                    Strings.truncate(text, maxPayloadChars));
        }
    }
}
