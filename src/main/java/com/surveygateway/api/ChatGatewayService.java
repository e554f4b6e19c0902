package com.surveygateway.api;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.observability.AuditLogService;
import com.surveygateway.processing.ChatCompletionServiceInterface;
import com.surveygateway.security.AdmissionDecision;
import com.surveygateway.security.AdmissionService;
import com.surveygateway.security.AdmissionUnavailableException;
import com.surveygateway.security.CallerIdentityResolver;
import com.surveygateway.security.KillSwitch;
import com.surveygateway.security.OriginValidator;
import com.surveygateway.shared.dto.ChatRequest;
import com.surveygateway.shared.dto.ChatResponse;
import com.surveygateway.util.Strings;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * The chat request pipeline: kill switch, origin and key check, request validation,
 * admission, upstream call. Each stage runs only if every earlier stage passed, so a
 * request that is refused before admission never touches the caller's counters.
 */
@Service
public class ChatGatewayService {

    private static final Logger logger = LoggerFactory.getLogger(ChatGatewayService.class);

    private final KillSwitch killSwitch;
    private final CallerIdentityResolver callerIdentityResolver;
    private final OriginValidator originValidator;
    private final AdmissionService admissionService;
    private final ChatCompletionServiceInterface chatCompletionService;
    private final AuditLogService auditLogService;
    private final GatewayConfigSnapshot config;
    private final Validator validator;

    public ChatGatewayService(KillSwitch killSwitch,
                              CallerIdentityResolver callerIdentityResolver,
                              OriginValidator originValidator,
                              AdmissionService admissionService,
                              ChatCompletionServiceInterface chatCompletionService,
                              AuditLogService auditLogService,
                              GatewayConfigSnapshot config,
                              Validator validator) {
        this.killSwitch = killSwitch;
        this.callerIdentityResolver = callerIdentityResolver;
        this.originValidator = originValidator;
        this.admissionService = admissionService;
        this.chatCompletionService = chatCompletionService;
        this.auditLogService = auditLogService;
        this.config = config;
        this.validator = validator;
    }

    /**
     * Runs one chat turn through the gateway.
     *
     * @param request parsed request body
     * @param httpRequest inbound request, for origin, key and identity headers
     * @return the upstream's reply
     * @throws GatewayException for every refused or failed request
     */
    public ChatResponse handle(ChatRequest request, HttpServletRequest httpRequest) {
        killSwitch.check();

        String callerId = callerIdentityResolver.resolve(httpRequest);
        auditLogService.requestReceived(callerId, originValidator.resolveOrigin(httpRequest));

        try {
            originValidator.verify(httpRequest);
            validate(request);
            auditLogService.requestPayload(callerId, request);

            if (!chatCompletionService.isReady()) {
                throw new GatewayException(GatewayError.INTERNAL_ERROR,
                        "Upstream is enabled but upstream.api-key is not configured");
            }

            AdmissionDecision decision = admit(callerId);
            if (!decision.isAdmitted()) {
                throw rejection(decision);
            }

            String text;
            try {
                text = chatCompletionService.generateReply(callerId, request);
            } catch (IOException | TimeoutException e) {
                throw new GatewayException(GatewayError.UPSTREAM_ERROR, e.getMessage(), e);
            }

            auditLogService.responsePayload(callerId, text);
            logger.debug("Chat turn completed for caller {}", callerId);
            return new ChatResponse(text);
        } catch (GatewayException e) {
            auditLogService.rejected(callerId, e.getError().name(), e.getMessage());
            throw e;
        }
    }

    private AdmissionDecision admit(String callerId) {
        try {
            return admissionService.admit(callerId);
        } catch (AdmissionUnavailableException e) {
            throw new GatewayException(GatewayError.INTERNAL_ERROR, e.getMessage(), e);
        }
    }

    private void validate(ChatRequest request) {
        Set<ConstraintViolation<ChatRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, String> errors = new LinkedHashMap<>();
            for (ConstraintViolation<ChatRequest> violation : violations) {
                errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
            }
            throw GatewayException.invalidRequest("Validation failed", errors);
        }

        int maxHistory = config.getMaxHistoryMessages();
        if (maxHistory > 0 && request.getHistory().size() > maxHistory) {
            throw GatewayException.invalidRequest("History must not exceed " + maxHistory + " messages");
        }

        if (Strings.isBlank(request.getPrompt())
                && Strings.isBlank(request.getSystemPrompt())
                && request.getHistory().isEmpty()) {
            throw GatewayException.invalidRequest("Request must contain a prompt, system prompt or history");
        }
    }

    private static GatewayException rejection(AdmissionDecision decision) {
        switch (decision.getOutcome()) {
            case TOO_FAST:
                return GatewayException.withRetryAfter(GatewayError.TOO_FAST,
                        "Calls closer together than the minimum interval", decision.getRetryAfter());
            case RATE_LIMIT_EXCEEDED:
                return new GatewayException(GatewayError.RATE_LIMIT_EXCEEDED,
                        "Rate limit error budget exhausted (" + decision.getRateLimitErrors() + " errors)");
            case VOLUME_CAP_EXCEEDED:
                return new GatewayException(GatewayError.VOLUME_CAP_EXCEEDED,
                        "Lifetime call cap reached (" + decision.getTotalCalls() + " calls)");
            default:
                throw new IllegalStateException("Not a rejection: " + decision.getOutcome());
        }
    }
}
