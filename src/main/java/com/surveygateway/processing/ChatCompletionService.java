package com.surveygateway.processing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.observability.AuditLogService;
import com.surveygateway.observability.GatewayMetricsServiceInterface;
import com.surveygateway.shared.dto.ChatMessage;
import com.surveygateway.shared.dto.ChatRequest;
import com.surveygateway.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Forwards an admitted chat turn to the upstream OpenAI-style chat completions API.
 * Supports local stub mode when upstream.enabled=false.
 *
 * The API key is attached here and nowhere else. Failures are reported to the caller as
 * exceptions with generic messages; upstream status codes and bodies are only logged.
 * Calls are never retried: a retry would spend upstream cost on a quota slot that was
 * already consumed at admission.
 */
@Service
public class ChatCompletionService implements ChatCompletionServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionService.class);
    private static final String DEFAULT_URL = "https://aiapi-prod.stanford.edu/v1/chat/completions";
    private static final int MAX_LOGGED_UPSTREAM_BODY_CHARS = 1000;

    private final RestTemplate upstreamRestTemplate;
    private final GatewayConfigSnapshot config;
    private final boolean enabled;
    private final String url;
    private final String defaultModel;
    private final double defaultTemperature;
    private final int defaultMaxTokens;
    private final GatewayMetricsServiceInterface metricsService;
    private final AuditLogService auditLogService;
    private final ObjectMapper objectMapper;

    public ChatCompletionService(
            RestTemplate upstreamRestTemplate,
            GatewayConfigSnapshot config,
            @Value("${upstream.enabled:false}") boolean enabled,
            @Value("${upstream.url:" + DEFAULT_URL + "}") String url,
            @Value("${upstream.default-model:gpt-4-turbo}") String defaultModel,
            @Value("${upstream.default-temperature:0.7}") double defaultTemperature,
            @Value("${upstream.default-max-tokens:1000}") int defaultMaxTokens,
            GatewayMetricsServiceInterface metricsService,
            AuditLogService auditLogService) {
        this.upstreamRestTemplate = upstreamRestTemplate;
        this.config = config;
        this.enabled = enabled;
        this.url = url;
        this.defaultModel = defaultModel;
        this.defaultTemperature = defaultTemperature;
        this.defaultMaxTokens = defaultMaxTokens;
        this.metricsService = metricsService;
        this.auditLogService = auditLogService;
        this.objectMapper = new ObjectMapper();

        logger.info("ChatCompletionService initialized: enabled={}, url={}, defaultModel={}",
                this.enabled, this.url, this.defaultModel);
        if (!this.enabled) {
            logger.info("Upstream disabled, will use stub mode for local development");
        }
    }

    @Override
    public boolean isReady() {
        return !enabled || !Strings.isBlank(config.getUpstreamApiKey());
    }

    /**
     * Calls the completion API and returns the generated text verbatim.
     *
     * @param callerId caller identity, for logging only
     * @param request validated, admitted chat turn
     * @return generated text; empty when the upstream returned no choices
     * @throws IOException on transport failure, non-2xx status or an unparseable body
     * @throws TimeoutException if the upstream did not answer within the configured timeout
     */
    @Override
    public String generateReply(String callerId, ChatRequest request) throws IOException, TimeoutException {
        String model = resolveModel(request);
        ObjectNode payload = buildPayload(request, model);
        String payloadJson = objectMapper.writeValueAsString(payload);
        auditLogService.upstreamPayload(callerId, payloadJson);

        long startTime = System.currentTimeMillis();
        boolean success = false;
        try {
            String text;
            if (!enabled) {
                logger.debug("Using stub mode (upstream.enabled=false)");
                text = generateStubReply(request);
            } else {
                text = callUpstream(payloadJson);
            }
            success = true;
            return text;
        } finally {
            long durationMs = System.currentTimeMillis() - startTime;
            metricsService.recordUpstreamLatency(durationMs, model, success);
            auditLogService.upstreamResult(callerId, model, durationMs, success);
        }
    }

    /**
     * Builds the completion payload: system prompt (if any), prior turns, then the new prompt (if any).
     */
    ObjectNode buildPayload(ChatRequest request, String model) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);

        ArrayNode messages = payload.putArray("messages");
        if (!Strings.isBlank(request.getSystemPrompt())) {
            addMessage(messages, "system", request.getSystemPrompt());
        }
        List<ChatMessage> history = request.getHistory();
        if (history != null) {
            for (ChatMessage message : history) {
                addMessage(messages, message.getRole(), message.getContent());
            }
        }
        if (!Strings.isBlank(request.getPrompt())) {
            addMessage(messages, "user", request.getPrompt());
        }

        payload.put("temperature", request.getTemperature() != null ? request.getTemperature() : defaultTemperature);
        payload.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : defaultMaxTokens);
        return payload;
    }

    String resolveModel(ChatRequest request) {
        return Strings.isBlank(request.getModel()) ? defaultModel : request.getModel().trim();
    }

    private static void addMessage(ArrayNode messages, String role, String content) {
        ObjectNode node = messages.addObject();
        node.put("role", role);
        node.put("content", content);
    }

    private String callUpstream(String payloadJson) throws IOException, TimeoutException {
        if (Strings.isBlank(config.getUpstreamApiKey())) {
            throw new IOException("Upstream API key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(config.getUpstreamApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = upstreamRestTemplate.exchange(url, HttpMethod.POST,
                    new HttpEntity<>(payloadJson, headers), String.class);
        } catch (HttpStatusCodeException e) {
            logger.error("Upstream returned error status {}: {}", e.getStatusCode().value(),
                    Strings.truncate(e.getResponseBodyAsString(), MAX_LOGGED_UPSTREAM_BODY_CHARS));
            throw new IOException("Upstream returned HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                logger.error("Upstream call timed out: {}", e.getMessage());
                TimeoutException timeout = new TimeoutException("Upstream call timed out");
                timeout.initCause(e);
                throw timeout;
            }
            logger.error("Upstream call failed: {}", e.getMessage(), e);
            throw new IOException("Upstream call failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            logger.error("Upstream call failed: {}", e.getMessage(), e);
            throw new IOException("Upstream call failed: " + e.getMessage(), e);
        }

        return extractText(response.getBody());
    }

    /**
     * Extracts {@code choices[0].message.content}. An empty choices array yields an empty reply;
     * anything that is not a completion object is treated as malformed.
     */
    String extractText(String body) throws IOException {
        if (Strings.isBlank(body)) {
            throw new IOException("Upstream returned an empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            logger.error("Failed to parse upstream response: {}",
                    Strings.truncate(body, MAX_LOGGED_UPSTREAM_BODY_CHARS));
            throw new IOException("Malformed upstream response", e);
        }

        JsonNode choices = root.path("choices");
        if (!choices.isArray()) {
            logger.error("Upstream response has no choices array: {}",
                    Strings.truncate(body, MAX_LOGGED_UPSTREAM_BODY_CHARS));
            throw new IOException("Malformed upstream response");
        }
        if (choices.isEmpty()) {
            logger.warn("Upstream response contained no choices, returning empty reply");
            return "";
        }

        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual()) {
            logger.error("Upstream choice has no text content: {}",
                    Strings.truncate(body, MAX_LOGGED_UPSTREAM_BODY_CHARS));
            throw new IOException("Malformed upstream response");
        }
        return content.asText();
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private String generateStubReply(ChatRequest request) {
        // Deterministic so tests and local runs can assert on it
        String prompt = Strings.isBlank(request.getPrompt()) ? "(no prompt)" : request.getPrompt();
        return "[stub] " + prompt;
    }
}
