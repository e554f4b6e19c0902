package com.surveygateway.processing;

import com.surveygateway.config.GatewayConfigSnapshot;
import com.surveygateway.observability.AuditLogService;
import com.surveygateway.observability.GatewayMetricsServiceInterface;
import com.surveygateway.shared.dto.ChatMessage;
import com.surveygateway.shared.dto.ChatRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for the upstream forwarder against a mocked completion endpoint.
 */
class ChatCompletionServiceTest {

    private static final String URL = "https://upstream.test/v1/chat/completions";
    private static final String API_KEY = "sk-test-123";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private GatewayMetricsServiceInterface metricsService;
    private ChatCompletionService service;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        metricsService = mock(GatewayMetricsServiceInterface.class);
        service = newService(true, API_KEY);
    }

    private ChatCompletionService newService(boolean enabled, String apiKey) {
        GatewayConfigSnapshot config = GatewayConfigSnapshot.builder().upstreamApiKey(apiKey).build();
        return new ChatCompletionService(restTemplate, config, enabled, URL,
                "gpt-4-turbo", 0.7, 1000, metricsService, new AuditLogService(config, 2000));
    }

    private static ChatRequest fullRequest() {
        ChatRequest request = new ChatRequest("What is next?");
        request.setSystemPrompt("You are a survey assistant.");
        request.setHistory(List.of(
                new ChatMessage("user", "Hi"),
                new ChatMessage("assistant", "Hello!")));
        return request;
    }

    @Test
    void sendsSystemHistoryThenPromptWithBearerKey() throws Exception {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer " + API_KEY))
                .andExpect(jsonPath("$.model").value("gpt-4-turbo"))
                .andExpect(jsonPath("$.temperature").value(0.7))
                .andExpect(jsonPath("$.max_tokens").value(1000))
                .andExpect(jsonPath("$.messages.length()").value(4))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content").value("Hi"))
                .andExpect(jsonPath("$.messages[2].role").value("assistant"))
                .andExpect(jsonPath("$.messages[3].role").value("user"))
                .andExpect(jsonPath("$.messages[3].content").value("What is next?"))
                .andRespond(withSuccess(
                        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Question 4.\"}}]}",
                        MediaType.APPLICATION_JSON));

        String text = service.generateReply("203.0.113.7", fullRequest());

        assertThat(text).isEqualTo("Question 4.");
        server.verify();
        verify(metricsService).recordUpstreamLatency(anyLong(), eq("gpt-4-turbo"), eq(true));
    }

    @Test
    void requestParametersOverrideDefaults() throws Exception {
        ChatRequest request = new ChatRequest("hi");
        request.setModel("gpt-4o");
        request.setTemperature(0.0);
        request.setMaxTokens(50);

        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.temperature").value(0.0))
                .andExpect(jsonPath("$.max_tokens").value(50))
                .andExpect(jsonPath("$.messages.length()").value(1))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(service.generateReply("caller", request)).isEqualTo("ok");
        server.verify();
    }

    @Test
    void blankPromptAndSystemAreLeftOut() {
        ChatRequest request = new ChatRequest("  ");
        request.setHistory(List.of(new ChatMessage("user", "only history")));

        var payload = service.buildPayload(request, "gpt-4-turbo");

        assertThat(payload.get("messages")).hasSize(1);
        assertThat(payload.get("messages").get(0).get("content").asText()).isEqualTo("only history");
    }

    @Test
    void emptyChoicesYieldEmptyText() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThat(service.generateReply("caller", fullRequest())).isEmpty();
    }

    @Test
    void nonSuccessStatusBecomesIOExceptionWithoutUpstreamBody() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid key sk-test-123\"}"));

        assertThatThrownBy(() -> service.generateReply("caller", fullRequest()))
                .isInstanceOf(IOException.class)
                .hasMessage("Upstream returned HTTP 401");
        verify(metricsService).recordUpstreamLatency(anyLong(), eq("gpt-4-turbo"), eq(false));
    }

    @Test
    void malformedBodyBecomesIOException() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("<html>gateway</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> service.generateReply("caller", fullRequest()))
                .isInstanceOf(IOException.class)
                .hasMessage("Malformed upstream response");
    }

    @Test
    void choiceWithoutContentIsMalformed() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{}}]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> service.generateReply("caller", fullRequest()))
                .isInstanceOf(IOException.class);
    }

    @Test
    void readTimeoutBecomesTimeoutException() {
        server.expect(requestTo(URL))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> service.generateReply("caller", fullRequest()))
                .isInstanceOf(TimeoutException.class);
    }

    @Test
    void stubModeNeverCallsTheNetwork() throws Exception {
        ChatCompletionService stub = newService(false, "");

        assertThat(stub.isReady()).isTrue();
        assertThat(stub.generateReply("caller", new ChatRequest("hello"))).isEqualTo("[stub] hello");
        server.verify();
    }

    @Test
    void enabledWithoutKeyIsNotReady() {
        assertThat(newService(true, "").isReady()).isFalse();
        assertThat(service.isReady()).isTrue();
    }
}
