package com.surveygateway.api;

import com.surveygateway.shared.dto.ChatRequest;
import com.surveygateway.shared.dto.ChatResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for the chat endpoint used by the survey widget.
 * Preflight and kill-switch responses are produced by filters and never reach here.
 */
@RestController
@Tag(name = "Chat", description = "Credential-hiding, rate-limited chat completion proxy")
public class ChatController {

    private final ChatGatewayService chatGatewayService;

    public ChatController(ChatGatewayService chatGatewayService) {
        this.chatGatewayService = chatGatewayService;
    }

    @PostMapping(value = "/api/chat",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Forward one chat turn to the upstream model",
               description = "Checks origin and endpoint key, applies per-caller admission limits, "
                       + "then returns the generated text.")
    @ApiResponse(responseCode = "200", description = "Generated text")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "401", description = "Origin or endpoint key rejected")
    @ApiResponse(responseCode = "429", description = "Caller is rate limited or over the call cap")
    @ApiResponse(responseCode = "502", description = "Upstream API error")
    @ApiResponse(responseCode = "503", description = "Service disabled")
    public ResponseEntity<ChatResponse> chat(@RequestBody ChatRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(chatGatewayService.handle(request, httpRequest));
    }
}
