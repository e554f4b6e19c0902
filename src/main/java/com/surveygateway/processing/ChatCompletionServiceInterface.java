package com.surveygateway.processing;

import com.surveygateway.shared.dto.ChatRequest;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Interface for the upstream completion call, to support both the real API and stub mode.
 */
public interface ChatCompletionServiceInterface {

    /**
     * @return false when the upstream is enabled but cannot be called (no API key)
     */
    boolean isReady();

    String generateReply(String callerId, ChatRequest request) throws IOException, TimeoutException;
}
