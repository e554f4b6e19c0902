package com.surveygateway.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for an inbound chat turn from the survey widget.
 * Model parameters are optional; the forwarder fills in configured defaults.
 */
public class ChatRequest {

    private String prompt;

    @JsonProperty("system")
    private String systemPrompt;

    @Valid
    private List<@NotNull(message = "History entries must not be null") ChatMessage> history = new ArrayList<>();

    private String model;

    @DecimalMin(value = "0.0", message = "Temperature must be between 0 and 2")
    @DecimalMax(value = "2.0", message = "Temperature must be between 0 and 2")
    private Double temperature;

    @JsonProperty("max_tokens")
    @Min(value = 1, message = "max_tokens must be at least 1")
    private Integer maxTokens;

    public ChatRequest() {
    }

    public ChatRequest(String prompt) {
        this.prompt = prompt;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public List<ChatMessage> getHistory() {
        return history;
    }

    public void setHistory(List<ChatMessage> history) {
        this.history = history != null ? history : new ArrayList<>();
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public void setTemperature(Double temperature) {
        this.temperature = temperature;
    }

    public Integer getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(Integer maxTokens) {
        this.maxTokens = maxTokens;
    }
}
