package com.surveygateway.shared.dto;

/**
 * DTO for a successful chat turn: the upstream's generated text, unmodified.
 */
public class ChatResponse {

    private String text;

    public ChatResponse() {
    }

    public ChatResponse(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
