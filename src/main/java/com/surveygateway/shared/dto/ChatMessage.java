package com.surveygateway.shared.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * One prior turn of the conversation, as sent by the widget.
 */
public class ChatMessage {

    @NotNull(message = "History role is required")
    @Pattern(regexp = "user|assistant", message = "History role must be 'user' or 'assistant'")
    private String role;

    @NotNull(message = "History content is required")
    private String content;

    public ChatMessage() {
    }

    public ChatMessage(String role, String content) {
        this.role = role;
        this.content = content;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }
}
