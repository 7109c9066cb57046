package com.bko.conductor.orchestration.model;

public record ConversationMessage(
        String role,
        String content
) {
    public boolean isUser() {
        return "user".equalsIgnoreCase(role);
    }

    public boolean isAssistant() {
        return "assistant".equalsIgnoreCase(role);
    }
}
