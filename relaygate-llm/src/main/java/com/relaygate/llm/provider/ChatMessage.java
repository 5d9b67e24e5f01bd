package com.relaygate.llm.provider;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One turn of a chat conversation.
 */
public record ChatMessage(
        @JsonProperty("role") String role,
        @JsonProperty("content") String content
) {

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    @JsonIgnore
    public boolean isUser() {
        return "user".equalsIgnoreCase(role);
    }
}
