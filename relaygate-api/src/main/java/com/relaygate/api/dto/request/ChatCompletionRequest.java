package com.relaygate.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-shaped chat completion request. {@code provider} and {@code force_provider} pick
 * an upstream explicitly; the {@code X-Preferred-Provider} header does the same.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionRequest {

    @NotEmpty(message = "At least one message is required")
    @Valid
    private List<Message> messages;

    private String model;

    private String provider;

    @JsonProperty("force_provider")
    private Boolean forceProvider = false;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {

        @NotBlank(message = "Message role is required")
        private String role;

        @NotNull(message = "Message content is required")
        private String content;
    }
}
