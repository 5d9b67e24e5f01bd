package com.relaygate.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat completions: bearer token, JSON body, text at
 * {@code choices[0].message.content}.
 */
@Component
public class OpenAiFormatClient extends AbstractFormatClient {

    public OpenAiFormatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
    }

    @Override
    public ProviderFormat getFormat() {
        return ProviderFormat.OPENAI;
    }

    @Override
    public Mono<RequestOutcome> send(ProviderConfig provider, String credential, List<ChatMessage> messages, String model) {
        String effectiveModel = provider.effectiveModel(model);
        Map<String, Object> request = chatBody(provider, effectiveModel, messages);

        return exchange(provider, effectiveModel, () -> webClient.post()
                .uri(provider.getEndpoint())
                .headers(headers -> {
                    if (credential != null) {
                        headers.set("Authorization", bearer(credential));
                    }
                })
                .bodyValue(request)
                .retrieve()
                .toEntity(String.class));
    }

    @Override
    protected String extractContent(JsonNode root) {
        return root.path("choices").path(0).path("message").path("content").asText("");
    }

    static Map<String, Object> chatBody(ProviderConfig provider, String model, List<ChatMessage> messages) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", messages);
        if (provider.getMaxTokens() != null) {
            request.put("max_tokens", provider.getMaxTokens());
        }
        if (provider.getTemperature() != null) {
            request.put("temperature", provider.getTemperature());
        }
        return request;
    }
}
