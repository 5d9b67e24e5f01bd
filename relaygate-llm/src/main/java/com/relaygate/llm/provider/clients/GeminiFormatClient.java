package com.relaygate.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini generateContent: the key travels as a {@code key} query parameter and only
 * user turns are sent, as text parts. An endpoint may carry a {@code {model}} placeholder.
 */
@Component
public class GeminiFormatClient extends AbstractFormatClient {

    public GeminiFormatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
    }

    @Override
    public ProviderFormat getFormat() {
        return ProviderFormat.GEMINI;
    }

    @Override
    public Mono<RequestOutcome> send(ProviderConfig provider, String credential, List<ChatMessage> messages, String model) {
        String effectiveModel = provider.effectiveModel(model);

        List<Map<String, String>> parts = messages.stream()
                .filter(ChatMessage::isUser)
                .map(message -> Map.of("text", message.content() != null ? message.content() : ""))
                .toList();

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("contents", List.of(Map.of("parts", parts)));
        Map<String, Object> generationConfig = new LinkedHashMap<>();
        if (provider.getMaxTokens() != null) {
            generationConfig.put("maxOutputTokens", provider.getMaxTokens());
        }
        if (provider.getTemperature() != null) {
            generationConfig.put("temperature", provider.getTemperature());
        }
        if (!generationConfig.isEmpty()) {
            request.put("generationConfig", generationConfig);
        }

        return exchange(provider, effectiveModel, () -> webClient.post()
                .uri(buildUri(provider.getEndpoint(), effectiveModel, credential))
                .bodyValue(request)
                .retrieve()
                .toEntity(String.class));
    }

    @Override
    protected String extractContent(JsonNode root) {
        return root.path("candidates").path(0).path("content").path("parts").path(0).path("text").asText("");
    }

    static URI buildUri(String endpoint, String model, String credential) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("model", model);
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoint);
        if (credential != null) {
            builder.queryParam("key", "{key}");
            variables.put("key", credential);
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }
}
