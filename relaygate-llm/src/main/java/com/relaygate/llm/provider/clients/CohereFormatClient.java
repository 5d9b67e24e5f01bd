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
 * Cohere v2 chat: message array, lowercase {@code authorization: bearer} header,
 * text at {@code message.content[0].text}.
 */
@Component
public class CohereFormatClient extends AbstractFormatClient {

    public CohereFormatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
    }

    @Override
    public ProviderFormat getFormat() {
        return ProviderFormat.COHERE;
    }

    @Override
    public Mono<RequestOutcome> send(ProviderConfig provider, String credential, List<ChatMessage> messages, String model) {
        String effectiveModel = provider.effectiveModel(model);
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", effectiveModel);
        request.put("messages", messages);

        return exchange(provider, effectiveModel, () -> webClient.post()
                .uri(provider.getEndpoint())
                .headers(headers -> {
                    if (credential != null) {
                        headers.set("authorization", "bearer " + credential);
                    }
                })
                .bodyValue(request)
                .retrieve()
                .toEntity(String.class));
    }

    @Override
    protected String extractContent(JsonNode root) {
        return root.path("message").path("content").path(0).path("text").asText("");
    }
}
