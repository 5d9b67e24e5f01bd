package com.relaygate.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Open GET endpoints that take the last message as the {@code user} query value.
 * The body is either an OpenAI-shaped JSON envelope or plain text.
 */
@Component
public class QueryGetFormatClient extends AbstractFormatClient {

    public QueryGetFormatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
    }

    @Override
    public ProviderFormat getFormat() {
        return ProviderFormat.QUERY_GET;
    }

    @Override
    public Mono<RequestOutcome> send(ProviderConfig provider, String credential, List<ChatMessage> messages, String model) {
        String effectiveModel = provider.effectiveModel(model);
        String userMessage = messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();

        URI uri = UriComponentsBuilder.fromUriString(provider.getEndpoint())
                .queryParam("user", "{user}")
                .queryParam("model", "{model}")
                .encode()
                .buildAndExpand(userMessage, effectiveModel)
                .toUri();

        return exchange(provider, effectiveModel, () -> webClient.get()
                .uri(uri)
                .retrieve()
                .toEntity(String.class));
    }

    @Override
    protected RequestOutcome toOutcome(ProviderConfig provider, int status, String body) {
        JsonNode root = readJson(body);
        if (root != null && root.isContainerNode()) {
            return contentOutcome(provider, status, extractContent(root), root);
        }
        return contentOutcome(provider, status, body, TextNode.valueOf(body));
    }

    @Override
    protected String extractContent(JsonNode root) {
        return root.path("choices").path(0).path("message").path("content").asText("");
    }
}
