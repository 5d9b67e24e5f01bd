package com.relaygate.llm.provider.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Cloudflare Workers AI: the endpoint carries an {@code {account_id}} placeholder.
 * Missing account ids fail fast without touching the network.
 */
@Component
@Slf4j
public class CloudflareFormatClient extends AbstractFormatClient {

    static final String ACCOUNT_PLACEHOLDER = "{account_id}";
    static final String MODEL_PLACEHOLDER = "{model}";

    public CloudflareFormatClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(webClientBuilder, objectMapper);
    }

    @Override
    public ProviderFormat getFormat() {
        return ProviderFormat.CLOUDFLARE;
    }

    @Override
    public Mono<RequestOutcome> send(ProviderConfig provider, String credential, List<ChatMessage> messages, String model) {
        String effectiveModel = provider.effectiveModel(model);

        if (provider.getAccountId() == null || provider.getAccountId().isBlank()) {
            log.warn("[CLOUDFLARE] Account id not configured | provider={}", provider.getId());
            return Mono.just(RequestOutcome.failure(ErrorKind.CONFIG_ERROR,
                    "Cloudflare account_id not configured for " + provider.getId()).toBuilder()
                    .providerUsed(provider.getId())
                    .modelUsed(effectiveModel)
                    .build());
        }

        if (effectiveModel == null || effectiveModel.isBlank()) {
            log.warn("[CLOUDFLARE] Model not configured | provider={}", provider.getId());
            return Mono.just(RequestOutcome.failure(ErrorKind.CONFIG_ERROR,
                    "Cloudflare model not configured for " + provider.getId()).toBuilder()
                    .providerUsed(provider.getId())
                    .build());
        }

        String url = provider.getEndpoint()
                .replace(ACCOUNT_PLACEHOLDER, provider.getAccountId())
                .replace(MODEL_PLACEHOLDER, effectiveModel);
        Map<String, Object> request = OpenAiFormatClient.chatBody(provider, effectiveModel, messages);

        return exchange(provider, effectiveModel, () -> webClient.post()
                .uri(url)
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
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isEmpty()) {
            // native Workers AI envelope
            content = root.path("result").path("response").asText("");
        }
        return content;
    }
}
