package com.relaygate.llm.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.model.ModelEntry;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import com.relaygate.llm.registry.ProviderRegistry;
import com.relaygate.llm.registry.ProviderRuntime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Asks every enabled provider's model listing endpoint which models it serves. A provider
 * without an endpoint, or whose listing fails, contributes its configured model.
 */
@Slf4j
public class ModelDiscoveryService implements ModelDiscovery {

    static final int MAX_CONCURRENT_DISCOVERIES = 8;

    private final ProviderRegistry registry;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ModelDiscoveryService(ProviderRegistry registry, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.registry = registry;
        this.webClient = webClientBuilder.clone().build();
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ModelEntry> discoverModels() {
        long startTime = System.currentTimeMillis();
        List<ProviderRuntime> enabled = registry.byPriority().stream()
                .filter(ProviderRuntime::isEnabled)
                .toList();
        log.info("[DISCOVERY] Discovering models | providers={}", enabled.size());

        List<ModelEntry> models = Flux.fromIterable(enabled)
                .flatMapSequential(provider -> discoverProvider(provider.getConfig())
                        .map(ids -> ids.stream().map(id -> new ModelEntry(provider.getId(), id)).toList()),
                        MAX_CONCURRENT_DISCOVERIES)
                .flatMapIterable(entries -> entries)
                .collectList()
                .block();

        log.info("[DISCOVERY] Discovery completed | models={} | durationMs={}",
                models != null ? models.size() : 0, System.currentTimeMillis() - startTime);
        return models != null ? models : List.of();
    }

    /**
     * Model ids served by one provider. Never errors; falls back to the configured model.
     */
    public Mono<List<String>> discoverProvider(ProviderConfig provider) {
        List<String> fallback = provider.getModel() != null ? List.of(provider.getModel()) : List.of();
        if (!provider.hasModelEndpoint()) {
            return Mono.just(fallback);
        }

        String credential = provider.getApiKeys().isEmpty() ? null : provider.getApiKeys().get(0);
        boolean needsKey = provider.isModelEndpointAuth() && provider.requiresAuth();
        if (needsKey && credential == null) {
            return Mono.just(fallback);
        }

        boolean keyInUrl = needsKey && provider.getFormat() == ProviderFormat.GEMINI;
        return Mono.defer(() -> webClient.get()
                .uri(listingUri(provider.getModelEndpoint(), keyInUrl ? credential : null))
                .headers(headers -> {
                    if (needsKey && !keyInUrl) {
                        headers.setBearerAuth(credential);
                    }
                })
                .retrieve()
                .bodyToMono(String.class))
                .timeout(provider.effectiveTimeout())
                .map(this::parseModelIds)
                .map(ids -> {
                    log.debug("[DISCOVERY] Provider models discovered | provider={} | models={}", provider.getId(), ids.size());
                    return ids.isEmpty() ? fallback : ids;
                })
                .defaultIfEmpty(fallback)
                .onErrorResume(e -> {
                    log.warn("[DISCOVERY] Model listing failed, using configured model | provider={} | error={}",
                            provider.getId(), e.getMessage());
                    return Mono.just(fallback);
                });
    }

    /**
     * Accepts OpenAI {@code data[].id}, a {@code models} list or object, or a bare array.
     */
    List<String> parseModelIds(String body) {
        List<String> ids = new ArrayList<>();
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("[DISCOVERY] Listing is not JSON | error={}", e.getMessage());
            return ids;
        }
        if (root == null) {
            return ids;
        }

        if (root.path("data").isArray()) {
            for (JsonNode model : root.path("data")) {
                ids.add(model.path("id").asText("unknown"));
            }
        } else if (root.has("models")) {
            JsonNode models = root.get("models");
            if (models.isArray()) {
                for (JsonNode model : models) {
                    ids.add(modelId(model));
                }
            } else if (models.isObject()) {
                Iterator<String> names = models.fieldNames();
                names.forEachRemaining(ids::add);
            }
        } else if (root.isArray()) {
            for (JsonNode model : root) {
                ids.add(modelId(model));
            }
        }
        return ids;
    }

    private static String modelId(JsonNode model) {
        if (model.isTextual()) {
            return model.asText();
        }
        if (model.hasNonNull("id")) {
            return model.get("id").asText();
        }
        if (model.hasNonNull("name")) {
            return model.get("name").asText();
        }
        return model.toString();
    }

    private static URI listingUri(String endpoint, String keyParam) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(endpoint);
        if (keyParam == null) {
            return builder.encode().build().toUri();
        }
        return builder.queryParam("key", "{key}").encode().buildAndExpand(keyParam).toUri();
    }
}
