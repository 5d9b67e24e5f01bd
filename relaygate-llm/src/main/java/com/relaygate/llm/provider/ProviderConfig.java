package com.relaygate.llm.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Static configuration of one upstream provider. Runtime health lives in
 * {@link com.relaygate.llm.registry.ProviderRuntime}.
 */
@Value
@Builder(toBuilder = true)
public class ProviderConfig {

    public static final int MAX_CREDENTIALS = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    String id;
    int priority;
    ProviderFormat format;
    String endpoint;
    String model;
    @Singular
    List<String> apiKeys;
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;
    String modelEndpoint;
    @Builder.Default
    boolean modelEndpointAuth = true;
    String accountId;
    Integer maxTokens;
    Double temperature;
    /** "bearer" for providers that need a key, null for open endpoints. */
    String authType;

    public boolean requiresAuth() {
        return authType != null && !authType.isBlank();
    }

    public boolean hasModelEndpoint() {
        return modelEndpoint != null && !modelEndpoint.isBlank();
    }

    public Duration effectiveTimeout() {
        return timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    public String effectiveModel(String requested) {
        return requested != null && !requested.isBlank() ? requested : model;
    }
}
