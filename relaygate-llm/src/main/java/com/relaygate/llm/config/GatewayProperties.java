package com.relaygate.llm.config;

import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import com.relaygate.llm.router.EngineSettings;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings and the provider table, bound from {@code gateway.*}.
 *
 * <pre>
 * gateway.providers.groq.priority=1
 * gateway.providers.groq.format=openai
 * gateway.providers.groq.endpoint=https://api.groq.com/openai/v1/chat/completions
 * gateway.providers.groq.api-keys=${GROQ_API_KEY_1:},${GROQ_API_KEY_2:}
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
@Getter
@Setter
@Slf4j
public class GatewayProperties {

    private boolean keyRotationEnabled = true;
    private boolean providerRotationEnabled = true;
    private int consecutiveFailureLimit = EngineSettings.DEFAULT_CONSECUTIVE_FAILURE_LIMIT;
    private boolean autodecideEnabled = true;
    private ModelCacheProperties modelCache = new ModelCacheProperties();
    private Map<String, Provider> providers = new LinkedHashMap<>();

    public EngineSettings toEngineSettings() {
        if (consecutiveFailureLimit < 1) {
            throw new IllegalStateException("gateway.consecutive-failure-limit must be at least 1");
        }
        return EngineSettings.builder()
                .keyRotationEnabled(keyRotationEnabled)
                .providerRotationEnabled(providerRotationEnabled)
                .consecutiveFailureLimit(consecutiveFailureLimit)
                .autodecideEnabled(autodecideEnabled)
                .build();
    }

    public List<ProviderConfig> toProviderConfigs() {
        List<ProviderConfig> configs = new ArrayList<>();
        providers.forEach((id, provider) -> configs.add(provider.toConfig(id)));
        return configs;
    }

    @Getter
    @Setter
    public static class ModelCacheProperties {
        private int validityMinutes = 30;
        private int refreshMinutes = 30;
        private boolean autoRefresh = true;
        private boolean discoverOnStartup = true;
        /** JSON snapshot file; blank keeps the cache in memory only. */
        private String file;
    }

    @Getter
    @Setter
    public static class Provider {
        private int priority = 999;
        private String format = ProviderFormat.OPENAI.getCode();
        private String endpoint;
        private String model;
        /** Comma-separated, at most three are used. */
        private String apiKeys;
        private boolean enabled = true;
        private int timeoutSeconds = 60;
        private String modelEndpoint;
        private boolean modelEndpointAuth = true;
        private String accountId;
        private Integer maxTokens;
        private Double temperature;
        private String authType = "bearer";

        ProviderConfig toConfig(String id) {
            ProviderFormat providerFormat;
            try {
                providerFormat = ProviderFormat.fromString(format);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Provider " + id + ": " + e.getMessage(), e);
            }
            if (timeoutSeconds < 1) {
                throw new IllegalStateException("Provider " + id + ": timeout-seconds must be positive");
            }

            return ProviderConfig.builder()
                    .id(id)
                    .priority(priority)
                    .format(providerFormat)
                    .endpoint(endpoint)
                    .model(model)
                    .apiKeys(splitKeys(apiKeys))
                    .enabled(enabled)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .modelEndpoint(modelEndpoint)
                    .modelEndpointAuth(modelEndpointAuth)
                    .accountId(accountId)
                    .maxTokens(maxTokens)
                    .temperature(temperature)
                    .authType(authType)
                    .build();
        }

        private static List<String> splitKeys(String keys) {
            List<String> result = new ArrayList<>();
            if (keys == null || keys.isBlank()) {
                return result;
            }
            for (String key : keys.split(",")) {
                String trimmed = key.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
            return result;
        }
    }
}
