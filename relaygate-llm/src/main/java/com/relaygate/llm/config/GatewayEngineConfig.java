package com.relaygate.llm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.benchmark.ProviderBenchmarkService;
import com.relaygate.llm.cache.ModelCache;
import com.relaygate.llm.cache.ModelDiscoveryService;
import com.relaygate.llm.health.FlagRegistry;
import com.relaygate.llm.keymanager.KeyLoadBalancer;
import com.relaygate.llm.provider.FormatAdapter;
import com.relaygate.llm.provider.FormatAdapterRegistry;
import com.relaygate.llm.registry.ProviderRegistry;
import com.relaygate.llm.router.FailoverLlmRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires one engine instance from {@link GatewayProperties}. Every piece of health state is a
 * bean owned here rather than a static registry.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GatewayEngineConfig {

    private final GatewayProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public FormatAdapterRegistry formatAdapterRegistry(List<FormatAdapter> adapters) {
        return new FormatAdapterRegistry(adapters);
    }

    @Bean
    public ProviderRegistry providerRegistry(FormatAdapterRegistry adapters) {
        if (properties.getProviders().isEmpty()) {
            log.warn("[CONFIG] No providers configured under gateway.providers - every request will fail with no_providers");
        }
        return new ProviderRegistry(properties.toProviderConfigs(), adapters);
    }

    @Bean
    public KeyLoadBalancer keyLoadBalancer(Clock clock) {
        return new KeyLoadBalancer(clock);
    }

    @Bean
    public FlagRegistry flagRegistry(Clock clock) {
        return new FlagRegistry(clock);
    }

    @Bean(destroyMethod = "stopAutoRefresh")
    public ModelCache modelCache(Clock clock, ObjectMapper objectMapper) {
        GatewayProperties.ModelCacheProperties cache = properties.getModelCache();
        if (cache.getValidityMinutes() < 1 || cache.getRefreshMinutes() < 1) {
            throw new IllegalStateException("gateway.model-cache validity and refresh minutes must be positive");
        }
        Path file = cache.getFile() != null && !cache.getFile().isBlank() ? Path.of(cache.getFile()) : null;
        return new ModelCache(clock, Duration.ofMinutes(cache.getValidityMinutes()), file, objectMapper);
    }

    @Bean
    public ModelDiscoveryService modelDiscoveryService(ProviderRegistry registry, WebClient.Builder webClientBuilder,
                                                       ObjectMapper objectMapper) {
        return new ModelDiscoveryService(registry, webClientBuilder, objectMapper);
    }

    @Bean
    public FailoverLlmRouter failoverLlmRouter(ProviderRegistry registry, FlagRegistry flagRegistry,
                                               KeyLoadBalancer keyLoadBalancer, ModelCache modelCache, Clock clock) {
        return new FailoverLlmRouter(registry, flagRegistry, keyLoadBalancer, properties.toEngineSettings(),
                modelCache, clock);
    }

    @Bean
    public ProviderBenchmarkService providerBenchmarkService(ProviderRegistry registry, FailoverLlmRouter router) {
        return new ProviderBenchmarkService(registry, router);
    }
}
