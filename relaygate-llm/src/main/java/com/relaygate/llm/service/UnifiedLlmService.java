package com.relaygate.llm.service;

import com.relaygate.llm.benchmark.BenchmarkReport;
import com.relaygate.llm.benchmark.ProviderBenchmarkService;
import com.relaygate.llm.cache.ModelCache;
import com.relaygate.llm.cache.ModelDiscoveryService;
import com.relaygate.llm.config.GatewayProperties;
import com.relaygate.llm.model.CompletionRequest;
import com.relaygate.llm.model.EngineStatus;
import com.relaygate.llm.model.KeyUsageReport;
import com.relaygate.llm.model.ModelEntry;
import com.relaygate.llm.model.ProviderDescriptor;
import com.relaygate.llm.model.ProviderUsage;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.router.FailoverLlmRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Entry point for the serving layer: completions, provider controls and the model index.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnifiedLlmService {

    private final FailoverLlmRouter router;
    private final ModelCache modelCache;
    private final ModelDiscoveryService modelDiscovery;
    private final ProviderBenchmarkService benchmarkService;
    private final GatewayProperties properties;

    public RequestOutcome complete(CompletionRequest request) {
        return router.complete(request);
    }

    public Mono<RequestOutcome> completeAsync(CompletionRequest request) {
        return router.completeAsync(request);
    }

    public RequestOutcome testProvider(String providerName, String message) {
        return router.testProvider(providerName, message);
    }

    public EngineStatus getStatus() {
        return router.getStatus();
    }

    public Optional<Map<String, KeyUsageReport>> getKeyReport(String providerName) {
        return router.getKeyReport(providerName);
    }

    public List<ModelEntry> findModelProviders(String modelName) {
        return router.findModelProviders(modelName);
    }

    public List<ProviderDescriptor> listProviders() {
        return router.listProviders();
    }

    public Map<String, ProviderUsage> getUsageStats() {
        return router.getUsageStats();
    }

    public boolean setProviderEnabled(String providerName, boolean enabled) {
        return router.setProviderEnabled(providerName, enabled);
    }

    public OptionalInt rollCredential(String providerName) {
        return router.rollCredential(providerName);
    }

    public BenchmarkReport runBenchmark(int iterations, boolean optimizePriorities) {
        return benchmarkService.run(iterations, optimizePriorities);
    }

    /**
     * Cached models, discovered synchronously when the cache is empty or stale.
     */
    public List<ModelEntry> listModels() {
        if (!modelCache.isValid()) {
            log.info("[MODELS] Cache miss or expired, discovering models");
            modelCache.refresh(modelDiscovery);
        }
        return modelCache.getModels();
    }

    public boolean refreshModels() {
        return modelCache.refresh(modelDiscovery);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeModelCache() {
        GatewayProperties.ModelCacheProperties cache = properties.getModelCache();
        boolean loaded = modelCache.load();

        if (!loaded && cache.isDiscoverOnStartup()) {
            Mono.fromRunnable(() -> modelCache.refresh(modelDiscovery))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(
                            ignored -> { },
                            e -> log.error("[MODELS] Startup discovery failed | error={}", e.getMessage(), e));
        }
        if (cache.isAutoRefresh()) {
            modelCache.startAutoRefresh(modelDiscovery, Duration.ofMinutes(cache.getRefreshMinutes()));
        }
    }
}
