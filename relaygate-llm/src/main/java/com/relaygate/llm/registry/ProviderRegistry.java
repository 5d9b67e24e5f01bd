package com.relaygate.llm.registry;

import com.relaygate.llm.provider.FormatAdapter;
import com.relaygate.llm.provider.FormatAdapterRegistry;
import com.relaygate.llm.provider.ProviderConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every provider's runtime state for one engine instance. Built once from configuration;
 * providers are never added or removed afterwards.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderRuntime> providers = new LinkedHashMap<>();

    public ProviderRegistry(List<ProviderConfig> configs, FormatAdapterRegistry adapters) {
        for (ProviderConfig raw : configs) {
            validate(raw);
            if (providers.containsKey(raw.getId())) {
                throw new IllegalStateException("Duplicate provider id: " + raw.getId());
            }

            ProviderConfig config = withValidCredentials(raw);
            if (config.requiresAuth() && config.getApiKeys().isEmpty()) {
                log.warn("[REGISTRY] Provider skipped - no valid API keys | provider={}", config.getId());
                continue;
            }

            FormatAdapter adapter = adapters.find(config.getFormat()).orElse(null);
            if (adapter == null) {
                log.warn("[REGISTRY] No adapter for format | provider={} | format={}", config.getId(), config.getFormat());
            }

            providers.put(config.getId(), new ProviderRuntime(config, adapter));
            log.info("[REGISTRY] Provider registered | provider={} | priority={} | format={} | keys={} | enabled={} | model={}",
                    config.getId(), config.getPriority(), config.getFormat(), config.getApiKeys().size(),
                    config.isEnabled(), config.getModel());
        }
        log.info("[REGISTRY] Loaded {} providers out of {} configured", providers.size(), configs.size());
    }

    public List<ProviderRuntime> all() {
        return Collections.unmodifiableList(new ArrayList<>(providers.values()));
    }

    public List<ProviderRuntime> byPriority() {
        List<ProviderRuntime> sorted = new ArrayList<>(providers.values());
        sorted.sort(Comparator.comparingInt(ProviderRuntime::getPriority));
        return sorted;
    }

    public Optional<ProviderRuntime> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        ProviderRuntime exact = providers.get(id);
        if (exact != null) {
            return Optional.of(exact);
        }
        String wanted = id.toLowerCase(Locale.ROOT);
        return providers.values().stream()
                .filter(p -> p.getId().toLowerCase(Locale.ROOT).equals(wanted))
                .findFirst();
    }

    public List<String> ids() {
        return new ArrayList<>(providers.keySet());
    }

    public int size() {
        return providers.size();
    }

    private static void validate(ProviderConfig config) {
        if (config.getId() == null || config.getId().isBlank()) {
            throw new IllegalStateException("Provider without id in configuration");
        }
        if (config.getFormat() == null) {
            throw new IllegalStateException("Provider " + config.getId() + " has no format");
        }
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            throw new IllegalStateException("Provider " + config.getId() + " has no endpoint");
        }
    }

    private static ProviderConfig withValidCredentials(ProviderConfig config) {
        List<String> valid = new ArrayList<>();
        for (String key : config.getApiKeys()) {
            if (key != null && !key.isBlank()) {
                valid.add(key.trim());
            }
        }
        if (valid.size() > ProviderConfig.MAX_CREDENTIALS) {
            log.warn("[REGISTRY] Too many API keys, keeping the first {} | provider={} | configured={}",
                    ProviderConfig.MAX_CREDENTIALS, config.getId(), valid.size());
            valid = new ArrayList<>(valid.subList(0, ProviderConfig.MAX_CREDENTIALS));
        }
        return config.toBuilder().clearApiKeys().apiKeys(valid).build();
    }
}
