package com.relaygate.llm.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the adapter for a provider's configured format.
 */
@Slf4j
public class FormatAdapterRegistry {

    private final Map<ProviderFormat, FormatAdapter> adapters = new EnumMap<>(ProviderFormat.class);

    public FormatAdapterRegistry(List<FormatAdapter> adapters) {
        for (FormatAdapter adapter : adapters) {
            FormatAdapter previous = this.adapters.put(adapter.getFormat(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for format " + adapter.getFormat()
                        + ": " + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
        }
        log.info("[ADAPTERS] Registered format adapters | formats={}", this.adapters.keySet());
    }

    public Optional<FormatAdapter> find(ProviderFormat format) {
        return Optional.ofNullable(format != null ? adapters.get(format) : null);
    }
}
