package com.relaygate.llm.cache;

import com.relaygate.llm.model.ModelEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the discovered models. {@code cachedAt} is null for a snapshot that was
 * never filled.
 */
public record ModelSnapshot(Instant cachedAt, List<ModelEntry> models, Map<String, List<String>> providers) {

    public static final ModelSnapshot EMPTY = new ModelSnapshot(null, List.of(), Map.of());

    public ModelSnapshot {
        models = List.copyOf(models);
        providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public static ModelSnapshot of(Instant cachedAt, List<ModelEntry> models) {
        Map<String, List<String>> byProvider = new LinkedHashMap<>();
        for (ModelEntry entry : models) {
            byProvider.computeIfAbsent(entry.provider(), p -> new ArrayList<>()).add(entry.model());
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        byProvider.forEach((provider, ids) -> frozen.put(provider, List.copyOf(ids)));
        return new ModelSnapshot(cachedAt, models, frozen);
    }

    public boolean isEmpty() {
        return cachedAt == null;
    }
}
