package com.relaygate.llm.cache;

import com.relaygate.llm.model.ModelEntry;

import java.util.List;

/**
 * Source of (provider, model) pairs for a cache refresh.
 */
@FunctionalInterface
public interface ModelDiscovery {

    List<ModelEntry> discoverModels();
}
