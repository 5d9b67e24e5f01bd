package com.relaygate.llm.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of engine health for dashboards and health checks.
 */
public record EngineStatus(
        int totalProviders,
        int availableProviders,
        int flaggedProviders,
        String currentProvider,
        List<String> topAvailable,
        List<FlaggedProvider> flaggedList
) {

    public record FlaggedProvider(String provider, String reason, Instant flaggedAt, Instant flagUntil) {
    }
}
