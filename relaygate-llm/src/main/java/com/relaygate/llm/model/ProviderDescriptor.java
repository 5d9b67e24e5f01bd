package com.relaygate.llm.model;

/**
 * Provider listing entry for dashboards. Never carries credentials.
 */
public record ProviderDescriptor(
        String id,
        int priority,
        String format,
        String model,
        boolean enabled,
        boolean flagged,
        int keyCount,
        boolean requiresAuth,
        boolean modelDiscovery
) {
}
