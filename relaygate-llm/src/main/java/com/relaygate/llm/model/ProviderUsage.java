package com.relaygate.llm.model;

import java.time.Instant;

public record ProviderUsage(
        long requests,
        long successes,
        long failures,
        int consecutiveFailures,
        double averageResponseSeconds,
        Instant lastUsed
) {
}
