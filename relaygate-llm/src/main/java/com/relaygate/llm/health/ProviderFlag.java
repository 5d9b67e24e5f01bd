package com.relaygate.llm.health;

import java.time.Instant;

/**
 * Quarantine record for a provider. {@code reason} is an error kind code or
 * {@code consecutive_failures}.
 */
public record ProviderFlag(Instant flaggedAt, Instant flagUntil, String reason) {

    public boolean isExpired(Instant now) {
        return now.isAfter(flagUntil);
    }
}
