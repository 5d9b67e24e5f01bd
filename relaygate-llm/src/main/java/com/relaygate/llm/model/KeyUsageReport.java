package com.relaygate.llm.model;

import java.time.Instant;

/**
 * Usage figures for one credential slot. {@code successRate} is a percentage.
 */
public record KeyUsageReport(
        long requests,
        long successes,
        long failures,
        int requestsThisMinute,
        boolean rateLimited,
        double weight,
        Instant lastUsed,
        double successRate
) {
}
