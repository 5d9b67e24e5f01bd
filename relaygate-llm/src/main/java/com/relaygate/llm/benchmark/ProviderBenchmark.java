package com.relaygate.llm.benchmark;

import java.util.List;

/**
 * Result of benchmarking one provider. Latency figures cover successful calls only;
 * {@code successRate} is a percentage.
 */
public record ProviderBenchmark(
        String provider,
        int iterations,
        int successes,
        double successRate,
        double averageSeconds,
        double minSeconds,
        double maxSeconds,
        boolean passed,
        double score,
        List<String> errors
) {
}
