package com.relaygate.llm.benchmark;

import java.util.List;

public record BenchmarkReport(
        int providersTested,
        int providersPassed,
        double passRate,
        boolean prioritiesUpdated,
        List<String> newPriorityOrder,
        List<ProviderBenchmark> results
) {
}
