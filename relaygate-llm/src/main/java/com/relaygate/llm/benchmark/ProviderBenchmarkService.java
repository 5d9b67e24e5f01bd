package com.relaygate.llm.benchmark;

import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.FormatAdapter;
import com.relaygate.llm.registry.ProviderRegistry;
import com.relaygate.llm.registry.ProviderRuntime;
import com.relaygate.llm.router.FailoverLlmRouter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stress-tests every provider with a fixed prompt and can reorder priorities from the results.
 * Calls go straight to the adapters, so benchmarking leaves flags and key weights untouched.
 */
@Slf4j
public class ProviderBenchmarkService {

    static final String TEST_PROMPT = "Hello! Please respond with exactly: 'Test successful - RelayGate working!'";
    static final double PASS_THRESHOLD = 75.0;

    private final ProviderRegistry registry;
    private final FailoverLlmRouter router;

    public ProviderBenchmarkService(ProviderRegistry registry, FailoverLlmRouter router) {
        this.registry = registry;
        this.router = router;
    }

    public BenchmarkReport run(int iterations, boolean optimizePriorities) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be at least 1");
        }
        log.info("[BENCHMARK] Starting | providers={} | iterations={}", registry.size(), iterations);

        List<ProviderBenchmark> results = new ArrayList<>();
        for (ProviderRuntime provider : registry.byPriority()) {
            ProviderBenchmark result = benchmark(provider, iterations);
            results.add(result);
            log.info("[BENCHMARK] Provider tested | provider={} | passed={} | successRate={} | avgSeconds={}",
                    result.provider(), result.passed(), result.successRate(), result.averageSeconds());
        }

        int passed = (int) results.stream().filter(ProviderBenchmark::passed).count();
        double passRate = results.isEmpty() ? 0.0 : passed * 100.0 / results.size();

        List<String> order = List.of();
        if (optimizePriorities && passed > 0) {
            order = rankByScore(results);
            router.applyPriorities(order);
        }

        log.info("[BENCHMARK] Completed | tested={} | passed={} | passRate={} | prioritiesUpdated={}",
                results.size(), passed, passRate, !order.isEmpty());
        return new BenchmarkReport(results.size(), passed, passRate, !order.isEmpty(), order, results);
    }

    ProviderBenchmark benchmark(ProviderRuntime provider, int iterations) {
        FormatAdapter adapter = provider.getAdapter();
        String credential = currentCredential(provider);
        List<ChatMessage> messages = List.of(ChatMessage.user(TEST_PROMPT));

        int successes = 0;
        List<Double> times = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < iterations; i++) {
            long start = System.nanoTime();
            RequestOutcome outcome = adapter != null
                    ? Mono.defer(() -> adapter.send(provider.getConfig(), credential, messages, null))
                            .onErrorResume(e -> Mono.just(RequestOutcome.failure(ErrorKind.REQUEST_EXCEPTION,
                                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())))
                            .block()
                    : RequestOutcome.failure(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported format: " + provider.getConfig().getFormat());
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

            if (outcome != null && outcome.isSuccess()) {
                successes++;
                times.add(seconds);
            } else {
                errors.add("#" + (i + 1) + " " + (outcome != null
                        ? outcome.getErrorKind() + ": " + outcome.getErrorMessage()
                        : "no response"));
            }
        }

        double successRate = successes * 100.0 / iterations;
        double average = times.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double min = times.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = times.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        return new ProviderBenchmark(provider.getId(), iterations, successes, successRate, average, min, max,
                successRate >= PASS_THRESHOLD, score(successRate, average), errors);
    }

    private static String currentCredential(ProviderRuntime provider) {
        if (!provider.hasCredentials()) {
            return null;
        }
        provider.getLock().lock();
        try {
            return provider.credential(provider.getCurrentCredentialIndex()).getApiKey();
        } finally {
            provider.getLock().unlock();
        }
    }

    /** Success rate weighs 60 %, speed 40 %; every second of average latency costs 20 speed points. */
    static double score(double successRate, double averageSeconds) {
        double speed = Math.max(0.0, 100.0 - averageSeconds * 20.0);
        return successRate * 0.6 + speed * 0.4;
    }

    /** Passing providers, best score first. */
    static List<String> rankByScore(List<ProviderBenchmark> results) {
        return results.stream()
                .filter(ProviderBenchmark::passed)
                .sorted(Comparator.comparingDouble(ProviderBenchmark::score).reversed())
                .map(ProviderBenchmark::provider)
                .toList();
    }
}
