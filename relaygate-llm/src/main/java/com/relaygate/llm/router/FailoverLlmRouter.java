package com.relaygate.llm.router;

import com.relaygate.llm.cache.ModelCache;
import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.health.FlagRegistry;
import com.relaygate.llm.health.ProviderFlag;
import com.relaygate.llm.health.RemediationPolicy;
import com.relaygate.llm.keymanager.KeyLoadBalancer;
import com.relaygate.llm.model.CompletionRequest;
import com.relaygate.llm.model.EngineStatus;
import com.relaygate.llm.model.KeyUsageReport;
import com.relaygate.llm.model.ModelEntry;
import com.relaygate.llm.model.ProviderDescriptor;
import com.relaygate.llm.model.ProviderUsage;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.provider.ChatMessage;
import com.relaygate.llm.provider.FormatAdapter;
import com.relaygate.llm.registry.ProviderRegistry;
import com.relaygate.llm.registry.ProviderRuntime;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Rotation and failover engine. Tries eligible providers one after another in priority order
 * and returns the first success; every failure feeds the remediation policy before the next
 * candidate is tried.
 *
 * <p>Health state lives in the registry, flag registry and credential slots owned by this
 * instance. Provider locks are only held to read or update that state, never while a call is
 * in flight.</p>
 */
@Slf4j
public class FailoverLlmRouter {

    static final int TOP_AVAILABLE_LIMIT = 5;
    private static final int ERROR_PREVIEW_LENGTH = 200;
    private static final DateTimeFormatter RETRY_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final ProviderRegistry registry;
    private final FlagRegistry flags;
    private final KeyLoadBalancer balancer;
    private final RemediationPolicy remediation;
    @Getter
    private final EngineSettings settings;
    private final ModelCache modelCache;
    private final Clock clock;

    private final AtomicLong requestCounter = new AtomicLong();
    private volatile String currentProvider;

    public FailoverLlmRouter(ProviderRegistry registry, FlagRegistry flags, KeyLoadBalancer balancer,
                             EngineSettings settings, ModelCache modelCache, Clock clock) {
        this.registry = registry;
        this.flags = flags;
        this.balancer = balancer;
        this.settings = settings;
        this.modelCache = modelCache;
        this.clock = clock;
        this.remediation = new RemediationPolicy(flags, balancer, settings, clock);

        log.info("[ROUTER] Initialized | providers={} | keyRotation={} | providerRotation={} | failureLimit={} | autodecide={}",
                registry.size(), settings.isKeyRotationEnabled(), settings.isProviderRotationEnabled(),
                settings.getConsecutiveFailureLimit(), settings.isAutodecideEnabled());
    }

    public RequestOutcome complete(CompletionRequest request) {
        return completeAsync(request).block();
    }

    /**
     * Non-blocking variant of {@link #complete}. Disposing the subscription abandons the
     * in-flight attempt; an abandoned attempt is recorded neither as success nor as failure.
     */
    public Mono<RequestOutcome> completeAsync(CompletionRequest request) {
        return Mono.defer(() -> {
            String requestId = "req-" + requestCounter.incrementAndGet();
            long requestStart = System.nanoTime();

            log.info("[ROUTER] Starting LLM request | requestId={} | messages={} | model={} | preferred={} | force={}",
                    requestId, request.getMessages().size(), request.hasModel() ? request.getModel() : "default",
                    request.getPreferredProvider(), request.isForceProvider());

            Plan plan = plan(request, requestId);
            if (plan.rejection() != null) {
                log.warn("[ROUTER] Request rejected | requestId={} | kind={} | error={}",
                        requestId, plan.rejection().getErrorKind(), plan.rejection().getErrorMessage());
                return Mono.just(plan.rejection());
            }

            List<Candidate> candidates = plan.candidates();
            List<String> failures = new ArrayList<>();
            RequestOutcome[] lastFailure = new RequestOutcome[1];

            return Flux.fromIterable(candidates)
                    .concatMap(candidate -> attempt(candidate, request.getMessages(), requestId)
                            .doOnNext(outcome -> {
                                if (!outcome.isSuccess()) {
                                    lastFailure[0] = outcome;
                                    failures.add(candidate.provider().getId() + " [" + outcome.getErrorKind() + "] "
                                            + preview(outcome.getErrorMessage()));
                                }
                            }), 1)
                    .filter(RequestOutcome::isSuccess)
                    .next()
                    .doOnNext(outcome -> log.info("[ROUTER] Request succeeded | requestId={} | provider={} | attempts={} | totalDurationMs={}",
                            requestId, outcome.getProviderUsed(), failures.size() + 1, elapsedMillis(requestStart)))
                    .switchIfEmpty(Mono.fromSupplier(() -> {
                        log.error("[ROUTER] All providers failed | requestId={} | attempted={} | totalDurationMs={}",
                                requestId, candidates.size(), elapsedMillis(requestStart));
                        return allFailed(failures, lastFailure[0]);
                    }));
        });
    }

    /**
     * Sends one message to a single provider, skipping priority ordering. The provider's flag
     * state still applies and the outcome updates its health like any other attempt.
     */
    public RequestOutcome testProvider(String providerName, String message) {
        Optional<ProviderRuntime> found = registry.find(providerName);
        if (found.isEmpty()) {
            return RequestOutcome.failure(ErrorKind.PROVIDER_NOT_FOUND, notFoundMessage(providerName));
        }
        ProviderRuntime provider = found.get();
        Optional<ProviderFlag> flag = flags.find(provider.getId());
        if (flag.isPresent()) {
            return RequestOutcome.failure(ErrorKind.PROVIDER_FLAGGED, flaggedMessage(provider.getId(), flag.get()));
        }

        String text = message != null && !message.isBlank()
                ? message
                : "Hello! Please respond with: '" + provider.getId() + " test successful!'";
        String requestId = "test-" + requestCounter.incrementAndGet();
        log.info("[ROUTER] Testing provider | requestId={} | provider={}", requestId, provider.getId());

        return attempt(new Candidate(provider, null), List.of(ChatMessage.user(text)), requestId).block();
    }

    public EngineStatus getStatus() {
        List<ProviderRuntime> available = eligibleByPriority();
        Map<String, ProviderFlag> active = flags.snapshot();

        List<EngineStatus.FlaggedProvider> flagged = active.entrySet().stream()
                .map(e -> new EngineStatus.FlaggedProvider(e.getKey(), e.getValue().reason(),
                        e.getValue().flaggedAt(), e.getValue().flagUntil()))
                .toList();

        return new EngineStatus(
                registry.size(),
                available.size(),
                active.size(),
                currentProvider,
                available.stream().limit(TOP_AVAILABLE_LIMIT).map(ProviderRuntime::getId).toList(),
                flagged);
    }

    public Optional<Map<String, KeyUsageReport>> getKeyReport(String providerName) {
        return registry.find(providerName).map(balancer::report);
    }

    public List<ModelEntry> findModelProviders(String modelName) {
        return modelCache != null ? modelCache.findProviders(modelName) : List.of();
    }

    public List<ProviderDescriptor> listProviders() {
        return registry.byPriority().stream()
                .map(p -> new ProviderDescriptor(
                        p.getId(),
                        p.getPriority(),
                        p.getConfig().getFormat().getCode(),
                        p.getConfig().getModel(),
                        p.isEnabled(),
                        flags.isFlagged(p.getId()),
                        p.getCredentials().size(),
                        p.getConfig().requiresAuth(),
                        p.getConfig().hasModelEndpoint()))
                .toList();
    }

    public Map<String, ProviderUsage> getUsageStats() {
        Map<String, ProviderUsage> stats = new LinkedHashMap<>();
        for (ProviderRuntime provider : registry.byPriority()) {
            provider.getLock().lock();
            try {
                stats.put(provider.getId(), new ProviderUsage(
                        provider.getRequests(),
                        provider.getSuccesses(),
                        provider.getFailures(),
                        provider.getConsecutiveFailures(),
                        provider.getAverageResponseSeconds(),
                        provider.getLastUsed()));
            } finally {
                provider.getLock().unlock();
            }
        }
        return stats;
    }

    /**
     * @return false if no such provider exists
     */
    public boolean setProviderEnabled(String providerName, boolean enabled) {
        Optional<ProviderRuntime> provider = registry.find(providerName);
        provider.ifPresent(p -> {
            p.setEnabled(enabled);
            log.info("[ROUTER] Provider {} | provider={}", enabled ? "enabled" : "disabled", p.getId());
        });
        return provider.isPresent();
    }

    /**
     * Retires the provider's current credential and moves to the next best one.
     *
     * @return the new credential index, empty if the provider is unknown or cannot rotate
     */
    public OptionalInt rollCredential(String providerName) {
        Optional<ProviderRuntime> found = registry.find(providerName);
        if (found.isEmpty()) {
            return OptionalInt.empty();
        }
        ProviderRuntime provider = found.get();
        provider.getLock().lock();
        try {
            return balancer.rotate(provider, provider.getCurrentCredentialIndex());
        } finally {
            provider.getLock().unlock();
        }
    }

    /**
     * Gives the listed providers priorities 1..n in list order. Unknown ids are ignored.
     */
    public void applyPriorities(List<String> orderedProviderIds) {
        int priority = 1;
        for (String id : orderedProviderIds) {
            Optional<ProviderRuntime> provider = registry.find(id);
            if (provider.isPresent()) {
                provider.get().setPriority(priority);
                log.info("[ROUTER] Priority updated | provider={} | priority={}", provider.get().getId(), priority);
                priority++;
            }
        }
    }

    private Plan plan(CompletionRequest request, String requestId) {
        if (request.isForceProvider() && request.hasPreferredProvider()) {
            return forcedPlan(request);
        }

        List<ProviderRuntime> eligible = eligibleByPriority();
        List<Candidate> candidates = new ArrayList<>();

        Map<String, String> discovered = request.hasModel() ? autodecide(request.getModel(), eligible) : Map.of();
        if (!discovered.isEmpty()) {
            log.info("[ROUTER] Autodecide matched providers | requestId={} | model={} | providers={}",
                    requestId, request.getModel(), discovered.keySet());
            for (ProviderRuntime provider : eligible) {
                if (discovered.containsKey(provider.getId())) {
                    candidates.add(new Candidate(provider, discovered.get(provider.getId())));
                }
            }
        } else {
            for (ProviderRuntime provider : eligible) {
                candidates.add(new Candidate(provider, request.getModel()));
            }
        }

        if (request.hasPreferredProvider()) {
            moveToFront(candidates, request.getPreferredProvider(), requestId);
        }

        if (!settings.isProviderRotationEnabled() && candidates.size() > 1) {
            candidates = List.of(candidates.get(0));
        }

        if (candidates.isEmpty()) {
            return Plan.rejected(RequestOutcome.failure(ErrorKind.NO_PROVIDERS, "No available providers"));
        }

        log.debug("[ROUTER] Candidates | requestId={} | order={}", requestId,
                candidates.stream().map(c -> c.provider().getId()).collect(Collectors.joining(",")));
        return Plan.of(candidates);
    }

    private Plan forcedPlan(CompletionRequest request) {
        String name = request.getPreferredProvider();
        Optional<ProviderRuntime> found = registry.find(name);
        if (found.isEmpty()) {
            return Plan.rejected(RequestOutcome.failure(ErrorKind.PROVIDER_NOT_FOUND, notFoundMessage(name)));
        }
        ProviderRuntime provider = found.get();
        if (!provider.isEnabled()) {
            return Plan.rejected(RequestOutcome.failure(ErrorKind.NO_PROVIDERS,
                    "Provider '" + provider.getId() + "' is disabled"));
        }
        Optional<ProviderFlag> flag = flags.find(provider.getId());
        if (flag.isPresent()) {
            return Plan.rejected(RequestOutcome.failure(ErrorKind.PROVIDER_FLAGGED, flaggedMessage(provider.getId(), flag.get())));
        }
        return Plan.of(List.of(new Candidate(provider, request.getModel())));
    }

    /**
     * Provider id to discovered model id for every eligible provider serving the requested
     * model. Empty when autodecide is off or nothing matches, in which case the model is
     * passed through unchanged.
     */
    private Map<String, String> autodecide(String model, List<ProviderRuntime> eligible) {
        if (!settings.isAutodecideEnabled() || modelCache == null) {
            return Map.of();
        }
        List<String> eligibleIds = eligible.stream().map(ProviderRuntime::getId).toList();
        Map<String, String> matches = new LinkedHashMap<>();
        for (ModelEntry entry : modelCache.findProviders(model)) {
            if (eligibleIds.contains(entry.provider())) {
                matches.putIfAbsent(entry.provider(), entry.model());
            }
        }
        return matches;
    }

    private void moveToFront(List<Candidate> candidates, String preferred, String requestId) {
        for (int i = 0; i < candidates.size(); i++) {
            if (candidates.get(i).provider().getId().equalsIgnoreCase(preferred)) {
                candidates.add(0, candidates.remove(i));
                return;
            }
        }
        log.info("[ROUTER] Preferred provider not eligible, using priority order | requestId={} | preferred={}",
                requestId, preferred);
    }

    private List<ProviderRuntime> eligibleByPriority() {
        return registry.byPriority().stream()
                .filter(ProviderRuntime::isEnabled)
                .filter(p -> !flags.isFlagged(p.getId()))
                .toList();
    }

    /**
     * One provider attempt: credential selection, dispatch, then the outcome is applied to
     * health state. Emits exactly one outcome unless cancelled.
     */
    private Mono<RequestOutcome> attempt(Candidate candidate, List<ChatMessage> messages, String requestId) {
        return Mono.defer(() -> {
            ProviderRuntime provider = candidate.provider();
            String id = provider.getId();

            FormatAdapter adapter = provider.getAdapter();
            if (adapter == null) {
                return Mono.just(tagged(RequestOutcome.failure(ErrorKind.UNSUPPORTED_FORMAT,
                        "Unsupported format: " + provider.getConfig().getFormat()), id));
            }

            int credentialIndex = -1;
            String credential = null;
            if (provider.hasCredentials()) {
                OptionalInt selected = balancer.acquireCredential(provider);
                if (selected.isEmpty()) {
                    log.warn("[ROUTER] Skipping provider, every key is cooling down | requestId={} | provider={}", requestId, id);
                    return Mono.just(tagged(RequestOutcome.failure(ErrorKind.RATE_LIMIT,
                            "All API keys of " + id + " are rate limited"), id));
                }
                credentialIndex = selected.getAsInt();
                credential = provider.credential(credentialIndex).getApiKey();
            }

            int keyIndex = credentialIndex;
            String selectedCredential = credential;
            String model = provider.getConfig().effectiveModel(candidate.model());
            log.info("[ROUTER] Attempting provider | requestId={} | provider={} | priority={} | key=#{} | model={}",
                    requestId, id, provider.getPriority(), keyIndex + 1, model);

            long start = System.nanoTime();
            return Mono.defer(() -> adapter.send(provider.getConfig(), selectedCredential, messages, model))
                    .onErrorResume(e -> Mono.just(RequestOutcome.failure(ErrorKind.REQUEST_EXCEPTION,
                            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())))
                    .defaultIfEmpty(RequestOutcome.failure(ErrorKind.EMPTY_RESPONSE, "Empty response from " + id))
                    .map(outcome -> {
                        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
                        RequestOutcome timed = outcome.toBuilder()
                                .responseTimeSeconds(seconds)
                                .providerUsed(id)
                                .modelUsed(outcome.getModelUsed() != null ? outcome.getModelUsed() : model)
                                .build();
                        if (timed.isSuccess()) {
                            remediation.onSuccess(provider, keyIndex, seconds);
                            currentProvider = id;
                        } else {
                            ErrorKind kind = remediation.onFailure(provider, keyIndex, timed);
                            log.warn("[ROUTER] Provider request failed | requestId={} | provider={} | statusCode={} | kind={} | classifiedAs={} | durationMs={} | error={}",
                                    requestId, id, timed.getStatusCode(), timed.getErrorKind(), kind,
                                    Math.round(seconds * 1000), preview(timed.getErrorMessage()));
                        }
                        return timed;
                    })
                    .doOnCancel(() -> log.info("[ROUTER] Attempt cancelled | requestId={} | provider={}", requestId, id));
        });
    }

    private RequestOutcome allFailed(List<String> failures, RequestOutcome last) {
        String message = "All providers failed: " + String.join("; ", failures);
        RequestOutcome.RequestOutcomeBuilder builder = RequestOutcome.builder()
                .success(false)
                .errorKind(ErrorKind.ALL_FAILED)
                .errorMessage(message);
        if (last != null) {
            builder.statusCode(last.getStatusCode()).rawResponse(last.getRawResponse());
        }
        return builder.build();
    }

    private String notFoundMessage(String name) {
        return "Provider '" + name + "' not found. Available providers: " + String.join(", ", registry.ids());
    }

    private String flaggedMessage(String id, ProviderFlag flag) {
        ZoneId zone = clock.getZone();
        LocalTime until = flag.flagUntil().atZone(zone).toLocalTime();
        return "Provider '" + id + "' is currently flagged due to " + flag.reason()
                + ". Retry available at " + RETRY_TIME.format(until);
    }

    private static RequestOutcome tagged(RequestOutcome outcome, String providerId) {
        return outcome.toBuilder().providerUsed(providerId).build();
    }

    private static String preview(String message) {
        if (message == null) {
            return "";
        }
        return message.length() > ERROR_PREVIEW_LENGTH ? message.substring(0, ERROR_PREVIEW_LENGTH) + "..." : message;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private record Candidate(ProviderRuntime provider, String model) {
    }

    private record Plan(List<Candidate> candidates, RequestOutcome rejection) {

        static Plan of(List<Candidate> candidates) {
            return new Plan(candidates, null);
        }

        static Plan rejected(RequestOutcome outcome) {
            return new Plan(List.of(), outcome);
        }
    }
}
