package com.relaygate.llm.keymanager;

import com.relaygate.llm.model.KeyUsageReport;
import com.relaygate.llm.registry.CredentialSlot;
import com.relaygate.llm.registry.ProviderRuntime;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Picks the least loaded, most reliable credential of a provider and keeps each slot's
 * counters, weight and per-minute window up to date.
 *
 * <p>Methods that take a {@link ProviderRuntime} without acquiring its lock expect the caller
 * to hold it; {@link #acquireCredential} and {@link #report} lock on their own.
 */
@Slf4j
public class KeyLoadBalancer {

    static final Duration RATE_LIMIT_COOLDOWN = Duration.ofSeconds(60);

    private final Clock clock;

    public KeyLoadBalancer(Clock clock) {
        this.clock = clock;
    }

    /**
     * Chooses a credential index by load score. A provider with a single credential always
     * gets index 0; an empty result means every credential is cooling down after a rate limit.
     */
    public OptionalInt selectCredential(ProviderRuntime provider) {
        List<CredentialSlot> slots = provider.getCredentials();
        if (slots.isEmpty()) {
            return OptionalInt.empty();
        }
        if (slots.size() == 1) {
            return OptionalInt.of(0);
        }

        Instant now = clock.instant();
        int best = -1;
        double bestScore = Double.MAX_VALUE;

        for (CredentialSlot slot : slots) {
            slot.pruneWindow(now);

            if (slot.isRateLimited()) {
                if (slot.getLastUsed() != null
                        && Duration.between(slot.getLastUsed(), now).compareTo(RATE_LIMIT_COOLDOWN) < 0) {
                    continue;
                }
                slot.clearRateLimited();
                log.debug("[KEYS] Rate limit cooldown over | provider={} | key=#{}",
                        provider.getId(), slot.getIndex() + 1);
            }

            double score = score(slot, now);
            if (score < bestScore) {
                bestScore = score;
                best = slot.getIndex();
            }
        }

        if (best < 0) {
            log.warn("[KEYS] No credential available, all rate limited | provider={} | keys={}",
                    provider.getId(), slots.size());
            return OptionalInt.empty();
        }
        return OptionalInt.of(best);
    }

    /** Selection and usage recording as one step under the provider lock. */
    public OptionalInt acquireCredential(ProviderRuntime provider) {
        provider.getLock().lock();
        try {
            OptionalInt index = selectCredential(provider);
            index.ifPresent(i -> recordUsage(provider, i));
            return index;
        } finally {
            provider.getLock().unlock();
        }
    }

    public void recordUsage(ProviderRuntime provider, int index) {
        provider.credential(index).recordRequest(clock.instant());
        provider.setCurrentCredentialIndex(index);
    }

    public void recordOutcome(ProviderRuntime provider, int index, boolean success, double responseSeconds) {
        CredentialSlot slot = provider.credential(index);
        Instant now = clock.instant();
        if (success) {
            slot.recordSuccess(now, responseSeconds);
        } else {
            slot.recordFailure(now, responseSeconds);
        }
    }

    public void markRateLimited(ProviderRuntime provider, int index) {
        CredentialSlot slot = provider.credential(index);
        slot.markRateLimited();
        log.info("[KEYS] Key marked rate limited | provider={} | key=#{} | masked={}",
                provider.getId(), index + 1, slot.getMaskedKey());
    }

    /**
     * Retires the credential that just failed and moves the current pointer to the next best one.
     * Returns the new index, or empty when nothing else is usable.
     */
    public OptionalInt rotate(ProviderRuntime provider, int failedIndex) {
        if (provider.getCredentials().size() <= 1) {
            return OptionalInt.empty();
        }
        markRateLimited(provider, failedIndex);
        OptionalInt next = selectCredential(provider);
        next.ifPresent(i -> {
            provider.setCurrentCredentialIndex(i);
            log.info("[KEYS] Rotated key | provider={} | from=#{} | to=#{}", provider.getId(), failedIndex + 1, i + 1);
        });
        return next;
    }

    public Map<String, KeyUsageReport> report(ProviderRuntime provider) {
        Instant now = clock.instant();
        Map<String, KeyUsageReport> report = new LinkedHashMap<>();
        provider.getLock().lock();
        try {
            for (CredentialSlot slot : provider.getCredentials()) {
                slot.pruneWindow(now);
                report.put("Key #" + (slot.getIndex() + 1), new KeyUsageReport(
                        slot.getRequests(),
                        slot.getSuccesses(),
                        slot.getFailures(),
                        slot.getRequestsInWindow(),
                        slot.isRateLimited(),
                        round(slot.getWeight()),
                        slot.getLastUsed(),
                        round(slot.getSuccessRate() * 100.0)
                ));
            }
        } finally {
            provider.getLock().unlock();
        }
        return report;
    }

    static double score(CredentialSlot slot, Instant now) {
        double recencyBonus = 1.0;
        if (slot.getLastUsed() != null) {
            double idleSeconds = Duration.between(slot.getLastUsed(), now).toMillis() / 1000.0;
            recencyBonus = Math.min(Math.max(idleSeconds, 0.0) / 60.0, 1.0);
        }
        double load = slot.getRequestsInWindow() * slot.getWeight();
        return Math.max(0.0, load - (recencyBonus + slot.getSuccessRate()));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
