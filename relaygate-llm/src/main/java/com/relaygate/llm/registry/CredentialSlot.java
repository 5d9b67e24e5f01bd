package com.relaygate.llm.registry;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One API key held by a provider, addressed by its position. Not thread-safe on its own:
 * every read and write happens under the owning {@link ProviderRuntime} lock.
 */
@Getter
public class CredentialSlot {

    public static final double MIN_WEIGHT = 0.5;
    public static final double MAX_WEIGHT = 2.0;
    public static final double INITIAL_WEIGHT = 1.0;
    public static final Duration WINDOW = Duration.ofSeconds(60);

    private final int index;
    private final String apiKey;

    private long requests;
    private long successes;
    private long failures;
    private double totalResponseSeconds;
    private double weight = INITIAL_WEIGHT;
    private boolean rateLimited;
    private Instant lastUsed;

    @Getter(AccessLevel.NONE)
    private final Deque<Instant> recentRequests = new ArrayDeque<>();

    CredentialSlot(int index, String apiKey) {
        this.index = index;
        this.apiKey = apiKey;
    }

    public void recordRequest(Instant now) {
        recentRequests.addLast(now);
        requests++;
        lastUsed = now;
    }

    public void recordSuccess(Instant now, double responseSeconds) {
        successes++;
        totalResponseSeconds += responseSeconds;
        weight = Math.max(MIN_WEIGHT, weight * 0.95);
        rateLimited = false;
        lastUsed = now;
    }

    public void recordFailure(Instant now, double responseSeconds) {
        failures++;
        totalResponseSeconds += responseSeconds;
        weight = Math.min(MAX_WEIGHT, weight * 1.1);
        lastUsed = now;
    }

    public void markRateLimited() {
        rateLimited = true;
        weight = MAX_WEIGHT;
    }

    public void clearRateLimited() {
        rateLimited = false;
    }

    /** Drops request instants that fell out of the 60 second window. */
    public void pruneWindow(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!recentRequests.isEmpty() && !recentRequests.peekFirst().isAfter(cutoff)) {
            recentRequests.pollFirst();
        }
    }

    public int getRequestsInWindow() {
        return recentRequests.size();
    }

    public double getSuccessRate() {
        return requests > 0 ? (double) successes / requests : 1.0;
    }

    /** Key with everything but the last four characters masked, for logs and reports. */
    public String getMaskedKey() {
        if (apiKey == null || apiKey.length() <= 4) {
            return "****";
        }
        return "****" + apiKey.substring(apiKey.length() - 4);
    }
}
