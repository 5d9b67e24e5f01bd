package com.relaygate.llm.registry;

import com.relaygate.llm.provider.FormatAdapter;
import com.relaygate.llm.provider.ProviderConfig;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable health state of one provider. Counters, credential slots and the current
 * credential pointer are guarded by {@link #getLock()}; priority and the enabled flag are
 * volatile so the candidate scan can read them without locking.
 */
@Getter
public class ProviderRuntime {

    private final ProviderConfig config;
    /** Null when no adapter speaks the configured format. */
    private final FormatAdapter adapter;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CredentialSlot> credentials;

    private volatile int priority;
    private volatile boolean enabled;

    private int consecutiveFailures;
    private int currentCredentialIndex;
    private long requests;
    private long successes;
    private long failures;
    private double totalResponseSeconds;
    private Instant lastUsed;

    public ProviderRuntime(ProviderConfig config, FormatAdapter adapter) {
        this.config = config;
        this.adapter = adapter;
        this.priority = config.getPriority();
        this.enabled = config.isEnabled();

        List<CredentialSlot> slots = new ArrayList<>();
        List<String> keys = config.getApiKeys();
        for (int i = 0; i < keys.size(); i++) {
            slots.add(new CredentialSlot(i, keys.get(i)));
        }
        this.credentials = Collections.unmodifiableList(slots);
    }

    public String getId() {
        return config.getId();
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CredentialSlot credential(int index) {
        return credentials.get(index);
    }

    public boolean hasCredentials() {
        return !credentials.isEmpty();
    }

    public void setCurrentCredentialIndex(int index) {
        this.currentCredentialIndex = index;
    }

    public int incrementConsecutiveFailures() {
        return ++consecutiveFailures;
    }

    public void resetConsecutiveFailures() {
        consecutiveFailures = 0;
    }

    public void recordAttempt(boolean success, double responseSeconds, Instant now) {
        requests++;
        totalResponseSeconds += responseSeconds;
        lastUsed = now;
        if (success) {
            successes++;
        } else {
            failures++;
        }
    }

    public double getAverageResponseSeconds() {
        return requests > 0 ? totalResponseSeconds / requests : 0.0;
    }
}
