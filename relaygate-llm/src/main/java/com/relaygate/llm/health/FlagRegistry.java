package com.relaygate.llm.health;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Provider quarantine records with lazy expiry: a flag disappears on the first lookup after
 * its expiry, there is no sweeper thread.
 */
@Slf4j
public class FlagRegistry {

    private final Map<String, ProviderFlag> flags = new ConcurrentHashMap<>();
    private final Clock clock;

    public FlagRegistry(Clock clock) {
        this.clock = clock;
    }

    public boolean isFlagged(String provider) {
        ProviderFlag flag = flags.get(provider);
        if (flag == null) {
            return false;
        }
        if (flag.isExpired(clock.instant())) {
            if (flags.remove(provider, flag)) {
                log.info("[FLAGS] Flag expired | provider={} | reason={}", provider, flag.reason());
            }
            return false;
        }
        return true;
    }

    /** Replaces any existing flag on the provider. */
    public ProviderFlag flag(String provider, String reason, Duration duration) {
        Instant now = clock.instant();
        return flagUntil(provider, reason, now.plus(duration));
    }

    public ProviderFlag flagUntil(String provider, String reason, Instant until) {
        ProviderFlag flag = new ProviderFlag(clock.instant(), until, reason);
        flags.put(provider, flag);
        log.warn("[FLAGS] Provider flagged | provider={} | reason={} | until={}", provider, reason, until);
        return flag;
    }

    /**
     * Flags the provider for at least {@code duration}; an existing flag that already lasts
     * longer keeps its expiry and only takes the new reason.
     */
    public ProviderFlag extend(String provider, String reason, Duration duration) {
        Instant now = clock.instant();
        Instant wanted = now.plus(duration);
        ProviderFlag merged = flags.compute(provider, (id, existing) -> {
            if (existing == null || existing.isExpired(now) || existing.flagUntil().isBefore(wanted)) {
                return new ProviderFlag(now, wanted, reason);
            }
            return new ProviderFlag(existing.flaggedAt(), existing.flagUntil(), reason);
        });
        log.warn("[FLAGS] Provider flag extended | provider={} | reason={} | until={}", provider, reason, merged.flagUntil());
        return merged;
    }

    public void clear(String provider) {
        if (flags.remove(provider) != null) {
            log.info("[FLAGS] Flag cleared | provider={}", provider);
        }
    }

    public Optional<ProviderFlag> find(String provider) {
        return isFlagged(provider) ? Optional.ofNullable(flags.get(provider)) : Optional.empty();
    }

    /** Active flags only; expired entries are dropped while building the snapshot. */
    public Map<String, ProviderFlag> snapshot() {
        Map<String, ProviderFlag> active = new LinkedHashMap<>();
        for (String provider : flags.keySet()) {
            find(provider).ifPresent(flag -> active.put(provider, flag));
        }
        return active;
    }
}
