package com.relaygate.llm.health;

import com.relaygate.llm.classifier.ErrorClassifier;
import com.relaygate.llm.classifier.ErrorKind;
import com.relaygate.llm.keymanager.KeyLoadBalancer;
import com.relaygate.llm.model.RequestOutcome;
import com.relaygate.llm.registry.ProviderRuntime;
import com.relaygate.llm.router.EngineSettings;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * Applies the outcome of one provider attempt to shared health state: credential counters,
 * provider counters, the consecutive failure count, key rotation and provider flags.
 * Each call is one critical section under the provider lock.
 */
@Slf4j
public class RemediationPolicy {

    public static final String CONSECUTIVE_FAILURES = "consecutive_failures";

    static final Duration CREDENTIAL_ERROR_FLAG = Duration.ofHours(1);
    static final Duration QUOTA_FLAG = Duration.ofMinutes(30);
    static final Duration NO_ROTATION_FLAG = Duration.ofMinutes(15);
    static final Duration OUTAGE_FLAG = Duration.ofMinutes(10);
    static final Duration CONSECUTIVE_FAILURE_FLAG = Duration.ofMinutes(30);
    static final int UNKNOWN_ROTATION_THRESHOLD = 2;

    private final FlagRegistry flags;
    private final KeyLoadBalancer balancer;
    private final EngineSettings settings;
    private final Clock clock;

    public RemediationPolicy(FlagRegistry flags, KeyLoadBalancer balancer, EngineSettings settings, Clock clock) {
        this.flags = flags;
        this.balancer = balancer;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Records a success: the provider's flag is lifted and its failure streak reset.
     *
     * @param credentialIndex slot used for the attempt, or -1 for providers without keys
     */
    public void onSuccess(ProviderRuntime provider, int credentialIndex, double responseSeconds) {
        provider.getLock().lock();
        try {
            if (credentialIndex >= 0) {
                balancer.recordOutcome(provider, credentialIndex, true, responseSeconds);
            }
            provider.recordAttempt(true, responseSeconds, clock.instant());
            provider.resetConsecutiveFailures();
        } finally {
            provider.getLock().unlock();
        }
        flags.clear(provider.getId());
    }

    /**
     * Classifies a failed attempt and applies the matching remediation.
     *
     * @return the kind the remediation was based on
     */
    public ErrorKind onFailure(ProviderRuntime provider, int credentialIndex, RequestOutcome outcome) {
        ErrorKind kind = remediationKind(outcome);
        String id = provider.getId();

        provider.getLock().lock();
        try {
            double seconds = outcome.getResponseTimeSeconds();
            if (credentialIndex >= 0) {
                balancer.recordOutcome(provider, credentialIndex, false, seconds);
            }
            provider.recordAttempt(false, seconds, clock.instant());
            int failures = provider.incrementConsecutiveFailures();
            boolean limitReached = failures >= settings.getConsecutiveFailureLimit();

            log.warn("[REMEDIATION] Provider failure | provider={} | kind={} | statusCode={} | consecutiveFailures={} | key=#{}",
                    id, kind, outcome.getStatusCode(), failures, credentialIndex + 1);

            if (kind.isCredentialLevel()) {
                handleCredentialError(provider, credentialIndex, kind);
            } else if (kind.isProviderOutage()) {
                flags.flag(id, kind.code(), OUTAGE_FLAG);
            } else if (kind == ErrorKind.UNKNOWN && !limitReached && failures >= UNKNOWN_ROTATION_THRESHOLD
                    && settings.isKeyRotationEnabled() && credentialIndex >= 0) {
                balancer.rotate(provider, credentialIndex);
            }

            if (limitReached) {
                log.warn("[REMEDIATION] Consecutive failure limit reached | provider={} | failures={} | limit={}",
                        id, failures, settings.getConsecutiveFailureLimit());
                flags.extend(id, CONSECUTIVE_FAILURES, CONSECUTIVE_FAILURE_FLAG);
            }
        } finally {
            provider.getLock().unlock();
        }
        return kind;
    }

    private void handleCredentialError(ProviderRuntime provider, int credentialIndex, ErrorKind kind) {
        String id = provider.getId();
        if (!settings.isKeyRotationEnabled()) {
            flags.flag(id, kind.code(), NO_ROTATION_FLAG);
            return;
        }

        if (credentialIndex >= 0 && provider.getCredentials().size() > 1) {
            balancer.rotate(provider, credentialIndex);
        } else if (credentialIndex >= 0) {
            balancer.markRateLimited(provider, credentialIndex);
        }

        if (kind == ErrorKind.DAILY_LIMIT) {
            flags.flagUntil(id, kind.code(), nextMidnight());
        } else if (kind == ErrorKind.RATE_LIMIT || kind == ErrorKind.AUTH_ERROR) {
            flags.flag(id, kind.code(), CREDENTIAL_ERROR_FLAG);
        } else {
            flags.flag(id, kind.code(), QUOTA_FLAG);
        }
    }

    /**
     * The kind remediation acts on. Quota failures that mention a per-day allowance are
     * promoted to {@link ErrorKind#DAILY_LIMIT}.
     */
    static ErrorKind remediationKind(RequestOutcome outcome) {
        ErrorKind kind = ErrorClassifier.classify(outcome.getErrorMessage(), outcome.getStatusCode(), outcome.getRawResponse());
        if (kind == ErrorKind.QUOTA_EXCEEDED
                && ErrorClassifier.isDailyLimit(outcome.getErrorMessage(), outcome.getRawResponse())) {
            return ErrorKind.DAILY_LIMIT;
        }
        return kind;
    }

    Instant nextMidnight() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        LocalDate tomorrow = now.toLocalDate().plusDays(1);
        return tomorrow.atStartOfDay(now.getZone()).toInstant();
    }
}
