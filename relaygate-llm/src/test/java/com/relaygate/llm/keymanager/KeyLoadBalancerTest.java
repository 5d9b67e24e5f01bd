package com.relaygate.llm.keymanager;

import com.relaygate.llm.model.KeyUsageReport;
import com.relaygate.llm.registry.ProviderRuntime;
import com.relaygate.llm.support.MutableClock;
import com.relaygate.llm.support.TestProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Verifies credential scoring, rate-limit cooldowns and weight updates.
 */
class KeyLoadBalancerTest {

    private MutableClock clock;
    private KeyLoadBalancer balancer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        balancer = new KeyLoadBalancer(clock);
    }

    private static ProviderRuntime provider(String... keys) {
        return new ProviderRuntime(TestProviders.openAi("groq", 1, keys), null);
    }

    @Test
    void singleCredentialIsAlwaysSelected() {
        ProviderRuntime provider = provider("k1");
        balancer.recordUsage(provider, 0);
        balancer.markRateLimited(provider, 0);

        assertEquals(OptionalInt.of(0), balancer.selectCredential(provider));
    }

    @Test
    void freshlyRateLimitedKeyIsNeverSelected() {
        ProviderRuntime provider = provider("k1", "k2", "k3");
        balancer.recordUsage(provider, 0);
        balancer.markRateLimited(provider, 0);
        clock.advance(Duration.ofSeconds(10));

        OptionalInt selected = balancer.selectCredential(provider);

        assertTrue(selected.isPresent());
        assertNotEquals(0, selected.getAsInt());
        assertEquals(2.0, provider.credential(0).getWeight());
    }

    @Test
    void rateLimitIsClearedLazilyAfterCooldown() {
        ProviderRuntime provider = provider("k1", "k2");
        balancer.recordUsage(provider, 0);
        balancer.markRateLimited(provider, 0);
        balancer.recordUsage(provider, 1);
        balancer.markRateLimited(provider, 1);

        assertTrue(balancer.selectCredential(provider).isEmpty());

        clock.advance(Duration.ofSeconds(61));

        assertEquals(OptionalInt.of(0), balancer.selectCredential(provider));
        assertFalse(provider.credential(0).isRateLimited());
    }

    @Test
    void tiesGoToLowestIndex() {
        ProviderRuntime provider = provider("k1", "k2", "k3");

        assertEquals(OptionalInt.of(0), balancer.selectCredential(provider));
    }

    @Test
    void busyKeyLosesToIdleKey() {
        ProviderRuntime provider = provider("k1", "k2");
        for (int i = 0; i < 5; i++) {
            balancer.recordUsage(provider, 0);
            balancer.recordOutcome(provider, 0, false, 0.2);
        }

        assertEquals(OptionalInt.of(1), balancer.selectCredential(provider));
    }

    @Test
    void failuresRaiseWeightUpToCeiling() {
        ProviderRuntime provider = provider("k1", "k2");
        double previous = provider.credential(0).getWeight();

        for (int i = 0; i < 10; i++) {
            balancer.recordOutcome(provider, 0, false, 0.1);
            double current = provider.credential(0).getWeight();
            assertTrue(current > previous || current == 2.0);
            previous = current;
        }
        assertEquals(2.0, provider.credential(0).getWeight(), 1e-9);
    }

    @Test
    void successLowersWeightAndClearsRateLimit() {
        ProviderRuntime provider = provider("k1", "k2");
        balancer.markRateLimited(provider, 1);

        balancer.recordOutcome(provider, 1, true, 0.5);

        assertEquals(1.9, provider.credential(1).getWeight(), 1e-9);
        assertFalse(provider.credential(1).isRateLimited());
    }

    @Test
    void windowDropsRequestsOlderThanOneMinute() {
        ProviderRuntime provider = provider("k1", "k2");
        balancer.recordUsage(provider, 0);
        balancer.recordUsage(provider, 0);
        clock.advance(Duration.ofSeconds(61));
        balancer.recordUsage(provider, 0);

        balancer.selectCredential(provider);

        assertEquals(1, provider.credential(0).getRequestsInWindow());
    }

    @Test
    void acquireRecordsUsageAndMovesCurrentPointer() {
        ProviderRuntime provider = provider("k1", "k2");
        balancer.recordUsage(provider, 0);

        OptionalInt acquired = balancer.acquireCredential(provider);

        assertEquals(OptionalInt.of(1), acquired);
        assertEquals(1, provider.getCurrentCredentialIndex());
        assertEquals(1, provider.credential(1).getRequests());
    }

    @Test
    void rotateRetiresFailedKey() {
        ProviderRuntime provider = provider("k1", "k2", "k3");
        balancer.recordUsage(provider, 0);

        OptionalInt next = balancer.rotate(provider, 0);

        assertEquals(OptionalInt.of(1), next);
        assertTrue(provider.credential(0).isRateLimited());
        assertEquals(1, provider.getCurrentCredentialIndex());
    }

    @Test
    void rotateIsNoOpForSingleKey() {
        ProviderRuntime provider = provider("k1");

        assertTrue(balancer.rotate(provider, 0).isEmpty());
        assertFalse(provider.credential(0).isRateLimited());
    }

    @Test
    void reportListsEveryKey() {
        ProviderRuntime provider = provider("k1", "k2");
        balancer.recordUsage(provider, 0);
        balancer.recordOutcome(provider, 0, true, 1.0);
        balancer.recordUsage(provider, 0);
        balancer.recordOutcome(provider, 0, false, 1.0);

        Map<String, KeyUsageReport> report = balancer.report(provider);

        assertEquals(2, report.size());
        KeyUsageReport first = report.get("Key #1");
        assertEquals(2, first.requests());
        assertEquals(1, first.successes());
        assertEquals(1, first.failures());
        assertEquals(2, first.requestsThisMinute());
        assertEquals(50.0, first.successRate());
        assertEquals(0, report.get("Key #2").requests());
    }
}
