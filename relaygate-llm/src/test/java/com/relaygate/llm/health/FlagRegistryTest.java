package com.relaygate.llm.health;

import com.relaygate.llm.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlagRegistryTest {

    private MutableClock clock;
    private FlagRegistry flags;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        flags = new FlagRegistry(clock);
    }

    @Test
    void flagHoldsUntilExpiryInclusive() {
        flags.flag("groq", "rate_limit", Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(10));
        assertTrue(flags.isFlagged("groq"));

        clock.advance(Duration.ofMillis(1));
        assertFalse(flags.isFlagged("groq"));
        assertTrue(flags.snapshot().isEmpty());
    }

    @Test
    void reflaggingOverwritesInsteadOfStacking() {
        flags.flag("groq", "rate_limit", Duration.ofHours(1));
        flags.flag("groq", "server_error", Duration.ofMinutes(10));

        assertEquals(1, flags.snapshot().size());
        ProviderFlag flag = flags.find("groq").orElseThrow();
        assertEquals("server_error", flag.reason());
        assertEquals(Instant.parse("2025-03-01T10:10:00Z"), flag.flagUntil());
    }

    @Test
    void extendKeepsLongerExistingExpiry() {
        flags.flag("groq", "rate_limit", Duration.ofHours(1));

        ProviderFlag extended = flags.extend("groq", "consecutive_failures", Duration.ofMinutes(30));

        assertEquals(Instant.parse("2025-03-01T11:00:00Z"), extended.flagUntil());
        assertEquals("consecutive_failures", extended.reason());
    }

    @Test
    void extendLengthensShorterFlag() {
        flags.flag("groq", "server_error", Duration.ofMinutes(10));

        ProviderFlag extended = flags.extend("groq", "consecutive_failures", Duration.ofMinutes(30));

        assertEquals(Instant.parse("2025-03-01T10:30:00Z"), extended.flagUntil());
    }

    @Test
    void clearingAnUnflaggedProviderIsNoOp() {
        flags.clear("groq");

        assertFalse(flags.isFlagged("groq"));
        assertTrue(flags.find("groq").isEmpty());
    }

    @Test
    void clearRemovesActiveFlag() {
        flags.flag("groq", "auth_error", Duration.ofHours(1));

        flags.clear("groq");

        assertFalse(flags.isFlagged("groq"));
    }
}
