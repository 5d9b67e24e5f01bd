package com.relaygate.llm.registry;

import com.relaygate.llm.provider.FormatAdapterRegistry;
import com.relaygate.llm.provider.ProviderConfig;
import com.relaygate.llm.provider.ProviderFormat;
import com.relaygate.llm.support.ScriptedAdapter;
import com.relaygate.llm.support.TestProviders;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderRegistryTest {

    private final FormatAdapterRegistry adapters = new FormatAdapterRegistry(List.of(new ScriptedAdapter()));

    @Test
    void providerWithoutUsableKeysIsSkipped() {
        ProviderRegistry registry = new ProviderRegistry(List.of(
                TestProviders.openAi("empty", 1, " ", ""),
                TestProviders.openAi("groq", 2, "k1")), adapters);

        assertEquals(List.of("groq"), registry.ids());
    }

    @Test
    void openProviderNeedsNoKeys() {
        ProviderConfig open = TestProviders.openAi("open", 1).toBuilder().authType(null).build();

        ProviderRegistry registry = new ProviderRegistry(List.of(open), adapters);

        assertEquals(1, registry.size());
        assertTrue(registry.find("open").orElseThrow().getCredentials().isEmpty());
    }

    @Test
    void keysAreTrimmedAndCappedAtThree() {
        ProviderRegistry registry = new ProviderRegistry(List.of(
                TestProviders.openAi("groq", 1, " k1 ", "k2", "k3", "k4")), adapters);

        ProviderRuntime groq = registry.find("groq").orElseThrow();
        assertEquals(3, groq.getCredentials().size());
        assertEquals("k1", groq.credential(0).getApiKey());
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(IllegalStateException.class, () -> new ProviderRegistry(List.of(
                TestProviders.openAi("groq", 1, "k1"),
                TestProviders.openAi("groq", 2, "k2")), adapters));
    }

    @Test
    void missingEndpointIsRejected() {
        ProviderConfig broken = TestProviders.openAi("groq", 1, "k1").toBuilder().endpoint(" ").build();

        assertThrows(IllegalStateException.class, () -> new ProviderRegistry(List.of(broken), adapters));
    }

    @Test
    void unknownFormatLeavesAdapterEmpty() {
        ProviderConfig cohere = TestProviders.openAi("cohere", 1, "k1").toBuilder().format(ProviderFormat.COHERE).build();

        ProviderRegistry registry = new ProviderRegistry(List.of(cohere, TestProviders.openAi("groq", 2, "k2")), adapters);

        assertNull(registry.find("cohere").orElseThrow().getAdapter());
        assertNotNull(registry.find("groq").orElseThrow().getAdapter());
    }

    @Test
    void lookupFallsBackToCaseInsensitiveMatch() {
        ProviderRegistry registry = new ProviderRegistry(List.of(TestProviders.openAi("Groq", 1, "k1")), adapters);

        assertEquals("Groq", registry.find("groq").orElseThrow().getId());
        assertTrue(registry.find("missing").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void byPriorityFollowsRuntimePriority() {
        ProviderRegistry registry = new ProviderRegistry(List.of(
                TestProviders.openAi("a", 1, "k1"),
                TestProviders.openAi("b", 2, "k2")), adapters);

        registry.find("b").orElseThrow().setPriority(0);

        assertEquals("b", registry.byPriority().get(0).getId());
    }
}
