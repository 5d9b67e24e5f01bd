package com.relaygate.llm.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaygate.llm.model.ModelEntry;
import com.relaygate.llm.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelCacheTest {

    private MutableClock clock;
    private ModelCache cache;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-03-01T10:00:00Z");
        cache = new ModelCache(clock);
    }

    private static List<ModelEntry> catalog() {
        return List.of(
                new ModelEntry("groq", "gpt-4"),
                new ModelEntry("groq", "gpt-4-turbo"),
                new ModelEntry("openrouter", "openai/GPT_4"),
                new ModelEntry("openrouter", "openai/gpt-4"),
                new ModelEntry("cohere", "command-r"));
    }

    @Test
    void matchingIgnoresCaseAndSeparators() {
        cache.refresh(ModelCacheTest::catalog);

        List<ModelEntry> upper = cache.findProviders("GPT-4");
        List<ModelEntry> squashed = cache.findProviders("gpt4");

        assertEquals(upper, squashed);
        assertEquals(List.of("groq", "openrouter", "openrouter"),
                upper.stream().map(ModelEntry::provider).toList());
    }

    @Test
    void longerModelNamesNeverMatchShorterQuery() {
        cache.refresh(ModelCacheTest::catalog);

        List<ModelEntry> matches = cache.findProviders("gpt-4");

        assertTrue(matches.stream().noneMatch(e -> e.model().equals("gpt-4-turbo")));
        assertEquals(List.of(new ModelEntry("groq", "gpt-4-turbo")), cache.findProviders("gpt-4-turbo"));
    }

    @Test
    void prefixIsStrippedAndDuplicatesCollapsed() {
        cache.refresh(() -> List.of(
                new ModelEntry("openrouter", "openai/gpt-4"),
                new ModelEntry("openrouter", "gpt-4")));

        assertEquals(List.of(new ModelEntry("openrouter", "gpt-4")), cache.findProviders("gpt-4"));
    }

    @Test
    void blankQueryMatchesNothing() {
        cache.refresh(ModelCacheTest::catalog);

        assertTrue(cache.findProviders("").isEmpty());
        assertTrue(cache.findProviders(null).isEmpty());
    }

    @Test
    void snapshotGroupsModelsByProvider() {
        cache.refresh(ModelCacheTest::catalog);

        assertEquals(List.of("gpt-4", "gpt-4-turbo"), cache.getProviders().get("groq"));
        assertEquals(5, cache.getModels().size());
    }

    @Test
    void validityEndsAfterWindow() {
        assertFalse(cache.isValid());
        assertNull(cache.getAge());

        cache.refresh(ModelCacheTest::catalog);
        clock.advance(Duration.ofMinutes(30));
        assertTrue(cache.isValid());

        clock.advance(Duration.ofSeconds(1));
        assertFalse(cache.isValid());
        assertEquals(Duration.ofMinutes(30).plusSeconds(1), cache.getAge());
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() {
        cache.refresh(ModelCacheTest::catalog);
        ModelSnapshot before = cache.snapshot();

        boolean replaced = cache.refresh(() -> {
            throw new IllegalStateException("listing down");
        });

        assertFalse(replaced);
        assertEquals(before, cache.snapshot());
        assertFalse(cache.refresh(() -> null));
        assertEquals(before, cache.snapshot());
    }

    @Test
    void refreshWritesFileThatLoadsBack() {
        Path file = tempDir.resolve("cache/models.json");
        ModelCache writer = new ModelCache(clock, Duration.ofMinutes(30), file, new ObjectMapper());
        writer.refresh(ModelCacheTest::catalog);
        assertTrue(Files.exists(file));

        clock.advance(Duration.ofMinutes(10));
        ModelCache reader = new ModelCache(clock, Duration.ofMinutes(30), file, new ObjectMapper());

        assertTrue(reader.load());
        assertEquals(writer.snapshot().cachedAt(), reader.snapshot().cachedAt());
        assertEquals(catalog(), reader.getModels());
        assertTrue(reader.isValid());
    }

    @Test
    void expiredFileIsIgnored() {
        Path file = tempDir.resolve("models.json");
        new ModelCache(clock, Duration.ofMinutes(30), file, new ObjectMapper()).refresh(ModelCacheTest::catalog);

        clock.advance(Duration.ofMinutes(31));
        ModelCache reader = new ModelCache(clock, Duration.ofMinutes(30), file, new ObjectMapper());

        assertFalse(reader.load());
        assertTrue(reader.snapshot().isEmpty());
    }

    @Test
    void missingOrCorruptFileIsIgnored() throws Exception {
        Path file = tempDir.resolve("models.json");
        ModelCache reader = new ModelCache(clock, Duration.ofMinutes(30), file, new ObjectMapper());
        assertFalse(reader.load());

        Files.writeString(file, "{not json");
        assertFalse(reader.load());
    }
}
