package com.relaygate.llm.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.relaygate.llm.model.ModelEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-boxed index of the models each provider serves. The whole index is one snapshot
 * with a single timestamp; refreshes swap it atomically and readers never see a partial one.
 */
@Slf4j
public class ModelCache {

    public static final Duration DEFAULT_VALIDITY = Duration.ofMinutes(30);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Duration validity;
    private final Path cacheFile;
    private final ObjectMapper objectMapper;

    private ModelSnapshot snapshot = ModelSnapshot.EMPTY;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> refreshTask;

    public ModelCache(Clock clock, Duration validity, Path cacheFile, ObjectMapper objectMapper) {
        this.clock = clock;
        this.validity = validity != null ? validity : DEFAULT_VALIDITY;
        this.cacheFile = cacheFile;
        this.objectMapper = objectMapper;
    }

    public ModelCache(Clock clock) {
        this(clock, DEFAULT_VALIDITY, null, new ObjectMapper());
    }

    public ModelSnapshot snapshot() {
        lock.lock();
        try {
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public List<ModelEntry> getModels() {
        return snapshot().models();
    }

    public Map<String, List<String>> getProviders() {
        return snapshot().providers();
    }

    public boolean isValid() {
        Instant cachedAt = snapshot().cachedAt();
        return cachedAt != null && !clock.instant().isAfter(cachedAt.plus(validity));
    }

    /** Age of the snapshot, or null if nothing was ever cached. */
    public Duration getAge() {
        Instant cachedAt = snapshot().cachedAt();
        return cachedAt != null ? Duration.between(cachedAt, clock.instant()) : null;
    }

    /**
     * Exact lookup after normalization: case, hyphens, underscores and dots are ignored and a
     * leading {@code provider/} prefix on the cached id is dropped. "gpt-4-turbo" never
     * matches "gpt-4".
     */
    public List<ModelEntry> findProviders(String modelName) {
        String wanted = normalize(modelName);
        if (wanted.isEmpty()) {
            return List.of();
        }
        Set<ModelEntry> matches = new LinkedHashSet<>();
        for (ModelEntry entry : getModels()) {
            String modelId = stripPrefix(entry.model());
            if (wanted.equals(normalize(modelId))) {
                matches.add(new ModelEntry(entry.provider(), modelId));
            }
        }
        return new ArrayList<>(matches);
    }

    /**
     * Runs discovery and swaps in the result. On failure the previous snapshot stays.
     *
     * @return true if the snapshot was replaced
     */
    public boolean refresh(ModelDiscovery discovery) {
        List<ModelEntry> models;
        try {
            models = discovery.discoverModels();
        } catch (RuntimeException e) {
            log.error("[MODEL_CACHE] Refresh failed, keeping previous snapshot | error={}", e.getMessage(), e);
            return false;
        }
        if (models == null) {
            log.warn("[MODEL_CACHE] Discovery returned nothing, keeping previous snapshot");
            return false;
        }

        ModelSnapshot fresh = ModelSnapshot.of(clock.instant(), models);
        lock.lock();
        try {
            snapshot = fresh;
        } finally {
            lock.unlock();
        }
        log.info("[MODEL_CACHE] Snapshot replaced | models={} | providers={}", fresh.models().size(), fresh.providers().size());
        save(fresh);
        return true;
    }

    /**
     * Loads the cache file if it exists and is still inside the validity window.
     */
    public boolean load() {
        if (cacheFile == null || !Files.exists(cacheFile)) {
            return false;
        }
        try {
            CacheFile file = objectMapper.readValue(cacheFile.toFile(), CacheFile.class);
            if (file.cachedAt() == null) {
                return false;
            }
            Instant cachedAt = Instant.ofEpochMilli(file.cachedAt());
            Duration age = Duration.between(cachedAt, clock.instant());
            if (age.compareTo(validity) > 0) {
                log.info("[MODEL_CACHE] Cache file expired | ageMinutes={}", age.toMinutes());
                return false;
            }
            List<ModelEntry> models = file.models() != null ? file.models() : List.of();
            lock.lock();
            try {
                snapshot = ModelSnapshot.of(cachedAt, models);
            } finally {
                lock.unlock();
            }
            log.info("[MODEL_CACHE] Loaded cache file | models={} | ageMinutes={}", models.size(), age.toMinutes());
            return true;
        } catch (IOException e) {
            log.warn("[MODEL_CACHE] Could not read cache file | path={} | error={}", cacheFile, e.getMessage());
            return false;
        }
    }

    public void startAutoRefresh(ModelDiscovery discovery, Duration period) {
        lock.lock();
        try {
            if (refreshTask != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "model-cache-refresh");
                thread.setDaemon(true);
                return thread;
            });
            long periodMs = period.toMillis();
            refreshTask = scheduler.scheduleAtFixedRate(() -> refresh(discovery), periodMs, periodMs, TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
        log.info("[MODEL_CACHE] Auto refresh started | periodMinutes={}", period.toMinutes());
    }

    public void stopAutoRefresh() {
        lock.lock();
        try {
            if (refreshTask == null) {
                return;
            }
            refreshTask.cancel(false);
            scheduler.shutdownNow();
            refreshTask = null;
            scheduler = null;
        } finally {
            lock.unlock();
        }
        log.info("[MODEL_CACHE] Auto refresh stopped");
    }

    static String normalize(String modelName) {
        if (modelName == null) {
            return "";
        }
        return modelName.toLowerCase(Locale.ROOT)
                .replace("-", "")
                .replace("_", "")
                .replace(".", "");
    }

    private static String stripPrefix(String modelId) {
        if (modelId == null) {
            return "";
        }
        int slash = modelId.indexOf('/');
        return slash >= 0 ? modelId.substring(slash + 1) : modelId;
    }

    private void save(ModelSnapshot saved) {
        if (cacheFile == null) {
            return;
        }
        try {
            CacheFile file = new CacheFile(saved.cachedAt().toEpochMilli(), saved.models(), saved.providers());
            Path parent = cacheFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writer()
                    .with(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(cacheFile.toFile(), file);
        } catch (IOException e) {
            log.warn("[MODEL_CACHE] Could not write cache file | path={} | error={}", cacheFile, e.getMessage());
        }
    }

    record CacheFile(Long cachedAt, List<ModelEntry> models, Map<String, List<String>> providers) {
    }
}
