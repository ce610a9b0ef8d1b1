package com.plughub.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link PluginRepository} held in memory. Every method is synchronized on the instance.
 * {@link JsonFilePluginRepository} persists the state after each mutation; a failed persist rolls
 * the mutation back.
 */
public class InMemoryPluginRepository implements PluginRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPluginRepository.class);

    private final Clock clock;
    private RepositoryState state;

    public InMemoryPluginRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryPluginRepository(Clock clock) {
        this(clock, new RepositoryState());
    }

    InMemoryPluginRepository(Clock clock, RepositoryState initial) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.state = Objects.requireNonNull(initial, "initial");
    }

    @Override
    public synchronized Optional<PluginRecord> getPlugin(String pluginId) {
        return Optional.ofNullable(state.plugins.get(pluginId));
    }

    @Override
    public synchronized List<PluginRecord> getAllPlugins(boolean enabledOnly) {
        List<PluginRecord> out = new ArrayList<>();
        for (PluginRecord r : state.plugins.values()) {
            if (!enabledOnly || r.isEnabled()) out.add(r);
        }
        return List.copyOf(out);
    }

    @Override
    public synchronized void savePlugin(PluginRecord record) {
        Objects.requireNonNull(record, "record");
        mutate(() -> state.plugins.put(record.getId(), record));
        log.debug("Saved plugin record {} v{}", record.getId(), record.getVersion());
    }

    @Override
    public synchronized boolean deletePlugin(String pluginId) {
        if (!state.plugins.containsKey(pluginId)) return false;
        mutate(() -> state.plugins.remove(pluginId));
        log.debug("Deleted plugin record {}", pluginId);
        return true;
    }

    @Override
    public synchronized boolean setEnabled(String pluginId, boolean enabled) {
        PluginRecord existing = state.plugins.get(pluginId);
        if (existing == null) return false;
        if (existing.isEnabled() != enabled) {
            mutate(() -> state.plugins.put(pluginId, existing.withEnabled(enabled)));
        }
        return true;
    }

    @Override
    public synchronized void savePluginConfig(String pluginId, String key, Object value) {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(key, "key");
        mutate(() -> state.configs.computeIfAbsent(pluginId, k -> new LinkedHashMap<>()).put(key, value));
    }

    @Override
    public synchronized Optional<Object> getPluginConfig(String pluginId, String key) {
        Map<String, Object> settings = state.configs.get(pluginId);
        return settings != null ? Optional.ofNullable(settings.get(key)) : Optional.empty();
    }

    @Override
    public synchronized Map<String, Object> getAllPluginConfigs(String pluginId) {
        Map<String, Object> settings = state.configs.get(pluginId);
        return settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : Map.of();
    }

    @Override
    public synchronized boolean deletePluginConfig(String pluginId, String key) {
        Map<String, Object> settings = state.configs.get(pluginId);
        if (settings == null || !settings.containsKey(key)) return false;
        mutate(() -> {
            Map<String, Object> s = state.configs.get(pluginId);
            s.remove(key);
            if (s.isEmpty()) state.configs.remove(pluginId);
            return null;
        });
        return true;
    }

    @Override
    public synchronized int deleteAllPluginConfigs(String pluginId) {
        Map<String, Object> settings = state.configs.get(pluginId);
        if (settings == null) return 0;
        int n = settings.size();
        mutate(() -> state.configs.remove(pluginId));
        return n;
    }

    @Override
    public synchronized void saveCache(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Instant expiresAt = ttl != null && !ttl.isZero() && !ttl.isNegative() ? clock.instant().plus(ttl) : null;
        mutate(() -> state.cache.put(key, new CacheEntry(value, expiresAt)));
    }

    @Override
    public synchronized Optional<Object> getCache(String key) {
        CacheEntry entry = state.cache.get(key);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.instant())) {
            mutate(() -> state.cache.remove(key));
            log.debug("Cache entry {} expired", key);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    @Override
    public synchronized boolean deleteCache(String key) {
        if (!state.cache.containsKey(key)) return false;
        mutate(() -> state.cache.remove(key));
        return true;
    }

    @Override
    public synchronized int clearExpiredCache() {
        Instant now = clock.instant();
        long expired = state.cache.values().stream().filter(e -> e.isExpired(now)).count();
        if (expired == 0) return 0;
        mutate(() -> {
            Iterator<CacheEntry> it = state.cache.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) it.remove();
            }
            return null;
        });
        return (int) expired;
    }

    /**
     * Writes the state after a mutation. No-op here.
     *
     * @throws RepositoryException if the state cannot be persisted
     */
    void persist(RepositoryState state) {
    }

    /** Current state; callers must hold the monitor. */
    final RepositoryState state() {
        return state;
    }

    private <T> T mutate(Supplier<T> change) {
        RepositoryState backup = state.copy();
        T result = change.get();
        try {
            persist(state);
        } catch (RuntimeException e) {
            state = backup;
            throw e;
        }
        return result;
    }
}
