package com.plughub.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Complete repository content; also the JSON document written by {@link JsonFilePluginRepository}.
 * Not thread-safe: guarded by the owning repository.
 */
final class RepositoryState {

    @JsonProperty("plugins")
    final Map<String, PluginRecord> plugins;

    @JsonProperty("configs")
    final Map<String, Map<String, Object>> configs;

    @JsonProperty("cache")
    final Map<String, CacheEntry> cache;

    RepositoryState() {
        this(null, null, null);
    }

    @JsonCreator
    RepositoryState(@JsonProperty("plugins") Map<String, PluginRecord> plugins,
                    @JsonProperty("configs") Map<String, Map<String, Object>> configs,
                    @JsonProperty("cache") Map<String, CacheEntry> cache) {
        this.plugins = plugins != null ? new LinkedHashMap<>(plugins) : new LinkedHashMap<>();
        this.configs = new LinkedHashMap<>();
        if (configs != null) {
            configs.forEach((id, settings) -> this.configs.put(id, new LinkedHashMap<>(settings)));
        }
        this.cache = cache != null ? new LinkedHashMap<>(cache) : new LinkedHashMap<>();
    }

    /** Copy deep enough to roll back any single mutation (records and values are replaced, never changed). */
    RepositoryState copy() {
        return new RepositoryState(plugins, configs, cache);
    }
}
