package com.plughub.repository;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence used by the plugin host: plugin records, per-plugin settings and a small TTL cache.
 * Writes are upserts; the host never assumes it is the only writer.
 * Implementations must be thread-safe.
 *
 * @see InMemoryPluginRepository
 * @see JsonFilePluginRepository
 */
public interface PluginRepository {

    Optional<PluginRecord> getPlugin(String pluginId);

    /** Records in registration order. */
    List<PluginRecord> getAllPlugins(boolean enabledOnly);

    default List<PluginRecord> getAllPlugins() {
        return getAllPlugins(false);
    }

    /**
     * Inserts or replaces the record with the same id.
     *
     * @throws RepositoryException if the write cannot be persisted
     */
    void savePlugin(PluginRecord record);

    /** @return true if a record was removed */
    boolean deletePlugin(String pluginId);

    /** @return false if no record exists for the id */
    boolean setEnabled(String pluginId, boolean enabled);

    void savePluginConfig(String pluginId, String key, Object value);

    Optional<Object> getPluginConfig(String pluginId, String key);

    /** All settings of one plugin; empty map when none. */
    Map<String, Object> getAllPluginConfigs(String pluginId);

    /** @return true if the key existed */
    boolean deletePluginConfig(String pluginId, String key);

    /** Removes every setting of the plugin. @return number of settings removed */
    int deleteAllPluginConfigs(String pluginId);

    /**
     * Stores a cache value.
     *
     * @param ttl time to live; null, zero or negative = never expires
     */
    void saveCache(String key, Object value, Duration ttl);

    /** Value if present and not expired; an expired entry is removed. */
    Optional<Object> getCache(String key);

    /** @return true if the key existed */
    boolean deleteCache(String key);

    /** @return number of expired entries removed */
    int clearExpiredCache();
}
