package com.plughub.plugin;

import com.plughub.events.EventBus;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Host services handed to a plugin in {@link Plugin#initialize(PluginContext)}.
 * Settings are persisted per plugin id in the host repository.
 */
public interface PluginContext {

    String getPluginId();

    String getVersion();

    /** Directory the plugin was installed into (read-only for the plugin by convention). */
    Path getPluginDir();

    /** Writable data directory owned by this plugin; created on demand. */
    Path getDataDir();

    /** Manifest metadata of the installed record, including any custom keys. */
    Map<String, Object> getMetadata();

    EventBus getEventBus();

    /** All persisted settings of this plugin. */
    Map<String, Object> getSettings();

    Object getSetting(String key);

    default Object getSetting(String key, Object defaultValue) {
        Object value = getSetting(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Persists a setting.
     *
     * @return false if the repository rejected the write
     */
    boolean setSetting(String key, Object value);

    /** Another loaded plugin, typically a declared dependency. */
    Optional<Plugin> getPlugin(String pluginId);
}
