package com.plughub.plugin;

import java.util.List;
import java.util.Map;

/**
 * SPI for plugins shipped with the host. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.plughub.plugin.PluginProvider) and registered as builtin plugins; they can
 * also serve as the {@code main} entry point of a {@link PluginDialect#PROVIDER} package.
 */
public interface PluginProvider {

    /** Stable plugin id (e.g. "echo"). */
    String getPluginId();

    String getName();

    /** Creates a new plugin instance. Called on every load. */
    Plugin createPlugin();

    default String getVersion() {
        return "1.0.0";
    }

    default String getAuthor() {
        return "";
    }

    default String getDescription() {
        return "";
    }

    /** Ids of plugins that must be loaded before this one. */
    default List<String> getDependencies() {
        return List.of();
    }

    /** Extra metadata stored with the plugin record. */
    default Map<String, Object> getMetadata() {
        return Map.of();
    }

    /** Enabled flag for the first registration; later registrations keep the stored flag. */
    default boolean isEnabledByDefault() {
        return true;
    }

    /** Whether this provider should be registered at all. Override to skip when the environment lacks something. */
    default boolean isAvailable() {
        return true;
    }
}
