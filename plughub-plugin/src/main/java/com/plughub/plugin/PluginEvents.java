package com.plughub.plugin;

/**
 * Event types published by the plugin host. Payloads are maps; keys are listed per event.
 */
public final class PluginEvents {

    /** pluginId, name, version */
    public static final String PLUGIN_LOADED = "plugin.loaded";
    /** pluginId */
    public static final String PLUGIN_UNLOADED = "plugin.unloaded";
    /** pluginId, name, version, enabled */
    public static final String PLUGIN_INSTALLED = "plugin.installed";
    /** pluginId, name, removeData */
    public static final String PLUGIN_UNINSTALLED = "plugin.uninstalled";
    /** pluginId */
    public static final String PLUGIN_ENABLED = "plugin.enabled";
    /** pluginId */
    public static final String PLUGIN_DISABLED = "plugin.disabled";
    /** pluginId, name, oldVersion, newVersion */
    public static final String PLUGIN_UPDATED = "plugin.updated";
    /** pluginId */
    public static final String PLUGIN_PAUSED = "plugin.paused";
    /** pluginId */
    public static final String PLUGIN_RESUMED = "plugin.resumed";
    /** loaded: list of plugin ids */
    public static final String PLUGINS_ALL_LOADED = "plugins.all_loaded";
    /** Published by the host when it begins shutting down; the plugin manager stops all plugins. */
    public static final String APP_STOPPING = "app.stopping";

    private PluginEvents() {
    }
}
