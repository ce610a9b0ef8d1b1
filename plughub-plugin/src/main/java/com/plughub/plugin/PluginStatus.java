package com.plughub.plugin;

/**
 * Runtime status reported by a plugin instance.
 */
public enum PluginStatus {
    INITIALIZED,
    RUNNING,
    PAUSED,
    STOPPED,
    ERROR
}
