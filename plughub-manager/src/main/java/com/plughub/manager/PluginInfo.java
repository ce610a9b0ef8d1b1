package com.plughub.manager;

import com.plughub.plugin.PluginStatus;
import com.plughub.repository.PluginRecord;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot combining a plugin's record with its runtime state.
 *
 * @param record      persisted record
 * @param loaded      whether an instance is loaded
 * @param status      instance status when loaded; ERROR when the last transition failed; STOPPED otherwise
 * @param error       message of the last failed transition, or null
 * @param settings    persisted plugin settings
 * @param runtimeInfo {@link com.plughub.plugin.Plugin#getInfo()} of the loaded instance; empty otherwise
 * @param loadedAt    load time, or null
 */
public record PluginInfo(PluginRecord record, boolean loaded, PluginStatus status, String error,
                         Map<String, Object> settings, Map<String, Object> runtimeInfo, Instant loadedAt) {

    public PluginInfo {
        settings = settings != null ? settings : Map.of();
        runtimeInfo = runtimeInfo != null ? runtimeInfo : Map.of();
    }

    public String id() {
        return record.getId();
    }
}
