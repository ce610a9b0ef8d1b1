package com.plughub.plugin;

import java.util.Map;

/**
 * Capability contract every plugin instance implements. The host drives the lifecycle:
 * {@link #initialize(PluginContext)} then {@link #start()} on load, {@link #stop()} then
 * {@link #cleanup()} on unload. Returning {@code false} from initialize or start aborts the load.
 * <p>
 * {@link #stop()} is cooperative: a plugin that owns threads must make them exit promptly.
 * Plugins run in-process with full trust.
 */
public interface Plugin {

    /**
     * Called once after instantiation.
     *
     * @return false to abort the load
     */
    boolean initialize(PluginContext context) throws Exception;

    /** @return false to abort the load */
    boolean start() throws Exception;

    /** @return false if the plugin could not stop cleanly (unload continues regardless) */
    boolean stop() throws Exception;

    /** Releases resources. Called after {@link #stop()}, also when a load is aborted. */
    void cleanup() throws Exception;

    /**
     * Processes one input map and returns an output map.
     *
     * @param input plugin-specific parameters; never null
     */
    Map<String, Object> process(Map<String, Object> input) throws Exception;

    PluginStatus getStatus();

    /** Runtime details shown in plugin info (counters, connections, ...). Empty by default. */
    default Map<String, Object> getInfo() {
        return Map.of();
    }
}
