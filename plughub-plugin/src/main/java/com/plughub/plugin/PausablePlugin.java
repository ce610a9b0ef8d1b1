package com.plughub.plugin;

/**
 * Optional capability: a plugin that can suspend work without being unloaded.
 */
public interface PausablePlugin extends Plugin {

    /** @return true if the plugin is now paused */
    boolean pause() throws Exception;

    /** @return true if the plugin is running again */
    boolean resume() throws Exception;
}
