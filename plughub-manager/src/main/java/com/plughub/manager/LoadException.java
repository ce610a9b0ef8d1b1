package com.plughub.manager;

/** Instantiation, initialize or start failed, or the plugin is not loadable. */
public class LoadException extends PluginException {

    public LoadException(String pluginId, String message) {
        super(PluginErrorKind.LOAD, pluginId, message);
    }

    public LoadException(String pluginId, String message, Throwable cause) {
        super(PluginErrorKind.LOAD, pluginId, message, cause);
    }
}
