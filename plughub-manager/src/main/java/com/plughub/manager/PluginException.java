package com.plughub.manager;

/**
 * Base of the plugin host's unchecked exception hierarchy. Carries the error kind and the plugin id;
 * {@link PluginManager} converts it into a failed {@link OperationResult}.
 */
public class PluginException extends RuntimeException {

    private final PluginErrorKind kind;
    private final String pluginId;

    public PluginException(PluginErrorKind kind, String pluginId, String message) {
        this(kind, pluginId, message, null);
    }

    public PluginException(PluginErrorKind kind, String pluginId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.pluginId = pluginId;
    }

    public PluginErrorKind getKind() {
        return kind;
    }

    public String getPluginId() {
        return pluginId;
    }
}
