package com.plughub.manager;

/** Package could not be fetched, copied, removed or recorded. */
public class InstallException extends PluginException {

    public InstallException(String pluginId, String message) {
        super(PluginErrorKind.INSTALL, pluginId, message);
    }

    public InstallException(String pluginId, String message, Throwable cause) {
        super(PluginErrorKind.INSTALL, pluginId, message, cause);
    }
}
