package com.plughub.manager;

/** No plugin record for the id. */
public class NotFoundException extends PluginException {

    public NotFoundException(String pluginId) {
        super(PluginErrorKind.NOT_FOUND, pluginId, "Plugin " + pluginId + " is not installed");
    }
}
