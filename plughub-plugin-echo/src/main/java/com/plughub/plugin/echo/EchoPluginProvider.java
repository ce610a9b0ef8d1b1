package com.plughub.plugin.echo;

import com.plughub.plugin.Plugin;
import com.plughub.plugin.PluginProvider;

/**
 * Builtin provider for the "echo" plugin, discovered through {@link java.util.ServiceLoader}.
 */
public final class EchoPluginProvider implements PluginProvider {

    public static final String PLUGIN_ID = "echo";

    @Override
    public String getPluginId() {
        return PLUGIN_ID;
    }

    @Override
    public String getName() {
        return "Echo";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public String getDescription() {
        return "Echoes the given text as 'ECHO: ' + input. Use for testing or simple passthrough.";
    }

    @Override
    public Plugin createPlugin() {
        return new EchoPlugin();
    }
}
