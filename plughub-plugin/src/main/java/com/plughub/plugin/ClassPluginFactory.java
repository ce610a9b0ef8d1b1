package com.plughub.plugin;

/**
 * {@link PluginDialect#CLASS}: {@code main} is a {@link Plugin} implementation with a public no-arg constructor.
 */
public final class ClassPluginFactory implements PluginFactory {

    @Override
    public String dialect() {
        return PluginDialect.CLASS;
    }

    @Override
    public Plugin create(PluginLoadContext context) throws Exception {
        return context.instantiateMain(Plugin.class);
    }
}
