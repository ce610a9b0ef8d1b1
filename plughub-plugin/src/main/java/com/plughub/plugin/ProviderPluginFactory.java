package com.plughub.plugin;

/**
 * {@link PluginDialect#PROVIDER}: {@code main} is a {@link PluginProvider}; each load asks it for a new instance.
 */
public final class ProviderPluginFactory implements PluginFactory {

    @Override
    public String dialect() {
        return PluginDialect.PROVIDER;
    }

    @Override
    public Plugin create(PluginLoadContext context) throws Exception {
        PluginProvider provider = context.instantiateMain(PluginProvider.class);
        Plugin plugin = provider.createPlugin();
        if (plugin == null) {
            throw new IllegalStateException("Provider " + provider.getClass().getName() + " returned no plugin");
        }
        return plugin;
    }
}
