package com.plughub.plugin;

/**
 * {@link PluginDialect#FUNCTION}: {@code main} is a {@link PluginFunction}, wrapped in a {@link FunctionPluginAdapter}.
 */
public final class FunctionPluginFactory implements PluginFactory {

    @Override
    public String dialect() {
        return PluginDialect.FUNCTION;
    }

    @Override
    public Plugin create(PluginLoadContext context) throws Exception {
        return new FunctionPluginAdapter(context.instantiateMain(PluginFunction.class));
    }
}
