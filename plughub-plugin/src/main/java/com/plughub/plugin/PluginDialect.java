package com.plughub.plugin;

/**
 * Manifest {@code dialect} values: the kind of entry point named by {@code main}.
 * Each dialect is served by one {@link PluginFactory}.
 */
public final class PluginDialect {

    /** {@code main} names a class implementing {@link Plugin}. Default when the manifest omits the dialect. */
    public static final String CLASS = "class";

    /** {@code main} names a class implementing {@link PluginFunction}; wrapped by {@link FunctionPluginAdapter}. */
    public static final String FUNCTION = "function";

    /** {@code main} names a {@link PluginProvider}; its {@link PluginProvider#createPlugin()} supplies the instance. */
    public static final String PROVIDER = "provider";

    private PluginDialect() {
    }
}
