package com.plughub.plugin;

/**
 * Creates plugin instances for one manifest dialect. The host keeps one factory per dialect and
 * rejects packages whose dialect has none.
 */
public interface PluginFactory {

    /** Dialect served, e.g. {@link PluginDialect#CLASS}. */
    String dialect();

    Plugin create(PluginLoadContext context) throws Exception;
}
