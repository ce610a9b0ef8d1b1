package com.plughub.plugin;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dialect → factory lookup.
 */
public final class PluginFactories {

    private PluginFactories() {
    }

    /** The shipped factories: class, function, provider. */
    public static List<PluginFactory> defaults() {
        return List.of(new ClassPluginFactory(), new FunctionPluginFactory(), new ProviderPluginFactory());
    }

    /**
     * Indexes factories by dialect; a later factory replaces an earlier one for the same dialect.
     */
    public static Map<String, PluginFactory> byDialect(List<? extends PluginFactory> factories) {
        Map<String, PluginFactory> map = new LinkedHashMap<>();
        for (PluginFactory f : factories) {
            map.put(f.dialect(), f);
        }
        return Map.copyOf(map);
    }
}
