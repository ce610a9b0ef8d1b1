package com.plughub.plugin;

import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a {@link PluginFactory} gets to instantiate one plugin.
 *
 * @param pluginId    plugin id
 * @param main        entry-point class name from the manifest
 * @param classLoader loader for this plugin's classes (per-load, or the host loader for class-path builtins)
 * @param pluginDir   installed plugin directory; null for class-path builtins
 * @param metadata    record metadata
 */
public record PluginLoadContext(String pluginId, String main, ClassLoader classLoader, Path pluginDir,
                                Map<String, Object> metadata) {

    public PluginLoadContext {
        Objects.requireNonNull(pluginId, "pluginId");
        Objects.requireNonNull(classLoader, "classLoader");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Loads {@link #main()} and creates it with its public no-arg constructor.
     *
     * @throws ClassNotFoundException if main is missing or cannot be found
     * @throws ClassCastException     if the class does not implement {@code type}
     */
    public <T> T instantiateMain(Class<T> type) throws ReflectiveOperationException {
        if (main == null || main.isBlank()) {
            throw new ClassNotFoundException("Plugin " + pluginId + " declares no main class");
        }
        Class<?> cls = Class.forName(main.trim(), true, classLoader);
        if (!type.isAssignableFrom(cls)) {
            throw new ClassCastException("Main class " + cls.getName() + " of plugin " + pluginId
                    + " does not implement " + type.getName());
        }
        try {
            return type.cast(cls.getDeclaredConstructor().newInstance());
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw e;
        }
    }
}
