package com.plughub.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-load class loader of a plugin directory: {@code classes/}, every {@code *.jar} in the
 * directory and in {@code lib/}, then the directory itself for resources.
 */
final class PluginClassLoaders {

    private static final Logger log = LoggerFactory.getLogger(PluginClassLoaders.class);

    private PluginClassLoaders() {
    }

    static URLClassLoader create(String pluginId, Path pluginDir, ClassLoader parent) throws IOException {
        List<URL> urls = new ArrayList<>();
        Path classes = pluginDir.resolve("classes");
        if (Files.isDirectory(classes)) {
            urls.add(classes.toUri().toURL());
        }
        addJars(pluginDir, urls);
        addJars(pluginDir.resolve("lib"), urls);
        urls.add(pluginDir.toUri().toURL());
        log.debug("Class path of plugin {}: {}", pluginId, urls);
        return new URLClassLoader("plugin-" + pluginId, urls.toArray(new URL[0]), parent);
    }

    static void close(String pluginId, URLClassLoader loader) {
        if (loader == null) return;
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader of plugin {}: {}", pluginId, e.getMessage());
        }
    }

    private static void addJars(Path dir, List<URL> urls) throws IOException {
        if (!Files.isDirectory(dir)) return;
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar);
            }
        }
        jars.sort(null);
        for (Path jar : jars) {
            urls.add(jar.toUri().toURL());
        }
    }
}
