package com.plughub.manager;

import com.plughub.plugin.PluginManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A validated package copied into the staging area, ready to be committed to its target directory.
 * Closing it removes whatever is left of the staging copy.
 */
final class StagedPackage implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagedPackage.class);

    private final PluginManifest manifest;
    private final Path stagingRoot;
    private final Path content;

    StagedPackage(PluginManifest manifest, Path stagingRoot, Path content) {
        this.manifest = manifest;
        this.stagingRoot = stagingRoot;
        this.content = content;
    }

    PluginManifest manifest() {
        return manifest;
    }

    /** Directory holding the package files (manifest.json at its root). */
    Path content() {
        return content;
    }

    @Override
    public void close() {
        try {
            PluginFiles.deleteRecursively(stagingRoot);
        } catch (IOException e) {
            log.warn("Failed to remove staging directory {}: {}", stagingRoot, e.getMessage());
        }
    }
}
