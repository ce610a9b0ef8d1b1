package com.plughub.manager;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Fetches plugin packages from a remote source for install and update.
 */
public interface PluginDownloader {

    /**
     * Downloads the latest package of a plugin.
     *
     * @return local path of the downloaded package (directory or .zip)
     * @throws IOException if the package cannot be fetched
     */
    Path fetchPackage(String pluginId) throws IOException;
}
