package com.plughub.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlugHubConfigTest {

    @Test
    void fromEnvironment_emptyEnvUsesDefaults() {
        PlugHubConfig config = PlugHubConfig.fromEnvironment(Map.of());

        assertEquals(Paths.get("plugins"), config.getPluginsDir());
        assertEquals(Paths.get("builtin-plugins"), config.getBuiltinPluginsDir());
        assertEquals(Paths.get("data"), config.getDataDir());
        assertEquals(Paths.get("data", "downloads"), config.getDownloadDir());
        assertEquals(0, config.getMaxWorkers());
        assertEquals("http://localhost:8000", config.getServerUrl());
        assertEquals(Duration.ofSeconds(30), config.getServerTimeout());
        assertEquals(Duration.ofSeconds(10), config.getShutdownTimeout());
        assertFalse(config.isAutoRestartOnUpdate());
    }

    @Test
    void fromEnvironment_readsAllVariables() {
        PlugHubConfig config = PlugHubConfig.fromEnvironment(Map.of(
                PlugHubConfig.ENV_PLUGINS_DIR, "/opt/ph/plugins",
                PlugHubConfig.ENV_BUILTIN_PLUGINS_DIR, "/opt/ph/builtin",
                PlugHubConfig.ENV_DATA_DIR, "/var/ph",
                PlugHubConfig.ENV_DOWNLOAD_DIR, "/tmp/ph",
                PlugHubConfig.ENV_MAX_WORKERS, " 6 ",
                PlugHubConfig.ENV_SERVER_URL, "https://plugins.example.org/",
                PlugHubConfig.ENV_SERVER_TIMEOUT_SECONDS, "5",
                PlugHubConfig.ENV_SHUTDOWN_TIMEOUT_SECONDS, "3",
                PlugHubConfig.ENV_AUTO_RESTART_ON_UPDATE, "1"));

        assertEquals(Paths.get("/opt/ph/plugins"), config.getPluginsDir());
        assertEquals(Paths.get("/opt/ph/builtin"), config.getBuiltinPluginsDir());
        assertEquals(Paths.get("/var/ph"), config.getDataDir());
        assertEquals(Paths.get("/tmp/ph"), config.getDownloadDir());
        assertEquals(6, config.getMaxWorkers());
        assertEquals("https://plugins.example.org", config.getServerUrl());
        assertEquals(Duration.ofSeconds(5), config.getServerTimeout());
        assertEquals(Duration.ofSeconds(3), config.getShutdownTimeout());
        assertTrue(config.isAutoRestartOnUpdate());
    }

    @Test
    void fromEnvironment_invalidNumbersFallBackToDefaults() {
        PlugHubConfig config = PlugHubConfig.fromEnvironment(Map.of(
                PlugHubConfig.ENV_MAX_WORKERS, "many",
                PlugHubConfig.ENV_SERVER_TIMEOUT_SECONDS, "-4"));

        assertEquals(0, config.getMaxWorkers());
        assertEquals(Duration.ofSeconds(30), config.getServerTimeout());
    }

    @Test
    void builder_baseDirLaysOutDirectoriesUnderneath() {
        Path base = Paths.get("/srv/plughub");
        PlugHubConfig config = PlugHubConfig.builder(base).build();

        assertEquals(base.resolve("plugins"), config.getPluginsDir());
        assertEquals(base.resolve("builtin-plugins"), config.getBuiltinPluginsDir());
        assertEquals(base.resolve("data").resolve("plugins").resolve("echo"), config.getPluginDataDir("echo"));
    }
}
