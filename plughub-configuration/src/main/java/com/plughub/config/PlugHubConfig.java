package com.plughub.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Host configuration loaded from environment variables.
 * <p>
 * Directories: PLUGHUB_PLUGINS_DIR (user-installed plugins), PLUGHUB_BUILTIN_PLUGINS_DIR (plugins shipped
 * with the host), PLUGHUB_DATA_DIR (repository file and per-plugin data), PLUGHUB_DOWNLOAD_DIR.
 * <p>
 * Remote server: PLUGHUB_SERVER_URL, PLUGHUB_SERVER_TIMEOUT_SECONDS.
 * Runtime: PLUGHUB_MAX_WORKERS, PLUGHUB_SHUTDOWN_TIMEOUT_SECONDS, PLUGHUB_AUTO_RESTART_ON_UPDATE.
 * Unparseable values fall back to the defaults.
 */
public final class PlugHubConfig {

    static final String ENV_PLUGINS_DIR = "PLUGHUB_PLUGINS_DIR";
    static final String ENV_BUILTIN_PLUGINS_DIR = "PLUGHUB_BUILTIN_PLUGINS_DIR";
    static final String ENV_DATA_DIR = "PLUGHUB_DATA_DIR";
    static final String ENV_MAX_WORKERS = "PLUGHUB_MAX_WORKERS";
    static final String ENV_SERVER_URL = "PLUGHUB_SERVER_URL";
    static final String ENV_SERVER_TIMEOUT_SECONDS = "PLUGHUB_SERVER_TIMEOUT_SECONDS";
    static final String ENV_DOWNLOAD_DIR = "PLUGHUB_DOWNLOAD_DIR";
    static final String ENV_SHUTDOWN_TIMEOUT_SECONDS = "PLUGHUB_SHUTDOWN_TIMEOUT_SECONDS";
    static final String ENV_AUTO_RESTART_ON_UPDATE = "PLUGHUB_AUTO_RESTART_ON_UPDATE";

    private static final String DEFAULT_PLUGINS_DIR = "plugins";
    private static final String DEFAULT_BUILTIN_PLUGINS_DIR = "builtin-plugins";
    private static final String DEFAULT_DATA_DIR = "data";
    private static final String DEFAULT_DOWNLOAD_DIR = "downloads";
    private static final String DEFAULT_SERVER_URL = "http://localhost:8000";
    private static final int DEFAULT_SERVER_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 10;
    /** 0 = available processors, at least 2. */
    private static final int DEFAULT_MAX_WORKERS = 0;

    private final Path pluginsDir;
    private final Path builtinPluginsDir;
    private final Path dataDir;
    private final Path downloadDir;
    private final int maxWorkers;
    private final String serverUrl;
    private final Duration serverTimeout;
    private final Duration shutdownTimeout;
    private final boolean autoRestartOnUpdate;

    private PlugHubConfig(Builder b) {
        this.pluginsDir = b.pluginsDir;
        this.builtinPluginsDir = b.builtinPluginsDir;
        this.dataDir = b.dataDir;
        this.downloadDir = b.downloadDir != null ? b.downloadDir : b.dataDir.resolve(DEFAULT_DOWNLOAD_DIR);
        this.maxWorkers = b.maxWorkers;
        this.serverUrl = stripTrailingSlash(b.serverUrl);
        this.serverTimeout = b.serverTimeout;
        this.shutdownTimeout = b.shutdownTimeout;
        this.autoRestartOnUpdate = b.autoRestartOnUpdate;
    }

    /** Directory holding one sub-directory per user-installed plugin. Default {@code plugins}. */
    public Path getPluginsDir() {
        return pluginsDir;
    }

    /** Directory holding plugins shipped with the host. Default {@code builtin-plugins}. */
    public Path getBuiltinPluginsDir() {
        return builtinPluginsDir;
    }

    /** Root for the repository file and {@code plugins/<id>} data directories. Default {@code data}. */
    public Path getDataDir() {
        return dataDir;
    }

    /** Where fetched packages are stored. Default {@code <dataDir>/downloads}. */
    public Path getDownloadDir() {
        return downloadDir;
    }

    /** Data directory of one plugin: {@code <dataDir>/plugins/<pluginId>}. */
    public Path getPluginDataDir(String pluginId) {
        return dataDir.resolve("plugins").resolve(pluginId);
    }

    /** Task executor pool size; 0 means available processors (at least 2). */
    public int getMaxWorkers() {
        return maxWorkers;
    }

    /** Base URL of the remote plugin server, without trailing slash. */
    public String getServerUrl() {
        return serverUrl;
    }

    public Duration getServerTimeout() {
        return serverTimeout;
    }

    /** Upper bound for waiting on background tasks during shutdown. */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /** Whether {@code update} reloads a plugin that was disabled before the update. */
    public boolean isAutoRestartOnUpdate() {
        return autoRestartOnUpdate;
    }

    public static PlugHubConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    public static PlugHubConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return fromEnvironment(env::get);
    }

    private static PlugHubConfig fromEnvironment(Function<String, String> env) {
        Path dataDir = Paths.get(getEnv(env, ENV_DATA_DIR, DEFAULT_DATA_DIR));
        String downloadDir = getEnv(env, ENV_DOWNLOAD_DIR, null);
        return builder()
                .pluginsDir(Paths.get(getEnv(env, ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR)))
                .builtinPluginsDir(Paths.get(getEnv(env, ENV_BUILTIN_PLUGINS_DIR, DEFAULT_BUILTIN_PLUGINS_DIR)))
                .dataDir(dataDir)
                .downloadDir(downloadDir != null ? Paths.get(downloadDir) : null)
                .maxWorkers(parseInt(env.apply(ENV_MAX_WORKERS), DEFAULT_MAX_WORKERS))
                .serverUrl(getEnv(env, ENV_SERVER_URL, DEFAULT_SERVER_URL))
                .serverTimeout(Duration.ofSeconds(parseInt(env.apply(ENV_SERVER_TIMEOUT_SECONDS), DEFAULT_SERVER_TIMEOUT_SECONDS)))
                .shutdownTimeout(Duration.ofSeconds(parseInt(env.apply(ENV_SHUTDOWN_TIMEOUT_SECONDS), DEFAULT_SHUTDOWN_TIMEOUT_SECONDS)))
                .autoRestartOnUpdate(parseBoolean(env.apply(ENV_AUTO_RESTART_ON_UPDATE), false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder rooted at {@code baseDir}: plugins, builtin-plugins and data underneath it. */
    public static Builder builder(Path baseDir) {
        return new Builder()
                .pluginsDir(baseDir.resolve(DEFAULT_PLUGINS_DIR))
                .builtinPluginsDir(baseDir.resolve(DEFAULT_BUILTIN_PLUGINS_DIR))
                .dataDir(baseDir.resolve(DEFAULT_DATA_DIR));
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String stripTrailingSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }

    @Override
    public String toString() {
        return "PlugHubConfig{pluginsDir=" + pluginsDir + ", builtinPluginsDir=" + builtinPluginsDir
                + ", dataDir=" + dataDir + ", downloadDir=" + downloadDir + ", maxWorkers=" + maxWorkers
                + ", serverUrl=" + serverUrl + ", serverTimeout=" + serverTimeout
                + ", shutdownTimeout=" + shutdownTimeout + ", autoRestartOnUpdate=" + autoRestartOnUpdate + "}";
    }

    public static final class Builder {
        private Path pluginsDir = Paths.get(DEFAULT_PLUGINS_DIR);
        private Path builtinPluginsDir = Paths.get(DEFAULT_BUILTIN_PLUGINS_DIR);
        private Path dataDir = Paths.get(DEFAULT_DATA_DIR);
        private Path downloadDir;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private String serverUrl = DEFAULT_SERVER_URL;
        private Duration serverTimeout = Duration.ofSeconds(DEFAULT_SERVER_TIMEOUT_SECONDS);
        private Duration shutdownTimeout = Duration.ofSeconds(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
        private boolean autoRestartOnUpdate;

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = Objects.requireNonNull(pluginsDir, "pluginsDir");
            return this;
        }

        public Builder builtinPluginsDir(Path builtinPluginsDir) {
            this.builtinPluginsDir = Objects.requireNonNull(builtinPluginsDir, "builtinPluginsDir");
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
            return this;
        }

        /** Null = {@code <dataDir>/downloads}. */
        public Builder downloadDir(Path downloadDir) {
            this.downloadDir = downloadDir;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = Math.max(0, maxWorkers);
            return this;
        }

        public Builder serverUrl(String serverUrl) {
            this.serverUrl = serverUrl != null && !serverUrl.isBlank() ? serverUrl : DEFAULT_SERVER_URL;
            return this;
        }

        public Builder serverTimeout(Duration serverTimeout) {
            this.serverTimeout = serverTimeout != null ? serverTimeout : Duration.ofSeconds(DEFAULT_SERVER_TIMEOUT_SECONDS);
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
            return this;
        }

        public Builder autoRestartOnUpdate(boolean autoRestartOnUpdate) {
            this.autoRestartOnUpdate = autoRestartOnUpdate;
            return this;
        }

        public PlugHubConfig build() {
            return new PlugHubConfig(this);
        }
    }
}
