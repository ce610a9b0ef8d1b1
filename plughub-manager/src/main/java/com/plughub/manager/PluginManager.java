package com.plughub.manager;

import com.plughub.annotations.ResourceCleanup;
import com.plughub.config.PlugHubConfig;
import com.plughub.events.EventBus;
import com.plughub.plugin.ManifestException;
import com.plughub.plugin.PausablePlugin;
import com.plughub.plugin.Plugin;
import com.plughub.plugin.PluginDialect;
import com.plughub.plugin.PluginEvents;
import com.plughub.plugin.PluginFactories;
import com.plughub.plugin.PluginFactory;
import com.plughub.plugin.PluginLoadContext;
import com.plughub.plugin.PluginManifest;
import com.plughub.plugin.PluginProvider;
import com.plughub.plugin.PluginStatus;
import com.plughub.repository.PluginRecord;
import com.plughub.repository.PluginRepository;
import com.plughub.repository.RepositoryException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the plugin lifecycle: install, load, enable/disable, pause/resume, update, unload, uninstall.
 * <p>
 * Every operation returns an {@link OperationResult}; no exception leaves the manager. Lifecycle
 * transitions are serialized by one reentrant lock per manager, so at most one {@link LoadedPlugin}
 * exists per id and dependency loads can recurse on the same thread. Package staging (manifest
 * validation, archive extraction) runs before the lock is taken.
 * <p>
 * A plugin whose last transition failed is in error: it is treated as unavailable for dependency
 * purposes until a direct {@link #load(String)} / {@link #enable(String)} of it, or
 * {@link #loadInstalled()}, retries it.
 */
public final class PluginManager implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    static final String METRIC_LIFECYCLE = "plughub.plugin.lifecycle";
    static final String SUBSCRIBER_ID = "plugin-manager";

    private final PlugHubConfig config;
    private final PluginRepository repository;
    private final EventBus eventBus;
    private final PluginDownloader downloader;
    private final Map<String, PluginFactory> factories;
    private final MeterRegistry meterRegistry;
    private final ClassLoader parentClassLoader;
    private final Clock clock;
    private final PackageInstaller installer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, LoadedPlugin> loaded = new ConcurrentHashMap<>();
    /** ids in the order they finished loading; guarded by lock */
    private final List<String> loadSequence = new ArrayList<>();
    /** ids whose load is in progress on the lock-holding thread; guarded by lock */
    private final Set<String> loading = new LinkedHashSet<>();
    /** id → message of the last failed transition */
    private final Map<String, String> errors = new ConcurrentHashMap<>();
    private volatile boolean initialized;

    private PluginManager(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.repository = Objects.requireNonNull(b.repository, "repository");
        this.eventBus = Objects.requireNonNull(b.eventBus, "eventBus");
        this.downloader = b.downloader;
        this.factories = PluginFactories.byDialect(b.factories);
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
        this.parentClassLoader = b.parentClassLoader != null ? b.parentClassLoader : PluginManager.class.getClassLoader();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.installer = new PackageInstaller(config.getPluginsDir());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates the plugin directories and subscribes to {@value PluginEvents#APP_STOPPING}. Idempotent.
     *
     * @throws IllegalStateException if a directory cannot be created
     */
    public void initialize() {
        lock.lock();
        try {
            if (initialized) return;
            for (Path dir : List.of(config.getPluginsDir(), config.getBuiltinPluginsDir(), config.getDataDir().resolve("plugins"))) {
                try {
                    Files.createDirectories(dir);
                } catch (IOException e) {
                    throw new IllegalStateException("Cannot create plugin directory " + dir + ": " + e.getMessage(), e);
                }
            }
            eventBus.subscribe(PluginEvents.APP_STOPPING, event -> stopAll(), SUBSCRIBER_ID);
            initialized = true;
            log.info("Plugin manager initialized (plugins={}, builtin={}, dialects={})",
                    config.getPluginsDir(), config.getBuiltinPluginsDir(), factories.keySet());
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------ load / unload

    /**
     * Loads an enabled plugin and, depth-first, its dependencies. Success no-op if already loaded.
     */
    public OperationResult load(String pluginId) {
        return locked("load", pluginId, () -> {
            errors.remove(pluginId);
            LoadedPlugin lp = loadInternal(pluginId);
            return OperationResult.success(pluginId, "Plugin " + pluginId + " loaded",
                    Map.of(OperationResult.DATA_VERSION, lp.getRecord().getVersion()));
        });
    }

    /**
     * Stops and discards a loaded plugin. Success no-op if not loaded. Fails with
     * {@link PluginErrorKind#DEPENDENCY} while other loaded plugins depend on it.
     */
    public OperationResult unload(String pluginId) {
        return locked("unload", pluginId, () -> {
            if (!loaded.containsKey(pluginId)) {
                return OperationResult.success(pluginId, "Plugin " + pluginId + " is not loaded");
            }
            unloadInternal(pluginId, true);
            return OperationResult.success(pluginId, "Plugin " + pluginId + " unloaded");
        });
    }

    /**
     * Loads every enabled plugin in dependency order, tolerating individual failures, then publishes
     * {@value PluginEvents#PLUGINS_ALL_LOADED}. Clears all error marks first.
     */
    public BatchResult loadInstalled() {
        lock.lock();
        try {
            errors.clear();
            List<PluginRecord> enabled = repository.getAllPlugins(true);
            List<String> order = DependencyGraph.of(enabled).loadOrder();
            log.info("Loading {} enabled plugins in order {}", order.size(), order);
            BatchResult.Builder batch = BatchResult.builder();
            for (String id : order) {
                batch.add(id, load(id));
            }
            BatchResult result = batch.build();
            eventBus.publish(PluginEvents.PLUGINS_ALL_LOADED, Map.of("loaded", result.getSucceeded()));
            if (!result.isSuccess()) {
                log.warn("{} plugins failed to load: {}", result.getFailures().size(), result.getFailures().keySet());
            }
            return result;
        } catch (RepositoryException e) {
            log.error("Cannot read plugin records: {}", e.getMessage(), e);
            return BatchResult.builder()
                    .add("*", OperationResult.failure(null, PluginErrorKind.LOAD, e.getMessage()))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unloads every loaded plugin in reverse load order, tolerating failures.
     */
    public BatchResult stopAll() {
        lock.lock();
        try {
            List<String> order = new ArrayList<>(loadSequence);
            Collections.reverse(order);
            log.info("Stopping {} plugins", order.size());
            BatchResult.Builder batch = BatchResult.builder();
            for (String id : order) {
                try {
                    unloadInternal(id, false);
                    batch.add(id, OperationResult.success(id, "stopped"));
                } catch (PluginException e) {
                    batch.add(id, OperationResult.failure(e));
                } catch (RuntimeException e) {
                    log.error("Stopping plugin {} failed: {}", id, e.getMessage(), e);
                    batch.add(id, OperationResult.failure(id, PluginErrorKind.LOAD, e.getMessage()));
                }
            }
            return batch.build();
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------ install / uninstall / update

    /**
     * Installs a package (directory or .zip). The manifest is validated before anything is written.
     *
     * @param enable load the plugin after installing (a failed load leaves it installed but disabled)
     * @param force  replace an existing installation
     */
    public OperationResult installFromPackage(Path packagePath, boolean enable, boolean force) {
        Objects.requireNonNull(packagePath, "packagePath");
        StagedPackage staged;
        try {
            staged = installer.stage(packagePath);
        } catch (ManifestException e) {
            return record("install", OperationResult.failure(
                    new ValidationException(null, e.getMessage(), e.getErrors(), e)));
        } catch (IOException e) {
            return record("install", OperationResult.failure(null, PluginErrorKind.INSTALL,
                    "Cannot read plugin package " + packagePath + ": " + e.getMessage()));
        }
        try (staged) {
            String id = staged.manifest().getId();
            return locked("install", id, () -> {
                checkDialect(staged.manifest());
                PluginRecord record = commitInstall(staged, force, false);
                eventBus.publish(PluginEvents.PLUGIN_INSTALLED, Map.of(
                        "pluginId", id, "name", record.getName(), "version", record.getVersion(), "enabled", enable));
                Map<String, Object> data = new LinkedHashMap<>();
                data.put(OperationResult.DATA_VERSION, record.getVersion());
                String message = "Plugin " + record.getName() + " v" + record.getVersion() + " installed";
                if (enable) {
                    OperationResult enabled = enable(id);
                    data.put(OperationResult.DATA_LOADED, enabled.isSuccess());
                    if (!enabled.isSuccess()) {
                        data.put(OperationResult.DATA_LOAD_ERROR, enabled.getMessage());
                        message += " but could not be enabled: " + enabled.getMessage();
                    }
                }
                return OperationResult.success(id, message, data);
            });
        }
    }

    /** Fetches a package through the configured {@link PluginDownloader} and installs it. */
    public OperationResult installFromRemote(String pluginId, boolean enable) {
        Path pkg;
        try {
            pkg = fetch(pluginId);
        } catch (PluginException e) {
            return record("install", OperationResult.failure(e));
        }
        return installFromPackage(pkg, enable, false);
    }

    /**
     * Removes an installed (non-builtin) plugin, unloading it first.
     *
     * @param removeData also delete its settings and data directory
     */
    public OperationResult uninstall(String pluginId, boolean removeData) {
        return locked("uninstall", pluginId, () -> {
            PluginRecord record = requireRecord(pluginId);
            if (record.isBuiltin()) {
                throw new ValidationException(pluginId, "Builtin plugin " + pluginId + " cannot be uninstalled");
            }
            if (loaded.containsKey(pluginId)) {
                unloadInternal(pluginId, true);
            }
            Path dir = config.getPluginsDir().resolve(pluginId);
            try {
                PluginFiles.deleteRecursively(dir);
            } catch (IOException e) {
                throw new InstallException(pluginId, "Cannot remove " + dir + ": " + e.getMessage(), e);
            }
            repository.deletePlugin(pluginId);
            errors.remove(pluginId);
            if (removeData) {
                removeData(pluginId);
            }
            eventBus.publish(PluginEvents.PLUGIN_UNINSTALLED, Map.of(
                    "pluginId", pluginId, "name", record.getName(), "removeData", removeData));
            return OperationResult.success(pluginId, "Plugin " + record.getName() + " uninstalled");
        });
    }

    /**
     * Replaces an installed plugin with a new package of the same id.
     *
     * @param newPackagePath package to install; null = fetch the latest through the downloader
     * @param autoRestart    load the plugin afterwards even if it was disabled before
     */
    public OperationResult update(String pluginId, Path newPackagePath, boolean autoRestart) {
        Optional<PluginRecord> before;
        try {
            before = repository.getPlugin(pluginId);
        } catch (RepositoryException e) {
            return record("update", OperationResult.failure(pluginId, PluginErrorKind.INSTALL, e.getMessage()));
        }
        if (before.isEmpty()) {
            return record("update", OperationResult.failure(new NotFoundException(pluginId)));
        }
        if (before.get().isBuiltin()) {
            return record("update", OperationResult.failure(
                    new ValidationException(pluginId, "Builtin plugin " + pluginId + " cannot be updated")));
        }

        StagedPackage staged;
        try {
            Path source = newPackagePath != null ? newPackagePath : fetch(pluginId);
            staged = installer.stage(source);
        } catch (PluginException e) {
            return record("update", OperationResult.failure(e));
        } catch (ManifestException e) {
            return record("update", OperationResult.failure(
                    new ValidationException(pluginId, e.getMessage(), e.getErrors(), e)));
        } catch (IOException e) {
            return record("update", OperationResult.failure(pluginId, PluginErrorKind.INSTALL,
                    "Cannot read update package: " + e.getMessage()));
        }

        try (staged) {
            return locked("update", pluginId, () -> {
                PluginManifest manifest = staged.manifest();
                if (!manifest.getId().equals(pluginId)) {
                    throw new ValidationException(pluginId,
                            "Update package is for plugin " + manifest.getId() + ", not " + pluginId);
                }
                checkDialect(manifest);
                PluginRecord current = requireRecord(pluginId);
                boolean wasEnabled = current.isEnabled();
                boolean wasLoaded = loaded.containsKey(pluginId);
                if (wasLoaded) {
                    unloadInternal(pluginId, true);
                }
                PluginRecord updated;
                try {
                    updated = commitInstall(staged, true, wasEnabled || autoRestart);
                } catch (PluginException e) {
                    if (wasLoaded) {
                        restoreLoaded(pluginId);
                    }
                    throw e;
                }
                Map<String, Object> data = new LinkedHashMap<>();
                data.put(OperationResult.DATA_OLD_VERSION, current.getVersion());
                data.put(OperationResult.DATA_NEW_VERSION, updated.getVersion());
                if (updated.isEnabled()) {
                    OperationResult restarted = enable(pluginId);
                    data.put(OperationResult.DATA_LOADED, restarted.isSuccess());
                    if (!restarted.isSuccess()) {
                        data.put(OperationResult.DATA_LOAD_ERROR, restarted.getMessage());
                    }
                }
                eventBus.publish(PluginEvents.PLUGIN_UPDATED, Map.of(
                        "pluginId", pluginId, "name", updated.getName(),
                        "oldVersion", current.getVersion(), "newVersion", updated.getVersion()));
                return OperationResult.success(pluginId, "Plugin " + updated.getName() + " updated from v"
                        + current.getVersion() + " to v" + updated.getVersion(), data);
            });
        }
    }

    // ------------------------------------------------------------------ enable / disable / pause / resume

    /** Marks the plugin enabled and loads it; a failed load reverts the flag to disabled. */
    public OperationResult enable(String pluginId) {
        return locked("enable", pluginId, () -> {
            PluginRecord record = requireRecord(pluginId);
            boolean wasLoaded = loaded.containsKey(pluginId);
            errors.remove(pluginId);
            if (!record.isEnabled()) {
                repository.setEnabled(pluginId, true);
            }
            try {
                loadInternal(pluginId);
            } catch (PluginException e) {
                repository.setEnabled(pluginId, false);
                throw e;
            }
            if (!record.isEnabled() || !wasLoaded) {
                eventBus.publish(PluginEvents.PLUGIN_ENABLED, Map.of("pluginId", pluginId));
            }
            return OperationResult.success(pluginId, "Plugin " + pluginId + " enabled");
        });
    }

    /** Unloads the plugin (subject to the dependent rule) and marks it disabled. */
    public OperationResult disable(String pluginId) {
        return locked("disable", pluginId, () -> {
            PluginRecord record = requireRecord(pluginId);
            if (loaded.containsKey(pluginId)) {
                unloadInternal(pluginId, true);
            }
            if (record.isEnabled()) {
                repository.setEnabled(pluginId, false);
                eventBus.publish(PluginEvents.PLUGIN_DISABLED, Map.of("pluginId", pluginId));
            }
            errors.remove(pluginId);
            return OperationResult.success(pluginId, "Plugin " + pluginId + " disabled");
        });
    }

    /** Suspends a loaded plugin that implements {@link PausablePlugin}. */
    public OperationResult pause(String pluginId) {
        return locked("pause", pluginId, () -> {
            LoadedPlugin lp = requireLoaded(pluginId);
            if (lp.isPaused()) {
                return OperationResult.success(pluginId, "Plugin " + pluginId + " is already paused");
            }
            PausablePlugin p = requirePausable(lp);
            invokeToggle(pluginId, "pause", p::pause);
            lp.setPaused(true);
            eventBus.publish(PluginEvents.PLUGIN_PAUSED, Map.of("pluginId", pluginId));
            return OperationResult.success(pluginId, "Plugin " + pluginId + " paused");
        });
    }

    /** Resumes a paused plugin. */
    public OperationResult resume(String pluginId) {
        return locked("resume", pluginId, () -> {
            LoadedPlugin lp = requireLoaded(pluginId);
            if (!lp.isPaused()) {
                return OperationResult.success(pluginId, "Plugin " + pluginId + " is already running");
            }
            PausablePlugin p = requirePausable(lp);
            invokeToggle(pluginId, "resume", p::resume);
            lp.setPaused(false);
            eventBus.publish(PluginEvents.PLUGIN_RESUMED, Map.of("pluginId", pluginId));
            return OperationResult.success(pluginId, "Plugin " + pluginId + " resumed");
        });
    }

    // ------------------------------------------------------------------ runner

    /**
     * Runs {@link Plugin#process(Map)} of a loaded, running plugin on the calling thread (outside the
     * manager lock). The output map is the result data. An unload waits for running calls (up to the
     * shutdown timeout) before stopping the plugin, and calls arriving during the unload are refused.
     */
    public OperationResult process(String pluginId, Map<String, Object> input) {
        LoadedPlugin lp = loaded.get(pluginId);
        if (lp == null) {
            PluginException e = repository.getPlugin(pluginId).isPresent()
                    ? new LoadException(pluginId, "Plugin " + pluginId + " is not loaded")
                    : new NotFoundException(pluginId);
            return record("process", OperationResult.failure(e));
        }
        if (lp.isPaused()) {
            return record("process", OperationResult.failure(pluginId, PluginErrorKind.LOAD,
                    "Plugin " + pluginId + " is paused"));
        }
        if (!lp.enter()) {
            return record("process", OperationResult.failure(pluginId, PluginErrorKind.LOAD,
                    "Plugin " + pluginId + " is being unloaded"));
        }
        try {
            Map<String, Object> out = lp.getPlugin().process(input != null ? input : Map.of());
            return record("process", OperationResult.success(pluginId, "processed", out));
        } catch (Exception e) {
            log.warn("Plugin {} failed to process input: {}", pluginId, e.getMessage(), e);
            return record("process", OperationResult.failure(pluginId, PluginErrorKind.PROCESS,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            lp.exit();
        }
    }

    // ------------------------------------------------------------------ builtins

    /**
     * Registers (or refreshes) a builtin plugin shipped on the host class path. An existing record keeps
     * its enabled flag and install date.
     */
    public OperationResult registerBuiltin(PluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String id = provider.getPluginId();
        return locked("register", id, () -> {
            if (!provider.isAvailable()) {
                return OperationResult.success(id, "Builtin plugin " + id + " is not available; skipped");
            }
            if (!PluginManifest.isValidId(id) || !PluginManifest.isValidVersion(provider.getVersion())) {
                throw new ValidationException(id, "Builtin provider " + provider.getClass().getName()
                        + " has an invalid id or version: " + id + " v" + provider.getVersion());
            }
            Map<String, Object> metadata = new LinkedHashMap<>(provider.getMetadata());
            metadata.put(PluginRecord.META_DEPENDENCIES, List.copyOf(provider.getDependencies()));
            metadata.put(PluginRecord.META_MAIN, provider.getClass().getName());
            metadata.put(PluginRecord.META_DIALECT, PluginDialect.PROVIDER);
            PluginRecord record = saveBuiltin(PluginRecord.builder(id)
                    .name(provider.getName())
                    .version(provider.getVersion())
                    .author(provider.getAuthor())
                    .description(provider.getDescription())
                    .enabled(provider.isEnabledByDefault())
                    .metadata(metadata));
            return OperationResult.success(id, "Builtin plugin " + id + " registered",
                    Map.of(OperationResult.DATA_VERSION, record.getVersion()));
        });
    }

    /**
     * Registers every {@code <builtinPluginsDir>/<id>} directory holding a valid manifest. Invalid entries
     * are logged and reported, the rest still register.
     */
    public BatchResult scanBuiltinDirectory() {
        Path dir = config.getBuiltinPluginsDir();
        BatchResult.Builder batch = BatchResult.builder();
        if (!Files.isDirectory(dir)) {
            log.debug("Builtin plugins directory does not exist: {}", dir);
            return batch.build();
        }
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isDirectory)) {
            stream.forEach(candidates::add);
        } catch (IOException e) {
            log.warn("Failed to list builtin plugins directory {}: {}", dir, e.getMessage());
            return batch.build();
        }
        candidates.sort(null);
        for (Path pluginDir : candidates) {
            String name = pluginDir.getFileName().toString();
            if (!Files.isRegularFile(pluginDir.resolve(PluginManifest.FILE_NAME))) {
                continue;
            }
            OperationResult result = locked("register", name, () -> {
                PluginManifest manifest;
                try {
                    manifest = PluginManifest.readFromDirectory(pluginDir);
                } catch (ManifestException e) {
                    throw new ValidationException(name, e.getMessage(), e.getErrors(), e);
                }
                if (!manifest.getId().equals(name)) {
                    throw new ValidationException(name, "Builtin directory " + name
                            + " holds plugin " + manifest.getId());
                }
                checkDialect(manifest);
                saveBuiltin(PluginRecord.builder(manifest.getId())
                        .name(manifest.getName())
                        .version(manifest.getVersion())
                        .author(manifest.getAuthor())
                        .description(manifest.getDescription())
                        .enabled(true)
                        .metadata(manifest.toMetadata()));
                return OperationResult.success(name, "Builtin plugin " + name + " registered");
            });
            if (!result.isSuccess()) {
                log.warn("Skipping builtin plugin {}: {}", name, result.getMessage());
            }
            batch.add(name, result);
        }
        return batch.build();
    }

    // ------------------------------------------------------------------ queries

    public boolean isLoaded(String pluginId) {
        return loaded.containsKey(pluginId);
    }

    public Optional<LoadedPlugin> getLoadedPlugin(String pluginId) {
        return Optional.ofNullable(loaded.get(pluginId));
    }

    /** Ids in the order they were loaded. */
    public List<String> getLoadedPluginIds() {
        lock.lock();
        try {
            return List.copyOf(loadSequence);
        } finally {
            lock.unlock();
        }
    }

    /** Message of the last failed transition, if the plugin is in error. */
    public Optional<String> getError(String pluginId) {
        return Optional.ofNullable(errors.get(pluginId));
    }

    public Optional<PluginInfo> getPluginInfo(String pluginId) {
        try {
            return repository.getPlugin(pluginId).map(this::toInfo);
        } catch (RepositoryException e) {
            log.error("Cannot read plugin {}: {}", pluginId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public List<PluginInfo> getAllPluginInfo() {
        try {
            return repository.getAllPlugins(false).stream().map(this::toInfo).toList();
        } catch (RepositoryException e) {
            log.error("Cannot read plugin records: {}", e.getMessage(), e);
            return List.of();
        }
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    @Override
    public void onExit() {
        stopAll();
        eventBus.unsubscribe(PluginEvents.APP_STOPPING, SUBSCRIBER_ID);
    }

    // ------------------------------------------------------------------ internals (lock held)

    private LoadedPlugin loadInternal(String pluginId) {
        LoadedPlugin existing = loaded.get(pluginId);
        if (existing != null) {
            log.debug("Plugin {} already loaded", pluginId);
            return existing;
        }
        PluginRecord record = requireRecord(pluginId);
        if (!record.isEnabled()) {
            throw new LoadException(pluginId, "Plugin " + pluginId + " is disabled");
        }
        loading.add(pluginId);
        try {
            for (String dep : record.getDependencies()) {
                resolveDependency(pluginId, dep);
            }
            LoadedPlugin lp = instantiate(record);
            loaded.put(pluginId, lp);
            loadSequence.add(pluginId);
            errors.remove(pluginId);
            log.info("Plugin {} ({} v{}) loaded", pluginId, record.getName(), record.getVersion());
            eventBus.publish(PluginEvents.PLUGIN_LOADED, Map.of(
                    "pluginId", pluginId, "name", record.getName(), "version", record.getVersion()));
            return lp;
        } catch (PluginException e) {
            errors.put(pluginId, e.getMessage());
            throw e;
        } finally {
            loading.remove(pluginId);
        }
    }

    private void resolveDependency(String pluginId, String dep) {
        if (loaded.containsKey(dep)) {
            return;
        }
        if (loading.contains(dep)) {
            throw DependencyException.unresolved(pluginId, dep, "circular dependency", null);
        }
        Optional<PluginRecord> depRecord = repository.getPlugin(dep);
        if (depRecord.isEmpty()) {
            throw DependencyException.unresolved(pluginId, dep, "not installed", null);
        }
        if (!depRecord.get().isEnabled()) {
            throw DependencyException.unresolved(pluginId, dep, "disabled", null);
        }
        String depError = errors.get(dep);
        if (depError != null) {
            throw DependencyException.unresolved(pluginId, dep, "in error state (" + depError + ")", null);
        }
        try {
            loadInternal(dep);
        } catch (PluginException e) {
            throw DependencyException.unresolved(pluginId, dep, e.getMessage(), e);
        }
    }

    private LoadedPlugin instantiate(PluginRecord record) {
        String id = record.getId();
        String dialect = record.getDialect(PluginDialect.CLASS);
        PluginFactory factory = factories.get(dialect);
        if (factory == null) {
            throw new LoadException(id, "Unsupported plugin dialect '" + dialect + "'");
        }
        Path dir = resolvePluginDir(record);
        URLClassLoader ownLoader = null;
        ClassLoader classLoader = parentClassLoader;
        if (dir != null) {
            try {
                ownLoader = PluginClassLoaders.create(id, dir, parentClassLoader);
                classLoader = ownLoader;
            } catch (IOException e) {
                throw new LoadException(id, "Cannot build class path of plugin " + id + ": " + e.getMessage(), e);
            }
        }

        List<String> missing = missingClasses(record.getRequiredClasses(), classLoader);
        if (!missing.isEmpty()) {
            PluginClassLoaders.close(id, ownLoader);
            throw new LoadException(id, "Plugin " + id + " requires classes that are not available: " + missing);
        }

        Plugin plugin;
        try {
            plugin = factory.create(new PluginLoadContext(id, record.getMain(), classLoader, dir, record.getMetadata()));
            if (plugin == null) {
                throw new IllegalStateException("factory returned no instance");
            }
        } catch (Exception | LinkageError e) {
            PluginClassLoaders.close(id, ownLoader);
            throw new LoadException(id, "Cannot instantiate plugin " + id + ": " + describe(e), e);
        }

        DefaultPluginContext context = new DefaultPluginContext(record, dir, config.getPluginDataDir(id),
                eventBus, repository, other -> getLoadedPlugin(other).map(LoadedPlugin::getPlugin));
        String failure;
        Throwable cause = null;
        try {
            if (!plugin.initialize(context)) {
                failure = "initialize() returned false";
            } else if (!plugin.start()) {
                failure = "start() returned false";
            } else {
                failure = null;
            }
        } catch (Exception | LinkageError e) {
            failure = "startup failed: " + describe(e);
            cause = e;
        }
        if (failure != null) {
            shutdownQuietly(id, plugin);
            PluginClassLoaders.close(id, ownLoader);
            throw new LoadException(id, "Plugin " + id + " " + failure, cause);
        }
        return new LoadedPlugin(record, plugin, ownLoader, dir, clock.instant());
    }

    private static List<String> missingClasses(List<String> classNames, ClassLoader classLoader) {
        List<String> missing = new ArrayList<>();
        for (String className : classNames) {
            try {
                Class.forName(className, false, classLoader);
            } catch (ClassNotFoundException | LinkageError e) {
                missing.add(className);
            }
        }
        return missing;
    }

    /** Installed directory for the record, or null for a builtin served from the host class path. */
    private Path resolvePluginDir(PluginRecord record) {
        if (record.isBuiltin()) {
            Path dir = config.getBuiltinPluginsDir().resolve(record.getId());
            return Files.isDirectory(dir) ? dir : null;
        }
        Path dir = config.getPluginsDir().resolve(record.getId());
        if (!Files.isDirectory(dir)) {
            throw new LoadException(record.getId(), "Plugin directory " + dir + " does not exist");
        }
        return dir;
    }

    private void unloadInternal(String pluginId, boolean checkDependents) {
        LoadedPlugin lp = loaded.get(pluginId);
        if (lp == null) return;
        if (checkDependents) {
            Set<String> dependents = findDependents(pluginId);
            if (!dependents.isEmpty()) {
                throw DependencyException.blockedBy(pluginId, dependents);
            }
        }
        loaded.remove(pluginId);
        loadSequence.remove(pluginId);
        if (!lp.retire(config.getShutdownTimeout())) {
            log.warn("Plugin {} still has {} running process calls after {}; stopping it anyway",
                    pluginId, lp.getInFlightCount(), config.getShutdownTimeout());
        }
        Plugin plugin = lp.getPlugin();
        try {
            if (!plugin.stop()) {
                log.warn("Plugin {} reported an unclean stop", pluginId);
            }
        } catch (Exception e) {
            log.error("Plugin {} failed to stop: {}", pluginId, e.getMessage(), e);
        }
        try {
            plugin.cleanup();
        } catch (Exception e) {
            log.error("Plugin {} failed to clean up: {}", pluginId, e.getMessage(), e);
        }
        PluginClassLoaders.close(pluginId, lp.getClassLoader());
        log.info("Plugin {} unloaded", pluginId);
        eventBus.publish(PluginEvents.PLUGIN_UNLOADED, Map.of("pluginId", pluginId));
    }

    /** Loaded or loading plugins declaring {@code pluginId} as a dependency. */
    private Set<String> findDependents(String pluginId) {
        Set<String> dependents = new LinkedHashSet<>();
        for (LoadedPlugin other : loaded.values()) {
            if (!other.getId().equals(pluginId) && other.getRecord().getDependencies().contains(pluginId)) {
                dependents.add(other.getId());
            }
        }
        for (String id : loading) {
            if (!id.equals(pluginId)) {
                repository.getPlugin(id)
                        .filter(r -> r.getDependencies().contains(pluginId))
                        .ifPresent(r -> dependents.add(id));
            }
        }
        return dependents;
    }

    /**
     * Swaps the staged package into {@code <pluginsDir>/<id>} and saves the record; on failure the
     * previous directory comes back and the old record stays authoritative.
     */
    private PluginRecord commitInstall(StagedPackage staged, boolean force, boolean enabled) {
        PluginManifest manifest = staged.manifest();
        String id = manifest.getId();
        Optional<PluginRecord> existing = repository.getPlugin(id);
        if (existing.isPresent()) {
            if (existing.get().isBuiltin()) {
                throw new ValidationException(id, "Plugin " + id + " is builtin and cannot be replaced");
            }
            if (!force) {
                throw new InstallException(id, "Plugin " + existing.get().getName() + " (" + id
                        + ") is already installed, version " + existing.get().getVersion());
            }
            if (loaded.containsKey(id)) {
                unloadInternal(id, true);
            }
        }
        if (manifest.isBuiltin()) {
            log.warn("Ignoring builtin flag in manifest of user-installed plugin {}", id);
        }
        Path target = config.getPluginsDir().resolve(id);
        PackageInstaller.Backup backup;
        try {
            backup = installer.commit(staged, target);
        } catch (IOException e) {
            throw new InstallException(id, "Cannot copy plugin " + id + " to " + target + ": " + e.getMessage(), e);
        }
        PluginRecord record = PluginRecord.builder(id)
                .name(manifest.getName())
                .version(manifest.getVersion())
                .author(manifest.getAuthor())
                .description(manifest.getDescription())
                .enabled(enabled)
                .builtin(false)
                .installDate(clock.instant())
                .metadata(manifest.toMetadata())
                .build();
        try {
            repository.savePlugin(record);
        } catch (RuntimeException e) {
            backup.restore();
            throw new InstallException(id, "Cannot save record of plugin " + id + ": " + e.getMessage(), e);
        }
        backup.discard();
        errors.remove(id);
        log.info("Plugin {} v{} installed into {}", id, record.getVersion(), target);
        return record;
    }

    private PluginRecord saveBuiltin(PluginRecord.Builder builder) {
        PluginRecord fresh = builder.builtin(true).installDate(clock.instant()).build();
        Optional<PluginRecord> existing = repository.getPlugin(fresh.getId());
        if (existing.isPresent() && !existing.get().isBuiltin()) {
            throw new ValidationException(fresh.getId(),
                    "Builtin plugin " + fresh.getId() + " conflicts with an installed plugin of the same id");
        }
        PluginRecord record = existing
                .map(prev -> fresh.toBuilder().enabled(prev.isEnabled()).installDate(prev.getInstallDate()).build())
                .orElse(fresh);
        repository.savePlugin(record);
        log.info("Builtin plugin {} v{} registered (enabled={})", record.getId(), record.getVersion(), record.isEnabled());
        return record;
    }

    private void restoreLoaded(String pluginId) {
        try {
            loadInternal(pluginId);
        } catch (PluginException e) {
            log.error("Could not reload plugin {} after a failed update: {}", pluginId, e.getMessage());
        }
    }

    private void removeData(String pluginId) {
        repository.deleteAllPluginConfigs(pluginId);
        Path dataDir = config.getPluginDataDir(pluginId);
        try {
            PluginFiles.deleteRecursively(dataDir);
        } catch (IOException e) {
            log.warn("Failed to remove data directory {} of plugin {}: {}", dataDir, pluginId, e.getMessage());
        }
    }

    private Path fetch(String pluginId) {
        if (downloader == null) {
            throw new InstallException(pluginId, "No plugin downloader configured");
        }
        try {
            Path pkg = downloader.fetchPackage(pluginId);
            log.info("Fetched package of plugin {}: {}", pluginId, pkg);
            return pkg;
        } catch (IOException | RuntimeException e) {
            throw new InstallException(pluginId, "Cannot download plugin " + pluginId + ": " + e.getMessage(), e);
        }
    }

    private void checkDialect(PluginManifest manifest) {
        if (!factories.containsKey(manifest.getDialect())) {
            throw new ValidationException(manifest.getId(), "Unsupported plugin dialect '" + manifest.getDialect()
                    + "' (supported: " + factories.keySet() + ")");
        }
    }

    private PluginRecord requireRecord(String pluginId) {
        return repository.getPlugin(pluginId).orElseThrow(() -> new NotFoundException(pluginId));
    }

    private LoadedPlugin requireLoaded(String pluginId) {
        LoadedPlugin lp = loaded.get(pluginId);
        if (lp == null) {
            requireRecord(pluginId);
            throw new LoadException(pluginId, "Plugin " + pluginId + " is not loaded");
        }
        return lp;
    }

    private static PausablePlugin requirePausable(LoadedPlugin lp) {
        if (lp.getPlugin() instanceof PausablePlugin p) {
            return p;
        }
        throw new ValidationException(lp.getId(), "Plugin " + lp.getId() + " does not support pause/resume");
    }

    private void invokeToggle(String pluginId, String action, Toggle toggle) {
        boolean ok;
        try {
            ok = toggle.run();
        } catch (Exception e) {
            errors.put(pluginId, action + " failed: " + e.getMessage());
            throw new LoadException(pluginId, "Plugin " + pluginId + " failed to " + action + ": " + e.getMessage(), e);
        }
        if (!ok) {
            throw new LoadException(pluginId, "Plugin " + pluginId + " refused to " + action);
        }
    }

    private PluginInfo toInfo(PluginRecord record) {
        LoadedPlugin lp = loaded.get(record.getId());
        String error = errors.get(record.getId());
        Map<String, Object> settings = repository.getAllPluginConfigs(record.getId());
        if (lp == null) {
            return new PluginInfo(record, false, error != null ? PluginStatus.ERROR : PluginStatus.STOPPED,
                    error, settings, Map.of(), null);
        }
        Map<String, Object> runtime;
        PluginStatus status;
        try {
            runtime = lp.getPlugin().getInfo();
            status = lp.getPlugin().getStatus();
        } catch (RuntimeException e) {
            log.warn("Plugin {} failed to report its status: {}", record.getId(), e.getMessage());
            runtime = Map.of();
            status = PluginStatus.ERROR;
        }
        return new PluginInfo(lp.getRecord(), true, status != null ? status : lp.getState(), error, settings,
                runtime, lp.getLoadedAt());
    }

    private static void shutdownQuietly(String pluginId, Plugin plugin) {
        try {
            plugin.stop();
        } catch (Exception e) {
            log.debug("stop() of half-started plugin {} failed: {}", pluginId, e.getMessage());
        }
        try {
            plugin.cleanup();
        } catch (Exception e) {
            log.debug("cleanup() of half-started plugin {} failed: {}", pluginId, e.getMessage());
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Runs {@code body} under the manager lock, converting exceptions into a failed result and
     * counting the outcome.
     */
    private OperationResult locked(String operation, String pluginId, Supplier<OperationResult> body) {
        lock.lock();
        try {
            return record(operation, body.get());
        } catch (PluginException e) {
            log.warn("{} of plugin {} failed: {}", operation, pluginId, e.getMessage());
            return record(operation, OperationResult.failure(e));
        } catch (RepositoryException e) {
            log.error("{} of plugin {} failed in the repository: {}", operation, pluginId, e.getMessage(), e);
            return record(operation, OperationResult.failure(pluginId, PluginErrorKind.INSTALL, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("{} of plugin {} failed unexpectedly: {}", operation, pluginId, e.getMessage(), e);
            return record(operation, OperationResult.failure(pluginId, PluginErrorKind.LOAD, describe(e)));
        } finally {
            lock.unlock();
        }
    }

    private OperationResult record(String operation, OperationResult result) {
        String outcome = result.isSuccess() ? "success" : result.getErrorKind().name().toLowerCase();
        meterRegistry.counter(METRIC_LIFECYCLE, "operation", operation, "outcome", outcome).increment();
        return result;
    }

    @FunctionalInterface
    private interface Toggle {
        boolean run() throws Exception;
    }

    public static final class Builder {
        private PlugHubConfig config;
        private PluginRepository repository;
        private EventBus eventBus;
        private PluginDownloader downloader;
        private final List<PluginFactory> factories = new ArrayList<>(PluginFactories.defaults());
        private MeterRegistry meterRegistry;
        private ClassLoader parentClassLoader;
        private Clock clock;

        public Builder config(PlugHubConfig config) {
            this.config = config;
            return this;
        }

        public Builder repository(PluginRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder downloader(PluginDownloader downloader) {
            this.downloader = downloader;
            return this;
        }

        /** Adds a factory; it replaces a shipped factory of the same dialect. */
        public Builder factory(PluginFactory factory) {
            this.factories.add(Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /** Parent of every per-plugin class loader; default the loader of this class. */
        public Builder parentClassLoader(ClassLoader parentClassLoader) {
            this.parentClassLoader = parentClassLoader;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PluginManager build() {
            return new PluginManager(this);
        }
    }
}
