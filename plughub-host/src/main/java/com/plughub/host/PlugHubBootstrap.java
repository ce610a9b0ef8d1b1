package com.plughub.host;

import com.plughub.config.PlugHubConfig;
import com.plughub.downloader.HttpPluginDownloader;
import com.plughub.events.EventBus;
import com.plughub.events.EventLoop;
import com.plughub.manager.BatchResult;
import com.plughub.manager.OperationResult;
import com.plughub.manager.PluginManager;
import com.plughub.plugin.PluginProvider;
import com.plughub.repository.JsonFilePluginRepository;
import com.plughub.repository.PluginRepository;
import com.plughub.tasks.TaskExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Bootstrap for the PlugHub host: builds configuration from the environment, wires the event bus,
 * task executor, repository and plugin manager, registers builtin plugins and loads every enabled
 * plugin. Must run on the thread that will drive the returned {@link HostContext#getEventLoop()}.
 */
public final class PlugHubBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PlugHubBootstrap.class);

    static final String REPOSITORY_FILE = "plugins.json";

    private PlugHubBootstrap() {
    }

    public static HostContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(PlugHubConfig.fromEnvironment());
    }

    /**
     * @throws IllegalStateException if the plugin directories cannot be created
     * @throws com.plughub.repository.RepositoryException if the repository file is unreadable
     */
    public static HostContext initialize(PlugHubConfig config) {
        log.info("Bootstrap: {}", config);
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        int workers = config.getMaxWorkers() > 0 ? config.getMaxWorkers() : TaskExecutor.defaultMaxWorkers();
        TaskExecutor taskExecutor = new TaskExecutor(workers, meterRegistry);
        EventLoop eventLoop = EventLoop.forCurrentThread();
        EventBus eventBus = new EventBus(eventLoop, config.getShutdownTimeout());
        PluginRepository repository = JsonFilePluginRepository.open(config.getDataDir().resolve(REPOSITORY_FILE));
        HttpPluginDownloader downloader = new HttpPluginDownloader(config);
        PluginManager pluginManager = PluginManager.builder()
                .config(config)
                .repository(repository)
                .eventBus(eventBus)
                .downloader(downloader)
                .meterRegistry(meterRegistry)
                .build();
        pluginManager.initialize();

        registerBuiltinProviders(pluginManager);
        BatchResult scanned = pluginManager.scanBuiltinDirectory();
        if (!scanned.getSucceeded().isEmpty()) {
            log.info("Bootstrap: builtin directory plugins {}", scanned.getSucceeded());
        }
        BatchResult loaded = pluginManager.loadInstalled();
        log.info("Bootstrap: {} plugins loaded, {} failed", loaded.getSucceeded().size(), loaded.getFailures().size());
        if (loaded.getSucceeded().isEmpty()) {
            log.warn("No plugins loaded; install packages into {} or add builtin providers", config.getPluginsDir());
        }
        return new HostContext(config, eventLoop, eventBus, taskExecutor, repository, pluginManager, downloader,
                meterRegistry);
    }

    /**
     * Registers every {@link PluginProvider} visible to {@link ServiceLoader}. A provider that fails
     * to instantiate or register is logged and skipped.
     */
    static int registerBuiltinProviders(PluginManager pluginManager) {
        int count = 0;
        for (ServiceLoader.Provider<PluginProvider> entry : ServiceLoader.load(PluginProvider.class).stream().toList()) {
            PluginProvider provider;
            try {
                provider = entry.get();
            } catch (ServiceConfigurationError e) {
                log.error("Builtin provider {} could not be created (skipping): {}", entry.type().getName(), e.getMessage(), e);
                continue;
            }
            OperationResult result = pluginManager.registerBuiltin(provider);
            if (result.isSuccess()) {
                count++;
                log.info("Registered builtin plugin {} (version={})", provider.getPluginId(), provider.getVersion());
            } else {
                log.error("Builtin plugin failed to register (skipping): pluginId={}, error={}",
                        provider.getPluginId(), result.getMessage());
            }
        }
        return count;
    }
}
