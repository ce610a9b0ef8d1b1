package com.plughub.host;

import com.plughub.annotations.ResourceCleanup;
import com.plughub.config.PlugHubConfig;
import com.plughub.downloader.HttpPluginDownloader;
import com.plughub.events.EventBus;
import com.plughub.events.EventLoop;
import com.plughub.manager.AsyncPluginOperations;
import com.plughub.manager.PluginManager;
import com.plughub.plugin.PluginEvents;
import com.plughub.repository.PluginRepository;
import com.plughub.tasks.TaskExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wrapper returned from {@link PlugHubBootstrap}: the wired host components plus the ordered
 * shutdown sequence.
 */
public final class HostContext {

    private static final Logger log = LoggerFactory.getLogger(HostContext.class);

    private final PlugHubConfig config;
    private final EventLoop eventLoop;
    private final EventBus eventBus;
    private final TaskExecutor taskExecutor;
    private final PluginRepository repository;
    private final PluginManager pluginManager;
    private final HttpPluginDownloader downloader;
    private final AsyncPluginOperations asyncOperations;
    private final MeterRegistry meterRegistry;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    HostContext(PlugHubConfig config, EventLoop eventLoop, EventBus eventBus, TaskExecutor taskExecutor,
                PluginRepository repository, PluginManager pluginManager, HttpPluginDownloader downloader,
                MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.eventLoop = eventLoop;
        this.eventBus = eventBus;
        this.taskExecutor = taskExecutor;
        this.repository = repository;
        this.pluginManager = pluginManager;
        this.downloader = downloader;
        this.meterRegistry = meterRegistry;
        this.asyncOperations = new AsyncPluginOperations(pluginManager, taskExecutor);
    }

    public PlugHubConfig getConfig() {
        return config;
    }

    /** Loop of the thread that ran the bootstrap; owner-thread events are queued here. */
    public EventLoop getEventLoop() {
        return eventLoop;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public TaskExecutor getTaskExecutor() {
        return taskExecutor;
    }

    public PluginRepository getRepository() {
        return repository;
    }

    public PluginManager getPluginManager() {
        return pluginManager;
    }

    public HttpPluginDownloader getDownloader() {
        return downloader;
    }

    public AsyncPluginOperations getAsyncOperations() {
        return asyncOperations;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Announces {@value PluginEvents#APP_STOPPING} (plugins stop on it), waits up to the shutdown timeout
     * for running tasks, then releases the manager, event bus and task executor in that order.
     * Runs once; later calls return immediately.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        Duration timeout = config.getShutdownTimeout();
        log.info("Shutting down host (timeout {}s)", timeout.toSeconds());
        eventBus.publish(PluginEvents.APP_STOPPING, Map.of());
        if (!taskExecutor.waitForIdle(timeout.toMillis())) {
            log.warn("{} tasks still running after {}s; shutting down anyway",
                    taskExecutor.getPendingCount(), timeout.toSeconds());
        }
        if (!eventBus.flush(timeout)) {
            log.warn("Async events still queued after {}s", timeout.toSeconds());
        }
        invokeResourceCleanup(List.of(pluginManager, eventBus, taskExecutor));
        log.info("Host stopped");
    }

    private static void invokeResourceCleanup(List<ResourceCleanup> components) {
        for (ResourceCleanup component : components) {
            try {
                component.onExit();
            } catch (Exception e) {
                log.warn("{} onExit failed: {}", component.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
