package com.plughub.plugin;

import com.plughub.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Base class with status bookkeeping and repository-backed settings. Subclasses implement
 * {@link #process(Map)} and override the {@code on*} hooks they need.
 */
public abstract class AbstractPlugin implements PausablePlugin {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final Object lock = new Object();
    private volatile PluginStatus status = PluginStatus.INITIALIZED;
    private volatile String lastError;
    private PluginContext context;

    @Override
    public final boolean initialize(PluginContext context) throws Exception {
        this.context = Objects.requireNonNull(context, "context");
        return guarded(this::onInitialize, "initialize", null);
    }

    @Override
    public final boolean start() throws Exception {
        synchronized (lock) {
            boolean ok = guarded(this::onStart, "start", PluginStatus.RUNNING);
            if (ok) {
                log.info("Plugin {} started", getPluginId());
            }
            return ok;
        }
    }

    @Override
    public final boolean stop() throws Exception {
        synchronized (lock) {
            if (status == PluginStatus.STOPPED) return true;
            boolean ok = guarded(this::onStop, "stop", PluginStatus.STOPPED);
            if (ok) {
                log.info("Plugin {} stopped", getPluginId());
            }
            return ok;
        }
    }

    @Override
    public final void cleanup() throws Exception {
        onCleanup();
    }

    @Override
    public final boolean pause() throws Exception {
        synchronized (lock) {
            if (status == PluginStatus.PAUSED) return true;
            if (status != PluginStatus.RUNNING) return false;
            return guarded(this::onPause, "pause", PluginStatus.PAUSED);
        }
    }

    @Override
    public final boolean resume() throws Exception {
        synchronized (lock) {
            if (status == PluginStatus.RUNNING) return true;
            if (status != PluginStatus.PAUSED) return false;
            return guarded(this::onResume, "resume", PluginStatus.RUNNING);
        }
    }

    @Override
    public PluginStatus getStatus() {
        return status;
    }

    /** Message of the last failed lifecycle hook, or null. */
    public String getLastError() {
        return lastError;
    }

    protected boolean onInitialize() throws Exception {
        return true;
    }

    protected boolean onStart() throws Exception {
        return true;
    }

    protected boolean onStop() throws Exception {
        return true;
    }

    protected void onCleanup() throws Exception {
    }

    protected boolean onPause() throws Exception {
        return true;
    }

    protected boolean onResume() throws Exception {
        return true;
    }

    protected final PluginContext getContext() {
        if (context == null) {
            throw new IllegalStateException("Plugin " + getClass().getName() + " is not initialized");
        }
        return context;
    }

    protected final String getPluginId() {
        return context != null ? context.getPluginId() : getClass().getSimpleName();
    }

    protected final Object getSetting(String key, Object defaultValue) {
        return getContext().getSetting(key, defaultValue);
    }

    protected final boolean setSetting(String key, Object value) {
        return getContext().setSetting(key, value);
    }

    /** Publishes on the host event bus. */
    protected final void publish(String eventType, Map<String, Object> payload) {
        EventBus bus = getContext().getEventBus();
        if (bus != null) {
            bus.publish(eventType, payload);
        }
    }

    private boolean guarded(Hook hook, String phase, PluginStatus onSuccess) throws Exception {
        try {
            boolean ok = hook.run();
            if (ok) {
                if (onSuccess != null) status = onSuccess;
                lastError = null;
            } else {
                lastError = phase + " returned false";
            }
            return ok;
        } catch (Exception e) {
            status = PluginStatus.ERROR;
            lastError = phase + " failed: " + e.getMessage();
            throw e;
        }
    }

    @FunctionalInterface
    private interface Hook {
        boolean run() throws Exception;
    }
}
