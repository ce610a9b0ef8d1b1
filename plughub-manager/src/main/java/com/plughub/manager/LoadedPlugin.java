package com.plughub.manager;

import com.plughub.plugin.Plugin;
import com.plughub.plugin.PluginStatus;
import com.plughub.repository.PluginRecord;

import java.net.URLClassLoader;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime handle of a loaded plugin: the instance, the record it was loaded from and the class loader
 * it owns. Never persisted; exactly one per plugin id while loaded.
 * <p>
 * Calls into {@link Plugin#process} are counted; {@link #retire(Duration)} refuses new calls and waits
 * for the running ones before the plugin is stopped.
 */
public final class LoadedPlugin {

    private final PluginRecord record;
    private final Plugin plugin;
    private final URLClassLoader classLoader;
    private final Path pluginDir;
    private final Instant loadedAt;
    private volatile boolean paused;

    private final ReentrantLock callLock = new ReentrantLock();
    private final Condition drained = callLock.newCondition();
    private int inFlight;
    private boolean retired;

    LoadedPlugin(PluginRecord record, Plugin plugin, URLClassLoader classLoader, Path pluginDir, Instant loadedAt) {
        this.record = record;
        this.plugin = plugin;
        this.classLoader = classLoader;
        this.pluginDir = pluginDir;
        this.loadedAt = loadedAt;
    }

    public String getId() {
        return record.getId();
    }

    /** Record snapshot taken at load time. */
    public PluginRecord getRecord() {
        return record;
    }

    public Plugin getPlugin() {
        return plugin;
    }

    /** Installed directory; null for class-path builtins. */
    public Path getPluginDir() {
        return pluginDir;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public boolean isPaused() {
        return paused;
    }

    /** {@link PluginStatus#RUNNING} or {@link PluginStatus#PAUSED}. */
    public PluginStatus getState() {
        return paused ? PluginStatus.PAUSED : PluginStatus.RUNNING;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    /** Registers a processing call; false once the plugin is being unloaded. */
    boolean enter() {
        callLock.lock();
        try {
            if (retired) return false;
            inFlight++;
            return true;
        } finally {
            callLock.unlock();
        }
    }

    void exit() {
        callLock.lock();
        try {
            if (--inFlight == 0) {
                drained.signalAll();
            }
        } finally {
            callLock.unlock();
        }
    }

    /**
     * Refuses further calls and waits up to {@code wait} for the running ones.
     *
     * @return true if no call is still running
     */
    boolean retire(Duration wait) {
        callLock.lock();
        try {
            retired = true;
            long remaining = wait.toNanos();
            while (inFlight > 0 && remaining > 0) {
                remaining = drained.awaitNanos(remaining);
            }
            return inFlight == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return inFlight == 0;
        } finally {
            callLock.unlock();
        }
    }

    int getInFlightCount() {
        callLock.lock();
        try {
            return inFlight;
        } finally {
            callLock.unlock();
        }
    }

    /** Per-load class loader; null when the plugin lives on the host class path. */
    URLClassLoader getClassLoader() {
        return classLoader;
    }
}
