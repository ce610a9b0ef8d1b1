package com.plughub.manager;

import com.plughub.events.EventBus;
import com.plughub.plugin.Plugin;
import com.plughub.plugin.PluginContext;
import com.plughub.repository.PluginRecord;
import com.plughub.repository.PluginRepository;
import com.plughub.repository.RepositoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link PluginContext} handed out by {@link PluginManager}; settings are read from and written to
 * the repository on every call.
 */
final class DefaultPluginContext implements PluginContext {

    private static final Logger log = LoggerFactory.getLogger(DefaultPluginContext.class);

    private final PluginRecord record;
    private final Path pluginDir;
    private final Path dataDir;
    private final EventBus eventBus;
    private final PluginRepository repository;
    private final Function<String, Optional<Plugin>> pluginLookup;

    DefaultPluginContext(PluginRecord record, Path pluginDir, Path dataDir, EventBus eventBus,
                         PluginRepository repository, Function<String, Optional<Plugin>> pluginLookup) {
        this.record = record;
        this.pluginDir = pluginDir;
        this.dataDir = dataDir;
        this.eventBus = eventBus;
        this.repository = repository;
        this.pluginLookup = pluginLookup;
    }

    @Override
    public String getPluginId() {
        return record.getId();
    }

    @Override
    public String getVersion() {
        return record.getVersion();
    }

    @Override
    public Path getPluginDir() {
        return pluginDir;
    }

    @Override
    public Path getDataDir() {
        try {
            return Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create data directory of plugin " + record.getId(), e);
        }
    }

    @Override
    public Map<String, Object> getMetadata() {
        return record.getMetadata();
    }

    @Override
    public EventBus getEventBus() {
        return eventBus;
    }

    @Override
    public Map<String, Object> getSettings() {
        return repository.getAllPluginConfigs(record.getId());
    }

    @Override
    public Object getSetting(String key) {
        return repository.getPluginConfig(record.getId(), key).orElse(null);
    }

    @Override
    public boolean setSetting(String key, Object value) {
        try {
            repository.savePluginConfig(record.getId(), key, value);
            return true;
        } catch (RepositoryException e) {
            log.error("Failed to save setting {} of plugin {}: {}", key, record.getId(), e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Plugin> getPlugin(String pluginId) {
        return pluginLookup.apply(pluginId);
    }
}
