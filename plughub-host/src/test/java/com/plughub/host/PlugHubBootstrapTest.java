package com.plughub.host;

import com.plughub.config.PlugHubConfig;
import com.plughub.events.Event;
import com.plughub.manager.OperationResult;
import com.plughub.manager.PluginManager;
import com.plughub.plugin.PluginEvents;
import com.plughub.repository.JsonFilePluginRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlugHubBootstrapTest {

    @TempDir
    Path tmp;

    @Test
    void initialize_registersAndLoadsBuiltinEcho() {
        HostContext ctx = PlugHubBootstrap.initialize(config());
        try {
            PluginManager manager = ctx.getPluginManager();
            assertTrue(manager.isLoaded("echo"));
            OperationResult result = manager.process("echo", Map.of("input", "ping"));
            assertEquals("ECHO: ping", result.getData().get("responseText"));
            assertTrue(Files.isRegularFile(tmp.resolve("data").resolve(PlugHubBootstrap.REPOSITORY_FILE)));
        } finally {
            ctx.shutdown();
        }
    }

    @Test
    void initialize_restoresDisabledFlagFromRepositoryFile() {
        HostContext first = PlugHubBootstrap.initialize(config());
        assertTrue(first.getPluginManager().disable("echo").isSuccess());
        first.shutdown();

        HostContext second = PlugHubBootstrap.initialize(config());
        try {
            assertFalse(second.getPluginManager().isLoaded("echo"));
            assertFalse(second.getRepository().getPlugin("echo").orElseThrow().isEnabled());
            assertTrue(second.getRepository() instanceof JsonFilePluginRepository);
        } finally {
            second.shutdown();
        }
    }

    @Test
    void shutdown_stopsPluginsThenReleasesComponents() {
        HostContext ctx = PlugHubBootstrap.initialize(config());
        List<String> seen = new ArrayList<>();
        ctx.getEventBus().subscribe(PluginEvents.APP_STOPPING, e -> seen.add(e.type()));
        ctx.getEventBus().subscribe(PluginEvents.PLUGIN_UNLOADED, (Event e) -> seen.add(e.type()));

        ctx.shutdown();
        ctx.shutdown();

        assertEquals(2, seen.size());
        assertTrue(seen.containsAll(List.of(PluginEvents.APP_STOPPING, PluginEvents.PLUGIN_UNLOADED)));
        assertTrue(ctx.isShutdown());
        assertFalse(ctx.getPluginManager().isLoaded("echo"));
        assertTrue(ctx.getEventBus().isShutdown());
        assertTrue(ctx.getTaskExecutor().isShutdown());
    }

    @Test
    void asyncOperations_runOnTaskExecutor() throws Exception {
        HostContext ctx = PlugHubBootstrap.initialize(config());
        try {
            CompletableFuture<OperationResult> done = new CompletableFuture<>();
            ctx.getAsyncOperations().processAsync("echo", Map.of("prompt", "later"), done::complete);
            assertEquals("ECHO: later", done.get(5, TimeUnit.SECONDS).getData().get("responseText"));
        } finally {
            ctx.shutdown();
        }
    }

    private PlugHubConfig config() {
        return PlugHubConfig.builder(tmp)
                .maxWorkers(2)
                .serverUrl("http://127.0.0.1:9")
                .build();
    }
}
