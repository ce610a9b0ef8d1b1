package com.plughub.manager;

import com.plughub.config.PlugHubConfig;
import com.plughub.events.EventBus;
import com.plughub.repository.InMemoryPluginRepository;
import com.plughub.tasks.TaskExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncPluginOperationsTest {

    @TempDir
    Path tmp;

    private EventBus eventBus;
    private TaskExecutor executor;
    private PluginManager manager;
    private AsyncPluginOperations async;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        executor = new TaskExecutor(2, new SimpleMeterRegistry());
        manager = PluginManager.builder()
                .config(PlugHubConfig.builder(tmp.resolve("home")).build())
                .repository(new InMemoryPluginRepository())
                .eventBus(eventBus)
                .build();
        manager.initialize();
        async = new AsyncPluginOperations(manager, executor);
    }

    @AfterEach
    void tearDown() {
        manager.onExit();
        executor.shutdown();
        eventBus.shutdown();
    }

    @Test
    void installAndProcessRunOnWorkerThreads() throws Exception {
        Path pkg = TestPackages.directory(tmp, "alpha", "1.0.0", TestPlugins.RecordingPlugin.class);
        CompletableFuture<OperationResult> installed = new CompletableFuture<>();
        CompletableFuture<String> callbackThread = new CompletableFuture<>();

        async.installAsync(pkg, true, false, r -> {
            callbackThread.complete(Thread.currentThread().getName());
            installed.complete(r);
        });

        assertTrue(installed.get(5, TimeUnit.SECONDS).isSuccess());
        assertTrue(callbackThread.get().startsWith("plughub-task-"));
        assertNotEquals(Thread.currentThread().getName(), callbackThread.get());

        CompletableFuture<OperationResult> processed = new CompletableFuture<>();
        async.processAsync("alpha", Map.of("n", 1), processed::complete);
        assertEquals("alpha", processed.get(5, TimeUnit.SECONDS).getData().get("handledBy"));
    }

    @Test
    void failuresArriveAsResults() throws Exception {
        CompletableFuture<OperationResult> removed = new CompletableFuture<>();
        async.uninstallAsync("ghost", false, removed::complete);
        assertEquals(PluginErrorKind.NOT_FOUND, removed.get(5, TimeUnit.SECONDS).getErrorKind());

        CompletableFuture<OperationResult> fetched = new CompletableFuture<>();
        async.installFromRemoteAsync("remote", false, fetched::complete);
        assertEquals(PluginErrorKind.INSTALL, fetched.get(5, TimeUnit.SECONDS).getErrorKind());

        assertTrue(executor.waitForIdle(5_000));
    }
}
