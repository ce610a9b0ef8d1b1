package com.plughub.plugin.echo;

import com.plughub.config.PlugHubConfig;
import com.plughub.events.EventBus;
import com.plughub.manager.OperationResult;
import com.plughub.manager.PluginManager;
import com.plughub.plugin.PluginProvider;
import com.plughub.repository.InMemoryPluginRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoPluginTest {

    @TempDir
    Path tmp;

    private InMemoryPluginRepository repository;
    private EventBus eventBus;
    private PluginManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryPluginRepository();
        eventBus = new EventBus();
        manager = PluginManager.builder()
                .config(PlugHubConfig.builder(tmp).build())
                .repository(repository)
                .eventBus(eventBus)
                .build();
        manager.initialize();
    }

    @AfterEach
    void tearDown() {
        manager.onExit();
        eventBus.shutdown();
    }

    @Test
    void provider_isDiscoveredThroughServiceLoader() {
        List<String> ids = ServiceLoader.load(PluginProvider.class).stream()
                .map(p -> p.get().getPluginId())
                .toList();

        assertTrue(ids.contains(EchoPluginProvider.PLUGIN_ID), ids.toString());
    }

    @Test
    void echo_prefixesInputOrPrompt() {
        startEcho();

        assertEquals("ECHO: hello", process(Map.of("input", " hello ")));
        assertEquals("ECHO: plan", process(Map.of("prompt", "plan")));
        assertEquals("ECHO: ", process(Map.of()));
        assertEquals(3L, manager.getPluginInfo("echo").orElseThrow().runtimeInfo().get("invocations"));
    }

    @Test
    void echo_readsPrefixSetting() {
        repository.savePluginConfig("echo", EchoPlugin.SETTING_PREFIX, ">> ");
        startEcho();

        assertEquals(">> hi", process(Map.of("input", "hi")));
    }

    private void startEcho() {
        assertTrue(manager.registerBuiltin(new EchoPluginProvider()).isSuccess());
        assertTrue(manager.loadInstalled().isSuccess());
    }

    private String process(Map<String, Object> input) {
        OperationResult result = manager.process("echo", input);
        assertTrue(result.isSuccess(), result.getMessage());
        return (String) result.getData().get(EchoPlugin.KEY_RESPONSE_TEXT);
    }
}
