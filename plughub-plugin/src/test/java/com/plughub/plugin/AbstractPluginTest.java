package com.plughub.plugin;

import com.plughub.events.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AbstractPluginTest {

    private final EventBus bus = new EventBus();

    @AfterEach
    void tearDown() {
        bus.shutdown();
    }

    @Test
    void lifecycle_tracksStatusThroughPauseAndStop() throws Exception {
        CounterPlugin plugin = new CounterPlugin();
        assertEquals(PluginStatus.INITIALIZED, plugin.getStatus());

        assertTrue(plugin.initialize(new TestPluginContext("counter", bus)));
        assertFalse(plugin.resume());
        assertTrue(plugin.start());
        assertEquals(PluginStatus.RUNNING, plugin.getStatus());
        assertTrue(plugin.pause());
        assertEquals(PluginStatus.PAUSED, plugin.getStatus());
        assertTrue(plugin.pause());
        assertTrue(plugin.resume());
        assertEquals(PluginStatus.RUNNING, plugin.getStatus());
        assertTrue(plugin.stop());
        assertEquals(PluginStatus.STOPPED, plugin.getStatus());
        assertFalse(plugin.pause());
    }

    @Test
    void start_throwingHookMovesToErrorAndRethrows() throws Exception {
        CounterPlugin plugin = new CounterPlugin();
        plugin.failStart = true;
        plugin.initialize(new TestPluginContext("counter", bus));

        assertThrows(IllegalStateException.class, plugin::start);
        assertEquals(PluginStatus.ERROR, plugin.getStatus());
        assertTrue(plugin.getLastError().startsWith("start failed"));
    }

    @Test
    void settingsAndPublishGoThroughContext() throws Exception {
        List<Object> events = new ArrayList<>();
        bus.subscribe("counter.tick", e -> events.add(e.payloadAsMap().get("count")));
        CounterPlugin plugin = new CounterPlugin();
        plugin.initialize(new TestPluginContext("counter", bus));
        plugin.start();

        plugin.process(Map.of());
        Map<String, Object> out = plugin.process(Map.of());

        assertEquals(2, out.get("count"));
        assertEquals(List.of(1, 2), events);
    }

    @Test
    void getContext_beforeInitializeFails() {
        assertThrows(IllegalStateException.class, () -> new CounterPlugin().process(Map.of()));
    }

    @Test
    void functionAdapter_requiresRunningAndWrapsFunction() throws Exception {
        FunctionPluginAdapter adapter = new FunctionPluginAdapter((input, ctx) -> Map.of("id", ctx.getPluginId()));
        adapter.initialize(new TestPluginContext("fn", bus));

        assertThrows(IllegalStateException.class, () -> adapter.process(Map.of()));
        adapter.start();
        assertEquals(Map.of("id", "fn"), adapter.process(Map.of()));
        assertEquals(1L, adapter.getInfo().get("invocations"));
    }

    static final class CounterPlugin extends AbstractPlugin {
        boolean failStart;

        @Override
        protected boolean onStart() {
            if (failStart) throw new IllegalStateException("port in use");
            return true;
        }

        @Override
        public Map<String, Object> process(Map<String, Object> input) {
            int count = ((Integer) getSetting("count", 0)) + 1;
            setSetting("count", count);
            publish("counter.tick", Map.of("count", count));
            return Map.of("count", count);
        }
    }
}
