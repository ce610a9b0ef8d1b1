package com.plughub.plugin;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PluginFactoriesTest {

    private final ClassLoader loader = getClass().getClassLoader();
    private final Map<String, PluginFactory> factories = PluginFactories.byDialect(PluginFactories.defaults());

    @Test
    void classDialect_instantiatesMainClass() throws Exception {
        Plugin plugin = factories.get(PluginDialect.CLASS).create(context(SamplePlugin.class.getName()));
        assertInstanceOf(SamplePlugin.class, plugin);
    }

    @Test
    void functionDialect_wrapsFunction() throws Exception {
        Plugin plugin = factories.get(PluginDialect.FUNCTION).create(context(UpperCaseFunction.class.getName()));
        FunctionPluginAdapter adapter = assertInstanceOf(FunctionPluginAdapter.class, plugin);
        assertInstanceOf(UpperCaseFunction.class, adapter.getFunction());
    }

    @Test
    void providerDialect_asksProviderForInstance() throws Exception {
        Plugin plugin = factories.get(PluginDialect.PROVIDER).create(context(SampleProvider.class.getName()));
        assertInstanceOf(SamplePlugin.class, plugin);
    }

    @Test
    void create_failsForMissingOrWrongMain() {
        assertThrows(ClassNotFoundException.class, () -> factories.get(PluginDialect.CLASS).create(context(null)));
        assertThrows(ClassNotFoundException.class,
                () -> factories.get(PluginDialect.CLASS).create(context("org.example.Missing")));
        assertThrows(ClassCastException.class,
                () -> factories.get(PluginDialect.CLASS).create(context(UpperCaseFunction.class.getName())));
    }

    @Test
    void byDialect_laterFactoryWins() {
        PluginFactory custom = new PluginFactory() {
            @Override
            public String dialect() {
                return PluginDialect.CLASS;
            }

            @Override
            public Plugin create(PluginLoadContext context) {
                return new SamplePlugin();
            }
        };
        Map<String, PluginFactory> map = PluginFactories.byDialect(
                List.of(new ClassPluginFactory(), custom));
        assertEquals(1, map.size());
        assertEquals(custom, map.get(PluginDialect.CLASS));
    }

    private PluginLoadContext context(String main) {
        return new PluginLoadContext("sample", main, loader, null, Map.of());
    }

    public static final class SamplePlugin extends AbstractPlugin {
        @Override
        public Map<String, Object> process(Map<String, Object> input) {
            return input;
        }
    }

    public static final class UpperCaseFunction implements PluginFunction {
        @Override
        public Map<String, Object> apply(Map<String, Object> input, PluginContext context) {
            return Map.of("text", String.valueOf(input.get("text")).toUpperCase());
        }
    }

    public static final class SampleProvider implements PluginProvider {
        @Override
        public String getPluginId() {
            return "sample";
        }

        @Override
        public String getName() {
            return "Sample";
        }

        @Override
        public Plugin createPlugin() {
            return new SamplePlugin();
        }
    }
}
