package com.plughub.plugin;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adapts a {@link PluginFunction} to the {@link Plugin} lifecycle.
 */
public final class FunctionPluginAdapter extends AbstractPlugin {

    private final PluginFunction function;
    private final AtomicLong invocations = new AtomicLong();

    public FunctionPluginAdapter(PluginFunction function) {
        this.function = Objects.requireNonNull(function, "function");
    }

    @Override
    public Map<String, Object> process(Map<String, Object> input) throws Exception {
        if (getStatus() != PluginStatus.RUNNING) {
            throw new IllegalStateException("Plugin " + getPluginId() + " is not running (" + getStatus() + ")");
        }
        invocations.incrementAndGet();
        Map<String, Object> out = function.apply(input, getContext());
        return out != null ? out : Map.of();
    }

    @Override
    public Map<String, Object> getInfo() {
        return Map.of("function", function.getClass().getName(), "invocations", invocations.get());
    }

    public PluginFunction getFunction() {
        return function;
    }
}
