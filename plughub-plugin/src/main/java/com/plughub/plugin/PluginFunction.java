package com.plughub.plugin;

import java.util.Map;

/**
 * Minimal plugin entry point: one stateless processing function. The host wraps it in a
 * {@link FunctionPluginAdapter} so it gets the full lifecycle.
 */
@FunctionalInterface
public interface PluginFunction {

    Map<String, Object> apply(Map<String, Object> input, PluginContext context) throws Exception;
}
