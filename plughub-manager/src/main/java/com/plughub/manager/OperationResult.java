package com.plughub.manager;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome of one {@link PluginManager} operation. Failures carry an error kind and message;
 * {@link #getData()} holds structured details (versions, blocking dependents, process output).
 */
public final class OperationResult {

    public static final String DATA_DEPENDENTS = "dependents";
    public static final String DATA_DEPENDENCY = "dependency";
    public static final String DATA_ERRORS = "errors";
    public static final String DATA_OLD_VERSION = "oldVersion";
    public static final String DATA_NEW_VERSION = "newVersion";
    public static final String DATA_VERSION = "version";
    public static final String DATA_LOADED = "loaded";
    public static final String DATA_LOAD_ERROR = "loadError";

    private final boolean success;
    private final String pluginId;
    private final PluginErrorKind errorKind;
    private final String message;
    private final Map<String, Object> data;

    private OperationResult(boolean success, String pluginId, PluginErrorKind errorKind, String message,
                            Map<String, Object> data) {
        this.success = success;
        this.pluginId = pluginId;
        this.errorKind = errorKind;
        this.message = message != null ? message : "";
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static OperationResult success(String pluginId, String message) {
        return new OperationResult(true, pluginId, null, message, null);
    }

    public static OperationResult success(String pluginId, String message, Map<String, Object> data) {
        return new OperationResult(true, pluginId, null, message, data);
    }

    public static OperationResult failure(String pluginId, PluginErrorKind kind, String message) {
        return new OperationResult(false, pluginId, kind, message, null);
    }

    public static OperationResult failure(String pluginId, PluginErrorKind kind, String message, Map<String, Object> data) {
        return new OperationResult(false, pluginId, kind, message, data);
    }

    /** Converts an exception, copying dependents, dependency or validation errors into the data. */
    public static OperationResult failure(PluginException e) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (e instanceof DependencyException de) {
            if (!de.getDependents().isEmpty()) {
                data.put(DATA_DEPENDENTS, List.copyOf(new TreeSet<>(de.getDependents())));
            }
            if (de.getDependency() != null) {
                data.put(DATA_DEPENDENCY, de.getDependency());
            }
        } else if (e instanceof ValidationException ve) {
            data.put(DATA_ERRORS, ve.getErrors());
        }
        return new OperationResult(false, e.getPluginId(), e.getKind(), e.getMessage(), data);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getPluginId() {
        return pluginId;
    }

    /** Null on success. */
    public PluginErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /** Loaded plugins that blocked an unload; empty otherwise. */
    public Set<String> getBlockingDependents() {
        Object deps = data.get(DATA_DEPENDENTS);
        if (deps instanceof List<?> list) {
            return Set.copyOf(list.stream().map(Object::toString).toList());
        }
        return Set.of();
    }

    @Override
    public String toString() {
        return success
                ? "OperationResult{success, pluginId=" + pluginId + ", message=" + message + "}"
                : "OperationResult{failure, pluginId=" + pluginId + ", kind=" + errorKind + ", message=" + message + "}";
    }
}
