package com.plughub.manager;

import java.util.Set;
import java.util.TreeSet;

/**
 * Dependency problem: either a dependency of {@code pluginId} cannot be resolved, or {@code pluginId}
 * cannot be unloaded because loaded plugins depend on it.
 */
public class DependencyException extends PluginException {

    private final String dependency;
    private final Set<String> dependents;

    private DependencyException(String pluginId, String message, String dependency, Set<String> dependents, Throwable cause) {
        super(PluginErrorKind.DEPENDENCY, pluginId, message, cause);
        this.dependency = dependency;
        this.dependents = Set.copyOf(dependents);
    }

    /** {@code pluginId} needs {@code dependency}, which is missing, disabled, in error, cyclic or failed to load. */
    public static DependencyException unresolved(String pluginId, String dependency, String reason, Throwable cause) {
        return new DependencyException(pluginId,
                "Plugin " + pluginId + " cannot load dependency " + dependency + ": " + reason,
                dependency, Set.of(), cause);
    }

    /** {@code pluginId} is required by the loaded (or loading) {@code dependents}. */
    public static DependencyException blockedBy(String pluginId, Set<String> dependents) {
        return new DependencyException(pluginId,
                "Plugin " + pluginId + " is required by loaded plugins " + new TreeSet<>(dependents),
                null, dependents, null);
    }

    /** The unresolved dependency, or null for a blocked unload. */
    public String getDependency() {
        return dependency;
    }

    /** Plugins blocking an unload; empty for an unresolved dependency. */
    public Set<String> getDependents() {
        return dependents;
    }
}
