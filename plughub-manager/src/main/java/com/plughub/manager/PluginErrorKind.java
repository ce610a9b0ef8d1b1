package com.plughub.manager;

/**
 * Failure categories reported by {@link PluginManager} operations.
 */
public enum PluginErrorKind {
    /** Bad manifest, unsupported dialect, or an operation not allowed for this plugin (e.g. builtin). */
    VALIDATION,
    /** Unresolvable dependency, or the operation is blocked by loaded dependents. */
    DEPENDENCY,
    /** Instantiation, initialize or start failed; or the plugin is not in a loadable state. */
    LOAD,
    /** Package could not be fetched, copied or recorded. */
    INSTALL,
    /** No record for the plugin id. */
    NOT_FOUND,
    /** The plugin's process call failed. */
    PROCESS
}
