/**
 * Plugin lifecycle management.
 * <p>
 * {@link com.plughub.manager.PluginManager} installs packages into the plugins directory, loads
 * enabled plugins in dependency order with one class loader each, and unloads them in reverse.
 * Operations report through {@link com.plughub.manager.OperationResult} and publish lifecycle
 * events on the {@link com.plughub.events.EventBus}.
 */
package com.plughub.manager;
