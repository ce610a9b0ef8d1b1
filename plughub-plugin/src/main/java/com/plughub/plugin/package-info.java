/**
 * Plugin contract shared by the host and plugin authors.
 * <ul>
 *   <li>{@link com.plughub.plugin.Plugin}, {@link com.plughub.plugin.PausablePlugin},
 *       {@link com.plughub.plugin.AbstractPlugin} – lifecycle and processing</li>
 *   <li>{@link com.plughub.plugin.PluginContext} – host services available to a plugin</li>
 *   <li>{@link com.plughub.plugin.PluginManifest} – {@code manifest.json} parsing and validation</li>
 *   <li>{@link com.plughub.plugin.PluginFactory} – one per {@link com.plughub.plugin.PluginDialect}</li>
 *   <li>{@link com.plughub.plugin.PluginProvider} – ServiceLoader SPI for builtin plugins</li>
 *   <li>{@link com.plughub.plugin.PluginEvents} – event type names</li>
 * </ul>
 */
package com.plughub.plugin;
