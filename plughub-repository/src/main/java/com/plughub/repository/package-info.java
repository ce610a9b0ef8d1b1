/**
 * Plugin records, plugin settings and cache storage behind {@link com.plughub.repository.PluginRepository}.
 */
package com.plughub.repository;
