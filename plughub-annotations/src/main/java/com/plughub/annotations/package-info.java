/**
 * Contracts shared by every PlugHub module. {@link com.plughub.annotations.ResourceCleanup} is the
 * shutdown hook the host calls on the event bus, the task executor and the plugin manager.
 */
package com.plughub.annotations;
