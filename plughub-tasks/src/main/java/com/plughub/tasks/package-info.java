/**
 * Worker pool for long-running host operations with result, error and completion callbacks.
 */
package com.plughub.tasks;
