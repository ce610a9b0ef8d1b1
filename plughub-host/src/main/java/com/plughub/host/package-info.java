/**
 * Host wiring and process entry point.
 */
package com.plughub.host;
