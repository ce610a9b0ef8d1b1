/**
 * HTTP client for the remote plugin server.
 */
package com.plughub.downloader;
