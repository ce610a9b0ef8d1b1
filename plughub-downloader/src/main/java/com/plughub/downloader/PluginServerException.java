package com.plughub.downloader;

import java.io.IOException;

/** Non-2xx answer from the plugin server. */
public class PluginServerException extends IOException {

    private final int statusCode;

    public PluginServerException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
