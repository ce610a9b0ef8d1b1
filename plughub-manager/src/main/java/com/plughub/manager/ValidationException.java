package com.plughub.manager;

import java.util.List;

/** Invalid package or a disallowed operation. */
public class ValidationException extends PluginException {

    private final List<String> errors;

    public ValidationException(String pluginId, String message) {
        this(pluginId, message, List.of(message), null);
    }

    public ValidationException(String pluginId, String message, List<String> errors, Throwable cause) {
        super(PluginErrorKind.VALIDATION, pluginId, message, cause);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
