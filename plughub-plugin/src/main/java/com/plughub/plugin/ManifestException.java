package com.plughub.plugin;

import java.util.List;

/**
 * Thrown when a plugin manifest is missing, unreadable or invalid.
 */
public class ManifestException extends RuntimeException {

    private final List<String> errors;

    public ManifestException(String message) {
        this(message, List.of(message), null);
    }

    public ManifestException(String message, Throwable cause) {
        this(message, List.of(message), cause);
    }

    public ManifestException(List<String> errors) {
        this("Invalid plugin manifest: " + String.join("; ", errors), errors, null);
    }

    private ManifestException(String message, List<String> errors, Throwable cause) {
        super(message, cause);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
