package org.example.nitro.exception;

import java.util.List;

/**
 * Exception thrown when package configuration is invalid.
 */
public class ConfigurationException extends NitroException {

    private final List<String> validationErrors;

    public ConfigurationException(String message) {
        super(message);
        this.validationErrors = List.of(message);
    }

    public ConfigurationException(String message, List<String> validationErrors) {
        super(message);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.validationErrors = List.of(message);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
