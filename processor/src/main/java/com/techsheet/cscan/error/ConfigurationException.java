package com.techsheet.cscan.error;

/**
 * Raised when processing is configured with a value the processor cannot honour,
 * such as an unknown colormap name. Never replaced by a silent default.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
