package com.cgrera.extractor;

/**
 * Raised when the synonym table or QA field mapping is missing, unreadable or invalid. This is the one fatal
 * condition of a run: it is thrown before any entity is processed.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
