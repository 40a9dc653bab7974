package de.bsommerfeld.notes.core.config;

/**
 * Thrown when the database settings are missing or malformed. Fatal: the
 * store cannot start without a complete configuration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
