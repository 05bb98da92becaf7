package com.phillippitts.simrecon.exception;

/**
 * Thrown when a configuration source cannot be read, or when a job's channels
 * cannot be matched to a configuration.
 */
public class ConfigurationException extends SimReconException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
