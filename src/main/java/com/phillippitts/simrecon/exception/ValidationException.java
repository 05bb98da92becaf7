package com.phillippitts.simrecon.exception;

/**
 * Thrown when an argument or configuration value is rejected before any work is done,
 * e.g. an unknown parameter key or an invalid attempt count.
 */
public class ValidationException extends SimReconException {

    public ValidationException(String message) {
        super(message);
    }
}
