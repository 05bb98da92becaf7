package com.phillippitts.simrecon.exception;

/**
 * Base exception for all simrecon application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SimReconException extends RuntimeException {

    public SimReconException(String message) {
        super(message);
    }

    public SimReconException(String message, Throwable cause) {
        super(message, cause);
    }

    public SimReconException(Throwable cause) {
        super(cause);
    }
}
