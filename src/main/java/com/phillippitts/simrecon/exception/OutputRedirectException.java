package com.phillippitts.simrecon.exception;

/**
 * Thrown when the process-wide output streams cannot be redirected to a log file.
 */
public class OutputRedirectException extends SimReconException {

    public OutputRedirectException(String message, Throwable cause) {
        super(message, cause);
    }
}
