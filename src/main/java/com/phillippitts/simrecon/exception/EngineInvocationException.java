package com.phillippitts.simrecon.exception;

/**
 * Thrown when the native engine fails to produce its output.
 * This may occur due to a non-zero exit, a missing output file, or a failure to launch.
 */
public class EngineInvocationException extends SimReconException {

    private final String engineName;

    public EngineInvocationException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public EngineInvocationException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public EngineInvocationException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
