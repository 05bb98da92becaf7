package com.phillippitts.simrecon.exception;

/**
 * Thrown when a required file, parent directory or config reference does not exist.
 */
public class NotFoundException extends SimReconException {

    private final String path;

    public NotFoundException(String message) {
        super(message);
        this.path = null;
    }

    public NotFoundException(String message, String path) {
        super(message + ": " + path);
        this.path = path;
    }

    /**
     * @return the missing path, or {@code null} when the missing item is not a path
     */
    public String getPath() {
        return path;
    }
}
