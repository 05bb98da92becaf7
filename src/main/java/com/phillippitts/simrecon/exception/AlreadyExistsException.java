package com.phillippitts.simrecon.exception;

import java.nio.file.Path;

/**
 * Thrown when a path that must be created fresh already exists.
 */
public class AlreadyExistsException extends SimReconException {

    private final Path path;

    public AlreadyExistsException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
