package com.phillippitts.simrecon.exception;

/**
 * Thrown when filename rules are requested for an operating system that has no entry
 * in the platform rule table.
 */
public class UnsupportedPlatformException extends SimReconException {

    private final String platformName;

    public UnsupportedPlatformException(String platformName) {
        super(platformName + " is not a supported system");
        this.platformName = platformName;
    }

    public String getPlatformName() {
        return platformName;
    }
}
