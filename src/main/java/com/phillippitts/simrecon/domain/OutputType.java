package com.phillippitts.simrecon.domain;

/**
 * Kind of artifact a job writes. The stub is the fixed token inserted into output filenames.
 */
public enum OutputType {
    OTF("OTF"),
    RECON("recon");

    private final String stub;

    OutputType(String stub) {
        this.stub = stub;
    }

    public String stub() {
        return stub;
    }
}
