package com.phillippitts.simrecon.domain;


/**
 * File format for reconstruction outputs.
 */
public enum OutputFileType {
    DV(".dv"),
    TIFF(".tiff");

    private final String suffix;

    OutputFileType(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
