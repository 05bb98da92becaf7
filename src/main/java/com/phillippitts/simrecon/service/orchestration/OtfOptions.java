package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.CropRegion;

import java.nio.file.Path;

/**
 * Options for PSF-to-OTF conversion.
 *
 * @param outputDirectory output directory, or {@code null} to write beside each PSF
 * @param overwrite replace existing OTFs instead of choosing a unique name
 * @param cleanup delete job workspaces afterwards
 * @param crop crop applied to each PSF channel, or {@code null}
 */
public record OtfOptions(Path outputDirectory, boolean overwrite, boolean cleanup, CropRegion crop) {

    public static OtfOptions defaults() {
        return new OtfOptions(null, false, true, null);
    }
}
