package com.phillippitts.simrecon.service.engine;

import com.phillippitts.simrecon.service.capture.CaptureTarget;

import java.nio.file.Path;
import java.util.Map;

/**
 * Native numerical engine for PSF-to-OTF conversion and SIM reconstruction.
 *
 * <p>Implementations must write any native output to {@link CaptureTarget#redirect()} so it
 * lands in the active capture log. Both operations block until the engine finishes; no
 * timeout is applied.
 */
public interface SimEngine {

    /**
     * Converts a single-channel PSF into an OTF.
     *
     * @throws com.phillippitts.simrecon.exception.EngineInvocationException if the engine fails
     */
    void convertPsfToOtf(Path psf, Path otf, Map<String, Object> params, CaptureTarget target);

    /**
     * Reconstructs a single-channel SIM dataset with the given OTF.
     *
     * @throws com.phillippitts.simrecon.exception.EngineInvocationException if the engine fails
     */
    void reconstruct(Path input, Path output, Path otf, Map<String, Object> params, CaptureTarget target);
}
