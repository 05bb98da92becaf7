package com.phillippitts.simrecon.service.dataset;

import com.phillippitts.simrecon.domain.CropRegion;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Image codec seam: reads channel structure from source files and writes engine results.
 *
 * <p>The orchestration layer never interprets image contents; everything format-specific
 * lives behind this interface.
 */
public interface DatasetHandler {

    /**
     * Lists the emission wavelengths present in {@code source}, in file order.
     *
     * @throws com.phillippitts.simrecon.exception.NotFoundException if the source does not exist
     */
    List<Integer> wavelengths(Path source);

    /**
     * Writes a single channel of {@code source} to {@code target}, optionally cropped.
     *
     * @param crop crop to apply, or {@code null} for the full frame
     */
    void extractChannel(Path source, int wavelength, Path target, CropRegion crop);

    /**
     * Combines per-channel results into one multi-channel artifact.
     *
     * @param channelOutputs engine results keyed by wavelength
     * @param overwrite replace {@code target} if it exists
     */
    void writeStitched(Map<Integer, Path> channelOutputs, Path target, boolean overwrite);

    /**
     * Writes one channel's result as a standalone artifact.
     *
     * @param overwrite replace {@code target} if it exists
     */
    void writeChannel(Path channelOutput, Path target, boolean overwrite);
}
