package com.phillippitts.simrecon.domain;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fully resolved configuration for one wavelength.
 *
 * <p>Immutable once constructed and shared read-only between concurrent jobs. Parameter
 * maps keep insertion order so engine command lines are deterministic.
 *
 * @param wavelength emission wavelength in nm
 * @param otfPath OTF used for reconstruction, or {@code null} when none is configured
 * @param otfParams merged OTF-generation parameters
 * @param reconParams merged reconstruction parameters
 */
public record ChannelConfig(
        int wavelength,
        Path otfPath,
        Map<String, Object> otfParams,
        Map<String, Object> reconParams
) {
    public ChannelConfig {
        otfParams = Collections.unmodifiableMap(new LinkedHashMap<>(otfParams));
        reconParams = Collections.unmodifiableMap(new LinkedHashMap<>(reconParams));
    }

    public boolean hasOtf() {
        return otfPath != null;
    }

    /**
     * Returns a copy with the given reconstruction parameters in place of the current ones.
     */
    public ChannelConfig withReconParams(Map<String, Object> params) {
        return new ChannelConfig(wavelength, otfPath, otfParams, params);
    }
}
