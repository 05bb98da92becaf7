package com.phillippitts.simrecon.domain;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Explicit, programmatic override for one channel. Null values in {@code settings} clear
 * the corresponding setting from the lower layers.
 *
 * @param otfPath OTF to use instead of the configured one, or {@code null} to keep it
 * @param settings parameter overrides (OTF and reconstruction keys mixed)
 */
public record ChannelOverride(Path otfPath, Map<String, Object> settings) {

    public ChannelOverride {
        settings = settings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    public static ChannelOverride otf(Path otfPath) {
        return new ChannelOverride(otfPath, Map.of());
    }
}
