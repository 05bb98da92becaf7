package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.domain.ChannelConfig;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Result of configuration resolution: defaults plus one {@link ChannelConfig} per known
 * wavelength. Immutable and safe to share between jobs.
 *
 * @param defaultOtfParams OTF parameters from the defaults layer
 * @param defaultReconParams reconstruction parameters from the defaults layer
 * @param channels resolved channels keyed by wavelength
 */
public record ResolvedConfiguration(Map<String, Object> defaultOtfParams,
                                    Map<String, Object> defaultReconParams,
                                    Map<Integer, ChannelConfig> channels) {

    public ResolvedConfiguration {
        defaultOtfParams = ConfigMerger.merge(Map.of(), defaultOtfParams, NullHandling.SKIP);
        defaultReconParams = ConfigMerger.merge(Map.of(), defaultReconParams, NullHandling.SKIP);
        channels = Collections.unmodifiableMap(new TreeMap<>(channels));
    }

    public Optional<ChannelConfig> channel(int wavelength) {
        return Optional.ofNullable(channels.get(wavelength));
    }

    /**
     * Returns the channel's config, or one built from the defaults (without an OTF) if the
     * wavelength was never configured.
     */
    public ChannelConfig channelOrDefaults(int wavelength) {
        ChannelConfig config = channels.get(wavelength);
        if (config != null) {
            return config;
        }
        return new ChannelConfig(wavelength, null, defaultOtfParams, defaultReconParams);
    }

    public Set<Integer> wavelengths() {
        return channels.keySet();
    }
}
