package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.domain.ChannelConfig;
import com.phillippitts.simrecon.domain.ChannelOverride;
import com.phillippitts.simrecon.exception.ConfigurationException;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves layered configuration into per-channel invocation parameters.
 *
 * <p>Layers, lowest precedence first:
 * <ol>
 *   <li>the defaults file referenced by {@code configs.defaults} in the root config</li>
 *   <li>the per-channel file referenced by {@code configs.<wavelength>}</li>
 *   <li>the explicit {@link ChannelOverride} map, where null values clear settings</li>
 * </ol>
 * Command-line overrides are applied later, per job, with {@link NullHandling#SKIP}.
 */
@Service
public class ConfigResolver {

    private static final Logger LOG = LogManager.getLogger(ConfigResolver.class);

    static final String CONFIGS_SECTION = "configs";
    static final String OTFS_SECTION = "otfs";
    static final String DEFAULTS_KEY = "defaults";

    private final ConfigReader reader;

    public ConfigResolver(ConfigReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    /**
     * Resolves every channel known to the root config or to {@code overrides}.
     *
     * @param rootConfig root config file, or {@code null} to use empty defaults
     * @param overrides explicit per-channel overrides keyed by wavelength, may be empty
     * @throws NotFoundException if the root config is missing or references no defaults
     * @throws ConfigurationException if a referenced config file cannot be read
     * @throws ValidationException if any layer contains an unknown key
     */
    public ResolvedConfiguration resolve(Path rootConfig, Map<Integer, ChannelOverride> overrides) {
        Map<Integer, ChannelOverride> explicit = overrides == null ? Map.of() : overrides;
        if (rootConfig == null) {
            return resolveWithoutRoot(explicit);
        }
        if (!Files.isRegularFile(rootConfig)) {
            throw new NotFoundException("Root config file not found", rootConfig.toString());
        }
        LOG.info("Loading configurations from {}...", rootConfig);
        Path baseDirectory = rootConfig.toAbsolutePath().getParent();
        Map<String, Object> root = reader.read(rootConfig);
        Map<String, Object> configs = section(root, CONFIGS_SECTION, rootConfig);
        Map<String, Object> otfs = section(root, OTFS_SECTION, rootConfig);

        Object defaultsRef = configs.get(DEFAULTS_KEY);
        if (defaultsRef == null || defaultsRef.toString().isBlank()) {
            throw new NotFoundException("Root config does not reference a defaults config", rootConfig.toString());
        }
        Path defaultsPath = resolvePath(baseDirectory, defaultsRef);
        ParameterSchemas.SplitSettings defaults =
                ParameterSchemas.split(readLayer(defaultsPath), defaultsPath.toString());
        Map<String, Object> defaultOtf = ConfigMerger.merge(Map.of(), defaults.otf(), NullHandling.SKIP);
        Map<String, Object> defaultRecon = ConfigMerger.merge(Map.of(), defaults.reconstruction(), NullHandling.SKIP);
        LOG.debug("Loaded defaults from {}", defaultsPath);

        Set<Integer> wavelengths = new TreeSet<>();
        for (String key : configs.keySet()) {
            if (!DEFAULTS_KEY.equals(key)) {
                wavelengths.add(parseWavelength(key, rootConfig));
            }
        }
        for (String key : otfs.keySet()) {
            wavelengths.add(parseWavelength(key, rootConfig));
        }
        wavelengths.addAll(explicit.keySet());

        Map<Integer, ChannelConfig> channels = new LinkedHashMap<>();
        for (Integer wavelength : wavelengths) {
            Map<String, Object> otfParams = defaultOtf;
            Map<String, Object> reconParams = defaultRecon;

            Object channelRef = configs.get(String.valueOf(wavelength));
            if (channelRef != null) {
                Path channelPath = resolvePath(baseDirectory, channelRef);
                ParameterSchemas.SplitSettings channelLayer =
                        ParameterSchemas.split(readLayer(channelPath), channelPath.toString());
                otfParams = ConfigMerger.merge(otfParams, channelLayer.otf(), NullHandling.SKIP);
                reconParams = ConfigMerger.merge(reconParams, channelLayer.reconstruction(), NullHandling.SKIP);
            }
            Object otfRef = otfs.get(String.valueOf(wavelength));
            Path otfPath = otfRef == null ? null : resolvePath(baseDirectory, otfRef);

            channels.put(wavelength, applyOverride(
                    new ChannelConfig(wavelength, otfPath, otfParams, reconParams), explicit.get(wavelength)));
        }
        LOG.info("Resolved configuration for wavelengths {}", channels.keySet());
        return new ResolvedConfiguration(defaultOtf, defaultRecon, channels);
    }

    private ResolvedConfiguration resolveWithoutRoot(Map<Integer, ChannelOverride> overrides) {
        Map<Integer, ChannelConfig> channels = new LinkedHashMap<>();
        overrides.forEach((wavelength, override) -> channels.put(wavelength,
                applyOverride(new ChannelConfig(wavelength, null, Map.of(), Map.of()), override)));
        return new ResolvedConfiguration(Map.of(), Map.of(), channels);
    }

    private static ChannelConfig applyOverride(ChannelConfig base, ChannelOverride override) {
        if (override == null) {
            return base;
        }
        ParameterSchemas.SplitSettings layer = ParameterSchemas.split(override.settings(),
                "override for channel " + base.wavelength());
        Path otfPath = override.otfPath() != null ? override.otfPath() : base.otfPath();
        return new ChannelConfig(base.wavelength(), otfPath,
                ConfigMerger.merge(base.otfParams(), layer.otf(), NullHandling.APPLY),
                ConfigMerger.merge(base.reconParams(), layer.reconstruction(), NullHandling.APPLY));
    }

    private Map<String, Object> readLayer(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file " + path + " does not exist");
        }
        return reader.read(path);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String name, Path rootConfig) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + name + "' of " + rootConfig + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static int parseWavelength(String key, Path rootConfig) {
        try {
            return Integer.parseInt(key.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid wavelength '" + key + "' in " + rootConfig);
        }
    }

    private static Path resolvePath(Path baseDirectory, Object reference) {
        Path path = Path.of(reference.toString());
        return path.isAbsolute() || baseDirectory == null ? path : baseDirectory.resolve(path).normalize();
    }
}
