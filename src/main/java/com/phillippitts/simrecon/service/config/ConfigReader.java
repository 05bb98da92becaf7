package com.phillippitts.simrecon.service.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads one configuration file into a structured settings map.
 *
 * <p>Keys are returned as strings regardless of how the file format types them.
 */
public interface ConfigReader {

    /**
     * @throws com.phillippitts.simrecon.exception.ConfigurationException if the file cannot be
     *         read or does not contain a mapping at its root
     */
    Map<String, Object> read(Path path);
}
