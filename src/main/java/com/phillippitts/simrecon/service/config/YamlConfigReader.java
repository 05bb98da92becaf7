package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SnakeYAML-backed {@link ConfigReader}. An empty document reads as an empty map.
 */
@Component
public class YamlConfigReader implements ConfigReader {

    private static final Logger LOG = LogManager.getLogger(YamlConfigReader.class);

    @Override
    public Map<String, Object> read(Path path) {
        Object document;
        try (InputStream in = Files.newInputStream(path)) {
            document = new Yaml().load(in);
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Unable to read config file " + path, e);
        }
        if (document == null) {
            LOG.debug("Config file {} is empty", path);
            return new LinkedHashMap<>();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new ConfigurationException("Config file " + path + " must contain a mapping, found "
                    + document.getClass().getSimpleName());
        }
        return stringKeys(root);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> stringKeys(Map<?, ?> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            Object converted = value instanceof Map<?, ?> nested ? stringKeys(nested) : value;
            result.put(String.valueOf(key), converted);
        });
        return result;
    }
}
