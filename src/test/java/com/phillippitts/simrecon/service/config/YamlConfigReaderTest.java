package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigReaderTest {

    private final YamlConfigReader reader = new YamlConfigReader();

    @TempDir
    Path tempDir;

    @Test
    @SuppressWarnings("unchecked")
    void readsNestedMappingWithStringKeys() throws IOException {
        Path file = Files.writeString(tempDir.resolve("root.yaml"), String.join("\n",
                "configs:",
                "  defaults: defaults.yaml",
                "  488: 488.yaml",
                "otfs:",
                "  488: otf_488.tiff",
                ""));

        Map<String, Object> root = reader.read(file);

        Map<String, Object> configs = (Map<String, Object>) root.get("configs");
        assertThat(configs).containsEntry("defaults", "defaults.yaml").containsEntry("488", "488.yaml");
        assertThat((Map<String, Object>) root.get("otfs")).containsKey("488");
    }

    @Test
    void emptyDocumentIsEmptyMap() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

        assertThat(reader.read(file)).isEmpty();
    }

    @Test
    void scalarRootIsRejected() throws IOException {
        Path file = Files.writeString(tempDir.resolve("scalar.yaml"), "just text");

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must contain a mapping");
    }

    @Test
    void malformedYamlIsConfigurationError() throws IOException {
        Path file = Files.writeString(tempDir.resolve("bad.yaml"), "a: [1, 2\nb: }");

        assertThatThrownBy(() -> reader.read(file)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void missingFileIsConfigurationError() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.yaml")))
                .isInstanceOf(ConfigurationException.class);
    }
}
