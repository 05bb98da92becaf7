package com.phillippitts.simrecon.config.engine;

import com.phillippitts.simrecon.exception.NotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class EngineBinaryValidationServiceTest {

    @TempDir
    Path tempDir;

    private Path executable(String name) throws IOException {
        Path binary = Files.writeString(tempDir.resolve(name), "#!/bin/sh\n");
        assertThat(binary.toFile().setExecutable(true)).isTrue();
        return binary;
    }

    @Test
    void findsBareNameOnSearchPath() throws IOException {
        Path binary = executable("makeotf");
        EngineBinaryValidationService svc =
                new EngineBinaryValidationService(EngineProperties.defaults(), tempDir.toString());

        assertThat(svc.validateBinary("makeotf", "OTF binary")).isEqualTo(binary);
    }

    @Test
    void bareNameMissingFromSearchPathIsNotFound() {
        EngineBinaryValidationService svc =
                new EngineBinaryValidationService(EngineProperties.defaults(), tempDir.toString());

        assertThatThrownBy(() -> svc.validateBinary("cudasirecon", "Reconstruction binary"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Reconstruction binary not found: cudasirecon");
    }

    @Test
    void explicitPathMustExist() {
        EngineBinaryValidationService svc = new EngineBinaryValidationService(EngineProperties.defaults(), "");
        String missing = tempDir.resolve("bin/makeotf").toString();

        assertThatThrownBy(() -> svc.validateBinary(missing, "OTF binary"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("OTF binary not found");
    }

    @Test
    void nonExecutableFileIsRejected() throws IOException {
        Path plain = Files.writeString(tempDir.resolve("makeotf"), "data");
        EngineBinaryValidationService svc = new EngineBinaryValidationService(EngineProperties.defaults(), "");

        assertThatThrownBy(() -> svc.validateBinary(plain.toString(), "OTF binary"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("not executable");
    }

    @Test
    void startupValidationPassesWhenBothBinariesPresent() throws IOException {
        executable("makeotf");
        executable("cudasirecon");
        EngineBinaryValidationService svc =
                new EngineBinaryValidationService(EngineProperties.defaults(), tempDir.toString());

        assertThatCode(svc::validateOnStartup).doesNotThrowAnyException();
    }
}
