package com.phillippitts.simrecon.config.engine;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the native SIM engine binaries.
 * Binds to properties prefixed with "simrecon.engine".
 *
 * <p>Example application.properties:
 * <pre>
 * simrecon.engine.otf-binary-path=/opt/cudasirecon/bin/makeotf
 * simrecon.engine.recon-binary-path=/opt/cudasirecon/bin/cudasirecon
 * </pre>
 *
 * <p>Bare names are looked up on the {@code PATH} by the operating system.
 *
 * @param otfBinaryPath PSF-to-OTF conversion executable
 * @param reconBinaryPath SIM reconstruction executable
 */
@ConfigurationProperties(prefix = "simrecon.engine")
@Validated
public record EngineProperties(
        @NotBlank(message = "OTF binary path must not be blank")
        @DefaultValue("makeotf")
        String otfBinaryPath,

        @NotBlank(message = "Reconstruction binary path must not be blank")
        @DefaultValue("cudasirecon")
        String reconBinaryPath
) {
    public static EngineProperties defaults() {
        return new EngineProperties("makeotf", "cudasirecon");
    }
}
