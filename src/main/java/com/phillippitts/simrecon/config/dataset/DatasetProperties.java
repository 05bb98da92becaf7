package com.phillippitts.simrecon.config.dataset;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Properties for the built-in dataset handler ("simrecon.dataset").
 *
 * @param defaultWavelength wavelength (nm) assigned to every single-channel source
 */
@ConfigurationProperties(prefix = "simrecon.dataset")
@Validated
public record DatasetProperties(
        @Positive(message = "Default wavelength must be positive")
        @DefaultValue("525")
        int defaultWavelength
) {
}
