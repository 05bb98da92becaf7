package com.phillippitts.simrecon.config.dataset;

import com.phillippitts.simrecon.service.dataset.DatasetHandler;
import com.phillippitts.simrecon.service.dataset.SingleChannelDatasetHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the fallback {@link DatasetHandler}. Any application-provided handler bean
 * (for example a DV/TIFF codec) replaces it.
 */
@Configuration
public class DatasetConfig {

    private static final Logger LOG = LogManager.getLogger(DatasetConfig.class);

    @Bean
    @ConditionalOnMissingBean(DatasetHandler.class)
    public DatasetHandler singleChannelDatasetHandler(DatasetProperties properties) {
        LOG.info("Using single-channel dataset handler (wavelength={})", properties.defaultWavelength());
        return new SingleChannelDatasetHandler(properties.defaultWavelength());
    }
}
