package com.phillippitts.simrecon.config.orchestration;

import com.phillippitts.simrecon.service.capture.OutputCapture;
import com.phillippitts.simrecon.service.dataset.DatasetHandler;
import com.phillippitts.simrecon.service.engine.SimEngine;
import com.phillippitts.simrecon.service.files.PathAllocator;
import com.phillippitts.simrecon.service.orchestration.JobCollaborators;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Groups the per-job services into one {@link JobCollaborators} bean shared by both
 * front-door services.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public JobCollaborators jobCollaborators(SimEngine engine, DatasetHandler datasets,
                                             OutputCapture outputCapture, PathAllocator pathAllocator) {
        return new JobCollaborators(engine, datasets, outputCapture, pathAllocator);
    }
}
