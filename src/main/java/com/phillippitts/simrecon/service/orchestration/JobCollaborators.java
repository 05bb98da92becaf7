package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.service.capture.OutputCapture;
import com.phillippitts.simrecon.service.dataset.DatasetHandler;
import com.phillippitts.simrecon.service.engine.SimEngine;
import com.phillippitts.simrecon.service.files.PathAllocator;

import java.util.Objects;

/**
 * Services every job needs (parameter object pattern).
 */
public record JobCollaborators(
        SimEngine engine,
        DatasetHandler datasets,
        OutputCapture outputCapture,
        PathAllocator pathAllocator
) {
    public JobCollaborators {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(datasets, "datasets");
        Objects.requireNonNull(outputCapture, "outputCapture");
        Objects.requireNonNull(pathAllocator, "pathAllocator");
    }
}
