package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.service.config.ConfigResolver;
import com.phillippitts.simrecon.service.config.ParameterSchemas;
import com.phillippitts.simrecon.service.config.ResolvedConfiguration;
import com.phillippitts.simrecon.service.workspace.EmptyDirectoryGuard;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for converting PSFs into OTFs. PSFs are always processed one at a time.
 */
@Service
public class OtfConversionService {

    private final ConfigResolver configResolver;
    private final JobOrchestrator orchestrator;
    private final JobCollaborators collaborators;

    public OtfConversionService(ConfigResolver configResolver, JobOrchestrator orchestrator,
                                JobCollaborators collaborators) {
        this.configResolver = Objects.requireNonNull(configResolver, "configResolver");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
    }

    /**
     * Converts every PSF, writing {@code {psf_stem}_OTF_{wavelength}.tiff} per channel.
     *
     * @param rootConfig root config file, or {@code null} to use empty defaults
     * @param cliSettings command-line OTF settings; null values are ignored
     * @throws com.phillippitts.simrecon.exception.ValidationException if {@code cliSettings}
     *         contains a key that is not an OTF parameter
     */
    public BatchResult convert(List<Path> psfs, Path rootConfig, Map<String, Object> cliSettings,
                               OtfOptions options) {
        Objects.requireNonNull(psfs, "psfs");
        OtfOptions effective = options == null ? OtfOptions.defaults() : options;
        Map<String, Object> settings = cliSettings == null ? Map.of() : cliSettings;
        ParameterSchemas.OTF.validate(settings, "command line");
        Map<String, Object> coerced = ParameterSchemas.OTF.select(settings);

        ResolvedConfiguration configuration = configResolver.resolve(rootConfig, Map.of());
        SchedulingMode mode = psfs.size() <= 1 ? SchedulingMode.SINGLE : SchedulingMode.SEQUENTIAL;

        EmptyDirectoryGuard outputGuard = EmptyDirectoryGuard.watch(effective.outputDirectory());
        try {
            ReconstructionService.createDirectory(effective.outputDirectory());
            List<OtfConversionJob> jobs = new ArrayList<>(psfs.size());
            for (Path psf : psfs) {
                jobs.add(new OtfConversionJob(psf, configuration, coerced, effective, collaborators));
            }
            return orchestrator.runAll(jobs, mode, null);
        } finally {
            ReconstructionService.closeGuard(outputGuard);
        }
    }
}
