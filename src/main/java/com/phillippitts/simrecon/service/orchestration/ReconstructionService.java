package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.ChannelOverride;
import com.phillippitts.simrecon.exception.StorageException;
import com.phillippitts.simrecon.service.config.ConfigResolver;
import com.phillippitts.simrecon.service.config.ParameterSchemas;
import com.phillippitts.simrecon.service.config.ResolvedConfiguration;
import com.phillippitts.simrecon.service.workspace.EmptyDirectoryGuard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for reconstructing a batch of SIM datasets.
 *
 * <p>Configuration is resolved once and shared read-only by every job. Output and
 * processing directories created for the batch are removed again if they end up empty.
 */
@Service
public class ReconstructionService {

    private static final Logger LOG = LogManager.getLogger(ReconstructionService.class);

    private final ConfigResolver configResolver;
    private final JobOrchestrator orchestrator;
    private final JobCollaborators collaborators;

    public ReconstructionService(ConfigResolver configResolver, JobOrchestrator orchestrator,
                                 JobCollaborators collaborators) {
        this.configResolver = Objects.requireNonNull(configResolver, "configResolver");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
    }

    /**
     * Reconstructs every source file.
     *
     * @param sources SIM datasets, one job each
     * @param rootConfig root config file, or {@code null}
     * @param overrides explicit per-channel overrides; null values clear settings
     * @param cliSettings command-line reconstruction settings; null values are ignored
     * @param options batch options
     * @return per-job results; never throws for individual job failures
     * @throws com.phillippitts.simrecon.exception.ValidationException if {@code cliSettings}
     *         contains a key that is not a reconstruction parameter
     */
    public BatchResult reconstruct(List<Path> sources, Path rootConfig, Map<Integer, ChannelOverride> overrides,
                                   Map<String, Object> cliSettings, ProcessingOptions options) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(options, "options");
        Map<String, Object> settings = cliSettings == null ? Map.of() : cliSettings;
        ParameterSchemas.RECONSTRUCTION.validate(settings, "command line");
        Map<String, Object> coerced = ParameterSchemas.RECONSTRUCTION.select(settings);

        ResolvedConfiguration configuration = configResolver.resolve(rootConfig, overrides);
        SchedulingMode mode = orchestrator.selectMode(sources.size(), options.parallelProcess(), options.executor());

        EmptyDirectoryGuard outputGuard = EmptyDirectoryGuard.watch(options.outputDirectory());
        EmptyDirectoryGuard processingGuard = EmptyDirectoryGuard.watch(options.processingDirectory());
        try {
            createDirectory(options.outputDirectory());
            createDirectory(options.processingDirectory());
            List<ReconstructionJob> jobs = new ArrayList<>(sources.size());
            for (Path source : sources) {
                jobs.add(new ReconstructionJob(source, configuration, coerced, options, collaborators));
            }
            return orchestrator.runAll(jobs, mode, options.executor());
        } finally {
            closeGuard(processingGuard);
            closeGuard(outputGuard);
        }
    }

    static void createDirectory(Path directory) {
        if (directory == null) {
            return;
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Failed to create directory " + directory, e);
        }
    }

    static void closeGuard(EmptyDirectoryGuard guard) {
        try {
            guard.close();
        } catch (StorageException e) {
            LOG.warn("{}", e.getMessage());
        }
    }
}
