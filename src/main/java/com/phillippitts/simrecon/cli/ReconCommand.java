package com.phillippitts.simrecon.cli;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.ChannelOverride;
import com.phillippitts.simrecon.domain.OutputFileType;
import com.phillippitts.simrecon.exception.SimReconException;
import com.phillippitts.simrecon.service.config.ParameterSchemas;
import com.phillippitts.simrecon.service.orchestration.ProcessingOptions;
import com.phillippitts.simrecon.service.orchestration.ReconstructionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: simrecon recon -d &lt;data&gt;... [options]
 * <p>
 * Reconstructs each dataset. Every reconstruction parameter is also available as an option
 * of the same name.
 */
@Command(name = ReconCommand.NAME, mixinStandardHelpOptions = true, description = "Reconstruct SIM datasets")
@Component
public class ReconCommand implements Callable<Integer> {

    static final String NAME = "recon";

    private static final Logger LOG = LogManager.getLogger(ReconCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    VerbosityMixin verbosity;

    @Option(names = {"-d", "--data"}, arity = "1..*", required = true, paramLabel = "FILE",
            description = "SIM datasets to reconstruct")
    List<Path> data;

    @Option(names = {"-c", "--config-path"}, description = "Root config file")
    Path configPath;

    @Option(names = {"-o", "--output-directory"}, description = "Directory for results (default: beside each dataset)")
    Path outputDirectory;

    @Option(names = {"-p", "--processing-directory"}, description = "Directory for temporary job workspaces")
    Path processingDirectory;

    @Option(names = "--otf", paramLabel = "WAVELENGTH=PATH", description = "OTF to use for a wavelength (repeatable)")
    Map<Integer, Path> otfs = new LinkedHashMap<>();

    @Option(names = "--overwrite", description = "Replace existing outputs")
    boolean overwrite;

    @Option(names = "--no-cleanup", description = "Keep job workspaces")
    boolean noCleanup;

    @Option(names = "--no-stitch", description = "Write one output per channel")
    boolean noStitch;

    @Option(names = "--allow-missing-channels", description = "Skip channels without an OTF")
    boolean allowMissingChannels;

    @Option(names = "--type", defaultValue = "DV", paramLabel = "dv|tiff", description = "Output file type")
    OutputFileType type;

    @Option(names = "--parallel", description = "Overlap engine runs with output writing")
    boolean parallel;

    private final ReconstructionService reconstructionService;

    public ReconCommand(ReconstructionService reconstructionService) {
        this.reconstructionService = reconstructionService;
    }

    @Override
    public Integer call() {
        Map<Integer, ChannelOverride> overrides = new LinkedHashMap<>();
        otfs.forEach((wavelength, path) -> overrides.put(wavelength, ChannelOverride.otf(path)));
        Map<String, Object> settings = SchemaOptions.collect(spec, ParameterSchemas.RECONSTRUCTION);
        ProcessingOptions options = ProcessingOptions.builder()
                .outputDirectory(outputDirectory)
                .processingDirectory(processingDirectory)
                .overwrite(overwrite)
                .cleanup(!noCleanup)
                .stitchChannels(!noStitch)
                .allowPartial(allowMissingChannels)
                .outputFileType(type)
                .parallelProcess(parallel)
                .build();
        try {
            BatchResult batch = reconstructionService.reconstruct(data, configPath, overrides, settings, options);
            return JobReport.print(batch, spec.commandLine().getOut());
        } catch (SimReconException e) {
            LOG.error("Reconstruction failed: {}", e.getMessage(), e);
            spec.commandLine().getErr().println("error: " + e.getMessage());
            return JobReport.EXIT_FAILED;
        }
    }
}
