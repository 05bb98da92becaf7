package com.phillippitts.simrecon.cli;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.CropRegion;
import com.phillippitts.simrecon.exception.SimReconException;
import com.phillippitts.simrecon.service.config.ParameterSchemas;
import com.phillippitts.simrecon.service.orchestration.OtfConversionService;
import com.phillippitts.simrecon.service.orchestration.OtfOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: simrecon otf -p &lt;psf&gt;... [options]
 * <p>
 * Converts each PSF into one OTF per channel. Every OTF parameter is also available as an
 * option of the same name.
 */
@Command(name = OtfCommand.NAME, mixinStandardHelpOptions = true, description = "Convert PSFs to OTFs")
@Component
public class OtfCommand implements Callable<Integer> {

    static final String NAME = "otf";

    private static final Logger LOG = LogManager.getLogger(OtfCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    VerbosityMixin verbosity;

    @Option(names = {"-p", "--psf"}, arity = "1..*", required = true, paramLabel = "PSF",
            description = "PSF files to convert")
    List<Path> psfs;

    @Option(names = {"-c", "--config-path"}, description = "Root config file")
    Path configPath;

    @Option(names = {"-o", "--output-directory"}, description = "Directory for OTFs (default: beside each PSF)")
    Path outputDirectory;

    @Option(names = "--overwrite", description = "Replace existing OTFs")
    boolean overwrite;

    @Option(names = "--no-cleanup", description = "Keep temporary files")
    boolean noCleanup;

    @Option(names = "--shape", arity = "2", paramLabel = "N", description = "Crop shape X Y in pixels")
    int[] shape;

    @Option(names = "--centre", arity = "2", paramLabel = "N", description = "Crop centre X Y in pixels")
    double[] centre;

    private final OtfConversionService conversionService;

    public OtfCommand(OtfConversionService conversionService) {
        this.conversionService = conversionService;
    }

    @Override
    public Integer call() {
        CropRegion crop = cropRegion();
        Map<String, Object> settings = SchemaOptions.collect(spec, ParameterSchemas.OTF);
        OtfOptions options = new OtfOptions(outputDirectory, overwrite, !noCleanup, crop);
        try {
            BatchResult batch = conversionService.convert(psfs, configPath, settings, options);
            return JobReport.print(batch, spec.commandLine().getOut());
        } catch (SimReconException e) {
            LOG.error("OTF conversion failed: {}", e.getMessage(), e);
            spec.commandLine().getErr().println("error: " + e.getMessage());
            return JobReport.EXIT_FAILED;
        }
    }

    private CropRegion cropRegion() {
        if (shape == null) {
            if (centre != null) {
                throw new ParameterException(spec.commandLine(), "--centre requires --shape");
            }
            return null;
        }
        try {
            return centre == null
                    ? new CropRegion(shape[0], shape[1], null, null)
                    : new CropRegion(shape[0], shape[1], centre[0], centre[1]);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
    }
}
