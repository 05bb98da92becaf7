package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.ChannelConfig;
import com.phillippitts.simrecon.domain.OutputType;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.service.config.ConfigMerger;
import com.phillippitts.simrecon.service.config.NullHandling;
import com.phillippitts.simrecon.service.config.ResolvedConfiguration;
import com.phillippitts.simrecon.service.files.PathAllocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reconstructs every channel of one SIM dataset and writes the result(s).
 *
 * <p>A channel is resolvable when its wavelength has a configured OTF that exists on disk.
 * Unresolvable channels fail the job unless partial processing is allowed, in which case
 * they are skipped. A job with no resolvable channel always fails.
 */
public class ReconstructionJob extends AbstractSimJob {

    private static final Logger LOG = LogManager.getLogger(ReconstructionJob.class);

    private final ResolvedConfiguration configuration;
    private final Map<String, Object> cliSettings;
    private final ProcessingOptions options;

    private final Map<Integer, ChannelConfig> channels = new LinkedHashMap<>();
    private final Map<Integer, Path> channelOutputs = new LinkedHashMap<>();
    private final List<Path> channelLogs = new ArrayList<>();

    public ReconstructionJob(Path source, ResolvedConfiguration configuration, Map<String, Object> cliSettings,
                             ProcessingOptions options, JobCollaborators collaborators) {
        super(source, collaborators);
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.cliSettings = cliSettings == null ? Map.of() : cliSettings;
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public String jobType() {
        return "reconstruction";
    }

    @Override
    protected void resolve() {
        List<Integer> wavelengths = collaborators().datasets().wavelengths(source());
        List<Integer> missing = new ArrayList<>();
        for (Integer wavelength : wavelengths) {
            ChannelConfig channel = configuration.channel(wavelength).orElse(null);
            if (channel == null || !channel.hasOtf() || !Files.isRegularFile(channel.otfPath())) {
                LOG.warn("No usable OTF for channel {} of {}", wavelength, source().getFileName());
                missing.add(wavelength);
                continue;
            }
            channels.put(wavelength, channel.withReconParams(
                    ConfigMerger.merge(channel.reconParams(), cliSettings, NullHandling.SKIP)));
        }
        if (!missing.isEmpty() && !options.allowPartial()) {
            throw new NotFoundException("No OTF available for wavelength(s) " + missing + " in",
                    source().toString());
        }
        if (channels.isEmpty()) {
            throw new NotFoundException("No channels with an OTF found in", source().toString());
        }
        missing.forEach(this::skipWavelength);
        LOG.info("Reconstructing {} channel(s) {} of {}", channels.size(), channels.keySet(), source().getFileName());
    }

    @Override
    protected Path workspaceParent() {
        if (options.processingDirectory() != null) {
            return options.processingDirectory();
        }
        if (options.outputDirectory() != null) {
            return options.outputDirectory();
        }
        return source().toAbsolutePath().getParent();
    }

    @Override
    protected boolean deleteWorkspace() {
        return options.cleanup();
    }

    @Override
    protected boolean ignoreCleanupErrors() {
        return options.ignoreCleanupErrors();
    }

    @Override
    protected void invoke() {
        String inputSuffix = suffixOf(source());
        String outputSuffix = options.outputFileType().suffix();
        for (ChannelConfig channel : channels.values()) {
            int wavelength = channel.wavelength();
            String stem = sourceStem() + "_" + wavelength;
            Path input = workspace().allocateFile(stem, inputSuffix);
            collaborators().datasets().extractChannel(source(), wavelength, input, null);

            Path output = workspace().allocateFile(stem + "_" + OutputType.RECON.stub(), outputSuffix);
            Path log = workspace().allocateFile(stem, ".log");
            channelLogs.add(log);
            collaborators().outputCapture().capture(log, target -> {
                collaborators().engine().reconstruct(input, output, channel.otfPath(), channel.reconParams(), target);
                return output;
            });
            channelOutputs.put(wavelength, output);
        }
    }

    @Override
    protected void postProcess() {
        String suffix = options.outputFileType().suffix();
        Path outputDirectory = options.outputDirectory();
        if (options.stitchChannels()) {
            Path target = allocateOutput(OutputType.RECON, suffix, null, outputDirectory, options.overwrite());
            collaborators().datasets().writeStitched(channelOutputs, target, options.overwrite());
            addOutput(target);
            LOG.info("Reconstruction written to {}", target);
        } else {
            for (Map.Entry<Integer, Path> entry : channelOutputs.entrySet()) {
                Path target = allocateOutput(OutputType.RECON, suffix, entry.getKey(), outputDirectory,
                        options.overwrite());
                collaborators().datasets().writeChannel(entry.getValue(), target, options.overwrite());
                addOutput(target);
                LOG.info("Channel {} reconstruction written to {}", entry.getKey(), target);
            }
        }
        Path logFile = allocateOutput(OutputType.RECON, ".log", null, outputDirectory, options.overwrite());
        writeCombinedLog(logFile, channelLogs);
    }

    private static String suffixOf(Path path) {
        String name = path.getFileName().toString();
        String stem = PathAllocator.stemOf(path);
        return name.substring(stem.length());
    }
}
