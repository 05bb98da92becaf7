package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.ChannelConfig;
import com.phillippitts.simrecon.domain.OutputType;
import com.phillippitts.simrecon.service.config.ConfigMerger;
import com.phillippitts.simrecon.service.config.NullHandling;
import com.phillippitts.simrecon.service.config.ResolvedConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts every channel of one PSF into an OTF named {@code {psf_stem}_OTF_{wavelength}.tiff}.
 *
 * <p>Channels without their own config use the defaults.
 */
public class OtfConversionJob extends AbstractSimJob {

    private static final Logger LOG = LogManager.getLogger(OtfConversionJob.class);

    static final String OTF_SUFFIX = ".tiff";

    private final ResolvedConfiguration configuration;
    private final Map<String, Object> cliSettings;
    private final OtfOptions options;

    private final Map<Integer, Map<String, Object>> channelParams = new LinkedHashMap<>();
    private final Map<Integer, Path> channelOtfs = new LinkedHashMap<>();
    private final List<Path> channelLogs = new ArrayList<>();

    public OtfConversionJob(Path psf, ResolvedConfiguration configuration, Map<String, Object> cliSettings,
                            OtfOptions options, JobCollaborators collaborators) {
        super(psf, collaborators);
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.cliSettings = cliSettings == null ? Map.of() : cliSettings;
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public String jobType() {
        return "otf";
    }

    @Override
    protected void resolve() {
        for (Integer wavelength : collaborators().datasets().wavelengths(source())) {
            ChannelConfig channel = configuration.channelOrDefaults(wavelength);
            channelParams.put(wavelength, ConfigMerger.merge(channel.otfParams(), cliSettings, NullHandling.SKIP));
        }
        LOG.info("Converting {} channel(s) {} of PSF {}", channelParams.size(), channelParams.keySet(),
                source().getFileName());
    }

    @Override
    protected Path workspaceParent() {
        return options.outputDirectory() != null
                ? options.outputDirectory()
                : source().toAbsolutePath().getParent();
    }

    @Override
    protected boolean deleteWorkspace() {
        return options.cleanup();
    }

    @Override
    protected boolean ignoreCleanupErrors() {
        return true;
    }

    @Override
    protected void invoke() {
        for (Map.Entry<Integer, Map<String, Object>> entry : channelParams.entrySet()) {
            int wavelength = entry.getKey();
            String stem = sourceStem() + "_" + wavelength;
            Path psf = workspace().allocateFile(stem, OTF_SUFFIX);
            collaborators().datasets().extractChannel(source(), wavelength, psf, options.crop());

            Path otf = workspace().allocateFile(stem + "_" + OutputType.OTF.stub(), OTF_SUFFIX);
            Path log = workspace().allocateFile(stem, ".log");
            channelLogs.add(log);
            collaborators().outputCapture().capture(log, target -> {
                collaborators().engine().convertPsfToOtf(psf, otf, entry.getValue(), target);
                return otf;
            });
            channelOtfs.put(wavelength, otf);
        }
    }

    @Override
    protected void postProcess() {
        for (Map.Entry<Integer, Path> entry : channelOtfs.entrySet()) {
            Path target = allocateOutput(OutputType.OTF, OTF_SUFFIX, entry.getKey(), options.outputDirectory(),
                    options.overwrite());
            collaborators().datasets().writeChannel(entry.getValue(), target, options.overwrite());
            addOutput(target);
            LOG.info("OTF for channel {} written to {}", entry.getKey(), target);
        }
        writeCombinedLog(allocateOutput(OutputType.OTF, ".log", null, options.outputDirectory(),
                options.overwrite()), channelLogs);
    }
}
