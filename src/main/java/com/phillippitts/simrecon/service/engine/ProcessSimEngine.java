package com.phillippitts.simrecon.service.engine;

import com.phillippitts.simrecon.config.engine.EngineProperties;
import com.phillippitts.simrecon.exception.EngineInvocationException;
import com.phillippitts.simrecon.exception.EngineInvocationExceptionBuilder;
import com.phillippitts.simrecon.service.capture.CaptureTarget;
import com.phillippitts.simrecon.util.ProcessTimeouts;
import com.phillippitts.simrecon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link SimEngine} that runs the configured native binaries as child processes.
 *
 * <p>The child's stdout and stderr are bound to the capture target, so nothing is buffered
 * in the JVM. A run succeeds when the process exits with 0 and the expected output file exists.
 * If the calling thread is interrupted while waiting, the process is destroyed.
 */
@Component
public class ProcessSimEngine implements SimEngine {

    private static final Logger LOG = LogManager.getLogger(ProcessSimEngine.class);

    static final String OTF_ENGINE = "makeotf";
    static final String RECON_ENGINE = "cudasirecon";

    private final ProcessFactory processFactory;
    private final EngineProperties properties;

    @Autowired
    public ProcessSimEngine(EngineProperties properties) {
        this(new DefaultProcessFactory(), properties);
    }

    ProcessSimEngine(ProcessFactory processFactory, EngineProperties properties) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public void convertPsfToOtf(Path psf, Path otf, Map<String, Object> params, CaptureTarget target) {
        Objects.requireNonNull(psf, "psf");
        Objects.requireNonNull(otf, "otf");
        List<String> command = EngineCommandBuilder.makeOtf(properties.otfBinaryPath(), psf, otf, params);
        run(OTF_ENGINE, command, psf, otf, target);
    }

    @Override
    public void reconstruct(Path input, Path output, Path otf, Map<String, Object> params,
                            CaptureTarget target) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(otf, "otf");
        List<String> command = EngineCommandBuilder.reconstruct(
                properties.reconBinaryPath(), input, output, otf, params);
        run(RECON_ENGINE, command, input, output, target);
    }

    private void run(String engine, List<String> command, Path input, Path output, CaptureTarget target) {
        LOG.debug("Starting {}: {}", engine, command);
        long startTime = System.nanoTime();
        Process process;
        try {
            process = processFactory.start(command, output.toAbsolutePath().getParent(), target.redirect());
        } catch (IOException e) {
            throw engineError(engine, "Failed to start " + command.get(0), -1, startTime, input, e);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(process);
            throw engineError(engine, "Interrupted while waiting for engine", -1, startTime, input, e);
        }

        if (exitCode != 0) {
            throw engineError(engine, "Non-zero exit: " + exitCode, exitCode, startTime, input, null);
        }
        if (!Files.exists(output)) {
            throw engineError(engine, "Engine did not produce " + output, exitCode, startTime, input, null);
        }
        LOG.info("{} finished for {} in {} ms", engine, input.getFileName(), TimeUtils.elapsedMillis(startTime));
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Engine process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying engine process");
        }
    }

    private static EngineInvocationException engineError(String engine, String msg, int exitCode,
                                                         long startTime, Path input, Throwable cause) {
        EngineInvocationExceptionBuilder builder = EngineInvocationExceptionBuilder.create(msg)
                .engine(engine)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startTime))
                .metadata("input", input);
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }
}
