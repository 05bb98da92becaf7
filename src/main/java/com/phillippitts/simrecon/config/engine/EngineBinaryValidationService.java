package com.phillippitts.simrecon.config.engine;

import com.phillippitts.simrecon.exception.NotFoundException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Validates that both engine binaries can be found at startup.
 *
 * <p>Fail-fast: application startup aborts with a {@link NotFoundException} naming the
 * missing binary. Bare executable names are searched on {@code PATH}; anything containing a
 * path separator is checked as a file.
 */
@Component
@ConditionalOnProperty(name = "simrecon.validation.enabled", havingValue = "true", matchIfMissing = true)
class EngineBinaryValidationService {

    private static final Logger LOG = LogManager.getLogger(EngineBinaryValidationService.class);

    private final EngineProperties engine;
    private final String searchPath;

    EngineBinaryValidationService(EngineProperties engine) {
        this(engine, System.getenv("PATH"));
    }

    EngineBinaryValidationService(EngineProperties engine, String searchPath) {
        this.engine = engine;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating engine binaries... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        Path otf = validateBinary(engine.otfBinaryPath(), "OTF binary");
        Path recon = validateBinary(engine.reconBinaryPath(), "Reconstruction binary");
        LOG.info("Engine validation complete: otf='{}', recon='{}'", otf, recon);
    }

    // Visible for tests
    Path validateBinary(String configured, String label) {
        Optional<Path> resolved = isBareName(configured) ? searchOnPath(configured) : asFile(configured);
        Path binary = resolved.orElseThrow(() ->
                new NotFoundException(label + " not found", configured));
        if (!Files.isExecutable(binary)) {
            throw new NotFoundException(label + " is not executable", binary.toString());
        }
        return binary;
    }

    private static boolean isBareName(String configured) {
        return configured.indexOf('/') < 0 && configured.indexOf('\\') < 0;
    }

    private static Optional<Path> asFile(String configured) {
        Path path = Path.of(configured).toAbsolutePath().normalize();
        return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
    }

    private Optional<Path> searchOnPath(String name) {
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            Path windowsCandidate = Path.of(dir, name + ".exe");
            if (Files.isRegularFile(windowsCandidate)) {
                return Optional.of(windowsCandidate);
            }
        }
        return Optional.empty();
    }
}
