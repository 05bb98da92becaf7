package com.phillippitts.simrecon.service.capture;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where a captured operation's native output should go.
 *
 * <p>Child processes started inside {@link OutputCapture#capture} must bind their stdout and
 * stderr to {@link #redirect()} so their descriptors point at the capture file.
 *
 * @param redirect redirect for child process stdout/stderr
 * @param logFile capture file, empty when running uncaptured
 */
public record CaptureTarget(ProcessBuilder.Redirect redirect, Optional<Path> logFile) {

    public static CaptureTarget file(Path logFile) {
        return new CaptureTarget(ProcessBuilder.Redirect.appendTo(logFile.toFile()), Optional.of(logFile));
    }

    /**
     * Output flows to this process's own stdout/stderr.
     */
    public static CaptureTarget uncaptured() {
        return new CaptureTarget(ProcessBuilder.Redirect.INHERIT, Optional.empty());
    }

    public boolean isCaptured() {
        return logFile.isPresent();
    }
}
