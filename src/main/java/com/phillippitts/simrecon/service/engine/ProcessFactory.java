package com.phillippitts.simrecon.service.engine;

import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of process-based engines.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a
 * fake {@link Process} with a controlled exit code.
 */
interface ProcessFactory {
    /**
     * Starts a new process with stdout and stderr both bound to {@code output}.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @param output destination of the child's stdout and stderr
     * @return started {@link Process}
     * @throws java.io.IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, ProcessBuilder.Redirect output)
            throws java.io.IOException;
}
