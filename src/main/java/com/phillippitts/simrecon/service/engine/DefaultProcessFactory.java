package com.phillippitts.simrecon.service.engine;

import com.phillippitts.simrecon.service.files.Platform;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir, ProcessBuilder.Redirect output)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice(Platform.current())));
        pb.redirectOutput(output);
        pb.redirectError(output);
        return pb.start();
    }

    static File nullDevice(Platform platform) {
        return new File(platform == Platform.WINDOWS ? "NUL" : "/dev/null");
    }
}
