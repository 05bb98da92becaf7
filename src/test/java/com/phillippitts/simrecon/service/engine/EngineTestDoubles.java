package com.phillippitts.simrecon.service.engine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for exercising {@link ProcessSimEngine} without the real engine binaries.
 */
final class EngineTestDoubles {

    private EngineTestDoubles() {}

    /**
     * @param exitCode exit code reported by the process
     * @param outputToCreate file written when the process is started, or null
     */
    record ProcessBehavior(int exitCode, Path outputToCreate) {}

    /**
     * Records every launch and hands back a {@link TestProcess} per the configured behaviour.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final ProcessBehavior behavior;
        final List<List<String>> commands = new ArrayList<>();
        final List<Path> workingDirs = new ArrayList<>();
        final List<ProcessBuilder.Redirect> redirects = new ArrayList<>();
        TestProcess lastProcess;

        StubProcessFactory(ProcessBehavior behavior) {
            this.behavior = behavior;
        }

        @Override
        public Process start(List<String> command, Path workingDir, ProcessBuilder.Redirect output) {
            commands.add(List.copyOf(command));
            workingDirs.add(workingDir);
            redirects.add(output);
            if (behavior.outputToCreate() != null) {
                try {
                    Files.writeString(behavior.outputToCreate(), "engine output");
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            lastProcess = new TestProcess(behavior.exitCode(), false);
            return lastProcess;
        }
    }

    static final class FailingProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command, Path workingDir, ProcessBuilder.Redirect output)
                throws IOException {
            throw new IOException("Cannot run program \"" + command.get(0) + "\"");
        }
    }

    static final class TestProcess extends Process {
        private final int exitCode;
        private final boolean interruptOnWait;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled;

        TestProcess(int exitCode, boolean interruptOnWait) {
            this.exitCode = exitCode;
            this.interruptOnWait = interruptOnWait;
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public int waitFor() throws InterruptedException {
            if (interruptOnWait) {
                throw new InterruptedException("test interrupt");
            }
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) {
            return !alive;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
