package com.phillippitts.simrecon.service.capture;

import com.phillippitts.simrecon.exception.OutputRedirectException;
import com.phillippitts.simrecon.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Redirects standard output and error to a log file for the duration of one operation.
 *
 * <p>Two destinations are redirected together:
 * <ul>
 *   <li>the JVM's {@link System#out} and {@link System#err}, as seen from the calling thread</li>
 *   <li>descriptors 1 and 2 of native engine processes, which the operation binds to
 *       {@link CaptureTarget#redirect()} (append mode, so both writers interleave safely)</li>
 * </ul>
 *
 * <p>{@code System.out} is process-global, so while any capture is active it is replaced by a
 * routing stream that sends each thread's writes to that thread's log, or to the original stream
 * when the thread is not capturing. The swap is guarded by a lock and undone when the last
 * capture ends, so concurrent jobs each get their own log without blocking one another.
 *
 * <p>The original streams are restored on every exit path. When the log file cannot be opened
 * the error is logged and the operation runs uncaptured. On success the file is flushed and
 * forced to stable storage before the calling thread's output is restored.
 */
@Component
public class OutputCapture {

    private static final Logger LOG = LogManager.getLogger(OutputCapture.class);

    // System.out and System.err are process-global, so the redirect state is shared by all instances
    private static final ReentrantLock INSTALL_LOCK = new ReentrantLock();
    private static final ThreadLocal<PrintStream> ROUTES = new ThreadLocal<>();
    private static int activeScopes;
    private static PrintStream savedOut;
    private static PrintStream savedErr;

    public <T> T capture(Path logFile, CapturedOperation<T> operation) {
        Objects.requireNonNull(logFile, "logFile");
        Objects.requireNonNull(operation, "operation");

        LogChannel log;
        try {
            log = LogChannel.open(logFile);
        } catch (OutputRedirectException e) {
            LOG.error("Failed to redirect output to log at {}", logFile, e);
            return operation.run(CaptureTarget.uncaptured());
        }

        PrintStream previousRoute = ROUTES.get();
        try {
            enter();
        } catch (RuntimeException e) {
            log.close();
            LOG.error("Failed to redirect output streams to {}", logFile, e);
            return operation.run(CaptureTarget.uncaptured());
        }
        ROUTES.set(log.stream());

        T result;
        try {
            result = operation.run(CaptureTarget.file(logFile));
        } catch (RuntimeException | Error e) {
            try {
                log.sync();
            } catch (RuntimeException syncFailure) {
                e.addSuppressed(syncFailure);
            } finally {
                leave(previousRoute);
                log.close();
            }
            throw e;
        }
        try {
            log.sync();
        } finally {
            leave(previousRoute);
            log.close();
        }
        return result;
    }

    /**
     * @return true while at least one capture scope is open on any thread
     */
    public static boolean isCapturing() {
        INSTALL_LOCK.lock();
        try {
            return activeScopes > 0;
        } finally {
            INSTALL_LOCK.unlock();
        }
    }

    private static void enter() {
        INSTALL_LOCK.lock();
        try {
            if (activeScopes == 0) {
                PrintStream out = System.out;
                PrintStream err = System.err;
                out.flush();
                err.flush();
                System.setOut(new PrintStream(new RoutingOutputStream(out), true));
                System.setErr(new PrintStream(new RoutingOutputStream(err), true));
                savedOut = out;
                savedErr = err;
            }
            activeScopes++;
        } finally {
            INSTALL_LOCK.unlock();
        }
    }

    private static void leave(PrintStream previousRoute) {
        if (previousRoute == null) {
            ROUTES.remove();
        } else {
            ROUTES.set(previousRoute);
        }
        INSTALL_LOCK.lock();
        try {
            activeScopes--;
            if (activeScopes == 0) {
                System.out.flush();
                System.err.flush();
                System.setOut(savedOut);
                System.setErr(savedErr);
                savedOut = null;
                savedErr = null;
            }
        } finally {
            INSTALL_LOCK.unlock();
        }
    }

    private static final class RoutingOutputStream extends OutputStream {
        private final PrintStream fallback;

        RoutingOutputStream(PrintStream fallback) {
            this.fallback = fallback;
        }

        private PrintStream target() {
            PrintStream routed = ROUTES.get();
            return routed != null ? routed : fallback;
        }

        @Override
        public void write(int b) {
            target().write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            target().write(b, off, len);
        }

        @Override
        public void flush() {
            target().flush();
        }
    }

    private static final class LogChannel {
        private final Path logFile;
        private final FileChannel channel;
        private final PrintStream stream;

        private LogChannel(Path logFile, FileChannel channel) {
            this.logFile = logFile;
            this.channel = channel;
            this.stream = new PrintStream(nonClosing(channel), true, StandardCharsets.UTF_8);
        }

        static LogChannel open(Path logFile) {
            try {
                Files.write(logFile, new byte[0]);
                return new LogChannel(logFile, FileChannel.open(logFile,
                        StandardOpenOption.WRITE, StandardOpenOption.APPEND));
            } catch (IOException | RuntimeException e) {
                throw new OutputRedirectException("Failed to create log file " + logFile, e);
            }
        }

        PrintStream stream() {
            return stream;
        }

        void sync() {
            stream.flush();
            try {
                channel.force(true);
            } catch (IOException e) {
                throw new StorageException("Failed to sync captured output " + logFile, e);
            }
        }

        void close() {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.debug("Closing capture channel failed: {}", e.toString());
            }
        }

        private static OutputStream nonClosing(FileChannel channel) {
            OutputStream raw = Channels.newOutputStream(channel);
            return new OutputStream() {
                @Override
                public void write(int b) throws IOException {
                    raw.write(b);
                }

                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    raw.write(b, off, len);
                }
            };
        }
    }
}
