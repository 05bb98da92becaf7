package com.phillippitts.simrecon.service.workspace;

import com.phillippitts.simrecon.exception.AlreadyExistsException;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.exception.StorageException;
import com.phillippitts.simrecon.service.files.PathAllocator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.lang.ref.Cleaner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Temporary directory owned by exactly one job.
 *
 * <p>The directory is created on construction and deleted by {@link #close()}. A workspace that
 * becomes unreachable without being closed is still deleted by a {@link Cleaner} action, which
 * logs a WARN because implicit cleanup means an explicit release path was missed.
 *
 * <p><b>Cleanup policy:</b>
 * <ul>
 *   <li>{@code delete=false} keeps the directory for inspection</li>
 *   <li>{@code ignoreCleanupErrors=true} logs deletion failures instead of throwing
 *       {@link StorageException}; implicit cleanup always logs</li>
 * </ul>
 *
 * <pre>{@code
 * try (TemporaryWorkspace ws = TemporaryWorkspace.builder(parent).name("job-1").create()) {
 *     Path split = ws.allocateFile("split", ".tiff");
 *     ...
 * }
 * }</pre>
 */
public final class TemporaryWorkspace implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TemporaryWorkspace.class);
    private static final Cleaner CLEANER = Cleaner.create();
    private static final String DEFAULT_PREFIX = "tmp";

    private final Path path;
    private final boolean delete;
    private final boolean ignoreCleanupErrors;
    private final PathAllocator pathAllocator;
    private final TreeRemover remover;
    private final List<Path> files = Collections.synchronizedList(new ArrayList<>());
    private final CleanupState state;
    private final Cleaner.Cleanable cleanable;

    private TemporaryWorkspace(Builder b, Path path) {
        this.path = path;
        this.delete = b.delete;
        this.ignoreCleanupErrors = b.ignoreCleanupErrors;
        this.pathAllocator = b.pathAllocator;
        this.remover = b.remover;
        this.state = new CleanupState(path, delete, remover);
        this.cleanable = CLEANER.register(this, state);
    }

    public static Builder builder(Path parent) {
        return new Builder(parent);
    }

    public Path path() {
        return path;
    }

    /**
     * @return paths allocated through {@link #allocateFile(String, String)}, in allocation order
     */
    public List<Path> files() {
        synchronized (files) {
            return List.copyOf(files);
        }
    }

    public boolean isReleased() {
        return state.released.get();
    }

    /**
     * Allocates a unique, not-yet-created file path inside this workspace.
     *
     * @throws IllegalStateException if the workspace was already released
     */
    public Path allocateFile(String stem, String suffix) {
        if (isReleased()) {
            throw new IllegalStateException("Workspace already released: " + path);
        }
        Path file = pathAllocator.getTemporaryPath(path, stem, suffix);
        files.add(file);
        return file;
    }

    /**
     * Explicitly releases the workspace, deleting it unless {@code delete=false}. Idempotent.
     *
     * @throws StorageException if deletion fails and cleanup errors are not ignored
     */
    @Override
    public void close() {
        if (!state.released.compareAndSet(false, true)) {
            return;
        }
        // Released flag is set, so the cleaner action becomes a no-op
        cleanable.clean();
        if (!delete) {
            LOG.info("Keeping workspace '{}' (cleanup disabled)", path);
            return;
        }
        try {
            remover.remove(path);
            LOG.debug("Removed workspace '{}'", path);
        } catch (IOException e) {
            if (!ignoreCleanupErrors) {
                throw new StorageException("Failed to remove workspace " + path, e);
            }
            LOG.warn("Failed to remove workspace '{}': {}", path, e.toString());
        }
    }

    @Override
    public String toString() {
        return "TemporaryWorkspace[" + path + "]";
    }

    /**
     * Deletes a directory tree.
     */
    @FunctionalInterface
    interface TreeRemover {
        void remove(Path path) throws IOException;
    }

    /**
     * Cleaner action. Must not reference the workspace, or it would never become unreachable.
     */
    private static final class CleanupState implements Runnable {
        private final Path path;
        private final boolean delete;
        private final TreeRemover remover;
        private final AtomicBoolean released = new AtomicBoolean();

        CleanupState(Path path, boolean delete, TreeRemover remover) {
            this.path = path;
            this.delete = delete;
            this.remover = remover;
        }

        @Override
        public void run() {
            if (!released.compareAndSet(false, true) || !delete) {
                return;
            }
            LOG.warn("Implicitly cleaning up workspace '{}'", path);
            try {
                remover.remove(path);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Implicit cleanup of '{}' failed: {}", path, e.toString());
            }
        }
    }

    public static final class Builder {
        private final Path parent;
        private String name;
        private boolean createParents = true;
        private boolean allowFallback = true;
        private boolean ignoreCleanupErrors;
        private boolean delete = true;
        private PathAllocator pathAllocator;
        private TreeRemover remover = FileSystemUtils::deleteRecursively;

        private Builder(Path parent) {
            this.parent = Objects.requireNonNull(parent, "parent");
        }

        /**
         * Explicit directory name; without one an anonymous unique directory is created.
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder createParents(boolean createParents) {
            this.createParents = createParents;
            return this;
        }

        /**
         * When the named directory exists, fall back to an anonymous directory instead of failing.
         */
        public Builder allowFallback(boolean allowFallback) {
            this.allowFallback = allowFallback;
            return this;
        }

        public Builder ignoreCleanupErrors(boolean ignoreCleanupErrors) {
            this.ignoreCleanupErrors = ignoreCleanupErrors;
            return this;
        }

        public Builder delete(boolean delete) {
            this.delete = delete;
            return this;
        }

        public Builder pathAllocator(PathAllocator pathAllocator) {
            this.pathAllocator = pathAllocator;
            return this;
        }

        Builder remover(TreeRemover remover) {
            this.remover = Objects.requireNonNull(remover, "remover");
            return this;
        }

        /**
         * Creates the directory and returns the owning workspace.
         *
         * @throws NotFoundException if the parent is missing and parent creation is disabled
         * @throws AlreadyExistsException if the named directory exists and fallback is disabled
         * @throws StorageException if the directory cannot be created
         */
        public TemporaryWorkspace create() {
            if (pathAllocator == null) {
                pathAllocator = new PathAllocator();
            }
            ensureParent();
            if (name != null) {
                Path target = parent.resolve(name);
                if (!Files.exists(target)) {
                    try {
                        Files.createDirectory(target);
                        return new TemporaryWorkspace(this, target);
                    } catch (java.nio.file.FileAlreadyExistsException e) {
                        // Lost a race with another creator; treated like a pre-existing directory
                        if (!allowFallback) {
                            throw new AlreadyExistsException("Directory cannot be created as it exists", target);
                        }
                    } catch (IOException e) {
                        throw new StorageException("Failed to create workspace " + target, e);
                    }
                } else if (!allowFallback) {
                    throw new AlreadyExistsException("Directory cannot be created as it exists", target);
                }
                LOG.debug("'{}' exists, falling back to an anonymous workspace", target);
            }
            try {
                Path anonymous = Files.createTempDirectory(parent, name != null ? name : DEFAULT_PREFIX);
                return new TemporaryWorkspace(this, anonymous);
            } catch (IOException e) {
                throw new StorageException("Failed to create workspace under " + parent, e);
            }
        }

        private void ensureParent() {
            if (Files.isDirectory(parent)) {
                return;
            }
            if (!createParents) {
                throw new NotFoundException("Parent directory does not exist", parent.toString());
            }
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StorageException("Failed to create parent directory " + parent, e);
            }
        }
    }
}
