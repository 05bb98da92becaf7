package com.phillippitts.simrecon.service.workspace;

import com.phillippitts.simrecon.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Removes a directory created during a guarded operation if it is left empty.
 *
 * <p>Whether the directory existed is recorded when the guard is opened. Directories that
 * existed beforehand are never removed, empty or not: they belong to the caller.
 *
 * <pre>{@code
 * try (EmptyDirectoryGuard guard = EmptyDirectoryGuard.watch(outputDirectory)) {
 *     Files.createDirectories(outputDirectory);
 *     ...
 * }
 * }</pre>
 */
public final class EmptyDirectoryGuard implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(EmptyDirectoryGuard.class);

    private final Path path;
    private final boolean tryCleanup;

    private EmptyDirectoryGuard(Path path, boolean tryCleanup) {
        this.path = path;
        this.tryCleanup = tryCleanup;
    }

    /**
     * Opens a guard for {@code path}; a {@code null} path yields a guard that does nothing.
     */
    public static EmptyDirectoryGuard watch(Path path) {
        if (path == null) {
            return new EmptyDirectoryGuard(null, false);
        }
        return new EmptyDirectoryGuard(path, !Files.isDirectory(path));
    }

    public boolean existedBefore() {
        return path != null && !tryCleanup;
    }

    /**
     * @throws StorageException if a new, empty directory could not be removed
     */
    @Override
    public void close() {
        if (!tryCleanup || !Files.isDirectory(path)) {
            return;
        }
        try {
            if (isEmpty(path)) {
                LOG.info("Removing empty directory '{}'", path);
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to remove empty directory " + path, e);
        }
    }

    private static boolean isEmpty(Path directory) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            return !entries.iterator().hasNext();
        }
    }
}
