package com.phillippitts.simrecon.service.files;

import com.phillippitts.simrecon.exception.AlreadyExistsException;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.exception.StorageException;
import com.phillippitts.simrecon.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds output and temporary file paths.
 *
 * <p>Output names follow {@code {source_stem}_{TYPE}[_{wavelength}][_{timestamp}]{suffix}} and
 * are sanitized with the {@link FilenameRules} of the running platform before any filesystem
 * check. Uniqueness is resolved by probing at allocation time; two allocators racing on the
 * same directory can still pick the same name, so callers needing atomicity must create the
 * file exclusively when writing.
 */
@Component
public class PathAllocator {

    private static final Logger LOG = LogManager.getLogger(PathAllocator.class);

    // No colons: the timestamp must be valid in filenames on every platform
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final FilenameRules rules;

    public PathAllocator() {
        this(FilenameRules.forCurrentPlatform());
    }

    public PathAllocator(FilenameRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /**
     * Creates the output path for a source file.
     *
     * @param request naming and uniqueness parameters
     * @return sanitized output path (not created)
     * @throws ValidationException if uniqueness is requested with {@code maxAttempts <= 1}
     * @throws StorageException if no unique name is found within {@code maxAttempts}
     * @throws NotFoundException if a timestamp is requested and the source does not exist
     */
    public Path createOutputPath(OutputPathRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.ensureUnique() && request.maxAttempts() <= 1) {
            throw new ValidationException("maxAttempts must be >1 to ensure a unique path, got "
                    + request.maxAttempts());
        }

        Path source = request.source();
        List<String> parts = new ArrayList<>();
        parts.add(stemOf(source));
        parts.add(request.outputType().stub());
        if (request.wavelength() != null) {
            parts.add(String.valueOf(request.wavelength()));
        }
        if (request.addTimestamp()) {
            parts.add(modificationTimestamp(source));
        }
        String stem = String.join("_", parts);

        Path directory = request.outputDirectory() != null
                ? request.outputDirectory()
                : parentOf(source);

        if (request.ensureUnique()) {
            return ensureUnique(directory, stem, request.suffix(), request.maxAttempts());
        }
        return directory.resolve(rules.sanitize(stem + request.suffix()));
    }

    /**
     * Returns {@code {directory}/{stem}{suffix}} if free, else the first free
     * {@code {stem}_{n}{suffix}} for n in 1..maxAttempts.
     */
    Path ensureUnique(Path directory, String stem, String suffix, int maxAttempts) {
        Path path = directory.resolve(rules.sanitize(stem + suffix));
        if (!Files.exists(path)) {
            return path;
        }
        Path candidate = null;
        for (int i = 1; i <= maxAttempts; i++) {
            candidate = directory.resolve(rules.sanitize(stem + "_" + i + suffix));
            if (!Files.exists(candidate)) {
                LOG.debug("'{}' was not unique, so '{}' will be used", path, candidate);
                return candidate;
            }
        }
        throw new StorageException("Failed to create unique file path after " + maxAttempts
                + " attempts. Final attempt was '" + candidate + "'");
    }

    /**
     * Returns {@code {directory}/{stem}_{uuid}{suffix}}.
     *
     * <p>Collisions are not retried.
     *
     * @throws AlreadyExistsException if the generated path exists
     */
    public Path getTemporaryPath(Path directory, String stem, String suffix) {
        Objects.requireNonNull(directory, "directory");
        Path path = directory.resolve(rules.sanitize(stem + "_" + UUID.randomUUID() + suffix));
        if (Files.exists(path)) {
            throw new AlreadyExistsException(
                    "Failed to create temporary file as the following already exists", path);
        }
        return path;
    }

    /**
     * Filename without its final extension.
     */
    public static String stemOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static Path parentOf(Path source) {
        Path parent = source.toAbsolutePath().getParent();
        return parent != null ? parent : source.toAbsolutePath();
    }

    private static String modificationTimestamp(Path source) {
        try {
            LocalDateTime modified = LocalDateTime.ofInstant(
                    Files.getLastModifiedTime(source).toInstant(), ZoneId.systemDefault());
            return TIMESTAMP_FORMAT.format(modified);
        } catch (IOException e) {
            throw new NotFoundException("Cannot read modification time of source file", source.toString());
        }
    }
}
