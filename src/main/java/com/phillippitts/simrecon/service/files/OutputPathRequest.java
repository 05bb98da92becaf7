package com.phillippitts.simrecon.service.files;

import com.phillippitts.simrecon.domain.OutputType;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters for {@link PathAllocator#createOutputPath(OutputPathRequest)}.
 *
 * <p>Build with {@link #builder(Path, OutputType, String)}:
 * <pre>{@code
 * OutputPathRequest request = OutputPathRequest.builder(source, OutputType.RECON, ".dv")
 *         .outputDirectory(outDir)
 *         .wavelength(525)
 *         .ensureUnique(true)
 *         .build();
 * }</pre>
 */
public final class OutputPathRequest {

    public static final int DEFAULT_MAX_ATTEMPTS = 99;

    private final Path source;
    private final OutputType outputType;
    private final String suffix;
    private final Path outputDirectory;
    private final Integer wavelength;
    private final boolean addTimestamp;
    private final boolean ensureUnique;
    private final int maxAttempts;

    private OutputPathRequest(Builder b) {
        this.source = b.source;
        this.outputType = b.outputType;
        this.suffix = b.suffix;
        this.outputDirectory = b.outputDirectory;
        this.wavelength = b.wavelength;
        this.addTimestamp = b.addTimestamp;
        this.ensureUnique = b.ensureUnique;
        this.maxAttempts = b.maxAttempts;
    }

    public static Builder builder(Path source, OutputType outputType, String suffix) {
        return new Builder(source, outputType, suffix);
    }

    public Path source() {
        return source;
    }

    public OutputType outputType() {
        return outputType;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * @return explicit output directory, or {@code null} to write beside the source
     */
    public Path outputDirectory() {
        return outputDirectory;
    }

    public Integer wavelength() {
        return wavelength;
    }

    public boolean addTimestamp() {
        return addTimestamp;
    }

    public boolean ensureUnique() {
        return ensureUnique;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public static final class Builder {
        private final Path source;
        private final OutputType outputType;
        private final String suffix;
        private Path outputDirectory;
        private Integer wavelength;
        private boolean addTimestamp;
        private boolean ensureUnique;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

        private Builder(Path source, OutputType outputType, String suffix) {
            this.source = Objects.requireNonNull(source, "source");
            this.outputType = Objects.requireNonNull(outputType, "outputType");
            this.suffix = Objects.requireNonNull(suffix, "suffix");
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder wavelength(Integer wavelength) {
            this.wavelength = wavelength;
            return this;
        }

        public Builder addTimestamp(boolean addTimestamp) {
            this.addTimestamp = addTimestamp;
            return this;
        }

        public Builder ensureUnique(boolean ensureUnique) {
            this.ensureUnique = ensureUnique;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public OutputPathRequest build() {
            return new OutputPathRequest(this);
        }
    }
}
