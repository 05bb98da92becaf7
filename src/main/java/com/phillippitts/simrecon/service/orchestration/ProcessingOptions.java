package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.OutputFileType;

import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Options for a reconstruction batch.
 *
 * <p>Defaults: outputs beside each source, unique output names, workspace cleanup on with
 * cleanup errors logged, channels stitched, partial processing off, DV output, sequential.
 */
public final class ProcessingOptions {

    private final Path outputDirectory;
    private final Path processingDirectory;
    private final boolean overwrite;
    private final boolean cleanup;
    private final boolean ignoreCleanupErrors;
    private final boolean stitchChannels;
    private final boolean allowPartial;
    private final OutputFileType outputFileType;
    private final boolean parallelProcess;
    private final Executor executor;

    private ProcessingOptions(Builder b) {
        this.outputDirectory = b.outputDirectory;
        this.processingDirectory = b.processingDirectory;
        this.overwrite = b.overwrite;
        this.cleanup = b.cleanup;
        this.ignoreCleanupErrors = b.ignoreCleanupErrors;
        this.stitchChannels = b.stitchChannels;
        this.allowPartial = b.allowPartial;
        this.outputFileType = b.outputFileType;
        this.parallelProcess = b.parallelProcess;
        this.executor = b.executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProcessingOptions defaults() {
        return builder().build();
    }

    /** Output directory, or {@code null} to write beside each source. */
    public Path outputDirectory() {
        return outputDirectory;
    }

    /** Parent for job workspaces, or {@code null} to use the output directory. */
    public Path processingDirectory() {
        return processingDirectory;
    }

    public boolean overwrite() {
        return overwrite;
    }

    public boolean cleanup() {
        return cleanup;
    }

    public boolean ignoreCleanupErrors() {
        return ignoreCleanupErrors;
    }

    public boolean stitchChannels() {
        return stitchChannels;
    }

    public boolean allowPartial() {
        return allowPartial;
    }

    public OutputFileType outputFileType() {
        return outputFileType;
    }

    public boolean parallelProcess() {
        return parallelProcess;
    }

    /** Caller-owned pool, or {@code null}. Never shut down by this library. */
    public Executor executor() {
        return executor;
    }

    public static final class Builder {
        private Path outputDirectory;
        private Path processingDirectory;
        private boolean overwrite;
        private boolean cleanup = true;
        private boolean ignoreCleanupErrors = true;
        private boolean stitchChannels = true;
        private boolean allowPartial;
        private OutputFileType outputFileType = OutputFileType.DV;
        private boolean parallelProcess;
        private Executor executor;

        private Builder() {
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder processingDirectory(Path processingDirectory) {
            this.processingDirectory = processingDirectory;
            return this;
        }

        public Builder overwrite(boolean overwrite) {
            this.overwrite = overwrite;
            return this;
        }

        public Builder cleanup(boolean cleanup) {
            this.cleanup = cleanup;
            return this;
        }

        public Builder ignoreCleanupErrors(boolean ignoreCleanupErrors) {
            this.ignoreCleanupErrors = ignoreCleanupErrors;
            return this;
        }

        public Builder stitchChannels(boolean stitchChannels) {
            this.stitchChannels = stitchChannels;
            return this;
        }

        public Builder allowPartial(boolean allowPartial) {
            this.allowPartial = allowPartial;
            return this;
        }

        public Builder outputFileType(OutputFileType outputFileType) {
            this.outputFileType = outputFileType == null ? OutputFileType.DV : outputFileType;
            return this;
        }

        public Builder parallelProcess(boolean parallelProcess) {
            this.parallelProcess = parallelProcess;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public ProcessingOptions build() {
            return new ProcessingOptions(this);
        }
    }
}
