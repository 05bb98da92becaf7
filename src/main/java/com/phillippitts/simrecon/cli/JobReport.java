package com.phillippitts.simrecon.cli;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.JobResult;

import java.io.PrintWriter;
import java.nio.file.Path;

/**
 * Prints a per-job summary and maps the batch outcome to an exit code.
 */
final class JobReport {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;

    private JobReport() {
    }

    static int print(BatchResult batch, PrintWriter out) {
        for (JobResult result : batch.results()) {
            out.printf("%-20s %s (%d ms)%n", result.outcome(), result.source(), result.duration().toMillis());
            for (Path output : result.outputs()) {
                out.println("    -> " + output);
            }
            if (!result.skippedWavelengths().isEmpty()) {
                out.println("    skipped wavelengths: " + result.skippedWavelengths());
            }
            if (result.failure() != null) {
                out.println("    error: " + result.failure().getMessage());
            }
        }
        out.flush();
        return batch.hasFailures() ? EXIT_FAILED : EXIT_OK;
    }
}
