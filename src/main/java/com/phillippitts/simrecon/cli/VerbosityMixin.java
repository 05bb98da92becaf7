package com.phillippitts.simrecon.cli;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine.Option;

/**
 * Shared {@code -v/--verbose} flag; raises every logger to DEBUG.
 */
public class VerbosityMixin {

    @Option(names = {"-v", "--verbose"}, description = "Show debug logging")
    void setVerbose(boolean verbose) {
        if (verbose) {
            Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.DEBUG);
        }
    }
}
