package com.phillippitts.simrecon.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: otf, recon.
 */
@Command(
        name = "simrecon",
        mixinStandardHelpOptions = true,
        version = "simrecon 0.1.0",
        description = "Converts PSFs to OTFs and reconstructs SIM datasets with a native engine",
        subcommands = {
                OtfCommand.class,
                ReconCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SimReconCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // No subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
