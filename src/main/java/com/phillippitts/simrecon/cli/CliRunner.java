package com.phillippitts.simrecon.cli;

import com.phillippitts.simrecon.service.config.ParameterSchemas;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SimReconCommand simReconCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SimReconCommand simReconCommand, IFactory factory) {
        this.simReconCommand = simReconCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = createCommandLine(simReconCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Builds the command tree and adds one option per engine parameter to each subcommand.
     */
    static CommandLine createCommandLine(SimReconCommand root, IFactory factory) {
        CommandLine commandLine = new CommandLine(root, factory);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setUnmatchedOptionsAllowedAsOptionParameters(false);
        SchemaOptions.register(commandLine.getSubcommands().get(OtfCommand.NAME).getCommandSpec(),
                ParameterSchemas.OTF);
        SchemaOptions.register(commandLine.getSubcommands().get(ReconCommand.NAME).getCommandSpec(),
                ParameterSchemas.RECONSTRUCTION);
        return commandLine;
    }
}
