package com.examboard.pseudocode;

import java.io.InputStream;

import com.examboard.pseudocode.cli.ConvertCommand;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main entry point of the pseudocode converter CLI.
 */
@Command(
        name = "pseudocode",
        mixinStandardHelpOptions = true,
        version = "pseudocode-converter 1.0.0",
        description = "Converts Java and TypeScript source code into exam-board pseudocode."
)
public class PseudocodeApplication implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine(System.in).execute(args);
        System.exit(exitCode);
    }

    /**
     * The root command with its "convert" subcommand reading standard input from the given stream.
     */
    public static CommandLine commandLine(InputStream stdin) {
        return new CommandLine(new PseudocodeApplication())
                .addSubcommand(new ConvertCommand(stdin))
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
