package com.raditha.watsim.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the WAT similarity tool.
 * <p>
 * Usage:
 * java -jar watsim.jar &lt;command&gt; [options]
 * <p>
 * Configuration priority: CLI arguments &gt; watsim.yml &gt; defaults
 */
@Command(name = "watsim", mixinStandardHelpOptions = true, version = "watsim v1.0.0",
        description = "Instruction-level similarity and trimming analysis for WAT modules",
        subcommands = {
                MatrixCommand.class,
                NGramsCommand.class,
                TrimCommand.class,
                AverageCommand.class,
                CompareCommand.class
        })
@SuppressWarnings("java:S106")
public class WatSimCLI implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the CLI and return its exit code instead of exiting.
     */
    public static int execute(String... args) {
        return createCommandLine().execute(args);
    }

    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new WatSimCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine failed = ex.getCommandLine();
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd;
    }
}
