package com.quakesieve.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Main entry point of the Quake Sieve command line.
 *
 * <h3>Commands</h3>
 *
 * <pre>
 *   decluster              Gardner-Knopoff formula windows
 *   decluster-table        Gardner-Knopoff lookup table
 *   decluster-fixed        fixed windows (alias: decluster-a1b)
 *   decluster-reasenberg   Reasenberg interaction clustering
 *   window                 scaled windows, nearest-in-time attribution
 *   run                    whatever a YAML configuration describes
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <p>
 * 0 on success, 1 when the configuration, the input or an output file is
 * unusable, 2 on a command-line usage error.
 * </p>
 *
 * @since 1.0.0
 */
@Command(name = "quake-sieve", mixinStandardHelpOptions = true, version = "quake-sieve 1.0.0",
        description = "Separate an earthquake catalog into mainshocks and aftershocks",
        subcommands = {
                DeclusterCommand.class,
                DeclusterTableCommand.class,
                DeclusterFixedCommand.class,
                DeclusterReasenbergCommand.class,
                WindowCommand.class,
                RunCommand.class
        })
public final class QuakeSieveJob implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(QuakeSieveJob.class);

    /** Exit code for configuration, input and output failures. */
    public static final int EXIT_FAILURE = 1;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command line without exiting the JVM.
     *
     * @return the process exit code
     */
    public static int execute(String... args) {
        return newCommandLine().execute(args);
    }

    /**
     * Build the configured command line. Enum options accept any case; an
     * exception escaping a command is logged and reported on stderr.
     */
    static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new QuakeSieveJob());
        cli.setCaseInsensitiveEnumValuesAllowed(true);
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            LOG.error("Command '{}' failed", commandLine.getCommandName(), ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            commandLine.getErr().flush();
            return EXIT_FAILURE;
        });
        return cli;
    }

    @Override
    public Integer call() {
        // no subcommand given
        spec.commandLine().getErr().println("Missing command.");
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }
}
