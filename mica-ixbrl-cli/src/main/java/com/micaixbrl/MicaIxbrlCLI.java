package com.micaixbrl;

import ch.qos.logback.classic.Level;
import com.micaixbrl.cli.GenerateCommand;
import com.micaixbrl.cli.InitCommand;
import com.micaixbrl.cli.ListCommand;
import com.micaixbrl.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for MiCA iXBRL.
 *
 * <p>Generates inline XBRL documents from crypto-asset white paper records and validates
 * records against the MiCA filing rules.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate the inline XBRL document (or the fact list) of a record</li>
 *   <li>{@code validate} - Validate a record</li>
 *   <li>{@code list} - List taxonomy fields, sections, enumerations, generators or rules</li>
 *   <li>{@code init} - Write a default configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * mica-ixbrl validate whitepaper.json --check-registry
 * mica-ixbrl generate whitepaper.json -o out/
 * mica-ixbrl list fields --section E
 * }</pre>
 */
@Command(
    name = "mica-ixbrl",
    mixinStandardHelpOptions = true,
    version = "MiCA iXBRL 1.0.0-SNAPSHOT",
    description = "Inline XBRL generation and validation for MiCA crypto-asset white papers",
    subcommands = {
        InitCommand.class,
        GenerateCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class MicaIxbrlCLI implements Runnable {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("MiCA iXBRL - Inline XBRL for MiCA crypto-asset white papers");
        spec.commandLine().getOut().println("Use 'mica-ixbrl --help' to see available commands");
    }

    /**
     * Sets the root log level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line, applying the global logging options before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        MicaIxbrlCLI cli = new MicaIxbrlCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
