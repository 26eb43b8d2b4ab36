package com.repocheck;

import com.repocheck.cli.CheckCommand;
import com.repocheck.cli.ListCommand;
import com.repocheck.cli.ValidateCommand;
import com.repocheck.core.config.ConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

import java.io.PrintWriter;

/**
 * Main CLI entry point for RepoCheck.
 *
 * <p>RepoCheck verifies that every model class of a model library is covered by its
 * test file and documented by its documentation page. It is meant to run as a CI step
 * that treats a non-zero exit code as a blocking failure.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code check} - Run the tested and documented coverage passes</li>
 *   <li>{@code list} - List model modules, their classes and expected coverage files</li>
 *   <li>{@code validate} - Validate the configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Check the repository in the current directory
 * repocheck check
 *
 * # Only check documentation coverage
 * repocheck check --pass documented
 *
 * # Show which classes are audited
 * repocheck -v list /path/to/transformers
 * }</pre>
 */
@Command(
    name = "repocheck",
    mixinStandardHelpOptions = true,
    version = "RepoCheck 1.0.0-SNAPSHOT",
    description = "Checks that all models are properly tested and documented",
    subcommands = {
        CheckCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class RepoCheckCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RepoCheckCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println(spec.version()[0]
            + " - checks that every model class is listed in its test file and documentation page");
        out.println();
        out.println("Commands:");
        spec.subcommands().forEach((name, subcommand) -> {
            String[] description = subcommand.getCommandSpec().usageMessage().description();
            out.printf("  %-10s %s%n", name, description.length > 0 ? description[0] : "");
        });
        out.println();
        out.println("Configuration is read from " + ConfigLoader.DEFAULT_CONFIG_FILE
            + " in the project directory; run 'repocheck validate' to check it.");
        out.flush();
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Runs before any subcommand executes.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Creates the configured command line.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        RepoCheckCLI cli = new RepoCheckCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
