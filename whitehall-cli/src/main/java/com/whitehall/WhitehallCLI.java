package com.whitehall;

import com.whitehall.cli.CheckCommand;
import com.whitehall.cli.CompileCommand;
import com.whitehall.cli.ListCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for Whitehall.
 *
 * <p>Whitehall compiles {@code .wh} component files into Kotlin Jetpack Compose sources.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code compile} - Compile files and write Kotlin sources</li>
 *   <li>{@code check} - Report diagnostics without writing output</li>
 *   <li>{@code list} - List built-in and configured components</li>
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
 * # Compile a source directory
 * whitehall compile src/ -o build/generated
 *
 * # Check a single file, diagnostics as JSON
 * whitehall check counter.wh --json
 *
 * # List known components
 * whitehall list components
 * }</pre>
 */
@Command(
    name = "whitehall",
    mixinStandardHelpOptions = true,
    version = "Whitehall 1.0.0-SNAPSHOT",
    description = "Compiles Whitehall markup into Kotlin Jetpack Compose",
    subcommands = {
        CompileCommand.class,
        CheckCommand.class,
        ListCommand.class
    }
)
public class WhitehallCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Whitehall - Markup to Jetpack Compose compiler");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'whitehall --help' to see available commands");
        System.out.println("Use 'whitehall <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options.
     *
     * <p>Runs before any subcommand through the execution strategy installed in {@link #commandLine()}.
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
     * Builds the command line with logging configured before the chosen subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        WhitehallCLI cli = new WhitehallCLI();
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
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
