package com.siccatalog;

import com.siccatalog.cli.CodeCommand;
import com.siccatalog.cli.DivisionCommand;
import com.siccatalog.cli.LeafTextCommand;
import com.siccatalog.cli.LookupCommand;
import com.siccatalog.cli.RephraseCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for the SIC catalog.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code code} - Show a node of the hierarchy</li>
 *   <li>{@code lookup} - Look up a code from a description</li>
 *   <li>{@code division} - List the distinct divisions of codes</li>
 *   <li>{@code rephrase} - Show the reviewed description of a code</li>
 *   <li>{@code leaf-text} - Export the leaf text corpus as CSV</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * sic-catalog code 01.11
 * sic-catalog lookup "Gamekeeper"
 * sic-catalog lookup "farm" --similarity
 * sic-catalog division 01700 01120 31010
 * sic-catalog leaf-text -o leaf_text.csv
 * }</pre>
 */
@Command(
    name = "sic-catalog",
    mixinStandardHelpOptions = true,
    version = "SIC Catalog 1.0.0-SNAPSHOT",
    description = "Standard Industrial Classification hierarchy and lookups",
    subcommands = {
        CodeCommand.class,
        LookupCommand.class,
        DivisionCommand.class,
        RephraseCommand.class,
        LeafTextCommand.class
    }
)
public class SicCatalogCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SicCatalogCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("SIC Catalog - Standard Industrial Classification lookups");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sic-catalog --help' to see available commands");
        System.out.println("Use 'sic-catalog <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
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
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SicCatalogCLI cli = new SicCatalogCLI();
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
