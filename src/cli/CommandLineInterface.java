package cli;

import application.OrchestratorConfiguration;
import application.SearchConfiguration;
import application.SearchOrchestrator;
import domain.engine.SearchInvariantException;
import domain.model.SearchOutcome;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Command-line entry point for the minimal-term search.
 *
 * <h3>Usage</h3>
 * <pre>
 *   java cli.CommandLineInterface &lt;goal&gt; &lt;seed&gt; [&lt;seed&gt; ...] [options]
 * </pre>
 *
 * <h3>Optional flags</h3>
 * <p>See {@link ArgumentParser} for full list of optional flags.
 *
 * <h3>Output</h3>
 * <ul>
 *   <li>Results are printed to stdout via {@link ResultFormatter} (or to a file if --output is used)</li>
 *   <li>Search progress goes to the log</li>
 *   <li>Exit codes: {@value #EXIT_SUCCESS} success, {@value #EXIT_ARGUMENT_ERROR} argument or
 *       I/O error, {@value #EXIT_UNREACHABLE} goal unreachable, {@value #EXIT_INTERNAL_ERROR}
 *       internal invariant breach</li>
 * </ul>
 *
 * @see ArgumentParser
 * @see SearchOrchestrator
 * @see ResultFormatter
 */
public final class CommandLineInterface {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_ARGUMENT_ERROR = 1;
    static final int EXIT_UNREACHABLE = 2;
    static final int EXIT_INTERNAL_ERROR = 3;

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the CLI and maps the result to an exit code.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    static int run(String[] args) {
        try {
            return execute(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Argument Error: " + e.getMessage());
            return EXIT_ARGUMENT_ERROR;
        } catch (IOException e) {
            System.err.println("I/O Error: " + e.getMessage());
            e.printStackTrace();
            return EXIT_ARGUMENT_ERROR;
        } catch (SearchInvariantException e) {
            System.err.println("Internal error (search invariant violated): " + e.getMessage());
            e.printStackTrace();
            return EXIT_INTERNAL_ERROR;
        }
    }

    /**
     * Executes the search workflow.
     *
     * @param args command-line arguments
     * @return process exit code
     * @throws IOException if the output file cannot be written
     * @throws IllegalArgumentException if arguments are invalid
     */
    private static int execute(String[] args) throws IOException {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(args);

        if (parser.isHelpRequested()) {
            parser.printHelp();
            return EXIT_SUCCESS;
        }

        SearchConfiguration config = parser.buildConfiguration();

        if (config.isDebugMode()) {
            System.err.println("[CLI] Starting minimal-term search...");
            System.err.printf("[CLI] Parameters: goal=%s, seeds=%d, domain=%s, frontier=%s%n",
                config.getNumericDomain().format(config.getGoal()),
                config.getSeeds().size(),
                config.getNumericDomain(),
                config.getFrontierStrategy());
        }

        SearchOutcome outcome = new SearchOrchestrator(config).search();
        displayResults(parser, config, outcome);

        return outcome.isSuccess() ? EXIT_SUCCESS : EXIT_UNREACHABLE;
    }

    /**
     * Measures memory usage after the search completes.
     *
     * @return memory used in megabytes
     */
    private static double measureMemoryUsage() {
        Runtime runtime = Runtime.getRuntime();
        long memoryBytes = runtime.totalMemory() - runtime.freeMemory();
        return memoryBytes / OrchestratorConfiguration.BYTES_PER_MB;
    }

    /**
     * Displays the outcome on stdout or in a file.
     *
     * @param parser  argument parser with output settings
     * @param config  search configuration
     * @param outcome search outcome
     * @throws IOException if output file cannot be written
     */
    private static void displayResults(ArgumentParser parser, SearchConfiguration config,
                                       SearchOutcome outcome) throws IOException {
        ResultFormatter formatter = new ResultFormatter(config.getNumericDomain());
        double memoryUsedMB = measureMemoryUsage();

        if (parser.getOutputFile() != null) {
            try (PrintStream fileOut = new PrintStream(new FileOutputStream(parser.getOutputFile()))) {
                formatter.printResults(fileOut, outcome, parser.isPostfixRequested(), memoryUsedMB);
            }
            System.err.println("[CLI] Results written to: " + parser.getOutputFile());
        } else {
            formatter.printResults(System.out, outcome, parser.isPostfixRequested(), memoryUsedMB);
        }
    }
}
