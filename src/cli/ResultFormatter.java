package cli;

import application.OrchestratorConfiguration;
import domain.model.NumericDomain;
import domain.model.SearchOutcome;
import domain.model.SearchStatistics;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Formats and prints a search outcome.
 *
 * <p>A success is printed as {@code goal = expression} with the proven term count, a
 * failure with its reason. A run summary (time, expansions, settled and open values,
 * memory) follows.
 *
 * <p>All floating-point values use {@link Locale#ROOT} so output is identical regardless
 * of the system locale.
 */
public final class ResultFormatter {

    private static final String RULE = "=================================================";

    private final NumericDomain domain;

    /**
     * Constructs a formatter.
     *
     * @param domain numeric domain used to print the goal literal
     */
    public ResultFormatter(NumericDomain domain) {
        this.domain = domain;
    }

    /**
     * Prints the outcome and run statistics.
     *
     * @param out          destination stream
     * @param outcome      the search outcome
     * @param printPostfix whether to add the postfix (RPN) form
     * @param memoryUsedMB heap memory in use at result-ready time, in megabytes
     */
    public void printResults(PrintStream out, SearchOutcome outcome, boolean printPostfix, double memoryUsedMB) {
        String goal = domain.format(outcome.getGoal());

        out.println(RULE);
        out.printf("MINIMAL EXPRESSION FOR %s%n", goal);
        out.println(RULE);

        if (outcome.isSuccess()) {
            out.printf("%s = %s%n", goal, outcome.getExpression());
            if (printPostfix) {
                out.printf("Postfix: %s%n", String.join(" ", outcome.getPostfix()));
            }
            out.printf("Terms needed: %d%n", outcome.getTermCount());
        } else {
            out.printf("Goal %s is %s under the current configuration.%n", goal, outcome.getReason());
        }

        SearchStatistics stats = outcome.getStatistics();
        out.println(RULE);
        out.printf(Locale.ROOT, "Execution time: %.3f seconds%n", stats.getElapsedMs() / OrchestratorConfiguration.MS_PER_SECOND);
        out.printf("Expansions: %d%n", stats.getExpansions());
        out.printf("Settled values: %d%n", stats.getSettledCount());
        out.printf("Open values: %d (%d dead evicted)%n", stats.getOpenCount(), stats.getDeadCount());
        out.printf(Locale.ROOT, "Memory used: %.2f MB%n", memoryUsedMB);
        out.println(RULE);
    }
}
