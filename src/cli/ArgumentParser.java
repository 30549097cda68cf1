package cli;

import application.SearchConfiguration;
import domain.model.NumericDomain;
import domain.model.Operator;
import infrastructure.util.ValidationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parses and validates all command-line arguments for the minimal-term search.
 *
 * <h3>Syntax</h3>
 * <pre>
 *   &lt;goal&gt; &lt;seed&gt; [&lt;seed&gt; ...]
 *       [--help | -h]
 *       [--debug]
 *       [--output &lt;file&gt; | -o &lt;file&gt;]
 *       [--domain INTEGER|REAL]
 *       [--min &lt;magnitude&gt;] [--max &lt;magnitude&gt;]
 *       [--tolerance &lt;epsilon&gt;]
 *       [--operators &lt;chars&gt;]
 *       [--frontier INDEXED_HEAP|LEVEL_BUCKET]
 *       [--term-bound &lt;n&gt;]
 *       [--postfix]
 * </pre>
 *
 * <h3>Required positional arguments</h3>
 * <ol>
 *   <li>{@code goal}: the value the expression must evaluate to</li>
 *   <li>{@code seed...}: one or more leaf values; negative numbers are seeds, not flags</li>
 * </ol>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   java cli.CommandLineInterface 2018 42 777 --max 1000000 --debug
 * </pre>
 *
 * @see SearchConfiguration
 */
public final class ArgumentParser {

    // =========================================================================
    // Error Messages
    // =========================================================================

    private static final String USAGE_MESSAGE =
        "Usage: <goal> <seed> [<seed> ...] [OPTIONS]\n" +
        "Options:\n" +
        "  --help, -h              Show this help message and exit\n" +
        "  --debug                 Enable debug output with phase-level timing\n" +
        "  --output, -o <file>     Write results to file instead of stdout\n" +
        "  --domain <domain>       Numeric domain: INTEGER, REAL (default: INTEGER)\n" +
        "  --min <magnitude>       Prune values with |v| below this (default: 0, REAL: 1e-9)\n" +
        "  --max <magnitude>       Prune values with |v| at or above this (default: 1000000)\n" +
        "  --tolerance <epsilon>   REAL goal matching tolerance (default: 1e-9)\n" +
        "  --operators <chars>     Allowed operators out of +-*/ (default: +-*/)\n" +
        "  --frontier <strategy>   Frontier: INDEXED_HEAP, LEVEL_BUCKET (default: INDEXED_HEAP)\n" +
        "  --term-bound <n>        Initial upper bound on the term count (default: |goal| + 10)\n" +
        "  --postfix               Also print the expression in postfix (RPN) form";

    private static final String MISSING_ARGS_ERROR =
        "Missing required arguments. " + USAGE_MESSAGE;

    private static final String INVALID_NUMBER_FORMAT =
        "Invalid %s: %s is not a number";

    private static final String INVALID_INTEGER_FORMAT =
        "Invalid %s: %s is not an integer";

    private static final String MISSING_VALUE_FORMAT =
        "%s requires a value";

    private static final String UNKNOWN_DOMAIN_FORMAT =
        "Unknown domain: %s. Valid domains: INTEGER, REAL";

    private static final String UNKNOWN_FRONTIER_FORMAT =
        "Unknown frontier strategy: %s. Valid strategies: INDEXED_HEAP, LEVEL_BUCKET";

    private static final String UNKNOWN_OPERATOR_FORMAT =
        "Unknown operator '%s'. Valid operators: + - * /";

    private static final String UNKNOWN_ARG_FORMAT =
        "Unknown argument: %s. Use --help for usage information.";

    // =========================================================================
    // Parsed Fields
    // =========================================================================

    private double goal;
    private final List<Double> seeds = new ArrayList<>();
    private boolean helpRequested = false;
    private boolean debugMode = false;
    private boolean postfixRequested = false;
    private String outputFile = null;
    private NumericDomain numericDomain = NumericDomain.INTEGER;
    private Double minMagnitude = null;
    private Double maxMagnitude = null;
    private Double tolerance = null;
    private Set<Operator> operators = null;
    private SearchConfiguration.FrontierStrategy frontierStrategy = null;
    private Integer termBound = null;

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Parses command-line arguments.
     *
     * @param args command-line arguments from {@code main()}
     * @throws IllegalArgumentException if arguments are invalid or missing
     */
    public void parse(String[] args) {
        // Check for help flag first (allow --help even without required args)
        if (args.length > 0 && (args[0].equals("--help") || args[0].equals("-h"))) {
            helpRequested = true;
            return;
        }

        if (args.length < 2 || isFlag(args[0]) || isFlag(args[1])) {
            throw new IllegalArgumentException(MISSING_ARGS_ERROR);
        }

        int firstFlag = parsePositionalArguments(args);
        parseOptionalFlags(args, firstFlag);
    }

    /**
     * Builds a {@link SearchConfiguration} from parsed arguments.
     *
     * <p>Must be called after {@link #parse(String[])}.
     *
     * @return immutable search configuration
     * @throws IllegalArgumentException if the combination of values is invalid
     */
    public SearchConfiguration buildConfiguration() {
        SearchConfiguration.Builder builder = new SearchConfiguration.Builder()
            .setGoal(goal)
            .setSeeds(seeds)
            .setNumericDomain(numericDomain)
            .setDebugMode(debugMode);

        if (minMagnitude != null) builder.setMinMagnitude(minMagnitude);
        if (maxMagnitude != null) builder.setMaxMagnitude(maxMagnitude);
        if (tolerance != null) builder.setGoalTolerance(tolerance);
        if (operators != null) builder.setOperators(operators);
        if (frontierStrategy != null) builder.setFrontierStrategy(frontierStrategy);
        if (termBound != null) builder.setInitialTermBound(termBound);

        return builder.build();
    }

    // =========================================================================
    // Getters
    // =========================================================================

    public double getGoal() { return goal; }
    public List<Double> getSeeds() { return Collections.unmodifiableList(seeds); }
    public boolean isHelpRequested() { return helpRequested; }
    public boolean isDebugMode() { return debugMode; }
    public boolean isPostfixRequested() { return postfixRequested; }
    public String getOutputFile() { return outputFile; }
    public NumericDomain getNumericDomain() { return numericDomain; }
    public Set<Operator> getOperators() { return operators; }
    public SearchConfiguration.FrontierStrategy getFrontierStrategy() { return frontierStrategy; }

    /**
     * Prints help message to stderr.
     */
    public void printHelp() {
        System.err.println("MinTerm: minimal-term arithmetic expression search");
        System.err.println();
        System.err.println(USAGE_MESSAGE);
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java cli.CommandLineInterface 2018 42 777 --max 1000000");
    }

    // =========================================================================
    // Private Parsing Methods
    // =========================================================================

    /**
     * Parses the goal and every seed up to the first flag.
     *
     * @param args command-line arguments
     * @return index of the first flag (or {@code args.length})
     * @throws IllegalArgumentException if a value is not a number
     */
    private int parsePositionalArguments(String[] args) {
        goal = parseNumber(args[0], "goal");
        int i = 1;
        while (i < args.length && !isFlag(args[i])) {
            double seed = parseNumber(args[i], "seed");
            ValidationUtils.validateFinite(seed, "seed");
            seeds.add(seed);
            i++;
        }
        return i;
    }

    /**
     * Parses optional flags starting at {@code start}.
     *
     * <p>Simple flags set a boolean and let the loop advance; parametrized flags call a
     * helper that consumes the value and returns the updated index.
     *
     * @param args  command-line arguments
     * @param start index of the first flag
     * @throws IllegalArgumentException if flags are invalid
     */
    private void parseOptionalFlags(String[] args, int start) {
        for (int i = start; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "--help":
                case "-h":
                    helpRequested = true;
                    break;

                case "--debug":
                    debugMode = true;
                    break;

                case "--postfix":
                    postfixRequested = true;
                    break;

                case "--output":
                case "-o":
                    outputFile = requireValue(args, i, arg);
                    i++;
                    break;

                case "--domain":
                    numericDomain = parseDomain(requireValue(args, i, arg));
                    i++;
                    break;

                case "--min":
                    minMagnitude = parseNumber(requireValue(args, i, arg), "minimum magnitude");
                    i++;
                    break;

                case "--max":
                    maxMagnitude = parseNumber(requireValue(args, i, arg), "maximum magnitude");
                    i++;
                    break;

                case "--tolerance":
                    tolerance = parseNumber(requireValue(args, i, arg), "tolerance");
                    i++;
                    break;

                case "--operators":
                    operators = parseOperators(requireValue(args, i, arg));
                    i++;
                    break;

                case "--frontier":
                    frontierStrategy = parseFrontier(requireValue(args, i, arg));
                    i++;
                    break;

                case "--term-bound":
                    termBound = parseInteger(requireValue(args, i, arg), "term bound");
                    i++;
                    break;

                default:
                    throw new IllegalArgumentException(String.format(UNKNOWN_ARG_FORMAT, arg));
            }
        }
    }

    /**
     * Returns whether an argument is an option rather than a (possibly negative) number.
     */
    private static boolean isFlag(String arg) {
        return arg.startsWith("--") || arg.equals("-h") || arg.equals("-o");
    }

    private static String requireValue(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(String.format(MISSING_VALUE_FORMAT, flag));
        }
        return args[i + 1];
    }

    private static double parseNumber(String arg, String what) {
        try {
            return Double.parseDouble(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_NUMBER_FORMAT, what, arg));
        }
    }

    private static int parseInteger(String arg, String what) {
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(INVALID_INTEGER_FORMAT, what, arg));
        }
    }

    private static NumericDomain parseDomain(String arg) {
        try {
            return NumericDomain.valueOf(arg.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(UNKNOWN_DOMAIN_FORMAT, arg));
        }
    }

    private static SearchConfiguration.FrontierStrategy parseFrontier(String arg) {
        try {
            return SearchConfiguration.FrontierStrategy.valueOf(arg.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(UNKNOWN_FRONTIER_FORMAT, arg));
        }
    }

    private static Set<Operator> parseOperators(String arg) {
        Set<Operator> parsed = EnumSet.noneOf(Operator.class);
        for (char c : arg.toCharArray()) {
            switch (c) {
                case '+':
                    parsed.add(Operator.ADD);
                    break;
                case '-':
                    parsed.add(Operator.SUB);
                    break;
                case '*':
                    parsed.add(Operator.MUL);
                    break;
                case '/':
                    parsed.add(Operator.DIV);
                    break;
                default:
                    throw new IllegalArgumentException(String.format(UNKNOWN_OPERATOR_FORMAT, c));
            }
        }
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException(String.format(MISSING_VALUE_FORMAT, "--operators"));
        }
        return parsed;
    }
}
