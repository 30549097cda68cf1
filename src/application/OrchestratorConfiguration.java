package application;

/**
 * Configuration constants for the search orchestrator.
 *
 * <p>Centralizes the defaults that shape a run when the caller does not set them
 * explicitly, plus the unit conversions used for reporting.
 *
 * <h3>Tuning guidelines</h3>
 * <ul>
 *   <li><b>INITIAL_TERM_BOUND_SLACK</b>: the starting goal bound only needs to be loose;
 *       it is replaced the first time the goal is found.</li>
 *   <li><b>INITIAL_TERM_BOUND_CAP</b>: keeps the default bound meaningful for huge goals,
 *       where the frontier would otherwise never shed any entry.</li>
 * </ul>
 */
public final class OrchestratorConfiguration {

    // =========================================================================
    // Goal Bound Defaults
    // =========================================================================

    /**
     * Added to {@code ceil(|goal|)} to form the default initial term bound.
     */
    public static final int INITIAL_TERM_BOUND_SLACK = 10;

    /**
     * Upper limit for {@code ceil(|goal|)} when deriving the default initial term bound.
     */
    public static final int INITIAL_TERM_BOUND_CAP = 1_000_000;

    /**
     * Smallest accepted initial term bound. A bound of 1 would admit no combination at all.
     */
    public static final int MIN_INITIAL_TERM_BOUND = 2;

    // =========================================================================
    // Reporting Constants
    // =========================================================================

    /**
     * Bytes per megabyte for memory reporting.
     */
    public static final double BYTES_PER_MB = 1024.0 * 1024.0;

    /**
     * Milliseconds per second for time reporting.
     */
    public static final double MS_PER_SECOND = 1000.0;

    // =========================================================================
    // Private Constructor
    // =========================================================================

    /**
     * Private constructor to prevent instantiation.
     *
     * <p>This is a pure utility class with only static constants.
     */
    private OrchestratorConfiguration() {
        throw new AssertionError("Utility class: do not instantiate");
    }

    /**
     * Derives the default initial term bound for a goal.
     *
     * @param goal the goal value (finite)
     * @return {@code min(ceil(|goal|), INITIAL_TERM_BOUND_CAP) + INITIAL_TERM_BOUND_SLACK}
     */
    public static int defaultInitialTermBound(double goal) {
        double magnitude = Math.ceil(Math.abs(goal));
        int capped = (int) Math.min(magnitude, INITIAL_TERM_BOUND_CAP);
        return capped + INITIAL_TERM_BOUND_SLACK;
    }
}
