package infrastructure.util;

/**
 * Shared numerical constants for the search's fixed machine-sized numeric domains.
 *
 * <h3>Design rationale</h3>
 * Both numeric domains store values as {@code double}. Integer mode is exact only while
 * every stored value stays below {@link #MAX_EXACT_INTEGER}; the magnitude band enforces
 * this, so the upper bound of the band is capped at that value in integer mode.
 *
 * <p>All constants are {@code public static final}: accessible via static import
 * in hot-path classes without boxing overhead.
 */
public final class NumericalConstants {

    /**
     * Largest integer magnitude (2^53) below which every integer is exactly
     * representable as a {@code double}.
     */
    public static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992.0;

    /**
     * Default tolerance used in real-valued mode when deciding that a discovered value
     * equals the goal.
     */
    public static final double DEFAULT_GOAL_TOLERANCE = 1e-9;

    /**
     * Default lower bound of the magnitude band in real-valued mode.
     *
     * <p>Values closer to zero than this are pruned; without a lower bound repeated
     * division would keep producing ever smaller irrelevant fractions.
     */
    public static final double DEFAULT_REAL_MIN_MAGNITUDE = 1e-9;

    /** Default (exclusive) upper bound of the magnitude band. */
    public static final double DEFAULT_MAX_MAGNITUDE = 1_000_000.0;

    private NumericalConstants() {
        // Prevent instantiation: static constants only
    }
}
